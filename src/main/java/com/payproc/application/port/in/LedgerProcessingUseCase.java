package com.payproc.application.port.in;

import com.payproc.application.port.out.ActivitySource;
import com.payproc.application.port.out.ProcessingListener;
import com.payproc.domain.model.AccountSnapshot;
import io.vertx.core.Future;

import java.util.List;

/**
 * Input port for folding an activity stream into final account balances
 */
public interface LedgerProcessingUseCase {

    /**
     * Process every record of the source, in order per client
     * @param source   activities, possibly interleaved with parse failures
     * @param listener receives every skipped record
     * @return Future with one snapshot per client ever observed, in no particular order
     */
    Future<List<AccountSnapshot>> process(ActivitySource source, ProcessingListener listener);
}
