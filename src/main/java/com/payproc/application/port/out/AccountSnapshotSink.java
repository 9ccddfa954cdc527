package com.payproc.application.port.out;

import com.payproc.domain.model.AccountSnapshot;

import java.io.IOException;
import java.util.List;

/**
 * Output port receiving the final account snapshots for serialization
 */
public interface AccountSnapshotSink {

    /**
     * Serialize every snapshot as {@code client, available, held, total, locked}
     */
    void write(List<AccountSnapshot> snapshots) throws IOException;
}
