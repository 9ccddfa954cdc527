package com.payproc.adapter.out.logging;

import com.payproc.application.port.out.ParseFailure;
import com.payproc.application.port.out.ProcessingListener;
import com.payproc.domain.exception.AccountActivityException;
import com.payproc.domain.model.AccountActivity;
import lombok.extern.slf4j.Slf4j;

/**
 * Reports skipped records through SLF4J
 */
@Slf4j
public class LoggingProcessingListener implements ProcessingListener {

    @Override
    public void onParseFailure(ParseFailure failure) {
        log.error("Error parsing account activity at {}", failure.describe());
    }

    @Override
    public void onActivityRejected(AccountActivity activity, AccountActivityException error) {
        log.warn("Error processing {} (transaction_id={}, client_id={}): {}",
                activity.getType().getValue(), activity.transactionId(), activity.clientId(), error.getMessage());
    }
}
