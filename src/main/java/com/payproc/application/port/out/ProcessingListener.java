package com.payproc.application.port.out;

import com.payproc.domain.exception.AccountActivityException;
import com.payproc.domain.model.AccountActivity;

/**
 * Observability port for records skipped during processing.
 * Implementations must be thread-safe: partitions report concurrently.
 */
public interface ProcessingListener {

    /**
     * A record could not be parsed and was skipped
     */
    void onParseFailure(ParseFailure failure);

    /**
     * An account rejected the activity; the account is unchanged
     */
    void onActivityRejected(AccountActivity activity, AccountActivityException error);

    static ProcessingListener composite(ProcessingListener... listeners) {
        return new ProcessingListener() {
            @Override
            public void onParseFailure(ParseFailure failure) {
                for (ProcessingListener listener : listeners) {
                    listener.onParseFailure(failure);
                }
            }

            @Override
            public void onActivityRejected(AccountActivity activity, AccountActivityException error) {
                for (ProcessingListener listener : listeners) {
                    listener.onActivityRejected(activity, error);
                }
            }
        };
    }
}
