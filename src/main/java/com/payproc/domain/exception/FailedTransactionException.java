package com.payproc.domain.exception;

/**
 * A well-formed transaction could not be executed.
 * Covers insufficient funds, duplicate transaction ids and locked accounts.
 */
public class FailedTransactionException extends AccountActivityException {

    public FailedTransactionException(String reason) {
        super("failed transaction", reason);
    }
}
