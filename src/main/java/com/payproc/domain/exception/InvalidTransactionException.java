package com.payproc.domain.exception;

/**
 * The payload of a transaction is out of domain, e.g. a negative amount
 */
public class InvalidTransactionException extends AccountActivityException {

    public InvalidTransactionException(String reason) {
        super("invalid transaction", reason);
    }
}
