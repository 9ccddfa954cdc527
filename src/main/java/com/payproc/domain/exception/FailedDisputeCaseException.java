package com.payproc.domain.exception;

/**
 * A dispute case violated the dispute protocol, e.g. disputing an already disputed transaction
 */
public class FailedDisputeCaseException extends AccountActivityException {

    public FailedDisputeCaseException(String reason) {
        super("failed dispute case", reason);
    }
}
