package com.payproc.domain.exception;

/**
 * Raised when an account rejects an activity.
 * The account is left exactly as it was before the attempt.
 */
public abstract class AccountActivityException extends Exception {

    protected AccountActivityException(String kind, String reason) {
        super(kind + ": " + reason);
    }
}
