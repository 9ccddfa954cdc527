package com.payproc.domain.model;

/**
 * Globally unique transaction identifier (unsigned 32-bit).
 * Unique across the whole input stream, not per client.
 */
public record TransactionId(long value) {

    public static final long MAX_VALUE = 0xFFFF_FFFFL;

    public TransactionId {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("transaction id out of range: " + value);
        }
    }

    public static TransactionId of(long value) {
        return new TransactionId(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
