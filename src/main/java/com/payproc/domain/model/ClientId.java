package com.payproc.domain.model;

/**
 * Globally unique client identifier (unsigned 16-bit)
 */
public record ClientId(int value) {

    public static final int MAX_VALUE = 0xFFFF;

    public ClientId {
        if (value < 0 || value > MAX_VALUE) {
            throw new IllegalArgumentException("client id out of range: " + value);
        }
    }

    public static ClientId of(int value) {
        return new ClientId(value);
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
