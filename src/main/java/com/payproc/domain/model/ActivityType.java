package com.payproc.domain.model;

/**
 * Kind of account activity
 */
public enum ActivityType {
    DEPOSIT("deposit"),
    WITHDRAWAL("withdrawal"),
    DISPUTE("dispute"),
    RESOLVE("resolve"),
    CHARGEBACK("chargeback");

    private final String value;

    ActivityType(String value) {
        this.value = value;
    }

    public String getValue() {
        return value;
    }

    /**
     * Deposits and withdrawals carry an amount, dispute activities do not
     */
    public boolean carriesAmount() {
        return this == DEPOSIT || this == WITHDRAWAL;
    }

    public static ActivityType fromValue(String value) {
        for (ActivityType type : values()) {
            if (type.value.equals(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown activity type: " + value);
    }

    public static boolean isValid(String value) {
        for (ActivityType type : values()) {
            if (type.value.equals(value)) {
                return true;
            }
        }
        return false;
    }
}
