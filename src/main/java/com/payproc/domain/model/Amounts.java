package com.payproc.domain.model;

import java.math.BigDecimal;

/**
 * Amount helpers shared by the ledger
 */
public final class Amounts {

    /** Initial balance, printed as {@code 0.0} */
    public static final BigDecimal ZERO = new BigDecimal("0.0");

    /** Most digits an amount may carry after the decimal point */
    public static final int MAX_SCALE = 28;

    /** Most digits an amount may carry before the decimal point */
    public static final int MAX_INTEGER_DIGITS = 28;

    private Amounts() {
    }

    /**
     * An amount is valid when it is representable and zero or strictly positive
     */
    public static boolean isValid(BigDecimal amount) {
        return isRepresentable(amount) && amount.signum() >= 0;
    }

    /**
     * Whether the amount fits the ledger's decimal domain: at most {@value #MAX_SCALE} fractional
     * digits and at most {@value #MAX_INTEGER_DIGITS} integer digits. Exponent notation is
     * accepted inside those bounds ({@code 1e5}), extreme exponents are not.
     */
    public static boolean isRepresentable(BigDecimal amount) {
        if (amount == null || amount.scale() > MAX_SCALE) {
            return false;
        }
        // long arithmetic: scale may be close to Integer.MIN_VALUE
        long integerDigits = (long) amount.precision() - amount.scale();
        return integerDigits <= MAX_INTEGER_DIGITS;
    }
}
