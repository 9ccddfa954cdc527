package com.payproc.domain.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Final state of an account, read once after processing
 */
@Value
public class AccountSnapshot {
    ClientId clientId;
    BigDecimal available;
    BigDecimal held;
    BigDecimal total;
    boolean locked;
}
