package com.payproc.domain.model;

import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Transaction - movement of funds into or out of a client account
 * Value object - deposit and withdrawal payload
 */
@Value
public class Transaction {
    @NonNull TransactionId id;
    @NonNull ClientId clientId;
    @NonNull BigDecimal amount;
}
