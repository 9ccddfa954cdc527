package com.payproc.domain.model;

import lombok.NonNull;
import lombok.Value;

/**
 * Dispute case - reference to a prior transaction raised by a client.
 * Carries no amount; the amount is looked up from the referenced transaction.
 */
@Value
public class DisputeCase {
    @NonNull TransactionId transactionId;
    @NonNull ClientId clientId;
}
