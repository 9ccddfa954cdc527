package com.payproc.domain.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * A single activity on a client account.
 * <p>
 * Exactly one payload is present: a {@link Transaction} for deposits and withdrawals,
 * a {@link DisputeCase} for disputes, resolutions and chargebacks. Instances are created
 * through the static factories only.
 */
@Value
public class AccountActivity {

    ActivityType type;

    @Getter(AccessLevel.NONE)
    Transaction transaction;

    @Getter(AccessLevel.NONE)
    DisputeCase disputeCase;

    private AccountActivity(ActivityType type, Transaction transaction, DisputeCase disputeCase) {
        this.type = Objects.requireNonNull(type, "type");
        this.transaction = transaction;
        this.disputeCase = disputeCase;
    }

    public static AccountActivity deposit(TransactionId id, ClientId clientId, BigDecimal amount) {
        return new AccountActivity(ActivityType.DEPOSIT, new Transaction(id, clientId, amount), null);
    }

    public static AccountActivity withdrawal(TransactionId id, ClientId clientId, BigDecimal amount) {
        return new AccountActivity(ActivityType.WITHDRAWAL, new Transaction(id, clientId, amount), null);
    }

    public static AccountActivity dispute(TransactionId id, ClientId clientId) {
        return new AccountActivity(ActivityType.DISPUTE, null, new DisputeCase(id, clientId));
    }

    public static AccountActivity resolve(TransactionId id, ClientId clientId) {
        return new AccountActivity(ActivityType.RESOLVE, null, new DisputeCase(id, clientId));
    }

    public static AccountActivity chargeback(TransactionId id, ClientId clientId) {
        return new AccountActivity(ActivityType.CHARGEBACK, null, new DisputeCase(id, clientId));
    }

    /**
     * @throws IllegalStateException if this is a dispute activity
     */
    public Transaction transaction() {
        if (transaction == null) {
            throw new IllegalStateException(type.getValue() + " carries no transaction");
        }
        return transaction;
    }

    /**
     * @throws IllegalStateException if this is a deposit or withdrawal
     */
    public DisputeCase disputeCase() {
        if (disputeCase == null) {
            throw new IllegalStateException(type.getValue() + " carries no dispute case");
        }
        return disputeCase;
    }

    public TransactionId transactionId() {
        return transaction != null ? transaction.getId() : disputeCase.getTransactionId();
    }

    public ClientId clientId() {
        return transaction != null ? transaction.getClientId() : disputeCase.getClientId();
    }
}
