package com.payproc.domain.model;

import com.payproc.domain.exception.AccountActivityException;
import com.payproc.domain.exception.FailedDisputeCaseException;
import com.payproc.domain.exception.FailedTransactionException;
import com.payproc.domain.exception.InvalidTransactionException;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Balances and dispute bookkeeping of a single client.
 * <p>
 * The only way of changing an account is {@link #apply(AccountActivity)}.
 *
 * <ul>
 *   <li>available - funds the client may withdraw</li>
 *   <li>held - funds frozen by open disputes</li>
 *   <li>total - available + held</li>
 * </ul>
 *
 * Every deposit and withdrawal that succeeds is recorded under its transaction id, so a
 * transaction id is executed at most once. Disputes, resolutions and chargebacks referencing
 * an unknown transaction are accepted as no-ops; they may refer to transactions outside the
 * observed input. Resolutions and chargebacks only act on transactions currently under dispute.
 * A chargeback locks the account, after which every activity is rejected.
 * <p>
 * A rejected activity leaves the account untouched.
 */
@Slf4j
@Getter
public class Account {

    private final ClientId clientId;
    private BigDecimal available = Amounts.ZERO;
    private BigDecimal held = Amounts.ZERO;
    private BigDecimal total = Amounts.ZERO;
    private boolean locked;

    @Getter(AccessLevel.NONE)
    private final Map<TransactionId, BigDecimal> transactionRecord = new HashMap<>();

    @Getter(AccessLevel.NONE)
    private final Set<TransactionId> disputeCases = new HashSet<>();

    public Account(ClientId clientId) {
        this.clientId = clientId;
    }

    /**
     * Apply an activity to this account
     *
     * @param activity deposit, withdrawal or dispute activity for this client
     * @throws InvalidTransactionException if the amount is out of domain
     * @throws FailedTransactionException  if the account is locked, the transaction id was already
     *                                     recorded or the funds are insufficient
     * @throws FailedDisputeCaseException  if the transaction is already under dispute
     */
    public void apply(AccountActivity activity) throws AccountActivityException {
        if (locked) {
            throw new FailedTransactionException("account locked");
        }

        boolean changed = switch (activity.getType()) {
            case DEPOSIT -> deposit(activity.transaction());
            case WITHDRAWAL -> withdraw(activity.transaction());
            case DISPUTE -> initiateDispute(activity.transactionId());
            case RESOLVE -> resolveDispute(activity.transactionId());
            case CHARGEBACK -> issueChargeback(activity.transactionId());
        };

        if (!changed) {
            log.debug("Ignored {} of transaction {} for client {}: not applicable",
                    activity.getType().getValue(), activity.transactionId(), clientId);
        }
    }

    public boolean isUnderDispute(TransactionId transactionId) {
        return disputeCases.contains(transactionId);
    }

    public boolean hasRecorded(TransactionId transactionId) {
        return transactionRecord.containsKey(transactionId);
    }

    public AccountSnapshot snapshot() {
        return new AccountSnapshot(clientId, available, held, total, locked);
    }

    // Each operation returns false when the activity was accepted as a no-op

    private boolean deposit(Transaction transaction) throws AccountActivityException {
        BigDecimal amount = transaction.getAmount();
        requireValidAmount("deposit", amount);
        requireNotRecorded(transaction.getId());

        available = available.add(amount);
        total = total.add(amount);
        transactionRecord.put(transaction.getId(), amount);
        return true;
    }

    private boolean withdraw(Transaction transaction) throws AccountActivityException {
        BigDecimal amount = transaction.getAmount();
        requireValidAmount("withdrawal", amount);
        requireNotRecorded(transaction.getId());
        if (amount.compareTo(available) > 0) {
            throw new FailedTransactionException("withdrawal failed because of insufficient funds");
        }

        available = available.subtract(amount);
        total = total.subtract(amount);
        transactionRecord.put(transaction.getId(), amount);
        return true;
    }

    private boolean initiateDispute(TransactionId transactionId) throws FailedDisputeCaseException {
        if (disputeCases.contains(transactionId)) {
            throw new FailedDisputeCaseException("transaction already disputed");
        }
        BigDecimal amount = transactionRecord.get(transactionId);
        if (amount == null) {
            return false;
        }

        available = available.subtract(amount);
        held = held.add(amount);
        disputeCases.add(transactionId);
        return true;
    }

    private boolean resolveDispute(TransactionId transactionId) {
        if (!disputeCases.remove(transactionId)) {
            return false;
        }
        BigDecimal amount = transactionRecord.get(transactionId);

        held = held.subtract(amount);
        available = available.add(amount);
        return true;
    }

    private boolean issueChargeback(TransactionId transactionId) {
        if (!disputeCases.remove(transactionId)) {
            return false;
        }
        BigDecimal amount = transactionRecord.get(transactionId);

        held = held.subtract(amount);
        total = total.subtract(amount);
        locked = true;
        log.debug("Account {} locked after chargeback of transaction {}", clientId, transactionId);
        return true;
    }

    private static void requireValidAmount(String kind, BigDecimal amount) throws InvalidTransactionException {
        if (!Amounts.isRepresentable(amount)) {
            throw new InvalidTransactionException(kind + " amount is out of range");
        }
        if (!Amounts.isValid(amount)) {
            throw new InvalidTransactionException(kind + " amount must be a positive number");
        }
    }

    private void requireNotRecorded(TransactionId transactionId) throws FailedTransactionException {
        if (transactionRecord.containsKey(transactionId)) {
            throw new FailedTransactionException("transaction already recorded");
        }
    }
}
