package com.payproc.application.service;

import com.payproc.application.port.out.ParseResult;
import com.payproc.application.port.out.ProcessingListener;
import com.payproc.domain.exception.AccountActivityException;
import com.payproc.domain.model.Account;
import com.payproc.domain.model.AccountActivity;
import com.payproc.domain.model.AccountSnapshot;
import com.payproc.domain.model.ClientId;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Folds a stream of account activities into per-client accounts.
 * <p>
 * Accounts are created on first sight of a client id and never removed. Parse failures and
 * rejected activities are reported to the {@link ProcessingListener} and never stop the run.
 * Not thread-safe: one aggregator is owned by one thread at a time.
 */
@Slf4j
public class LedgerAggregator {

    private final Map<ClientId, Account> accounts = new HashMap<>();
    private final ProcessingListener listener;

    private long applied;
    private long rejected;

    public LedgerAggregator(ProcessingListener listener) {
        this.listener = listener;
    }

    /**
     * Consume every record in order and return the resulting snapshots
     */
    public List<AccountSnapshot> process(Iterator<ParseResult> records) {
        while (records.hasNext()) {
            accept(records.next());
        }
        log.debug("Aggregated {} accounts ({} activities applied, {} rejected)",
                accounts.size(), applied, rejected);
        return snapshots();
    }

    public void accept(ParseResult record) {
        if (record.isSuccess()) {
            apply(record.activity());
        } else {
            listener.onParseFailure(record.failure());
        }
    }

    public void apply(AccountActivity activity) {
        Account account = accounts.computeIfAbsent(activity.clientId(), Account::new);
        try {
            account.apply(activity);
            applied++;
            log.debug("Applied {} of transaction {} for client {}",
                    activity.getType().getValue(), activity.transactionId(), activity.clientId());
        } catch (AccountActivityException e) {
            rejected++;
            listener.onActivityRejected(activity, e);
        }
    }

    public List<AccountSnapshot> snapshots() {
        List<AccountSnapshot> snapshots = new ArrayList<>(accounts.size());
        for (Account account : accounts.values()) {
            snapshots.add(account.snapshot());
        }
        return snapshots;
    }

    public int accountCount() {
        return accounts.size();
    }
}
