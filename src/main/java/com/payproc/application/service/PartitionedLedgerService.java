package com.payproc.application.service;

import com.payproc.application.port.in.LedgerProcessingUseCase;
import com.payproc.application.port.out.ActivitySource;
import com.payproc.application.port.out.ParseResult;
import com.payproc.application.port.out.ProcessingListener;
import com.payproc.domain.model.AccountActivity;
import com.payproc.domain.model.AccountSnapshot;
import io.vertx.core.Future;
import io.vertx.core.Vertx;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Use case implementation running the ledger on Vert.x worker threads.
 * <p>
 * With a single partition the whole stream is folded by one aggregator. With more partitions
 * the source is read once on one worker, activities are assigned to partition
 * {@code clientId % partitions} in input order, and each partition is folded by its own
 * aggregator concurrently. A client always lands in the same partition, so its activities keep
 * their input order and its account has a single owner.
 */
@Slf4j
public class PartitionedLedgerService implements LedgerProcessingUseCase {

    private final Vertx vertx;
    private final int partitions;

    public PartitionedLedgerService(Vertx vertx, int partitions) {
        if (partitions < 1) {
            throw new IllegalArgumentException("partitions must be at least 1, got " + partitions);
        }
        this.vertx = vertx;
        this.partitions = partitions;
    }

    @Override
    public Future<List<AccountSnapshot>> process(ActivitySource source, ProcessingListener listener) {
        log.info("Processing account activities (partitions: {})", partitions);

        Future<List<AccountSnapshot>> result;
        if (partitions == 1) {
            result = vertx.executeBlocking(() -> new LedgerAggregator(listener).process(source.read()), false);
        } else {
            result = vertx.executeBlocking(() -> partition(source.read(), listener), false)
                    .compose(batches -> foldPartitions(batches, listener));
        }

        return result
                .onSuccess(snapshots -> log.info("Processed activities for {} accounts", snapshots.size()))
                .onFailure(error -> log.error("Failed to process account activities", error));
    }

    /**
     * Split the stream by client id, reporting parse failures as they are read
     */
    private List<List<AccountActivity>> partition(Iterator<ParseResult> records, ProcessingListener listener) {
        List<List<AccountActivity>> batches = new ArrayList<>(partitions);
        for (int i = 0; i < partitions; i++) {
            batches.add(new ArrayList<>());
        }

        while (records.hasNext()) {
            ParseResult record = records.next();
            if (record.isSuccess()) {
                AccountActivity activity = record.activity();
                batches.get(activity.clientId().value() % partitions).add(activity);
            } else {
                listener.onParseFailure(record.failure());
            }
        }
        return batches;
    }

    private Future<List<AccountSnapshot>> foldPartitions(List<List<AccountActivity>> batches,
                                                         ProcessingListener listener) {
        List<Future<List<AccountSnapshot>>> folds = new ArrayList<>(batches.size());
        for (int i = 0; i < batches.size(); i++) {
            List<AccountActivity> batch = batches.get(i);
            int index = i;
            folds.add(vertx.executeBlocking(() -> {
                LedgerAggregator aggregator = new LedgerAggregator(listener);
                batch.forEach(aggregator::apply);
                log.debug("Partition {} folded {} activities into {} accounts",
                        index, batch.size(), aggregator.accountCount());
                return aggregator.snapshots();
            }, false));
        }

        return Future.all(folds).map(done -> {
            List<AccountSnapshot> merged = new ArrayList<>();
            for (Future<List<AccountSnapshot>> fold : folds) {
                merged.addAll(fold.result());
            }
            return merged;
        });
    }
}
