package com.payproc.application.service;

import com.payproc.application.port.out.ParseFailure;
import com.payproc.application.port.out.ProcessingListener;
import com.payproc.domain.exception.AccountActivityException;
import com.payproc.domain.model.AccountActivity;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Listener that records every skipped record as a structured value
 */
public class ProcessingReport implements ProcessingListener {

    private final ConcurrentLinkedQueue<ParseFailure> parseFailures = new ConcurrentLinkedQueue<>();
    private final ConcurrentLinkedQueue<Rejection> rejections = new ConcurrentLinkedQueue<>();

    @Override
    public void onParseFailure(ParseFailure failure) {
        parseFailures.add(failure);
    }

    @Override
    public void onActivityRejected(AccountActivity activity, AccountActivityException error) {
        rejections.add(new Rejection(activity, error));
    }

    public List<ParseFailure> parseFailures() {
        return Collections.unmodifiableList(new ArrayList<>(parseFailures));
    }

    public List<Rejection> rejections() {
        return Collections.unmodifiableList(new ArrayList<>(rejections));
    }

    public boolean isClean() {
        return parseFailures.isEmpty() && rejections.isEmpty();
    }

    /**
     * An activity an account refused, with the reason
     */
    public record Rejection(AccountActivity activity, AccountActivityException error) {
    }
}
