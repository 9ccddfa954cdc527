package com.payproc.application.port.out;

import com.payproc.domain.model.AccountActivity;

import java.util.Objects;

/**
 * Outcome of reading one record: either an activity or a parse failure
 */
public record ParseResult(AccountActivity activity, ParseFailure failure) {

    public ParseResult {
        if ((activity == null) == (failure == null)) {
            throw new IllegalArgumentException("exactly one of activity and failure must be set");
        }
    }

    public boolean isSuccess() {
        return activity != null;
    }

    public static ParseResult success(AccountActivity activity) {
        return new ParseResult(Objects.requireNonNull(activity, "activity"), null);
    }

    public static ParseResult failure(long row, String reason) {
        return new ParseResult(null, new ParseFailure(row, reason));
    }
}
