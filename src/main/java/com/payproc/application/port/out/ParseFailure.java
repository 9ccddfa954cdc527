package com.payproc.application.port.out;

/**
 * A record the activity source could not turn into an account activity
 *
 * @param row    1-based data row number, header excluded
 * @param reason why the record was rejected
 */
public record ParseFailure(long row, String reason) {

    public String describe() {
        return "row " + row + ": " + reason;
    }
}
