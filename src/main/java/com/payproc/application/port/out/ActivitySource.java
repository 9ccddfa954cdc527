package com.payproc.application.port.out;

import java.util.Iterator;

/**
 * Output port for the producer of account activities.
 * Implementations own all format-specific parsing and report bad records as
 * {@link ParseFailure}s instead of failing the whole read.
 */
public interface ActivitySource {

    /**
     * Records in input order. The iterator is single-pass.
     */
    Iterator<ParseResult> read();
}
