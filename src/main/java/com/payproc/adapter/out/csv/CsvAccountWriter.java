package com.payproc.adapter.out.csv;

import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.payproc.application.port.out.AccountSnapshotSink;
import com.payproc.domain.model.AccountSnapshot;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.util.List;

/**
 * Writes account snapshots as CSV with a header line.
 * Nothing is written when there are no snapshots. The output stream is flushed but left open.
 */
@Slf4j
public class CsvAccountWriter implements AccountSnapshotSink {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
            .build();
    private static final CsvSchema SCHEMA = CSV_MAPPER.schemaFor(AccountCsvRow.class).withHeader();

    private final OutputStream output;

    public CsvAccountWriter(OutputStream output) {
        this.output = output;
    }

    @Override
    public void write(List<AccountSnapshot> snapshots) throws IOException {
        try (SequenceWriter writer = CSV_MAPPER.writer(SCHEMA).writeValues(output)) {
            for (AccountSnapshot snapshot : snapshots) {
                writer.write(AccountCsvRow.from(snapshot));
            }
        }
        output.flush();
        log.debug("Wrote {} account records", snapshots.size());
    }
}
