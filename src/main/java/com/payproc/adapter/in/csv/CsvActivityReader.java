package com.payproc.adapter.in.csv;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectReader;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.payproc.application.port.out.ActivitySource;
import com.payproc.application.port.out.ParseResult;
import com.payproc.domain.model.AccountActivity;
import com.payproc.domain.model.ActivityType;
import com.payproc.domain.model.ClientId;
import com.payproc.domain.model.TransactionId;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads account activities from CSV with a header line.
 * <p>
 * Column order comes from the header, header names and values are trimmed and records may
 * have fewer columns than the header: dispute, resolve and chargeback rows usually omit the
 * amount. A bad record becomes a {@link ParseResult#failure} and reading continues.
 */
@Slf4j
public class CsvActivityReader implements ActivitySource {

    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvParser.Feature.TRIM_SPACES)
            .enable(CsvParser.Feature.SKIP_EMPTY_LINES)
            .enable(CsvParser.Feature.IGNORE_TRAILING_UNMAPPABLE)
            .build();
    private static final CsvSchema SCHEMA_WITH_HEADER = CsvSchema.emptySchema().withHeader();

    private final InputStream input;
    private final CsvActivityRowValidator validator;

    public CsvActivityReader(InputStream input) {
        this(input, new CsvActivityRowValidator());
    }

    public CsvActivityReader(InputStream input, CsvActivityRowValidator validator) {
        this.input = input;
        this.validator = validator;
    }

    @Override
    public Iterator<ParseResult> read() {
        ObjectReader reader = CSV_MAPPER.readerFor(CsvActivityRow.class).with(SCHEMA_WITH_HEADER);
        try {
            MappingIterator<CsvActivityRow> rows = reader.readValues(input);
            return new RowIterator(rows);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to read account activity records", e);
        }
    }

    ParseResult convert(long rowNumber, CsvActivityRow row) {
        ValidationResult validation = validator.validate(row);
        if (!validation.isValid()) {
            return ParseResult.failure(rowNumber, validation.describe());
        }

        ActivityType type = ActivityType.fromValue(row.getType().trim());
        TransactionId tx = TransactionId.of(Long.parseLong(row.getTx().trim()));
        ClientId client = ClientId.of(Integer.parseInt(row.getClient().trim()));

        AccountActivity activity = switch (type) {
            case DEPOSIT -> AccountActivity.deposit(tx, client, new BigDecimal(row.getAmount().trim()));
            case WITHDRAWAL -> AccountActivity.withdrawal(tx, client, new BigDecimal(row.getAmount().trim()));
            case DISPUTE -> AccountActivity.dispute(tx, client);
            case RESOLVE -> AccountActivity.resolve(tx, client);
            case CHARGEBACK -> AccountActivity.chargeback(tx, client);
        };
        return ParseResult.success(activity);
    }

    private class RowIterator implements Iterator<ParseResult> {

        private final MappingIterator<CsvActivityRow> rows;
        private long rowNumber;

        RowIterator(MappingIterator<CsvActivityRow> rows) {
            this.rows = rows;
        }

        @Override
        public boolean hasNext() {
            try {
                return rows.hasNextValue();
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to read account activity records", e);
            }
        }

        @Override
        public ParseResult next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            rowNumber++;
            try {
                return convert(rowNumber, rows.nextValue());
            } catch (JsonProcessingException e) {
                log.debug("Malformed CSV record at row {}", rowNumber, e);
                return ParseResult.failure(rowNumber, "malformed record: " + e.getOriginalMessage());
            } catch (IOException e) {
                throw new UncheckedIOException("Unable to read account activity records", e);
            }
        }
    }
}
