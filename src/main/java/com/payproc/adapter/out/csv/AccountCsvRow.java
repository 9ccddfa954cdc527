package com.payproc.adapter.out.csv;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.payproc.domain.model.AccountSnapshot;
import lombok.Value;

/**
 * Output record: {@code client, available, held, total, locked}.
 * Balances are written in plain decimal notation, never scientific.
 */
@Value
@JsonPropertyOrder({"client", "available", "held", "total", "locked"})
public class AccountCsvRow {

    @JsonProperty("client")
    int client;

    @JsonProperty("available")
    String available;

    @JsonProperty("held")
    String held;

    @JsonProperty("total")
    String total;

    @JsonProperty("locked")
    boolean locked;

    public static AccountCsvRow from(AccountSnapshot snapshot) {
        return new AccountCsvRow(
                snapshot.getClientId().value(),
                snapshot.getAvailable().toPlainString(),
                snapshot.getHeld().toPlainString(),
                snapshot.getTotal().toPlainString(),
                snapshot.isLocked()
        );
    }
}
