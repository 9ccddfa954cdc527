package com.payproc.adapter.in.csv;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Raw CSV record: {@code type, client, tx, amount}.
 * Everything is kept as text so that bad values become parse failures of this row only.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class CsvActivityRow {

    @JsonProperty("type")
    private String type;

    @JsonProperty("client")
    private String client;

    @JsonProperty("tx")
    private String tx;

    @JsonProperty("amount")
    private String amount;
}
