package com.payproc.config;

import io.vertx.core.json.JsonObject;
import lombok.Builder;
import lombok.Value;

/**
 * Runtime configuration of the processor
 */
@Value
@Builder(toBuilder = true)
public class LedgerConfig {

    public static final int DEFAULT_PARTITIONS = 1;

    @Builder.Default
    int partitions = DEFAULT_PARTITIONS;

    boolean silent;

    /**
     * Bind the {@code processor} and {@code output} sections of the configuration
     */
    public static LedgerConfig fromJson(JsonObject config) {
        JsonObject processor = config.getJsonObject("processor", new JsonObject());
        JsonObject output = config.getJsonObject("output", new JsonObject());

        int partitions = processor.getInteger("partitions", DEFAULT_PARTITIONS);
        if (partitions < 1) {
            throw new IllegalStateException("processor.partitions must be at least 1, got " + partitions);
        }

        return LedgerConfig.builder()
                .partitions(partitions)
                .silent(output.getBoolean("silent", false))
                .build();
    }
}
