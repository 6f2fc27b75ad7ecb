package com.tradewatch.runner.sync;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Signal row written to the sink.
 *
 * @param metadataJson signal metadata serialized as JSON
 */
public record SignalRecord(
    @JsonProperty("id") String id,
    @JsonProperty("trader_id") String traderId,
    @JsonProperty("symbol") String symbol,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("metadata_json") String metadataJson
) {}
