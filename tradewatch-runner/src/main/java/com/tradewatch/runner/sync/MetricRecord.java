package com.tradewatch.runner.sync;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record MetricRecord(
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("counters") Map<String, Long> counters
) {
    public MetricRecord {
        counters = Map.copyOf(counters);
    }
}
