package com.tradewatch.runner.sync;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EventRecord(
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("type") EventType type,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("message") String message,
    @JsonProperty("details_json") String detailsJson
) {}
