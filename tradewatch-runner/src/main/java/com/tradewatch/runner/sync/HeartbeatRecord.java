package com.tradewatch.runner.sync;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Liveness record written on its own schedule, independent of queued data.
 *
 * @param status   "ok" or "degraded" when persistence keeps failing
 * @param counters uptime, queue depths, evictions and consecutive failures
 */
public record HeartbeatRecord(
    @JsonProperty("source_id") String sourceId,
    @JsonProperty("timestamp") long timestamp,
    @JsonProperty("status") String status,
    @JsonProperty("counters") Map<String, Long> counters
) {
    public HeartbeatRecord {
        counters = Map.copyOf(counters);
    }
}
