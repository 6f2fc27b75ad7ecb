package com.tradewatch.runner.sync;

import java.time.Duration;

/**
 * Batching, backpressure and retry parameters of the state synchronizer.
 *
 * @param degradedAfterFailures consecutive failed flushes before persistence is reported degraded
 */
public record SyncSettings(
    Duration flushInterval,
    int maxBatchSize,
    int signalQueueCap,
    int metricQueueCap,
    int eventQueueCap,
    Duration heartbeatInterval,
    Duration retryBase,
    Duration retryMax,
    int degradedAfterFailures
) {
    public SyncSettings {
        if (maxBatchSize < 1 || signalQueueCap < 1 || metricQueueCap < 1 || eventQueueCap < 1) {
            throw new IllegalArgumentException("batch size and queue caps must be >= 1");
        }
        if (degradedAfterFailures < 1) {
            throw new IllegalArgumentException("degradedAfterFailures must be >= 1");
        }
    }

    /**
     * Delay before the next flush after {@code failures} consecutive failures:
     * the flush interval when healthy, else {@code retryBase * 2^(failures - 1)} capped at {@code retryMax}.
     */
    public Duration nextFlushDelay(int failures) {
        if (failures <= 0) {
            return flushInterval;
        }
        int shift = Math.min(failures - 1, 30);
        long ms = retryBase.toMillis() * (1L << shift);
        return ms < 0 || ms > retryMax.toMillis() ? retryMax : Duration.ofMillis(ms);
    }
}
