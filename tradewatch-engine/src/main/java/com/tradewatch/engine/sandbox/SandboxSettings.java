package com.tradewatch.engine.sandbox;

import java.time.Duration;

/**
 * Limits applied to strategy evaluation.
 *
 * @param filterTimeout           wall-clock limit for one filter evaluation
 * @param seriesTimeout           wall-clock limit for one series evaluation
 * @param timeoutBackoffThreshold consecutive timeouts before a trader's refresh interval is stretched
 * @param maxBackoffMultiplier    upper bound of the refresh stretch factor
 * @param seriesPoints            points kept per series line
 * @param candleSliceLength       primary-interval candles attached to a result
 * @param threads                 sandbox executor threads
 */
public record SandboxSettings(
    Duration filterTimeout,
    Duration seriesTimeout,
    int timeoutBackoffThreshold,
    int maxBackoffMultiplier,
    int seriesPoints,
    int candleSliceLength,
    int threads
) {
    public SandboxSettings {
        if (filterTimeout == null || filterTimeout.isNegative() || filterTimeout.isZero()) {
            throw new IllegalArgumentException("filterTimeout must be positive");
        }
        if (seriesTimeout == null || seriesTimeout.isNegative() || seriesTimeout.isZero()) {
            throw new IllegalArgumentException("seriesTimeout must be positive");
        }
        if (timeoutBackoffThreshold < 1) {
            throw new IllegalArgumentException("timeoutBackoffThreshold must be >= 1");
        }
        if (maxBackoffMultiplier < 1) {
            throw new IllegalArgumentException("maxBackoffMultiplier must be >= 1");
        }
        if (seriesPoints < 1 || candleSliceLength < 0 || threads < 1) {
            throw new IllegalArgumentException("seriesPoints and threads must be >= 1, candleSliceLength >= 0");
        }
    }

    public static SandboxSettings defaults() {
        return new SandboxSettings(Duration.ofSeconds(1), Duration.ofSeconds(3), 3, 8, 100, 100,
            Math.max(2, Runtime.getRuntime().availableProcessors()));
    }

    public SandboxSettings withTimeouts(Duration filter, Duration series) {
        return new SandboxSettings(filter, series, timeoutBackoffThreshold, maxBackoffMultiplier,
            seriesPoints, candleSliceLength, threads);
    }
}
