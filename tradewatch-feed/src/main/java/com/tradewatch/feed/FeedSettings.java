package com.tradewatch.feed;

import java.time.Duration;
import java.util.Objects;

/**
 * Connection and buffering parameters of the market data client.
 *
 * @param streamUrl      base URL of the combined stream endpoint, e.g. {@code wss://stream.binance.com:9443}
 * @param restUrl        base URL of the REST API used for backfill
 * @param bufferCapacity maximum candles kept per (symbol, interval)
 * @param reconnectBase  delay before the first reconnect attempt
 * @param reconnectMax   cap of the exponential reconnect delay
 * @param staleAfter     silence after which a connected stream is reported degraded
 */
public record FeedSettings(
    String streamUrl,
    String restUrl,
    int bufferCapacity,
    Duration reconnectBase,
    Duration reconnectMax,
    Duration staleAfter
) {
    public FeedSettings {
        Objects.requireNonNull(streamUrl, "streamUrl");
        Objects.requireNonNull(restUrl, "restUrl");
        if (bufferCapacity < 1) {
            throw new IllegalArgumentException("bufferCapacity must be >= 1, got " + bufferCapacity);
        }
        requirePositive(reconnectBase, "reconnectBase");
        requirePositive(reconnectMax, "reconnectMax");
        requirePositive(staleAfter, "staleAfter");
        if (reconnectMax.compareTo(reconnectBase) < 0) {
            throw new IllegalArgumentException("reconnectMax must not be below reconnectBase");
        }
    }

    public static FeedSettings defaults() {
        return new FeedSettings("wss://stream.binance.com:9443", "https://api.binance.com", 500,
            Duration.ofSeconds(5), Duration.ofSeconds(60), Duration.ofSeconds(30));
    }

    public FeedSettings withStreamUrl(String url) {
        return new FeedSettings(url, restUrl, bufferCapacity, reconnectBase, reconnectMax, staleAfter);
    }

    private static void requirePositive(Duration d, String name) {
        if (d == null || d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got " + d);
        }
    }
}
