package com.tradewatch.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * OHLCV candle for one interval of one symbol.
 *
 * A closed candle never changes. The newest candle of a buffer may still be forming
 * ({@code closed == false}) and is replaced by later updates carrying the same open time.
 *
 * Extended fields from Binance klines:
 * - quoteVolume: volume in quote asset (e.g., USDT for BTCUSDT), -1 when unknown
 * - tradeCount: number of trades in the candle, -1 when unknown
 */
public record Candle(
    long openTime,
    double open,
    double high,
    double low,
    double close,
    double volume,
    long closeTime,
    boolean closed,
    double quoteVolume,
    int tradeCount
) {
    /**
     * Closed candle without extended fields. Close time is left at -1 (unknown).
     */
    public Candle(long openTime, double open, double high, double low, double close, double volume) {
        this(openTime, open, high, low, close, volume, -1, true, -1, -1);
    }

    /**
     * Candle with close time and closed flag but without extended fields.
     */
    public Candle(long openTime, double open, double high, double low, double close, double volume,
                  long closeTime, boolean closed) {
        this(openTime, open, high, low, close, volume, closeTime, closed, -1, -1);
    }

    /**
     * Copy of this candle marked as closed.
     */
    public Candle asClosed() {
        return closed ? this : new Candle(openTime, open, high, low, close, volume,
            closeTime, true, quoteVolume, tradeCount);
    }

    @JsonIgnore
    public boolean hasQuoteVolume() {
        return quoteVolume >= 0;
    }

    /**
     * Check if this is a bullish candle (close > open)
     */
    @JsonIgnore
    public boolean isBullish() {
        return close > open;
    }

    /**
     * Check if this is a bearish candle (close < open)
     */
    @JsonIgnore
    public boolean isBearish() {
        return close < open;
    }

    @JsonIgnore
    public double bodySize() {
        return Math.abs(close - open);
    }

    @JsonIgnore
    public double range() {
        return high - low;
    }

    /**
     * Typical price (high + low + close) / 3, used by VWAP.
     */
    @JsonIgnore
    public double typicalPrice() {
        return (high + low + close) / 3.0;
    }
}
