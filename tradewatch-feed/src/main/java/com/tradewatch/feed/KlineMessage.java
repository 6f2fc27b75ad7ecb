package com.tradewatch.feed;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tradewatch.core.model.Candle;

/**
 * Binance kline stream payload.
 *
 * Example:
 * {
 *   "e": "kline",
 *   "E": 1704067200000,
 *   "s": "BTCUSDT",
 *   "k": {
 *     "t": 1704067200000,
 *     "T": 1704067259999,
 *     "s": "BTCUSDT",
 *     "i": "1m",
 *     "o": "42000.00",
 *     "c": "42030.00",
 *     "h": "42050.00",
 *     "l": "41980.00",
 *     "v": "12.56",
 *     "n": 500,
 *     "x": false,
 *     "q": "527814.20"
 *   }
 * }
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class KlineMessage {

    @JsonProperty("e")
    private String eventType;

    @JsonProperty("E")
    private long eventTime;

    @JsonProperty("s")
    private String symbol;

    @JsonProperty("k")
    private KlineData kline;

    public String getEventType() {
        return eventType;
    }

    public long getEventTime() {
        return eventTime;
    }

    public String getSymbol() {
        return symbol != null ? symbol : kline != null ? kline.symbol : null;
    }

    public String getInterval() {
        return kline != null ? kline.interval : null;
    }

    public KlineData getKline() {
        return kline;
    }

    /**
     * Convert to a candle.
     *
     * @throws IllegalArgumentException if required fields are missing or not numeric
     */
    public Candle toCandle() {
        if (kline == null) {
            throw new IllegalArgumentException("kline payload missing");
        }
        if (getSymbol() == null || kline.interval == null) {
            throw new IllegalArgumentException("kline without symbol or interval");
        }
        return kline.toCandle();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class KlineData {

        @JsonProperty("t")
        private long startTime;

        @JsonProperty("T")
        private long endTime;

        @JsonProperty("s")
        private String symbol;

        @JsonProperty("i")
        private String interval;

        @JsonProperty("o")
        private String open;

        @JsonProperty("c")
        private String close;

        @JsonProperty("h")
        private String high;

        @JsonProperty("l")
        private String low;

        @JsonProperty("v")
        private String volume;

        @JsonProperty("n")
        private int tradeCount = -1;

        @JsonProperty("x")
        private boolean closed;

        @JsonProperty("q")
        private String quoteVolume;

        public long getStartTime() {
            return startTime;
        }

        public long getEndTime() {
            return endTime;
        }

        public boolean isClosed() {
            return closed;
        }

        Candle toCandle() {
            return new Candle(
                startTime,
                number("o", open),
                number("h", high),
                number("l", low),
                number("c", close),
                number("v", volume),
                endTime,
                closed,
                quoteVolume != null ? number("q", quoteVolume) : -1,
                tradeCount
            );
        }
    }

    static double number(String field, String value) {
        if (value == null) {
            throw new IllegalArgumentException("missing field '" + field + "'");
        }
        try {
            return Double.parseDouble(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("field '" + field + "' is not numeric: " + value);
        }
    }
}
