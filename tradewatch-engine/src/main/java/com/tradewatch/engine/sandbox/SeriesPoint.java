package com.tradewatch.engine.sandbox;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * One point of a series line: x is the candle open time, y2 and y3 are present
 * only for multi-value lines (bands, MACD triplets).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record SeriesPoint(long x, double y, Double y2, Double y3) {

    public static SeriesPoint of(long x, double y) {
        return new SeriesPoint(x, y, null, null);
    }
}
