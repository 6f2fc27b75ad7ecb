package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Highest high and lowest low over a rolling window (the current bar included).
 */
public final class RangeFunctions {

    private RangeFunctions() {}

    public static double[] highOf(List<Candle> candles, int period) {
        return rolling(candles, period, true);
    }

    public static double[] lowOf(List<Candle> candles, int period) {
        return rolling(candles, period, false);
    }

    public static OptionalDouble latestHighOf(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < period) {
            return OptionalDouble.empty();
        }
        return Indicators.last(highOf(candles, period));
    }

    public static OptionalDouble latestLowOf(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < period) {
            return OptionalDouble.empty();
        }
        return Indicators.last(lowOf(candles, period));
    }

    private static double[] rolling(List<Candle> candles, int period, boolean high) {
        int n = candles.size();
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period) {
            return result;
        }

        for (int i = period - 1; i < n; i++) {
            double extreme = high ? Double.NEGATIVE_INFINITY : Double.POSITIVE_INFINITY;
            for (int j = i - period + 1; j <= i; j++) {
                Candle c = candles.get(j);
                extreme = high ? Math.max(extreme, c.high()) : Math.min(extreme, c.low());
            }
            result[i] = extreme;
        }
        return result;
    }
}
