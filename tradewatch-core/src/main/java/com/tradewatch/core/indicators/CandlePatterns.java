package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Two-bar candlestick patterns.
 */
public final class CandlePatterns {

    public static final double BULLISH = 1.0;
    public static final double BEARISH = -1.0;
    public static final double NONE = 0.0;

    private CandlePatterns() {}

    /**
     * Engulfing pattern per bar: +1 bullish engulfing, -1 bearish engulfing, 0 none.
     * The first bar has no predecessor and is NaN.
     */
    public static double[] engulfing(List<Candle> candles) {
        int n = candles.size();
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        for (int i = 1; i < n; i++) {
            result[i] = engulfingAt(candles.get(i - 1), candles.get(i));
        }
        return result;
    }

    public static OptionalDouble latestEngulfing(List<Candle> candles) {
        if (candles == null || candles.size() < 2) {
            return OptionalDouble.empty();
        }
        int n = candles.size();
        return OptionalDouble.of(engulfingAt(candles.get(n - 2), candles.get(n - 1)));
    }

    private static double engulfingAt(Candle prev, Candle curr) {
        if (prev.isBearish() && curr.isBullish()
                && curr.open() <= prev.close() && curr.close() >= prev.open()) {
            return BULLISH;
        }
        if (prev.isBullish() && curr.isBearish()
                && curr.open() >= prev.close() && curr.close() <= prev.open()) {
            return BEARISH;
        }
        return NONE;
    }
}
