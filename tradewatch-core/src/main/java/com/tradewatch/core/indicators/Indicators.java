package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Entry point for the indicator library.
 *
 * Series methods return one value per candle with Double.NaN during warmup.
 * The {@code latest} family returns the newest value only, or empty when the
 * candle list is too short for the indicator.
 */
public final class Indicators {

    private Indicators() {}

    // ========== Series ==========

    public static double[] sma(List<Candle> candles, int period) {
        return SMA.calculate(candles, period);
    }

    public static double[] ema(List<Candle> candles, int period) {
        return EMA.calculate(candles, period);
    }

    public static double[] rsi(List<Candle> candles, int period) {
        return RSI.calculate(candles, period);
    }

    public static double[] atr(List<Candle> candles, int period) {
        return ATR.calculate(candles, period);
    }

    public static MACD.Result macd(List<Candle> candles, int fast, int slow, int signal) {
        return MACD.calculate(candles, fast, slow, signal);
    }

    public static BollingerBands.Result bollinger(List<Candle> candles, int period, double stdDevMultiplier) {
        return BollingerBands.calculate(candles, period, stdDevMultiplier);
    }

    public static Stochastic.Result stochastic(List<Candle> candles, int kPeriod, int dPeriod) {
        return Stochastic.calculate(candles, kPeriod, dPeriod);
    }

    public static double[] vwap(List<Candle> candles) {
        return VWAP.calculate(candles);
    }

    public static double[] averageVolume(List<Candle> candles, int period) {
        return VolumeIndicators.averageVolume(candles, period);
    }

    public static double[] highOf(List<Candle> candles, int period) {
        return RangeFunctions.highOf(candles, period);
    }

    public static double[] lowOf(List<Candle> candles, int period) {
        return RangeFunctions.lowOf(candles, period);
    }

    public static double[] engulfing(List<Candle> candles) {
        return CandlePatterns.engulfing(candles);
    }

    // ========== Helpers ==========

    public static double[] closes(List<Candle> candles) {
        double[] values = new double[candles.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = candles.get(i).close();
        }
        return values;
    }

    public static double[] volumes(List<Candle> candles) {
        double[] values = new double[candles.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = candles.get(i).volume();
        }
        return values;
    }

    /**
     * Last element of a series, empty if the series is empty or the last value is NaN.
     */
    public static OptionalDouble last(double[] series) {
        if (series == null || series.length == 0 || Double.isNaN(series[series.length - 1])) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(series[series.length - 1]);
    }

    /**
     * Number of leading NaN entries in a series.
     */
    public static int warmupLength(double[] series) {
        int i = 0;
        while (i < series.length && Double.isNaN(series[i])) {
            i++;
        }
        return i;
    }
}
