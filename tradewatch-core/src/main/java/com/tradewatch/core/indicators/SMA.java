package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Simple Moving Average indicator.
 */
public final class SMA {

    private SMA() {} // Utility class

    /**
     * Calculate SMA of closes for all bars.
     * @return Array where index corresponds to bar index. Warmup entries are Double.NaN.
     */
    public static double[] calculate(List<Candle> candles, int period) {
        return calculate(Indicators.closes(candles), period);
    }

    /**
     * Calculate SMA over a plain value sequence.
     */
    public static double[] calculate(double[] values, int period) {
        int n = values.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period) {
            return result;
        }

        double sum = 0;
        for (int i = 0; i < period; i++) {
            sum += values[i];
        }
        result[period - 1] = sum / period;

        for (int i = period; i < n; i++) {
            sum = sum - values[i - period] + values[i];
            result[i] = sum / period;
        }

        return result;
    }

    /**
     * SMA of the most recent {@code period} closes, empty during warmup.
     */
    public static OptionalDouble latest(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < period) {
            return OptionalDouble.empty();
        }
        double sum = 0;
        for (int i = candles.size() - period; i < candles.size(); i++) {
            sum += candles.get(i).close();
        }
        return OptionalDouble.of(sum / period);
    }
}
