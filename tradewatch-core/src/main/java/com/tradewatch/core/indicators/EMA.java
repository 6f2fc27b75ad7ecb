package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Exponential Moving Average indicator, seeded with the SMA of the first period.
 */
public final class EMA {

    private EMA() {} // Utility class

    /**
     * Calculate EMA of closes for all bars.
     * @return Array where index corresponds to bar index. Warmup entries are Double.NaN.
     */
    public static double[] calculate(List<Candle> candles, int period) {
        return calculate(Indicators.closes(candles), period);
    }

    /**
     * Calculate EMA over a value sequence. Leading NaN values are skipped, so the
     * result can be chained onto another indicator's output (MACD signal line).
     */
    public static double[] calculate(double[] values, int period) {
        int n = values.length;
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0) {
            return result;
        }

        int start = 0;
        while (start < n && Double.isNaN(values[start])) {
            start++;
        }
        if (n - start < period) {
            return result;
        }

        double multiplier = 2.0 / (period + 1);

        // First EMA is SMA
        double sum = 0;
        for (int i = start; i < start + period; i++) {
            sum += values[i];
        }
        int seed = start + period - 1;
        result[seed] = sum / period;

        for (int i = seed + 1; i < n; i++) {
            result[i] = (values[i] - result[i - 1]) * multiplier + result[i - 1];
        }

        return result;
    }

    public static OptionalDouble latest(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < period) {
            return OptionalDouble.empty();
        }
        return Indicators.last(calculate(candles, period));
    }
}
