package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Relative Strength Index indicator (Wilder smoothing).
 */
public final class RSI {

    private RSI() {} // Utility class

    /**
     * Calculate RSI for all bars.
     * @return Array where index corresponds to bar index. The first {@code period} entries are Double.NaN.
     */
    public static double[] calculate(List<Candle> candles, int period) {
        int n = candles.size();
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period + 1) {
            return result;
        }

        double avgGain = 0;
        double avgLoss = 0;

        for (int i = 1; i <= period; i++) {
            double change = candles.get(i).close() - candles.get(i - 1).close();
            if (change > 0) {
                avgGain += change;
            } else {
                avgLoss -= change;
            }
        }

        avgGain /= period;
        avgLoss /= period;
        result[period] = toRsi(avgGain, avgLoss);

        for (int i = period + 1; i < n; i++) {
            double change = candles.get(i).close() - candles.get(i - 1).close();
            double gain = change > 0 ? change : 0;
            double loss = change < 0 ? -change : 0;

            avgGain = (avgGain * (period - 1) + gain) / period;
            avgLoss = (avgLoss * (period - 1) + loss) / period;
            result[i] = toRsi(avgGain, avgLoss);
        }

        return result;
    }

    /**
     * RSI of the newest bar. Needs {@code period + 1} candles.
     */
    public static OptionalDouble latest(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < period + 1) {
            return OptionalDouble.empty();
        }
        return Indicators.last(calculate(candles, period));
    }

    private static double toRsi(double avgGain, double avgLoss) {
        if (avgLoss == 0) {
            return 100;
        }
        double rs = avgGain / avgLoss;
        return 100 - (100 / (1 + rs));
    }
}
