package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Bollinger Bands indicator (population standard deviation around the SMA).
 */
public final class BollingerBands {

    private BollingerBands() {}

    /**
     * Bollinger Bands series containing upper, middle, lower, and width.
     */
    public record Result(double[] upper, double[] middle, double[] lower, double[] width) {}

    public record Value(double upper, double middle, double lower, double width) {}

    public static Result calculate(List<Candle> candles, int period, double stdDevMultiplier) {
        int n = candles.size();
        double[] upper = new double[n];
        double[] middle = new double[n];
        double[] lower = new double[n];
        double[] width = new double[n];
        Arrays.fill(upper, Double.NaN);
        Arrays.fill(middle, Double.NaN);
        Arrays.fill(lower, Double.NaN);
        Arrays.fill(width, Double.NaN);

        if (period <= 0 || n < period) {
            return new Result(upper, middle, lower, width);
        }

        double[] smaValues = SMA.calculate(candles, period);

        for (int i = period - 1; i < n; i++) {
            double mean = smaValues[i];
            double stdDev = stdDev(candles, period, i, mean);

            middle[i] = mean;
            upper[i] = mean + stdDevMultiplier * stdDev;
            lower[i] = mean - stdDevMultiplier * stdDev;
            width[i] = upper[i] - lower[i];
        }

        return new Result(upper, middle, lower, width);
    }

    public static Optional<Value> latest(List<Candle> candles, int period, double stdDevMultiplier) {
        if (candles == null || period <= 0 || candles.size() < period) {
            return Optional.empty();
        }
        int last = candles.size() - 1;
        double mean = SMA.latest(candles, period).orElse(Double.NaN);
        double stdDev = stdDev(candles, period, last, mean);
        double upper = mean + stdDevMultiplier * stdDev;
        double lower = mean - stdDevMultiplier * stdDev;
        return Optional.of(new Value(upper, mean, lower, upper - lower));
    }

    private static double stdDev(List<Candle> candles, int period, int barIndex, double mean) {
        double sumSquaredDiff = 0;
        for (int j = barIndex - period + 1; j <= barIndex; j++) {
            double diff = candles.get(j).close() - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / period);
    }
}
