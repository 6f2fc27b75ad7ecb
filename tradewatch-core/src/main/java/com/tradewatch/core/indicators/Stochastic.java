package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Stochastic Oscillator - measures momentum by comparing close to high-low range.
 */
public final class Stochastic {

    private Stochastic() {}

    /**
     * Full Stochastic result with %K and %D lines.
     */
    public record Result(double[] k, double[] d) {}

    public record Value(double k, double d) {}

    public static Result calculate(List<Candle> candles, int kPeriod, int dPeriod) {
        int n = candles.size();
        double[] k = new double[n];
        double[] d = new double[n];
        Arrays.fill(k, Double.NaN);
        Arrays.fill(d, Double.NaN);

        if (kPeriod <= 0 || dPeriod <= 0 || n < kPeriod) {
            return new Result(k, d);
        }

        for (int i = kPeriod - 1; i < n; i++) {
            k[i] = kAt(candles, kPeriod, i);
        }

        for (int i = kPeriod + dPeriod - 2; i < n; i++) {
            double sum = 0;
            for (int j = i - dPeriod + 1; j <= i; j++) {
                sum += k[j];
            }
            d[i] = sum / dPeriod;
        }

        return new Result(k, d);
    }

    /**
     * Latest %K and %D. Needs {@code kPeriod + dPeriod - 1} candles.
     */
    public static Optional<Value> latest(List<Candle> candles, int kPeriod, int dPeriod) {
        if (candles == null || kPeriod <= 0 || dPeriod <= 0 || candles.size() < kPeriod + dPeriod - 1) {
            return Optional.empty();
        }
        Result result = calculate(candles, kPeriod, dPeriod);
        int last = candles.size() - 1;
        return Optional.of(new Value(result.k()[last], result.d()[last]));
    }

    private static double kAt(List<Candle> candles, int period, int barIndex) {
        double highestHigh = Double.NEGATIVE_INFINITY;
        double lowestLow = Double.POSITIVE_INFINITY;

        for (int j = barIndex - period + 1; j <= barIndex; j++) {
            Candle c = candles.get(j);
            highestHigh = Math.max(highestHigh, c.high());
            lowestLow = Math.min(lowestLow, c.low());
        }

        double range = highestHigh - lowestLow;
        if (range <= 0) {
            return 50.0;
        }

        double close = candles.get(barIndex).close();
        return ((close - lowestLow) / range) * 100.0;
    }
}
