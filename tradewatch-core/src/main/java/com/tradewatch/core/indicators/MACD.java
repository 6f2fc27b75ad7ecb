package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * Moving Average Convergence Divergence indicator.
 */
public final class MACD {

    private MACD() {}

    /**
     * MACD series containing line, signal, and histogram.
     */
    public record Result(double[] line, double[] signal, double[] histogram) {}

    /**
     * MACD values of a single bar.
     */
    public record Value(double line, double signal, double histogram) {}

    /**
     * Bars needed before the signal line has a value.
     */
    public static int warmupBars(int slowPeriod, int signalPeriod) {
        return slowPeriod + signalPeriod - 1;
    }

    public static Result calculate(List<Candle> candles, int fastPeriod, int slowPeriod, int signalPeriod) {
        int n = candles.size();
        double[] line = new double[n];
        double[] histogram = new double[n];
        Arrays.fill(line, Double.NaN);
        Arrays.fill(histogram, Double.NaN);

        if (fastPeriod <= 0 || slowPeriod <= 0 || signalPeriod <= 0 || n < slowPeriod) {
            double[] signal = new double[n];
            Arrays.fill(signal, Double.NaN);
            return new Result(line, signal, histogram);
        }

        double[] fastEma = EMA.calculate(candles, fastPeriod);
        double[] slowEma = EMA.calculate(candles, slowPeriod);

        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(fastEma[i]) && !Double.isNaN(slowEma[i])) {
                line[i] = fastEma[i] - slowEma[i];
            }
        }

        double[] signal = EMA.calculate(line, signalPeriod);
        for (int i = 0; i < n; i++) {
            if (!Double.isNaN(signal[i])) {
                histogram[i] = line[i] - signal[i];
            }
        }

        return new Result(line, signal, histogram);
    }

    public static Optional<Value> latest(List<Candle> candles, int fastPeriod, int slowPeriod, int signalPeriod) {
        if (candles == null || candles.size() < warmupBars(slowPeriod, signalPeriod)) {
            return Optional.empty();
        }
        Result result = calculate(candles, fastPeriod, slowPeriod, signalPeriod);
        int last = candles.size() - 1;
        if (Double.isNaN(result.signal()[last])) {
            return Optional.empty();
        }
        return Optional.of(new Value(result.line()[last], result.signal()[last], result.histogram()[last]));
    }
}
