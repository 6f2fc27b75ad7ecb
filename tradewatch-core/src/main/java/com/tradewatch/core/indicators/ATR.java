package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Average True Range indicator (Wilder smoothing).
 */
public final class ATR {

    private ATR() {}

    /**
     * True range needs the previous close, so the first value appears at index {@code period}.
     */
    public static double[] calculate(List<Candle> candles, int period) {
        int n = candles.size();
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        if (period <= 0 || n < period + 1) {
            return result;
        }

        double[] tr = new double[n];
        for (int i = 1; i < n; i++) {
            Candle curr = candles.get(i);
            double prevClose = candles.get(i - 1).close();

            double highLow = curr.high() - curr.low();
            double highPrevClose = Math.abs(curr.high() - prevClose);
            double lowPrevClose = Math.abs(curr.low() - prevClose);

            tr[i] = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));
        }

        double sum = 0;
        for (int i = 1; i <= period; i++) {
            sum += tr[i];
        }
        result[period] = sum / period;

        for (int i = period + 1; i < n; i++) {
            result[i] = (result[i - 1] * (period - 1) + tr[i]) / period;
        }

        return result;
    }

    public static OptionalDouble latest(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < period + 1) {
            return OptionalDouble.empty();
        }
        return Indicators.last(calculate(candles, period));
    }
}
