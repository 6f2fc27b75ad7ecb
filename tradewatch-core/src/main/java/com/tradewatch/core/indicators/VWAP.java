package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.Arrays;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Volume Weighted Average Price indicator.
 * Formula: Sum(Typical Price * Volume) / Sum(Volume)
 * Typical Price = (High + Low + Close) / 3
 */
public final class VWAP {

    private VWAP() {} // Utility class

    /**
     * Cumulative VWAP from the start of the buffer.
     * Entries stay NaN until some volume has traded.
     */
    public static double[] calculate(List<Candle> candles) {
        int n = candles.size();
        double[] result = new double[n];
        Arrays.fill(result, Double.NaN);

        double cumulativeTPV = 0;
        double cumulativeVolume = 0;

        for (int i = 0; i < n; i++) {
            Candle c = candles.get(i);
            cumulativeTPV += c.typicalPrice() * c.volume();
            cumulativeVolume += c.volume();

            if (cumulativeVolume > 0) {
                result[i] = cumulativeTPV / cumulativeVolume;
            }
        }

        return result;
    }

    public static OptionalDouble latest(List<Candle> candles) {
        if (candles == null || candles.isEmpty()) {
            return OptionalDouble.empty();
        }
        return Indicators.last(calculate(candles));
    }
}
