package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.List;
import java.util.OptionalDouble;

/**
 * Volume aggregates.
 */
public final class VolumeIndicators {

    private VolumeIndicators() {}

    /**
     * Rolling average of base-asset volume.
     */
    public static double[] averageVolume(List<Candle> candles, int period) {
        return SMA.calculate(Indicators.volumes(candles), period);
    }

    public static OptionalDouble latestAverageVolume(List<Candle> candles, int period) {
        if (candles == null || period <= 0 || candles.size() < period) {
            return OptionalDouble.empty();
        }
        double sum = 0;
        for (int i = candles.size() - period; i < candles.size(); i++) {
            sum += candles.get(i).volume();
        }
        return OptionalDouble.of(sum / period);
    }
}
