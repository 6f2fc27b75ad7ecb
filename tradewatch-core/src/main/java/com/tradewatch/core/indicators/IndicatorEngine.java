package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Indicator access for one candle list with caching.
 * An engine is built per evaluation; repeated references to the same indicator
 * inside one strategy are computed once.
 */
public class IndicatorEngine {

    private final List<Candle> candles;
    private final String interval;
    private final Map<String, Object> cache = new ConcurrentHashMap<>();

    public IndicatorEngine(List<Candle> candles, String interval) {
        this.candles = candles != null ? candles : List.of();
        this.interval = interval;
    }

    public String getInterval() {
        return interval;
    }

    public List<Candle> getCandles() {
        return candles;
    }

    public int getBarCount() {
        return candles.size();
    }

    /**
     * Candle at index, or null if out of range.
     */
    public Candle getCandleAt(int barIndex) {
        if (barIndex < 0 || barIndex >= candles.size()) {
            return null;
        }
        return candles.get(barIndex);
    }

    @SuppressWarnings("unchecked")
    private <T> T cached(String key, Supplier<T> compute) {
        Object value = cache.get(key);
        if (value == null) {
            value = compute.get();
            cache.put(key, value);
        }
        return (T) value;
    }

    private static double at(double[] series, int barIndex) {
        return barIndex >= 0 && barIndex < series.length ? series[barIndex] : Double.NaN;
    }

    // ========== Moving averages / momentum ==========

    public double[] getSMA(int period) {
        return cached("sma:" + period, () -> Indicators.sma(candles, period));
    }

    public double getSMAAt(int period, int barIndex) {
        return at(getSMA(period), barIndex);
    }

    public double[] getEMA(int period) {
        return cached("ema:" + period, () -> Indicators.ema(candles, period));
    }

    public double getEMAAt(int period, int barIndex) {
        return at(getEMA(period), barIndex);
    }

    public double[] getRSI(int period) {
        return cached("rsi:" + period, () -> Indicators.rsi(candles, period));
    }

    public double getRSIAt(int period, int barIndex) {
        return at(getRSI(period), barIndex);
    }

    public double[] getATR(int period) {
        return cached("atr:" + period, () -> Indicators.atr(candles, period));
    }

    public double getATRAt(int period, int barIndex) {
        return at(getATR(period), barIndex);
    }

    // ========== MACD ==========

    public MACD.Result getMACD(int fast, int slow, int signal) {
        return cached("macd:" + fast + ":" + slow + ":" + signal,
            () -> Indicators.macd(candles, fast, slow, signal));
    }

    public double getMACDLineAt(int fast, int slow, int signal, int barIndex) {
        return at(getMACD(fast, slow, signal).line(), barIndex);
    }

    public double getMACDSignalAt(int fast, int slow, int signal, int barIndex) {
        return at(getMACD(fast, slow, signal).signal(), barIndex);
    }

    public double getMACDHistogramAt(int fast, int slow, int signal, int barIndex) {
        return at(getMACD(fast, slow, signal).histogram(), barIndex);
    }

    // ========== Bollinger Bands ==========

    public BollingerBands.Result getBollingerBands(int period, double stdDev) {
        return cached("bbands:" + period + ":" + stdDev,
            () -> Indicators.bollinger(candles, period, stdDev));
    }

    public double getBollingerUpperAt(int period, double stdDev, int barIndex) {
        return at(getBollingerBands(period, stdDev).upper(), barIndex);
    }

    public double getBollingerMiddleAt(int period, double stdDev, int barIndex) {
        return at(getBollingerBands(period, stdDev).middle(), barIndex);
    }

    public double getBollingerLowerAt(int period, double stdDev, int barIndex) {
        return at(getBollingerBands(period, stdDev).lower(), barIndex);
    }

    public double getBollingerWidthAt(int period, double stdDev, int barIndex) {
        return at(getBollingerBands(period, stdDev).width(), barIndex);
    }

    // ========== Stochastic ==========

    public Stochastic.Result getStochastic(int kPeriod, int dPeriod) {
        return cached("stoch:" + kPeriod + ":" + dPeriod,
            () -> Indicators.stochastic(candles, kPeriod, dPeriod));
    }

    public double getStochasticKAt(int kPeriod, int dPeriod, int barIndex) {
        return at(getStochastic(kPeriod, dPeriod).k(), barIndex);
    }

    public double getStochasticDAt(int kPeriod, int dPeriod, int barIndex) {
        return at(getStochastic(kPeriod, dPeriod).d(), barIndex);
    }

    // ========== Volume / range / patterns ==========

    public double[] getVWAP() {
        return cached("vwap", () -> Indicators.vwap(candles));
    }

    public double getVWAPAt(int barIndex) {
        return at(getVWAP(), barIndex);
    }

    public double getAvgVolumeAt(int period, int barIndex) {
        return at(cached("avgvol:" + period, () -> Indicators.averageVolume(candles, period)), barIndex);
    }

    public double getHighOfAt(int period, int barIndex) {
        return at(cached("highof:" + period, () -> Indicators.highOf(candles, period)), barIndex);
    }

    public double getLowOfAt(int period, int barIndex) {
        return at(cached("lowof:" + period, () -> Indicators.lowOf(candles, period)), barIndex);
    }

    public double getEngulfingAt(int barIndex) {
        return at(cached("engulfing", () -> Indicators.engulfing(candles)), barIndex);
    }
}
