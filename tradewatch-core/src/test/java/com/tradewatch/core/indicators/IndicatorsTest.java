package com.tradewatch.core.indicators;

import com.tradewatch.core.model.Candle;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;

import static org.junit.jupiter.api.Assertions.*;

class IndicatorsTest {

    private static final double EPS = 1e-9;

    private static Candle candle(int i, double close) {
        return new Candle(i * 60_000L, close, close + 1, close - 1, close, 100);
    }

    private static List<Candle> closes(double... values) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            candles.add(candle(i, values[i]));
        }
        return candles;
    }

    private static List<Candle> rising(int count) {
        List<Candle> candles = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            candles.add(candle(i, 100 + i));
        }
        return candles;
    }

    @Nested
    @DisplayName("Latest value is absent during warmup")
    class WarmupTests {

        @Test
        @DisplayName("RSI needs period + 1 candles")
        void rsiNeedsPeriodPlusOne() {
            assertTrue(RSI.latest(rising(14), 14).isEmpty());
            assertTrue(RSI.latest(rising(15), 14).isPresent());
        }

        @Test
        @DisplayName("MACD needs slow + signal - 1 candles")
        void macdWarmup() {
            assertTrue(MACD.latest(rising(33), 12, 26, 9).isEmpty());
            assertTrue(MACD.latest(rising(34), 12, 26, 9).isPresent());
        }

        @Test
        @DisplayName("Short, null and invalid inputs give empty values, not exceptions")
        void shortInputs() {
            assertTrue(SMA.latest(rising(2), 3).isEmpty());
            assertTrue(SMA.latest(null, 3).isEmpty());
            assertTrue(SMA.latest(rising(10), 0).isEmpty());
            assertTrue(EMA.latest(List.of(), 5).isEmpty());
            assertTrue(ATR.latest(rising(14), 14).isEmpty());
            assertTrue(BollingerBands.latest(rising(19), 20, 2).isEmpty());
            assertTrue(Stochastic.latest(rising(15), 14, 3).isEmpty());
            assertTrue(VWAP.latest(List.of()).isEmpty());
            assertTrue(VolumeIndicators.latestAverageVolume(rising(4), 5).isEmpty());
            assertTrue(RangeFunctions.latestHighOf(rising(4), 5).isEmpty());
            assertTrue(CandlePatterns.latestEngulfing(rising(1)).isEmpty());
        }

        @Test
        @DisplayName("Series mark warmup bars as NaN")
        void seriesWarmupIsNaN() {
            double[] rsi = Indicators.rsi(rising(20), 14);

            assertEquals(20, rsi.length);
            assertEquals(14, Indicators.warmupLength(rsi));
            assertTrue(Double.isNaN(rsi[13]));
            assertFalse(Double.isNaN(rsi[14]));
        }
    }

    @Nested
    @DisplayName("Known values")
    class KnownValueTests {

        @Test
        @DisplayName("SMA and EMA of 1..5")
        void smaAndEma() {
            List<Candle> candles = closes(1, 2, 3, 4, 5);

            double[] sma = SMA.calculate(candles, 3);
            assertTrue(Double.isNaN(sma[1]));
            assertEquals(2.0, sma[2], EPS);
            assertEquals(4.0, sma[4], EPS);

            double[] ema = EMA.calculate(candles, 3);
            assertEquals(2.0, ema[2], EPS);
            assertEquals(3.0, ema[3], EPS);
            assertEquals(4.0, ema[4], EPS);
        }

        @Test
        @DisplayName("RSI is 100 when prices only rise")
        void rsiAllGains() {
            assertEquals(100.0, RSI.latest(rising(30), 14).getAsDouble(), EPS);
        }

        @Test
        @DisplayName("RSI is 50 for alternating equal moves")
        void rsiBalanced() {
            double[] values = new double[15];
            for (int i = 0; i < values.length; i++) {
                values[i] = i % 2 == 0 ? 100 : 101;
            }
            // 7 gains and 7 losses of 1.0 over 14 changes
            assertEquals(50.0, RSI.latest(closes(values), 14).getAsDouble(), EPS);
        }

        @Test
        @DisplayName("Bollinger bands collapse on flat prices")
        void bollingerFlat() {
            double[] values = new double[20];
            java.util.Arrays.fill(values, 50);

            Optional<BollingerBands.Value> bb = BollingerBands.latest(closes(values), 20, 2);

            assertTrue(bb.isPresent());
            assertEquals(50.0, bb.get().upper(), EPS);
            assertEquals(50.0, bb.get().lower(), EPS);
            assertEquals(0.0, bb.get().width(), EPS);
        }

        @Test
        @DisplayName("ATR equals a constant true range")
        void atrConstantRange() {
            double[] values = new double[20];
            java.util.Arrays.fill(values, 10);

            assertEquals(2.0, ATR.latest(closes(values), 14).getAsDouble(), EPS);
        }

        @Test
        @DisplayName("Stochastic is 50 when the range is zero")
        void stochasticZeroRange() {
            List<Candle> candles = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                candles.add(new Candle(i, 10, 10, 10, 10, 1));
            }

            Stochastic.Value value = Stochastic.latest(candles, 14, 3).orElseThrow();
            assertEquals(50.0, value.k(), EPS);
            assertEquals(50.0, value.d(), EPS);
        }

        @Test
        @DisplayName("VWAP weights typical price by volume")
        void vwap() {
            List<Candle> candles = List.of(
                new Candle(0, 10, 10, 10, 10, 1),
                new Candle(1, 20, 20, 20, 20, 3)
            );

            assertEquals(17.5, VWAP.latest(candles).getAsDouble(), EPS);
        }

        @Test
        @DisplayName("Volume average and range extremes")
        void volumeAndRange() {
            List<Candle> candles = List.of(
                new Candle(0, 10, 12, 9, 11, 100),
                new Candle(1, 11, 15, 10, 14, 200),
                new Candle(2, 14, 14, 8, 9, 300)
            );

            assertEquals(200.0, VolumeIndicators.latestAverageVolume(candles, 3).getAsDouble(), EPS);
            assertEquals(15.0, RangeFunctions.latestHighOf(candles, 3).getAsDouble(), EPS);
            assertEquals(8.0, RangeFunctions.latestLowOf(candles, 2).getAsDouble(), EPS);
        }

        @Test
        @DisplayName("Engulfing detects both directions")
        void engulfing() {
            Candle bearish = new Candle(0, 10, 10.2, 8.8, 9, 1);
            Candle bullishEngulf = new Candle(1, 8.9, 10.6, 8.8, 10.5, 1);
            Candle bullish = new Candle(0, 9, 10.2, 8.8, 10, 1);
            Candle bearishEngulf = new Candle(1, 10.1, 10.2, 8.5, 8.7, 1);

            assertEquals(OptionalDouble.of(1.0), CandlePatterns.latestEngulfing(List.of(bearish, bullishEngulf)));
            assertEquals(OptionalDouble.of(-1.0), CandlePatterns.latestEngulfing(List.of(bullish, bearishEngulf)));
            assertEquals(OptionalDouble.of(0.0), CandlePatterns.latestEngulfing(List.of(bullish, bullishEngulf)));
        }

        @Test
        @DisplayName("MACD histogram is line minus signal")
        void macdHistogram() {
            MACD.Value value = MACD.latest(rising(60), 12, 26, 9).orElseThrow();

            assertEquals(value.line() - value.signal(), value.histogram(), EPS);
            assertTrue(value.line() > 0, "fast EMA leads on a rising series");
        }
    }

    @Nested
    @DisplayName("IndicatorEngine")
    class EngineTests {

        @Test
        @DisplayName("Caches series per key and bounds-checks indices")
        void cachesSeries() {
            IndicatorEngine engine = new IndicatorEngine(rising(30), "1m");

            assertSame(engine.getRSI(14), engine.getRSI(14));
            assertEquals(100.0, engine.getRSIAt(14, 29), EPS);
            assertTrue(Double.isNaN(engine.getRSIAt(14, 30)));
            assertTrue(Double.isNaN(engine.getRSIAt(14, -1)));
            assertNull(engine.getCandleAt(-1));
        }
    }
}
