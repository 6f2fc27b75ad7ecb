package com.tradewatch.engine.screener;

import com.tradewatch.core.model.Candle;
import com.tradewatch.core.model.MarketSnapshot;
import com.tradewatch.core.model.Trader;
import com.tradewatch.engine.sandbox.EvaluationResult;
import com.tradewatch.engine.sandbox.SandboxOutcome;
import com.tradewatch.engine.sandbox.SandboxSettings;
import com.tradewatch.engine.sandbox.StrategySandbox;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ParallelScreenerTest {

    private static final long NOW = 1_700_000_000_000L;

    private StrategySandbox sandbox;
    private ParallelScreener screener;

    @BeforeEach
    void setUp() {
        sandbox = new StrategySandbox(SandboxSettings.defaults());
        screener = new ParallelScreener(sandbox, 4, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        screener.shutdown();
        sandbox.shutdown();
    }

    private static Map<String, MarketSnapshot> snapshots(int symbols) {
        Map<String, MarketSnapshot> map = new LinkedHashMap<>();
        for (int s = 0; s < symbols; s++) {
            String symbol = "SYM" + s + "USDT";
            List<Candle> candles = List.of(
                new Candle(0, 10, 11, 9, 10, 100),
                new Candle(60_000, 10, 12, 9, 11 + s, 100)
            );
            map.put(symbol, new MarketSnapshot(symbol, null, Map.of("1m", candles)));
        }
        return map;
    }

    @Nested
    @DisplayName("Scheduling")
    class SchedulingTests {

        @Test
        @DisplayName("Trader runs once per refresh interval")
        void dueOncePerInterval() {
            Trader trader = new Trader("t1", "Any", "close > 0", "1m");
            Map<String, MarketSnapshot> data = snapshots(3);

            ScreeningReport first = screener.screen(List.of(trader), data, NOW);
            ScreeningReport again = screener.screen(List.of(trader), data, NOW + 30_000);
            ScreeningReport later = screener.screen(List.of(trader), data, NOW + 60_000);

            assertEquals(1, first.dueTraders());
            assertEquals(3, first.totalMatches());
            assertEquals(3, first.totalEvaluated());
            assertEquals(0, again.dueTraders());
            assertEquals(1, later.dueTraders());
        }

        @Test
        @DisplayName("Invalid and disabled traders are skipped")
        void skipsInvalidAndDisabled() {
            Trader broken = new Trader("bad", "Broken", "RSI(14) <", "1m");
            Trader disabled = new Trader("off", "Off", "close > 0", "1m");
            disabled.setEnabled(false);

            ScreeningReport report = screener.screen(List.of(broken, disabled), snapshots(2), NOW);

            assertEquals(0, report.dueTraders());
            assertEquals(1, report.skippedInvalid());
        }

        @Test
        @DisplayName("Max signals per run caps matches")
        void capsMatches() {
            Trader trader = new Trader("t1", "Any", "close > 0", "1m");
            trader.setMaxSignalsPerRun(2);

            ScreeningReport report = screener.screen(List.of(trader), snapshots(5), NOW);

            assertEquals(2, report.totalMatches());
            assertEquals(5, report.totalEvaluated());
        }

        @Test
        @DisplayName("Forget makes a trader due again")
        void forget() {
            Trader trader = new Trader("t1", "Any", "close > 0", "1h");
            screener.screen(List.of(trader), snapshots(1), NOW);
            assertFalse(screener.isDue(trader, NOW + 1));

            screener.forget("t1");

            assertTrue(screener.isDue(trader, NOW + 1));
        }

        @Test
        @DisplayName("Results do not depend on pool size")
        void poolSizeIndependent() {
            ParallelScreener single = new ParallelScreener(sandbox, 1, Duration.ofSeconds(5));
            try {
                List<Trader> traders = List.of(
                    new Trader("a", "A", "close > 11", "1m"),
                    new Trader("b", "B", "close > 12", "1m"));

                ScreeningReport wide = screener.screen(traders, snapshots(4), NOW);
                ScreeningReport narrow = single.screen(traders, snapshots(4), NOW);

                assertEquals(wide.totalMatches(), narrow.totalMatches());
                assertEquals(5, narrow.totalMatches());
            } finally {
                single.shutdown();
            }
        }
    }

    @Nested
    @DisplayName("Tick budget")
    class BudgetTests {

        @Test
        @DisplayName("Slow traders are abandoned and retried next tick")
        void abandonsSlowTrader() {
            StrategySandbox slow = new StrategySandbox(SandboxSettings.defaults()) {
                @Override
                public SandboxOutcome<EvaluationResult> evaluate(Trader trader, MarketSnapshot snapshot) {
                    try {
                        Thread.sleep(5_000);
                    } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        return new SandboxOutcome.RuntimeFailure<>("interrupted");
                    }
                    return super.evaluate(trader, snapshot);
                }
            };
            ParallelScreener budgeted = new ParallelScreener(slow, 2, Duration.ofMillis(200));
            try {
                Trader trader = new Trader("slow", "Slow", "close > 0", "1m");
                long start = System.nanoTime();

                ScreeningReport report = budgeted.screen(List.of(trader), snapshots(2), NOW);

                long elapsedMs = (System.nanoTime() - start) / 1_000_000;
                assertTrue(elapsedMs < 2_000, "tick took " + elapsedMs + " ms");
                assertEquals(1, report.abandonedCount());
                assertTrue(report.results().get(0).abandoned());
                assertTrue(budgeted.isDue(trader, NOW), "abandoned trader stays due");
                assertEquals(1, budgeted.stats().abandonedTasks());
            } finally {
                budgeted.shutdown();
                slow.shutdown();
            }
        }
    }

    @Test
    @DisplayName("Shutdown terminates the pool")
    void shutdown() {
        assertFalse(screener.isTerminated());
        screener.shutdown();
        assertTrue(screener.isTerminated());
        assertEquals(4, screener.stats().workers());
    }
}
