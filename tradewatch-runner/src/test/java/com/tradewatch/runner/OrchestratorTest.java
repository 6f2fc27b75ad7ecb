package com.tradewatch.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradewatch.core.model.Trader;
import com.tradewatch.engine.sandbox.StrategySandbox;
import com.tradewatch.engine.screener.ParallelScreener;
import com.tradewatch.feed.FeedSettings;
import com.tradewatch.feed.HistoricalKlineLoader;
import com.tradewatch.feed.MarketDataClient;
import com.tradewatch.runner.config.TradeWatchConfig;
import com.tradewatch.runner.sync.Counter;
import com.tradewatch.runner.sync.EventType;
import com.tradewatch.runner.sync.SignalRecord;
import com.tradewatch.runner.traders.DirectoryTraderSource;
import com.tradewatch.runner.traders.TraderSource;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class OrchestratorTest {

    private static final long T0 = 1_700_000_040_000L;

    @TempDir
    Path tradersDir;

    private RecordingSink sink;
    private Orchestrator orchestrator;

    /** Feed and screener as configured, except the feed never opens a socket. */
    static class OfflineFactory implements ComponentFactory {
        @Override
        public MarketDataClient createFeed(Collection<String> symbols, Collection<String> intervals) {
            return new MarketDataClient(symbols, intervals, FeedSettings.defaults()) {
                @Override
                public void connect() {
                    // messages are injected by the test
                }
            };
        }

        @Override
        public ParallelScreener createScreener(StrategySandbox sandbox) {
            return new ParallelScreener(sandbox, 2, Duration.ofSeconds(2));
        }

        @Override
        public HistoricalKlineLoader createKlineLoader() {
            throw new UnsupportedOperationException("backfill is disabled in tests");
        }
    }

    static TradeWatchConfig testConfig(Path tradersDir) {
        TradeWatchConfig config = TradeWatchConfig.defaults();
        config.getMarketData().setSymbols(List.of("BTCUSDT", "ETHUSDT"));
        config.getMarketData().setBackfill(false);
        config.getScreener().setTickIntervalMs(600_000);
        config.getTraders().setReloadIntervalMs(600_000);
        config.getHealth().setCheckIntervalMs(600_000);
        config.getSync().setFlushIntervalMs(600_000);
        config.getSync().setHeartbeatIntervalMs(600_000);
        config.getTraders().setDirectory(tradersDir.toString());
        config.validate();
        return config;
    }

    static String kline(String symbol, String interval, long openTime, String close, boolean closed) {
        return """
            {"stream":"%s@kline_%s","data":{"e":"kline","E":%d,"s":"%s","k":{"t":%d,"T":%d,"s":"%s","i":"%s",\
            "o":"100.0","c":"%s","h":"110.0","l":"90.0","v":"5.5","n":12,"x":%s,"q":"550.0"}}}"""
            .formatted(symbol.toLowerCase(), interval, openTime, symbol, openTime, openTime + 59_999,
                symbol, interval, close, closed);
    }

    private void writeTrader(String id, String body) throws IOException {
        Files.writeString(tradersDir.resolve(id + ".yaml"), "id: " + id + "\n" + body);
    }

    @BeforeEach
    void setUp() throws IOException {
        writeTrader("breakout", "filterCode: close > 100\nrefreshInterval: 1m\n");
        sink = new RecordingSink();
        orchestrator = new Orchestrator(testConfig(tradersDir), new DirectoryTraderSource(tradersDir), sink,
            new ObjectMapper(), new OfflineFactory());
        orchestrator.start();
    }

    @AfterEach
    void tearDown() {
        orchestrator.stop();
    }

    @Nested
    @DisplayName("Ticks")
    class TickTests {

        @Test
        @DisplayName("A matching trader produces one signal, the repeat tick none")
        void tickCreatesSignal() {
            orchestrator.getFeed().handleMessage(kline("BTCUSDT", "1m", T0, "105.0", false));
            orchestrator.getFeed().handleMessage(kline("ETHUSDT", "1m", T0, "95.0", false));

            orchestrator.runTick();

            List<SignalRecord> pending = orchestrator.getSynchronizer().pendingSignals();
            assertEquals(1, pending.size());
            assertEquals("breakout", pending.get(0).traderId());
            assertEquals("BTCUSDT", pending.get(0).symbol());
            assertEquals(2, orchestrator.getSynchronizer().counter(Counter.EVALUATIONS));

            orchestrator.runTick();

            assertEquals(1, orchestrator.getSynchronizer().pendingSignals().size());
            assertEquals(2, orchestrator.status().ticks());
        }

        @Test
        @DisplayName("Paused orchestrator skips ticks until resumed")
        void pauseSkipsTicks() {
            orchestrator.getFeed().handleMessage(kline("BTCUSDT", "1m", T0, "105.0", false));

            orchestrator.pause();
            orchestrator.runTick();
            assertEquals(0, orchestrator.status().ticks());
            assertTrue(orchestrator.status().paused());

            orchestrator.resume();
            orchestrator.runTick();
            assertEquals(1, orchestrator.status().ticks());
            assertTrue(orchestrator.getSynchronizer().pendingEvents().stream()
                .anyMatch(e -> e.type() == EventType.SCREENING_PAUSED));
        }

        @Test
        @DisplayName("Candle closes keep advancing dedupe bars while paused")
        void closesAppliedWhilePaused() {
            orchestrator.getFeed().handleMessage(kline("BTCUSDT", "1m", T0, "105.0", false));
            orchestrator.runTick();

            orchestrator.pause();
            orchestrator.getFeed().handleMessage(kline("BTCUSDT", "1m", T0, "105.0", true));
            orchestrator.getFeed().handleMessage(kline("BTCUSDT", "1m", T0 + 60_000, "106.0", true));
            assertEquals(2, orchestrator.getLifecycle().pendingCloses());

            orchestrator.runTick();

            assertEquals(0, orchestrator.getLifecycle().pendingCloses());
            assertEquals(2, orchestrator.getLifecycle().entry("breakout", "BTCUSDT").orElseThrow()
                .getBarsSinceSignal());
        }

        @Test
        @DisplayName("A tick with no market data completes without signals")
        void emptyTick() {
            orchestrator.runTick();

            assertEquals(1, orchestrator.status().ticks());
            assertTrue(orchestrator.getSynchronizer().pendingSignals().isEmpty());
        }

        @Test
        @DisplayName("Flush writes queued signals and events to the sink")
        void flush() {
            orchestrator.getFeed().handleMessage(kline("BTCUSDT", "1m", T0, "105.0", false));
            orchestrator.runTick();

            orchestrator.flush();

            assertEquals(1, sink.signals.size());
            assertTrue(sink.events.stream().anyMatch(e -> e.type() == EventType.MACHINE_STARTED));
        }
    }

    @Nested
    @DisplayName("Reload")
    class ReloadTests {

        @Test
        @DisplayName("New timeframe extends the interval union and the subscriptions")
        void addedTraderExtendsIntervals() throws IOException {
            assertEquals(List.of("1m"), orchestrator.getIntervals());

            writeTrader("trend", "filterCode: close > SMA(20)\nrefreshInterval: 5m\nrequiredTimeframes: [1h]\n");
            Orchestrator.ReloadResult result = orchestrator.reloadTraders();

            assertEquals(1, result.added());
            assertTrue(result.intervalsChanged());
            assertEquals(List.of("1m", "5m", "1h"), orchestrator.getIntervals());
            assertTrue(orchestrator.getFeed().getIntervals().contains("1h"));
            assertNotNull(orchestrator.getFeed().buffer("BTCUSDT", "5m"));
        }

        @Test
        @DisplayName("Removed and changed traders are detected")
        void removedAndUpdated() throws IOException {
            writeTrader("other", "filterCode: close > 1\n");
            orchestrator.reloadTraders();

            Files.delete(tradersDir.resolve("breakout.yaml"));
            writeTrader("other", "filterCode: close > 2\nversion: 2\n");
            Orchestrator.ReloadResult result = orchestrator.reloadTraders();

            assertEquals(0, result.added());
            assertEquals(1, result.updated());
            assertEquals(1, result.removed());
            assertEquals(List.of("other"), List.copyOf(orchestrator.getTraders().keySet()));
        }

        @Test
        @DisplayName("Changing the refresh interval resets dedupe history")
        void intervalChangeResetsHistory() throws IOException {
            orchestrator.getFeed().handleMessage(kline("BTCUSDT", "1m", T0, "105.0", false));
            orchestrator.runTick();
            assertEquals("1m", orchestrator.getLifecycle().entry("breakout", "BTCUSDT").orElseThrow().getInterval());

            writeTrader("breakout", "filterCode: close > 100\nrefreshInterval: 15m\nversion: 2\n");
            Orchestrator.ReloadResult result = orchestrator.reloadTraders();

            assertEquals(1, result.updated());
            assertTrue(orchestrator.getLifecycle().entry("breakout", "BTCUSDT").isEmpty());
        }

        @Test
        @DisplayName("Source-only changes keep dedupe history")
        void sourceChangeKeepsHistory() throws IOException {
            orchestrator.getFeed().handleMessage(kline("BTCUSDT", "1m", T0, "105.0", false));
            orchestrator.runTick();

            writeTrader("breakout", "filterCode: close > 101\nrefreshInterval: 1m\nversion: 2\n");
            orchestrator.reloadTraders();

            assertTrue(orchestrator.getLifecycle().entry("breakout", "BTCUSDT").isPresent());
        }

        @Test
        @DisplayName("Compile errors are reported once per trader version")
        void invalidTraderReportedOnce() throws IOException {
            writeTrader("broken", "filterCode: close >\n");

            orchestrator.reloadTraders();
            orchestrator.reloadTraders();

            long invalidEvents = orchestrator.getSynchronizer().pendingEvents().stream()
                .filter(e -> e.type() == EventType.TRADER_INVALID)
                .count();
            assertEquals(1, invalidEvents);
            assertEquals(1, orchestrator.getSynchronizer().counter(Counter.COMPILE_ERRORS));
            assertEquals(1, orchestrator.status().invalidTraders());
        }

        @Test
        @DisplayName("Failed load keeps the current traders")
        void failedLoadKeepsTraders() {
            AtomicInteger calls = new AtomicInteger();
            TraderSource flaky = new TraderSource() {
                @Override
                public List<Trader> loadTraders() throws IOException {
                    if (calls.incrementAndGet() > 1) {
                        throw new IOException("collaborator unreachable");
                    }
                    return List.of(new Trader("t1", "T1", "close > 1", "1m"));
                }

                @Override
                public String describe() {
                    return "flaky";
                }
            };
            Orchestrator other = new Orchestrator(testConfig(tradersDir), flaky, new RecordingSink(),
                new ObjectMapper(), new OfflineFactory());
            other.start();
            try {
                Orchestrator.ReloadResult result = other.reloadTraders();

                assertFalse(result.loaded());
                assertEquals(List.of("t1"), List.copyOf(other.getTraders().keySet()));
            } finally {
                other.stop();
            }
        }
    }

    @Nested
    @DisplayName("Supervision")
    class SupervisionTests {

        private long restartEvents(String component) {
            return orchestrator.getSynchronizer().pendingEvents().stream()
                .filter(e -> e.type() == EventType.COMPONENT_RESTARTED)
                .filter(e -> e.detailsJson().contains("\"" + component + "\""))
                .count();
        }

        @Test
        @DisplayName("A feed that is down with no reconnect pending is rebuilt")
        void rebuildsFeed() {
            MarketDataClient before = orchestrator.getFeed();
            before.shutdown();

            orchestrator.supervise();

            assertNotSame(before, orchestrator.getFeed());
            assertEquals(List.of("1m"), List.copyOf(orchestrator.getFeed().getIntervals()));
            assertEquals(1, restartEvents("market_data"));
        }

        @Test
        @DisplayName("A terminated screener pool is replaced and ticks keep working")
        void rebuildsScreener() {
            ParallelScreener before = orchestrator.getScreener();
            before.shutdown();

            orchestrator.supervise();

            assertNotSame(before, orchestrator.getScreener());
            assertFalse(orchestrator.getScreener().isTerminated());
            assertEquals(1, restartEvents("screener"));

            orchestrator.getFeed().handleMessage(kline("BTCUSDT", "1m", T0, "105.0", false));
            orchestrator.runTick();
            assertEquals(1, orchestrator.getSynchronizer().pendingSignals().size());
        }

        @Test
        @DisplayName("A stopped synchronizer is restarted with its queue intact")
        void restartsSynchronizer() {
            orchestrator.getFeed().handleMessage(kline("BTCUSDT", "1m", T0, "105.0", false));
            orchestrator.runTick();
            sink.failing = true;
            orchestrator.getSynchronizer().stop();
            assertFalse(orchestrator.getSynchronizer().isRunning());
            sink.failing = false;

            orchestrator.supervise();

            assertTrue(orchestrator.getSynchronizer().isRunning());
            assertEquals(1, orchestrator.getSynchronizer().pendingSignals().size());
            assertEquals(1, restartEvents("synchronizer"));
        }

        @Test
        @DisplayName("Healthy components are left alone")
        void healthyComponentsKept() {
            ParallelScreener screener = orchestrator.getScreener();

            orchestrator.supervise();

            assertSame(screener, orchestrator.getScreener());
            assertEquals(0, restartEvents("screener"));
            assertEquals(0, restartEvents("synchronizer"));
        }
    }

    @Test
    @DisplayName("Interval union covers refresh intervals, timeframes and the default")
    void requiredIntervals() {
        Trader a = new Trader("a", "A", "close > 1", "15m");
        a.setRequiredTimeframes(List.of("1h", "4h"));
        Trader b = new Trader("b", "B", "close > 1", "5m");
        Trader c = new Trader("c", "C", "close > 1", "15m");

        List<String> intervals = Orchestrator.requiredIntervals(List.of(a, b, c), "1m");

        assertEquals(List.of("1m", "5m", "15m", "1h", "4h"), intervals);
    }
}
