package com.tradewatch.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradewatch.core.model.Interval;
import com.tradewatch.core.model.MarketSnapshot;
import com.tradewatch.core.model.Trader;
import com.tradewatch.engine.sandbox.CompiledStrategy;
import com.tradewatch.engine.sandbox.SandboxOutcome;
import com.tradewatch.engine.sandbox.StrategySandbox;
import com.tradewatch.engine.screener.ParallelScreener;
import com.tradewatch.engine.screener.ScreeningReport;
import com.tradewatch.engine.signal.Signal;
import com.tradewatch.engine.signal.SignalLifecycle;
import com.tradewatch.feed.ConnectionState;
import com.tradewatch.feed.FeedStats;
import com.tradewatch.feed.MarketDataClient;
import com.tradewatch.runner.api.RunnerControl;
import com.tradewatch.runner.config.TradeWatchConfig;
import com.tradewatch.runner.health.HealthMonitor;
import com.tradewatch.runner.health.HealthReport;
import com.tradewatch.runner.health.HealthStatus;
import com.tradewatch.runner.sync.Counter;
import com.tradewatch.runner.sync.EventType;
import com.tradewatch.runner.sync.PersistenceSink;
import com.tradewatch.runner.sync.Severity;
import com.tradewatch.runner.sync.StateSynchronizer;
import com.tradewatch.runner.traders.TraderSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Wires the feed, sandbox, screener, signal lifecycle and synchronizer together and drives them.
 *
 * Ticks and trader reloads share one single-threaded scheduler, so they never overlap and signal
 * history is only touched from that thread. Supervision, metric snapshots and the STATUS log line
 * run on a second scheduler. No scheduled loop lets an exception escape.
 */
public class Orchestrator implements RunnerControl {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);

    public record ReloadResult(boolean loaded, int added, int updated, int removed, boolean intervalsChanged) {
        public boolean changed() {
            return added + updated + removed > 0;
        }

        static ReloadResult failed() {
            return new ReloadResult(false, 0, 0, 0, false);
        }
    }

    private final TradeWatchConfig config;
    private final TraderSource traderSource;
    private final ComponentFactory factory;

    private final StrategySandbox sandbox;
    private final SignalLifecycle lifecycle;
    private final StateSynchronizer synchronizer;
    private final HealthMonitor health;

    private volatile MarketDataClient feed;
    private volatile ParallelScreener screener;

    // id -> enabled trader, replaced wholesale on reload
    private volatile Map<String, Trader> traders = Map.of();
    private volatile int loadedTraders;
    private volatile List<String> intervals = List.of();
    // traderId -> version whose compile error was already reported
    private final Map<String, Integer> reportedInvalid = new HashMap<>();
    private final Object reloadLock = new Object();

    private ScheduledExecutorService tickScheduler;
    private ScheduledExecutorService controlScheduler;

    private final AtomicBoolean tickInProgress = new AtomicBoolean();
    private final AtomicLong ticks = new AtomicLong();
    private volatile long lastTickAt;
    private volatile long lastTickMs;
    private volatile int lastAbandoned;
    private volatile boolean running;
    private volatile boolean paused;
    private volatile long startedAt;

    public Orchestrator(TradeWatchConfig config, TraderSource traderSource, PersistenceSink sink, ObjectMapper mapper) {
        this(config, traderSource, sink, mapper, ComponentFactory.fromConfig(config));
    }

    public Orchestrator(TradeWatchConfig config, TraderSource traderSource, PersistenceSink sink, ObjectMapper mapper,
                        ComponentFactory factory) {
        this.config = config;
        this.traderSource = traderSource;
        this.factory = factory;
        this.sandbox = new StrategySandbox(config.toSandboxSettings());
        this.lifecycle = new SignalLifecycle(config.getSignals().getDedupeBars());
        this.synchronizer = new StateSynchronizer(config.getSourceId(), config.toSyncSettings(), sink, mapper);
        this.health = new HealthMonitor(Duration.ofMillis(config.getHealth().getCheckIntervalMs()));
    }

    // ========== Lifecycle ==========

    public synchronized void start() {
        if (running) {
            return;
        }
        startedAt = System.currentTimeMillis();
        log.info("Starting TradeWatch (source {})", config.getSourceId());

        reloadTraders();

        feed = createFeed(config.getMarketData().getSymbols(), intervals);
        screener = factory.createScreener(sandbox);
        synchronizer.start();

        health.registerComponent("market_data", this::marketDataHealth);
        health.registerComponent("persistence", this::persistenceHealth);
        health.registerComponent("workers", this::workersHealth);
        health.addUnhealthyListener(report -> synchronizer.enqueueEvent(EventType.HEALTH_CHECK_FAILED, Severity.ERROR,
            "Health check failed", Map.of("components", report.components(), "error_rate", report.errorRatePerMinute())));
        health.start();

        running = true;
        scheduleLoops();

        synchronizer.enqueueEvent(EventType.MACHINE_STARTED, Severity.INFO, "TradeWatch started",
            Map.of("traders", traders.size(), "symbols", feed.getSymbols().size(), "intervals", intervals));
        log.info("TradeWatch started: {} traders, {} symbols, intervals {}", traders.size(),
            feed.getSymbols().size(), intervals);
    }

    private void scheduleLoops() {
        tickScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "orchestrator-tick");
            t.setDaemon(true);
            return t;
        });
        controlScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "orchestrator-control");
            t.setDaemon(true);
            return t;
        });

        long tickMs = config.getScreener().getTickIntervalMs();
        tickScheduler.scheduleWithFixedDelay(this::runTick, tickMs, tickMs, TimeUnit.MILLISECONDS);

        long reloadMs = config.getTraders().getReloadIntervalMs();
        tickScheduler.scheduleWithFixedDelay(() -> {
            try {
                reloadTraders();
            } catch (RuntimeException e) {
                log.error("Trader reload failed", e);
            }
        }, reloadMs, reloadMs, TimeUnit.MILLISECONDS);

        long checkMs = config.getHealth().getCheckIntervalMs();
        controlScheduler.scheduleWithFixedDelay(() -> {
            try {
                supervise();
            } catch (RuntimeException e) {
                log.error("Supervision failed", e);
            }
        }, checkMs, checkMs, TimeUnit.MILLISECONDS);

        long metricsMs = config.getSync().getFlushIntervalMs();
        controlScheduler.scheduleAtFixedRate(synchronizer::enqueueMetricSnapshot, metricsMs, metricsMs, TimeUnit.MILLISECONDS);

        controlScheduler.scheduleAtFixedRate(this::logStatus, 1, 5, TimeUnit.MINUTES);
    }

    /**
     * Stop loops, feed and screener, then flush the synchronizer one last time.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        log.info("Stopping TradeWatch...");

        shutdownScheduler(controlScheduler);
        shutdownScheduler(tickScheduler);
        health.stop();
        if (feed != null) {
            feed.shutdown();
        }
        if (screener != null) {
            screener.shutdown();
        }
        synchronizer.enqueueEvent(EventType.MACHINE_STOPPED, Severity.INFO, "TradeWatch stopped",
            Map.of("ticks", ticks.get(), "uptime_ms", System.currentTimeMillis() - startedAt));
        synchronizer.stop();
        sandbox.shutdown();
        log.info("TradeWatch stopped after {} ticks", ticks.get());
    }

    private void shutdownScheduler(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(config.getScreener().getTickBudgetMs() + 1000, TimeUnit.MILLISECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isRunning() {
        return running;
    }

    // ========== Tick ==========

    /**
     * One screening pass: snapshot, screen due traders, classify matches, queue new signals.
     * Skipped while paused or while another tick is still running. Never throws.
     */
    public void runTick() {
        if (!running) {
            return;
        }
        if (paused) {
            // bar counts keep advancing so dedupe windows stay accurate across a pause
            lifecycle.applyPendingCloses();
            return;
        }
        if (!tickInProgress.compareAndSet(false, true)) {
            log.debug("Tick skipped, previous tick still running");
            return;
        }
        long start = System.nanoTime();
        try {
            long now = System.currentTimeMillis();
            Map<String, Trader> current = traders;
            Map<String, MarketSnapshot> snapshots = feed.snapshot();

            ScreeningReport report = screener.screen(new ArrayList<>(current.values()), snapshots, now);
            SignalLifecycle.Outcome outcome = lifecycle.process(report, current, snapshots, now);

            for (Signal signal : outcome.created()) {
                synchronizer.enqueueSignal(signal);
            }
            if (!outcome.created().isEmpty()) {
                synchronizer.enqueueEvent(EventType.SIGNAL_CREATED, Severity.INFO,
                    outcome.created().size() + " new signals",
                    Map.of("count", outcome.created().size(),
                        "signals", outcome.created().stream().map(Signal::id).toList()));
            }

            synchronizer.increment(Counter.TICKS, 1);
            synchronizer.increment(Counter.EVALUATIONS, report.totalEvaluated());
            synchronizer.increment(Counter.RUNTIME_ERRORS, report.totalRuntimeErrors());
            synchronizer.increment(Counter.TIMEOUTS, report.totalTimeouts());
            synchronizer.increment(Counter.ABANDONED_TASKS, report.abandonedCount());
            if (report.totalRuntimeErrors() > 0) {
                health.recordError("screener", report.totalRuntimeErrors() + " runtime errors in tick");
            }
            lastAbandoned = report.abandonedCount();

            ticks.incrementAndGet();
            lastTickAt = now;
            if (report.dueTraders() > 0) {
                log.debug("Tick: {} due traders, {} evaluations, {} matches, {} new, {} continuing in {} ms",
                    report.dueTraders(), report.totalEvaluated(), report.totalMatches(),
                    outcome.created().size(), outcome.continuing(), report.duration().toMillis());
            }
        } catch (RuntimeException e) {
            log.error("Tick failed", e);
            health.recordError("tick", String.valueOf(e.getMessage()));
        } finally {
            lastTickMs = (System.nanoTime() - start) / 1_000_000;
            tickInProgress.set(false);
        }
    }

    // ========== Traders ==========

    /**
     * Reload traders from the source and apply the difference. A failed load keeps the current set.
     */
    public ReloadResult reloadTraders() {
        synchronized (reloadLock) {
            return applyTraders();
        }
    }

    private ReloadResult applyTraders() {
        List<Trader> loaded;
        try {
            loaded = traderSource.loadTraders();
        } catch (IOException e) {
            log.warn("Failed to load traders from {}, keeping {} current traders: {}",
                traderSource.describe(), traders.size(), e.getMessage());
            health.recordError("traders", e.getMessage());
            return ReloadResult.failed();
        }

        Map<String, Trader> next = new LinkedHashMap<>();
        for (Trader trader : loaded) {
            if (trader.isEnabled()) {
                next.put(trader.getId(), trader);
            }
        }
        Map<String, Trader> previous = traders;

        int removed = 0;
        for (String id : previous.keySet()) {
            if (!next.containsKey(id)) {
                retire(id);
                removed++;
            }
        }

        int added = 0;
        int updated = 0;
        for (Trader trader : next.values()) {
            Trader old = previous.get(trader.getId());
            if (old == null) {
                added++;
            } else if (trader.differsFrom(old)) {
                sandbox.evict(trader.getId());
                if (screener != null) {
                    screener.forget(trader.getId());
                }
                if (!trader.primaryInterval().equals(old.primaryInterval())) {
                    // dedupe entries count bars of the old interval
                    lifecycle.retire(trader.getId());
                }
                updated++;
            } else {
                continue;
            }
            compileAndReport(trader);
        }

        traders = Map.copyOf(next);
        loadedTraders = loaded.size();

        List<String> required = computeIntervals(next.values());
        boolean intervalsChanged = !required.equals(intervals);
        intervals = required;
        if (intervalsChanged && feed != null) {
            MarketDataClient.SubscriptionChange change =
                feed.updateSubscriptions(config.getMarketData().getSymbols(), required);
            log.info("Intervals now {} (+{} / -{} streams)", required,
                change.subscribed().size(), change.unsubscribed().size());
        }

        ReloadResult result = new ReloadResult(true, added, updated, removed, intervalsChanged);
        if (result.changed()) {
            log.info("Traders synced from {}: +{} ~{} -{} ({} enabled)", traderSource.describe(),
                added, updated, removed, next.size());
            synchronizer.enqueueEvent(EventType.CONFIG_SYNCED, Severity.INFO, "Traders synced",
                Map.of("added", added, "updated", updated, "removed", removed, "traders", next.size()));
        }
        return result;
    }

    private void retire(String traderId) {
        sandbox.evict(traderId);
        if (screener != null) {
            screener.forget(traderId);
        }
        lifecycle.retire(traderId);
        reportedInvalid.remove(traderId);
        log.info("Retired trader {}", traderId);
    }

    private void compileAndReport(Trader trader) {
        SandboxOutcome<CompiledStrategy> outcome = sandbox.compile(trader);
        if (outcome instanceof SandboxOutcome.CompileFailure<CompiledStrategy> failure) {
            Integer reported = reportedInvalid.put(trader.getId(), trader.getVersion());
            if (reported == null || reported != trader.getVersion()) {
                synchronizer.increment(Counter.COMPILE_ERRORS, 1);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("trader_id", trader.getId());
                details.put("version", trader.getVersion());
                details.put("phase", failure.phase());
                details.put("error", failure.message());
                details.put("position", failure.position());
                synchronizer.enqueueEvent(EventType.TRADER_INVALID, Severity.WARNING,
                    "Trader " + trader.getId() + " failed to compile", details);
            }
        } else {
            reportedInvalid.remove(trader.getId());
        }
    }

    private List<String> computeIntervals(Collection<Trader> active) {
        Set<String> all = new LinkedHashSet<>(requiredIntervals(active, config.getMarketData().getDefaultInterval()));
        for (Trader trader : active) {
            SandboxOutcome<CompiledStrategy> compiled = sandbox.compile(trader);
            if (compiled instanceof SandboxOutcome.Success<CompiledStrategy> ok) {
                all.addAll(ok.value().referencedIntervals());
            }
        }
        return sortIntervals(all);
    }

    /**
     * Union of every trader's refresh interval and declared timeframes plus the default interval,
     * shortest first.
     */
    public static List<String> requiredIntervals(Collection<Trader> traders, String defaultInterval) {
        Set<String> all = new LinkedHashSet<>();
        all.add(defaultInterval);
        for (Trader trader : traders) {
            all.addAll(trader.allIntervals());
        }
        return sortIntervals(all);
    }

    private static List<String> sortIntervals(Set<String> intervals) {
        List<String> sorted = new ArrayList<>();
        for (String interval : intervals) {
            if (Interval.isValid(interval)) {
                sorted.add(interval);
            } else {
                log.warn("Ignoring unsupported interval '{}'", interval);
            }
        }
        sorted.sort(Comparator.comparingLong(Interval::toMillis));
        return sorted;
    }

    // ========== Components ==========

    private MarketDataClient createFeed(Collection<String> symbols, Collection<String> feedIntervals) {
        MarketDataClient client = factory.createFeed(symbols, feedIntervals);
        client.addCandleCloseListener((symbol, interval, candle) ->
            lifecycle.onCandleClosed(symbol, interval, candle.openTime()));

        AtomicReference<ConnectionState> previous = new AtomicReference<>(ConnectionState.DISCONNECTED);
        client.addStateListener(state -> {
            ConnectionState before = previous.getAndSet(state);
            if (state == ConnectionState.CONNECTED && before != ConnectionState.DEGRADED) {
                synchronizer.enqueueEvent(EventType.WEBSOCKET_CONNECTED, Severity.INFO, "Market data connected",
                    Map.of("symbols", client.getSymbols().size(), "intervals", client.getIntervals()));
            } else if (state == ConnectionState.DISCONNECTED && before != ConnectionState.DISCONNECTED) {
                synchronizer.enqueueEvent(EventType.WEBSOCKET_DISCONNECTED, Severity.WARNING, "Market data disconnected");
                health.recordError("market_data", "Stream disconnected");
            }
        });

        if (config.getMarketData().isBackfill()) {
            int pairs = client.backfill(factory.createKlineLoader(), config.getMarketData().getBackfillLimit());
            log.info("Backfilled {} symbol/interval pairs", pairs);
        }
        client.connect();
        return client;
    }

    /**
     * Replace components that have stopped on their own.
     */
    void supervise() {
        if (!running) {
            return;
        }
        MarketDataClient currentFeed = feed;
        if (currentFeed.getState() == ConnectionState.DISCONNECTED && !currentFeed.isReconnectPending()) {
            log.warn("Market data client is down with no reconnect pending, rebuilding it");
            currentFeed.shutdown();
            feed = createFeed(config.getMarketData().getSymbols(), intervals);
            componentRestarted("market_data");
        }
        if (screener.isTerminated()) {
            log.warn("Screener pool terminated, rebuilding it");
            screener = factory.createScreener(sandbox);
            componentRestarted("screener");
        }
        if (!synchronizer.isRunning()) {
            log.warn("State synchronizer stopped, restarting it");
            synchronizer.start();
            componentRestarted("synchronizer");
        }
    }

    private void componentRestarted(String component) {
        synchronizer.enqueueEvent(EventType.COMPONENT_RESTARTED, Severity.WARNING,
            "Restarted " + component, Map.of("component", component));
        health.recordError(component, "Component restarted");
    }

    // ========== Health ==========

    private HealthStatus marketDataHealth() {
        ConnectionState state = feed.getState();
        if (state == ConnectionState.CONNECTED) {
            return HealthStatus.HEALTHY;
        }
        return state == ConnectionState.DISCONNECTED ? HealthStatus.UNHEALTHY : HealthStatus.DEGRADED;
    }

    private HealthStatus persistenceHealth() {
        if (!synchronizer.isRunning()) {
            return HealthStatus.UNHEALTHY;
        }
        return synchronizer.isDegraded() ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
    }

    private HealthStatus workersHealth() {
        if (screener.isTerminated()) {
            return HealthStatus.UNHEALTHY;
        }
        return lastAbandoned > 0 ? HealthStatus.DEGRADED : HealthStatus.HEALTHY;
    }

    private void logStatus() {
        try {
            OrchestratorStatus s = status();
            long uptimeMin = (System.currentTimeMillis() - startedAt) / 60_000;
            log.info("STATUS | uptime={}m | paused={} | traders={} | feed={} | msgs={} | ticks={} | lastTick={}ms | signalQueue={} | failures={}",
                uptimeMin, s.paused(), s.enabledTraders(), s.feedState(), s.feed().messagesReceived(), s.ticks(),
                s.lastTickMs(), s.sync().signalQueueDepth(), s.sync().consecutiveFailures());
        } catch (RuntimeException e) {
            log.debug("Status heartbeat error: {}", e.getMessage());
        }
    }

    // ========== Control ==========

    @Override
    public void pause() {
        if (!paused) {
            paused = true;
            log.info("Screening paused");
            synchronizer.enqueueEvent(EventType.SCREENING_PAUSED, Severity.INFO, "Screening paused");
        }
    }

    @Override
    public void resume() {
        if (paused) {
            paused = false;
            log.info("Screening resumed");
            synchronizer.enqueueEvent(EventType.SCREENING_RESUMED, Severity.INFO, "Screening resumed");
        }
    }

    public boolean isPaused() {
        return paused;
    }

    @Override
    public StateSynchronizer.FlushResult flush() {
        return synchronizer.flushNow();
    }

    @Override
    public HealthReport health() {
        return health.latest();
    }

    @Override
    public OrchestratorStatus status() {
        MarketDataClient currentFeed = feed;
        Map<String, Trader> current = traders;
        int invalid = 0;
        for (String id : current.keySet()) {
            if (sandbox.isInvalid(id)) {
                invalid++;
            }
        }
        return new OrchestratorStatus(running, paused, loadedTraders, current.size(), invalid, intervals,
            currentFeed != null ? new ArrayList<>(currentFeed.getSymbols()) : List.of(),
            currentFeed != null ? currentFeed.getState() : ConnectionState.DISCONNECTED,
            currentFeed != null ? currentFeed.stats() : new FeedStats(0, 0, 0, 0, 0, 0),
            screener != null ? screener.stats() : null,
            synchronizer.stats(), ticks.get(), lastTickAt, lastTickMs, lifecycle.size());
    }

    public StrategySandbox getSandbox() {
        return sandbox;
    }

    public StateSynchronizer getSynchronizer() {
        return synchronizer;
    }

    public ParallelScreener getScreener() {
        return screener;
    }

    public SignalLifecycle getLifecycle() {
        return lifecycle;
    }

    public MarketDataClient getFeed() {
        return feed;
    }

    public Map<String, Trader> getTraders() {
        return traders;
    }

    public List<String> getIntervals() {
        return intervals;
    }
}
