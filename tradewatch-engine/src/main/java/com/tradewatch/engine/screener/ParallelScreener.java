package com.tradewatch.engine.screener;

import com.tradewatch.core.model.Interval;
import com.tradewatch.core.model.MarketSnapshot;
import com.tradewatch.core.model.Trader;
import com.tradewatch.engine.sandbox.EvaluationResult;
import com.tradewatch.engine.sandbox.SandboxOutcome;
import com.tradewatch.engine.sandbox.StrategySandbox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs due traders against all symbols on a bounded worker pool.
 *
 * One task per due trader evaluates every symbol through the sandbox. The tick waits at most
 * the tick budget; unfinished tasks are cancelled and retried on the next tick because their
 * last-run time is only advanced when they complete.
 */
public class ParallelScreener {

    private static final Logger log = LoggerFactory.getLogger(ParallelScreener.class);

    private final StrategySandbox sandbox;
    private final int workers;
    private final Duration tickBudget;
    private final ThreadPoolExecutor pool;

    // traderId -> epoch millis of last completed run
    private final Map<String, Long> lastRun = new ConcurrentHashMap<>();
    private final AtomicLong abandonedTasks = new AtomicLong();

    public ParallelScreener(StrategySandbox sandbox, int workers, Duration tickBudget) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        this.sandbox = sandbox;
        this.workers = workers;
        this.tickBudget = tickBudget;

        AtomicInteger threadCount = new AtomicInteger();
        this.pool = new ThreadPoolExecutor(workers, workers, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(), r -> {
                Thread t = new Thread(r, "screener-" + threadCount.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
    }

    /**
     * True if the trader has never run or its (backoff-stretched) refresh interval has elapsed.
     */
    public boolean isDue(Trader trader, long nowMs) {
        Long last = lastRun.get(trader.getId());
        if (last == null) {
            return true;
        }
        long refreshMs = Interval.toMillis(trader.primaryInterval()) * sandbox.backoffMultiplier(trader.getId());
        return nowMs - last >= refreshMs;
    }

    /**
     * Screen all due traders against the snapshots.
     */
    public ScreeningReport screen(List<Trader> traders, Map<String, MarketSnapshot> snapshots, long nowMs) {
        long start = System.nanoTime();
        int skippedInvalid = 0;

        List<MarketSnapshot> symbols = List.copyOf(snapshots.values());
        Map<Trader, Future<TraderScreenResult>> tasks = new LinkedHashMap<>();
        for (Trader trader : traders) {
            if (!trader.isEnabled() || !isDue(trader, nowMs)) {
                continue;
            }
            if (!sandbox.compile(trader).isSuccess()) {
                skippedInvalid++;
                continue;
            }
            tasks.put(trader, pool.submit(() -> screenTrader(trader, symbols)));
        }

        long deadline = start + tickBudget.toNanos();
        List<TraderScreenResult> results = new ArrayList<>();
        for (Map.Entry<Trader, Future<TraderScreenResult>> entry : tasks.entrySet()) {
            Trader trader = entry.getKey();
            Future<TraderScreenResult> future = entry.getValue();
            try {
                long remaining = Math.max(0, deadline - System.nanoTime());
                TraderScreenResult result = future.get(remaining, TimeUnit.NANOSECONDS);
                lastRun.put(trader.getId(), nowMs);
                results.add(result);
            } catch (TimeoutException | CancellationException e) {
                future.cancel(true);
                abandonedTasks.incrementAndGet();
                log.warn("Abandoned trader {} after tick budget of {} ms; will retry next tick",
                    trader.getId(), tickBudget.toMillis());
                results.add(TraderScreenResult.abandoned(trader.getId(), Duration.ofNanos(System.nanoTime() - start)));
            } catch (ExecutionException e) {
                // Sandbox outcomes never throw, so this is a bug in the task itself
                log.error("Screening task for trader {} failed", trader.getId(), e.getCause());
                lastRun.put(trader.getId(), nowMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                tasks.values().forEach(f -> f.cancel(true));
                log.warn("Screening tick interrupted");
                break;
            }
        }

        return new ScreeningReport(nowMs, results, skippedInvalid, Duration.ofNanos(System.nanoTime() - start));
    }

    private TraderScreenResult screenTrader(Trader trader, List<MarketSnapshot> symbols) {
        long start = System.nanoTime();
        int cap = trader.getMaxSignalsPerRun();
        List<EvaluationResult> matches = new ArrayList<>();
        int evaluated = 0;
        int runtimeErrors = 0;
        int timeouts = 0;

        for (MarketSnapshot snapshot : symbols) {
            if (Thread.currentThread().isInterrupted()) {
                break;
            }
            SandboxOutcome<EvaluationResult> outcome = sandbox.evaluate(trader, snapshot);
            evaluated++;
            if (outcome instanceof SandboxOutcome.Success<EvaluationResult> ok) {
                if (ok.value().matched() && (cap <= 0 || matches.size() < cap)) {
                    matches.add(ok.value());
                }
            } else if (outcome instanceof SandboxOutcome.TimedOut) {
                timeouts++;
            } else {
                runtimeErrors++;
            }
        }

        return new TraderScreenResult(trader.getId(), matches, evaluated, runtimeErrors, timeouts,
            Duration.ofNanos(System.nanoTime() - start), false);
    }

    /**
     * Clear timing of a retired trader.
     */
    public void forget(String traderId) {
        lastRun.remove(traderId);
    }

    public ScreenerStats stats() {
        return new ScreenerStats(workers, pool.getActiveCount(), pool.getCompletedTaskCount(), abandonedTasks.get());
    }

    /**
     * Let in-flight tasks finish for up to the tick budget, then stop the pool.
     */
    public void shutdown() {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(tickBudget.toMillis(), TimeUnit.MILLISECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public boolean isTerminated() {
        return pool.isShutdown();
    }
}
