package com.tradewatch.engine.sandbox;

import com.tradewatch.core.dsl.AstNode;
import com.tradewatch.core.dsl.ExpressionPrinter;
import com.tradewatch.core.dsl.Parser;
import com.tradewatch.core.model.Candle;
import com.tradewatch.core.model.MarketSnapshot;
import com.tradewatch.core.model.Trader;
import com.tradewatch.engine.ConditionEvaluator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Compiles and runs trader strategies with hard wall-clock limits.
 *
 * Strategy code is the condition language only: it can read candles, ticker fields and
 * indicators, nothing else. Each evaluation runs on the sandbox executor and is cancelled
 * when it exceeds its timeout. Compiled strategies are cached per trader and reused while
 * the trader's version and sources are unchanged.
 */
public class StrategySandbox {

    private static final Logger log = LoggerFactory.getLogger(StrategySandbox.class);

    private final SandboxSettings settings;
    private final ExecutorService executor;

    private final Map<String, CompiledStrategy> cache = new ConcurrentHashMap<>();
    private final Map<String, InvalidEntry> invalid = new ConcurrentHashMap<>();
    private final Map<String, TraderStats> stats = new ConcurrentHashMap<>();

    private record InvalidEntry(int version, String filterSource, String seriesSource,
                                SandboxOutcome.CompileFailure<CompiledStrategy> failure) {}

    public StrategySandbox(SandboxSettings settings) {
        this.settings = settings;
        AtomicInteger threadCount = new AtomicInteger();
        this.executor = Executors.newFixedThreadPool(settings.threads(), r -> {
            Thread t = new Thread(r, "sandbox-" + threadCount.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    public SandboxSettings getSettings() {
        return settings;
    }

    // ========== Compilation ==========

    /**
     * Compile a trader, reusing the cached compilation while it is current.
     * A compile error is logged once per trader version.
     */
    public SandboxOutcome<CompiledStrategy> compile(Trader trader) {
        CompiledStrategy cached = cache.get(trader.getId());
        if (cached != null && cached.isCurrentFor(trader)) {
            return new SandboxOutcome.Success<>(cached);
        }

        String seriesSource = trader.hasSeriesCode() ? trader.getSeriesCode() : null;
        InvalidEntry known = invalid.get(trader.getId());
        if (known != null && known.version() == trader.getVersion()
                && Objects.equals(known.filterSource(), trader.getFilterCode())
                && Objects.equals(known.seriesSource(), seriesSource)) {
            return known.failure();
        }

        try {
            CompiledStrategy compiled = compileSources(trader.getId(), trader.getVersion(),
                trader.getFilterCode(), seriesSource);
            cache.put(trader.getId(), compiled);
            invalid.remove(trader.getId());
            log.debug("Compiled trader {}", trader);
            return new SandboxOutcome.Success<>(compiled);
        } catch (CompileException e) {
            SandboxOutcome.CompileFailure<CompiledStrategy> failure =
                new SandboxOutcome.CompileFailure<>(e.getPhase(), e.getMessage(), e.getPosition());
            cache.remove(trader.getId());
            invalid.put(trader.getId(), new InvalidEntry(trader.getVersion(), trader.getFilterCode(),
                seriesSource, failure));
            log.warn("Trader {} has an invalid {} (position {}): {}", trader, e.getPhase(),
                e.getPosition(), e.getMessage());
            return failure;
        }
    }

    /**
     * Compile sources without touching the cache.
     */
    public SandboxOutcome<CompiledStrategy> validate(String filterCode, String seriesCode) {
        try {
            String series = seriesCode != null && !seriesCode.isBlank() ? seriesCode : null;
            return new SandboxOutcome.Success<>(compileSources("validation", 0, filterCode, series));
        } catch (CompileException e) {
            return new SandboxOutcome.CompileFailure<>(e.getPhase(), e.getMessage(), e.getPosition());
        }
    }

    private CompiledStrategy compileSources(String traderId, int version, String filterCode, String seriesCode) {
        Parser.ParseResult parsed = new Parser().parse(filterCode);
        if (!parsed.success()) {
            throw new CompileException("filter", parsed.error(), parsed.errorPosition());
        }
        if (!isConditionShaped(parsed.ast())) {
            throw new CompileException("filter", "Filter must be a condition (comparison, cross or logical expression)", 0);
        }
        SeriesProgram series = seriesCode != null ? SeriesProgram.compile(seriesCode) : null;
        return new CompiledStrategy(traderId, version, filterCode, seriesCode, parsed.ast(), series);
    }

    private static boolean isConditionShaped(AstNode node) {
        if (node instanceof AstNode.LookbackAccess l) {
            return isConditionShaped(l.expression());
        }
        if (node instanceof AstNode.TimeframeScope t) {
            return isConditionShaped(t.expression());
        }
        return node instanceof AstNode.Comparison || node instanceof AstNode.CrossComparison
            || node instanceof AstNode.LogicalExpression || node instanceof AstNode.NotExpression
            || node instanceof AstNode.BooleanLiteral;
    }

    public boolean isInvalid(String traderId) {
        return invalid.containsKey(traderId);
    }

    public Optional<String> compileError(String traderId) {
        InvalidEntry entry = invalid.get(traderId);
        return entry != null ? Optional.of(entry.failure().message()) : Optional.empty();
    }

    /**
     * Drop everything kept for a retired trader.
     */
    public void evict(String traderId) {
        cache.remove(traderId);
        invalid.remove(traderId);
        stats.remove(traderId);
    }

    // ========== Evaluation ==========

    public SandboxOutcome<FilterResult> evaluateFilter(Trader trader, MarketSnapshot snapshot) {
        SandboxOutcome<CompiledStrategy> compiled = compile(trader);
        if (!(compiled instanceof SandboxOutcome.Success<CompiledStrategy> ok)) {
            return compiled.retype();
        }
        return evaluateFilter(ok.value(), trader, snapshot);
    }

    public SandboxOutcome<Map<String, IndicatorSeries>> evaluateSeries(Trader trader, MarketSnapshot snapshot) {
        SandboxOutcome<CompiledStrategy> compiled = compile(trader);
        if (!(compiled instanceof SandboxOutcome.Success<CompiledStrategy> ok)) {
            return compiled.retype();
        }
        return evaluateSeries(ok.value(), trader, snapshot);
    }

    /**
     * Filter, then series on a match. A series failure fails the whole evaluation.
     */
    public SandboxOutcome<EvaluationResult> evaluate(Trader trader, MarketSnapshot snapshot) {
        SandboxOutcome<CompiledStrategy> compiled = compile(trader);
        if (!(compiled instanceof SandboxOutcome.Success<CompiledStrategy> ok)) {
            return compiled.retype();
        }
        return evaluate(ok.value(), trader, snapshot);
    }

    /**
     * Evaluate an already compiled strategy, used for ad-hoc evaluation requests.
     */
    public SandboxOutcome<EvaluationResult> evaluate(CompiledStrategy strategy, Trader trader, MarketSnapshot snapshot) {
        SandboxOutcome<FilterResult> filter = evaluateFilter(strategy, trader, snapshot);
        if (!(filter instanceof SandboxOutcome.Success<FilterResult> matched)) {
            return filter.retype();
        }
        if (!matched.value().matched()) {
            return new SandboxOutcome.Success<>(EvaluationResult.noMatch(trader.getId(), snapshot.symbol()));
        }

        Map<String, IndicatorSeries> indicators = Map.of();
        if (strategy.hasSeries()) {
            SandboxOutcome<Map<String, IndicatorSeries>> series = evaluateSeries(strategy, trader, snapshot);
            if (!(series instanceof SandboxOutcome.Success<Map<String, IndicatorSeries>> ok)) {
                return series.retype();
            }
            indicators = ok.value();
        }

        List<Candle> candles = snapshot.candles(trader.primaryInterval());
        int from = Math.max(0, candles.size() - settings.candleSliceLength());
        return new SandboxOutcome.Success<>(new EvaluationResult(trader.getId(), snapshot.symbol(), true,
            matched.value().reasoning(), indicators, candles.subList(from, candles.size())));
    }

    private SandboxOutcome<FilterResult> evaluateFilter(CompiledStrategy strategy, Trader trader, MarketSnapshot snapshot) {
        SandboxOutcome<FilterResult> outcome = runBounded(() -> {
            ConditionEvaluator evaluator = new ConditionEvaluator(snapshot, trader.primaryInterval());
            if (!evaluator.evaluate(strategy.getFilter())) {
                return FilterResult.noMatch();
            }
            List<String> reasoning = ExpressionPrinter.conjuncts(strategy.getFilter()).stream()
                .map(ExpressionPrinter::print)
                .toList();
            return new FilterResult(true, reasoning);
        }, settings.filterTimeout());
        record(trader, snapshot.symbol(), "filter", outcome);
        return outcome;
    }

    private SandboxOutcome<Map<String, IndicatorSeries>> evaluateSeries(CompiledStrategy strategy, Trader trader,
                                                                        MarketSnapshot snapshot) {
        if (!strategy.hasSeries()) {
            return new SandboxOutcome.Success<>(Map.of());
        }
        SandboxOutcome<Map<String, IndicatorSeries>> outcome = runBounded(() -> {
            Map<String, IndicatorSeries> output = runSeries(strategy.getSeries(), trader, snapshot);
            for (String required : trader.getSeriesIndicators()) {
                if (!output.containsKey(required)) {
                    throw new ConditionEvaluator.EvaluationException(
                        "Series output is missing declared indicator '" + required + "'");
                }
            }
            return output;
        }, settings.seriesTimeout());
        record(trader, snapshot.symbol(), "series", outcome);
        return outcome;
    }

    private Map<String, IndicatorSeries> runSeries(SeriesProgram program, Trader trader, MarketSnapshot snapshot) {
        ConditionEvaluator evaluator = new ConditionEvaluator(snapshot, trader.primaryInterval());
        List<Candle> candles = evaluator.primaryCandles();
        int from = Math.max(0, candles.size() - settings.seriesPoints());

        Map<String, IndicatorSeries> output = new LinkedHashMap<>();
        for (SeriesProgram.Line line : program.lines()) {
            List<AstNode> exprs = line.expressions();
            List<SeriesPoint> points = new ArrayList<>();
            for (int i = from; i < candles.size(); i++) {
                double y = evaluator.evaluateValue(exprs.get(0), i);
                if (Double.isNaN(y)) {
                    continue; // warmup
                }
                Double y2 = exprs.size() > 1 ? orNull(evaluator.evaluateValue(exprs.get(1), i)) : null;
                Double y3 = exprs.size() > 2 ? orNull(evaluator.evaluateValue(exprs.get(2), i)) : null;
                points.add(new SeriesPoint(candles.get(i).openTime(), y, y2, y3));
            }
            output.put(line.name(), new IndicatorSeries(line.name(), line.sources(), points));
        }
        return output;
    }

    private static Double orNull(double value) {
        return Double.isNaN(value) ? null : value;
    }

    /**
     * Run a task on the sandbox executor, cancelling it once the timeout elapses.
     */
    public <T> SandboxOutcome<T> runBounded(Callable<T> task, Duration timeout) {
        long start = System.nanoTime();
        Future<T> future;
        try {
            future = executor.submit(task);
        } catch (RejectedExecutionException e) {
            return new SandboxOutcome.RuntimeFailure<>("Sandbox is shut down");
        }

        try {
            return new SandboxOutcome.Success<>(future.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            future.cancel(true);
            return new SandboxOutcome.TimedOut<>(Duration.ofNanos(System.nanoTime() - start));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            String message = cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
            return new SandboxOutcome.RuntimeFailure<>(message);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            return new SandboxOutcome.RuntimeFailure<>("Interrupted while waiting for evaluation");
        }
    }

    // ========== Per-trader accounting ==========

    private void record(Trader trader, String symbol, String phase, SandboxOutcome<?> outcome) {
        TraderStats s = stats.computeIfAbsent(trader.getId(), id -> new TraderStats());
        if (outcome instanceof SandboxOutcome.TimedOut<?> t) {
            int multiplier = s.onTimeout(settings.timeoutBackoffThreshold(), settings.maxBackoffMultiplier());
            log.warn("Trader {} {} timed out on {} after {} ms (backoff x{})", trader.getId(), phase, symbol,
                t.elapsed().toMillis(), multiplier);
        } else {
            s.onCompleted();
            if (outcome instanceof SandboxOutcome.RuntimeFailure<?> f) {
                s.runtimeErrors.incrementAndGet();
                log.debug("Trader {} {} failed on {}: {}", trader.getId(), phase, symbol, f.message());
            }
        }
    }

    /**
     * Factor applied to the trader's refresh interval, 1 unless it keeps timing out.
     */
    public int backoffMultiplier(String traderId) {
        TraderStats s = stats.get(traderId);
        return s != null ? s.multiplier() : 1;
    }

    public int runtimeErrors(String traderId) {
        TraderStats s = stats.get(traderId);
        return s != null ? s.runtimeErrors.get() : 0;
    }

    public int timeouts(String traderId) {
        TraderStats s = stats.get(traderId);
        return s != null ? s.timeouts.get() : 0;
    }

    public void shutdown() {
        executor.shutdownNow();
    }

    private static final class TraderStats {
        private final AtomicInteger runtimeErrors = new AtomicInteger();
        private final AtomicInteger timeouts = new AtomicInteger();
        private int consecutiveTimeouts;
        private int multiplier = 1;

        synchronized int onTimeout(int threshold, int maxMultiplier) {
            timeouts.incrementAndGet();
            consecutiveTimeouts++;
            if (consecutiveTimeouts >= threshold) {
                multiplier = Math.min(maxMultiplier, multiplier * 2);
            }
            return multiplier;
        }

        synchronized void onCompleted() {
            consecutiveTimeouts = 0;
            multiplier = 1;
        }

        synchronized int multiplier() {
            return multiplier;
        }
    }
}
