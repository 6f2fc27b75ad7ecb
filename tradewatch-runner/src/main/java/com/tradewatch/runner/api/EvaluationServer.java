package com.tradewatch.runner.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradewatch.core.model.Candle;
import com.tradewatch.core.model.Interval;
import com.tradewatch.core.model.MarketSnapshot;
import com.tradewatch.core.model.Ticker;
import com.tradewatch.core.model.Trader;
import com.tradewatch.engine.sandbox.CompiledStrategy;
import com.tradewatch.engine.sandbox.EvaluationResult;
import com.tradewatch.engine.sandbox.IndicatorSeries;
import com.tradewatch.engine.sandbox.SandboxOutcome;
import com.tradewatch.engine.sandbox.StrategySandbox;
import com.tradewatch.runner.health.HealthReport;
import com.tradewatch.runner.health.HealthStatus;
import io.javalin.Javalin;
import io.javalin.http.Context;
import io.javalin.json.JavalinJackson;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * HTTP surface for ad-hoc strategy validation and evaluation plus runtime control.
 *
 * Ad-hoc evaluations run in the same sandbox as screening, under the same timeouts, but never
 * touch the compiled-trader cache.
 */
public class EvaluationServer {

    private static final Logger log = LoggerFactory.getLogger(EvaluationServer.class);

    private final StrategySandbox sandbox;
    private final RunnerControl control;
    private final ObjectMapper mapper;
    private final int port;
    private Javalin app;

    public EvaluationServer(StrategySandbox sandbox, RunnerControl control, ObjectMapper mapper, int port) {
        this.sandbox = sandbox;
        this.control = control;
        this.mapper = mapper;
        this.port = port;
    }

    public void start() {
        app = Javalin.create(javalinConfig -> {
            javalinConfig.jsonMapper(new JavalinJackson(mapper, true));
            javalinConfig.showJavalinBanner = false;
        });

        configureStrategyRoutes();
        configureControlRoutes();
        configureHealthRoutes();

        app.exception(BadRequest.class, (e, ctx) -> ctx.status(400).json(new ErrorResponse(e.getMessage())));
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Request {} {} failed", ctx.method(), ctx.path(), e);
            ctx.status(500).json(new ErrorResponse("Internal error: " + e.getMessage()));
        });

        app.start(port);
        log.info("Evaluation server listening on port {}", app.port());
    }

    /**
     * Bound port, useful when started on port 0.
     */
    public int port() {
        return app.port();
    }

    public void stop() {
        if (app != null) {
            app.stop();
            app = null;
        }
    }

    // ========== Routes ==========

    private void configureStrategyRoutes() {
        app.post("/api/strategies/validate", this::handleValidate);
        app.post("/api/strategies/evaluate", this::handleEvaluate);
    }

    private void configureControlRoutes() {
        app.get("/api/status", ctx -> ctx.json(control.status()));
        app.post("/api/pause", ctx -> {
            control.pause();
            ctx.json(new ControlResponse(true, "paused"));
        });
        app.post("/api/resume", ctx -> {
            control.resume();
            ctx.json(new ControlResponse(true, "resumed"));
        });
        app.post("/api/flush", ctx -> ctx.json(control.flush()));
    }

    private void configureHealthRoutes() {
        app.get("/health", ctx -> {
            HealthReport report = control.health();
            ctx.status(report.status() == HealthStatus.UNHEALTHY ? 503 : 200).json(report);
        });
    }

    /**
     * POST /api/strategies/validate {filterCode, seriesCode}
     */
    private void handleValidate(Context ctx) {
        ValidateRequest req = readBody(ctx, ValidateRequest.class);
        if (req.filterCode() == null || req.filterCode().isBlank()) {
            throw new BadRequest("filterCode is required");
        }
        SandboxOutcome<CompiledStrategy> outcome = sandbox.validate(req.filterCode(), req.seriesCode());
        if (outcome instanceof SandboxOutcome.CompileFailure<CompiledStrategy> failure) {
            ctx.json(new ValidateResponse(false, failure.phase(), failure.message(), failure.position()));
        } else {
            ctx.json(new ValidateResponse(true, null, null, null));
        }
    }

    /**
     * POST /api/strategies/evaluate {filterCode, seriesCode, refreshInterval, requiredTimeframes,
     * seriesIndicators, marketData}
     */
    private void handleEvaluate(Context ctx) {
        EvaluateRequest req = readBody(ctx, EvaluateRequest.class);
        if (req.filterCode() == null || req.filterCode().isBlank()) {
            throw new BadRequest("filterCode is required");
        }
        if (req.marketData() == null) {
            throw new BadRequest("marketData is required");
        }

        Trader trader;
        MarketSnapshot snapshot;
        try {
            trader = req.toTrader("adhoc-" + UUID.randomUUID());
            snapshot = req.marketData().toSnapshot();
        } catch (IllegalArgumentException e) {
            throw new BadRequest(e.getMessage());
        }

        SandboxOutcome<CompiledStrategy> compiled = sandbox.validate(trader.getFilterCode(), trader.getSeriesCode());
        if (!(compiled instanceof SandboxOutcome.Success<CompiledStrategy> ok)) {
            ctx.json(EvaluateResponse.of(compiled.retype()));
            return;
        }
        try {
            ctx.json(EvaluateResponse.of(sandbox.evaluate(ok.value(), trader, snapshot)));
        } finally {
            sandbox.evict(trader.getId());
        }
    }

    private <T> T readBody(Context ctx, Class<T> type) {
        String body = ctx.body();
        if (body == null || body.isBlank()) {
            throw new BadRequest("Request body is required");
        }
        try {
            T value = mapper.readValue(body, type);
            if (value == null) {
                throw new BadRequest("Request body is required");
            }
            return value;
        } catch (JsonProcessingException e) {
            throw new BadRequest("Malformed JSON: " + e.getOriginalMessage());
        }
    }

    private static class BadRequest extends RuntimeException {
        BadRequest(String message) {
            super(message);
        }
    }

    // ========== Request/Response records ==========

    public record ValidateRequest(String filterCode, String seriesCode) {}

    public record ValidateResponse(boolean valid, String phase, String error, Integer errorPosition) {}

    public record EvaluateRequest(
        String filterCode,
        String seriesCode,
        String refreshInterval,
        List<String> requiredTimeframes,
        List<String> seriesIndicators,
        MarketDataPayload marketData
    ) {
        Trader toTrader(String id) {
            String interval = refreshInterval != null && !refreshInterval.isBlank() ? refreshInterval : Interval.DEFAULT;
            Trader trader = new Trader(id, "ad-hoc", filterCode, interval);
            trader.setSeriesCode(seriesCode);
            trader.setRequiredTimeframes(requiredTimeframes != null ? new ArrayList<>(requiredTimeframes) : null);
            trader.setSeriesIndicators(seriesIndicators != null ? new ArrayList<>(seriesIndicators) : null);
            for (String iv : trader.allIntervals()) {
                if (!Interval.isValid(iv)) {
                    throw new IllegalArgumentException("Unsupported interval: " + iv);
                }
            }
            return trader;
        }
    }

    public record MarketDataPayload(String symbol, TickerPayload ticker, Map<String, List<CandlePayload>> klines) {

        MarketSnapshot toSnapshot() {
            String sym = symbol != null && !symbol.isBlank() ? symbol.toUpperCase() : "UNKNOWN";
            Map<String, List<Candle>> candles = new LinkedHashMap<>();
            if (klines != null) {
                for (Map.Entry<String, List<CandlePayload>> entry : klines.entrySet()) {
                    String interval = entry.getKey();
                    if (!Interval.isValid(interval)) {
                        throw new IllegalArgumentException("Unsupported interval: " + interval);
                    }
                    long intervalMs = Interval.toMillis(interval);
                    List<Candle> list = new ArrayList<>();
                    if (entry.getValue() != null) {
                        for (CandlePayload c : entry.getValue()) {
                            list.add(c.toCandle(intervalMs));
                        }
                    }
                    list.sort(Comparator.comparingLong(Candle::openTime));
                    candles.put(interval, list);
                }
            }
            Ticker t = ticker != null ? ticker.toTicker(sym) : null;
            return new MarketSnapshot(sym, t, candles);
        }
    }

    public record TickerPayload(Double lastPrice, Double priceChangePercent, Double quoteVolume) {

        Ticker toTicker(String symbol) {
            return new Ticker(symbol, orNaN(lastPrice), orNaN(priceChangePercent), orNaN(quoteVolume),
                System.currentTimeMillis());
        }
    }

    /**
     * One kline. {@code closed} defaults to true.
     */
    public record CandlePayload(
        long openTime,
        double open,
        double high,
        double low,
        double close,
        double volume,
        Boolean closed,
        Double quoteVolume,
        Integer tradeCount
    ) {
        Candle toCandle(long intervalMs) {
            return new Candle(openTime, open, high, low, close, volume, openTime + intervalMs - 1,
                closed == null || closed, quoteVolume != null ? quoteVolume : -1,
                tradeCount != null ? tradeCount : -1);
        }
    }

    /**
     * @param outcome matched, no_match, compile_error, runtime_error or timeout
     */
    public record EvaluateResponse(
        boolean success,
        String outcome,
        String error,
        Integer errorPosition,
        boolean matched,
        List<String> reasoning,
        Map<String, IndicatorSeries> series
    ) {
        static EvaluateResponse of(SandboxOutcome<EvaluationResult> outcome) {
            if (outcome instanceof SandboxOutcome.Success<EvaluationResult> ok) {
                EvaluationResult result = ok.value();
                return new EvaluateResponse(true, result.matched() ? "matched" : "no_match", null, null,
                    result.matched(), result.reasoning(), result.indicators());
            }
            if (outcome instanceof SandboxOutcome.CompileFailure<EvaluationResult> c) {
                return new EvaluateResponse(false, outcome.kind(), c.phase() + ": " + c.message(), c.position(),
                    false, List.of(), Map.of());
            }
            if (outcome instanceof SandboxOutcome.RuntimeFailure<EvaluationResult> r) {
                return new EvaluateResponse(false, outcome.kind(), r.message(), null, false, List.of(), Map.of());
            }
            SandboxOutcome.TimedOut<EvaluationResult> t = (SandboxOutcome.TimedOut<EvaluationResult>) outcome;
            return new EvaluateResponse(false, outcome.kind(),
                "Evaluation exceeded its time limit after " + t.elapsed().toMillis() + " ms", null,
                false, List.of(), Map.of());
        }
    }

    public record ControlResponse(boolean success, String state) {}

    public record ErrorResponse(String error) {}

    private static double orNaN(Double value) {
        return value != null ? value : Double.NaN;
    }
}
