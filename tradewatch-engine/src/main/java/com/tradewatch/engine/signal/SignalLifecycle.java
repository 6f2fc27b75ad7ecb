package com.tradewatch.engine.signal;

import com.tradewatch.core.model.Interval;
import com.tradewatch.core.model.MarketSnapshot;
import com.tradewatch.core.model.Ticker;
import com.tradewatch.core.model.Trader;
import com.tradewatch.engine.sandbox.EvaluationResult;
import com.tradewatch.engine.screener.ScreeningReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.UUID;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns positive matches into deduplicated signals.
 *
 * A match is new when the (trader, symbol) has no history, or when either the bar count or
 * the elapsed time since its last signal has reached the dedupe window. Bar counts advance
 * once per closed candle of the trader's primary interval. Close events arrive from the feed
 * thread and are queued; they are applied at the start of {@link #process}, so history is
 * only ever touched by the thread running ticks.
 */
public class SignalLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SignalLifecycle.class);

    private record CandleClose(String symbol, String interval, long openTime) {}

    /**
     * Signals created in one tick plus the number of matches classified as continuing.
     */
    public record Outcome(List<Signal> created, int continuing) {
        public Outcome {
            created = List.copyOf(created);
        }
    }

    /** Closes kept while nothing drains the queue; older ones are dropped first. */
    public static final int MAX_PENDING_CLOSES = 10_000;

    private final int dedupeBars;
    private final Map<String, SignalHistoryEntry> history = new HashMap<>();
    private final Queue<CandleClose> pendingCloses = new ConcurrentLinkedQueue<>();
    private final AtomicInteger pendingCount = new AtomicInteger();
    private final AtomicLong droppedCloses = new AtomicLong();

    public SignalLifecycle(int dedupeBars) {
        if (dedupeBars < 1) {
            throw new IllegalArgumentException("dedupeBars must be >= 1, got " + dedupeBars);
        }
        this.dedupeBars = dedupeBars;
    }

    public int getDedupeBars() {
        return dedupeBars;
    }

    /**
     * Record a closed candle. Safe to call from any thread.
     */
    public void onCandleClosed(String symbol, String interval, long openTime) {
        pendingCloses.add(new CandleClose(symbol, interval, openTime));
        if (pendingCount.incrementAndGet() > MAX_PENDING_CLOSES && pendingCloses.poll() != null) {
            pendingCount.decrementAndGet();
            if (droppedCloses.incrementAndGet() == 1) {
                log.warn("Candle close queue full ({} entries), dropping the oldest closes", MAX_PENDING_CLOSES);
            }
        }
    }

    /**
     * Classify every match of a screening report and create signals for the new ones.
     *
     * @param traders   current traders by id, for names and intervals
     * @param snapshots the snapshots the report was computed from, for price context
     */
    public Outcome process(ScreeningReport report, Map<String, Trader> traders,
                           Map<String, MarketSnapshot> snapshots, long nowMs) {
        applyPendingCloses();

        List<Signal> created = new ArrayList<>();
        int continuing = 0;

        for (EvaluationResult match : report.allMatches()) {
            Trader trader = traders.get(match.traderId());
            if (trader == null) {
                continue; // retired mid-tick
            }
            MarketSnapshot snapshot = snapshots.get(match.symbol());
            if (classify(trader, match.symbol(), nowMs) == Classification.NEW) {
                Signal signal = createSignal(trader, match, snapshot, nowMs);
                created.add(signal);
                log.info("Signal {}", signal.toSummary());
            } else {
                continuing++;
            }
        }

        return new Outcome(created, continuing);
    }

    /**
     * Classify one match and update its history entry.
     */
    public Classification classify(Trader trader, String symbol, long nowMs) {
        String key = key(trader.getId(), symbol);
        SignalHistoryEntry entry = history.get(key);

        if (entry == null) {
            history.put(key, new SignalHistoryEntry(trader.getId(), symbol, trader.primaryInterval(), nowMs));
            return Classification.NEW;
        }

        long windowMs = dedupeBars * Interval.toMillis(entry.getInterval());
        if (entry.getBarsSinceSignal() >= dedupeBars || nowMs - entry.getLastSignalTime() >= windowMs) {
            entry.reset(nowMs);
            return Classification.NEW;
        }

        entry.onContinuing();
        return Classification.CONTINUING;
    }

    /**
     * Advance bar counts with the queued closes. Must be called from the tick thread.
     */
    public void applyPendingCloses() {
        CandleClose close;
        while ((close = pendingCloses.poll()) != null) {
            pendingCount.decrementAndGet();
            for (SignalHistoryEntry entry : history.values()) {
                if (entry.getSymbol().equals(close.symbol()) && entry.getInterval().equals(close.interval())) {
                    entry.onBarClosed();
                }
            }
        }
    }

    private Signal createSignal(Trader trader, EvaluationResult match, MarketSnapshot snapshot, long nowMs) {
        Ticker ticker = snapshot != null ? snapshot.ticker() : null;
        double price = snapshot != null ? snapshot.latestPrice() : Double.NaN;
        if (Double.isNaN(price) && !match.candles().isEmpty()) {
            price = match.candles().get(match.candles().size() - 1).close();
        }

        Signal.Metadata metadata = new Signal.Metadata(
            ticker != null ? ticker.lastPrice() : price,
            ticker != null ? ticker.priceChangePercent() : Double.NaN,
            ticker != null ? ticker.quoteVolume() : Double.NaN,
            match.reasoning(),
            match.indicators()
        );

        return new Signal(UUID.randomUUID().toString(), trader.getId(), trader.getName(), trader.getVersion(),
            match.symbol(), trader.primaryInterval(), nowMs, price, metadata);
    }

    /**
     * Drop the history of a retired trader. Must be called from the tick thread.
     */
    public void retire(String traderId) {
        history.values().removeIf(e -> e.getTraderId().equals(traderId));
    }

    public Optional<SignalHistoryEntry> entry(String traderId, String symbol) {
        applyPendingCloses();
        return Optional.ofNullable(history.get(key(traderId, symbol)));
    }

    public int size() {
        return history.size();
    }

    public int pendingCloses() {
        return pendingCount.get();
    }

    public long droppedCloses() {
        return droppedCloses.get();
    }

    private static String key(String traderId, String symbol) {
        return traderId + "|" + symbol;
    }
}
