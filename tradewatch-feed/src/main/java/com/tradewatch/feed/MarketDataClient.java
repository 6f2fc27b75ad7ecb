package com.tradewatch.feed;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradewatch.core.model.Candle;
import com.tradewatch.core.model.Interval;
import com.tradewatch.core.model.MarketSnapshot;
import com.tradewatch.core.model.Ticker;
import org.java_websocket.client.WebSocketClient;
import org.java_websocket.exceptions.WebsocketNotConnectedException;
import org.java_websocket.handshake.ServerHandshake;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Live market data over one Binance combined stream.
 *
 * Subscribes a ticker stream per symbol and a kline stream per (symbol, interval). Ticker
 * messages replace the symbol's ticker; kline messages are applied to the pair's
 * {@link CandleBuffer}. Malformed messages are counted and dropped one by one. Lost
 * connections are re-established with exponential backoff using the full current
 * subscription set.
 */
public class MarketDataClient {

    private static final Logger log = LoggerFactory.getLogger(MarketDataClient.class);

    /**
     * Change of the subscribed stream set.
     */
    public record SubscriptionChange(List<String> subscribed, List<String> unsubscribed) {
        public boolean isEmpty() {
            return subscribed.isEmpty() && unsubscribed.isEmpty();
        }
    }

    private final FeedSettings settings;
    private final ObjectMapper mapper;
    private final Object subscriptionLock = new Object();

    private volatile Set<String> symbols;
    private volatile Set<String> intervals;

    // "SYMBOL|interval" -> buffer
    private final Map<String, CandleBuffer> buffers = new ConcurrentHashMap<>();
    private final Map<String, Ticker> tickers = new ConcurrentHashMap<>();

    private final List<Consumer<ConnectionState>> stateListeners = new CopyOnWriteArrayList<>();
    private final List<CandleCloseListener> closeListeners = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "market-data-scheduler");
        t.setDaemon(true);
        return t;
    });

    private volatile WebSocketClient client;
    private volatile ConnectionState state = ConnectionState.DISCONNECTED;
    private volatile boolean shouldReconnect;
    private volatile ScheduledFuture<?> pendingReconnect;
    private volatile ScheduledFuture<?> staleCheck;
    private final AtomicInteger reconnectAttempts = new AtomicInteger();
    private final AtomicInteger requestIds = new AtomicInteger();

    private final AtomicLong messagesReceived = new AtomicLong();
    private final AtomicLong bufferUpdates = new AtomicLong();
    private final AtomicLong malformedMessages = new AtomicLong();
    private final AtomicLong closedCandles = new AtomicLong();
    private final AtomicLong reconnects = new AtomicLong();
    private volatile long lastMessageTime;

    public MarketDataClient(Collection<String> symbols, Collection<String> intervals, FeedSettings settings) {
        this(symbols, intervals, settings, HttpClientFactory.getMapper());
    }

    public MarketDataClient(Collection<String> symbols, Collection<String> intervals, FeedSettings settings,
                            ObjectMapper mapper) {
        this.settings = settings;
        this.mapper = mapper;
        this.symbols = normalizeSymbols(symbols);
        this.intervals = validateIntervals(intervals);
        for (String symbol : this.symbols) {
            for (String interval : this.intervals) {
                buffers.put(key(symbol, interval), new CandleBuffer(symbol, interval, settings.bufferCapacity()));
            }
        }
    }

    // ========== Listeners ==========

    public void addStateListener(Consumer<ConnectionState> listener) {
        stateListeners.add(listener);
    }

    public void addCandleCloseListener(CandleCloseListener listener) {
        closeListeners.add(listener);
    }

    // ========== Connection ==========

    /**
     * Open the stream. Returns immediately; the connection completes on the socket thread.
     */
    public void connect() {
        if (state == ConnectionState.CONNECTED || state == ConnectionState.CONNECTING) {
            return;
        }
        shouldReconnect = true;
        if (staleCheck == null) {
            long periodMs = Math.max(250, settings.staleAfter().toMillis() / 2);
            staleCheck = scheduler.scheduleAtFixedRate(this::checkStale, periodMs, periodMs, TimeUnit.MILLISECONDS);
        }
        doConnect();
    }

    private void doConnect() {
        pendingReconnect = null;
        if (!shouldReconnect) {
            return;
        }
        updateState(ConnectionState.CONNECTING);
        try {
            URI uri = URI.create(streamUrl(settings.streamUrl(), symbols, intervals));
            WebSocketClient socket = new WebSocketClient(uri) {
                @Override
                public void onOpen(ServerHandshake handshake) {
                    if (MarketDataClient.this.client != this) {
                        return;
                    }
                    log.info("Market data stream connected ({} symbols x {} intervals)",
                        symbols.size(), intervals.size());
                    reconnectAttempts.set(0);
                    lastMessageTime = System.currentTimeMillis();
                    updateState(ConnectionState.CONNECTED);
                }

                @Override
                public void onMessage(String message) {
                    handleMessage(message);
                }

                @Override
                public void onClose(int code, String reason, boolean remote) {
                    if (MarketDataClient.this.client != this) {
                        return;
                    }
                    log.info("Market data stream closed: code={}, reason={}, remote={}", code, reason, remote);
                    updateState(ConnectionState.DISCONNECTED);
                    scheduleReconnect();
                }

                @Override
                public void onError(Exception ex) {
                    log.error("Market data stream error: {}", ex.getMessage());
                }
            };
            client = socket;
            socket.connect();
        } catch (IllegalArgumentException | IllegalStateException e) {
            log.error("Failed to connect market data stream: {}", e.getMessage());
            updateState(ConnectionState.DISCONNECTED);
            scheduleReconnect();
        }
    }

    private void scheduleReconnect() {
        if (!shouldReconnect) {
            return;
        }
        int attempt = reconnectAttempts.incrementAndGet();
        Duration delay = reconnectDelay(attempt, settings.reconnectBase(), settings.reconnectMax());
        reconnects.incrementAndGet();
        log.info("Reconnecting market data stream in {} ms (attempt {})", delay.toMillis(), attempt);
        try {
            pendingReconnect = scheduler.schedule(this::doConnect, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Reconnect not scheduled, client is shutting down");
        }
    }

    /**
     * Reconnect delay for an attempt: {@code base * 2^(attempt - 1)}, capped at {@code max}.
     */
    public static Duration reconnectDelay(int attempt, Duration base, Duration max) {
        int shift = Math.min(Math.max(attempt - 1, 0), 30);
        long ms = base.toMillis() * (1L << shift);
        if (ms < 0 || ms > max.toMillis()) {
            return max;
        }
        return Duration.ofMillis(ms);
    }

    private void checkStale() {
        if (state != ConnectionState.CONNECTED) {
            return;
        }
        long silentMs = System.currentTimeMillis() - lastMessageTime;
        if (silentMs > settings.staleAfter().toMillis()) {
            log.warn("No market data for {} ms, marking stream degraded", silentMs);
            updateState(ConnectionState.DEGRADED);
        }
    }

    /**
     * Stop reconnecting, close the socket and release the scheduler.
     */
    public void shutdown() {
        shouldReconnect = false;
        ScheduledFuture<?> reconnect = pendingReconnect;
        if (reconnect != null) {
            reconnect.cancel(false);
        }
        ScheduledFuture<?> stale = staleCheck;
        if (stale != null) {
            stale.cancel(false);
        }
        WebSocketClient socket = client;
        client = null;
        if (socket != null) {
            socket.close();
        }
        updateState(ConnectionState.DISCONNECTED);

        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("Market data scheduler did not terminate cleanly");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private void updateState(ConnectionState newState) {
        ConnectionState old = state;
        if (old == newState) {
            return;
        }
        state = newState;
        for (Consumer<ConnectionState> listener : stateListeners) {
            try {
                listener.accept(newState);
            } catch (RuntimeException e) {
                log.warn("State listener failed on {} -> {}", old, newState, e);
            }
        }
    }

    // ========== Messages ==========

    /**
     * Apply one raw stream message. Called on the socket thread; never throws.
     */
    public void handleMessage(String raw) {
        messagesReceived.incrementAndGet();
        lastMessageTime = System.currentTimeMillis();
        if (state == ConnectionState.DEGRADED) {
            log.info("Market data flowing again");
            updateState(ConnectionState.CONNECTED);
        }

        try {
            JsonNode root = mapper.readTree(raw);
            JsonNode payload = root.has("stream") && root.has("data") ? root.get("data") : root;

            // {"result": null, "id": 3} acknowledges SUBSCRIBE / UNSUBSCRIBE
            if (payload.has("id") && payload.has("result")) {
                return;
            }

            String event = payload.path("e").asText("");
            switch (event) {
                case "kline" -> applyKline(mapper.treeToValue(payload, KlineMessage.class));
                case "24hrTicker" -> applyTicker(mapper.treeToValue(payload, TickerMessage.class));
                default -> throw new IllegalArgumentException("unrecognized event '" + event + "'");
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            malformedMessages.incrementAndGet();
            log.debug("Discarding market data message: {}", e.getMessage());
        }
    }

    private void applyKline(KlineMessage message) {
        Candle candle = message.toCandle();
        String symbol = message.getSymbol().toUpperCase(Locale.ROOT);
        String interval = message.getInterval();

        CandleBuffer buffer = buffers.get(key(symbol, interval));
        if (buffer == null) {
            log.debug("Ignoring kline for unmonitored {} {}", symbol, interval);
            return;
        }

        CandleBuffer.Update update = buffer.apply(candle);
        if (update.changed()) {
            bufferUpdates.incrementAndGet();
        }
        for (Candle closed : update.closed()) {
            closedCandles.incrementAndGet();
            for (CandleCloseListener listener : closeListeners) {
                try {
                    listener.onCandleClosed(symbol, interval, closed);
                } catch (RuntimeException e) {
                    log.warn("Candle close listener failed for {} {}", symbol, interval, e);
                }
            }
        }
    }

    private void applyTicker(TickerMessage message) {
        Ticker ticker = message.toTicker();
        String symbol = ticker.symbol().toUpperCase(Locale.ROOT);
        if (symbols.contains(symbol)) {
            tickers.put(symbol, ticker);
        }
    }

    // ========== Subscriptions ==========

    /**
     * Replace the monitored symbol and interval sets.
     *
     * While connected the difference is sent as incremental SUBSCRIBE / UNSUBSCRIBE frames;
     * otherwise the new set takes effect on the next connect. Buffers and tickers of dropped
     * pairs are discarded.
     */
    public SubscriptionChange updateSubscriptions(Collection<String> newSymbols, Collection<String> newIntervals) {
        Set<String> nextSymbols = normalizeSymbols(newSymbols);
        Set<String> nextIntervals = validateIntervals(newIntervals);

        synchronized (subscriptionLock) {
            Set<String> before = new LinkedHashSet<>(streams(symbols, intervals));
            Set<String> after = new LinkedHashSet<>(streams(nextSymbols, nextIntervals));

            List<String> added = new ArrayList<>(after);
            added.removeAll(before);
            List<String> removed = new ArrayList<>(before);
            removed.removeAll(after);

            symbols = nextSymbols;
            intervals = nextIntervals;

            for (String symbol : nextSymbols) {
                for (String interval : nextIntervals) {
                    buffers.computeIfAbsent(key(symbol, interval),
                        k -> new CandleBuffer(symbol, interval, settings.bufferCapacity()));
                }
            }
            buffers.values().removeIf(b ->
                !nextSymbols.contains(b.getSymbol()) || !nextIntervals.contains(b.getInterval()));
            tickers.keySet().removeIf(s -> !nextSymbols.contains(s));

            SubscriptionChange change = new SubscriptionChange(List.copyOf(added), List.copyOf(removed));
            if (change.isEmpty()) {
                return change;
            }

            WebSocketClient socket = client;
            if (socket != null && socket.isOpen()) {
                sendFrame(socket, "UNSUBSCRIBE", removed);
                sendFrame(socket, "SUBSCRIBE", added);
                log.info("Subscriptions updated: +{} -{} streams", added.size(), removed.size());
            } else {
                log.info("Subscriptions updated while disconnected: +{} -{} streams, applied on next connect",
                    added.size(), removed.size());
            }
            return change;
        }
    }

    public SubscriptionChange addSymbols(Collection<String> added) {
        Set<String> next = new LinkedHashSet<>(symbols);
        next.addAll(normalizeSymbols(added));
        return updateSubscriptions(next, intervals);
    }

    public SubscriptionChange removeSymbols(Collection<String> removed) {
        Set<String> next = new LinkedHashSet<>(symbols);
        next.removeAll(normalizeSymbols(removed));
        return updateSubscriptions(next, intervals);
    }

    private void sendFrame(WebSocketClient socket, String method, List<String> params) {
        if (params.isEmpty()) {
            return;
        }
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("method", method);
        frame.put("params", params);
        frame.put("id", requestIds.incrementAndGet());
        try {
            socket.send(mapper.writeValueAsString(frame));
        } catch (JsonProcessingException e) {
            log.error("Failed to encode {} frame", method, e);
        } catch (WebsocketNotConnectedException e) {
            log.warn("Stream closed before {} could be sent; the next connect subscribes the full set", method);
        }
    }

    /**
     * Stream names for a symbol and interval set: one ticker stream per symbol plus one kline
     * stream per pair, lower case.
     */
    public static List<String> streams(Collection<String> symbols, Collection<String> intervals) {
        List<String> streams = new ArrayList<>();
        for (String symbol : symbols) {
            String s = symbol.toLowerCase(Locale.ROOT);
            streams.add(s + "@ticker");
            for (String interval : intervals) {
                streams.add(s + "@kline_" + interval);
            }
        }
        return streams;
    }

    /**
     * Combined stream URL, e.g. {@code <base>/stream?streams=btcusdt@ticker/btcusdt@kline_1m}.
     */
    public static String streamUrl(String base, Collection<String> symbols, Collection<String> intervals) {
        String trimmed = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
        return trimmed + "/stream?streams=" + String.join("/", streams(symbols, intervals));
    }

    // ========== Backfill ==========

    /**
     * Seed every buffer with recent klines. Pairs that fail to load are logged and skipped.
     *
     * @return number of pairs loaded
     */
    public int backfill(HistoricalKlineLoader loader, int limit) {
        int loaded = 0;
        for (CandleBuffer buffer : List.copyOf(buffers.values())) {
            try {
                List<Candle> candles = loader.load(buffer.getSymbol(), buffer.getInterval(), limit);
                candles.forEach(buffer::apply);
                loaded++;
            } catch (IOException e) {
                log.warn("Backfill failed for {} {}: {}", buffer.getSymbol(), buffer.getInterval(), e.getMessage());
            }
        }
        log.info("Backfilled {}/{} symbol intervals", loaded, buffers.size());
        return loaded;
    }

    // ========== Reads ==========

    /**
     * Point-in-time view of every symbol with at least one candle. Candle lists are copied per
     * buffer; the candles themselves are shared.
     */
    public Map<String, MarketSnapshot> snapshot() {
        Map<String, MarketSnapshot> snapshots = new LinkedHashMap<>();
        Set<String> currentIntervals = intervals;
        for (String symbol : new TreeSet<>(symbols)) {
            Map<String, List<Candle>> candles = new LinkedHashMap<>();
            for (String interval : currentIntervals) {
                CandleBuffer buffer = buffers.get(key(symbol, interval));
                if (buffer != null) {
                    List<Candle> list = buffer.snapshot();
                    if (!list.isEmpty()) {
                        candles.put(interval, list);
                    }
                }
            }
            if (!candles.isEmpty()) {
                snapshots.put(symbol, new MarketSnapshot(symbol, tickers.get(symbol), candles));
            }
        }
        return snapshots;
    }

    public CandleBuffer buffer(String symbol, String interval) {
        return buffers.get(key(symbol.toUpperCase(Locale.ROOT), interval));
    }

    public Ticker ticker(String symbol) {
        return tickers.get(symbol.toUpperCase(Locale.ROOT));
    }

    public FeedStats stats() {
        return new FeedStats(messagesReceived.get(), bufferUpdates.get(), malformedMessages.get(),
            closedCandles.get(), reconnects.get(), lastMessageTime);
    }

    public ConnectionState getState() {
        return state;
    }

    public boolean isConnected() {
        return state == ConnectionState.CONNECTED;
    }

    public boolean isReconnectPending() {
        ScheduledFuture<?> reconnect = pendingReconnect;
        return reconnect != null && !reconnect.isDone();
    }

    public Set<String> getSymbols() {
        return symbols;
    }

    public Set<String> getIntervals() {
        return intervals;
    }

    private static String key(String symbol, String interval) {
        return symbol + "|" + interval;
    }

    private static Set<String> normalizeSymbols(Collection<String> symbols) {
        Set<String> normalized = new LinkedHashSet<>();
        for (String symbol : symbols) {
            if (symbol != null && !symbol.isBlank()) {
                normalized.add(symbol.trim().toUpperCase(Locale.ROOT));
            }
        }
        return Collections.unmodifiableSet(normalized);
    }

    private static Set<String> validateIntervals(Collection<String> intervals) {
        Set<String> valid = new LinkedHashSet<>();
        for (String interval : intervals) {
            if (!Interval.isValid(interval)) {
                throw new IllegalArgumentException("Invalid interval: " + interval);
            }
            valid.add(interval);
        }
        return Collections.unmodifiableSet(valid);
    }
}
