package com.tradewatch.runner.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradewatch.engine.signal.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Buffers signals, metrics and events in bounded queues and writes them to the sink in
 * batches on a fixed cadence.
 *
 * Queues drop their oldest item when full. A failed batch goes back to the head of its queue
 * and the next flush is delayed with exponential backoff; after a configured number of
 * consecutive failures a {@code persistence_degraded} event is queued and heartbeats report
 * the degraded state. Heartbeats run on their own schedule so a quiet system stays visible.
 */
public class StateSynchronizer {

    private static final Logger log = LoggerFactory.getLogger(StateSynchronizer.class);

    public record FlushResult(int signals, int metrics, int events, boolean failed) {
        public int total() {
            return signals + metrics + events;
        }
    }

    public record SyncStats(
        boolean running,
        int signalQueueDepth,
        int metricQueueDepth,
        int eventQueueDepth,
        long signalEvictions,
        long metricEvictions,
        long eventEvictions,
        int consecutiveFailures,
        boolean degraded,
        long recordsWritten,
        Map<String, Long> counters
    ) {}

    @FunctionalInterface
    private interface BatchWriter<T> {
        void write(List<T> batch) throws SinkException;
    }

    private final String sourceId;
    private final SyncSettings settings;
    private final PersistenceSink sink;
    private final ObjectMapper mapper;

    private final BoundedQueue<SignalRecord> signalQueue;
    private final BoundedQueue<MetricRecord> metricQueue;
    private final BoundedQueue<EventRecord> eventQueue;

    private final Map<Counter, AtomicLong> counters = new EnumMap<>(Counter.class);
    private final AtomicLong recordsWritten = new AtomicLong();
    private final Object flushLock = new Object();
    private final long createdAt = System.currentTimeMillis();

    private volatile int consecutiveFailures;
    private volatile boolean degraded;
    private volatile boolean running;
    private ScheduledExecutorService scheduler;

    public StateSynchronizer(String sourceId, SyncSettings settings, PersistenceSink sink, ObjectMapper mapper) {
        this.sourceId = sourceId;
        this.settings = settings;
        this.sink = sink;
        this.mapper = mapper;
        this.signalQueue = new BoundedQueue<>("signal", settings.signalQueueCap());
        this.metricQueue = new BoundedQueue<>("metric", settings.metricQueueCap());
        this.eventQueue = new BoundedQueue<>("event", settings.eventQueueCap());
        for (Counter counter : Counter.values()) {
            counters.put(counter, new AtomicLong());
        }
    }

    // ========== Lifecycle ==========

    /**
     * Start the flush and heartbeat schedules.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, r -> {
            Thread t = new Thread(r, "state-sync");
            t.setDaemon(true);
            return t;
        });
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        scheduler = executor;
        running = true;
        scheduleFlush(settings.flushInterval());
        long heartbeatMs = settings.heartbeatInterval().toMillis();
        scheduler.scheduleAtFixedRate(this::heartbeat, 0, heartbeatMs, TimeUnit.MILLISECONDS);
        log.info("State synchronizer started (sink {}, flush every {} ms)", sink.describe(),
            settings.flushInterval().toMillis());
    }

    /**
     * Stop the schedules, then flush what is left once on the calling thread.
     */
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        FlushResult last = flushNow();
        log.info("State synchronizer stopped; final flush wrote {} records{}", last.total(),
            last.failed() ? " before failing" : "");
    }

    public boolean isRunning() {
        return running;
    }

    private void scheduleFlush(Duration delay) {
        try {
            scheduler.schedule(this::scheduledFlush, delay.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.debug("Flush not rescheduled, synchronizer is stopping");
        }
    }

    private void scheduledFlush() {
        try {
            flushNow();
        } catch (RuntimeException e) {
            log.error("Unexpected flush failure", e);
        } finally {
            if (running) {
                scheduleFlush(settings.nextFlushDelay(consecutiveFailures));
            }
        }
    }

    // ========== Producers ==========

    public void enqueueSignal(Signal signal) {
        String metadata;
        try {
            metadata = mapper.writeValueAsString(signal.metadata());
        } catch (JsonProcessingException e) {
            log.error("Failed to encode metadata of signal {}", signal.id(), e);
            metadata = "{}";
        }
        signalQueue.offer(new SignalRecord(signal.id(), signal.traderId(), signal.symbol(), signal.timestamp(), metadata));
        increment(Counter.SIGNALS_CREATED, 1);
    }

    public void enqueueEvent(EventType type, Severity severity, String message, Map<String, ?> details) {
        String detailsJson;
        try {
            detailsJson = mapper.writeValueAsString(details != null ? details : Map.of());
        } catch (JsonProcessingException e) {
            log.warn("Failed to encode details of {} event", type.wireName(), e);
            detailsJson = "{}";
        }
        eventQueue.offer(new EventRecord(sourceId, type, severity, System.currentTimeMillis(), message, detailsJson));
        if (severity == Severity.ERROR) {
            increment(Counter.ERROR_EVENTS, 1);
        }
        log.debug("Queued {} event: {}", type.wireName(), message);
    }

    public void enqueueEvent(EventType type, Severity severity, String message) {
        enqueueEvent(type, severity, message, Map.of());
    }

    /**
     * Queue the current cumulative counters as a metric record.
     */
    public void enqueueMetricSnapshot() {
        metricQueue.offer(new MetricRecord(sourceId, System.currentTimeMillis(), counterValues()));
    }

    public void increment(Counter counter, long delta) {
        if (delta != 0) {
            counters.get(counter).addAndGet(delta);
        }
    }

    public long counter(Counter counter) {
        return counters.get(counter).get();
    }

    // ========== Flushing ==========

    /**
     * Drain every queue to the sink, signals first. Stops at the first failed batch, which is
     * put back at the head of its queue.
     */
    public FlushResult flushNow() {
        synchronized (flushLock) {
            int[] written = new int[3];
            try {
                written[0] = flushQueue(signalQueue, sink::writeSignals);
                written[1] = flushQueue(metricQueue, sink::writeMetrics);
                written[2] = flushQueue(eventQueue, sink::writeEvents);
                onFlushSucceeded();
                return new FlushResult(written[0], written[1], written[2], false);
            } catch (SinkException e) {
                onFlushFailed(e);
                return new FlushResult(written[0], written[1], written[2], true);
            }
        }
    }

    private <T> int flushQueue(BoundedQueue<T> queue, BatchWriter<T> writer) throws SinkException {
        int written = 0;
        while (!queue.isEmpty()) {
            List<T> batch = queue.drain(settings.maxBatchSize());
            try {
                writer.write(batch);
            } catch (SinkException e) {
                queue.requeueFront(batch);
                throw e;
            }
            written += batch.size();
            recordsWritten.addAndGet(batch.size());
        }
        if (written > 0) {
            log.debug("Flushed {} {} records", written, queue.name());
        }
        return written;
    }

    private void onFlushSucceeded() {
        if (consecutiveFailures > 0) {
            log.info("Persistence recovered after {} failed flushes", consecutiveFailures);
        }
        consecutiveFailures = 0;
        degraded = false;
    }

    private void onFlushFailed(SinkException e) {
        consecutiveFailures++;
        log.warn("Flush to {} failed ({} consecutive), next attempt in {} ms: {}", sink.describe(),
            consecutiveFailures, settings.nextFlushDelay(consecutiveFailures).toMillis(), e.getMessage());
        if (consecutiveFailures == settings.degradedAfterFailures()) {
            degraded = true;
            log.error("Persistence degraded after {} consecutive failed flushes", consecutiveFailures);
            enqueueEvent(EventType.PERSISTENCE_DEGRADED, Severity.ERROR,
                "Persistence failing after " + consecutiveFailures + " attempts",
                Map.of("consecutive_failures", consecutiveFailures, "error", String.valueOf(e.getMessage())));
        }
    }

    private void heartbeat() {
        try {
            sink.writeHeartbeat(buildHeartbeat());
        } catch (SinkException e) {
            log.warn("Heartbeat to {} failed: {}", sink.describe(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Unexpected heartbeat failure", e);
        }
    }

    public HeartbeatRecord buildHeartbeat() {
        Map<String, Long> values = new LinkedHashMap<>();
        values.put("uptime_ms", System.currentTimeMillis() - createdAt);
        values.put("signal_queue_depth", (long) signalQueue.size());
        values.put("metric_queue_depth", (long) metricQueue.size());
        values.put("event_queue_depth", (long) eventQueue.size());
        values.put("signal_evictions", signalQueue.evictions());
        values.put("metric_evictions", metricQueue.evictions());
        values.put("event_evictions", eventQueue.evictions());
        values.put("consecutive_failures", (long) consecutiveFailures);
        return new HeartbeatRecord(sourceId, System.currentTimeMillis(), degraded ? "degraded" : "ok", values);
    }

    // ========== Reads ==========

    private Map<String, Long> counterValues() {
        Map<String, Long> values = new LinkedHashMap<>();
        counters.forEach((counter, value) -> values.put(counter.wireName(), value.get()));
        return values;
    }

    public SyncStats stats() {
        return new SyncStats(running, signalQueue.size(), metricQueue.size(), eventQueue.size(),
            signalQueue.evictions(), metricQueue.evictions(), eventQueue.evictions(),
            consecutiveFailures, degraded, recordsWritten.get(), counterValues());
    }

    public boolean isDegraded() {
        return degraded;
    }

    public int getConsecutiveFailures() {
        return consecutiveFailures;
    }

    public List<SignalRecord> pendingSignals() {
        return signalQueue.peekAll();
    }

    public List<EventRecord> pendingEvents() {
        return eventQueue.peekAll();
    }
}
