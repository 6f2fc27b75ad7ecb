package com.tradewatch.runner.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Periodically asks each registered component for its status and keeps a bounded log of
 * recorded errors.
 *
 * Overall status is the worst component status, raised to degraded when the error rate over
 * the last five minutes exceeds five per minute or the heap is nearly full. A transition into
 * unhealthy is reported once to the listener.
 */
public class HealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitor.class);

    public static final int ERROR_LOG_SIZE = 1000;
    public static final Duration ERROR_RATE_WINDOW = Duration.ofMinutes(5);
    static final double DEGRADED_ERROR_RATE = 5.0;
    static final int DEGRADED_HEAP_PERCENT = 90;
    private static final int REPORTED_ERRORS = 20;

    public record ErrorEntry(long timestamp, String source, String message) {}

    private final Duration checkInterval;
    private final LongSupplier clock;
    private final long startedAt;

    private final Map<String, Supplier<HealthStatus>> components = new LinkedHashMap<>();
    private final Deque<ErrorEntry> errors = new ArrayDeque<>();
    private final List<Consumer<HealthReport>> unhealthyListeners = new ArrayList<>();

    private volatile HealthReport lastReport;
    private ScheduledExecutorService scheduler;

    public HealthMonitor(Duration checkInterval) {
        this(checkInterval, System::currentTimeMillis);
    }

    HealthMonitor(Duration checkInterval, LongSupplier clock) {
        this.checkInterval = checkInterval;
        this.clock = clock;
        this.startedAt = clock.getAsLong();
    }

    /**
     * Register a component probe. A probe that throws counts as unhealthy.
     */
    public synchronized void registerComponent(String name, Supplier<HealthStatus> probe) {
        components.put(name, probe);
    }

    public synchronized void addUnhealthyListener(Consumer<HealthReport> listener) {
        unhealthyListeners.add(listener);
    }

    public void recordError(String source, String message) {
        synchronized (errors) {
            errors.addLast(new ErrorEntry(clock.getAsLong(), source, message));
            while (errors.size() > ERROR_LOG_SIZE) {
                errors.pollFirst();
            }
        }
        log.debug("Error recorded from {}: {}", source, message);
    }

    public double errorRatePerMinute() {
        long windowStart = clock.getAsLong() - ERROR_RATE_WINDOW.toMillis();
        int recent = 0;
        synchronized (errors) {
            for (ErrorEntry entry : errors) {
                if (entry.timestamp() >= windowStart) {
                    recent++;
                }
            }
        }
        return recent / (double) ERROR_RATE_WINDOW.toMinutes();
    }

    public List<ErrorEntry> errorLog() {
        synchronized (errors) {
            return new ArrayList<>(errors);
        }
    }

    /**
     * Run one check now and notify listeners on a transition into unhealthy.
     */
    public HealthReport check() {
        Map<String, Supplier<HealthStatus>> probes;
        List<Consumer<HealthReport>> listeners;
        synchronized (this) {
            probes = new LinkedHashMap<>(components);
            listeners = new ArrayList<>(unhealthyListeners);
        }

        Map<String, HealthStatus> statuses = new LinkedHashMap<>();
        HealthStatus overall = HealthStatus.HEALTHY;
        for (Map.Entry<String, Supplier<HealthStatus>> probe : probes.entrySet()) {
            HealthStatus status;
            try {
                status = probe.getValue().get();
                if (status == null) {
                    status = HealthStatus.UNHEALTHY;
                }
            } catch (RuntimeException e) {
                log.warn("Health probe {} failed: {}", probe.getKey(), e.getMessage());
                recordError(probe.getKey(), "Health probe failed: " + e.getMessage());
                status = HealthStatus.UNHEALTHY;
            }
            statuses.put(probe.getKey(), status);
            overall = overall.worst(status);
        }

        double errorRate = errorRatePerMinute();
        if (errorRate > DEGRADED_ERROR_RATE) {
            overall = overall.worst(HealthStatus.DEGRADED);
        }
        int heap = heapUsedPercent();
        if (heap > DEGRADED_HEAP_PERCENT) {
            overall = overall.worst(HealthStatus.DEGRADED);
        }

        List<ErrorEntry> all = errorLog();
        List<ErrorEntry> recent = all.subList(Math.max(0, all.size() - REPORTED_ERRORS), all.size());
        long now = clock.getAsLong();
        HealthReport report = new HealthReport(overall, now, now - startedAt, statuses, errorRate, heap, recent);

        HealthReport previous = lastReport;
        lastReport = report;
        HealthStatus before = previous != null ? previous.status() : HealthStatus.HEALTHY;
        if (overall != before) {
            log.info("Health changed {} -> {} {}", before.wireName(), overall.wireName(), statuses);
        }
        if (overall == HealthStatus.UNHEALTHY && before != HealthStatus.UNHEALTHY) {
            for (Consumer<HealthReport> listener : listeners) {
                try {
                    listener.accept(report);
                } catch (RuntimeException e) {
                    log.error("Unhealthy listener failed", e);
                }
            }
        }
        return report;
    }

    /**
     * The most recent report, running a check first if none exists yet.
     */
    public HealthReport latest() {
        HealthReport report = lastReport;
        return report != null ? report : check();
    }

    private static int heapUsedPercent() {
        Runtime runtime = Runtime.getRuntime();
        long max = runtime.maxMemory();
        if (max <= 0 || max == Long.MAX_VALUE) {
            return 0;
        }
        long used = runtime.totalMemory() - runtime.freeMemory();
        return (int) (used * 100 / max);
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-monitor");
            t.setDaemon(true);
            return t;
        });
        long ms = checkInterval.toMillis();
        scheduler.scheduleAtFixedRate(() -> {
            try {
                check();
            } catch (RuntimeException e) {
                log.error("Health check failed", e);
            }
        }, ms, ms, TimeUnit.MILLISECONDS);
        log.info("Health monitor started (every {} ms, components {})", ms, components.keySet());
    }

    public synchronized void stop() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }
}
