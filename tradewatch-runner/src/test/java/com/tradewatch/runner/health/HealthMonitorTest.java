package com.tradewatch.runner.health;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class HealthMonitorTest {

    private AtomicLong now;
    private HealthMonitor monitor;
    private AtomicReference<HealthStatus> marketData;

    @BeforeEach
    void setUp() {
        now = new AtomicLong(1_700_000_000_000L);
        monitor = new HealthMonitor(Duration.ofSeconds(30), now::get);
        marketData = new AtomicReference<>(HealthStatus.HEALTHY);
        monitor.registerComponent("market_data", marketData::get);
        monitor.registerComponent("persistence", () -> HealthStatus.HEALTHY);
    }

    @Nested
    @DisplayName("Overall status")
    class StatusTests {

        @Test
        @DisplayName("Overall is the worst component")
        void worstComponent() {
            assertEquals(HealthStatus.HEALTHY, monitor.check().status());

            marketData.set(HealthStatus.DEGRADED);
            HealthReport report = monitor.check();

            assertEquals(HealthStatus.DEGRADED, report.status());
            assertEquals(HealthStatus.DEGRADED, report.components().get("market_data"));
            assertEquals(HealthStatus.HEALTHY, report.components().get("persistence"));
        }

        @Test
        @DisplayName("A throwing probe counts as unhealthy and is logged as an error")
        void throwingProbe() {
            monitor.registerComponent("workers", () -> {
                throw new IllegalStateException("pool gone");
            });

            HealthReport report = monitor.check();

            assertEquals(HealthStatus.UNHEALTHY, report.status());
            assertEquals(1, monitor.errorLog().size());
        }

        @Test
        @DisplayName("High error rate degrades an otherwise healthy system")
        void errorRateDegrades() {
            for (int i = 0; i < 30; i++) {
                monitor.recordError("screener", "boom " + i);
            }

            HealthReport report = monitor.check();

            assertEquals(6.0, report.errorRatePerMinute(), 1e-9);
            assertEquals(HealthStatus.DEGRADED, report.status());
        }
    }

    @Nested
    @DisplayName("Error log")
    class ErrorLogTests {

        @Test
        @DisplayName("Errors older than the window do not count toward the rate")
        void windowedRate() {
            for (int i = 0; i < 10; i++) {
                monitor.recordError("feed", "old");
            }
            now.addAndGet(Duration.ofMinutes(6).toMillis());
            monitor.recordError("feed", "new");

            assertEquals(0.2, monitor.errorRatePerMinute(), 1e-9);
            assertEquals(11, monitor.errorLog().size());
        }

        @Test
        @DisplayName("Log keeps the newest 1000 entries")
        void bounded() {
            for (int i = 0; i < 1010; i++) {
                monitor.recordError("feed", "e" + i);
            }

            List<HealthMonitor.ErrorEntry> log = monitor.errorLog();
            assertEquals(HealthMonitor.ERROR_LOG_SIZE, log.size());
            assertEquals("e10", log.get(0).message());
        }
    }

    @Test
    @DisplayName("Listener fires once per transition into unhealthy")
    void unhealthyTransition() {
        List<HealthReport> fired = new ArrayList<>();
        monitor.addUnhealthyListener(fired::add);

        marketData.set(HealthStatus.UNHEALTHY);
        monitor.check();
        monitor.check();
        marketData.set(HealthStatus.HEALTHY);
        monitor.check();
        marketData.set(HealthStatus.UNHEALTHY);
        monitor.check();

        assertEquals(2, fired.size());
        assertEquals(HealthStatus.UNHEALTHY, fired.get(0).components().get("market_data"));
    }
}
