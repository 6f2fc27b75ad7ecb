package com.tradewatch.runner.health;

import java.util.List;
import java.util.Map;

/**
 * Result of one health check.
 *
 * @param status             worst of the component statuses and the error-rate verdict
 * @param errorRatePerMinute errors recorded per minute over the rate window
 * @param recentErrors       newest errors, newest last
 */
public record HealthReport(
    HealthStatus status,
    long timestamp,
    long uptimeMs,
    Map<String, HealthStatus> components,
    double errorRatePerMinute,
    int heapUsedPercent,
    List<HealthMonitor.ErrorEntry> recentErrors
) {
    public HealthReport {
        components = Map.copyOf(components);
        recentErrors = List.copyOf(recentErrors);
    }

    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
