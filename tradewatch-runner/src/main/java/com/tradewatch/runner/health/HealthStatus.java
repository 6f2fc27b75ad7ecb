package com.tradewatch.runner.health;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Component and overall health, ordered from best to worst.
 */
public enum HealthStatus {
    HEALTHY,
    DEGRADED,
    UNHEALTHY;

    public HealthStatus worst(HealthStatus other) {
        return other != null && other.ordinal() > ordinal() ? other : this;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
