package com.tradewatch.runner.sync;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Cumulative counters reported in metric records.
 */
public enum Counter {
    SIGNALS_CREATED,
    EVALUATIONS,
    RUNTIME_ERRORS,
    TIMEOUTS,
    COMPILE_ERRORS,
    ERROR_EVENTS,
    TICKS,
    ABANDONED_TASKS;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
