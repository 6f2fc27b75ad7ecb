package com.tradewatch.runner.sync;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle and fault events reported to the sink.
 */
public enum EventType {
    MACHINE_STARTED,
    MACHINE_STOPPED,
    CONFIG_SYNCED,
    TRADER_INVALID,
    SIGNAL_CREATED,
    WEBSOCKET_CONNECTED,
    WEBSOCKET_DISCONNECTED,
    COMPONENT_RESTARTED,
    PERSISTENCE_DEGRADED,
    HEALTH_CHECK_FAILED,
    SCREENING_PAUSED,
    SCREENING_RESUMED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
