package com.tradewatch.feed;

/**
 * Connection state of the market data stream.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    /** Socket open but no message received within the stale threshold. */
    DEGRADED
}
