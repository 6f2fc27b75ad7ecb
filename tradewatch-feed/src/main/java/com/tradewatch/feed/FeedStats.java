package com.tradewatch.feed;

/**
 * Counters of the market data client since construction.
 *
 * @param lastMessageTime epoch millis of the last received message, 0 if none yet
 */
public record FeedStats(
    long messagesReceived,
    long bufferUpdates,
    long malformedMessages,
    long closedCandles,
    long reconnects,
    long lastMessageTime
) {}
