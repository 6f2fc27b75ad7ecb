package com.tradewatch.core.model;

/**
 * Latest 24h ticker summary for a symbol. Only the most recent update is kept.
 */
public record Ticker(
    String symbol,
    double lastPrice,
    double priceChangePercent,
    double quoteVolume,
    long eventTime
) {}
