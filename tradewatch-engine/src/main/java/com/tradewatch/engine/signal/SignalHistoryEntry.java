package com.tradewatch.engine.signal;

/**
 * Dedupe state for one (trader, symbol). Mutated only on the tick thread.
 */
public class SignalHistoryEntry {

    private final String traderId;
    private final String symbol;
    private final String interval;
    private long lastSignalTime;
    private int barsSinceSignal;
    private int continuingMatches;

    public SignalHistoryEntry(String traderId, String symbol, String interval, long lastSignalTime) {
        this.traderId = traderId;
        this.symbol = symbol;
        this.interval = interval;
        this.lastSignalTime = lastSignalTime;
    }

    public String getTraderId() {
        return traderId;
    }

    public String getSymbol() {
        return symbol;
    }

    /**
     * Interval whose candle closes advance the bar count.
     */
    public String getInterval() {
        return interval;
    }

    public long getLastSignalTime() {
        return lastSignalTime;
    }

    public int getBarsSinceSignal() {
        return barsSinceSignal;
    }

    public int getContinuingMatches() {
        return continuingMatches;
    }

    void onBarClosed() {
        barsSinceSignal++;
    }

    void onContinuing() {
        continuingMatches++;
    }

    void reset(long timestamp) {
        lastSignalTime = timestamp;
        barsSinceSignal = 0;
        continuingMatches = 0;
    }
}
