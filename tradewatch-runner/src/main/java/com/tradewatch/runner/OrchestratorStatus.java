package com.tradewatch.runner;

import com.tradewatch.engine.screener.ScreenerStats;
import com.tradewatch.feed.ConnectionState;
import com.tradewatch.feed.FeedStats;
import com.tradewatch.runner.sync.StateSynchronizer;

import java.util.List;

/**
 * Point-in-time view of the orchestrator for the status endpoint and the STATUS log line.
 *
 * @param lastTickAt epoch millis of the last completed tick, 0 before the first
 */
public record OrchestratorStatus(
    boolean running,
    boolean paused,
    int traders,
    int enabledTraders,
    int invalidTraders,
    List<String> intervals,
    List<String> symbols,
    ConnectionState feedState,
    FeedStats feed,
    ScreenerStats screener,
    StateSynchronizer.SyncStats sync,
    long ticks,
    long lastTickAt,
    long lastTickMs,
    int trackedSignals
) {
    public OrchestratorStatus {
        intervals = List.copyOf(intervals);
        symbols = List.copyOf(symbols);
    }
}
