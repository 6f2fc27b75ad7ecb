package com.tradewatch.engine.screener;

import com.tradewatch.engine.sandbox.EvaluationResult;

import java.time.Duration;
import java.util.List;

/**
 * Outcome of one screening tick.
 *
 * @param timestamp      tick time in epoch millis
 * @param results        one entry per trader that was due
 * @param skippedInvalid enabled traders skipped because their code does not compile
 */
public record ScreeningReport(long timestamp, List<TraderScreenResult> results, int skippedInvalid, Duration duration) {

    public ScreeningReport {
        results = List.copyOf(results);
    }

    public static ScreeningReport empty(long timestamp) {
        return new ScreeningReport(timestamp, List.of(), 0, Duration.ZERO);
    }

    public int dueTraders() {
        return results.size();
    }

    public List<EvaluationResult> allMatches() {
        return results.stream().flatMap(r -> r.matches().stream()).toList();
    }

    public int totalMatches() {
        return results.stream().mapToInt(r -> r.matches().size()).sum();
    }

    public int totalEvaluated() {
        return results.stream().mapToInt(TraderScreenResult::evaluated).sum();
    }

    public int totalRuntimeErrors() {
        return results.stream().mapToInt(TraderScreenResult::runtimeErrors).sum();
    }

    public int totalTimeouts() {
        return results.stream().mapToInt(TraderScreenResult::timeouts).sum();
    }

    public int abandonedCount() {
        return (int) results.stream().filter(TraderScreenResult::abandoned).count();
    }
}
