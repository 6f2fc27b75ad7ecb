package com.tradewatch.engine.screener;

import com.tradewatch.engine.sandbox.EvaluationResult;

import java.time.Duration;
import java.util.List;

/**
 * What one trader's task produced in a tick.
 *
 * @param matches   positive results, capped by the trader's max signals per run
 * @param evaluated symbols evaluated
 * @param abandoned true when the task did not finish within the tick budget
 */
public record TraderScreenResult(
    String traderId,
    List<EvaluationResult> matches,
    int evaluated,
    int runtimeErrors,
    int timeouts,
    Duration duration,
    boolean abandoned
) {
    public TraderScreenResult {
        matches = List.copyOf(matches);
    }

    public static TraderScreenResult abandoned(String traderId, Duration duration) {
        return new TraderScreenResult(traderId, List.of(), 0, 0, 0, duration, true);
    }
}
