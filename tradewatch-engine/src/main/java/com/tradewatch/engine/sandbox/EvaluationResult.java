package com.tradewatch.engine.sandbox;

import com.tradewatch.core.model.Candle;

import java.util.List;
import java.util.Map;

/**
 * Outcome of evaluating one trader against one symbol in a tick.
 * Indicators, reasoning and candles are empty unless the filter matched.
 */
public record EvaluationResult(
    String traderId,
    String symbol,
    boolean matched,
    List<String> reasoning,
    Map<String, IndicatorSeries> indicators,
    List<Candle> candles
) {
    public EvaluationResult {
        reasoning = List.copyOf(reasoning);
        indicators = Map.copyOf(indicators);
        candles = List.copyOf(candles);
    }

    public static EvaluationResult noMatch(String traderId, String symbol) {
        return new EvaluationResult(traderId, symbol, false, List.of(), Map.of(), List.of());
    }
}
