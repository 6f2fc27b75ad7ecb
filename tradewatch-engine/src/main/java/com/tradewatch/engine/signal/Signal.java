package com.tradewatch.engine.signal;

import com.tradewatch.engine.sandbox.IndicatorSeries;

import java.util.List;
import java.util.Map;

/**
 * A deduplicated match of a trader on a symbol. Created once, never mutated.
 *
 * @param timestamp epoch millis of the tick that produced it
 * @param price     last price at that tick
 */
public record Signal(
    String id,
    String traderId,
    String traderName,
    int traderVersion,
    String symbol,
    String interval,
    long timestamp,
    double price,
    Metadata metadata
) {
    /**
     * Market context and strategy output captured with the signal.
     */
    public record Metadata(
        double lastPrice,
        double priceChangePercent,
        double quoteVolume,
        List<String> reasoning,
        Map<String, IndicatorSeries> indicators
    ) {
        public Metadata {
            reasoning = List.copyOf(reasoning);
            indicators = Map.copyOf(indicators);
        }
    }

    public String toSummary() {
        return String.format("%s %s @ %.4f (%s v%d, %s)", symbol, traderName, price, traderId, traderVersion, interval);
    }
}
