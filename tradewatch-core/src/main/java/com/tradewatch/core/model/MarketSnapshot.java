package com.tradewatch.core.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Point-in-time, read-only view of one symbol: its ticker plus candles per interval.
 * Handed to strategy evaluation; the maps and lists cannot be modified.
 */
public record MarketSnapshot(
    String symbol,
    Ticker ticker,
    Map<String, List<Candle>> candles
) {
    public MarketSnapshot {
        Map<String, List<Candle>> copy = new LinkedHashMap<>();
        if (candles != null) {
            candles.forEach((interval, list) -> copy.put(interval, List.copyOf(list)));
        }
        candles = Collections.unmodifiableMap(copy);
    }

    /**
     * Candles for an interval, oldest first. Empty if the interval is not present.
     */
    public List<Candle> candles(String interval) {
        return candles.getOrDefault(interval, List.of());
    }

    public boolean hasInterval(String interval) {
        return !candles(interval).isEmpty();
    }

    /**
     * Ticker price, falling back to the newest close of any interval.
     */
    public double latestPrice() {
        if (ticker != null) {
            return ticker.lastPrice();
        }
        long newest = Long.MIN_VALUE;
        double price = Double.NaN;
        for (List<Candle> list : candles.values()) {
            if (!list.isEmpty()) {
                Candle last = list.get(list.size() - 1);
                if (last.openTime() > newest) {
                    newest = last.openTime();
                    price = last.close();
                }
            }
        }
        return price;
    }
}
