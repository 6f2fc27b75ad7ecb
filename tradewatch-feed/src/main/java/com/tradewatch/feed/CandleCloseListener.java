package com.tradewatch.feed;

import com.tradewatch.core.model.Candle;

/**
 * Notified once per candle when it closes. Called on the feed thread; implementations must not block.
 */
@FunctionalInterface
public interface CandleCloseListener {
    void onCandleClosed(String symbol, String interval, Candle candle);
}
