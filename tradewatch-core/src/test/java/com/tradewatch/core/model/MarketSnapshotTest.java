package com.tradewatch.core.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class MarketSnapshotTest {

    @Test
    @DisplayName("Snapshot is detached from the source lists and read-only")
    void snapshotIsReadOnly() {
        List<Candle> source = new ArrayList<>(List.of(new Candle(0, 1, 2, 0.5, 1.5, 10)));
        MarketSnapshot snapshot = new MarketSnapshot("BTCUSDT", null, Map.of("1m", source));

        source.add(new Candle(60_000, 1.5, 2, 1, 1.8, 10));

        assertEquals(1, snapshot.candles("1m").size());
        assertThrows(UnsupportedOperationException.class, () -> snapshot.candles("1m").clear());
        assertTrue(snapshot.candles("4h").isEmpty());
    }

    @Test
    @DisplayName("Latest price prefers the ticker")
    void latestPrice() {
        Map<String, List<Candle>> candles = Map.of("1m", List.of(new Candle(0, 1, 2, 0.5, 1.5, 10)));

        assertEquals(1.5, new MarketSnapshot("X", null, candles).latestPrice());
        assertEquals(2.0, new MarketSnapshot("X", new Ticker("X", 2.0, 1, 1, 0), candles).latestPrice());
    }

    @Test
    @DisplayName("Trader intervals include refresh interval and timeframes")
    void traderIntervals() {
        Trader trader = new Trader("t1", "Dip", "RSI(14) < 30", "15m");
        trader.setRequiredTimeframes(List.of("4h", "15m"));

        assertEquals("15m", trader.primaryInterval());
        assertEquals(Set.of("15m", "4h"), trader.allIntervals());

        trader.setRefreshInterval(null);
        assertEquals(Interval.DEFAULT, trader.primaryInterval());
    }

    @Test
    @DisplayName("Trader change detection")
    void traderChanges() {
        Trader a = new Trader("t1", "Dip", "RSI(14) < 30", "15m");
        Trader b = new Trader("t1", "Dip renamed", "RSI(14) < 30", "15m");

        assertFalse(a.differsFrom(b));
        b.setFilterCode("RSI(14) < 25");
        assertTrue(a.differsFrom(b));
    }
}
