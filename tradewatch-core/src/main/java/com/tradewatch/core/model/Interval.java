package com.tradewatch.core.model;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Binance kline interval strings ("1m", "15m", "4h", "1d", ...).
 */
public final class Interval {

    /**
     * Interval always subscribed and used when a trader declares none.
     */
    public static final String DEFAULT = "1m";

    private static final Map<String, Duration> KNOWN = Map.ofEntries(
        Map.entry("1s", Duration.ofSeconds(1)),
        Map.entry("1m", Duration.ofMinutes(1)),
        Map.entry("3m", Duration.ofMinutes(3)),
        Map.entry("5m", Duration.ofMinutes(5)),
        Map.entry("15m", Duration.ofMinutes(15)),
        Map.entry("30m", Duration.ofMinutes(30)),
        Map.entry("1h", Duration.ofHours(1)),
        Map.entry("2h", Duration.ofHours(2)),
        Map.entry("4h", Duration.ofHours(4)),
        Map.entry("6h", Duration.ofHours(6)),
        Map.entry("8h", Duration.ofHours(8)),
        Map.entry("12h", Duration.ofHours(12)),
        Map.entry("1d", Duration.ofDays(1)),
        Map.entry("3d", Duration.ofDays(3)),
        Map.entry("1w", Duration.ofDays(7)),
        // Exchange month, approximated for dedupe windows
        Map.entry("1M", Duration.ofDays(30))
    );

    private Interval() {}

    /**
     * Parse an interval string to its duration.
     * Accepts the exchange intervals plus generic forms such as "2m" or "3h".
     *
     * @throws IllegalArgumentException if the string is not a valid interval
     */
    public static Duration parse(String interval) {
        if (interval == null || interval.isBlank()) {
            throw new IllegalArgumentException("Empty interval");
        }
        Duration known = KNOWN.get(interval);
        if (known != null) {
            return known;
        }

        int i = 0;
        while (i < interval.length() && Character.isDigit(interval.charAt(i))) {
            i++;
        }
        if (i == 0 || i == interval.length()) {
            throw new IllegalArgumentException("Invalid interval format: " + interval);
        }

        long value;
        try {
            value = Long.parseLong(interval.substring(0, i));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid interval number: " + interval);
        }
        if (value <= 0) {
            throw new IllegalArgumentException("Invalid interval number: " + interval);
        }

        return switch (interval.substring(i)) {
            case "s" -> Duration.ofSeconds(value);
            case "m" -> Duration.ofMinutes(value);
            case "h" -> Duration.ofHours(value);
            case "d" -> Duration.ofDays(value);
            case "w" -> Duration.ofDays(value * 7);
            default -> throw new IllegalArgumentException("Unsupported interval unit: " + interval);
        };
    }

    public static boolean isValid(String interval) {
        try {
            parse(interval);
            return true;
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static long toMillis(String interval) {
        return parse(interval).toMillis();
    }

    /**
     * Round a timestamp down to the open time of the candle containing it.
     */
    public static long openTimeOf(long timestampMs, String interval) {
        long ms = toMillis(interval);
        return timestampMs - Math.floorMod(timestampMs, ms);
    }

    /**
     * Intervals offered to strategy authors.
     */
    public static List<String> supported() {
        return List.of("1m", "5m", "15m", "30m", "1h", "4h", "1d");
    }
}
