package com.tradewatch.feed;

import com.tradewatch.core.model.Candle;

import java.util.ArrayList;
import java.util.List;

/**
 * Fixed-capacity ring buffer of candles for one (symbol, interval).
 *
 * Open times are strictly increasing and the length never exceeds the capacity. Only the
 * newest candle may change, and only while it is still forming. A single writer (the feed
 * thread) applies updates; readers take copies under the same lock.
 */
public class CandleBuffer {

    public enum Action {
        APPENDED,
        REPLACED,
        IGNORED
    }

    /**
     * Result of applying one candle.
     *
     * @param closed candles this update closed, oldest first. Usually empty or the applied
     *               candle itself; a forming candle superseded by a newer open time is closed
     *               implicitly and reported here as well.
     */
    public record Update(Action action, List<Candle> closed) {
        static final Update IGNORED = new Update(Action.IGNORED, List.of());

        public boolean changed() {
            return action != Action.IGNORED;
        }
    }

    private final String symbol;
    private final String interval;
    private final Candle[] ring;
    private final Object lock = new Object();
    private int head;
    private int size;

    public CandleBuffer(String symbol, String interval, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.symbol = symbol;
        this.interval = interval;
        this.ring = new Candle[capacity];
    }

    public Update apply(Candle candle) {
        synchronized (lock) {
            if (size == 0) {
                append(candle);
                return new Update(Action.APPENDED, candle.closed() ? List.of(candle) : List.of());
            }

            int lastIndex = (head + size - 1) % ring.length;
            Candle last = ring[lastIndex];

            if (candle.openTime() > last.openTime()) {
                List<Candle> closed = new ArrayList<>(2);
                if (!last.closed()) {
                    Candle sealed = last.asClosed();
                    ring[lastIndex] = sealed;
                    closed.add(sealed);
                }
                append(candle);
                if (candle.closed()) {
                    closed.add(candle);
                }
                return new Update(Action.APPENDED, closed);
            }

            if (candle.openTime() == last.openTime() && !last.closed()) {
                ring[lastIndex] = candle;
                return new Update(Action.REPLACED, candle.closed() ? List.of(candle) : List.of());
            }

            // Older than the last candle, or a repeat of a closed one
            return Update.IGNORED;
        }
    }

    private void append(Candle candle) {
        if (size < ring.length) {
            ring[(head + size) % ring.length] = candle;
            size++;
        } else {
            ring[head] = candle;
            head = (head + 1) % ring.length;
        }
    }

    /**
     * Copy of the candles, oldest first.
     */
    public List<Candle> snapshot() {
        synchronized (lock) {
            List<Candle> copy = new ArrayList<>(size);
            for (int i = 0; i < size; i++) {
                copy.add(ring[(head + i) % ring.length]);
            }
            return copy;
        }
    }

    public Candle last() {
        synchronized (lock) {
            return size == 0 ? null : ring[(head + size - 1) % ring.length];
        }
    }

    public int size() {
        synchronized (lock) {
            return size;
        }
    }

    public int capacity() {
        return ring.length;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getInterval() {
        return interval;
    }
}
