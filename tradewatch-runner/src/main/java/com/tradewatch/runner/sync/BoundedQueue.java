package com.tradewatch.runner.sync;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Drop-oldest FIFO queue with a fixed cap.
 *
 * When full, adding an item evicts the oldest one and counts the eviction. Producers on
 * different threads serialize on the queue's lock; the later arrival is kept.
 */
public class BoundedQueue<T> {

    private static final Logger log = LoggerFactory.getLogger(BoundedQueue.class);

    private final String name;
    private final int capacity;
    private final Deque<T> items = new ArrayDeque<>();
    private final Object lock = new Object();
    private long evictions;

    public BoundedQueue(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
    }

    /**
     * Append an item, evicting the oldest when full.
     *
     * @return true if an item was evicted
     */
    public boolean offer(T item) {
        synchronized (lock) {
            boolean evicted = false;
            if (items.size() >= capacity) {
                items.pollFirst();
                evictions++;
                evicted = true;
            }
            items.addLast(item);
            if (evicted) {
                log.warn("{} queue full (cap {}), evicted oldest item; {} evictions so far", name, capacity, evictions);
            }
            return evicted;
        }
    }

    /**
     * Remove up to {@code max} items from the head.
     */
    public List<T> drain(int max) {
        synchronized (lock) {
            int n = Math.min(max, items.size());
            List<T> batch = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                batch.add(items.pollFirst());
            }
            return batch;
        }
    }

    /**
     * Put a failed batch back at the head, in its original order. Items beyond the cap are
     * evicted from the head, i.e. the oldest go first.
     */
    public void requeueFront(List<T> batch) {
        synchronized (lock) {
            for (int i = batch.size() - 1; i >= 0; i--) {
                items.addFirst(batch.get(i));
            }
            int dropped = 0;
            while (items.size() > capacity) {
                items.pollFirst();
                evictions++;
                dropped++;
            }
            if (dropped > 0) {
                log.warn("{} queue over cap after retry, evicted {} oldest items", name, dropped);
            }
        }
    }

    public int size() {
        synchronized (lock) {
            return items.size();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public long evictions() {
        synchronized (lock) {
            return evictions;
        }
    }

    public int capacity() {
        return capacity;
    }

    public String name() {
        return name;
    }

    /**
     * Copy of the queued items, oldest first.
     */
    public List<T> peekAll() {
        synchronized (lock) {
            return new ArrayList<>(items);
        }
    }
}
