package com.tradewatch.runner.sync;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class BoundedQueueTest {

    @Test
    @DisplayName("Full queue evicts the oldest item")
    void evictsOldest() {
        BoundedQueue<Integer> queue = new BoundedQueue<>("test", 3);
        assertFalse(queue.offer(1));
        queue.offer(2);
        queue.offer(3);

        assertTrue(queue.offer(4));
        assertEquals(List.of(2, 3, 4), queue.peekAll());
        assertEquals(1, queue.evictions());
    }

    @Test
    @DisplayName("Drain takes at most the requested number from the head")
    void drainBatch() {
        BoundedQueue<Integer> queue = new BoundedQueue<>("test", 10);
        for (int i = 0; i < 5; i++) {
            queue.offer(i);
        }

        assertEquals(List.of(0, 1, 2), queue.drain(3));
        assertEquals(List.of(3, 4), queue.drain(3));
        assertTrue(queue.drain(3).isEmpty());
    }

    @Test
    @DisplayName("Requeued batch goes back in front in original order")
    void requeueKeepsOrder() {
        BoundedQueue<Integer> queue = new BoundedQueue<>("test", 10);
        queue.offer(1);
        queue.offer(2);
        List<Integer> batch = queue.drain(2);
        queue.offer(3);

        queue.requeueFront(batch);

        assertEquals(List.of(1, 2, 3), queue.peekAll());
    }

    @Test
    @DisplayName("Requeue beyond the cap drops the oldest items")
    void requeueOverCap() {
        BoundedQueue<Integer> queue = new BoundedQueue<>("test", 3);
        queue.offer(1);
        queue.offer(2);
        List<Integer> batch = queue.drain(2);
        queue.offer(3);
        queue.offer(4);

        queue.requeueFront(batch);

        assertEquals(List.of(2, 3, 4), queue.peekAll());
        assertEquals(1, queue.evictions());
    }

    @Test
    @DisplayName("Capacity below one is rejected")
    void rejectsZeroCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new BoundedQueue<>("test", 0));
    }
}
