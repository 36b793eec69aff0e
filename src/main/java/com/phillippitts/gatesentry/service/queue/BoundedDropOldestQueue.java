package com.phillippitts.gatesentry.service.queue;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Bounded multi-producer queue that evicts the oldest element instead of blocking or rejecting.
 *
 * <p>Used at every context boundary (frames, state updates, gate events). Producers never block;
 * overflow is reported to the caller through the return value of {@link #offer(Object)} and counted.
 *
 * <p><b>Thread Safety:</b> all methods are guarded by a single {@link ReentrantLock}.
 *
 * @param <T> element type
 */
public final class BoundedDropOldestQueue<T> {

    private final String name;
    private final int capacity;
    private final Deque<T> items;
    private final Lock lock = new ReentrantLock();
    private final AtomicLong dropped = new AtomicLong();

    public BoundedDropOldestQueue(String name, int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got " + capacity);
        }
        this.name = name;
        this.capacity = capacity;
        this.items = new ArrayDeque<>(capacity);
    }

    /**
     * Appends an element, evicting the oldest one if the queue is full.
     *
     * @return the evicted element, or empty if nothing was dropped
     * @throws NullPointerException if item is null
     */
    public Optional<T> offer(T item) {
        if (item == null) {
            throw new NullPointerException("item cannot be null");
        }
        lock.lock();
        try {
            T evicted = null;
            if (items.size() >= capacity) {
                evicted = items.pollFirst();
                dropped.incrementAndGet();
            }
            items.addLast(item);
            return Optional.ofNullable(evicted);
        } finally {
            lock.unlock();
        }
    }

    /** Re-inserts an element at the head so it is taken first on the next poll. Drops it if full. */
    public boolean pushFront(T item) {
        lock.lock();
        try {
            if (items.size() >= capacity) {
                dropped.incrementAndGet();
                return false;
            }
            items.addFirst(item);
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Removes and returns up to {@code max} elements, oldest first. */
    public List<T> pollBatch(int max) {
        lock.lock();
        try {
            int n = Math.min(max, items.size());
            List<T> out = new ArrayList<>(n);
            for (int i = 0; i < n; i++) {
                out.add(items.pollFirst());
            }
            return out;
        } finally {
            lock.unlock();
        }
    }

    /** Removes and returns every pending element, oldest first. */
    public List<T> drainAll() {
        lock.lock();
        try {
            List<T> out = new ArrayList<>(items);
            items.clear();
            return out;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return items.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public int capacity() {
        return capacity;
    }

    /** Total number of elements evicted since creation. */
    public long droppedCount() {
        return dropped.get();
    }

    public String name() {
        return name;
    }
}
