package com.dispatchplatform.common.memory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Predicate;

/**
 * Bounded FIFO buffer with a single writer and lock-free readers.
 *
 * <p>Every write publishes a fresh immutable snapshot through a volatile field, so readers on
 * any thread see a consistent list. Elements are kept oldest first; once the bound is exceeded
 * the oldest element is evicted.
 */
public class BoundedRing<T> {

    private final int capacity;
    private volatile List<T> items = List.of();

    public BoundedRing(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be positive: " + capacity);
        this.capacity = capacity;
    }

    public void append(T item) {
        List<T> next = new ArrayList<>(items.size() + 1);
        next.addAll(items);
        next.add(item);
        while (next.size() > capacity) {
            next.remove(0);
        }
        items = List.copyOf(next);
    }

    /** Replaces the first element matching {@code target} with {@code replacement}. */
    public void replaceFirst(Predicate<T> target, T replacement) {
        List<T> next = new ArrayList<>(items);
        for (int i = 0; i < next.size(); i++) {
            if (target.test(next.get(i))) {
                next.set(i, replacement);
                items = List.copyOf(next);
                return;
            }
        }
    }

    /** The newest {@code n} elements, oldest first. */
    public List<T> recent(int n) {
        List<T> snapshot = items;
        if (n >= snapshot.size()) return snapshot;
        return snapshot.subList(snapshot.size() - Math.max(n, 0), snapshot.size());
    }

    /** The newest {@code n} elements, newest first. */
    public List<T> newestFirst(int n) {
        List<T> recent = new ArrayList<>(recent(n));
        Collections.reverse(recent);
        return List.copyOf(recent);
    }

    public List<T> snapshot() {
        return items;
    }

    public int size() {
        return items.size();
    }

    public int capacity() {
        return capacity;
    }
}
