package com.oracle.thinking.core;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity ring buffer. Once full, each {@link #add} overwrites the oldest item.
 * Not thread-safe; owners synchronize access.
 */
public class CircularBuffer<T> {

    private final Object[] items;
    private final int capacity;
    private int head = -1;
    private int size;

    public CircularBuffer(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("Capacity must be a positive integer, got " + capacity);
        }
        this.capacity = capacity;
        this.items = new Object[capacity];
    }

    public void add(T item) {
        head = (head + 1) % capacity;
        items[head] = item;
        size = Math.min(size + 1, capacity);
    }

    /**
     * All items, oldest first.
     */
    public List<T> getAll() {
        return getAll(size);
    }

    /**
     * The most recent {@code limit} items, oldest first. A limit of zero or less yields an empty list.
     */
    public List<T> getAll(int limit) {
        if (limit <= 0 || size == 0) {
            return Collections.emptyList();
        }
        int count = Math.min(limit, size);
        List<T> result = new ArrayList<>(count);
        int start = head - count + 1;
        for (int i = 0; i < count; i++) {
            result.add(at(start + i));
        }
        return result;
    }

    public Optional<T> getOldest() {
        return size == 0 ? Optional.empty() : Optional.ofNullable(at(head - size + 1));
    }

    public Optional<T> getNewest() {
        return size == 0 ? Optional.empty() : Optional.ofNullable(at(head));
    }

    public int size() {
        return size;
    }

    public int capacity() {
        return capacity;
    }

    public boolean isFull() {
        return size == capacity;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public void clear() {
        Arrays.fill(items, null);
        head = -1;
        size = 0;
    }

    @SuppressWarnings("unchecked")
    private T at(int index) {
        return (T) items[Math.floorMod(index, capacity)];
    }
}
