package com.swarmcore.core.metrics;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Optional;

/**
 * Fixed-capacity ring that evicts the oldest element when full. Thread-safe.
 */
public class SampleRing<T> {

    private final Deque<T> elements;
    private final int capacity;

    public SampleRing(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.elements = new ArrayDeque<>(capacity);
    }

    public synchronized void add(T element) {
        if (elements.size() == capacity) {
            elements.pollFirst();
        }
        elements.addLast(element);
    }

    public synchronized Optional<T> latest() {
        return Optional.ofNullable(elements.peekLast());
    }

    /**
     * Elements oldest first.
     */
    public synchronized List<T> toList() {
        return List.copyOf(elements);
    }

    public synchronized int size() {
        return elements.size();
    }

    public int capacity() {
        return capacity;
    }
}
