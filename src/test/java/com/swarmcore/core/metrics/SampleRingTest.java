package com.swarmcore.core.metrics;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SampleRingTest {

    @Test
    @DisplayName("keeps the newest elements up to capacity, oldest first")
    void overwritesOldest() {
        var ring = new SampleRing<Integer>(3);
        for (int i = 1; i <= 5; i++) {
            ring.add(i);
        }
        assertEquals(List.of(3, 4, 5), ring.toList());
        assertEquals(5, ring.latest().orElseThrow());
        assertEquals(3, ring.size());
    }

    @Test
    @DisplayName("empty ring has no latest element")
    void empty() {
        var ring = new SampleRing<String>(2);
        assertTrue(ring.latest().isEmpty());
        assertTrue(ring.toList().isEmpty());
    }

    @Test
    @DisplayName("capacity must be positive")
    void invalidCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new SampleRing<String>(0));
    }

    @Test
    @DisplayName("snapshot is unaffected by later additions")
    void snapshotIsCopy() {
        var ring = new SampleRing<Integer>(2);
        ring.add(1);
        List<Integer> before = ring.toList();
        ring.add(2);
        ring.add(3);
        assertEquals(List.of(1), before);
        assertEquals(List.of(2, 3), ring.toList());
        assertEquals(2, ring.capacity());
    }
}
