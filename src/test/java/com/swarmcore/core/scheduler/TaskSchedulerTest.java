package com.swarmcore.core.scheduler;

import com.swarmcore.MutableClock;
import com.swarmcore.core.model.Task;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TaskSchedulerTest {

    private TaskScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new TaskScheduler(new MutableClock());
    }

    private static Task task(String id, int priority) {
        return Task.builder(id).priority(priority).build();
    }

    @Test
    @DisplayName("higher priority is dispatched first")
    void priorityOrder() {
        scheduler.enqueue(task("low", 1));
        scheduler.enqueue(task("high", 9));
        scheduler.enqueue(task("mid", 5));

        assertEquals("high", scheduler.poll().orElseThrow().taskId());
        assertEquals("mid", scheduler.poll().orElseThrow().taskId());
        assertEquals("low", scheduler.poll().orElseThrow().taskId());
        assertTrue(scheduler.poll().isEmpty());
    }

    @Test
    @DisplayName("equal priorities are FIFO")
    void fifoWithinPriority() {
        scheduler.enqueue(task("first", 3));
        scheduler.enqueue(task("second", 3));
        scheduler.enqueue(task("third", 3));

        assertEquals("first", scheduler.poll().orElseThrow().taskId());
        assertEquals("second", scheduler.poll().orElseThrow().taskId());
    }

    @Test
    @DisplayName("requeued entry keeps its original position")
    void requeueKeepsPosition() {
        scheduler.enqueue(task("a", 3));
        scheduler.enqueue(task("b", 3));
        var a = scheduler.poll().orElseThrow();
        scheduler.requeue(a);

        assertEquals("a", scheduler.peek().orElseThrow().taskId());
    }

    @Test
    @DisplayName("a task is queued at most once")
    void noDuplicates() {
        assertTrue(scheduler.enqueue(task("a", 1)));
        assertFalse(scheduler.enqueue(task("a", 1)));
        assertEquals(1, scheduler.queueDepth());
    }

    @Test
    @DisplayName("remove takes a task out of the queue")
    void remove() {
        scheduler.enqueue(task("a", 1));
        scheduler.enqueue(task("b", 2));
        assertTrue(scheduler.remove("a"));
        assertFalse(scheduler.contains("a"));
        assertFalse(scheduler.remove("a"));
        assertEquals(1, scheduler.snapshot().size());
    }
}
