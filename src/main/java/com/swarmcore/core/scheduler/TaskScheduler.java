package com.swarmcore.core.scheduler;

import com.swarmcore.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.PriorityQueue;

/**
 * Priority queue of ready tasks: highest priority first, FIFO among equal priorities.
 * <p>
 * The queue holds ids and ordering keys only; task state lives in the task table.
 */
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    /**
     * Queue entry. {@code sequence} is fixed at first enqueue and kept across requeues.
     */
    public record QueuedTask(String taskId, int priority, long sequence, Instant enqueuedAt) {}

    static final Comparator<QueuedTask> ORDER = Comparator
            .comparingInt(QueuedTask::priority).reversed()
            .thenComparingLong(QueuedTask::sequence);

    protected final Clock clock;

    private final PriorityQueue<QueuedTask> queue = new PriorityQueue<>(ORDER);
    private final Map<String, QueuedTask> index = new HashMap<>();
    private long nextSequence;

    public TaskScheduler(Clock clock) {
        this.clock = clock;
    }

    /**
     * Adds a ready task.
     *
     * @return false if the task is already queued
     */
    public synchronized boolean enqueue(Task task) {
        if (index.containsKey(task.id())) {
            return false;
        }
        var entry = new QueuedTask(task.id(), task.priority(), nextSequence++, clock.instant());
        queue.add(entry);
        index.put(task.id(), entry);
        log.debug("Queued task {} (priority={}, depth={})", task.id(), task.priority(), queue.size());
        return true;
    }

    /**
     * Puts a previously polled entry back with its original position.
     */
    public synchronized void requeue(QueuedTask entry) {
        if (index.putIfAbsent(entry.taskId(), entry) == null) {
            queue.add(entry);
        }
    }

    public synchronized Optional<QueuedTask> poll() {
        QueuedTask head = queue.poll();
        if (head != null) {
            index.remove(head.taskId());
        }
        return Optional.ofNullable(head);
    }

    public synchronized Optional<QueuedTask> peek() {
        return Optional.ofNullable(queue.peek());
    }

    public synchronized boolean remove(String taskId) {
        return take(taskId).isPresent();
    }

    /**
     * Removes and returns the entry for one task.
     */
    protected synchronized Optional<QueuedTask> take(String taskId) {
        QueuedTask entry = index.remove(taskId);
        if (entry != null) {
            queue.remove(entry);
        }
        return Optional.ofNullable(entry);
    }

    public synchronized boolean contains(String taskId) {
        return index.containsKey(taskId);
    }

    public synchronized int queueDepth() {
        return queue.size();
    }

    /**
     * Queue contents in dispatch order, without removing them.
     */
    public synchronized List<QueuedTask> snapshot() {
        var ordered = new ArrayList<>(queue);
        ordered.sort(ORDER);
        return ordered;
    }

    /**
     * Removes and returns every queued entry in dispatch order.
     */
    protected synchronized List<QueuedTask> drain() {
        var ordered = new ArrayList<QueuedTask>(queue.size());
        while (!queue.isEmpty()) {
            ordered.add(queue.poll());
        }
        index.clear();
        return ordered;
    }
}
