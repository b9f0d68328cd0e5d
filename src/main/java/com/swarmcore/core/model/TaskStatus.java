package com.swarmcore.core.model;

/**
 * Lifecycle status of a task.
 * <p>
 * Forward path is PENDING, READY, ASSIGNED, RUNNING, then COMPLETED or FAILED.
 * A FAILED task re-enters READY when it still has retries left, and an ASSIGNED
 * task may fall back to READY when its agent goes away.
 */
public enum TaskStatus {
    PENDING,
    READY,
    ASSIGNED,
    RUNNING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean terminal() {
        return this == COMPLETED || this == CANCELLED;
    }

    public boolean started() {
        return this == RUNNING;
    }

    public boolean canTransitionTo(TaskStatus next) {
        if (next == CANCELLED) {
            return this != COMPLETED && this != CANCELLED;
        }
        return switch (this) {
            case PENDING -> next == READY;
            case READY -> next == ASSIGNED;
            case ASSIGNED -> next == RUNNING || next == READY;
            case RUNNING -> next == COMPLETED || next == FAILED;
            case FAILED -> next == READY;
            case COMPLETED, CANCELLED -> false;
        };
    }
}
