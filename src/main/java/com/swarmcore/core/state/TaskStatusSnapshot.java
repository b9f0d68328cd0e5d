package com.swarmcore.core.state;

import com.swarmcore.core.model.TaskStatus;

import java.time.Instant;

/**
 * Point-in-time view of a task as returned to callers.
 *
 * @param taskId                 task id
 * @param status                 lifecycle status
 * @param assignedAgentId        owning agent, null if unassigned
 * @param retryCount             retries consumed
 * @param version                task table version the view was read at
 * @param failureReason          latest failure diagnostic, null if none
 * @param cancellationRequested  true if a cooperative cancel is pending for a running task
 * @param updatedAt              time of the update that produced this version
 */
public record TaskStatusSnapshot(
    String taskId,
    TaskStatus status,
    String assignedAgentId,
    int retryCount,
    long version,
    String failureReason,
    boolean cancellationRequested,
    Instant updatedAt
) {}
