package com.swarmcore.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Set;

/**
 * Immutable snapshot of a worker agent and its bookkeeping counters.
 *
 * @param id                 unique identifier
 * @param capabilities       what this agent can run
 * @param maxConcurrentTasks upper bound on assigned plus running tasks
 * @param status             availability
 * @param load               assigned plus running tasks
 * @param tasksCompleted     lifetime completions
 * @param tasksFailed        lifetime failures
 * @param totalExecutionMs   summed run time of completed tasks
 * @param lastActivity       time of the latest assignment or completion
 */
public record Agent(
    String id,
    Set<String> capabilities,
    int maxConcurrentTasks,
    AgentStatus status,
    int load,
    long tasksCompleted,
    long tasksFailed,
    long totalExecutionMs,
    Instant lastActivity
) implements Serializable {

    public Agent {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Agent id must not be blank");
        }
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        status = status == null ? AgentStatus.IDLE : status;
        if (maxConcurrentTasks <= 0) {
            maxConcurrentTasks = 1;
        }
    }

    public static Agent of(String id, int maxConcurrentTasks, String... capabilities) {
        return new Agent(id, Set.of(capabilities), maxConcurrentTasks, AgentStatus.IDLE, 0, 0, 0, 0, null);
    }

    public boolean canHandle(Set<String> required) {
        return capabilities.containsAll(required);
    }

    /**
     * True when the agent accepts new work.
     */
    public boolean accepting() {
        return (status == AgentStatus.IDLE || status == AgentStatus.BUSY) && load < maxConcurrentTasks;
    }

    public boolean online() {
        return status != AgentStatus.OFFLINE;
    }

    public Agent withLoad(int newLoad, Instant at) {
        int bounded = Math.max(0, newLoad);
        AgentStatus next = status;
        if (status == AgentStatus.IDLE || status == AgentStatus.BUSY) {
            next = bounded > 0 ? AgentStatus.BUSY : AgentStatus.IDLE;
        }
        return new Agent(id, capabilities, maxConcurrentTasks, next, bounded,
                tasksCompleted, tasksFailed, totalExecutionMs, at != null ? at : lastActivity);
    }

    public Agent withStatus(AgentStatus next) {
        return new Agent(id, capabilities, maxConcurrentTasks, next, load,
                tasksCompleted, tasksFailed, totalExecutionMs, lastActivity);
    }

    public Agent recordCompletion(long executionMs, Instant at) {
        return new Agent(id, capabilities, maxConcurrentTasks, status, load,
                tasksCompleted + 1, tasksFailed, totalExecutionMs + Math.max(0, executionMs), at)
                .withLoad(load - 1, at);
    }

    public Agent recordFailure(Instant at) {
        return new Agent(id, capabilities, maxConcurrentTasks, status, load,
                tasksCompleted, tasksFailed + 1, totalExecutionMs, at)
                .withLoad(load - 1, at);
    }

    public double averageExecutionMs() {
        return tasksCompleted == 0 ? 0.0 : (double) totalExecutionMs / tasksCompleted;
    }

    public double successRate() {
        long total = tasksCompleted + tasksFailed;
        return total == 0 ? 1.0 : (double) tasksCompleted / total;
    }
}
