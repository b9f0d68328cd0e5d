package com.swarmcore.core.metrics;

/**
 * Coordination totals at a point in time.
 *
 * @param totalAgents         registered agents
 * @param activeAgents        agents with at least one assigned or running task
 * @param totalTasks          tasks in the task table
 * @param completedTasks      tasks in COMPLETED
 * @param failedTasks         tasks in FAILED
 * @param avgExecutionMs      mean run time of completed tasks
 * @param throughputPerMinute completions per minute since the collector was created
 * @param errorRate           failure events over completion plus failure events
 */
public record CoordinationSummary(
    int totalAgents,
    int activeAgents,
    int totalTasks,
    int completedTasks,
    int failedTasks,
    double avgExecutionMs,
    double throughputPerMinute,
    double errorRate
) {}
