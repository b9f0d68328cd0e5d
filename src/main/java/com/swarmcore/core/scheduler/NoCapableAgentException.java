package com.swarmcore.core.scheduler;

import com.swarmcore.core.CoordinationException;

import java.util.Set;

/**
 * No agent currently qualifies for the task, by capability or by available capacity.
 */
public class NoCapableAgentException extends CoordinationException {

    private final String taskId;
    private final Set<String> requiredCapabilities;

    public NoCapableAgentException(String taskId, Set<String> requiredCapabilities) {
        super("No eligible agent for task " + taskId + " requiring " + requiredCapabilities);
        this.taskId = taskId;
        this.requiredCapabilities = Set.copyOf(requiredCapabilities);
    }

    public String getTaskId() {
        return taskId;
    }

    public Set<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }
}
