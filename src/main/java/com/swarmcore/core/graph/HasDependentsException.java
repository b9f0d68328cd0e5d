package com.swarmcore.core.graph;

import com.swarmcore.core.CoordinationException;

import java.util.Set;

/**
 * Thrown when removing a task that other tasks still depend on without forcing.
 */
public class HasDependentsException extends CoordinationException {

    private final String taskId;
    private final Set<String> dependents;

    public HasDependentsException(String taskId, Set<String> dependents) {
        super("Task " + taskId + " has dependents: " + dependents);
        this.taskId = taskId;
        this.dependents = Set.copyOf(dependents);
    }

    public String getTaskId() {
        return taskId;
    }

    public Set<String> getDependents() {
        return dependents;
    }
}
