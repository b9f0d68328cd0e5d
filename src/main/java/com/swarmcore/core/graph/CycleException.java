package com.swarmcore.core.graph;

import com.swarmcore.core.CoordinationException;

import java.util.List;

/**
 * Thrown when adding a task would introduce a dependency cycle.
 * The graph is left exactly as it was before the rejected call.
 */
public class CycleException extends CoordinationException {

    private final String taskId;
    private final List<String> cycle;

    public CycleException(String taskId, List<String> cycle) {
        super("Adding " + taskId + " would create a dependency cycle: " + String.join(" -> ", cycle));
        this.taskId = taskId;
        this.cycle = List.copyOf(cycle);
    }

    public String getTaskId() {
        return taskId;
    }

    public List<String> getCycle() {
        return cycle;
    }
}
