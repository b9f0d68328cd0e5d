package com.swarmcore.core.graph;

import java.util.List;

/**
 * A chain of tasks where each one depends on the previous.
 *
 * @param taskIds tasks from the root of the chain to its terminal node
 */
public record DependencyPath(List<String> taskIds) {

    public DependencyPath {
        taskIds = List.copyOf(taskIds);
    }

    public int length() {
        return taskIds.size();
    }
}
