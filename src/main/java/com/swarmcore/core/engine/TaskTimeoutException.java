package com.swarmcore.core.engine;

import com.swarmcore.core.CoordinationException;

import java.time.Duration;

/**
 * A task stayed RUNNING past its deadline.
 */
public class TaskTimeoutException extends CoordinationException {

    private final String taskId;
    private final Duration timeout;

    public TaskTimeoutException(String taskId, Duration timeout) {
        super("Task " + taskId + " exceeded its deadline of " + timeout);
        this.taskId = taskId;
        this.timeout = timeout;
    }

    public String getTaskId() {
        return taskId;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
