package com.swarmcore.core.engine;

import com.swarmcore.core.CoordinationException;

/**
 * An agent reported the outcome of an attempt that is no longer the task's current one,
 * for example a run that already timed out and was retried.
 */
public class StaleAttemptException extends CoordinationException {

    private final String taskId;
    private final String agentId;
    private final int attempt;

    public StaleAttemptException(String taskId, String agentId, int attempt, String current) {
        super("Outcome of attempt " + attempt + " of task " + taskId + " on agent " + agentId
                + " is stale; task is " + current);
        this.taskId = taskId;
        this.agentId = agentId;
        this.attempt = attempt;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getAgentId() {
        return agentId;
    }

    public int getAttempt() {
        return attempt;
    }
}
