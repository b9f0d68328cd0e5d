package com.swarmcore.core.resources;

import com.swarmcore.core.CoordinationException;

/**
 * Thrown when a claim cannot be satisfied in full. No part of the claim is recorded.
 */
public class InsufficientResourceException extends CoordinationException {

    private final String taskId;
    private final String resourceName;
    private final int requested;
    private final int available;

    public InsufficientResourceException(String taskId, String resourceName, int requested, int available) {
        super("Task " + taskId + " requested " + requested + " of " + resourceName
                + " but only " + available + " available");
        this.taskId = taskId;
        this.resourceName = resourceName;
        this.requested = requested;
        this.available = available;
    }

    public String getTaskId() {
        return taskId;
    }

    public String getResourceName() {
        return resourceName;
    }

    public int getRequested() {
        return requested;
    }

    public int getAvailable() {
        return available;
    }
}
