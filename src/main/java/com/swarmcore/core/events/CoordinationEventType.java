package com.swarmcore.core.events;

public enum CoordinationEventType {
    TASK_SUBMITTED,
    TASK_ASSIGNED,
    TASK_STARTED,
    TASK_COMPLETED,
    TASK_FAILED,
    TASK_CANCELLED,
    TASK_STOLEN,
    AGENT_REGISTERED,
    AGENT_REMOVED
}
