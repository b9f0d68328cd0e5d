package com.swarmcore.core.scheduler;

/**
 * Outcome of one assignment attempt.
 *
 * @param taskId  task considered
 * @param outcome what happened
 * @param agentId chosen agent when assigned, otherwise null
 * @param reason  diagnostic for deferrals and failures
 */
public record AssignmentResult(String taskId, Outcome outcome, String agentId, String reason) {

    public enum Outcome {
        ASSIGNED,
        DEFERRED_NO_AGENT,
        DEFERRED_RESOURCES,
        DEFERRED_CONFLICT,
        FAILED_UNASSIGNABLE,
        SKIPPED;

        public boolean deferred() {
            return this == DEFERRED_NO_AGENT || this == DEFERRED_RESOURCES || this == DEFERRED_CONFLICT;
        }
    }

    public static AssignmentResult assigned(String taskId, String agentId) {
        return new AssignmentResult(taskId, Outcome.ASSIGNED, agentId, null);
    }

    public static AssignmentResult of(String taskId, Outcome outcome, String reason) {
        return new AssignmentResult(taskId, outcome, null, reason);
    }
}
