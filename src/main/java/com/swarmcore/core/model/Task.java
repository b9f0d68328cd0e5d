package com.swarmcore.core.model;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Immutable snapshot of a unit of work.
 * <p>
 * Snapshots are never mutated in place: every state change produces a new record that
 * is swapped into the task table through a version-checked update.
 *
 * @param id                   unique identifier
 * @param dependencies         ids of tasks that must complete first, in declaration order
 * @param priority             higher runs first
 * @param requiredCapabilities capabilities an agent must have to run this task
 * @param tags                 free-form labels; the part before ':' is the namespace used for affinity
 * @param resources            resources claimed while assigned or running
 * @param status               current lifecycle status
 * @param assignedAgentId      owning agent, null while unassigned
 * @param retryCount           retries consumed so far
 * @param maxRetries           retry budget
 * @param createdAt            submission time
 * @param assignedAt           time of the latest assignment, null while unassigned
 * @param startedAt            time the owning agent started it, null until RUNNING
 * @param timeout              run deadline; null means the coordinator default
 * @param failureReason        diagnostic of the latest failure, null if none
 */
public record Task(
    String id,
    List<String> dependencies,
    int priority,
    Set<String> requiredCapabilities,
    Set<String> tags,
    ResourceRequirements resources,
    TaskStatus status,
    String assignedAgentId,
    int retryCount,
    int maxRetries,
    Instant createdAt,
    Instant assignedAt,
    Instant startedAt,
    Duration timeout,
    String failureReason
) implements Serializable {

    public Task {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Task id must not be blank");
        }
        dependencies = dependencies == null ? List.of() : List.copyOf(new LinkedHashSet<>(dependencies));
        requiredCapabilities = requiredCapabilities == null ? Set.of() : Set.copyOf(requiredCapabilities);
        tags = tags == null ? Set.of() : Set.copyOf(tags);
        resources = resources == null ? ResourceRequirements.none() : resources;
        status = status == null ? TaskStatus.PENDING : status;
        createdAt = createdAt == null ? Instant.EPOCH : createdAt;
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Namespaces derived from tags, used by affinity scheduling.
     */
    public Set<String> namespaces() {
        var result = new LinkedHashSet<String>();
        for (String tag : tags) {
            int idx = tag.indexOf(':');
            result.add(idx > 0 ? tag.substring(0, idx) : tag);
        }
        return result;
    }

    public boolean retriesLeft() {
        return retryCount < maxRetries;
    }

    public Task withStatus(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Task " + id + " cannot move from " + status + " to " + next);
        }
        return new Task(id, dependencies, priority, requiredCapabilities, tags, resources, next,
                assignedAgentId, retryCount, maxRetries, createdAt, assignedAt, startedAt, timeout, failureReason);
    }

    public Task assignTo(String agentId, Instant at) {
        return new Task(id, dependencies, priority, requiredCapabilities, tags, resources,
                withStatus(TaskStatus.ASSIGNED).status(), agentId, retryCount, maxRetries, createdAt,
                at, null, timeout, failureReason);
    }

    /**
     * Moves an assigned but unstarted task to another agent.
     */
    public Task reassignTo(String agentId, Instant at) {
        if (status != TaskStatus.ASSIGNED) {
            throw new IllegalStateException("Task " + id + " is " + status + ", only ASSIGNED tasks can move");
        }
        return new Task(id, dependencies, priority, requiredCapabilities, tags, resources, status,
                agentId, retryCount, maxRetries, createdAt, at, null, timeout, failureReason);
    }

    public Task unassign() {
        return new Task(id, dependencies, priority, requiredCapabilities, tags, resources,
                withStatus(TaskStatus.READY).status(), null, retryCount, maxRetries, createdAt,
                null, null, timeout, failureReason);
    }

    public Task start(Instant at) {
        return new Task(id, dependencies, priority, requiredCapabilities, tags, resources,
                withStatus(TaskStatus.RUNNING).status(), assignedAgentId, retryCount, maxRetries,
                createdAt, assignedAt, at, timeout, failureReason);
    }

    public Task fail(String reason, boolean consumeRetry) {
        return new Task(id, dependencies, priority, requiredCapabilities, tags, resources,
                TaskStatus.FAILED, assignedAgentId, consumeRetry ? retryCount + 1 : retryCount, maxRetries,
                createdAt, assignedAt, startedAt, timeout, reason);
    }

    public Task retry() {
        return new Task(id, dependencies, priority, requiredCapabilities, tags, resources,
                withStatus(TaskStatus.READY).status(), null, retryCount, maxRetries, createdAt,
                null, null, timeout, failureReason);
    }

    public Task withCreatedAt(Instant at) {
        return new Task(id, dependencies, priority, requiredCapabilities, tags, resources, status,
                assignedAgentId, retryCount, maxRetries, at, assignedAt, startedAt, timeout, failureReason);
    }

    /**
     * Back to PENDING with no owner, keeping the retry count. Used when reloading a
     * checkpoint whose in-flight work was lost with the previous process.
     */
    public Task resetForRecovery() {
        return new Task(id, dependencies, priority, requiredCapabilities, tags, resources, TaskStatus.PENDING,
                null, retryCount, maxRetries, createdAt, null, null, timeout, failureReason);
    }

    public Task cancel(String reason) {
        return new Task(id, dependencies, priority, requiredCapabilities, tags, resources,
                withStatus(TaskStatus.CANCELLED).status(), assignedAgentId, retryCount, maxRetries,
                createdAt, assignedAt, startedAt, timeout, reason);
    }

    public static final class Builder {
        private final String id;
        private final List<String> dependencies = new ArrayList<>();
        private int priority;
        private final Set<String> capabilities = new LinkedHashSet<>();
        private final Set<String> tags = new LinkedHashSet<>();
        private ResourceRequirements resources = ResourceRequirements.none();
        private int maxRetries = 3;
        private Instant createdAt;
        private Duration timeout;

        private Builder(String id) {
            this.id = id;
        }

        public Builder dependsOn(String... ids) {
            dependencies.addAll(List.of(ids));
            return this;
        }

        public Builder dependsOn(List<String> ids) {
            dependencies.addAll(ids);
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder requires(String... capabilities) {
            this.capabilities.addAll(List.of(capabilities));
            return this;
        }

        public Builder requires(Set<String> capabilities) {
            this.capabilities.addAll(capabilities);
            return this;
        }

        public Builder tags(String... tags) {
            this.tags.addAll(List.of(tags));
            return this;
        }

        public Builder resources(ResourceRequirements resources) {
            this.resources = resources;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Task build() {
            return new Task(id, dependencies, priority, capabilities, tags, resources, TaskStatus.PENDING,
                    null, 0, maxRetries, createdAt, null, null, timeout, null);
        }
    }
}
