package com.swarmcore.core.scheduler;

import com.swarmcore.core.model.Agent;
import com.swarmcore.core.model.Task;

import java.time.Instant;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Remembers, per tag namespace, when each agent last completed a task in it.
 */
public class AffinityTracker {

    private final Map<String, Map<String, Instant>> lastCompletion = new ConcurrentHashMap<>();

    public void record(String agentId, Task task, Instant completedAt) {
        for (String namespace : task.namespaces()) {
            lastCompletion.computeIfAbsent(namespace, k -> new ConcurrentHashMap<>())
                    .merge(agentId, completedAt, (a, b) -> a.isAfter(b) ? a : b);
        }
    }

    /**
     * The candidate with the most recent completion sharing a namespace with {@code task}.
     */
    public Optional<Agent> preferred(Task task, Collection<Agent> candidates) {
        Agent best = null;
        Instant bestAt = null;
        for (Agent candidate : candidates) {
            Instant at = latestFor(candidate.id(), task);
            if (at != null && (bestAt == null || at.isAfter(bestAt)
                    || (at.equals(bestAt) && candidate.id().compareTo(best.id()) < 0))) {
                best = candidate;
                bestAt = at;
            }
        }
        return Optional.ofNullable(best);
    }

    public void forget(String agentId) {
        lastCompletion.values().forEach(byAgent -> byAgent.remove(agentId));
    }

    private Instant latestFor(String agentId, Task task) {
        Instant latest = null;
        for (String namespace : task.namespaces()) {
            Map<String, Instant> byAgent = lastCompletion.get(namespace);
            Instant at = byAgent == null ? null : byAgent.get(agentId);
            if (at != null && (latest == null || at.isAfter(latest))) {
                latest = at;
            }
        }
        return latest;
    }
}
