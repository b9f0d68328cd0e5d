package com.swarmcore.core.resources;

import com.swarmcore.core.model.ResourceRequirements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tracks capacity of named resources and the claims held by in-flight tasks.
 * <p>
 * Claims are all-or-nothing across every resource they name, and are reference-counted
 * per task: repeated claims by one task add references, and the units return to the
 * pool when the last reference is released. Counters change only through this API.
 */
public class ResourceManager {

    private static final Logger log = LoggerFactory.getLogger(ResourceManager.class);

    private record Claim(ResourceRequirements requirements, int references) {}

    private final Map<String, ResourceDefinition> definitions = new LinkedHashMap<>();
    private final Map<String, Integer> claimed = new HashMap<>();
    private final Map<String, Set<String>> holders = new HashMap<>();
    private final Map<String, Claim> claims = new HashMap<>();

    public synchronized void register(ResourceDefinition definition) {
        ResourceDefinition previous = definitions.get(definition.name());
        if (previous != null && claimed.getOrDefault(definition.name(), 0) > definition.capacity()) {
            throw new IllegalStateException("Cannot shrink " + definition.name() + " below claimed units");
        }
        definitions.put(definition.name(), definition);
        claimed.putIfAbsent(definition.name(), 0);
        holders.putIfAbsent(definition.name(), new LinkedHashSet<>());
        log.debug("Registered resource {} (capacity={}, exclusive={})",
                definition.name(), definition.capacity(), definition.exclusive());
    }

    /**
     * Claims every requested unit for the task, or nothing.
     *
     * @throws InsufficientResourceException if any requested resource is short or unknown
     */
    public synchronized void claim(String taskId, ResourceRequirements requirements) {
        Claim existing = claims.get(taskId);
        if (existing != null) {
            if (!existing.requirements().equals(requirements)) {
                throw new IllegalStateException("Task " + taskId + " already holds a different claim");
            }
            claims.put(taskId, new Claim(requirements, existing.references() + 1));
            return;
        }
        for (var entry : requirements.amounts().entrySet()) {
            int available = availableLocked(entry.getKey());
            if (!definitions.containsKey(entry.getKey()) || entry.getValue() > available) {
                throw new InsufficientResourceException(taskId, entry.getKey(), entry.getValue(), available);
            }
        }
        for (var entry : requirements.amounts().entrySet()) {
            claimed.merge(entry.getKey(), entry.getValue(), Integer::sum);
            holders.get(entry.getKey()).add(taskId);
        }
        claims.put(taskId, new Claim(requirements, 1));
    }

    /**
     * Drops one reference to the task's claim.
     *
     * @return true if the units were returned
     */
    public synchronized boolean release(String taskId) {
        Claim claim = claims.get(taskId);
        if (claim == null) {
            return false;
        }
        if (claim.references() > 1) {
            claims.put(taskId, new Claim(claim.requirements(), claim.references() - 1));
            return false;
        }
        returnUnits(taskId, claim);
        return true;
    }

    /**
     * Returns the task's units regardless of outstanding references.
     */
    public synchronized boolean releaseAll(String taskId) {
        Claim claim = claims.get(taskId);
        if (claim == null) {
            return false;
        }
        returnUnits(taskId, claim);
        return true;
    }

    /**
     * Remaining units of a resource, 0 for unknown names.
     */
    public synchronized int availability(String resourceName) {
        return availableLocked(resourceName);
    }

    public synchronized boolean canSatisfy(ResourceRequirements requirements) {
        for (var entry : requirements.amounts().entrySet()) {
            if (!definitions.containsKey(entry.getKey()) || entry.getValue() > availableLocked(entry.getKey())) {
                return false;
            }
        }
        return true;
    }

    public synchronized boolean holds(String taskId) {
        return claims.containsKey(taskId);
    }

    public synchronized boolean isExclusive(String resourceName) {
        ResourceDefinition definition = definitions.get(resourceName);
        return definition != null && definition.exclusive();
    }

    public synchronized ResourceRequirements claimsFor(String taskId) {
        Claim claim = claims.get(taskId);
        return claim == null ? ResourceRequirements.none() : claim.requirements();
    }

    public synchronized List<ResourceUsage> snapshot() {
        var usage = new ArrayList<ResourceUsage>();
        for (ResourceDefinition definition : definitions.values()) {
            usage.add(new ResourceUsage(definition.name(), definition.capacity(),
                    claimed.getOrDefault(definition.name(), 0), definition.exclusive(),
                    Set.copyOf(holders.get(definition.name()))));
        }
        return usage;
    }

    private int availableLocked(String name) {
        ResourceDefinition definition = definitions.get(name);
        if (definition == null) {
            return 0;
        }
        if (definition.exclusive()) {
            return holders.get(name).isEmpty() ? definition.capacity() : 0;
        }
        return definition.capacity() - claimed.getOrDefault(name, 0);
    }

    private void returnUnits(String taskId, Claim claim) {
        for (var entry : claim.requirements().amounts().entrySet()) {
            claimed.merge(entry.getKey(), -entry.getValue(), Integer::sum);
            holders.get(entry.getKey()).remove(taskId);
        }
        claims.remove(taskId);
    }
}
