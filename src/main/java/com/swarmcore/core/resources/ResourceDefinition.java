package com.swarmcore.core.resources;

/**
 * A named allocatable resource.
 *
 * @param name      unique name
 * @param capacity  total units
 * @param exclusive when true, at most one task may hold any part of it at a time
 */
public record ResourceDefinition(String name, int capacity, boolean exclusive) {

    public ResourceDefinition {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Resource name must not be blank");
        }
        if (capacity < 0) {
            throw new IllegalArgumentException("Resource capacity must be non-negative: " + name);
        }
    }

    public static ResourceDefinition shared(String name, int capacity) {
        return new ResourceDefinition(name, capacity, false);
    }

    public static ResourceDefinition exclusive(String name) {
        return new ResourceDefinition(name, 1, true);
    }
}
