package com.swarmcore.core.resources;

import java.util.Set;

/**
 * @param name      resource name
 * @param capacity  total units
 * @param claimed   units held by active claims
 * @param exclusive whether the resource is exclusive
 * @param holders   tasks currently holding part of it
 */
public record ResourceUsage(String name, int capacity, int claimed, boolean exclusive, Set<String> holders) {

    public int available() {
        if (exclusive) {
            return holders.isEmpty() ? capacity : 0;
        }
        return capacity - claimed;
    }
}
