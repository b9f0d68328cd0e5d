package com.swarmcore.core.model;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Amounts of named resources a task needs while it is assigned or running.
 *
 * @param amounts resource name to requested units; never null
 */
public record ResourceRequirements(Map<String, Integer> amounts) implements Serializable {

    private static final ResourceRequirements NONE = new ResourceRequirements(Map.of());

    public ResourceRequirements {
        if (amounts == null) {
            amounts = Map.of();
        } else {
            for (var entry : amounts.entrySet()) {
                if (entry.getValue() == null || entry.getValue() < 0) {
                    throw new IllegalArgumentException(
                            "Resource amount must be non-negative: " + entry.getKey());
                }
            }
            amounts = Map.copyOf(amounts);
        }
    }

    public static ResourceRequirements none() {
        return NONE;
    }

    public static ResourceRequirements of(String name, int amount) {
        return new ResourceRequirements(Map.of(name, amount));
    }

    public ResourceRequirements and(String name, int amount) {
        var merged = new LinkedHashMap<>(amounts);
        merged.merge(name, amount, Integer::sum);
        return new ResourceRequirements(merged);
    }

    public boolean empty() {
        return amounts.isEmpty();
    }
}
