package com.swarmcore.core.scheduler;

import java.util.Locale;

/**
 * Builds the strategy named in configuration.
 */
public final class SchedulingStrategyFactory {

    public enum StrategyType {
        CAPABILITY,
        ROUND_ROBIN,
        LEAST_LOADED,
        AFFINITY;

        /**
         * Accepts enum names as well as lower-case dashed forms such as {@code round-robin}.
         */
        public static StrategyType parse(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown scheduling strategy: " + value, e);
            }
        }
    }

    private SchedulingStrategyFactory() {}

    public static SchedulingStrategy create(StrategyType type) {
        return switch (type) {
            case CAPABILITY -> new CapabilitySchedulingStrategy();
            case ROUND_ROBIN -> new RoundRobinSchedulingStrategy();
            case LEAST_LOADED -> new LeastLoadedSchedulingStrategy();
            case AFFINITY -> new AffinitySchedulingStrategy();
        };
    }

    public static SchedulingStrategy create(String name) {
        return create(StrategyType.parse(name));
    }
}
