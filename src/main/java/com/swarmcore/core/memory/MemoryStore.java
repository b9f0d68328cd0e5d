package com.swarmcore.core.memory;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value store used for best-effort checkpoints. Values are opaque strings.
 */
public interface MemoryStore {

    Optional<String> get(String key);

    void put(String key, String value);

    /**
     * Stores a value that expires after {@code ttl}.
     */
    void put(String key, String value, Duration ttl);

    boolean delete(String key);
}
