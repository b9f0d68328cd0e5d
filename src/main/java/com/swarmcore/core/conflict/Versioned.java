package com.swarmcore.core.conflict;

import java.time.Instant;

/**
 * A value snapshot tagged with the version it was stored under.
 *
 * @param id        entity identifier
 * @param value     immutable snapshot
 * @param version   starts at 0 and increments on every successful update
 * @param updatedAt time of the update that produced this snapshot
 */
public record Versioned<T>(String id, T value, long version, Instant updatedAt) {}
