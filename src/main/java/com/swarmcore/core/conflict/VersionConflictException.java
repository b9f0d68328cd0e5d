package com.swarmcore.core.conflict;

import com.swarmcore.core.CoordinationException;

/**
 * Thrown when an update was made against a stale version. The caller should re-read
 * and retry against the current version.
 */
public class VersionConflictException extends CoordinationException {

    private final String entityId;
    private final long expectedVersion;
    private final long actualVersion;

    public VersionConflictException(String entityId, long expectedVersion, long actualVersion) {
        super("Version conflict on " + entityId + ": expected " + expectedVersion + " but found " + actualVersion);
        this.entityId = entityId;
        this.expectedVersion = expectedVersion;
        this.actualVersion = actualVersion;
    }

    public String getEntityId() {
        return entityId;
    }

    public long getExpectedVersion() {
        return expectedVersion;
    }

    public long getActualVersion() {
        return actualVersion;
    }
}
