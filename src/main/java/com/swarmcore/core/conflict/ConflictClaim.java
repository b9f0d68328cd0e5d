package com.swarmcore.core.conflict;

import java.time.Instant;

/**
 * One competing mutation of a shared entity.
 *
 * @param claimantId      who is competing: a task id for resource contention, an agent id for task contention
 * @param agentId         agent acting for the claimant, may be null
 * @param requestedVersion entity version the claimant read
 * @param timestamp       when the claim was made
 * @param priority        higher wins under priority resolution
 */
public record ConflictClaim(
    String claimantId,
    String agentId,
    long requestedVersion,
    Instant timestamp,
    int priority
) {}
