package com.swarmcore.core.conflict;

import java.util.Comparator;
import java.util.List;

/**
 * Picks the winning claim among two or more competing claims.
 */
public interface ConflictResolutionStrategy {

    /** Highest priority first, then earliest, then smallest claimant id. */
    Comparator<ConflictClaim> PRIORITY_ORDER = Comparator
            .comparingInt(ConflictClaim::priority).reversed()
            .thenComparing(ConflictClaim::timestamp)
            .thenComparing(ConflictClaim::claimantId);

    String name();

    ConflictClaim pickWinner(List<ConflictClaim> claims);
}
