package com.swarmcore.core.conflict;

import java.util.Comparator;
import java.util.List;

/**
 * Earliest claim wins; equal timestamps fall back to priority.
 */
public class TimestampResolutionStrategy implements ConflictResolutionStrategy {

    private static final Comparator<ConflictClaim> ORDER = Comparator
            .comparing(ConflictClaim::timestamp)
            .thenComparing(PRIORITY_ORDER);

    @Override
    public String name() {
        return "timestamp";
    }

    @Override
    public ConflictClaim pickWinner(List<ConflictClaim> claims) {
        return claims.stream().min(ORDER).orElseThrow();
    }
}
