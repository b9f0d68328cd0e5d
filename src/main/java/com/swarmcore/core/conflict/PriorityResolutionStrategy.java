package com.swarmcore.core.conflict;

import java.util.List;

public class PriorityResolutionStrategy implements ConflictResolutionStrategy {

    @Override
    public String name() {
        return "priority";
    }

    @Override
    public ConflictClaim pickWinner(List<ConflictClaim> claims) {
        return claims.stream().min(PRIORITY_ORDER).orElseThrow();
    }
}
