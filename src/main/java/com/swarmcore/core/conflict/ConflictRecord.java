package com.swarmcore.core.conflict;

import java.time.Instant;
import java.util.List;

/**
 * Outcome of arbitrating competing claims on one subject.
 *
 * @param subjectId  contested task or resource
 * @param claims     all competing claims
 * @param strategy   name of the strategy that decided
 * @param winner     the accepted claim
 * @param resolvedAt resolution time
 */
public record ConflictRecord(
    String subjectId,
    List<ConflictClaim> claims,
    String strategy,
    ConflictClaim winner,
    Instant resolvedAt
) {

    public ConflictRecord {
        claims = List.copyOf(claims);
    }

    public List<ConflictClaim> losers() {
        return claims.stream().filter(c -> c != winner).toList();
    }
}
