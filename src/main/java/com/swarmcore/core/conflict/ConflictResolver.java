package com.swarmcore.core.conflict;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Arbitrates competing claims on the same entity with a configured strategy.
 * <p>
 * Claims can be resolved directly with {@link #resolve}, or collected per subject with
 * {@link #submit} and decided together by {@link #resolvePending}, which closes the
 * subject's resolution window. Every decision involving two or more claims is counted
 * as a conflict and kept in a bounded history.
 */
public class ConflictResolver {

    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);

    private final ConflictResolutionStrategy strategy;
    private final Clock clock;
    private final int historyLimit;
    private final Map<String, List<ConflictClaim>> pending = new ConcurrentHashMap<>();
    private final Deque<ConflictRecord> history = new ArrayDeque<>();
    private final AtomicLong conflicts = new AtomicLong();

    public ConflictResolver(ConflictResolutionStrategy strategy, Clock clock, int historyLimit) {
        this.strategy = strategy;
        this.clock = clock;
        this.historyLimit = Math.max(1, historyLimit);
    }

    public String strategyName() {
        return strategy.name();
    }

    /**
     * Picks the winner among {@code claims}. A single claim wins without arbitration.
     *
     * @throws IllegalArgumentException if there are no claims
     */
    public ConflictRecord resolve(String subjectId, List<ConflictClaim> claims) {
        if (claims.isEmpty()) {
            throw new IllegalArgumentException("No claims for " + subjectId);
        }
        if (claims.size() == 1) {
            return new ConflictRecord(subjectId, claims, strategy.name(), claims.get(0), clock.instant());
        }
        ConflictClaim winner = strategy.pickWinner(claims);
        var record = new ConflictRecord(subjectId, claims, strategy.name(), winner, clock.instant());
        conflicts.incrementAndGet();
        synchronized (history) {
            history.addLast(record);
            while (history.size() > historyLimit) {
                history.removeFirst();
            }
        }
        log.debug("Conflict on {} among {} claims won by {} ({})",
                subjectId, claims.size(), winner.claimantId(), strategy.name());
        return record;
    }

    public void submit(String subjectId, ConflictClaim claim) {
        pending.compute(subjectId, (id, claims) -> {
            var next = claims == null ? new ArrayList<ConflictClaim>() : new ArrayList<>(claims);
            next.add(claim);
            return List.copyOf(next);
        });
    }

    /**
     * Resolves and discards the claims collected for {@code subjectId}.
     */
    public Optional<ConflictRecord> resolvePending(String subjectId) {
        List<ConflictClaim> claims = pending.remove(subjectId);
        if (claims == null || claims.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(resolve(subjectId, claims));
    }

    public int pendingCount(String subjectId) {
        List<ConflictClaim> claims = pending.get(subjectId);
        return claims == null ? 0 : claims.size();
    }

    public long conflictCount() {
        return conflicts.get();
    }

    public List<ConflictRecord> history() {
        synchronized (history) {
            return List.copyOf(history);
        }
    }
}
