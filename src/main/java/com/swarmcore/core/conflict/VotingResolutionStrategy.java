package com.swarmcore.core.conflict;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Quorum vote among the claimants plus any configured observers.
 * <p>
 * Ballots ignore priority: each voter prefers the claim made against the freshest
 * version, then the earliest claim. A claimant votes for its preferred claim among the
 * others, never its own; an observer votes for its preferred claim overall. The claim
 * with the most votes wins if it reaches {@code ceil(voters * quorumRatio)} and is not
 * tied. Otherwise priority order decides.
 */
public class VotingResolutionStrategy implements ConflictResolutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(VotingResolutionStrategy.class);

    static final Comparator<ConflictClaim> BALLOT_ORDER = Comparator
            .comparingLong(ConflictClaim::requestedVersion).reversed()
            .thenComparing(ConflictClaim::timestamp)
            .thenComparing(ConflictClaim::claimantId);

    private final double quorumRatio;
    private final Set<String> observers;

    public VotingResolutionStrategy(double quorumRatio, Set<String> observers) {
        if (quorumRatio <= 0 || quorumRatio > 1) {
            throw new IllegalArgumentException("quorumRatio must be in (0, 1]");
        }
        this.quorumRatio = quorumRatio;
        this.observers = Set.copyOf(observers);
    }

    @Override
    public String name() {
        return "voting";
    }

    @Override
    public ConflictClaim pickWinner(List<ConflictClaim> claims) {
        var ranked = claims.stream().sorted(PRIORITY_ORDER).toList();
        var ballot = claims.stream().sorted(BALLOT_ORDER).toList();
        var votes = new HashMap<ConflictClaim, Integer>();
        var voters = new LinkedHashSet<String>();

        for (ConflictClaim voter : ranked) {
            if (!voters.add(voter.claimantId())) {
                continue;
            }
            ballot.stream()
                    .filter(c -> !c.claimantId().equals(voter.claimantId()))
                    .findFirst()
                    .ifPresent(choice -> votes.merge(choice, 1, Integer::sum));
        }
        for (String observer : observers) {
            if (voters.add(observer)) {
                votes.merge(ballot.get(0), 1, Integer::sum);
            }
        }

        int quorum = (int) Math.ceil(voters.size() * quorumRatio);
        ConflictClaim leader = null;
        int leaderVotes = 0;
        boolean tied = false;
        for (ConflictClaim claim : ranked) {
            int count = votes.getOrDefault(claim, 0);
            if (count > leaderVotes) {
                leader = claim;
                leaderVotes = count;
                tied = false;
            } else if (count == leaderVotes && count > 0) {
                tied = true;
            }
        }
        if (leader != null && !tied && leaderVotes >= quorum) {
            log.debug("Vote decided by {}/{} votes (quorum {})", leaderVotes, voters.size(), quorum);
            return leader;
        }
        log.debug("No quorum ({} voters, quorum {}); falling back to priority", voters.size(), quorum);
        return ranked.get(0);
    }
}
