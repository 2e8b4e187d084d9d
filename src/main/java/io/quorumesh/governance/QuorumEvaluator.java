package io.quorumesh.governance;

import io.quorumesh.model.Decision;
import io.quorumesh.model.ProposalStatus;
import io.quorumesh.model.Vote;
import io.quorumesh.model.VoteValue;
import io.quorumesh.model.VotingPolicy;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Pure vote tally. The same inputs always give the same decision, and nothing is read or written.
 */
public final class QuorumEvaluator {
    public static final String REASON_DISABLED = "voting disabled";
    public static final String REASON_POOL_BELOW_MINIMUM = "pool below minimum";
    public static final String REASON_QUORUM_YES = "yes quorum reached";
    public static final String REASON_QUORUM_NO = "no quorum reached";
    public static final String REASON_TIMEOUT = "timeout before quorum";
    public static final String REASON_WAITING = "waiting for votes";

    private QuorumEvaluator() {
    }

    public static Decision evaluate(
            String proposerId,
            int poolSize,
            List<Vote> votes,
            Instant createdAt,
            Instant now,
            VotingPolicy policy
    ) {
        if (!policy.enabled()) {
            return Decision.pending(0, 0, REASON_DISABLED);
        }
        String proposer = normalize(proposerId);
        int yes = 0;
        int no = 0;
        for (Vote vote : votes == null ? List.<Vote>of() : votes) {
            if (!policy.allowSelfVote() && !proposer.isEmpty() && proposer.equals(normalize(vote.voterId()))) {
                continue;
            }
            if (vote.value() == VoteValue.YES) {
                yes++;
            } else if (vote.value() == VoteValue.NO) {
                no++;
            }
        }
        if (poolSize < policy.minPoolSize()) {
            return Decision.pending(yes, no, REASON_POOL_BELOW_MINIMUM);
        }
        if (yes >= policy.quorumYes()) {
            return new Decision(ProposalStatus.APPROVED, yes, no, REASON_QUORUM_YES);
        }
        if (no >= policy.quorumNo()) {
            return new Decision(ProposalStatus.REJECTED, yes, no, REASON_QUORUM_NO);
        }
        if (createdAt != null && now != null && policy.timeout() != null
                && Duration.between(createdAt, now).compareTo(policy.timeout()) >= 0) {
            return new Decision(ProposalStatus.EXPIRED, yes, no, REASON_TIMEOUT);
        }
        return Decision.pending(yes, no, REASON_WAITING);
    }

    private static String normalize(String id) {
        return id == null ? "" : id.trim().toLowerCase(Locale.ROOT);
    }
}
