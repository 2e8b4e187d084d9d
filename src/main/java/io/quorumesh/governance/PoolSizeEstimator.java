package io.quorumesh.governance;

import io.quorumesh.model.VotingPolicy;
import io.quorumesh.storage.RosterStore;

public final class PoolSizeEstimator {
    private final RosterStore roster;

    public PoolSizeEstimator(RosterStore roster) {
        this.roster = roster;
    }

    /**
     * Explicit override, then the active roster of the group, then the policy minimum, then 1.
     */
    public int estimate(String group, int override, VotingPolicy policy) {
        if (override > 0) {
            return override;
        }
        if (group != null && !group.isBlank()) {
            int active = roster.countActiveMembers(group.trim());
            if (active > 0) {
                return active;
            }
        }
        if (policy != null && policy.minPoolSize() > 0) {
            return policy.minPoolSize();
        }
        return 1;
    }
}
