package io.quorumesh.governance;

import io.quorumesh.model.Fact;
import io.quorumesh.model.FactOutcome;
import io.quorumesh.storage.KnowledgeStore;

/**
 * Latest-version-wins policy per (group, subject, predicate). Equal or lower versions never overwrite
 * silently: they come back as STALE or CONFLICT and only the chosen row is written.
 */
public final class FactResolver implements KnowledgeStore.FactPolicy {
    public static final String REASON_ACCEPTED = "accepted";
    public static final String REASON_DUPLICATE = "duplicate";
    public static final String REASON_OLDER_VERSION = "older_version";

    @Override
    public KnowledgeStore.FactResolution resolve(Fact latest, Fact incoming) {
        int current = latest == null ? 0 : latest.version();
        int next = incoming.version();
        if (next == current + 1) {
            return new KnowledgeStore.FactResolution(FactOutcome.ACCEPTED, REASON_ACCEPTED, incoming);
        }
        if (latest != null && next == current) {
            if (latest.source().equals(incoming.source())) {
                return new KnowledgeStore.FactResolution(FactOutcome.STALE, REASON_DUPLICATE, null);
            }
            boolean incomingWins = incoming.source().compareTo(latest.source()) < 0;
            String winner = incomingWins ? incoming.source() : latest.source();
            return new KnowledgeStore.FactResolution(
                    FactOutcome.CONFLICT,
                    "same_version_different_source:winner=" + winner,
                    incomingWins ? incoming : null
            );
        }
        if (next < current) {
            return new KnowledgeStore.FactResolution(FactOutcome.STALE, REASON_OLDER_VERSION, null);
        }
        return new KnowledgeStore.FactResolution(
                FactOutcome.CONFLICT,
                "version_gap_" + current + "_to_" + next,
                null
        );
    }
}
