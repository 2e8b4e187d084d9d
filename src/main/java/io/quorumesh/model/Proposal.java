package io.quorumesh.model;

import java.util.List;

public record Proposal(
        String proposalId,
        String group,
        String title,
        String statement,
        List<String> tags,
        String proposerClawId,
        String proposerInstanceId,
        ProposalStatus status,
        int yes,
        int no,
        String reason,
        long createdAtMs,
        long updatedAtMs
) {
    public Proposal {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static Proposal pending(
            String proposalId,
            String group,
            String title,
            String statement,
            List<String> tags,
            String proposerClawId,
            String proposerInstanceId,
            long nowMs
    ) {
        return new Proposal(proposalId, group, title, statement, tags, proposerClawId, proposerInstanceId,
                ProposalStatus.PENDING, 0, 0, "", nowMs, nowMs);
    }
}
