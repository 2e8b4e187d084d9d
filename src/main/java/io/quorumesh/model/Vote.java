package io.quorumesh.model;

public record Vote(
        String proposalId,
        String voterId,
        String instanceId,
        VoteValue value,
        String reason,
        String traceId,
        long updatedAtMs
) {
}
