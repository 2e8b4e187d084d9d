package io.quorumesh.model;

public record CascadeTransition(
        String traceId,
        String taskId,
        CascadeStatus fromStatus,
        CascadeStatus toStatus,
        String actor,
        String reason,
        String payload,
        String idempotencyKey,
        long createdAtMs
) {
}
