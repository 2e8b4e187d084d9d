package io.quorumesh.envelope;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Instant;

@JsonPropertyOrder({"schemaVersion", "type", "traceId", "timestamp", "idempotencyKey", "originId", "payload"})
public record Envelope(
        String schemaVersion,
        EnvelopeType type,
        String traceId,
        Instant timestamp,
        String idempotencyKey,
        String originId,
        EnvelopePayload payload
) {
    public static Envelope of(
            String traceId,
            Instant timestamp,
            String idempotencyKey,
            String originId,
            EnvelopePayload payload
    ) {
        return new Envelope(
                EnvelopeCodec.CURRENT_SCHEMA_VERSION,
                payload.envelopeType(),
                traceId,
                timestamp,
                idempotencyKey,
                originId,
                payload
        );
    }
}
