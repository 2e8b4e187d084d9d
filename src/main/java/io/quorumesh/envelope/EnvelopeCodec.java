package io.quorumesh.envelope;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quorumesh.error.ValidationException;
import io.quorumesh.util.Jsons;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;

/**
 * Encodes and decodes knowledge envelopes. Payloads are decoded through a registry indexed by
 * {@link EnvelopeType}; a type without a registered decoder is rejected.
 */
public final class EnvelopeCodec {
    public static final String CURRENT_SCHEMA_VERSION = "v1";
    private static final Set<String> KNOWN_SCHEMA_VERSIONS = Set.of(CURRENT_SCHEMA_VERSION);

    private final ObjectMapper mapper;
    private final Map<EnvelopeType, Class<? extends EnvelopePayload>> decoders;

    public EnvelopeCodec() {
        this(defaultDecoders());
    }

    EnvelopeCodec(Map<EnvelopeType, Class<? extends EnvelopePayload>> decoders) {
        this.mapper = Jsons.compactMapper();
        this.decoders = Collections.unmodifiableMap(new EnumMap<>(decoders));
    }

    public static Map<EnvelopeType, Class<? extends EnvelopePayload>> defaultDecoders() {
        Map<EnvelopeType, Class<? extends EnvelopePayload>> out = new EnumMap<>(EnvelopeType.class);
        out.put(EnvelopeType.PROPOSAL, Payloads.ProposalPayload.class);
        out.put(EnvelopeType.VOTE, Payloads.VotePayload.class);
        out.put(EnvelopeType.DECISION, Payloads.DecisionPayload.class);
        out.put(EnvelopeType.FACT, Payloads.FactPayload.class);
        out.put(EnvelopeType.PRESENCE, Payloads.PresencePayload.class);
        out.put(EnvelopeType.CAPABILITIES, Payloads.CapabilitiesPayload.class);
        return out;
    }

    public static void validateBase(Envelope envelope) {
        if (envelope == null) {
            throw new ValidationException("envelope is required");
        }
        if (isBlank(envelope.schemaVersion())) {
            throw new ValidationException("schemaVersion is required");
        }
        if (!KNOWN_SCHEMA_VERSIONS.contains(envelope.schemaVersion().trim())) {
            throw new ValidationException("unsupported schemaVersion: " + envelope.schemaVersion());
        }
        if (envelope.type() == null) {
            throw new ValidationException("type is required");
        }
        if (isBlank(envelope.traceId())) {
            throw new ValidationException("traceId is required");
        }
        if (envelope.timestamp() == null || Instant.EPOCH.equals(envelope.timestamp())) {
            throw new ValidationException("timestamp is required");
        }
        if (isBlank(envelope.idempotencyKey())) {
            throw new ValidationException("idempotencyKey is required");
        }
        if (isBlank(envelope.originId())) {
            throw new ValidationException("originId is required");
        }
    }

    /**
     * Validates the envelope and its payload, then serializes it to compact JSON.
     */
    public String encode(Envelope envelope) {
        validateBase(envelope);
        validatePayload(envelope.type(), envelope.payload());
        try {
            return mapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to encode envelope: " + envelope.idempotencyKey(), e);
        }
    }

    public Envelope decode(String raw) {
        JsonNode root;
        try {
            root = mapper.readTree(raw == null ? "" : raw);
        } catch (JsonProcessingException e) {
            throw new ValidationException("envelope is not valid JSON", e);
        }
        if (root == null || !root.isObject()) {
            throw new ValidationException("envelope must be a JSON object");
        }
        String rawType = text(root, "type");
        EnvelopeType type = null;
        if (!isBlank(rawType)) {
            type = EnvelopeType.find(rawType)
                    .orElseThrow(() -> new ValidationException("unsupported type: " + rawType));
        }
        Envelope base = new Envelope(
                text(root, "schemaVersion"),
                type,
                text(root, "traceId"),
                timestamp(root.get("timestamp")),
                text(root, "idempotencyKey"),
                text(root, "originId"),
                null
        );
        validateBase(base);
        EnvelopePayload payload = decodePayload(base.type(), root.get("payload"));
        return new Envelope(
                base.schemaVersion().trim(),
                base.type(),
                base.traceId().trim(),
                base.timestamp(),
                base.idempotencyKey().trim(),
                base.originId().trim(),
                payload
        );
    }

    private EnvelopePayload decodePayload(EnvelopeType type, JsonNode node) {
        Class<? extends EnvelopePayload> target = decoders.get(type);
        if (target == null) {
            throw new ValidationException("no payload decoder registered for type: " + type.wire());
        }
        if (node == null || node.isNull() || !node.isObject()) {
            throw new ValidationException("payload is required");
        }
        EnvelopePayload payload;
        try {
            payload = mapper.treeToValue(node, target);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new ValidationException("malformed " + type.wire() + " payload", e);
        }
        validatePayload(type, payload);
        return payload;
    }

    private void validatePayload(EnvelopeType type, EnvelopePayload payload) {
        if (payload == null) {
            throw new ValidationException("payload is required");
        }
        if (payload.envelopeType() != type) {
            throw new ValidationException(
                    "payload type mismatch, envelope=" + type.wire() + ", payload=" + payload.envelopeType().wire());
        }
        payload.validate();
    }

    private Instant timestamp(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isNumber()) {
            return Instant.ofEpochMilli(node.asLong());
        }
        String value = node.asText("");
        if (value.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(value.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("timestamp must be ISO-8601: " + value, e);
        }
    }

    private static String text(JsonNode root, String field) {
        JsonNode node = root.get(field);
        if (node == null || node.isNull()) {
            return null;
        }
        return node.asText();
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
