package io.quorumesh.envelope;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Optional;

public enum EnvelopeType {
    PROPOSAL("proposal", "proposals", true),
    VOTE("vote", "votes", true),
    DECISION("decision", "decisions", true),
    FACT("fact", "facts", true),
    PRESENCE("presence", "presence", false),
    CAPABILITIES("capabilities", "capabilities", false);

    private final String wire;
    private final String topicSuffix;
    private final boolean governed;

    EnvelopeType(String wire, String topicSuffix, boolean governed) {
        this.wire = wire;
        this.topicSuffix = topicSuffix;
        this.governed = governed;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public String topicSuffix() {
        return topicSuffix;
    }

    /**
     * Governed types mutate shared knowledge and require governance to be enabled.
     */
    public boolean governed() {
        return governed;
    }

    public static Optional<EnvelopeType> find(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (EnvelopeType type : values()) {
            if (type.wire.equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
