package io.quorumesh.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum VoteValue {
    YES("yes"),
    NO("no");

    private final String wire;

    VoteValue(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public static VoteValue fromString(String raw) {
        if (raw != null) {
            String value = raw.trim();
            for (VoteValue vote : values()) {
                if (vote.wire.equalsIgnoreCase(value)) {
                    return vote;
                }
            }
        }
        throw new IllegalArgumentException("vote must be yes|no");
    }
}
