package io.quorumesh.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum FactOutcome {
    ACCEPTED("accepted"),
    STALE("stale"),
    CONFLICT("conflict");

    private final String wire;

    FactOutcome(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }
}
