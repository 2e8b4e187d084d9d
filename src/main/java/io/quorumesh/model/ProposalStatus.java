package io.quorumesh.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ProposalStatus {
    PENDING("pending"),
    APPROVED("approved"),
    REJECTED("rejected"),
    EXPIRED("expired");

    private final String wire;

    ProposalStatus(String wire) {
        this.wire = wire;
    }

    @JsonValue
    public String wire() {
        return wire;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }

    public static ProposalStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Proposal status must not be blank");
        }
        String value = raw.trim();
        for (ProposalStatus status : values()) {
            if (status.wire.equalsIgnoreCase(value) || status.name().equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown proposal status: " + raw);
    }
}
