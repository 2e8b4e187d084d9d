package io.quorumesh.envelope;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * Type-tagged envelope payload. Each implementation maps to exactly one {@link EnvelopeType}.
 */
public interface EnvelopePayload {
    @JsonIgnore
    EnvelopeType envelopeType();

    /**
     * Throws {@link io.quorumesh.error.ValidationException} when a required field is missing or malformed.
     */
    void validate();
}
