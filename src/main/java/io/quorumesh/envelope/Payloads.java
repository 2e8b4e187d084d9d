package io.quorumesh.envelope;

import io.quorumesh.error.ValidationException;
import io.quorumesh.model.ProposalStatus;
import io.quorumesh.model.VoteValue;

import java.util.List;

/**
 * Payload variants carried by {@link Envelope}.
 */
public final class Payloads {
    private Payloads() {
    }

    public record ProposalPayload(
            String proposalId,
            String group,
            String title,
            String statement,
            List<String> tags
    ) implements EnvelopePayload {
        @Override
        public EnvelopeType envelopeType() {
            return EnvelopeType.PROPOSAL;
        }

        @Override
        public void validate() {
            require(proposalId, "proposalId is required");
            require(group, "group is required");
            require(statement, "statement is required");
            requireNoNullElements(tags, "tags");
        }
    }

    public record VotePayload(String proposalId, String vote, String reason) implements EnvelopePayload {
        @Override
        public EnvelopeType envelopeType() {
            return EnvelopeType.VOTE;
        }

        @Override
        public void validate() {
            require(proposalId, "proposalId is required");
            try {
                VoteValue.fromString(vote);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("vote must be yes|no", e);
            }
        }
    }

    public record DecisionPayload(
            String proposalId,
            String outcome,
            int yes,
            int no,
            String reason
    ) implements EnvelopePayload {
        @Override
        public EnvelopeType envelopeType() {
            return EnvelopeType.DECISION;
        }

        @Override
        public void validate() {
            require(proposalId, "proposalId is required");
            ProposalStatus status;
            try {
                status = ProposalStatus.fromString(outcome);
            } catch (IllegalArgumentException e) {
                throw new ValidationException("outcome must be approved|rejected|expired", e);
            }
            if (!status.isTerminal()) {
                throw new ValidationException("outcome must be approved|rejected|expired");
            }
            if (yes < 0 || no < 0) {
                throw new ValidationException("yes/no must be >= 0");
            }
        }
    }

    public record FactPayload(
            String factId,
            String group,
            String subject,
            String predicate,
            String object,
            int version,
            String source,
            String proposalId,
            List<String> tags
    ) implements EnvelopePayload {
        @Override
        public EnvelopeType envelopeType() {
            return EnvelopeType.FACT;
        }

        @Override
        public void validate() {
            require(factId, "factId is required");
            require(group, "group is required");
            if (isBlank(subject) || isBlank(predicate) || isBlank(object)) {
                throw new ValidationException("subject/predicate/object are required");
            }
            if (version <= 0) {
                throw new ValidationException("version must be > 0");
            }
            require(source, "source is required");
            requireNoNullElements(tags, "tags");
        }
    }

    public record PresencePayload(String group, String instanceId, String status) implements EnvelopePayload {
        @Override
        public EnvelopeType envelopeType() {
            return EnvelopeType.PRESENCE;
        }

        @Override
        public void validate() {
            require(group, "group is required");
            require(status, "status is required");
        }
    }

    public record CapabilitiesPayload(
            String group,
            String instanceId,
            List<String> capabilities
    ) implements EnvelopePayload {
        @Override
        public EnvelopeType envelopeType() {
            return EnvelopeType.CAPABILITIES;
        }

        @Override
        public void validate() {
            require(group, "group is required");
            if (capabilities == null) {
                throw new ValidationException("capabilities are required");
            }
            requireNoNullElements(capabilities, "capabilities");
        }
    }

    private static void require(String value, String message) {
        if (isBlank(value)) {
            throw new ValidationException(message);
        }
    }

    private static void requireNoNullElements(List<String> values, String field) {
        if (values == null) {
            return;
        }
        for (String value : values) {
            if (value == null) {
                throw new ValidationException(field + " must not contain null");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
