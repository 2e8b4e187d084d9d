package io.quorumesh.governance;

import io.quorumesh.bus.FileBus;
import io.quorumesh.envelope.Envelope;
import io.quorumesh.envelope.EnvelopeCodec;
import io.quorumesh.envelope.KnowledgeTopics;
import io.quorumesh.envelope.Payloads;
import io.quorumesh.error.ValidationException;
import io.quorumesh.model.Fact;
import io.quorumesh.model.GroupMember;
import io.quorumesh.model.Proposal;
import io.quorumesh.model.Vote;
import io.quorumesh.model.VoteValue;
import io.quorumesh.observability.AuditLogger;
import io.quorumesh.runtime.GovernanceSettings;
import io.quorumesh.storage.KnowledgeStore;
import io.quorumesh.storage.RosterStore;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Consumer side of the knowledge topics. Every envelope is checked against the durable seen-set before any
 * side effect, and its key is recorded only after the effect is applied, so redelivery applies it once.
 */
public final class KnowledgeEnvelopeHandler {
    private final GovernanceService governance;
    private final KnowledgeStore store;
    private final RosterStore roster;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final Supplier<GovernanceSettings> settings;
    private final EnvelopeCodec codec;

    public KnowledgeEnvelopeHandler(
            GovernanceService governance,
            KnowledgeStore store,
            RosterStore roster,
            AuditLogger auditLogger,
            Clock clock,
            Supplier<GovernanceSettings> settings
    ) {
        this.governance = governance;
        this.store = store;
        this.roster = roster;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.settings = settings;
        this.codec = new EnvelopeCodec();
    }

    public HandleOutcome handleRaw(String topic, String raw) {
        return handle(topic, codec.decode(raw));
    }

    public HandleOutcome handle(String topic, Envelope envelope) {
        EnvelopeCodec.validateBase(envelope);
        if (envelope.type().governed()) {
            governance.requireEnabled();
        }
        String self = settings.get().clawId();
        if (self != null && !self.isBlank() && self.equalsIgnoreCase(envelope.originId())) {
            audit(topic, envelope, HandleOutcome.SKIPPED_SELF);
            return HandleOutcome.SKIPPED_SELF;
        }
        synchronized (governance.writerLock()) {
            if (store.hasSeen(envelope.idempotencyKey())) {
                audit(topic, envelope, HandleOutcome.DEDUPLICATED);
                return HandleOutcome.DEDUPLICATED;
            }
            apply(envelope);
            store.markSeen(new KnowledgeStore.SeenKey(
                    envelope.idempotencyKey(),
                    envelope.originId(),
                    envelope.type().wire(),
                    topic,
                    envelope.traceId(),
                    clock.millis()
            ));
        }
        audit(topic, envelope, HandleOutcome.APPLIED);
        return HandleOutcome.APPLIED;
    }

    /**
     * Drains every knowledge topic of {@code group} for one consumer. A malformed record is counted as rejected
     * and committed past; any other failure stops the drain with the record left uncommitted for redelivery.
     */
    public ConsumeSummary consume(FileBus bus, String group, String consumerId, int limit) {
        if (group == null || group.isBlank()) {
            throw new ValidationException("group is required");
        }
        int applied = 0;
        int deduplicated = 0;
        int skippedSelf = 0;
        int rejected = 0;
        int remaining = 0;
        for (String topic : KnowledgeTopics.forGroup(group).all()) {
            for (FileBus.BusRecord record : bus.poll(topic, consumerId, limit)) {
                try {
                    switch (handleRaw(topic, record.payload())) {
                        case APPLIED -> applied++;
                        case DEDUPLICATED -> deduplicated++;
                        case SKIPPED_SELF -> skippedSelf++;
                    }
                } catch (ValidationException e) {
                    rejected++;
                    auditLogger.log(AuditLogger.AuditEvent.of(
                            "envelope.consume",
                            consumerId,
                            "topic/" + topic,
                            "rejected",
                            null,
                            Map.of("record_id", record.recordId(), "error", String.valueOf(e.getMessage()))
                    ));
                }
                bus.commit(topic, consumerId, record);
            }
            remaining += bus.lag(topic, consumerId);
        }
        return new ConsumeSummary(group.trim(), consumerId, applied, deduplicated, skippedSelf, rejected, remaining);
    }

    private void apply(Envelope envelope) {
        long tsMs = envelope.timestamp().toEpochMilli();
        String origin = envelope.originId();
        switch (envelope.type()) {
            case PROPOSAL -> {
                Payloads.ProposalPayload p = (Payloads.ProposalPayload) envelope.payload();
                if (store.getProposal(p.proposalId()).isEmpty()) {
                    governance.registry().create(Proposal.pending(
                            p.proposalId(),
                            p.group(),
                            p.title() == null ? "" : p.title(),
                            p.statement(),
                            p.tags(),
                            origin,
                            "",
                            tsMs
                    ));
                }
            }
            case VOTE -> {
                Payloads.VotePayload p = (Payloads.VotePayload) envelope.payload();
                governance.recordRemoteVote(new Vote(
                        p.proposalId(),
                        origin,
                        "",
                        VoteValue.fromString(p.vote()),
                        p.reason() == null ? "" : p.reason(),
                        envelope.traceId(),
                        tsMs
                ), envelope.traceId());
            }
            case DECISION -> governance.applyRemoteDecision(
                    (Payloads.DecisionPayload) envelope.payload(), origin, envelope.traceId());
            case FACT -> {
                Payloads.FactPayload p = (Payloads.FactPayload) envelope.payload();
                governance.applyFact(new Fact(
                        p.factId(),
                        p.group(),
                        p.subject(),
                        p.predicate(),
                        p.object(),
                        p.version(),
                        p.source(),
                        p.proposalId() == null ? "" : p.proposalId(),
                        p.tags(),
                        tsMs
                ), origin, envelope.traceId());
            }
            case PRESENCE -> {
                Payloads.PresencePayload p = (Payloads.PresencePayload) envelope.payload();
                roster.upsertGroupMember(new GroupMember(p.group(), origin, p.instanceId(), p.status(), List.of(), tsMs));
            }
            case CAPABILITIES -> {
                Payloads.CapabilitiesPayload p = (Payloads.CapabilitiesPayload) envelope.payload();
                roster.upsertGroupMember(new GroupMember(p.group(), origin, p.instanceId(), GroupMember.STATUS_ACTIVE,
                        p.capabilities(), tsMs));
            }
        }
    }

    private void audit(String topic, Envelope envelope, HandleOutcome outcome) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", envelope.type().wire());
        details.put("idempotency_key", envelope.idempotencyKey());
        details.put("origin", envelope.originId());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "envelope.consume",
                settings.get().clawId(),
                "topic/" + (topic == null ? "" : topic),
                outcome.wire(),
                envelope.traceId(),
                details
        ));
    }

    public enum HandleOutcome {
        APPLIED("applied"),
        DEDUPLICATED("deduplicated"),
        SKIPPED_SELF("self");

        private final String wire;

        HandleOutcome(String wire) {
            this.wire = wire;
        }

        public String wire() {
            return wire;
        }
    }

    /**
     * {@code remaining} counts records still uncommitted after the drain, either past {@code limit} or behind a
     * record that failed.
     */
    public record ConsumeSummary(String group, String consumerId, int applied, int deduplicated, int skippedSelf,
                                 int rejected, int remaining) {}
}
