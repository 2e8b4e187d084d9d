package io.quorumesh.governance;

import io.quorumesh.bus.EnvelopeTransport;
import io.quorumesh.envelope.Envelope;
import io.quorumesh.envelope.EnvelopeCodec;
import io.quorumesh.envelope.EnvelopePayload;
import io.quorumesh.envelope.IdempotencyKeys;
import io.quorumesh.envelope.KnowledgeTopics;
import io.quorumesh.envelope.Payloads;
import io.quorumesh.error.GovernanceDisabledException;
import io.quorumesh.error.StateConflictException;
import io.quorumesh.error.ValidationException;
import io.quorumesh.model.Decision;
import io.quorumesh.model.Fact;
import io.quorumesh.model.GroupMember;
import io.quorumesh.model.Proposal;
import io.quorumesh.model.ProposalStatus;
import io.quorumesh.model.Vote;
import io.quorumesh.model.VoteValue;
import io.quorumesh.observability.AuditLogger;
import io.quorumesh.observability.TraceContextUtil;
import io.quorumesh.runtime.GovernanceSettings;
import io.quorumesh.storage.KnowledgeStore;
import io.quorumesh.storage.RosterStore;
import io.quorumesh.util.Hashing;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Local side of knowledge governance: proposals, votes, quorum evaluation, decisions and derived facts.
 * Vote upsert, re-evaluation, decision write and fact write run under one writer lock.
 */
public final class GovernanceService {
    public static final String DERIVED_FACT_PREDICATE = "statement";
    public static final String DECISION_SOURCE_PREFIX = "decision:";

    private final KnowledgeStore store;
    private final EnvelopeTransport transport;
    private final AuditLogger auditLogger;
    private final Clock clock;
    private final Supplier<GovernanceSettings> settings;
    private final ProposalRegistry registry;
    private final PoolSizeEstimator poolSizeEstimator;
    private final FactResolver factResolver;
    private final EnvelopeCodec codec;
    private final Object writerLock;

    public GovernanceService(
            KnowledgeStore store,
            RosterStore roster,
            EnvelopeTransport transport,
            AuditLogger auditLogger,
            Clock clock,
            Supplier<GovernanceSettings> settings
    ) {
        this.store = store;
        this.transport = transport;
        this.auditLogger = auditLogger;
        this.clock = clock;
        this.settings = settings;
        this.registry = new ProposalRegistry(store);
        this.poolSizeEstimator = new PoolSizeEstimator(roster);
        this.factResolver = new FactResolver();
        this.codec = new EnvelopeCodec();
        this.writerLock = new Object();
    }

    public ProposalRegistry registry() {
        return registry;
    }

    Object writerLock() {
        return writerLock;
    }

    public void requireEnabled() {
        if (!settings.get().governanceActive()) {
            throw new GovernanceDisabledException();
        }
    }

    public ProposeResult propose(ProposeRequest req) {
        requireEnabled();
        GovernanceSettings s = settings.get();
        String clawId = requireIdentity(s);
        String group = firstNonBlank(req.group(), s.group());
        String proposalId = firstNonBlank(req.proposalId(), ProposalRegistry.newProposalId());
        String traceId = TraceContextUtil.traceIdOrNew(req.traceId());
        long nowMs = clock.millis();
        Proposal proposal = Proposal.pending(
                proposalId,
                group,
                req.title() == null ? "" : req.title().trim(),
                req.statement() == null ? null : req.statement().trim(),
                req.tags(),
                clawId,
                s.instanceId(),
                nowMs
        );
        Proposal stored;
        boolean republish;
        synchronized (writerLock) {
            Optional<Proposal> existing = store.getProposal(proposalId);
            republish = existing.isPresent() && isSameProposal(existing.get(), proposal);
            if (republish) {
                stored = existing.get();
            } else {
                registry.create(proposal);
                stored = proposal;
            }
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                republish ? "proposal.republish" : "proposal.create",
                clawId,
                "proposal/" + proposalId,
                "ok",
                traceId,
                Map.of("group", group, "title", stored.title())
        ));
        String topic = publishProposal(stored, traceId);
        return new ProposeResult(stored, topic, traceId, republish);
    }

    // Same id, proposer, group and statement: a retry after a failed publish, answered with the stored row.
    private static boolean isSameProposal(Proposal stored, Proposal requested) {
        return stored.proposerClawId().equalsIgnoreCase(requested.proposerClawId())
                && stored.group().equals(requested.group())
                && stored.statement().equals(requested.statement());
    }

    private String publishProposal(Proposal proposal, String traceId) {
        return publish(
                proposal.group(),
                new Payloads.ProposalPayload(proposal.proposalId(), proposal.group(), proposal.title(),
                        proposal.statement(), proposal.tags()),
                IdempotencyKeys.proposal(proposal.proposalId()),
                traceId
        );
    }

    /**
     * Records this node's vote, re-evaluates the proposal and publishes the vote plus any terminal decision.
     *
     * @throws StateConflictException if the proposal is already decided and this is not a retry of the same vote
     */
    public VoteResult vote(VoteRequest req) {
        requireEnabled();
        GovernanceSettings s = settings.get();
        String voterId = requireIdentity(s);
        VoteValue value;
        try {
            value = VoteValue.fromString(req.vote());
        } catch (IllegalArgumentException e) {
            throw new ValidationException(e.getMessage(), e);
        }
        String traceId = TraceContextUtil.traceIdOrNew(req.traceId());
        Proposal proposal = registry.get(req.proposalId());
        Vote vote = new Vote(proposal.proposalId(), voterId, s.instanceId(), value,
                req.reason() == null ? "" : req.reason().trim(), traceId, clock.millis());
        Evaluation evaluation;
        synchronized (writerLock) {
            Proposal current = registry.get(proposal.proposalId());
            if (current.status().isTerminal() && !sameVoteRecorded(vote)) {
                throw new StateConflictException(
                        "proposal " + current.proposalId() + " is already " + current.status().wire(),
                        ProposalStatus.PENDING.wire(),
                        current.status().wire()
                );
            }
            // A decided proposal that already holds this exact vote is a retry after a failed publish.
            if (!current.status().isTerminal()) {
                store.upsertVote(vote);
            }
            evaluation = evaluateLocked(current, req.poolSizeOverride(), traceId);
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "vote.cast",
                voterId,
                "proposal/" + proposal.proposalId(),
                value.wire(),
                traceId,
                Map.of("decision", evaluation.decision().status().wire(), "pool_size", evaluation.poolSize())
        ));
        publish(
                proposal.group(),
                new Payloads.VotePayload(proposal.proposalId(), value.wire(), vote.reason()),
                IdempotencyKeys.vote(proposal.proposalId(), voterId),
                traceId
        );
        publishDecisionArtifacts(evaluation, traceId);
        return new VoteResult(vote, evaluation);
    }

    /**
     * Re-runs the evaluator for a proposal. This is also where a quorum timeout turns into an expired status,
     * since expiry is only checked when a proposal is evaluated.
     */
    public Evaluation evaluate(String proposalId, int poolSizeOverride, String traceId) {
        requireEnabled();
        String trace = TraceContextUtil.traceIdOrNew(traceId);
        Evaluation evaluation;
        synchronized (writerLock) {
            evaluation = evaluateLocked(registry.get(proposalId), poolSizeOverride, trace);
        }
        publishDecisionArtifacts(evaluation, trace);
        return evaluation;
    }

    /**
     * Stores a vote received from a peer and re-evaluates locally. Nothing is published.
     */
    public Optional<Evaluation> recordRemoteVote(Vote vote, String traceId) {
        requireEnabled();
        synchronized (writerLock) {
            store.upsertVote(vote);
            Optional<Proposal> proposal = store.getProposal(vote.proposalId());
            if (proposal.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(evaluateLocked(proposal.get(), 0, traceId));
        }
    }

    /**
     * Applies a decision received from a peer. The first terminal write wins; later ones are ignored.
     */
    public Optional<Evaluation> applyRemoteDecision(Payloads.DecisionPayload payload, String actor, String traceId) {
        requireEnabled();
        Decision decision = new Decision(
                ProposalStatus.fromString(payload.outcome()),
                payload.yes(),
                payload.no(),
                payload.reason() == null ? "" : payload.reason()
        );
        synchronized (writerLock) {
            Optional<Proposal> proposal = store.getProposal(payload.proposalId());
            if (proposal.isEmpty()) {
                return Optional.empty();
            }
            return Optional.of(writeDecisionLocked(proposal.get(), decision, 0, actor, traceId));
        }
    }

    public KnowledgeStore.FactApplyResult applyFact(Fact fact, String actor, String traceId) {
        requireEnabled();
        synchronized (writerLock) {
            return applyFactLocked(fact, actor, traceId);
        }
    }

    /**
     * Publishes this node's presence, plus its capabilities when any are given. Not governed, so it works with
     * governance disabled.
     */
    public List<String> announce(String group, String status, List<String> capabilities) {
        GovernanceSettings s = settings.get();
        String memberId = requireIdentity(s);
        String g = firstNonBlank(group, s.group());
        if (g == null || g.isBlank()) {
            throw new ValidationException("group is required");
        }
        String traceId = TraceContextUtil.newTraceId();
        long nowMs = clock.millis();
        List<String> topics = new ArrayList<>();
        topics.add(publish(
                g,
                new Payloads.PresencePayload(g, s.instanceId(), firstNonBlank(status, GroupMember.STATUS_ACTIVE)),
                IdempotencyKeys.presence(memberId, nowMs),
                traceId
        ));
        if (capabilities != null && !capabilities.isEmpty()) {
            topics.add(publish(
                    g,
                    new Payloads.CapabilitiesPayload(g, s.instanceId(), capabilities),
                    IdempotencyKeys.capabilities(memberId, nowMs),
                    traceId
            ));
        }
        return topics;
    }

    public List<Fact> listFacts(String group, int limit, int offset) {
        return store.listFacts(group, limit, offset);
    }

    public List<Proposal> listDecisions(ProposalStatus status, int limit, int offset) {
        return registry.list(status, limit, offset);
    }

    public Map<String, Object> status() {
        GovernanceSettings s = settings.get();
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("knowledgeEnabled", s.knowledgeEnabled());
        out.put("governanceEnabled", s.governanceEnabled());
        out.put("group", s.group());
        out.put("clawId", s.clawId());
        out.put("instanceId", s.instanceId());
        Map<String, Object> voting = new LinkedHashMap<>();
        voting.put("enabled", s.voting().enabled());
        voting.put("minPoolSize", s.voting().minPoolSize());
        voting.put("quorumYes", s.voting().quorumYes());
        voting.put("quorumNo", s.voting().quorumNo());
        voting.put("timeoutSec", s.voting().timeout().getSeconds());
        voting.put("allowSelfVote", s.voting().allowSelfVote());
        out.put("voting", voting);
        out.put("proposals", store.countProposalsByStatus());
        out.put("facts", store.countFacts(s.group()));
        out.put("factOutcomes", store.countFactOutcomes());
        out.put("seenEnvelopes", store.countSeen());
        out.put("poolSize", poolSizeEstimator.estimate(s.group(), 0, s.voting()));
        return out;
    }

    private boolean sameVoteRecorded(Vote vote) {
        return store.listVotes(vote.proposalId()).stream()
                .anyMatch(v -> v.voterId().equals(vote.voterId()) && v.value() == vote.value());
    }

    private Evaluation evaluateLocked(Proposal proposal, int poolSizeOverride, String traceId) {
        GovernanceSettings s = settings.get();
        int poolSize = poolSizeEstimator.estimate(proposal.group(), poolSizeOverride, s.voting());
        if (proposal.status().isTerminal()) {
            Decision stored = new Decision(proposal.status(), proposal.yes(), proposal.no(), proposal.reason());
            return new Evaluation(proposal, stored, false, poolSize, null);
        }
        List<Vote> votes = store.listVotes(proposal.proposalId());
        Instant now = clock.instant();
        Decision decision = QuorumEvaluator.evaluate(
                proposal.proposerClawId(),
                poolSize,
                votes,
                Instant.ofEpochMilli(proposal.createdAtMs()),
                now,
                s.voting()
        );
        if (!decision.isTerminal()) {
            store.updateProposalTally(proposal.proposalId(), decision.yes(), decision.no(), now.toEpochMilli());
            return new Evaluation(proposal, decision, false, poolSize, null);
        }
        return writeDecisionLocked(proposal, decision, poolSize, s.clawId(), traceId);
    }

    private Evaluation writeDecisionLocked(Proposal proposal, Decision decision, int poolSize, String actor, String traceId) {
        long nowMs = clock.millis();
        boolean applied = store.updateProposalDecision(proposal.proposalId(), decision, nowMs);
        Proposal after = store.getProposal(proposal.proposalId()).orElse(proposal);
        if (!applied) {
            Decision stored = new Decision(after.status(), after.yes(), after.no(), after.reason());
            return new Evaluation(after, stored, false, poolSize, null);
        }
        auditLogger.log(AuditLogger.AuditEvent.of(
                "proposal.decide",
                actor,
                "proposal/" + proposal.proposalId(),
                decision.status().wire(),
                traceId,
                Map.of("yes", decision.yes(), "no", decision.no(), "reason", decision.reason())
        ));
        KnowledgeStore.FactApplyResult derived = null;
        if (decision.status() == ProposalStatus.APPROVED) {
            derived = applyFactLocked(deriveFact(after, nowMs), actor, traceId);
        }
        return new Evaluation(after, decision, true, poolSize, derived);
    }

    private Fact deriveFact(Proposal proposal, long nowMs) {
        String subject = proposal.title() == null || proposal.title().isBlank()
                ? proposal.proposalId()
                : proposal.title().trim();
        int latest = store.getFactLatest(proposal.group(), subject, DERIVED_FACT_PREDICATE)
                .map(Fact::version)
                .orElse(0);
        return new Fact(
                factId(proposal.group(), subject, DERIVED_FACT_PREDICATE),
                proposal.group(),
                subject,
                DERIVED_FACT_PREDICATE,
                proposal.statement(),
                latest + 1,
                DECISION_SOURCE_PREFIX + proposal.proposalId(),
                proposal.proposalId(),
                proposal.tags(),
                nowMs
        );
    }

    public static String factId(String group, String subject, String predicate) {
        return "kf-" + Hashing.sha256Hex(group + "|" + subject + "|" + predicate).substring(0, 24);
    }

    private KnowledgeStore.FactApplyResult applyFactLocked(Fact fact, String actor, String traceId) {
        KnowledgeStore.FactApplyResult result = store.upsertFactLatest(fact, factResolver, clock.millis());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("group", fact.group());
        details.put("subject", fact.subject());
        details.put("predicate", fact.predicate());
        details.put("version", fact.version());
        details.put("source", fact.source());
        details.put("reason", result.reason());
        auditLogger.log(AuditLogger.AuditEvent.of(
                "fact.apply",
                actor,
                "fact/" + fact.factId(),
                result.outcome().wire(),
                traceId,
                details
        ));
        return result;
    }

    private void publishDecisionArtifacts(Evaluation evaluation, String traceId) {
        Decision decision = evaluation.decision();
        if (!decision.isTerminal()) {
            return;
        }
        Proposal proposal = evaluation.proposal();
        publish(
                proposal.group(),
                new Payloads.DecisionPayload(proposal.proposalId(), decision.status().wire(), decision.yes(),
                        decision.no(), decision.reason()),
                IdempotencyKeys.decision(proposal.proposalId()),
                traceId
        );
        if (decision.status() != ProposalStatus.APPROVED) {
            return;
        }
        String subject = proposal.title() == null || proposal.title().isBlank()
                ? proposal.proposalId()
                : proposal.title().trim();
        Optional<Fact> fact = store.getFactLatest(proposal.group(), subject, DERIVED_FACT_PREDICATE)
                .filter(f -> (DECISION_SOURCE_PREFIX + proposal.proposalId()).equals(f.source()));
        fact.ifPresent(f -> publish(
                f.group(),
                new Payloads.FactPayload(f.factId(), f.group(), f.subject(), f.predicate(), f.object(), f.version(),
                        f.source(), f.proposalId(), f.tags()),
                IdempotencyKeys.fact(f.factId(), f.version(), f.source()),
                traceId
        ));
    }

    private String publish(String group, EnvelopePayload payload, String idempotencyKey, String traceId) {
        GovernanceSettings s = settings.get();
        Envelope envelope = Envelope.of(traceId, clock.instant(), idempotencyKey, requireIdentity(s), payload);
        String json = codec.encode(envelope);
        String topic = KnowledgeTopics.topic(group, payload.envelopeType());
        transport.produce(topic, idempotencyKey, json);
        auditLogger.log(AuditLogger.AuditEvent.of(
                "envelope.publish",
                s.clawId(),
                "topic/" + topic,
                "ok",
                traceId,
                Map.of("type", payload.envelopeType().wire(), "idempotency_key", idempotencyKey)
        ));
        return topic;
    }

    private static String requireIdentity(GovernanceSettings s) {
        if (s.clawId() == null || s.clawId().isBlank()) {
            throw new ValidationException("clawId is required; set it in settings or pass --claw-id");
        }
        return s.clawId();
    }

    private static String firstNonBlank(String value, String fallback) {
        if (value != null && !value.isBlank()) {
            return value.trim();
        }
        return fallback;
    }

    public record ProposeRequest(String proposalId, String group, String title, String statement, List<String> tags,
                                 String traceId) {}
    public record ProposeResult(Proposal proposal, String topic, String traceId, boolean republished) {}
    public record VoteRequest(String proposalId, String vote, String reason, int poolSizeOverride, String traceId) {}
    public record VoteResult(Vote vote, Evaluation evaluation) {}

    /**
     * @param applied whether this call wrote the terminal decision
     * @param fact    the derived fact outcome, present only when this call approved the proposal
     */
    public record Evaluation(Proposal proposal, Decision decision, boolean applied, int poolSize,
                             KnowledgeStore.FactApplyResult fact) {}
}
