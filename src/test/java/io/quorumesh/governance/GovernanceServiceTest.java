package io.quorumesh.governance;

import com.fasterxml.jackson.databind.JsonNode;
import io.quorumesh.bus.EnvelopeTransport;
import io.quorumesh.config.QuorumMeshConfig;
import io.quorumesh.envelope.Envelope;
import io.quorumesh.envelope.EnvelopeCodec;
import io.quorumesh.envelope.IdempotencyKeys;
import io.quorumesh.envelope.Payloads;
import io.quorumesh.error.DuplicateIdException;
import io.quorumesh.error.GovernanceDisabledException;
import io.quorumesh.error.StateConflictException;
import io.quorumesh.error.TransportException;
import io.quorumesh.error.ValidationException;
import io.quorumesh.model.Fact;
import io.quorumesh.model.FactOutcome;
import io.quorumesh.model.ProposalStatus;
import io.quorumesh.model.VotingPolicy;
import io.quorumesh.runtime.GovernanceSettings;
import io.quorumesh.runtime.QuorumMeshRuntime;
import io.quorumesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

final class GovernanceServiceTest {

    @Test
    void quorumApprovalPublishesDecisionAndDerivedFact() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-governance-approve-");
        try {
            List<Produced> sent = new ArrayList<>();
            QuorumMeshRuntime runtime = runtime(root, (topic, key, payload) -> sent.add(new Produced(topic, key, payload)),
                    new MutableClock());
            GovernanceService governance = runtime.governance();

            as(runtime, "claw-a");
            GovernanceService.ProposeResult proposed = governance.propose(new GovernanceService.ProposeRequest(
                    "kp-approve", "", "Retry budget", "retry budget is 3", List.of("ops"), "trace-approve"));
            Assertions.assertEquals("ops.knowledge.proposals", proposed.topic());
            Assertions.assertEquals("trace-approve", proposed.traceId());

            as(runtime, "claw-b");
            GovernanceService.VoteResult first = governance.vote(
                    new GovernanceService.VoteRequest("kp-approve", "yes", "", 3, null));
            Assertions.assertEquals(ProposalStatus.PENDING, first.evaluation().decision().status());
            Assertions.assertEquals(QuorumEvaluator.REASON_WAITING, first.evaluation().decision().reason());

            as(runtime, "claw-c");
            GovernanceService.VoteResult second = governance.vote(
                    new GovernanceService.VoteRequest("kp-approve", "YES", "agreed", 3, null));
            GovernanceService.Evaluation evaluation = second.evaluation();
            Assertions.assertTrue(evaluation.applied());
            Assertions.assertEquals(ProposalStatus.APPROVED, evaluation.decision().status());
            Assertions.assertEquals(2, evaluation.decision().yes());
            Assertions.assertEquals(FactOutcome.ACCEPTED, evaluation.fact().outcome());

            Fact fact = runtime.knowledgeStore().getFactLatest("ops", "Retry budget", "statement").orElseThrow();
            Assertions.assertEquals("retry budget is 3", fact.object());
            Assertions.assertEquals(1, fact.version());
            Assertions.assertEquals("decision:kp-approve", fact.source());
            Assertions.assertEquals(GovernanceService.factId("ops", "Retry budget", "statement"), fact.factId());

            Assertions.assertEquals(List.of(
                    "knowledge:proposal:kp-approve",
                    "knowledge:vote:kp-approve:claw-b",
                    "knowledge:vote:kp-approve:claw-c",
                    "knowledge:decision:kp-approve",
                    "knowledge:fact:" + fact.factId() + ":v1:decision:kp-approve"
            ), sent.stream().map(Produced::key).toList());
            Envelope decision = new EnvelopeCodec().decode(sent.get(3).payload());
            Assertions.assertEquals("claw-c", decision.originId());
            Assertions.assertEquals("approved", ((Payloads.DecisionPayload) decision.payload()).outcome());
            Assertions.assertEquals("ops.knowledge.facts", sent.get(4).topic());

            StateConflictException late = Assertions.assertThrows(StateConflictException.class, () -> {
                as(runtime, "claw-d");
                governance.vote(new GovernanceService.VoteRequest("kp-approve", "no", "", 3, null));
            });
            Assertions.assertEquals("approved", late.actual());
            Assertions.assertTrue(runtime.auditLogger().verifyChain().valid());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void selfVoteDoesNotCountByDefault() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-governance-self-");
        try {
            QuorumMeshRuntime runtime = runtime(root, (topic, key, payload) -> { }, new MutableClock());
            as(runtime, "claw-a");
            runtime.governance().propose(new GovernanceService.ProposeRequest(
                    "kp-self", "ops", "", "self votes are ignored", List.of(), null));
            GovernanceService.VoteResult result = runtime.governance().vote(
                    new GovernanceService.VoteRequest("kp-self", "yes", "", 3, null));
            Assertions.assertEquals(0, result.evaluation().decision().yes());
            Assertions.assertEquals(ProposalStatus.PENDING, result.evaluation().decision().status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void proposalExpiresWhenEvaluatedAfterTimeout() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-governance-expire-");
        try {
            MutableClock clock = new MutableClock();
            List<Produced> sent = new ArrayList<>();
            QuorumMeshRuntime runtime = runtime(root, (topic, key, payload) -> sent.add(new Produced(topic, key, payload)),
                    clock);
            as(runtime, "claw-a");
            runtime.governance().propose(new GovernanceService.ProposeRequest(
                    "kp-expire", "ops", "", "nobody answers", List.of(), null));

            clock.advance(Duration.ofMinutes(59));
            Assertions.assertEquals(ProposalStatus.PENDING,
                    runtime.governance().evaluate("kp-expire", 3, null).decision().status());

            clock.advance(Duration.ofMinutes(1));
            GovernanceService.Evaluation expired = runtime.governance().evaluate("kp-expire", 3, null);
            Assertions.assertEquals(ProposalStatus.EXPIRED, expired.decision().status());
            Assertions.assertEquals(QuorumEvaluator.REASON_TIMEOUT, expired.decision().reason());
            Assertions.assertNull(expired.fact());
            Assertions.assertEquals(0, runtime.knowledgeStore().countFacts("ops"));
            Assertions.assertEquals("knowledge:decision:kp-expire", sent.get(sent.size() - 1).key());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void voteRetryAfterFailedPublishRepublishesDecision() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-governance-retry-");
        try {
            List<Produced> sent = new ArrayList<>();
            boolean[] failDecision = {true};
            EnvelopeTransport flaky = (topic, key, payload) -> {
                if (failDecision[0] && key.startsWith("knowledge:decision:")) {
                    failDecision[0] = false;
                    throw new TransportException(topic, "broker unavailable", null);
                }
                sent.add(new Produced(topic, key, payload));
            };
            QuorumMeshRuntime runtime = runtime(root, flaky, new MutableClock());
            runtime.overrideSettings(runtime.settings().withVoting(new VotingPolicy(
                    true, 1, 1, 1, Duration.ofHours(1), false)));
            as(runtime, "claw-a");
            runtime.governance().propose(new GovernanceService.ProposeRequest(
                    "kp-retry", "ops", "Flaky", "publish is retried", List.of(), null));

            as(runtime, "claw-b");
            GovernanceService.VoteRequest vote = new GovernanceService.VoteRequest("kp-retry", "yes", "", 0, "trace-retry");
            Assertions.assertThrows(TransportException.class, () -> runtime.governance().vote(vote));
            Assertions.assertEquals(ProposalStatus.APPROVED,
                    runtime.knowledgeStore().getProposal("kp-retry").orElseThrow().status());

            GovernanceService.VoteResult retried = runtime.governance().vote(vote);
            Assertions.assertFalse(retried.evaluation().applied());
            Assertions.assertEquals(ProposalStatus.APPROVED, retried.evaluation().decision().status());
            Assertions.assertTrue(sent.stream().anyMatch(p -> p.key().equals("knowledge:decision:kp-retry")));
            Assertions.assertEquals(1, runtime.knowledgeStore().listFactHistory("ops", "Flaky", "statement", 10).size());

            Assertions.assertThrows(StateConflictException.class, () -> runtime.governance().vote(
                    new GovernanceService.VoteRequest("kp-retry", "no", "", 0, null)));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void proposeRetryAfterFailedPublishRepublishesStoredProposal() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-governance-propose-retry-");
        try {
            List<Produced> sent = new ArrayList<>();
            boolean[] failProposal = {true};
            EnvelopeTransport flaky = (topic, key, payload) -> {
                if (failProposal[0] && key.startsWith("knowledge:proposal:")) {
                    failProposal[0] = false;
                    throw new TransportException(topic, "broker unavailable", null);
                }
                sent.add(new Produced(topic, key, payload));
            };
            MutableClock clock = new MutableClock();
            QuorumMeshRuntime runtime = runtime(root, flaky, clock);
            as(runtime, "claw-a");
            GovernanceService.ProposeRequest request = new GovernanceService.ProposeRequest(
                    "kp-flaky", "ops", "Flaky", "proposal publish is retried", List.of("ops"), "trace-p");
            Assertions.assertThrows(TransportException.class, () -> runtime.governance().propose(request));
            Assertions.assertTrue(runtime.knowledgeStore().getProposal("kp-flaky").isPresent());
            Assertions.assertTrue(sent.isEmpty());

            clock.advance(Duration.ofMinutes(5));
            GovernanceService.ProposeResult retried = runtime.governance().propose(request);
            Assertions.assertTrue(retried.republished());
            Assertions.assertEquals(Instant.parse("2026-03-01T09:00:00Z").toEpochMilli(), retried.proposal().createdAtMs());
            Assertions.assertEquals(List.of("knowledge:proposal:kp-flaky"), sent.stream().map(Produced::key).toList());
            Envelope republished = new EnvelopeCodec().decode(sent.get(0).payload());
            Assertions.assertEquals("proposal publish is retried",
                    ((Payloads.ProposalPayload) republished.payload()).statement());
            Assertions.assertEquals(1, runtime.knowledgeStore().listProposals(null, 10, 0).size());

            Assertions.assertThrows(DuplicateIdException.class, () -> runtime.governance().propose(
                    new GovernanceService.ProposeRequest("kp-flaky", "ops", "Flaky", "a different claim", List.of(), null)));
            as(runtime, "claw-b");
            Assertions.assertThrows(DuplicateIdException.class, () -> runtime.governance().propose(request));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void terminalDecisionIgnoresLaterVotesAndDecisions() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-governance-terminal-");
        try {
            List<Produced> sent = new ArrayList<>();
            QuorumMeshRuntime runtime = runtime(root, (topic, key, payload) -> sent.add(new Produced(topic, key, payload)),
                    new MutableClock());
            runtime.overrideSettings(runtime.settings().withVoting(new VotingPolicy(
                    true, 1, 2, 1, Duration.ofHours(1), false)));
            as(runtime, "claw-a");
            runtime.governance().propose(new GovernanceService.ProposeRequest(
                    "kp-final", "ops", "Final", "rejections stick", List.of(), null));
            as(runtime, "claw-b");
            GovernanceService.VoteResult rejected = runtime.governance().vote(
                    new GovernanceService.VoteRequest("kp-final", "no", "", 0, null));
            Assertions.assertEquals(ProposalStatus.REJECTED, rejected.evaluation().decision().status());

            as(runtime, "claw-a");
            KnowledgeEnvelopeHandler handler = runtime.envelopeHandler();
            Instant ts = Instant.parse("2026-03-01T09:05:00Z");
            for (String voter : List.of("claw-c", "claw-d", "claw-e")) {
                handler.handle("ops.knowledge.votes", Envelope.of("trace-final", ts,
                        IdempotencyKeys.vote("kp-final", voter), voter,
                        new Payloads.VotePayload("kp-final", "yes", "")));
            }
            handler.handle("ops.knowledge.decisions", Envelope.of("trace-final", ts,
                    IdempotencyKeys.decision("kp-final"), "claw-c",
                    new Payloads.DecisionPayload("kp-final", "approved", 3, 0, "quorum reached")));

            GovernanceService.Evaluation after = runtime.governance().evaluate("kp-final", 0, null);
            Assertions.assertFalse(after.applied());
            Assertions.assertEquals(ProposalStatus.REJECTED, after.decision().status());
            Assertions.assertEquals(0, after.decision().yes());
            Assertions.assertEquals(1, after.decision().no());
            Assertions.assertEquals(ProposalStatus.REJECTED,
                    runtime.knowledgeStore().getProposal("kp-final").orElseThrow().status());
            Assertions.assertEquals(0, runtime.knowledgeStore().countFacts("ops"));
            EnvelopeCodec codec = new EnvelopeCodec();
            List<String> outcomes = sent.stream()
                    .filter(p -> p.key().equals("knowledge:decision:kp-final"))
                    .map(p -> ((Payloads.DecisionPayload) codec.decode(p.payload()).payload()).outcome())
                    .toList();
            Assertions.assertFalse(outcomes.isEmpty());
            Assertions.assertTrue(outcomes.stream().allMatch("rejected"::equals));
            Assertions.assertTrue(sent.stream().noneMatch(p -> p.key().startsWith("knowledge:fact:")));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void governedOperationsFailWhenDisabled() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-governance-disabled-");
        try {
            List<Produced> sent = new ArrayList<>();
            QuorumMeshRuntime runtime = runtime(root, (topic, key, payload) -> sent.add(new Produced(topic, key, payload)),
                    new MutableClock());
            as(runtime, "claw-a");
            runtime.governance().propose(new GovernanceService.ProposeRequest(
                    "kp-dup", "ops", "", "first", List.of(), null));
            Assertions.assertThrows(DuplicateIdException.class, () -> runtime.governance().propose(
                    new GovernanceService.ProposeRequest("kp-dup", "ops", "", "second", List.of(), null)));
            Assertions.assertThrows(ValidationException.class, () -> runtime.governance().propose(
                    new GovernanceService.ProposeRequest(null, "ops", "", " ", List.of(), null)));
            Assertions.assertThrows(ValidationException.class, () -> runtime.governance().vote(
                    new GovernanceService.VoteRequest("kp-dup", "maybe", "", 3, null)));

            runtime.overrideSettings(runtime.settings().withEnabled(true, false));
            int published = sent.size();
            Assertions.assertThrows(GovernanceDisabledException.class, () -> runtime.governance().propose(
                    new GovernanceService.ProposeRequest(null, "ops", "", "blocked", List.of(), null)));
            Assertions.assertThrows(GovernanceDisabledException.class, () -> runtime.governance().vote(
                    new GovernanceService.VoteRequest("kp-dup", "yes", "", 3, null)));
            Assertions.assertThrows(GovernanceDisabledException.class,
                    () -> runtime.governance().evaluate("kp-dup", 3, null));
            Assertions.assertEquals(published, sent.size());

            List<String> topics = runtime.governance().announce("ops", "", List.of("review"));
            Assertions.assertEquals(List.of("ops.knowledge.presence", "ops.knowledge.capabilities"), topics);
            JsonNode status = Jsons.mapper().valueToTree(runtime.status());
            Assertions.assertFalse(status.path("governanceEnabled").asBoolean());
            Assertions.assertEquals(1, status.path("proposals").path("pending").asInt());
        } finally {
            deleteRecursively(root);
        }
    }

    private static QuorumMeshRuntime runtime(Path root, EnvelopeTransport transport, Clock clock) {
        QuorumMeshRuntime runtime = new QuorumMeshRuntime(QuorumMeshConfig.fromRoot(root.toString()), transport, clock);
        runtime.init();
        return runtime;
    }

    private static void as(QuorumMeshRuntime runtime, String clawId) {
        runtime.overrideSettings(runtime.settings().withIdentity("ops", clawId, "inst-" + clawId));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private record Produced(String topic, String key, String payload) {
    }

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2026-03-01T09:00:00Z");

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
