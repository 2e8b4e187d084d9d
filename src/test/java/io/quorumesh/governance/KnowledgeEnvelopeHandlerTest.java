package io.quorumesh.governance;

import io.quorumesh.bus.FileBus;
import io.quorumesh.config.QuorumMeshConfig;
import io.quorumesh.envelope.Envelope;
import io.quorumesh.envelope.EnvelopeCodec;
import io.quorumesh.envelope.IdempotencyKeys;
import io.quorumesh.envelope.Payloads;
import io.quorumesh.error.GovernanceDisabledException;
import io.quorumesh.error.ValidationException;
import io.quorumesh.model.Fact;
import io.quorumesh.model.GroupMember;
import io.quorumesh.model.Proposal;
import io.quorumesh.model.ProposalStatus;
import io.quorumesh.runtime.QuorumMeshRuntime;
import io.quorumesh.storage.KnowledgeStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

final class KnowledgeEnvelopeHandlerTest {
    private static final Instant TS = Instant.parse("2026-03-01T10:00:00Z");

    @Test
    void peersConvergeAndRedeliveryAppliesOnce() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-handler-converge-");
        try {
            FileBus shared = new FileBus(QuorumMeshConfig.fromRoot(root.resolve("shared").toString()));
            QuorumMeshRuntime nodeA = node(root.resolve("a"), shared, "claw-a");
            QuorumMeshRuntime nodeB = node(root.resolve("b"), shared, "claw-b");

            nodeA.governance().propose(new GovernanceService.ProposeRequest(
                    "kp-1", "ops", "Retry budget", "retry budget is 3", List.of(), "trace-1"));

            KnowledgeEnvelopeHandler.ConsumeSummary atB = nodeB.envelopeHandler().consume(shared, "ops", "node-b", 100);
            Assertions.assertEquals(1, atB.applied());
            Proposal mirrored = nodeB.knowledgeStore().getProposal("kp-1").orElseThrow();
            Assertions.assertEquals("claw-a", mirrored.proposerClawId());
            Assertions.assertEquals(ProposalStatus.PENDING, mirrored.status());

            nodeB.governance().vote(new GovernanceService.VoteRequest("kp-1", "yes", "", 3, "trace-1"));

            KnowledgeEnvelopeHandler.ConsumeSummary atA = nodeA.envelopeHandler().consume(shared, "ops", "node-a", 100);
            Assertions.assertEquals(1, atA.skippedSelf());
            Assertions.assertEquals(1, atA.applied());
            Assertions.assertEquals(1, nodeA.knowledgeStore().getProposal("kp-1").orElseThrow().yes());

            Envelope remoteVote = Envelope.of("trace-1", TS, IdempotencyKeys.vote("kp-1", "claw-c"), "claw-c",
                    new Payloads.VotePayload("kp-1", "yes", "looks right"));
            Assertions.assertEquals(KnowledgeEnvelopeHandler.HandleOutcome.APPLIED,
                    nodeA.envelopeHandler().handle("ops.knowledge.votes", remoteVote));
            Assertions.assertEquals(KnowledgeEnvelopeHandler.HandleOutcome.DEDUPLICATED,
                    nodeA.envelopeHandler().handle("ops.knowledge.votes", remoteVote));

            Proposal decided = nodeA.knowledgeStore().getProposal("kp-1").orElseThrow();
            Assertions.assertEquals(ProposalStatus.APPROVED, decided.status());
            Assertions.assertEquals(2, decided.yes());
            Assertions.assertEquals(2, nodeA.knowledgeStore().listVotes("kp-1").size());
            Assertions.assertTrue(nodeA.knowledgeStore().getFactLatest("ops", "Retry budget", "statement").isPresent());

            KnowledgeEnvelopeHandler.ConsumeSummary replay =
                    nodeB.envelopeHandler().consume(shared, "ops", "node-b-replay", 100);
            Assertions.assertEquals(0, replay.applied());
            Assertions.assertEquals(1, replay.deduplicated());
            Assertions.assertEquals(1, replay.skippedSelf());
            Assertions.assertEquals(1, nodeB.knowledgeStore().listProposals(null, 10, 0).size());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void remoteFactVersionsAreResolvedNotOverwritten() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-handler-facts-");
        try {
            FileBus shared = new FileBus(QuorumMeshConfig.fromRoot(root.resolve("shared").toString()));
            QuorumMeshRuntime node = node(root.resolve("a"), shared, "claw-a");
            KnowledgeEnvelopeHandler handler = node.envelopeHandler();

            Assertions.assertEquals(KnowledgeEnvelopeHandler.HandleOutcome.APPLIED,
                    handler.handle("ops.knowledge.facts", fact(1, "decision:kp-7", "3")));
            handler.handle("ops.knowledge.facts", fact(3, "decision:kp-9", "5"));
            handler.handle("ops.knowledge.facts", fact(1, "decision:kp-0", "4"));

            Fact latest = node.knowledgeStore().getFactLatest("ops", "retry", "limit").orElseThrow();
            Assertions.assertEquals(1, latest.version());
            Assertions.assertEquals("decision:kp-0", latest.source());
            Assertions.assertEquals("4", latest.object());

            List<KnowledgeStore.FactHistoryRow> history = node.knowledgeStore().listFactHistory("ops", "retry", "limit", 10);
            Assertions.assertEquals(List.of("conflict", "conflict", "accepted"),
                    history.stream().map(KnowledgeStore.FactHistoryRow::outcome).toList());
            Assertions.assertEquals("version_gap_1_to_3", history.get(1).reason());
            Assertions.assertEquals("same_version_different_source:winner=decision:kp-0", history.get(0).reason());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void malformedRecordsAreSkippedAndDisabledGovernanceLeavesRecordsForRedelivery() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-handler-reject-");
        try {
            FileBus shared = new FileBus(QuorumMeshConfig.fromRoot(root.resolve("shared").toString()));
            QuorumMeshRuntime nodeA = node(root.resolve("a"), shared, "claw-a");
            QuorumMeshRuntime nodeB = node(root.resolve("b"), shared, "claw-b");

            shared.produce("ops.knowledge.facts", "junk", "{not json");
            shared.produce("ops.knowledge.votes", "odd", "{\"schemaVersion\":\"v1\",\"type\":\"gossip\"}");
            KnowledgeEnvelopeHandler.ConsumeSummary first = nodeB.envelopeHandler().consume(shared, "ops", "node-b", 100);
            Assertions.assertEquals(2, first.rejected());
            Assertions.assertEquals(0, nodeB.envelopeHandler().consume(shared, "ops", "node-b", 100).rejected());

            nodeA.governance().propose(new GovernanceService.ProposeRequest(
                    "kp-2", "ops", "", "held back", List.of(), null));
            nodeB.overrideSettings(nodeB.settings().withEnabled(true, false));
            Assertions.assertThrows(GovernanceDisabledException.class,
                    () -> nodeB.envelopeHandler().consume(shared, "ops", "node-b", 100));
            Assertions.assertTrue(nodeB.knowledgeStore().getProposal("kp-2").isEmpty());

            nodeB.overrideSettings(nodeB.settings().withEnabled(true, true));
            Assertions.assertEquals(1, nodeB.envelopeHandler().consume(shared, "ops", "node-b", 100).applied());
            Assertions.assertTrue(nodeB.knowledgeStore().getProposal("kp-2").isPresent());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void nullListElementsAreRejectedWithoutBlockingLaterRecords() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-handler-nulls-");
        try {
            FileBus shared = new FileBus(QuorumMeshConfig.fromRoot(root.resolve("shared").toString()));
            QuorumMeshRuntime nodeB = node(root.resolve("b"), shared, "claw-b");
            EnvelopeCodec codec = new EnvelopeCodec();

            String bad = codec.encode(Envelope.of("trace-n", TS, IdempotencyKeys.proposal("kp-bad"), "claw-a",
                    new Payloads.ProposalPayload("kp-bad", "ops", "", "bad tags", List.of("a"))))
                    .replace("[\"a\"]", "[\"a\",null]");
            Assertions.assertTrue(bad.contains("null]"));
            shared.produce("ops.knowledge.proposals", "kp-bad", bad);
            shared.produce("ops.knowledge.proposals", "kp-good", codec.encode(Envelope.of("trace-n", TS,
                    IdempotencyKeys.proposal("kp-good"), "claw-a",
                    new Payloads.ProposalPayload("kp-good", "ops", "", "fine", List.of("a")))));

            KnowledgeEnvelopeHandler.ConsumeSummary first = nodeB.envelopeHandler().consume(shared, "ops", "node-b", 100);
            Assertions.assertEquals(1, first.rejected());
            Assertions.assertEquals(1, first.applied());
            Assertions.assertEquals(0, first.remaining());
            Assertions.assertTrue(nodeB.knowledgeStore().getProposal("kp-good").isPresent());
            Assertions.assertTrue(nodeB.knowledgeStore().getProposal("kp-bad").isEmpty());

            KnowledgeEnvelopeHandler.ConsumeSummary second = nodeB.envelopeHandler().consume(shared, "ops", "node-b", 100);
            Assertions.assertEquals(0, second.rejected());
            Assertions.assertEquals(0, second.applied());

            String capabilities = codec.encode(Envelope.of("trace-n", TS, IdempotencyKeys.capabilities("claw-a", 1L),
                    "claw-a", new Payloads.CapabilitiesPayload("ops", "inst-a", List.of("review"))))
                    .replace("[\"review\"]", "[null]");
            Assertions.assertThrows(ValidationException.class,
                    () -> nodeB.envelopeHandler().handleRaw("ops.knowledge.capabilities", capabilities));
            Assertions.assertTrue(nodeB.listMembers("ops", false).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void presenceAndCapabilitiesFillTheRosterEvenWithGovernanceOff() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-test-handler-roster-");
        try {
            FileBus shared = new FileBus(QuorumMeshConfig.fromRoot(root.resolve("shared").toString()));
            QuorumMeshRuntime nodeA = node(root.resolve("a"), shared, "claw-a");
            QuorumMeshRuntime nodeB = node(root.resolve("b"), shared, "claw-b");
            nodeB.overrideSettings(nodeB.settings().withEnabled(true, false));

            nodeA.governance().announce("ops", "active", List.of("review", "deploy"));
            KnowledgeEnvelopeHandler.ConsumeSummary summary = nodeB.envelopeHandler().consume(shared, "ops", "node-b", 100);
            Assertions.assertEquals(2, summary.applied());

            List<GroupMember> members = nodeB.listMembers("ops", true);
            Assertions.assertEquals(1, members.size());
            Assertions.assertEquals("claw-a", members.get(0).memberId());
            Assertions.assertEquals("inst-claw-a", members.get(0).instanceId());
            Assertions.assertEquals(List.of("review", "deploy"), members.get(0).capabilities());
        } finally {
            deleteRecursively(root);
        }
    }

    private static QuorumMeshRuntime node(Path dir, FileBus shared, String clawId) {
        QuorumMeshRuntime runtime = new QuorumMeshRuntime(QuorumMeshConfig.fromRoot(dir.toString()), shared, null);
        runtime.init();
        runtime.overrideSettings(runtime.settings().withIdentity("ops", clawId, "inst-" + clawId));
        return runtime;
    }

    private static Envelope fact(int version, String source, String object) {
        String factId = GovernanceService.factId("ops", "retry", "limit");
        return Envelope.of("trace-facts", TS, IdempotencyKeys.fact(factId, version, source), "claw-x",
                new Payloads.FactPayload(factId, "ops", "retry", "limit", object, version, source, "", List.of()));
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
}
