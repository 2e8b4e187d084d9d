package io.quorumesh.bus;

import io.quorumesh.config.QuorumMeshConfig;
import io.quorumesh.error.TransportException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Stream;

final class FileBusTest {

    @Test
    void uncommittedRecordsAreRedelivered() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-filebus-");
        try {
            FileBus bus = new FileBus(QuorumMeshConfig.fromRoot(root.toString()));
            bus.produce("ops.knowledge.votes", "k-1", "{\"n\":1}");
            bus.produce("ops.knowledge.votes", "k-2", "{\"n\":2}");
            bus.produce("ops.knowledge.votes", "k-3", "{\"n\":3}");
            Assertions.assertEquals(3, bus.depth("ops.knowledge.votes"));

            List<FileBus.BusRecord> first = bus.poll("ops.knowledge.votes", "node-b", 10);
            Assertions.assertEquals(List.of("k-1", "k-2", "k-3"), first.stream().map(FileBus.BusRecord::key).toList());

            bus.commit("ops.knowledge.votes", "node-b", first.get(0));
            List<FileBus.BusRecord> again = bus.poll("ops.knowledge.votes", "node-b", 10);
            Assertions.assertEquals(List.of("k-2", "k-3"), again.stream().map(FileBus.BusRecord::key).toList());
            Assertions.assertEquals("{\"n\":2}", again.get(0).payload());

            Assertions.assertEquals(3, bus.poll("ops.knowledge.votes", "node-c", 10).size());
            Assertions.assertEquals(3, bus.lag("ops.knowledge.votes", "node-c"));
            Assertions.assertEquals(2, bus.lag("ops.knowledge.votes", "node-b"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void pollHonorsLimitAndCommitsSurviveReopen() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-filebus-limit-");
        try {
            QuorumMeshConfig config = QuorumMeshConfig.fromRoot(root.toString());
            FileBus bus = new FileBus(config);
            for (int i = 0; i < 5; i++) {
                bus.produce("ops.knowledge.facts", "f-" + i, "{}");
            }
            List<FileBus.BusRecord> batch = bus.poll("ops.knowledge.facts", "node-b", 2);
            Assertions.assertEquals(2, batch.size());
            bus.commit("ops.knowledge.facts", "node-b", batch.get(0));
            bus.commit("ops.knowledge.facts", "node-b", batch.get(1));

            FileBus reopened = new FileBus(config);
            List<FileBus.BusRecord> rest = reopened.poll("ops.knowledge.facts", "node-b", 100);
            Assertions.assertEquals(List.of("f-2", "f-3", "f-4"), rest.stream().map(FileBus.BusRecord::key).toList());
            Assertions.assertTrue(reopened.poll("ops.knowledge.decisions", "node-b", 10).isEmpty());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void recordSortingBeforeCommittedOneIsStillDelivered() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-filebus-order-");
        try {
            QuorumMeshConfig config = QuorumMeshConfig.fromRoot(root.toString());
            FileBus consumerSide = new FileBus(config);
            FileBus otherProducer = new FileBus(config);
            consumerSide.produce("ops.knowledge.votes", "late", "{\"n\":2}");
            List<FileBus.BusRecord> first = consumerSide.poll("ops.knowledge.votes", "node-b", 10);
            Assertions.assertEquals(1, first.size());
            consumerSide.commit("ops.knowledge.votes", "node-b", first.get(0));

            // A peer's record whose id sorts below the committed one, as with clock skew between producers.
            Path topicDir = config.busTopicsRoot().resolve("ops.knowledge.votes");
            String earlierId = "0000000000001_000001_000000000000_00000000";
            Files.writeString(
                    topicDir.resolve(earlierId + ".rec.json"),
                    "{\"recordId\":\"" + earlierId + "\",\"topic\":\"ops.knowledge.votes\",\"key\":\"early\","
                            + "\"producedAtMs\":1,\"payload\":\"{}\"}"
            );
            otherProducer.produce("ops.knowledge.votes", "another", "{\"n\":3}");

            List<FileBus.BusRecord> next = consumerSide.poll("ops.knowledge.votes", "node-b", 10);
            Assertions.assertEquals(
                    List.of("early", "another"),
                    next.stream().map(FileBus.BusRecord::key).toList()
            );
            Assertions.assertEquals(3, consumerSide.depth("ops.knowledge.votes"));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void blankTopicIsRejected() throws Exception {
        Path root = Files.createTempDirectory("quorumesh-filebus-blank-");
        try {
            FileBus bus = new FileBus(QuorumMeshConfig.fromRoot(root.toString()));
            Assertions.assertThrows(TransportException.class, () -> bus.produce(" ", "k", "{}"));
        } finally {
            deleteRecursively(root);
        }
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
