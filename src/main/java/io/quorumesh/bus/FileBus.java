package io.quorumesh.bus;

import io.quorumesh.config.QuorumMeshConfig;
import io.quorumesh.error.TransportException;
import io.quorumesh.util.Hashing;
import io.quorumesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Topic log on the local file system. Each record is one JSON file. Every consumer keeps the set of record ids
 * it has committed on a topic, so uncommitted records are delivered again whatever order producers wrote them in.
 */
public final class FileBus implements EnvelopeTransport {
    private static final String RECORD_SUFFIX = ".rec.json";
    private static final String DONE_SUFFIX = ".done";

    private final QuorumMeshConfig config;
    private final AtomicLong sequence;

    public FileBus(QuorumMeshConfig config) {
        this.config = config;
        this.sequence = new AtomicLong(0L);
    }

    @Override
    public void produce(String topic, String key, String payload) {
        String safeTopic = requireTopic(topic);
        long nowMs = System.currentTimeMillis();
        String recordId = "%013d_%06d_%s_%s".formatted(
                nowMs,
                sequence.incrementAndGet() % 1_000_000L,
                Hashing.sha256Hex(key == null ? "" : key).substring(0, 12),
                UUID.randomUUID().toString().replace("-", "").substring(0, 8)
        );
        Path dir = topicDir(safeTopic);
        Path target = dir.resolve(recordId + RECORD_SUFFIX);
        Path tmp = dir.resolve("." + recordId + ".tmp");
        try {
            Files.createDirectories(dir);
            String json = Jsons.toCompactJson(new BusRecord(recordId, safeTopic, key, nowMs, payload));
            Files.writeString(tmp, json, StandardCharsets.UTF_8);
            try {
                Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException atomicUnsupported) {
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new TransportException(safeTopic, "Failed to produce record on topic: " + safeTopic, e);
        }
    }

    /**
     * Returns up to {@code limit} records the consumer has not committed yet, oldest first.
     */
    public List<BusRecord> poll(String topic, String consumerId, int limit) {
        String safeTopic = requireTopic(topic);
        Set<String> committed = committedIds(safeTopic, consumerId);
        List<BusRecord> out = new ArrayList<>();
        for (Path file : listRecordFiles(topicDir(safeTopic))) {
            if (out.size() >= Math.max(1, limit)) {
                break;
            }
            if (committed.contains(recordId(file))) {
                continue;
            }
            try {
                out.add(Jsons.mapper().readValue(file.toFile(), BusRecord.class));
            } catch (IOException e) {
                throw new TransportException(safeTopic, "Failed to read record: " + file, e);
            }
        }
        return out;
    }

    public void commit(String topic, String consumerId, BusRecord record) {
        String safeTopic = requireTopic(topic);
        Path doneDir = consumerDir(safeTopic, consumerId);
        try {
            Files.createDirectories(doneDir);
            Path marker = doneDir.resolve(record.recordId() + DONE_SUFFIX);
            if (!Files.exists(marker)) {
                Files.writeString(marker, Long.toString(System.currentTimeMillis()), StandardCharsets.UTF_8);
            }
        } catch (IOException e) {
            throw new TransportException(safeTopic, "Failed to commit record for consumer: " + consumerId, e);
        }
    }

    /**
     * Records on the topic this consumer has not committed yet.
     */
    public int lag(String topic, String consumerId) {
        String safeTopic = requireTopic(topic);
        Set<String> committed = committedIds(safeTopic, consumerId);
        int pending = 0;
        for (Path file : listRecordFiles(topicDir(safeTopic))) {
            if (!committed.contains(recordId(file))) {
                pending++;
            }
        }
        return pending;
    }

    public int depth(String topic) {
        return listRecordFiles(topicDir(requireTopic(topic))).size();
    }

    private List<Path> listRecordFiles(Path dir) {
        List<Path> files = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return files;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + RECORD_SUFFIX)) {
            for (Path path : stream) {
                files.add(path);
            }
        } catch (IOException e) {
            throw new TransportException(dir.getFileName().toString(), "Failed to list topic directory: " + dir, e);
        }
        files.sort(Comparator.comparing(path -> path.getFileName().toString()));
        return files;
    }

    private Path topicDir(String topic) {
        return config.busTopicsRoot().resolve(topic);
    }

    private Path consumerDir(String topic, String consumerId) {
        String consumer = consumerId == null || consumerId.isBlank() ? "default" : sanitize(consumerId);
        return config.busCommitsRoot().resolve(consumer).resolve(topic);
    }

    private Set<String> committedIds(String topic, String consumerId) {
        Set<String> ids = new HashSet<>();
        Path dir = consumerDir(topic, consumerId);
        if (!Files.isDirectory(dir)) {
            return ids;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + DONE_SUFFIX)) {
            for (Path path : stream) {
                String name = path.getFileName().toString();
                ids.add(name.substring(0, name.length() - DONE_SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new TransportException(topic, "Failed to read committed records for consumer: " + consumerId, e);
        }
        return ids;
    }

    private static String recordId(Path file) {
        String name = file.getFileName().toString();
        return name.substring(0, name.length() - RECORD_SUFFIX.length());
    }

    private static String requireTopic(String topic) {
        if (topic == null || topic.isBlank()) {
            throw new TransportException(topic, "topic must not be blank", null);
        }
        return sanitize(topic);
    }

    private static String sanitize(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (char ch : raw.trim().toCharArray()) {
            boolean ok = Character.isLetterOrDigit(ch) || ch == '.' || ch == '_' || ch == '-';
            sb.append(ok ? ch : '-');
        }
        return sb.toString();
    }

    public record BusRecord(String recordId, String topic, String key, long producedAtMs, String payload) {
    }
}
