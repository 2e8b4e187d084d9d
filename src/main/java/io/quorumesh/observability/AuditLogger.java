package io.quorumesh.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quorumesh.util.Hashing;
import io.quorumesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row, so truncation or
 * in-place edits break the chain and show up in {@link #verifyChain()}.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String namespace;
    private final Clock clock;
    private final ObjectMapper compactMapper;
    private String previousHash;

    public AuditLogger(Path auditFile, String namespace, Clock clock) {
        this.auditFile = auditFile;
        this.namespace = namespace == null || namespace.isBlank() ? "default" : namespace.trim();
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.compactMapper = Jsons.compactMapper();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", clock.instant().toString());
        row.put("namespace", namespace);
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("trace_id", event.traceId());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(toCompactJson(row));
        row.put("hash", rowHash);
        String line = toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    /**
     * Last {@code limit} rows, oldest first.
     */
    public synchronized List<JsonNode> readRecent(int limit) {
        List<JsonNode> rows = readAll();
        int from = Math.max(0, rows.size() - Math.max(1, limit));
        return new ArrayList<>(rows.subList(from, rows.size()));
    }

    public synchronized ChainVerification verifyChain() {
        String expectedPrev = "";
        int index = 0;
        for (JsonNode row : readAll()) {
            String prev = row.path("prev_hash").asText("");
            String hash = row.path("hash").asText("");
            if (!expectedPrev.equals(prev)) {
                return new ChainVerification(false, index, "prev_hash mismatch at row " + index);
            }
            Map<String, Object> unhashed = new LinkedHashMap<>();
            row.fields().forEachRemaining(e -> {
                if (!"hash".equals(e.getKey())) {
                    unhashed.put(e.getKey(), e.getValue());
                }
            });
            if (!Hashing.sha256Hex(toCompactJson(unhashed)).equals(hash)) {
                return new ChainVerification(false, index, "hash mismatch at row " + index);
            }
            expectedPrev = hash;
            index++;
        }
        return new ChainVerification(true, index, "");
    }

    private List<JsonNode> readAll() {
        List<JsonNode> out = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    out.add(compactMapper.readTree(line));
                }
            }
            return out;
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log: " + auditFile, e);
        }
    }

    private String loadLastHash() {
        List<JsonNode> rows = readAll();
        if (rows.isEmpty()) {
            return "";
        }
        return rows.get(rows.size() - 1).path("hash").asText("");
    }

    private String toCompactJson(Map<String, Object> row) {
        try {
            return compactMapper.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            throw new RuntimeException("Failed to serialize audit row", e);
        }
    }

    public record ChainVerification(boolean valid, int rows, String error) {
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            String traceId,
            Map<String, Object> details
    ) {
        public static AuditEvent of(
                String action,
                String actor,
                String resource,
                String result,
                String traceId,
                Map<String, Object> details
        ) {
            return new AuditEvent(action, actor, resource, result, traceId, details == null ? Map.of() : details);
        }
    }
}
