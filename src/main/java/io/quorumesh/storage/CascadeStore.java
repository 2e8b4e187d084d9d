package io.quorumesh.storage;

import io.quorumesh.error.DuplicateIdException;
import io.quorumesh.error.NotFoundException;
import io.quorumesh.error.StateConflictException;
import io.quorumesh.model.CascadeStatus;
import io.quorumesh.model.CascadeTask;
import io.quorumesh.model.CascadeTransition;
import io.quorumesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public final class CascadeStore {
    private static final String TASK_COLUMNS = """
            trace_id,task_id,sequence,title,status,required_input_json,produced_output_json,validation_rules_json,\
            retry_count,max_retries,input_json,output_json,last_error,created_at_ms,updated_at_ms,committed_at_ms,archived_at_ms""";
    private static final String TRANSITION_COLUMNS =
            "trace_id,task_id,from_status,to_status,actor,reason,payload,idempotency_key,created_at_ms";

    private final Database database;

    public CascadeStore(Database database) {
        this.database = database;
    }

    public void createCascadeTask(CascadeTask t) {
        if (getCascadeTask(t.traceId(), t.taskId()).isPresent()) {
            throw new DuplicateIdException("cascade task", t.traceId() + "/" + t.taskId());
        }
        String sql = "INSERT INTO cascade_tasks(" + TASK_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, t.traceId());
            ps.setString(2, t.taskId());
            ps.setInt(3, t.sequence());
            ps.setString(4, t.title() == null ? "" : t.title());
            ps.setString(5, t.status().wire());
            ps.setString(6, Jsons.toCompactJson(t.requiredInput()));
            ps.setString(7, Jsons.toCompactJson(t.producedOutput()));
            ps.setString(8, Jsons.toCompactJson(t.validationRules()));
            ps.setInt(9, t.retryCount());
            ps.setInt(10, t.maxRetries());
            ps.setString(11, t.inputJson() == null ? "{}" : t.inputJson());
            ps.setString(12, t.outputJson() == null ? "{}" : t.outputJson());
            ps.setString(13, t.lastError() == null ? "" : t.lastError());
            ps.setLong(14, t.createdAtMs());
            ps.setLong(15, t.updatedAtMs());
            setNullableLong(ps, 16, t.committedAtMs());
            setNullableLong(ps, 17, t.archivedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (getCascadeTask(t.traceId(), t.taskId()).isPresent()) {
                throw new DuplicateIdException("cascade task", t.traceId() + "/" + t.taskId());
            }
            throw new RuntimeException("Failed to create cascade task", e);
        }
    }

    public Optional<CascadeTask> getCascadeTask(String traceId, String taskId) {
        try (Connection c = database.openConnection()) {
            return readTask(c, traceId, taskId);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cascade task", e);
        }
    }

    public Optional<CascadeTask> findBySequence(String traceId, int sequence) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM cascade_tasks WHERE trace_id=? AND sequence=? ORDER BY task_id LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, traceId);
            ps.setInt(2, sequence);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readTask(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cascade task by sequence", e);
        }
    }

    /**
     * Compare-and-set status change plus transition log entry, in one transaction. A transition whose
     * idempotency key was already applied to the task is returned as is with {@code deduplicated=true}.
     *
     * @throws NotFoundException      if the task does not exist
     * @throws StateConflictException if the stored status is not {@code from}
     */
    public AdvanceResult advanceCascadeTask(Advance a) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                Optional<CascadeTransition> existing = readTransition(c, a.traceId(), a.taskId(), a.idempotencyKey());
                if (existing.isPresent()) {
                    c.commit();
                    CascadeTask task = readTask(c, a.traceId(), a.taskId())
                            .orElseThrow(() -> new NotFoundException("cascade task", a.traceId() + "/" + a.taskId()));
                    return new AdvanceResult(existing.get(), task, true);
                }
                CascadeTask current = readTask(c, a.traceId(), a.taskId())
                        .orElseThrow(() -> new NotFoundException("cascade task", a.traceId() + "/" + a.taskId()));
                int retryIncrement = a.from() == CascadeStatus.SELF_TEST && a.to() == CascadeStatus.PENDING ? 1 : 0;
                boolean stampCommitted = a.to() == CascadeStatus.COMMITTED;
                boolean stampArchived = a.to() == CascadeStatus.RELEASED_NEXT || a.to() == CascadeStatus.FAILED;
                boolean recordError = a.to() == CascadeStatus.FAILED || retryIncrement > 0;
                String update = """
                        UPDATE cascade_tasks SET status=?,retry_count=retry_count+?,updated_at_ms=?,
                            input_json=COALESCE(?,input_json),output_json=COALESCE(?,output_json),
                            last_error=CASE WHEN ? THEN ? ELSE last_error END,
                            committed_at_ms=CASE WHEN ? THEN ? ELSE committed_at_ms END,
                            archived_at_ms=CASE WHEN ? THEN ? ELSE archived_at_ms END
                        WHERE trace_id=? AND task_id=? AND status=?
                        """;
                int updated;
                try (PreparedStatement ps = c.prepareStatement(update)) {
                    ps.setString(1, a.to().wire());
                    ps.setInt(2, retryIncrement);
                    ps.setLong(3, a.nowMs());
                    ps.setString(4, a.inputJson());
                    ps.setString(5, a.outputJson());
                    ps.setInt(6, recordError ? 1 : 0);
                    ps.setString(7, a.reason() == null ? "" : a.reason());
                    ps.setInt(8, stampCommitted ? 1 : 0);
                    ps.setLong(9, a.nowMs());
                    ps.setInt(10, stampArchived ? 1 : 0);
                    ps.setLong(11, a.nowMs());
                    ps.setString(12, a.traceId());
                    ps.setString(13, a.taskId());
                    ps.setString(14, a.from().wire());
                    updated = ps.executeUpdate();
                }
                if (updated == 0) {
                    throw new StateConflictException(
                            "cascade task " + a.taskId() + " is " + current.status().wire() + ", expected " + a.from().wire(),
                            a.from().wire(),
                            current.status().wire()
                    );
                }
                CascadeTransition transition = new CascadeTransition(
                        a.traceId(), a.taskId(), a.from(), a.to(),
                        a.actor() == null ? "" : a.actor(),
                        a.reason() == null ? "" : a.reason(),
                        a.payload() == null || a.payload().isBlank() ? "{}" : a.payload(),
                        a.idempotencyKey(),
                        a.nowMs()
                );
                try (PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO cascade_transitions(" + TRANSITION_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?)")) {
                    ps.setString(1, transition.traceId());
                    ps.setString(2, transition.taskId());
                    ps.setString(3, transition.fromStatus().wire());
                    ps.setString(4, transition.toStatus().wire());
                    ps.setString(5, transition.actor());
                    ps.setString(6, transition.reason());
                    ps.setString(7, transition.payload());
                    ps.setString(8, transition.idempotencyKey());
                    ps.setLong(9, transition.createdAtMs());
                    ps.executeUpdate();
                }
                CascadeTask after = readTask(c, a.traceId(), a.taskId()).orElseThrow();
                c.commit();
                return new AdvanceResult(transition, after, false);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            Optional<CascadeTransition> afterRace = findTransition(a.traceId(), a.taskId(), a.idempotencyKey());
            if (afterRace.isPresent()) {
                CascadeTask task = getCascadeTask(a.traceId(), a.taskId()).orElseThrow();
                return new AdvanceResult(afterRace.get(), task, true);
            }
            throw new RuntimeException("Failed to advance cascade task", e);
        }
    }

    public Optional<CascadeTransition> findTransition(String traceId, String taskId, String idempotencyKey) {
        try (Connection c = database.openConnection()) {
            return readTransition(c, traceId, taskId, idempotencyKey);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read cascade transition", e);
        }
    }

    public int countTransitionsInto(String traceId, String taskId, CascadeStatus to) {
        String sql = "SELECT COUNT(*) FROM cascade_transitions WHERE trace_id=? AND task_id=? AND to_status=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, traceId);
            ps.setString(2, taskId);
            ps.setString(3, to.wire());
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count cascade transitions", e);
        }
    }

    public List<CascadeTask> listCascadeTasks(String traceId) {
        String sql = "SELECT " + TASK_COLUMNS + " FROM cascade_tasks WHERE trace_id=? ORDER BY sequence, task_id";
        List<CascadeTask> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, traceId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readTask(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list cascade tasks", e);
        }
    }

    /**
     * Oldest first. A blank {@code taskId} lists the transitions of the whole trace.
     */
    public List<CascadeTransition> listCascadeTransitions(String traceId, String taskId, int limit) {
        boolean withTask = taskId != null && !taskId.isBlank();
        String sql = "SELECT " + TRANSITION_COLUMNS + " FROM cascade_transitions WHERE trace_id=?"
                + (withTask ? " AND task_id=?" : "")
                + " ORDER BY id LIMIT ?";
        List<CascadeTransition> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            ps.setString(i++, traceId);
            if (withTask) {
                ps.setString(i++, taskId);
            }
            ps.setInt(i, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readTransition(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list cascade transitions", e);
        }
    }

    private Optional<CascadeTask> readTask(Connection c, String traceId, String taskId) throws SQLException {
        String sql = "SELECT " + TASK_COLUMNS + " FROM cascade_tasks WHERE trace_id=? AND task_id=?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, traceId);
            ps.setString(2, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readTask(rs));
            }
        }
    }

    private Optional<CascadeTransition> readTransition(Connection c, String traceId, String taskId, String key) throws SQLException {
        String sql = "SELECT " + TRANSITION_COLUMNS + " FROM cascade_transitions WHERE trace_id=? AND task_id=? AND idempotency_key=?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, traceId);
            ps.setString(2, taskId);
            ps.setString(3, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readTransition(rs));
            }
        }
    }

    private static CascadeTask readTask(ResultSet rs) throws SQLException {
        long committed = rs.getLong("committed_at_ms");
        Long committedAt = rs.wasNull() ? null : committed;
        long archived = rs.getLong("archived_at_ms");
        Long archivedAt = rs.wasNull() ? null : archived;
        return new CascadeTask(
                rs.getString("task_id"),
                rs.getString("trace_id"),
                rs.getInt("sequence"),
                rs.getString("title"),
                CascadeStatus.fromString(rs.getString("status")),
                Jsons.readStringList(rs.getString("required_input_json")),
                Jsons.readStringList(rs.getString("produced_output_json")),
                Jsons.readStringList(rs.getString("validation_rules_json")),
                rs.getInt("retry_count"),
                rs.getInt("max_retries"),
                rs.getString("input_json"),
                rs.getString("output_json"),
                rs.getString("last_error"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms"),
                committedAt,
                archivedAt
        );
    }

    private static CascadeTransition readTransition(ResultSet rs) throws SQLException {
        return new CascadeTransition(
                rs.getString("trace_id"),
                rs.getString("task_id"),
                CascadeStatus.fromString(rs.getString("from_status")),
                CascadeStatus.fromString(rs.getString("to_status")),
                rs.getString("actor"),
                rs.getString("reason"),
                rs.getString("payload"),
                rs.getString("idempotency_key"),
                rs.getLong("created_at_ms")
        );
    }

    private static void setNullableLong(PreparedStatement ps, int index, Long value) throws SQLException {
        if (value == null) {
            ps.setNull(index, Types.BIGINT);
        } else {
            ps.setLong(index, value);
        }
    }

    /**
     * {@code inputJson} and {@code outputJson} are written with the status change; {@code null} keeps the
     * stored value.
     */
    public record Advance(String traceId, String taskId, CascadeStatus from, CascadeStatus to, String actor,
                          String reason, String payload, String idempotencyKey, String inputJson,
                          String outputJson, long nowMs) {}
    public record AdvanceResult(CascadeTransition transition, CascadeTask task, boolean deduplicated) {}
}
