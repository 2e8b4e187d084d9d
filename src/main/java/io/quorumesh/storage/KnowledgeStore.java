package io.quorumesh.storage;

import io.quorumesh.error.DuplicateIdException;
import io.quorumesh.model.Decision;
import io.quorumesh.model.Fact;
import io.quorumesh.model.FactOutcome;
import io.quorumesh.model.Proposal;
import io.quorumesh.model.ProposalStatus;
import io.quorumesh.model.Vote;
import io.quorumesh.model.VoteValue;
import io.quorumesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class KnowledgeStore {
    private static final String PROPOSAL_COLUMNS =
            "proposal_id,group_name,title,statement,tags_json,proposer_claw_id,proposer_instance_id,status,yes_votes,no_votes,reason,created_at_ms,updated_at_ms";
    private static final String FACT_COLUMNS =
            "fact_id,group_name,subject,predicate,object,version,source,proposal_id,tags_json,created_at_ms";

    private final Database database;

    public KnowledgeStore(Database database) {
        this.database = database;
    }

    public void createProposal(Proposal p) {
        if (getProposal(p.proposalId()).isPresent()) {
            throw new DuplicateIdException("proposal", p.proposalId());
        }
        String sql = "INSERT INTO knowledge_proposals(" + PROPOSAL_COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?)";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, p.proposalId());
            ps.setString(2, p.group());
            ps.setString(3, nz(p.title()));
            ps.setString(4, p.statement());
            ps.setString(5, Jsons.toCompactJson(p.tags()));
            ps.setString(6, p.proposerClawId());
            ps.setString(7, nz(p.proposerInstanceId()));
            ps.setString(8, p.status().wire());
            ps.setInt(9, p.yes());
            ps.setInt(10, p.no());
            ps.setString(11, nz(p.reason()));
            ps.setLong(12, p.createdAtMs());
            ps.setLong(13, p.updatedAtMs());
            ps.executeUpdate();
        } catch (SQLException e) {
            if (getProposal(p.proposalId()).isPresent()) {
                throw new DuplicateIdException("proposal", p.proposalId());
            }
            throw new RuntimeException("Failed to create proposal", e);
        }
    }

    public Optional<Proposal> getProposal(String proposalId) {
        String sql = "SELECT " + PROPOSAL_COLUMNS + " FROM knowledge_proposals WHERE proposal_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, proposalId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readProposal(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read proposal", e);
        }
    }

    public List<Proposal> listProposals(ProposalStatus status, int limit, int offset) {
        String base = "SELECT " + PROPOSAL_COLUMNS + " FROM knowledge_proposals";
        String sql = status == null
                ? base + " ORDER BY created_at_ms DESC, proposal_id LIMIT ? OFFSET ?"
                : base + " WHERE status=? ORDER BY created_at_ms DESC, proposal_id LIMIT ? OFFSET ?";
        List<Proposal> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            if (status != null) {
                ps.setString(i++, status.wire());
            }
            ps.setInt(i++, Math.max(1, limit));
            ps.setInt(i, Math.max(0, offset));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readProposal(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list proposals", e);
        }
    }

    /**
     * Writes a terminal decision if the proposal is still pending.
     *
     * @return {@code false} when the proposal was already decided (or does not exist)
     */
    public boolean updateProposalDecision(String proposalId, Decision decision, long nowMs) {
        String sql = """
                UPDATE knowledge_proposals SET status=?,yes_votes=?,no_votes=?,reason=?,updated_at_ms=?
                WHERE proposal_id=? AND status=?
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, decision.status().wire());
            ps.setInt(2, decision.yes());
            ps.setInt(3, decision.no());
            ps.setString(4, nz(decision.reason()));
            ps.setLong(5, nowMs);
            ps.setString(6, proposalId);
            ps.setString(7, ProposalStatus.PENDING.wire());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to update proposal decision", e);
        }
    }

    /**
     * Refreshes the running tally of a pending proposal without deciding it.
     */
    public void updateProposalTally(String proposalId, int yes, int no, long nowMs) {
        exec("UPDATE knowledge_proposals SET yes_votes=?,no_votes=?,updated_at_ms=? WHERE proposal_id=? AND status=?", ps -> {
            ps.setInt(1, yes);
            ps.setInt(2, no);
            ps.setLong(3, nowMs);
            ps.setString(4, proposalId);
            ps.setString(5, ProposalStatus.PENDING.wire());
        });
    }

    public Map<String, Integer> countProposalsByStatus() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (ProposalStatus status : ProposalStatus.values()) {
            out.put(status.wire(), 0);
        }
        String sql = "SELECT status, COUNT(*) AS c FROM knowledge_proposals GROUP BY status";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString("status"), rs.getInt("c"));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count proposals", e);
        }
    }

    public void upsertVote(Vote v) {
        String sql = """
                INSERT INTO knowledge_votes(proposal_id,voter_id,instance_id,vote,reason,trace_id,updated_at_ms)
                VALUES(?,?,?,?,?,?,?)
                ON CONFLICT(proposal_id, voter_id) DO UPDATE SET
                    instance_id=excluded.instance_id,
                    vote=excluded.vote,
                    reason=excluded.reason,
                    trace_id=excluded.trace_id,
                    updated_at_ms=excluded.updated_at_ms
                """;
        exec(sql, ps -> {
            ps.setString(1, v.proposalId());
            ps.setString(2, v.voterId());
            ps.setString(3, nz(v.instanceId()));
            ps.setString(4, v.value().wire());
            ps.setString(5, nz(v.reason()));
            ps.setString(6, nz(v.traceId()));
            ps.setLong(7, v.updatedAtMs());
        });
    }

    public List<Vote> listVotes(String proposalId) {
        String sql = """
                SELECT proposal_id,voter_id,instance_id,vote,reason,trace_id,updated_at_ms
                FROM knowledge_votes WHERE proposal_id=? ORDER BY updated_at_ms, voter_id
                """;
        List<Vote> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, proposalId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Vote(
                            rs.getString("proposal_id"),
                            rs.getString("voter_id"),
                            rs.getString("instance_id"),
                            VoteValue.fromString(rs.getString("vote")),
                            rs.getString("reason"),
                            rs.getString("trace_id"),
                            rs.getLong("updated_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list votes", e);
        }
    }

    public Optional<Fact> getFactLatest(String group, String subject, String predicate) {
        try (Connection c = database.openConnection()) {
            return readLatest(c, group, subject, predicate);
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read fact", e);
        }
    }

    /**
     * Resolves {@code incoming} against the stored latest version and records the outcome in the fact history,
     * all in one transaction. Only the row chosen by the policy is ever served.
     */
    public FactApplyResult upsertFactLatest(Fact incoming, FactPolicy policy, long nowMs) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                Optional<Fact> latest = readLatest(c, incoming.group(), incoming.subject(), incoming.predicate());
                FactResolution resolution = policy.resolve(latest.orElse(null), incoming);
                Fact served = latest.orElse(null);
                if (resolution.write() != null) {
                    writeLatest(c, resolution.write(), latest.isPresent(), nowMs);
                    served = resolution.write();
                }
                try (PreparedStatement h = c.prepareStatement("""
                        INSERT INTO knowledge_fact_history(fact_id,group_name,subject,predicate,object,version,source,outcome,reason,recorded_at_ms)
                        VALUES(?,?,?,?,?,?,?,?,?,?)
                        """)) {
                    h.setString(1, incoming.factId());
                    h.setString(2, incoming.group());
                    h.setString(3, incoming.subject());
                    h.setString(4, incoming.predicate());
                    h.setString(5, incoming.object());
                    h.setInt(6, incoming.version());
                    h.setString(7, incoming.source());
                    h.setString(8, resolution.outcome().wire());
                    h.setString(9, nz(resolution.reason()));
                    h.setLong(10, nowMs);
                    h.executeUpdate();
                }
                c.commit();
                return new FactApplyResult(resolution.outcome(), nz(resolution.reason()), resolution.write() != null,
                        incoming, served);
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply fact", e);
        }
    }

    public List<Fact> listFacts(String group, int limit, int offset) {
        boolean withGroup = group != null && !group.isBlank();
        String sql = "SELECT " + FACT_COLUMNS + " FROM knowledge_facts"
                + (withGroup ? " WHERE group_name=?" : "")
                + " ORDER BY updated_at_ms DESC, subject, predicate LIMIT ? OFFSET ?";
        List<Fact> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            int i = 1;
            if (withGroup) {
                ps.setString(i++, group);
            }
            ps.setInt(i++, Math.max(1, limit));
            ps.setInt(i, Math.max(0, offset));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(readFact(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list facts", e);
        }
    }

    public int countFacts(String group) {
        boolean withGroup = group != null && !group.isBlank();
        String sql = "SELECT COUNT(*) FROM knowledge_facts" + (withGroup ? " WHERE group_name=?" : "");
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            if (withGroup) {
                ps.setString(1, group);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count facts", e);
        }
    }

    public List<FactHistoryRow> listFactHistory(String group, String subject, String predicate, int limit) {
        String sql = """
                SELECT id,fact_id,group_name,subject,predicate,object,version,source,outcome,reason,recorded_at_ms
                FROM knowledge_fact_history
                WHERE group_name=? AND subject=? AND predicate=?
                ORDER BY id DESC LIMIT ?
                """;
        List<FactHistoryRow> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, group);
            ps.setString(2, subject);
            ps.setString(3, predicate);
            ps.setInt(4, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new FactHistoryRow(
                            rs.getLong("id"),
                            rs.getString("fact_id"),
                            rs.getString("group_name"),
                            rs.getString("subject"),
                            rs.getString("predicate"),
                            rs.getString("object"),
                            rs.getInt("version"),
                            rs.getString("source"),
                            rs.getString("outcome"),
                            rs.getString("reason"),
                            rs.getLong("recorded_at_ms")
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list fact history", e);
        }
    }

    public Map<String, Integer> countFactOutcomes() {
        Map<String, Integer> out = new LinkedHashMap<>();
        for (FactOutcome outcome : FactOutcome.values()) {
            out.put(outcome.wire(), 0);
        }
        String sql = "SELECT outcome, COUNT(*) AS c FROM knowledge_fact_history GROUP BY outcome";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) {
                out.put(rs.getString("outcome"), rs.getInt("c"));
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count fact outcomes", e);
        }
    }

    public boolean hasSeen(String idempotencyKey) {
        String sql = "SELECT 1 FROM knowledge_idempotency WHERE idempotency_key=? LIMIT 1";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, idempotencyKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read idempotency key", e);
        }
    }

    /**
     * @return {@code true} if the key was recorded now, {@code false} if it was already present
     */
    public boolean markSeen(SeenKey key) {
        String sql = """
                INSERT OR IGNORE INTO knowledge_idempotency(idempotency_key,origin_id,envelope_type,topic,trace_id,created_at_ms)
                VALUES(?,?,?,?,?,?)
                """;
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, key.idempotencyKey());
            ps.setString(2, nz(key.originId()));
            ps.setString(3, nz(key.envelopeType()));
            ps.setString(4, nz(key.topic()));
            ps.setString(5, nz(key.traceId()));
            ps.setLong(6, key.nowMs());
            return ps.executeUpdate() == 1;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to record idempotency key", e);
        }
    }

    public int countSeen() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM knowledge_idempotency");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count idempotency keys", e);
        }
    }

    private Optional<Fact> readLatest(Connection c, String group, String subject, String predicate) throws SQLException {
        String sql = "SELECT " + FACT_COLUMNS + " FROM knowledge_facts WHERE group_name=? AND subject=? AND predicate=?";
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, group);
            ps.setString(2, subject);
            ps.setString(3, predicate);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(readFact(rs));
            }
        }
    }

    private void writeLatest(Connection c, Fact f, boolean exists, long nowMs) throws SQLException {
        String sql = exists
                ? """
                  UPDATE knowledge_facts SET fact_id=?,object=?,version=?,source=?,proposal_id=?,tags_json=?,created_at_ms=?,updated_at_ms=?
                  WHERE group_name=? AND subject=? AND predicate=?
                  """
                : """
                  INSERT INTO knowledge_facts(fact_id,object,version,source,proposal_id,tags_json,created_at_ms,updated_at_ms,group_name,subject,predicate)
                  VALUES(?,?,?,?,?,?,?,?,?,?,?)
                  """;
        try (PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, f.factId());
            ps.setString(2, f.object());
            ps.setInt(3, f.version());
            ps.setString(4, f.source());
            ps.setString(5, nz(f.proposalId()));
            ps.setString(6, Jsons.toCompactJson(f.tags()));
            ps.setLong(7, f.createdAtMs());
            ps.setLong(8, nowMs);
            ps.setString(9, f.group());
            ps.setString(10, f.subject());
            ps.setString(11, f.predicate());
            ps.executeUpdate();
        }
    }

    private static Proposal readProposal(ResultSet rs) throws SQLException {
        return new Proposal(
                rs.getString("proposal_id"),
                rs.getString("group_name"),
                rs.getString("title"),
                rs.getString("statement"),
                Jsons.readStringList(rs.getString("tags_json")),
                rs.getString("proposer_claw_id"),
                rs.getString("proposer_instance_id"),
                ProposalStatus.fromString(rs.getString("status")),
                rs.getInt("yes_votes"),
                rs.getInt("no_votes"),
                rs.getString("reason"),
                rs.getLong("created_at_ms"),
                rs.getLong("updated_at_ms")
        );
    }

    private static Fact readFact(ResultSet rs) throws SQLException {
        return new Fact(
                rs.getString("fact_id"),
                rs.getString("group_name"),
                rs.getString("subject"),
                rs.getString("predicate"),
                rs.getString("object"),
                rs.getInt("version"),
                rs.getString("source"),
                rs.getString("proposal_id"),
                Jsons.readStringList(rs.getString("tags_json")),
                rs.getLong("created_at_ms")
        );
    }

    private void exec(String sql, Binder binder) {
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            binder.bind(ps);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw new RuntimeException("DB exec failed", e);
        }
    }

    private static String nz(String value) {
        return value == null ? "" : value;
    }

    private interface Binder { void bind(PreparedStatement ps) throws SQLException; }

    /**
     * Decides how an incoming fact version relates to the stored latest one.
     */
    @FunctionalInterface
    public interface FactPolicy {
        FactResolution resolve(Fact latest, Fact incoming);
    }

    /**
     * @param write the row to store as latest, or {@code null} to leave the stored row untouched
     */
    public record FactResolution(FactOutcome outcome, String reason, Fact write) {}
    public record FactApplyResult(FactOutcome outcome, String reason, boolean written, Fact incoming, Fact latest) {}
    public record FactHistoryRow(long id, String factId, String group, String subject, String predicate, String object,
                                 int version, String source, String outcome, String reason, long recordedAtMs) {}
    public record SeenKey(String idempotencyKey, String originId, String envelopeType, String topic, String traceId, long nowMs) {}
}
