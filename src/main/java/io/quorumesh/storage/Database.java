package io.quorumesh.storage;

import io.quorumesh.config.QuorumMeshConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class Database {
    private static final String MIGRATION_SCHEMA_VERSION = "quorumesh.schema.migration.v1";
    private final QuorumMeshConfig config;
    private final String jdbcUrl;

    public Database(QuorumMeshConfig config) {
        this.config = config;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public String namespace() {
        return config.namespace();
    }

    public void init() {
        initDirectories();
        initSchema();
        applyAndValidatePragmas();
    }

    public Connection openConnection() throws SQLException {
        Connection conn = DriverManager.getConnection(jdbcUrl);
        try (Statement st = conn.createStatement()) {
            st.execute("PRAGMA busy_timeout=5000");
            st.execute("PRAGMA foreign_keys=ON");
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
            Files.createDirectories(config.busTopicsRoot());
            Files.createDirectories(config.busCommitsRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS knowledge_proposals (
                        proposal_id TEXT PRIMARY KEY,
                        group_name TEXT NOT NULL,
                        title TEXT NOT NULL DEFAULT '',
                        statement TEXT NOT NULL,
                        tags_json TEXT NOT NULL DEFAULT '[]',
                        proposer_claw_id TEXT NOT NULL,
                        proposer_instance_id TEXT NOT NULL DEFAULT '',
                        status TEXT NOT NULL,
                        yes_votes INTEGER NOT NULL DEFAULT 0,
                        no_votes INTEGER NOT NULL DEFAULT 0,
                        reason TEXT NOT NULL DEFAULT '',
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS knowledge_votes (
                        proposal_id TEXT NOT NULL,
                        voter_id TEXT NOT NULL,
                        instance_id TEXT NOT NULL DEFAULT '',
                        vote TEXT NOT NULL,
                        reason TEXT NOT NULL DEFAULT '',
                        trace_id TEXT NOT NULL DEFAULT '',
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(proposal_id, voter_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS knowledge_facts (
                        group_name TEXT NOT NULL,
                        subject TEXT NOT NULL,
                        predicate TEXT NOT NULL,
                        fact_id TEXT NOT NULL,
                        object TEXT NOT NULL,
                        version INTEGER NOT NULL,
                        source TEXT NOT NULL,
                        proposal_id TEXT NOT NULL DEFAULT '',
                        tags_json TEXT NOT NULL DEFAULT '[]',
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(group_name, subject, predicate)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS knowledge_fact_history (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        fact_id TEXT NOT NULL,
                        group_name TEXT NOT NULL,
                        subject TEXT NOT NULL,
                        predicate TEXT NOT NULL,
                        object TEXT NOT NULL,
                        version INTEGER NOT NULL,
                        source TEXT NOT NULL,
                        outcome TEXT NOT NULL,
                        reason TEXT NOT NULL DEFAULT '',
                        recorded_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS knowledge_idempotency (
                        idempotency_key TEXT PRIMARY KEY,
                        origin_id TEXT NOT NULL,
                        envelope_type TEXT NOT NULL,
                        topic TEXT NOT NULL DEFAULT '',
                        trace_id TEXT NOT NULL DEFAULT '',
                        created_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS group_members (
                        group_name TEXT NOT NULL,
                        member_id TEXT NOT NULL,
                        instance_id TEXT NOT NULL DEFAULT '',
                        status TEXT NOT NULL,
                        capabilities_json TEXT NOT NULL DEFAULT '[]',
                        last_seen_ms INTEGER NOT NULL,
                        PRIMARY KEY(group_name, member_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS cascade_tasks (
                        trace_id TEXT NOT NULL,
                        task_id TEXT NOT NULL,
                        sequence INTEGER NOT NULL,
                        title TEXT NOT NULL DEFAULT '',
                        status TEXT NOT NULL,
                        required_input_json TEXT NOT NULL DEFAULT '[]',
                        produced_output_json TEXT NOT NULL DEFAULT '[]',
                        validation_rules_json TEXT NOT NULL DEFAULT '[]',
                        retry_count INTEGER NOT NULL DEFAULT 0,
                        max_retries INTEGER NOT NULL DEFAULT 0,
                        input_json TEXT NOT NULL DEFAULT '{}',
                        output_json TEXT NOT NULL DEFAULT '{}',
                        last_error TEXT NOT NULL DEFAULT '',
                        created_at_ms INTEGER NOT NULL,
                        updated_at_ms INTEGER NOT NULL,
                        committed_at_ms INTEGER,
                        archived_at_ms INTEGER,
                        PRIMARY KEY(trace_id, task_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS cascade_transitions (
                        id INTEGER PRIMARY KEY AUTOINCREMENT,
                        trace_id TEXT NOT NULL,
                        task_id TEXT NOT NULL,
                        from_status TEXT NOT NULL,
                        to_status TEXT NOT NULL,
                        actor TEXT NOT NULL DEFAULT '',
                        reason TEXT NOT NULL DEFAULT '',
                        payload TEXT NOT NULL DEFAULT '{}',
                        idempotency_key TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        UNIQUE(trace_id, task_id, idempotency_key),
                        FOREIGN KEY(trace_id, task_id) REFERENCES cascade_tasks(trace_id, task_id)
                    )
                    """);
            ensureSchemaMigrationsTable(conn);
            applyVersionedMigrations(conn);

            st.execute("CREATE INDEX IF NOT EXISTS idx_proposals_status_created ON knowledge_proposals(status, created_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_votes_proposal ON knowledge_votes(proposal_id)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_facts_group_updated ON knowledge_facts(group_name, updated_at_ms)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_cascade_tasks_trace_seq ON cascade_tasks(trace_id, sequence)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_cascade_transitions_task ON cascade_transitions(trace_id, task_id, id)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void ensureSchemaMigrationsTable(Connection conn) throws SQLException {
        try (Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS schema_migrations (
                        version TEXT PRIMARY KEY,
                        description TEXT NOT NULL,
                        checksum TEXT NOT NULL,
                        applied_at_ms INTEGER NOT NULL,
                        success INTEGER NOT NULL
                    )
                    """);
        }
    }

    private void applyVersionedMigrations(Connection conn) throws SQLException {
        List<MigrationStep> steps = new ArrayList<>();
        steps.add(new MigrationStep(
                "20261001_001_fact_history_indexes",
                "Index fact audit history by key and outcome",
                List.of(
                        "CREATE INDEX IF NOT EXISTS idx_fact_history_key ON knowledge_fact_history(group_name, subject, predicate, id)",
                        "CREATE INDEX IF NOT EXISTS idx_fact_history_outcome ON knowledge_fact_history(outcome)"
                )
        ));
        steps.add(new MigrationStep(
                "20261001_002_roster_status_index",
                "Index group roster by status for pool-size estimation",
                List.of("CREATE INDEX IF NOT EXISTS idx_group_members_status ON group_members(group_name, status)")
        ));
        for (MigrationStep step : steps) {
            if (isMigrationApplied(conn, step.version())) {
                continue;
            }
            applyMigration(conn, step);
        }
    }

    private boolean isMigrationApplied(Connection conn, String version) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(
                "SELECT 1 FROM schema_migrations WHERE version=? AND success=1 LIMIT 1")) {
            ps.setString(1, version);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        }
    }

    private void applyMigration(Connection conn, MigrationStep step) throws SQLException {
        String checksum = checksum(step);
        try (Statement st = conn.createStatement()) {
            for (String sql : step.sql()) {
                st.execute(sql);
            }
        }
        try (PreparedStatement ps = conn.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, step.version());
            ps.setString(2, step.description());
            ps.setString(3, checksum);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private String checksum(MigrationStep step) {
        StringBuilder sb = new StringBuilder();
        sb.append(MIGRATION_SCHEMA_VERSION).append('|')
                .append(step.version()).append('|')
                .append(step.description()).append('|');
        for (String sql : step.sql()) {
            sb.append(sql).append(';');
        }
        return Integer.toHexString(sb.toString().hashCode());
    }

    private record MigrationStep(String version, String description, List<String> sql) {
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        int safeLimit = Math.max(1, limit);
        List<SchemaMigrationRow> out = new ArrayList<>();
        try (Connection c = openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, safeLimit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new SchemaMigrationRow(
                            rs.getString("version"),
                            rs.getString("description"),
                            rs.getString("checksum"),
                            rs.getLong("applied_at_ms"),
                            rs.getInt("success") == 1
                    ));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list schema migrations", e);
        }
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
