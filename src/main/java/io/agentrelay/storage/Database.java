package io.agentrelay.storage;

import io.agentrelay.config.AgentRelayConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

public final class Database {
    private final AgentRelayConfig config;
    private final String jdbcUrl;

    public Database(AgentRelayConfig config) {
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
            st.execute("PRAGMA foreign_keys=ON");
            st.execute("PRAGMA busy_timeout=5000");
        } catch (SQLException e) {
            conn.close();
            throw e;
        }
        return conn;
    }

    private void initDirectories() {
        try {
            Files.createDirectories(config.rootDir());
            Files.createDirectories(config.auditRoot());
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize directories", e);
        }
    }

    private void initSchema() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("""
                    CREATE TABLE IF NOT EXISTS broker_agents (
                        namespace TEXT NOT NULL,
                        agent_id TEXT NOT NULL,
                        capacity INTEGER NOT NULL,
                        enqueued_count INTEGER NOT NULL DEFAULT 0,
                        delivered_count INTEGER NOT NULL DEFAULT 0,
                        rejected_count INTEGER NOT NULL DEFAULT 0,
                        expired_count INTEGER NOT NULL DEFAULT 0,
                        PRIMARY KEY(namespace, agent_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS broker_mailbox_items (
                        namespace TEXT NOT NULL,
                        agent_id TEXT NOT NULL,
                        position INTEGER NOT NULL,
                        envelope_id TEXT NOT NULL,
                        priority TEXT NOT NULL,
                        envelope_json TEXT NOT NULL,
                        PRIMARY KEY(namespace, agent_id, position),
                        FOREIGN KEY(namespace, agent_id) REFERENCES broker_agents(namespace, agent_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS broker_conversations (
                        namespace TEXT NOT NULL,
                        conversation_id TEXT NOT NULL,
                        kind TEXT NOT NULL,
                        status TEXT NOT NULL,
                        conversation_json TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        last_activity_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(namespace, conversation_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS broker_task_requests (
                        namespace TEXT NOT NULL,
                        request_id TEXT NOT NULL,
                        requester TEXT NOT NULL,
                        target TEXT NOT NULL,
                        created_at_ms INTEGER NOT NULL,
                        PRIMARY KEY(namespace, request_id)
                    )
                    """);
            st.execute("""
                    CREATE TABLE IF NOT EXISTS broker_snapshot_meta (
                        namespace TEXT PRIMARY KEY,
                        taken_at_ms INTEGER NOT NULL,
                        saved_at_ms INTEGER NOT NULL
                    )
                    """);
            st.execute("CREATE INDEX IF NOT EXISTS idx_broker_conversations_status ON broker_conversations(namespace, status)");
            st.execute("CREATE INDEX IF NOT EXISTS idx_broker_task_requests_created ON broker_task_requests(namespace, created_at_ms)");
        } catch (SQLException e) {
            throw new RuntimeException("Failed to initialize SQLite schema", e);
        }
    }

    private void applyAndValidatePragmas() {
        try (Connection conn = openConnection(); Statement st = conn.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");

            validatePragma(st, "journal_mode", "wal");
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
}
