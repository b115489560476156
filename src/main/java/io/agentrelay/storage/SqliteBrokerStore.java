package io.agentrelay.storage;

import io.agentrelay.model.BrokerSnapshot;
import io.agentrelay.model.ConversationView;
import io.agentrelay.model.Envelope;
import io.agentrelay.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores the latest broker snapshot of one namespace. A save replaces the previous
 * snapshot in a single transaction; envelopes and conversations are kept as JSON.
 */
public final class SqliteBrokerStore implements PersistentStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteBrokerStore.class);
    private static final List<String> CLEAR_ORDER = List.of(
            "broker_mailbox_items",
            "broker_agents",
            "broker_conversations",
            "broker_task_requests",
            "broker_snapshot_meta"
    );

    private final Database database;
    private final String namespace;

    public SqliteBrokerStore(Database database) {
        this.database = database;
        this.namespace = database.namespace();
    }

    @Override
    public void save(BrokerSnapshot snapshot) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                for (String table : CLEAR_ORDER) {
                    try (PreparedStatement del = c.prepareStatement("DELETE FROM " + table + " WHERE namespace=?")) {
                        del.setString(1, namespace);
                        del.executeUpdate();
                    }
                }
                try (PreparedStatement agent = c.prepareStatement(
                        "INSERT INTO broker_agents(namespace,agent_id,capacity,enqueued_count,delivered_count,rejected_count,expired_count) VALUES(?,?,?,?,?,?,?)");
                     PreparedStatement item = c.prepareStatement(
                             "INSERT INTO broker_mailbox_items(namespace,agent_id,position,envelope_id,priority,envelope_json) VALUES(?,?,?,?,?,?)")) {
                    for (BrokerSnapshot.MailboxState mailbox : snapshot.mailboxes()) {
                        agent.setString(1, namespace);
                        agent.setString(2, mailbox.agentId());
                        agent.setInt(3, mailbox.capacity());
                        agent.setLong(4, mailbox.enqueuedCount());
                        agent.setLong(5, mailbox.deliveredCount());
                        agent.setLong(6, mailbox.rejectedCount());
                        agent.setLong(7, mailbox.expiredCount());
                        agent.executeUpdate();

                        int position = 0;
                        for (Envelope envelope : mailbox.items()) {
                            item.setString(1, namespace);
                            item.setString(2, mailbox.agentId());
                            item.setInt(3, position++);
                            item.setString(4, envelope.id());
                            item.setString(5, envelope.priority().label());
                            item.setString(6, Jsons.toCompactJson(envelope));
                            item.executeUpdate();
                        }
                    }
                }
                try (PreparedStatement conv = c.prepareStatement(
                        "INSERT INTO broker_conversations(namespace,conversation_id,kind,status,conversation_json,created_at_ms,last_activity_at_ms) VALUES(?,?,?,?,?,?,?)")) {
                    for (ConversationView conversation : snapshot.conversations()) {
                        conv.setString(1, namespace);
                        conv.setString(2, conversation.id());
                        conv.setString(3, conversation.kind());
                        conv.setString(4, conversation.status().name());
                        conv.setString(5, Jsons.toCompactJson(conversation));
                        conv.setLong(6, conversation.createdAtMs());
                        conv.setLong(7, conversation.lastActivityAtMs());
                        conv.executeUpdate();
                    }
                }
                try (PreparedStatement req = c.prepareStatement(
                        "INSERT INTO broker_task_requests(namespace,request_id,requester,target,created_at_ms) VALUES(?,?,?,?,?)")) {
                    for (BrokerSnapshot.TaskRequestRecord request : snapshot.taskRequests()) {
                        req.setString(1, namespace);
                        req.setString(2, request.requestId());
                        req.setString(3, request.requester());
                        req.setString(4, request.target());
                        req.setLong(5, request.createdAtMs());
                        req.executeUpdate();
                    }
                }
                try (PreparedStatement meta = c.prepareStatement(
                        "INSERT INTO broker_snapshot_meta(namespace,taken_at_ms,saved_at_ms) VALUES(?,?,?)")) {
                    meta.setString(1, namespace);
                    meta.setLong(2, snapshot.takenAtMs());
                    meta.setLong(3, Instant.now().toEpochMilli());
                    meta.executeUpdate();
                }
                c.commit();
            } catch (Exception e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (Exception e) {
            throw new RuntimeException("Failed to save broker snapshot", e);
        }
        log.debug("Saved broker snapshot namespace={} mailboxes={} conversations={} task_requests={}",
                namespace, snapshot.mailboxes().size(), snapshot.conversations().size(), snapshot.taskRequests().size());
    }

    @Override
    public Optional<BrokerSnapshot> load() {
        try (Connection c = database.openConnection()) {
            Long takenAtMs = loadTakenAt(c);
            if (takenAtMs == null) {
                return Optional.empty();
            }
            return Optional.of(new BrokerSnapshot(
                    takenAtMs,
                    loadMailboxes(c),
                    loadConversations(c),
                    loadTaskRequests(c)
            ));
        } catch (SQLException e) {
            throw new RuntimeException("Failed to load broker snapshot", e);
        }
    }

    private Long loadTakenAt(Connection c) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("SELECT taken_at_ms FROM broker_snapshot_meta WHERE namespace=?")) {
            ps.setString(1, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getLong("taken_at_ms") : null;
            }
        }
    }

    private List<BrokerSnapshot.MailboxState> loadMailboxes(Connection c) throws SQLException {
        Map<String, List<Envelope>> items = new LinkedHashMap<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT agent_id,envelope_json FROM broker_mailbox_items WHERE namespace=? ORDER BY agent_id, position")) {
            ps.setString(1, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    items.computeIfAbsent(rs.getString("agent_id"), k -> new ArrayList<>())
                            .add(Jsons.fromJson(rs.getString("envelope_json"), Envelope.class));
                }
            }
        }
        List<BrokerSnapshot.MailboxState> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT agent_id,capacity,enqueued_count,delivered_count,rejected_count,expired_count FROM broker_agents WHERE namespace=? ORDER BY agent_id")) {
            ps.setString(1, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    String agentId = rs.getString("agent_id");
                    out.add(new BrokerSnapshot.MailboxState(
                            agentId,
                            rs.getInt("capacity"),
                            items.getOrDefault(agentId, List.of()),
                            rs.getLong("enqueued_count"),
                            rs.getLong("delivered_count"),
                            rs.getLong("rejected_count"),
                            rs.getLong("expired_count")
                    ));
                }
            }
        }
        return out;
    }

    private List<ConversationView> loadConversations(Connection c) throws SQLException {
        List<ConversationView> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT conversation_json FROM broker_conversations WHERE namespace=? ORDER BY created_at_ms, conversation_id")) {
            ps.setString(1, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(Jsons.fromJson(rs.getString("conversation_json"), ConversationView.class));
                }
            }
        }
        return out;
    }

    private List<BrokerSnapshot.TaskRequestRecord> loadTaskRequests(Connection c) throws SQLException {
        List<BrokerSnapshot.TaskRequestRecord> out = new ArrayList<>();
        try (PreparedStatement ps = c.prepareStatement(
                "SELECT request_id,requester,target,created_at_ms FROM broker_task_requests WHERE namespace=? ORDER BY created_at_ms, request_id")) {
            ps.setString(1, namespace);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new BrokerSnapshot.TaskRequestRecord(
                            rs.getString("request_id"),
                            rs.getString("requester"),
                            rs.getString("target"),
                            rs.getLong("created_at_ms")
                    ));
                }
            }
        }
        return out;
    }
}
