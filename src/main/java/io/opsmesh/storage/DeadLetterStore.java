package io.opsmesh.storage;

import io.opsmesh.bridge.DeadLetterEntry;
import io.opsmesh.model.Message;
import io.opsmesh.model.Priority;
import io.opsmesh.util.Jsons;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Durable dead-letter queue. One row per message id: a message that fails again is updated in
 * place (retry count, last attempt, reason) rather than duplicated.
 */
public final class DeadLetterStore {
    private static final String COLUMNS = """
            message_id,topic,payload_json,priority,sender_id,recipient_id,created_at_ms,ttl_ms,contract_version,
            failure_kind,failure_reason,retry_count,first_failed_at_ms,last_attempt_at_ms,channel
            """;

    private final Database database;

    public DeadLetterStore(Database database) {
        this.database = database;
    }

    /**
     * @return {@code true} when a new entry was created, {@code false} when an existing one was updated
     */
    public synchronized boolean upsert(DeadLetterEntry entry) {
        try (Connection c = database.openConnection()) {
            c.setAutoCommit(false);
            try {
                boolean exists;
                try (PreparedStatement ps = c.prepareStatement("SELECT 1 FROM dead_letters WHERE message_id=?")) {
                    ps.setString(1, entry.messageId());
                    try (ResultSet rs = ps.executeQuery()) {
                        exists = rs.next();
                    }
                }
                if (exists) {
                    try (PreparedStatement ps = c.prepareStatement("""
                            UPDATE dead_letters
                            SET failure_kind=?,failure_reason=?,retry_count=retry_count+?,last_attempt_at_ms=?,channel=?
                            WHERE message_id=?
                            """)) {
                        ps.setString(1, entry.kind().name());
                        ps.setString(2, entry.failureReason());
                        ps.setInt(3, Math.max(0, entry.retryCount()));
                        ps.setLong(4, entry.lastAttemptAtMs());
                        ps.setString(5, entry.channel());
                        ps.setString(6, entry.messageId());
                        ps.executeUpdate();
                    }
                } else {
                    try (PreparedStatement ps = c.prepareStatement(
                            "INSERT INTO dead_letters(" + COLUMNS + ") VALUES(?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)")) {
                        Message m = entry.message();
                        ps.setString(1, m.id());
                        ps.setString(2, m.topic());
                        ps.setString(3, m.payload() == null ? null : Jsons.toCompactJson(m.payload()));
                        ps.setString(4, m.priority().name());
                        ps.setString(5, m.senderId());
                        ps.setString(6, m.recipientId());
                        ps.setLong(7, m.createdAtMs());
                        ps.setLong(8, m.ttlMs());
                        ps.setString(9, m.contractVersion() == null ? "" : m.contractVersion());
                        ps.setString(10, entry.kind().name());
                        ps.setString(11, entry.failureReason());
                        ps.setInt(12, Math.max(0, entry.retryCount()));
                        ps.setLong(13, entry.firstFailedAtMs());
                        ps.setLong(14, entry.lastAttemptAtMs());
                        ps.setString(15, entry.channel());
                        ps.executeUpdate();
                    }
                }
                c.commit();
                return !exists;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(true);
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to store dead letter: " + entry.messageId(), e);
        }
    }

    public Optional<DeadLetterEntry> find(String messageId) {
        String sql = "SELECT " + COLUMNS + " FROM dead_letters WHERE message_id=?";
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setString(1, messageId);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(map(rs));
            }
        } catch (SQLException e) {
            throw new RuntimeException("Failed to read dead letter: " + messageId, e);
        }
    }

    /**
     * Oldest first.
     */
    public List<DeadLetterEntry> list(int limit) {
        String sql = "SELECT " + COLUMNS + " FROM dead_letters ORDER BY first_failed_at_ms ASC, message_id ASC LIMIT ?";
        List<DeadLetterEntry> out = new ArrayList<>();
        try (Connection c = database.openConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(1, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(map(rs));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to list dead letters", e);
        }
    }

    public synchronized boolean remove(String messageId) {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("DELETE FROM dead_letters WHERE message_id=?")) {
            ps.setString(1, messageId);
            return ps.executeUpdate() > 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to remove dead letter: " + messageId, e);
        }
    }

    public int depth() {
        try (Connection c = database.openConnection();
             PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM dead_letters");
             ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getInt(1) : 0;
        } catch (SQLException e) {
            throw new RuntimeException("Failed to count dead letters", e);
        }
    }

    private DeadLetterEntry map(ResultSet rs) throws SQLException {
        String payload = rs.getString("payload_json");
        Message message = new Message(
                rs.getString("message_id"),
                rs.getString("topic"),
                payload == null ? null : Jsons.readTree(payload),
                Priority.valueOf(rs.getString("priority")),
                rs.getString("sender_id"),
                rs.getString("recipient_id"),
                rs.getLong("created_at_ms"),
                rs.getLong("ttl_ms"),
                rs.getString("contract_version")
        );
        return new DeadLetterEntry(
                message,
                DeadLetterEntry.FailureKind.fromString(rs.getString("failure_kind")),
                rs.getString("failure_reason"),
                rs.getInt("retry_count"),
                rs.getLong("first_failed_at_ms"),
                rs.getLong("last_attempt_at_ms"),
                rs.getString("channel")
        );
    }
}
