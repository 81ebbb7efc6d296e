package io.opsmesh.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;
import java.util.UUID;

/**
 * Immutable bus and bridge message.
 *
 * <p>{@code ttlMs <= 0} means the message never expires. {@code recipientId} is
 * {@code null} for broadcast messages. {@code contractVersion} is {@code null} when the sender
 * declared none; only {@link #create} stamps the baseline.
 */
public record Message(
        String id,
        String topic,
        JsonNode payload,
        Priority priority,
        String senderId,
        String recipientId,
        long createdAtMs,
        long ttlMs,
        String contractVersion
) {
    public static final String BASELINE_CONTRACT_VERSION = "1.0";

    public Message {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(topic, "topic");
        priority = priority == null ? Priority.NORMAL : priority;
        contractVersion = contractVersion == null || contractVersion.isBlank() ? null : contractVersion.trim();
    }

    public static Message create(String topic, JsonNode payload, Priority priority, String senderId, long nowMs, long ttlMs) {
        return new Message(newId(), topic, payload, priority, senderId, null, nowMs, ttlMs, BASELINE_CONTRACT_VERSION);
    }

    public static String newId() {
        return "msg_" + UUID.randomUUID();
    }

    public boolean isExpired(long nowMs) {
        return ttlMs > 0L && (nowMs - createdAtMs) > ttlMs;
    }

    public Message withRecipient(String recipient) {
        return new Message(id, topic, payload, priority, senderId, recipient, createdAtMs, ttlMs, contractVersion);
    }

    public Message withContractVersion(String version) {
        return new Message(id, topic, payload, priority, senderId, recipientId, createdAtMs, ttlMs, version);
    }
}
