package io.opsmesh.bridge;

import io.opsmesh.model.Message;

/**
 * A message the bridge could not deliver. Keyed by message id, so a message is dead-lettered
 * at most once no matter how many times it fails.
 */
public record DeadLetterEntry(
        Message message,
        FailureKind kind,
        String failureReason,
        int retryCount,
        long firstFailedAtMs,
        long lastAttemptAtMs,
        String channel
) {
    public String messageId() {
        return message.id();
    }

    public enum FailureKind {
        CONTRACT,
        RETRIES_EXHAUSTED,
        PERMANENT,
        CIRCUIT_OPEN;

        public String label() {
            return name().toLowerCase();
        }

        public static FailureKind fromString(String raw) {
            for (FailureKind kind : values()) {
                if (kind.name().equalsIgnoreCase(raw) || kind.label().equalsIgnoreCase(raw)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown failure kind: " + raw);
        }
    }
}
