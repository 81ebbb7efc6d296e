package io.opsmesh.bridge;

public record DeliveryOutcome(
        String messageId,
        Status status,
        int attempts,
        String reason,
        String replyMessageId
) {
    public enum Status {
        DELIVERED,
        DEAD_LETTERED,
        NOT_FOUND
    }

    public boolean delivered() {
        return status == Status.DELIVERED;
    }
}
