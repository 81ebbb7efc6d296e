package io.opsmesh.bus;

/**
 * Outcome of offering a message to a topic queue.
 *
 * @param droppedMessageId id of the message dropped to make room (the incoming one when
 *                         {@code accepted} is false), or {@code null} when nothing was dropped
 */
public record PublishResult(String messageId, boolean accepted, String droppedMessageId) {
    public boolean backpressure() {
        return droppedMessageId != null;
    }
}
