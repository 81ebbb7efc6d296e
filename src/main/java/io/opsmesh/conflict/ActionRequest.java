package io.opsmesh.conflict;

/**
 * A proposal from {@code sourceId} to apply {@code action} to {@code resourceId}.
 */
public record ActionRequest(
        String sourceId,
        String resourceId,
        String action,
        double priorityScore,
        long requestedAtMs
) {
    public ActionRequest {
        if (sourceId == null || sourceId.isBlank()) {
            throw new IllegalArgumentException("source_id is required");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("action is required");
        }
        if (Double.isNaN(priorityScore)) {
            throw new IllegalArgumentException("priority_score must be a number");
        }
        resourceId = resourceId == null || resourceId.isBlank() ? "*" : resourceId.trim();
    }
}
