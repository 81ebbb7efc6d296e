package io.opsmesh.conflict;

public record RequestOutcome(ActionRequest request, boolean won, int rank, String reason) {
}
