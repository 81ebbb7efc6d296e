package io.opsmesh.conflict;

import java.util.List;

/**
 * Immutable result of one resolution. {@code competingRequests} is in ranked order, so the
 * first outcome is always the winner.
 */
public record ConflictRecord(
        String id,
        String resourceId,
        List<RequestOutcome> competingRequests,
        String resolution,
        String winningSourceId,
        long resolvedAtMs
) {
    public ConflictRecord {
        competingRequests = List.copyOf(competingRequests);
    }

    public List<RequestOutcome> losers() {
        return competingRequests.subList(1, competingRequests.size());
    }
}
