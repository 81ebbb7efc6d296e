package io.opsmesh.bridge;

/**
 * Snapshot consumed by monitoring: breaker state, dead-letter depth and delivery counters.
 */
public record BridgeHealth(
        String bridgeId,
        BridgeStatus status,
        boolean validatorConfigured,
        CircuitState circuitState,
        int consecutiveFailures,
        long circuitTrips,
        long circuitRejections,
        int deadLetterDepth,
        long processed,
        long failed,
        long retried,
        long deadLettered,
        long contractRejected,
        double avgProcessingMs,
        long checkedAtMs
) {
}
