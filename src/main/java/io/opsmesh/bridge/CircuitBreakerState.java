package io.opsmesh.bridge;

/**
 * Persistable snapshot of one channel's breaker.
 *
 * @param halfOpenTrialBudget trial calls still allowed in the current half-open window
 * @param halfOpenSuccesses   trial calls that succeeded in the current half-open window
 */
public record CircuitBreakerState(
        String channel,
        CircuitState state,
        int consecutiveFailures,
        long openedAtMs,
        int halfOpenTrialBudget,
        int halfOpenSuccesses,
        long trips,
        long updatedAtMs
) {
    public static CircuitBreakerState closed(String channel, long nowMs) {
        return new CircuitBreakerState(channel, CircuitState.CLOSED, 0, 0L, 0, 0, 0L, nowMs);
    }
}
