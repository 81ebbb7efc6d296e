package io.opsmesh.emergency;

import java.util.List;

/**
 * @param resolvedBy the protocol that reported success, or {@code null} when every step failed
 */
public record InterventionResult(
        String emergencyId,
        EmergencyType type,
        boolean succeeded,
        InterventionProtocol resolvedBy,
        List<InterventionStep.StepOutcome> attempts,
        long completedAtMs
) {
}
