package io.opsmesh.supervisor;

import io.opsmesh.agent.HealthReport;
import io.opsmesh.conflict.ConflictRecord;
import io.opsmesh.emergency.EmergencyEvent;

import java.util.List;
import java.util.Map;

/**
 * What one tick did. {@code health} is {@code null} when the collect phase failed.
 * Interventions are only dispatched during the tick; their results arrive later.
 */
public record CycleReport(
        long cycle,
        long startedAtMs,
        long durationMs,
        boolean overrun,
        Map<String, Long> phaseDurationsMs,
        HealthReport health,
        List<EmergencyEvent> emergencies,
        int interventionsDispatched,
        List<ConflictRecord> conflicts,
        int uncontestedCommands,
        boolean forwarded,
        List<String> phaseErrors
) {
}
