package io.opsmesh.supervisor;

import java.util.Map;

/**
 * Cumulative loop metrics. Failure counts are also written by intervention and forwarding callbacks.
 */
public record CycleMetrics(
        long cycles,
        long overruns,
        long phaseErrors,
        double avgCycleMs,
        Map<String, Double> avgPhaseMs,
        long totalConflicts,
        long totalEmergencies,
        double conflictsPerCycle,
        double emergenciesPerCycle,
        long lastCycleAtMs,
        long interventionsDispatched,
        long failedInterventions,
        long failedForwards
) {
}
