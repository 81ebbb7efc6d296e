package io.opsmesh.emergency;

import java.util.Set;

public record EmergencyEvent(
        String id,
        EmergencyType type,
        double severity,
        long detectedAtMs,
        long cooldownUntilMs,
        Set<String> affectedAgents,
        String metricName,
        double observedValue,
        double thresholdValue,
        String severitySource
) {
    public EmergencyEvent {
        affectedAgents = affectedAgents == null ? Set.of() : Set.copyOf(affectedAgents);
    }

    public EmergencyEvent withSeverity(double newSeverity, String source) {
        return new EmergencyEvent(id, type, newSeverity, detectedAtMs, cooldownUntilMs, affectedAgents,
                metricName, observedValue, thresholdValue, source);
    }

    public String describe() {
        return metricName + " exceeded threshold: " + observedValue + " > " + thresholdValue;
    }
}
