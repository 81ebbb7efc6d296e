package io.opsmesh.emergency;

import java.util.List;

/**
 * Fires {@code type} once {@code metricName} stays above {@code threshold} for at least
 * {@code dwellMs}; afterwards the type is muted for {@code cooldownMs}.
 *
 * @param baseSeverity severity in [0,1] used when no better estimate is available
 */
public record EmergencyThreshold(
        EmergencyType type,
        String metricName,
        double threshold,
        long dwellMs,
        long cooldownMs,
        double baseSeverity
) {
    public static final String METRIC_FAILURE_RATE = "call_failure_rate";
    public static final String METRIC_RESPONSE_TIME = "avg_response_time_ms";
    public static final String METRIC_DOWNTIME = "agent_downtime_seconds";
    public static final String METRIC_MEMORY = "memory_usage_percent";
    public static final String METRIC_RATE_LIMIT = "api_rate_limit_hit";

    public EmergencyThreshold {
        if (type == null) {
            throw new IllegalArgumentException("type is required");
        }
        if (metricName == null || metricName.isBlank()) {
            throw new IllegalArgumentException("metric is required for " + type.label());
        }
        dwellMs = Math.max(0L, dwellMs);
        cooldownMs = Math.max(0L, cooldownMs);
        baseSeverity = Math.max(0.0d, Math.min(1.0d, baseSeverity));
    }

    public static List<EmergencyThreshold> defaults() {
        return List.of(
                new EmergencyThreshold(EmergencyType.FAILURE_RATE, METRIC_FAILURE_RATE, 0.3d, 120_000L, 300_000L, 0.75d),
                new EmergencyThreshold(EmergencyType.LATENCY, METRIC_RESPONSE_TIME, 8_000d, 180_000L, 180_000L, 0.5d),
                new EmergencyThreshold(EmergencyType.DOWNTIME, METRIC_DOWNTIME, 300d, 60_000L, 600_000L, 1.0d),
                new EmergencyThreshold(EmergencyType.RESOURCE_EXHAUSTION, METRIC_MEMORY, 90d, 300_000L, 300_000L, 0.75d),
                new EmergencyThreshold(EmergencyType.RATE_LIMIT, METRIC_RATE_LIMIT, 0d, 30_000L, 900_000L, 0.5d)
        );
    }
}
