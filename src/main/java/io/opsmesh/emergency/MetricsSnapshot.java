package io.opsmesh.emergency;

import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Point-in-time metric values plus, per metric, the agents that contributed to it.
 */
public record MetricsSnapshot(
        long capturedAtMs,
        Map<String, Double> values,
        Map<String, Set<String>> contributors
) {
    public MetricsSnapshot {
        values = values == null ? Map.of() : Map.copyOf(values);
        contributors = contributors == null ? Map.of() : Map.copyOf(contributors);
    }

    public static MetricsSnapshot of(long capturedAtMs, Map<String, Double> values) {
        return new MetricsSnapshot(capturedAtMs, values, Map.of());
    }

    public OptionalDouble value(String metric) {
        Double v = values.get(metric);
        return v == null || v.isNaN() ? OptionalDouble.empty() : OptionalDouble.of(v);
    }

    public Set<String> contributorsOf(String metric) {
        return contributors.getOrDefault(metric, Set.of());
    }
}
