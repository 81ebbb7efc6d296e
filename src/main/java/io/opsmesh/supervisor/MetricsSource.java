package io.opsmesh.supervisor;

import java.util.Map;

/**
 * Extra metric values merged into each cycle's snapshot, on top of what agents report in
 * their heartbeats. Values from this source win on key collisions.
 */
@FunctionalInterface
public interface MetricsSource {
    Map<String, Double> sample(long nowMs);
}
