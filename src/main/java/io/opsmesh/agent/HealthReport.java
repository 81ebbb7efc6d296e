package io.opsmesh.agent;

import java.util.List;
import java.util.Map;

public record HealthReport(
        long checkedAtMs,
        List<StatusTransition> transitions,
        List<String> newlyOffline,
        List<String> evicted,
        Map<AgentStatus, Integer> counts
) {
}
