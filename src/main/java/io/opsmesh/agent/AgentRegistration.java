package io.opsmesh.agent;

import java.util.Map;
import java.util.Set;

public record AgentRegistration(
        String agentId,
        Set<String> capabilities,
        AgentStatus status,
        long lastHeartbeatMs,
        long registeredAtMs,
        long statusChangedAtMs,
        Map<String, Double> metrics
) {
    public AgentRegistration {
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }

    AgentRegistration withHeartbeat(long heartbeatMs, Map<String, Double> latestMetrics, long nowMs) {
        long last = Math.max(lastHeartbeatMs, heartbeatMs);
        Map<String, Double> nextMetrics = latestMetrics == null ? metrics : latestMetrics;
        long changedAt = status == AgentStatus.ACTIVE ? statusChangedAtMs : nowMs;
        return new AgentRegistration(agentId, capabilities, AgentStatus.ACTIVE, last, registeredAtMs, changedAt, nextMetrics);
    }

    AgentRegistration withStatus(AgentStatus next, long nowMs) {
        return new AgentRegistration(agentId, capabilities, next, lastHeartbeatMs, registeredAtMs, nowMs, metrics);
    }

    public long silenceMs(long nowMs) {
        return Math.max(0L, nowMs - lastHeartbeatMs);
    }
}
