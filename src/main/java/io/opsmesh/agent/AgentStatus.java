package io.opsmesh.agent;

public enum AgentStatus {
    ACTIVE,
    DEGRADED,
    OFFLINE;

    public String label() {
        return name().toLowerCase();
    }
}
