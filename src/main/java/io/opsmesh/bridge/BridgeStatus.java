package io.opsmesh.bridge;

public enum BridgeStatus {
    HEALTHY,
    DEGRADED,
    CIRCUIT_OPEN,
    STOPPED;

    public String label() {
        return name().toLowerCase();
    }
}
