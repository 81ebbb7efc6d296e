package io.opsmesh.bridge;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN;

    public String label() {
        return name().toLowerCase();
    }
}
