package io.opsmesh.emergency;

public enum InterventionProtocol {
    REDUCE_LOAD,
    ACTIVATE_FALLBACK,
    RESTART_AGENTS,
    REDISTRIBUTE_WORKLOAD,
    CLEAR_CACHES,
    THROTTLE_REQUESTS,
    ESCALATE_TO_HUMAN;

    public String label() {
        return name().toLowerCase();
    }
}
