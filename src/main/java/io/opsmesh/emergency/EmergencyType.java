package io.opsmesh.emergency;

public enum EmergencyType {
    FAILURE_RATE("failure_rate"),
    LATENCY("latency"),
    DOWNTIME("downtime"),
    RESOURCE_EXHAUSTION("resource_exhaustion"),
    RATE_LIMIT("rate_limit");

    private final String label;

    EmergencyType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public static EmergencyType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Emergency type is required");
        }
        for (EmergencyType value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.label.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown emergency type: " + raw);
    }
}
