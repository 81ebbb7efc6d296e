package io.opsmesh.bridge;

import java.util.List;
import java.util.Map;

/**
 * Versioned schema for one topic crossing the bridge: required fields plus declared property
 * types ({@code string}, {@code number}, {@code integer}, {@code boolean}, {@code object},
 * {@code array}).
 */
public record MessageContract(
        String topic,
        String version,
        List<String> required,
        Map<String, String> propertyTypes
) {
    public MessageContract {
        if (topic == null || topic.isBlank()) {
            throw new IllegalArgumentException("contract topic is required");
        }
        Version.parse(version);
        required = required == null ? List.of() : List.copyOf(required);
        propertyTypes = propertyTypes == null ? Map.of() : Map.copyOf(propertyTypes);
    }

    public Version parsedVersion() {
        return Version.parse(version);
    }

    /**
     * {@code major.minor}; a bare major means minor 0.
     */
    public record Version(int major, int minor) implements Comparable<Version> {
        public static Version parse(String raw) {
            if (raw == null || raw.isBlank()) {
                throw new IllegalArgumentException("contract version is required");
            }
            String[] parts = raw.trim().split("\\.");
            if (parts.length > 2) {
                throw new IllegalArgumentException("Invalid contract version: " + raw);
            }
            try {
                int major = Integer.parseInt(parts[0]);
                int minor = parts.length == 2 ? Integer.parseInt(parts[1]) : 0;
                if (major < 0 || minor < 0) {
                    throw new IllegalArgumentException("Invalid contract version: " + raw);
                }
                return new Version(major, minor);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid contract version: " + raw, e);
            }
        }

        @Override
        public int compareTo(Version other) {
            int cmp = Integer.compare(major, other.major);
            return cmp != 0 ? cmp : Integer.compare(minor, other.minor);
        }

        @Override
        public String toString() {
            return major + "." + minor;
        }
    }
}
