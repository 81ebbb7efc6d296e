package io.opsmesh.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class OpsMeshConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE_NAME = "opsmesh-settings.json";
    public static final long DEFAULT_TICK_PERIOD_MS = 1_000L;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 5_000L;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 10_000L;
    public static final int DEFAULT_MISSED_HEARTBEATS = 3;
    public static final int DEFAULT_EVICTION_MULTIPLIER = 10;
    public static final int DEFAULT_BUS_QUEUE_CAPACITY = 1_000;
    public static final int DEFAULT_BUS_WORKER_THREADS = 4;
    public static final int DEFAULT_BUS_DELIVERY_ATTEMPTS = 2;
    public static final int DEFAULT_BREAKER_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_BREAKER_RECOVERY_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_BREAKER_HALF_OPEN_TRIALS = 3;
    public static final int DEFAULT_RETRY_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_RETRY_BASE_DELAY_MS = 1_000L;
    public static final long DEFAULT_RETRY_MAX_DELAY_MS = 60_000L;
    public static final long DEFAULT_RETRY_JITTER_MS = 250L;
    public static final long DEFAULT_VALIDATOR_TIMEOUT_MS = 5_000L;

    private final Path rootDir;

    public OpsMeshConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static OpsMeshConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new OpsMeshConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path dbFile() {
        return rootDir.resolve("opsmesh.db");
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }
}
