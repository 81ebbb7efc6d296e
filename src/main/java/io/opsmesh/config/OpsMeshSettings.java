package io.opsmesh.config;

import io.opsmesh.emergency.EmergencyThreshold;
import io.opsmesh.emergency.EmergencyType;

import java.util.ArrayList;
import java.util.List;

/**
 * Every tunable of a runtime, after defaults and sanitizing have been applied.
 */
public record OpsMeshSettings(
        long tickPeriodMs,
        long shutdownGraceMs,
        long heartbeatIntervalMs,
        int missedHeartbeats,
        int evictionMultiplier,
        int busQueueCapacity,
        int busWorkerThreads,
        int busDeliveryAttempts,
        int breakerFailureThreshold,
        long breakerRecoveryTimeoutMs,
        int breakerHalfOpenTrials,
        int retryMaxAttempts,
        long retryBaseDelayMs,
        long retryMaxDelayMs,
        long retryJitterMs,
        long validatorTimeoutMs,
        String validatorEndpoint,
        String auditSigningSecret,
        List<EmergencyThreshold> emergencyThresholds
) {
    public OpsMeshSettings {
        validatorEndpoint = validatorEndpoint == null ? "" : validatorEndpoint.trim();
        auditSigningSecret = auditSigningSecret == null ? "" : auditSigningSecret;
        emergencyThresholds = emergencyThresholds == null || emergencyThresholds.isEmpty()
                ? EmergencyThreshold.defaults()
                : List.copyOf(emergencyThresholds);
    }

    public static OpsMeshSettings defaults() {
        return new OpsMeshSettings(
                OpsMeshConfig.DEFAULT_TICK_PERIOD_MS,
                OpsMeshConfig.DEFAULT_SHUTDOWN_GRACE_MS,
                OpsMeshConfig.DEFAULT_HEARTBEAT_INTERVAL_MS,
                OpsMeshConfig.DEFAULT_MISSED_HEARTBEATS,
                OpsMeshConfig.DEFAULT_EVICTION_MULTIPLIER,
                OpsMeshConfig.DEFAULT_BUS_QUEUE_CAPACITY,
                OpsMeshConfig.DEFAULT_BUS_WORKER_THREADS,
                OpsMeshConfig.DEFAULT_BUS_DELIVERY_ATTEMPTS,
                OpsMeshConfig.DEFAULT_BREAKER_FAILURE_THRESHOLD,
                OpsMeshConfig.DEFAULT_BREAKER_RECOVERY_TIMEOUT_MS,
                OpsMeshConfig.DEFAULT_BREAKER_HALF_OPEN_TRIALS,
                OpsMeshConfig.DEFAULT_RETRY_MAX_ATTEMPTS,
                OpsMeshConfig.DEFAULT_RETRY_BASE_DELAY_MS,
                OpsMeshConfig.DEFAULT_RETRY_MAX_DELAY_MS,
                OpsMeshConfig.DEFAULT_RETRY_JITTER_MS,
                OpsMeshConfig.DEFAULT_VALIDATOR_TIMEOUT_MS,
                "",
                "",
                EmergencyThreshold.defaults()
        );
    }

    static OpsMeshSettings fromFile(SettingsFile file, OpsMeshSettings defaults) {
        if (file == null) {
            return defaults;
        }
        long retryBase = sanitizeLong(file.retryBaseDelayMs(), defaults.retryBaseDelayMs(), 0L);
        return new OpsMeshSettings(
                sanitizeLong(file.tickPeriodMs(), defaults.tickPeriodMs(), 10L),
                sanitizeLong(file.shutdownGraceMs(), defaults.shutdownGraceMs(), 0L),
                sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 1L),
                sanitizeInt(file.missedHeartbeats(), defaults.missedHeartbeats(), 1),
                sanitizeInt(file.evictionMultiplier(), defaults.evictionMultiplier(), 1),
                sanitizeInt(file.busQueueCapacity(), defaults.busQueueCapacity(), 1),
                sanitizeInt(file.busWorkerThreads(), defaults.busWorkerThreads(), 1),
                sanitizeInt(file.busDeliveryAttempts(), defaults.busDeliveryAttempts(), 1),
                sanitizeInt(file.breakerFailureThreshold(), defaults.breakerFailureThreshold(), 1),
                sanitizeLong(file.breakerRecoveryTimeoutMs(), defaults.breakerRecoveryTimeoutMs(), 0L),
                sanitizeInt(file.breakerHalfOpenTrials(), defaults.breakerHalfOpenTrials(), 1),
                sanitizeInt(file.retryMaxAttempts(), defaults.retryMaxAttempts(), 1),
                retryBase,
                sanitizeLong(file.retryMaxDelayMs(), defaults.retryMaxDelayMs(), retryBase),
                sanitizeLong(file.retryJitterMs(), defaults.retryJitterMs(), 0L),
                sanitizeLong(file.validatorTimeoutMs(), defaults.validatorTimeoutMs(), 1L),
                file.validatorEndpoint() == null ? defaults.validatorEndpoint() : file.validatorEndpoint(),
                file.auditSigningSecret() == null ? defaults.auditSigningSecret() : file.auditSigningSecret(),
                sanitizeThresholds(file.emergencyThresholds(), defaults.emergencyThresholds())
        );
    }

    public boolean validatorConfigured() {
        return !validatorEndpoint.isBlank();
    }

    /**
     * Copy safe for printing: the audit secret is masked.
     */
    public OpsMeshSettings redacted() {
        return new OpsMeshSettings(tickPeriodMs, shutdownGraceMs, heartbeatIntervalMs, missedHeartbeats,
                evictionMultiplier, busQueueCapacity, busWorkerThreads, busDeliveryAttempts,
                breakerFailureThreshold, breakerRecoveryTimeoutMs, breakerHalfOpenTrials, retryMaxAttempts,
                retryBaseDelayMs, retryMaxDelayMs, retryJitterMs, validatorTimeoutMs, validatorEndpoint,
                auditSigningSecret.isBlank() ? "" : "***", emergencyThresholds);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static List<EmergencyThreshold> sanitizeThresholds(List<ThresholdFile> raw, List<EmergencyThreshold> fallback) {
        if (raw == null || raw.isEmpty()) {
            return fallback;
        }
        List<EmergencyThreshold> out = new ArrayList<>();
        for (ThresholdFile row : raw) {
            if (row == null || row.type() == null) {
                continue;
            }
            EmergencyType type = EmergencyType.fromString(row.type());
            EmergencyThreshold base = null;
            for (EmergencyThreshold candidate : fallback) {
                if (candidate.type() == type) {
                    base = candidate;
                    break;
                }
            }
            if (base == null) {
                for (EmergencyThreshold candidate : EmergencyThreshold.defaults()) {
                    if (candidate.type() == type) {
                        base = candidate;
                    }
                }
            }
            out.add(new EmergencyThreshold(
                    type,
                    row.metric() == null || row.metric().isBlank() ? base.metricName() : row.metric().trim(),
                    row.threshold() == null ? base.threshold() : row.threshold(),
                    sanitizeLong(row.dwellMs(), base.dwellMs(), 0L),
                    sanitizeLong(row.cooldownMs(), base.cooldownMs(), 0L),
                    row.severity() == null ? base.baseSeverity() : row.severity()
            ));
        }
        return out.isEmpty() ? fallback : List.copyOf(out);
    }

    /**
     * On-disk shape of {@code opsmesh-settings.json}; every field is optional.
     */
    record SettingsFile(
            Long tickPeriodMs,
            Long shutdownGraceMs,
            Long heartbeatIntervalMs,
            Integer missedHeartbeats,
            Integer evictionMultiplier,
            Integer busQueueCapacity,
            Integer busWorkerThreads,
            Integer busDeliveryAttempts,
            Integer breakerFailureThreshold,
            Long breakerRecoveryTimeoutMs,
            Integer breakerHalfOpenTrials,
            Integer retryMaxAttempts,
            Long retryBaseDelayMs,
            Long retryMaxDelayMs,
            Long retryJitterMs,
            Long validatorTimeoutMs,
            String validatorEndpoint,
            String auditSigningSecret,
            List<ThresholdFile> emergencyThresholds
    ) {
    }

    record ThresholdFile(
            String type,
            String metric,
            Double threshold,
            Long dwellMs,
            Long cooldownMs,
            Double severity
    ) {
    }
}
