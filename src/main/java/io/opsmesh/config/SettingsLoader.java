package io.opsmesh.config;

import io.opsmesh.observability.AuditLogger;
import io.opsmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reads {@code opsmesh-settings.json} under the runtime root. A missing file means defaults;
 * an unreadable one is an error.
 */
public final class SettingsLoader {
    private static final Logger log = LoggerFactory.getLogger(SettingsLoader.class);

    private final OpsMeshConfig config;

    public SettingsLoader(OpsMeshConfig config) {
        this.config = config;
    }

    public LoadOutcome load() {
        OpsMeshSettings defaults = OpsMeshSettings.defaults();
        Path file = config.settingsFile();
        if (!Files.exists(file)) {
            log.info("No settings file at {}, using defaults", file);
            return new LoadOutcome(defaults, "defaults", file.toString());
        }
        try {
            OpsMeshSettings.SettingsFile raw = Jsons.mapper().readValue(file.toFile(), OpsMeshSettings.SettingsFile.class);
            OpsMeshSettings resolved = OpsMeshSettings.fromFile(raw, defaults);
            log.info("Loaded settings from {}", file);
            return new LoadOutcome(resolved, "file", file.toString());
        } catch (IOException | IllegalArgumentException e) {
            throw new RuntimeException("Failed to load settings: " + file, e);
        }
    }

    /**
     * Writes the load to the audit trail. Separate from {@link #load()} because the audit signing
     * secret itself comes from the settings.
     */
    public static void audit(AuditLogger auditLogger, LoadOutcome outcome) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("config", outcome.path());
        details.put("source", outcome.source());
        details.put("tick_period_ms", outcome.settings().tickPeriodMs());
        details.put("validator_configured", outcome.settings().validatorConfigured());
        details.put("audit_signed", !outcome.settings().auditSigningSecret().isBlank());
        String result = "file".equals(outcome.source()) ? "ok" : "ok_default";
        auditLogger.log(AuditLogger.AuditEvent.of("settings.load", "system", "runtime/settings", result, details));
    }

    public record LoadOutcome(OpsMeshSettings settings, String source, String path) {
    }
}
