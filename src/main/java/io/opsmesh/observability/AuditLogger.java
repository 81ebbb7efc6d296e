package io.opsmesh.observability;

import com.fasterxml.jackson.databind.JsonNode;
import io.opsmesh.util.Hashing;
import io.opsmesh.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines audit trail. Each row carries the hash of the previous row, so a
 * truncated or edited file breaks the chain; rows are HMAC-signed when a secret is set.
 */
public final class AuditLogger {
    private final Path auditFile;
    private final String signingSecret;
    private String previousHash;

    public AuditLogger(Path auditFile, String signingSecret) {
        this.auditFile = auditFile;
        this.signingSecret = signingSecret == null ? "" : signingSecret.trim();
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Another process created it between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(AuditEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", Instant.now().toString());
        row.put("action", event.action());
        row.put("actor", event.actor());
        row.put("resource", event.resource());
        row.put("result", event.result());
        row.put("details", event.details());
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        if (!signingSecret.isBlank()) {
            row.put("signature", Hashing.hmacSha256Hex(signingSecret, rowHash));
        }
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public synchronized List<JsonNode> tail(int limit) {
        List<JsonNode> rows = new ArrayList<>();
        try {
            List<String> lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
            int from = Math.max(0, lines.size() - Math.max(1, limit));
            for (String line : lines.subList(from, lines.size())) {
                if (line != null && !line.isBlank()) {
                    rows.add(Jsons.readTree(line));
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
        return rows;
    }

    /**
     * Re-walks the chain and reports the first row whose hash, link or signature does not match.
     * Signatures are only checked on signed rows, and only when this logger has a secret.
     */
    public synchronized IntegrityOutcome verify() {
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read audit log", e);
        }
        String expectedPrev = "";
        int checked = 0;
        for (String line : lines) {
            if (line == null || line.isBlank()) {
                continue;
            }
            checked++;
            JsonNode node;
            try {
                node = Jsons.readTree(line);
            } catch (IllegalArgumentException e) {
                return IntegrityOutcome.broken(checked, "unparseable row");
            }
            String storedHash = node.path("hash").asText();
            if (!expectedPrev.equals(node.path("prev_hash").asText())) {
                return IntegrityOutcome.broken(checked, "prev_hash does not link to the previous row");
            }
            if (!rowHash(node).equals(storedHash)) {
                return IntegrityOutcome.broken(checked, "hash mismatch");
            }
            if (!signingSecret.isBlank() && node.hasNonNull("signature")
                    && !Hashing.hmacSha256Hex(signingSecret, storedHash).equals(node.path("signature").asText())) {
                return IntegrityOutcome.broken(checked, "signature mismatch");
            }
            expectedPrev = storedHash;
        }
        return new IntegrityOutcome(true, checked, -1, null);
    }

    private static String rowHash(JsonNode node) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", node.path("timestamp").asText());
        row.put("action", node.path("action").asText());
        row.put("actor", node.path("actor").asText());
        row.put("resource", node.path("resource").asText());
        row.put("result", node.path("result").asText());
        row.put("details", Jsons.mapper().convertValue(node.path("details"), Map.class));
        row.put("prev_hash", node.path("prev_hash").asText());
        return Hashing.sha256Hex(Jsons.toCompactJson(row));
    }

    private String loadLastHash() {
        try {
            if (!Files.exists(auditFile)) {
                return "";
            }
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.readTree(last).path("hash").asText("");
        } catch (IOException | IllegalArgumentException e) {
            throw new RuntimeException("Failed to read last audit hash: " + auditFile, e);
        }
    }

    public record AuditEvent(
            String action,
            String actor,
            String resource,
            String result,
            Map<String, Object> details
    ) {
        public static AuditEvent of(String action, String actor, String resource, String result, Map<String, Object> details) {
            return new AuditEvent(action, actor, resource, result, details == null ? Map.of() : details);
        }
    }

    /**
     * @param firstBrokenRow 1-based row number, or -1 when the chain is intact
     */
    public record IntegrityOutcome(boolean ok, int checkedRows, int firstBrokenRow, String reason) {
        static IntegrityOutcome broken(int row, String reason) {
            return new IntegrityOutcome(false, row, row, reason);
        }
    }
}
