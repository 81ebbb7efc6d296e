package io.opsmesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.opsmesh.agent.AgentStatus;
import io.opsmesh.bridge.BridgeStatus;
import io.opsmesh.config.OpsMeshConfig;
import io.opsmesh.observability.PrometheusFormatter;
import io.opsmesh.supervisor.CycleReport;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

final class OpsMeshRuntimeTest {

    @Test
    void opensWithDefaultsAndReportsMetrics() throws Exception {
        Path root = Files.createTempDirectory("opsmesh-test-runtime-");
        try {
            OpsMeshConfig config = new OpsMeshConfig(root);
            try (OpsMeshRuntime runtime = OpsMeshRuntime.open(config)) {
                Assertions.assertTrue(Files.exists(config.dbFile()));
                Assertions.assertFalse(runtime.settings().validatorConfigured());
                Assertions.assertFalse(runtime.bridge().validatorConfigured());

                runtime.supervisor().register("worker-1", Set.of("deploy"));
                CycleReport report = runtime.supervisor().runCycle(System.currentTimeMillis());
                Assertions.assertTrue(report.phaseErrors().isEmpty());
                Assertions.assertFalse(report.forwarded());

                OpsMeshRuntime.MetricsOutcome metrics = runtime.metrics();
                Assertions.assertEquals(1, metrics.agents().get(AgentStatus.ACTIVE));
                Assertions.assertEquals(1L, metrics.cycle().cycles());
                Assertions.assertEquals(BridgeStatus.HEALTHY, metrics.bridge().status());

                String text = PrometheusFormatter.format(metrics);
                Assertions.assertTrue(text.contains("# TYPE opsmesh_cycles_total gauge"));
                Assertions.assertTrue(text.contains("opsmesh_cycles_total 1\n"));
                Assertions.assertTrue(text.contains("opsmesh_agents{status=\"active\"} 1\n"));
                Assertions.assertTrue(text.contains("opsmesh_agents{status=\"offline\"} 0\n"));
                Assertions.assertTrue(text.contains("opsmesh_bridge_circuit_state 0\n"));
                Assertions.assertTrue(text.contains("opsmesh_emergencies_raised_total{type=\"downtime\"} 0\n"));
                Assertions.assertTrue(text.contains("opsmesh_bridge_status{status=\"healthy\"} 1\n"));
                Assertions.assertTrue(text.contains("opsmesh_forward_failures_total 0\n"));
                Assertions.assertEquals(1, countOccurrences(text, "# HELP opsmesh_agents "));

                List<JsonNode> audit = runtime.auditLogger().tail(5);
                Assertions.assertEquals("settings.load", audit.get(0).path("action").asText());
                Assertions.assertEquals("ok_default", audit.get(0).path("result").asText());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void endpointOverrideAndSuppliedClientAreUsed() throws Exception {
        Path root = Files.createTempDirectory("opsmesh-test-runtime-override-");
        try {
            OpsMeshConfig config = new OpsMeshConfig(root);
            Files.writeString(config.settingsFile(), "{\"tickPeriodMs\": 250, \"auditSigningSecret\": \"k\"}",
                    StandardCharsets.UTF_8);
            OpsMeshRuntime.Options options = new OpsMeshRuntime.Options(
                    (message, timeout) -> Optional.empty(), null, nowMs -> Map.of("memory_usage_percent", 12.0d),
                    "http://localhost:9/validator");
            try (OpsMeshRuntime runtime = OpsMeshRuntime.open(config, options)) {
                Assertions.assertEquals(250L, runtime.settings().tickPeriodMs());
                Assertions.assertEquals("http://localhost:9/validator", runtime.settings().validatorEndpoint());
                Assertions.assertTrue(runtime.bridge().validatorConfigured());
                Assertions.assertEquals("***", runtime.settings().redacted().auditSigningSecret());

                runtime.start();
                Assertions.assertTrue(runtime.supervisor().isRunning());
            }
            Assertions.assertTrue(new String(Files.readAllBytes(config.auditFile()), StandardCharsets.UTF_8)
                    .contains("\"signature\""));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void closedRuntimeCannotStart() throws Exception {
        Path root = Files.createTempDirectory("opsmesh-test-runtime-closed-");
        try {
            OpsMeshRuntime runtime = OpsMeshRuntime.open(new OpsMeshConfig(root));
            runtime.close();
            runtime.close();
            Assertions.assertThrows(IllegalStateException.class, runtime::start);
            Assertions.assertEquals(BridgeStatus.STOPPED, runtime.bridge().health().status());
        } finally {
            deleteRecursively(root);
        }
    }

    private static int countOccurrences(String text, String needle) {
        int count = 0;
        int at = text.indexOf(needle);
        while (at >= 0) {
            count++;
            at = text.indexOf(needle, at + needle.length());
        }
        return count;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
