package io.opsmesh.emergency;

import com.fasterxml.jackson.databind.JsonNode;
import io.opsmesh.bus.MessageBus;
import io.opsmesh.bus.Topics;
import io.opsmesh.decision.ReasoningService;
import io.opsmesh.model.Message;
import io.opsmesh.observability.AuditLogger;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;

final class EmergencyManagerTest {
    private static final List<EmergencyThreshold> FAST_FAILURE_RATE = List.of(
            new EmergencyThreshold(EmergencyType.FAILURE_RATE, EmergencyThreshold.METRIC_FAILURE_RATE, 0.3d, 1_000L, 5_000L, 0.75d),
            new EmergencyThreshold(EmergencyType.RATE_LIMIT, EmergencyThreshold.METRIC_RATE_LIMIT, 0d, 0L, 5_000L, 0.4d)
    );

    @Test
    void firesOnlyAfterDwellAndThenHonorsCooldown() {
        EmergencyManager manager = new EmergencyManager(null, FAST_FAILURE_RATE);

        Assertions.assertTrue(manager.evaluate(failureRate(0L, 0.5d)).isEmpty());
        Assertions.assertTrue(manager.evaluate(failureRate(500L, 0.5d)).isEmpty());
        List<EmergencyEvent> fired = manager.evaluate(failureRate(1_000L, 0.5d));
        Assertions.assertEquals(1, fired.size());
        EmergencyEvent event = fired.get(0);
        Assertions.assertEquals(EmergencyType.FAILURE_RATE, event.type());
        Assertions.assertEquals(6_000L, event.cooldownUntilMs());

        Assertions.assertTrue(manager.evaluate(failureRate(1_500L, 0.5d)).isEmpty());
        Assertions.assertTrue(manager.evaluate(failureRate(5_999L, 0.5d)).isEmpty());
        Assertions.assertTrue(manager.inCooldown(EmergencyType.FAILURE_RATE, 5_999L));
        Assertions.assertEquals(2L, manager.statistics().suppressed());

        Assertions.assertEquals(List.of(event.id()), manager.expireCooldowns(6_000L));
        Assertions.assertEquals(1, manager.evaluate(failureRate(6_000L, 0.5d)).size());
        Assertions.assertEquals(2L, manager.statistics().raised());
    }

    @Test
    void dipBelowThresholdRestartsDwell() {
        EmergencyManager manager = new EmergencyManager(null, FAST_FAILURE_RATE);

        manager.evaluate(failureRate(0L, 0.5d));
        manager.evaluate(failureRate(500L, 0.1d));
        Assertions.assertTrue(manager.evaluate(failureRate(1_000L, 0.5d)).isEmpty());
        Assertions.assertTrue(manager.evaluate(failureRate(1_900L, 0.5d)).isEmpty());
        Assertions.assertEquals(1, manager.evaluate(failureRate(2_000L, 0.5d)).size());
    }

    @Test
    void missingMetricNeverFires() {
        EmergencyManager manager = new EmergencyManager(null, FAST_FAILURE_RATE);
        Assertions.assertTrue(manager.evaluate(MetricsSnapshot.of(10_000L, Map.of("other", 99d))).isEmpty());
        Assertions.assertEquals(0L, manager.statistics().raised());
    }

    @Test
    void detectionSeverityFallsBackFromHeuristicToBase() {
        EmergencyManager manager = new EmergencyManager(null, FAST_FAILURE_RATE);
        EmergencyEvent viaHeuristic = manager.raise(EmergencyType.FAILURE_RATE, Set.of(), 0.45d, 0L).orElseThrow();
        Assertions.assertEquals("heuristic", viaHeuristic.severitySource());
        Assertions.assertEquals(0.75d, viaHeuristic.severity(), 1e-9);

        EmergencyEvent viaBase = manager.raise(EmergencyType.RATE_LIMIT, Set.of(), 3d, 0L).orElseThrow();
        Assertions.assertEquals("base", viaBase.severitySource());
        Assertions.assertEquals(0.4d, viaBase.severity(), 1e-9);
    }

    @Test
    void detectionNeverCallsReasoningEvenWhenSlow() {
        List<String> calls = Collections.synchronizedList(new ArrayList<>());
        ReasoningService slow = (purpose, context, timeout) -> {
            calls.add(purpose);
            Thread.sleep(1_500L);
            return "0.9";
        };
        EmergencyManager manager = new EmergencyManager(null, FAST_FAILURE_RATE, slow, null, () -> 0L);

        long started = System.nanoTime();
        manager.evaluate(failureRate(0L, 0.5d));
        List<EmergencyEvent> fired = manager.evaluate(failureRate(1_000L, 0.5d));
        EmergencyEvent raised = manager.raise(EmergencyType.RATE_LIMIT, Set.of(), 3d, 1_000L).orElseThrow();
        long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

        Assertions.assertEquals(1, fired.size());
        Assertions.assertEquals("heuristic", fired.get(0).severitySource());
        Assertions.assertEquals("base", raised.severitySource());
        Assertions.assertTrue(calls.isEmpty(), "reasoning called during detection: " + calls);
        Assertions.assertTrue(elapsedMs < 1_000L, "detection took " + elapsedMs + " ms");
    }

    @Test
    void interventionReassessesSeverityWithReasoningOutsideTheLock() throws Exception {
        List<Boolean> lockHeld = Collections.synchronizedList(new ArrayList<>());
        EmergencyManager[] holder = new EmergencyManager[1];
        ReasoningService answering = (purpose, context, timeout) -> {
            lockHeld.add(Thread.holdsLock(holder[0]));
            return "emergency_severity".equals(purpose) ? "0.9" : "summary";
        };
        try (MessageBus bus = new MessageBus()) {
            List<Message> raised = Collections.synchronizedList(new ArrayList<>());
            bus.subscribe(Topics.EMERGENCY_RAISED, raised::add);
            EmergencyManager manager = new EmergencyManager(bus, FAST_FAILURE_RATE, answering, null, () -> 0L);
            holder[0] = manager;
            manager.setProtocol(EmergencyType.FAILURE_RATE, List.of(new InterventionStep(InterventionProtocol.THROTTLE_REQUESTS,
                    event -> InterventionStep.StepOutcome.fail(InterventionProtocol.THROTTLE_REQUESTS, "busy"))));

            EmergencyEvent event = manager.raise(EmergencyType.FAILURE_RATE, Set.of(), 0.45d, 0L).orElseThrow();
            Assertions.assertEquals("heuristic", event.severitySource());
            manager.intervene(event);
            Assertions.assertTrue(bus.awaitIdle(2_000L));

            Assertions.assertEquals(List.of(false), lockHeld);
            EmergencyEvent active = manager.activeEmergencies().get(0);
            Assertions.assertEquals("reasoning", active.severitySource());
            Assertions.assertEquals(0.9d, active.severity(), 1e-9);
            JsonNode payload = raised.get(0).payload();
            Assertions.assertEquals("reasoning", payload.path("severity_source").asText());
            Assertions.assertEquals(0.9d, payload.path("severity").asDouble(), 1e-9);
        }

        ReasoningService failing = (purpose, context, timeout) -> {
            throw new IOException("reasoning endpoint down");
        };
        EmergencyManager degraded = new EmergencyManager(null, FAST_FAILURE_RATE, failing, null, () -> 0L);
        EmergencyEvent event = degraded.raise(EmergencyType.FAILURE_RATE, Set.of(), 0.45d, 0L).orElseThrow();
        degraded.setProtocol(EmergencyType.FAILURE_RATE, List.of());
        degraded.intervene(event);
        Assertions.assertEquals("heuristic", degraded.activeEmergencies().get(0).severitySource());
    }

    @Test
    void directRaiseIsSubjectToCooldown() {
        EmergencyManager manager = new EmergencyManager(null, FAST_FAILURE_RATE);
        Optional<EmergencyEvent> first = manager.raise(EmergencyType.DOWNTIME, Set.of("worker-1"), 600d, 0L);
        Optional<EmergencyEvent> second = manager.raise(EmergencyType.DOWNTIME, Set.of("worker-2"), 900d, 1_000L);

        Assertions.assertTrue(first.isPresent());
        Assertions.assertTrue(second.isEmpty());
        Assertions.assertEquals(Set.of("worker-1"), first.get().affectedAgents());
        Assertions.assertEquals(1L, manager.statistics().raisedByType().get(EmergencyType.DOWNTIME));
    }

    @Test
    void interventionStopsAtFirstSuccessfulStepAndPublishesLifecycle() throws Exception {
        Path root = Files.createTempDirectory("opsmesh-test-emergency-");
        try (MessageBus bus = new MessageBus()) {
            List<Message> raised = Collections.synchronizedList(new ArrayList<>());
            List<Message> resolved = Collections.synchronizedList(new ArrayList<>());
            bus.subscribe(Topics.EMERGENCY_RAISED, raised::add);
            bus.subscribe(Topics.EMERGENCY_RESOLVED, resolved::add);
            AuditLogger audit = new AuditLogger(root.resolve("audit.log"), "");
            EmergencyManager manager = new EmergencyManager(bus, FAST_FAILURE_RATE, null, audit, () -> 42L);
            List<InterventionProtocol> invoked = new ArrayList<>();
            manager.setProtocol(EmergencyType.FAILURE_RATE, List.of(
                    new InterventionStep(InterventionProtocol.ACTIVATE_FALLBACK, event -> {
                        invoked.add(InterventionProtocol.ACTIVATE_FALLBACK);
                        throw new IllegalStateException("fallback offline");
                    }),
                    new InterventionStep(InterventionProtocol.REDUCE_LOAD, event -> {
                        invoked.add(InterventionProtocol.REDUCE_LOAD);
                        return InterventionStep.StepOutcome.fail(InterventionProtocol.REDUCE_LOAD, "no capacity");
                    }),
                    new InterventionStep(InterventionProtocol.THROTTLE_REQUESTS, event -> {
                        invoked.add(InterventionProtocol.THROTTLE_REQUESTS);
                        return InterventionStep.StepOutcome.ok(InterventionProtocol.THROTTLE_REQUESTS, "throttled");
                    }),
                    new InterventionStep(InterventionProtocol.ESCALATE_TO_HUMAN, event -> {
                        invoked.add(InterventionProtocol.ESCALATE_TO_HUMAN);
                        return InterventionStep.StepOutcome.ok(InterventionProtocol.ESCALATE_TO_HUMAN, "paged");
                    })
            ));

            EmergencyEvent event = manager.raise(EmergencyType.FAILURE_RATE, Set.of("worker-1"), 0.6d, 0L).orElseThrow();
            InterventionResult result = manager.intervene(event);

            Assertions.assertTrue(result.succeeded());
            Assertions.assertEquals(InterventionProtocol.THROTTLE_REQUESTS, result.resolvedBy());
            Assertions.assertEquals(3, result.attempts().size());
            Assertions.assertEquals(List.of(InterventionProtocol.ACTIVATE_FALLBACK, InterventionProtocol.REDUCE_LOAD,
                    InterventionProtocol.THROTTLE_REQUESTS), invoked);
            Assertions.assertTrue(manager.activeEmergencies().isEmpty());

            Assertions.assertTrue(bus.awaitIdle(5_000L));
            Assertions.assertEquals(1, raised.size());
            Assertions.assertEquals(1, resolved.size());
            JsonNode payload = resolved.get(0).payload();
            Assertions.assertEquals(event.id(), payload.path("emergency_id").asText());
            Assertions.assertTrue(payload.path("handled").asBoolean());
            Assertions.assertEquals("throttle_requests", payload.path("resolved_by").asText());

            List<String> actions = new ArrayList<>();
            for (JsonNode row : audit.tail(10)) {
                actions.add(row.path("action").asText());
            }
            Assertions.assertEquals(List.of("emergency.detect", "emergency.intervene"), actions);
            Assertions.assertTrue(audit.verify().ok());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void unhandledEmergencyStaysActiveUntilResolved() {
        EmergencyManager manager = new EmergencyManager(null, FAST_FAILURE_RATE);
        manager.setProtocol(EmergencyType.FAILURE_RATE, List.of(
                new InterventionStep(InterventionProtocol.REDUCE_LOAD,
                        event -> InterventionStep.StepOutcome.fail(InterventionProtocol.REDUCE_LOAD, "no capacity"))));

        EmergencyEvent event = manager.raise(EmergencyType.FAILURE_RATE, Set.of(), 0.6d, 0L).orElseThrow();
        InterventionResult result = manager.intervene(event);

        Assertions.assertFalse(result.succeeded());
        Assertions.assertNull(result.resolvedBy());
        Assertions.assertEquals(1, manager.activeEmergencies().size());
        Assertions.assertTrue(manager.resolve(event.id(), "fixed by hand", 100L));
        Assertions.assertFalse(manager.resolve(event.id(), "again", 200L));

        EmergencyManager.Statistics stats = manager.statistics();
        Assertions.assertEquals(1L, stats.interventionsFailed());
        Assertions.assertEquals(1L, stats.resolved());
        Assertions.assertEquals(0, stats.active());
        Assertions.assertEquals(1, manager.history(10).size());
    }

    @Test
    void defaultDowntimeProtocolFallsThroughRestartWithoutAgents() throws Exception {
        try (MessageBus bus = new MessageBus()) {
            List<Message> commands = Collections.synchronizedList(new ArrayList<>());
            bus.subscribe(Topics.AGENT_COMMAND, commands::add);
            EmergencyManager manager = new EmergencyManager(bus, EmergencyThreshold.defaults());

            EmergencyEvent event = manager.raise(EmergencyType.DOWNTIME, Set.of(), 400d, 0L).orElseThrow();
            InterventionResult result = manager.intervene(event);

            Assertions.assertTrue(result.succeeded());
            Assertions.assertEquals(InterventionProtocol.REDISTRIBUTE_WORKLOAD, result.resolvedBy());
            Assertions.assertFalse(result.attempts().get(0).success());
            Assertions.assertTrue(bus.awaitIdle(5_000L));
            Assertions.assertEquals(1, commands.size());
            Assertions.assertEquals("redistribute_workload", commands.get(0).payload().path("command").asText());
            Assertions.assertNull(commands.get(0).recipientId());
        }
    }

    @Test
    void defaultProtocolTargetsEachAffectedAgent() throws Exception {
        try (MessageBus bus = new MessageBus()) {
            List<Message> toA = Collections.synchronizedList(new ArrayList<>());
            List<Message> toB = Collections.synchronizedList(new ArrayList<>());
            bus.subscribe(Topics.AGENT_COMMAND, "worker-a", toA::add);
            bus.subscribe(Topics.AGENT_COMMAND, "worker-b", toB::add);
            EmergencyManager manager = new EmergencyManager(bus, EmergencyThreshold.defaults());

            EmergencyEvent event = manager.raise(EmergencyType.DOWNTIME, Set.of("worker-a"), 400d, 0L).orElseThrow();
            InterventionResult result = manager.intervene(event);

            Assertions.assertEquals(InterventionProtocol.RESTART_AGENTS, result.resolvedBy());
            Assertions.assertTrue(bus.awaitIdle(5_000L));
            Assertions.assertEquals(1, toA.size());
            Assertions.assertEquals("restart_agents", toA.get(0).payload().path("command").asText());
            Assertions.assertTrue(toB.isEmpty());
        }
    }

    private static MetricsSnapshot failureRate(long at, double value) {
        return MetricsSnapshot.of(at, Map.of(EmergencyThreshold.METRIC_FAILURE_RATE, value));
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
