package io.opsmesh.supervisor;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.opsmesh.agent.AgentRegistry;
import io.opsmesh.agent.AgentStatus;
import io.opsmesh.bridge.CircuitBreaker;
import io.opsmesh.bridge.ContractRegistry;
import io.opsmesh.bridge.IntegrationBridge;
import io.opsmesh.bridge.RetryPolicy;
import io.opsmesh.bridge.ValidatorClient;
import io.opsmesh.bus.MessageBus;
import io.opsmesh.bus.Topics;
import io.opsmesh.config.OpsMeshConfig;
import io.opsmesh.conflict.ActionRequest;
import io.opsmesh.conflict.ConflictResolver;
import io.opsmesh.decision.ReasoningService;
import io.opsmesh.emergency.EmergencyManager;
import io.opsmesh.emergency.EmergencyThreshold;
import io.opsmesh.emergency.EmergencyType;
import io.opsmesh.emergency.InterventionProtocol;
import io.opsmesh.model.Message;
import io.opsmesh.model.Priority;
import io.opsmesh.storage.Database;
import io.opsmesh.storage.DeadLetterStore;
import io.opsmesh.util.Jsons;
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
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.BooleanSupplier;
import java.util.stream.Stream;

final class OperationalSupervisorTest {

    @Test
    void silentAgentRaisesExactlyOneDowntimeEmergency() throws Exception {
        AtomicLong clock = new AtomicLong(0L);
        try (MessageBus bus = new MessageBus(100, 2, 1, clock::get)) {
            List<Message> raised = Collections.synchronizedList(new ArrayList<>());
            List<Message> restarts = Collections.synchronizedList(new ArrayList<>());
            bus.subscribe(Topics.EMERGENCY_RAISED, raised::add);
            bus.subscribe(Topics.AGENT_COMMAND, "worker-1", restarts::add);
            AgentRegistry registry = new AgentRegistry(bus, 1_000L, 3, 100);
            EmergencyManager emergencies = new EmergencyManager(bus, EmergencyThreshold.defaults(), null, null, clock::get);
            OperationalSupervisor supervisor = new OperationalSupervisor(bus, registry, emergencies,
                    new ConflictResolver(), null, null, null, 1_000L, 1_000L, clock::get);

            supervisor.register("worker-1", Set.of("deploy"));
            supervisor.register("worker-2", Set.of("deploy"));
            for (long t = 1_000L; t <= 12_000L; t += 1_000L) {
                clock.set(t);
                supervisor.heartbeat("worker-2", t, Map.of("call_failure_rate", 0.01d));
                CycleReport report = supervisor.runCycle(t);
                Assertions.assertTrue(report.phaseErrors().isEmpty(), report.phaseErrors().toString());
            }

            Assertions.assertTrue(supervisor.awaitInterventions(5_000L));
            Assertions.assertTrue(bus.awaitIdle(5_000L));
            Assertions.assertEquals(1, raised.size());
            Assertions.assertEquals(EmergencyType.DOWNTIME.label(), raised.get(0).payload().path("type").asText());
            Assertions.assertEquals("worker-1", raised.get(0).payload().path("affected_agents").get(0).asText());
            Assertions.assertEquals(1, restarts.size());
            Assertions.assertEquals(InterventionProtocol.RESTART_AGENTS.label(), restarts.get(0).payload().path("command").asText());
            Assertions.assertEquals(AgentStatus.OFFLINE, registry.find("worker-1").orElseThrow().status());
            Assertions.assertEquals(AgentStatus.ACTIVE, registry.find("worker-2").orElseThrow().status());

            CycleMetrics metrics = supervisor.metrics();
            Assertions.assertEquals(12L, metrics.cycles());
            Assertions.assertEquals(1L, metrics.totalEmergencies());
            Assertions.assertEquals(1L, emergencies.statistics().raised());
            Assertions.assertEquals(1L, metrics.interventionsDispatched());
            Assertions.assertEquals(0L, metrics.failedInterventions());
            supervisor.close();
        }
    }

    @Test
    void slowReasoningRunsOnInterventionWorkerAndNeverStallsTheLoop() throws Exception {
        AtomicLong clock = new AtomicLong(0L);
        List<String> reasoningThreads = Collections.synchronizedList(new ArrayList<>());
        ReasoningService slow = (purpose, context, timeout) -> {
            reasoningThreads.add(purpose + "@" + Thread.currentThread().getName());
            Thread.sleep(1_500L);
            return "0.95";
        };
        try (MessageBus bus = new MessageBus(100, 2, 1, clock::get)) {
            List<Message> raised = Collections.synchronizedList(new ArrayList<>());
            bus.subscribe(Topics.EMERGENCY_RAISED, raised::add);
            AgentRegistry registry = new AgentRegistry(bus, 1_000L, 3, 100);
            EmergencyManager emergencies = new EmergencyManager(bus, EmergencyThreshold.defaults(), slow, null, clock::get);
            OperationalSupervisor supervisor = new OperationalSupervisor(bus, registry, emergencies,
                    new ConflictResolver(), null, null, null, 1_000L, 5_000L, clock::get);

            supervisor.register("worker-1", Set.of("deploy"));
            int dispatched = 0;
            for (long t = 1_000L; t <= 12_000L; t += 1_000L) {
                clock.set(t);
                CycleReport report = supervisor.runCycle(t);
                dispatched += report.interventionsDispatched();
                Assertions.assertFalse(report.overrun(), "cycle " + report.cycle() + " overran: " + report.phaseDurationsMs());
                Assertions.assertTrue(report.phaseDurationsMs().get(OperationalSupervisor.PHASE_EVALUATE) < 1_000L);
            }
            Assertions.assertEquals(1, dispatched);
            Assertions.assertEquals(0L, supervisor.metrics().overruns());

            Assertions.assertTrue(supervisor.awaitInterventions(10_000L));
            Assertions.assertTrue(bus.awaitIdle(5_000L));
            Assertions.assertFalse(reasoningThreads.isEmpty());
            for (String call : reasoningThreads) {
                Assertions.assertTrue(call.endsWith("@opsmesh-interventions"), call);
            }
            Assertions.assertEquals(1, raised.size());
            Assertions.assertEquals("reasoning", raised.get(0).payload().path("severity_source").asText());
            supervisor.close();
        }
    }

    @Test
    void contradictoryRequestsAreResolvedAndOthersPassThrough() throws Exception {
        try (MessageBus bus = new MessageBus()) {
            List<Message> resolved = Collections.synchronizedList(new ArrayList<>());
            List<Message> commands = Collections.synchronizedList(new ArrayList<>());
            bus.subscribe(Topics.CONFLICT_RESOLVED, resolved::add);
            bus.subscribe(Topics.AGENT_COMMAND, commands::add);
            OperationalSupervisor supervisor = supervisor(bus, null, null);

            supervisor.submitActionRequest(new ActionRequest("scaler", "api", "scale_up", 0.8d, 10L));
            supervisor.submitActionRequest(new ActionRequest("saver", "api", "scale_down", 0.3d, 5L));
            supervisor.submitActionRequest(new ActionRequest("janitor", "cache", "flush", 0.1d, 7L));
            Assertions.assertEquals(3, supervisor.pendingActionRequests());

            CycleReport report = supervisor.runCycle(System.currentTimeMillis());

            Assertions.assertEquals(0, supervisor.pendingActionRequests());
            Assertions.assertEquals(1, report.conflicts().size());
            Assertions.assertEquals("scale_up", report.conflicts().get(0).resolution());
            Assertions.assertEquals(1, report.uncontestedCommands());
            Assertions.assertTrue(bus.awaitIdle(5_000L));
            Assertions.assertEquals(1, resolved.size());
            Assertions.assertEquals("scaler", resolved.get(0).payload().path("winner").asText());
            List<String> issued = new ArrayList<>();
            for (Message command : commands) {
                issued.add(command.payload().path("command").asText());
            }
            Collections.sort(issued);
            Assertions.assertEquals(List.of("flush", "scale_up"), issued);
            Assertions.assertEquals(1.0d, supervisor.metrics().conflictsPerCycle(), 1e-9);
        }
    }

    @Test
    void failingPhaseIsCountedAndLaterPhasesStillRun() throws Exception {
        try (MessageBus bus = new MessageBus()) {
            MetricsSource broken = nowMs -> {
                throw new IllegalStateException("metrics backend down");
            };
            OperationalSupervisor supervisor = supervisor(bus, null, broken);
            supervisor.submitActionRequest(new ActionRequest("a", "db", "vacuum", 0.5d, 1L));
            supervisor.submitActionRequest(new ActionRequest("b", "db", "reindex", 0.6d, 1L));

            CycleReport report = supervisor.runCycle(System.currentTimeMillis());

            Assertions.assertEquals(1, report.phaseErrors().size());
            Assertions.assertTrue(report.phaseErrors().get(0).startsWith(OperationalSupervisor.PHASE_COLLECT));
            Assertions.assertEquals(1, report.conflicts().size());
            Assertions.assertEquals(Set.of(OperationalSupervisor.PHASE_COLLECT, OperationalSupervisor.PHASE_EVALUATE,
                    OperationalSupervisor.PHASE_RESOLVE, OperationalSupervisor.PHASE_FORWARD), report.phaseDurationsMs().keySet());
            Assertions.assertEquals(1L, supervisor.metrics().phaseErrors());
        }
    }

    @Test
    void slowCycleIsReportedAsOverrun() throws Exception {
        try (MessageBus bus = new MessageBus()) {
            MetricsSource slow = nowMs -> {
                try {
                    Thread.sleep(40L);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return Map.of();
            };
            OperationalSupervisor supervisor = new OperationalSupervisor(bus, new AgentRegistry(bus),
                    new EmergencyManager(bus, EmergencyThreshold.defaults()), new ConflictResolver(), null, slow, null,
                    10L, 1_000L, System::currentTimeMillis);

            CycleReport report = supervisor.runCycle(System.currentTimeMillis());

            Assertions.assertTrue(report.overrun());
            Assertions.assertEquals(1L, supervisor.metrics().overruns());
        }
    }

    @Test
    void forwardsImprovementTriggerAndPublishesBridgeHealth() throws Exception {
        Path root = Files.createTempDirectory("opsmesh-test-supervisor-forward-");
        try (MessageBus bus = new MessageBus()) {
            Database db = new Database(OpsMeshConfig.fromRoot(root.toString()));
            db.init();
            List<Message> sent = Collections.synchronizedList(new ArrayList<>());
            CountDownLatch delivered = new CountDownLatch(1);
            ValidatorClient validator = (message, timeout) -> {
                sent.add(message);
                delivered.countDown();
                return Optional.empty();
            };
            DeadLetterStore store = new DeadLetterStore(db);
            try (IntegrationBridge bridge = new IntegrationBridge("validator-bridge", validator,
                    ContractRegistry.fromClasspath(),
                    new CircuitBreaker("validator-bridge", 3, 1_000L, 1, System::currentTimeMillis),
                    new RetryPolicy(1, 10L, 10L, 0L), 2_000L, store, bus, null, System::currentTimeMillis, null)) {
                List<Message> health = Collections.synchronizedList(new ArrayList<>());
                bus.subscribe(Topics.BRIDGE_HEALTH, health::add);
                OperationalSupervisor supervisor = supervisor(bus, bridge, null);

                CycleReport quiet = supervisor.runCycle(System.currentTimeMillis());
                Assertions.assertFalse(quiet.forwarded());

                supervisor.submitActionRequest(new ActionRequest("a", "db", "vacuum", 0.5d, 1L));
                supervisor.submitActionRequest(new ActionRequest("b", "db", "reindex", 0.6d, 1L));
                CycleReport busy = supervisor.runCycle(System.currentTimeMillis());

                Assertions.assertTrue(busy.forwarded());
                Assertions.assertTrue(delivered.await(5, TimeUnit.SECONDS));
                Message trigger = sent.get(0);
                Assertions.assertEquals(Topics.IMPROVEMENT_TRIGGER, trigger.topic());
                Assertions.assertEquals("1.1", trigger.contractVersion());
                Assertions.assertEquals("conflict_summary", trigger.payload().path("trigger_type").asText());
                Assertions.assertEquals(2, trigger.payload().path("cycle").asInt());
                Assertions.assertEquals(1, trigger.payload().path("conflicts").size());
                waitUntil(() -> bridge.health().processed() == 1L);
                Assertions.assertEquals(0, store.depth());

                Assertions.assertTrue(bus.awaitIdle(5_000L));
                Assertions.assertEquals(2, health.size());
                Assertions.assertEquals(Priority.LOW, health.get(0).priority());
                Assertions.assertEquals("validator-bridge", health.get(0).payload().path("bridgeId").asText());
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void failedForwardIsLoggedAndCounted() throws Exception {
        Path root = Files.createTempDirectory("opsmesh-test-supervisor-forward-failure-");
        MessageBus bridgeBus = new MessageBus();
        try (MessageBus bus = new MessageBus()) {
            Database db = new Database(OpsMeshConfig.fromRoot(root.toString()));
            db.init();
            ObjectNode deployment = Jsons.object();
            deployment.put("deployment_id", "dep-1");
            deployment.put("status", "deployed");
            deployment.put("timestamp", "2026-01-01T00:00:00Z");
            Message reply = Message.create(Topics.DEPLOYMENT_NOTIFICATION, deployment, Priority.NORMAL, "validator",
                    System.currentTimeMillis(), 0L).withContractVersion("1.1");
            ValidatorClient validator = (message, timeout) -> Optional.of(reply);
            // Publishing the reply on a closed bus makes the delivery itself throw.
            bridgeBus.close();
            try (IntegrationBridge bridge = new IntegrationBridge("validator-bridge", validator,
                    ContractRegistry.fromClasspath(),
                    new CircuitBreaker("validator-bridge", 3, 1_000L, 1, System::currentTimeMillis),
                    new RetryPolicy(1, 10L, 10L, 0L), 2_000L, new DeadLetterStore(db), bridgeBus, null,
                    System::currentTimeMillis, null)) {
                OperationalSupervisor supervisor = supervisor(bus, bridge, null);
                supervisor.submitActionRequest(new ActionRequest("a", "db", "vacuum", 0.5d, 1L));
                supervisor.submitActionRequest(new ActionRequest("b", "db", "reindex", 0.6d, 1L));

                CycleReport report = supervisor.runCycle(System.currentTimeMillis());

                Assertions.assertTrue(report.forwarded());
                Assertions.assertTrue(report.phaseErrors().isEmpty());
                waitUntil(() -> supervisor.metrics().failedForwards() == 1L);
                supervisor.close();
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void loopConsumesBusTrafficAndStopsGracefully() throws Exception {
        try (MessageBus bus = new MessageBus()) {
            List<Message> resolved = Collections.synchronizedList(new ArrayList<>());
            List<Message> deployments = Collections.synchronizedList(new ArrayList<>());
            bus.subscribe(Topics.CONFLICT_RESOLVED, resolved::add);
            bus.subscribe(Topics.AGENT_COMMAND, "agent-x", m -> {
                if ("apply_deployment".equals(m.payload().path("command").asText())) {
                    deployments.add(m);
                }
            });
            OperationalSupervisor supervisor = new OperationalSupervisor(bus, new AgentRegistry(bus),
                    new EmergencyManager(bus, EmergencyThreshold.defaults()), new ConflictResolver(), null, null, null,
                    60_000L, 2_000L, System::currentTimeMillis);
            supervisor.start();
            try {
                Assertions.assertTrue(supervisor.isRunning());
                waitUntil(() -> supervisor.metrics().cycles() == 1L);
                bus.publish(Topics.AGENT_ACTION, action("planner", "svc", "restart", 0.9d), Priority.NORMAL, 0L);
                bus.publish(Topics.AGENT_ACTION, action("scaler", "svc", "scale_up", 0.2d), Priority.NORMAL, 0L);

                ObjectNode deployment = Jsons.object();
                deployment.put("deployment_id", "dep-9");
                deployment.put("status", "deployed");
                deployment.put("timestamp", "2026-01-01T00:00:00Z");
                ArrayNode targets = deployment.putArray("target_agents");
                targets.add("agent-x");
                bus.publish(Topics.DEPLOYMENT_NOTIFICATION, deployment, Priority.HIGH, 0L);

                waitUntil(() -> supervisor.pendingActionRequests() == 2 && !deployments.isEmpty());
            } finally {
                Assertions.assertTrue(supervisor.stop());
            }
            Assertions.assertFalse(supervisor.isRunning());
            Assertions.assertEquals("dep-9", deployments.get(0).payload().path("deployment_id").asText());

            CycleReport report = supervisor.runCycle(System.currentTimeMillis());
            Assertions.assertEquals(1, report.conflicts().size());
            Assertions.assertTrue(bus.awaitIdle(5_000L));
            Assertions.assertEquals("restart", resolved.get(0).payload().path("resolution").asText());
            Assertions.assertEquals(2L, supervisor.metrics().cycles());
            Assertions.assertTrue(supervisor.stop());
        }
    }

    private static OperationalSupervisor supervisor(MessageBus bus, IntegrationBridge bridge, MetricsSource source) {
        return new OperationalSupervisor(bus, new AgentRegistry(bus), new EmergencyManager(bus, EmergencyThreshold.defaults()),
                new ConflictResolver(), bridge, source, null, 1_000L, 1_000L, System::currentTimeMillis);
    }

    private static ObjectNode action(String source, String resource, String action, double score) {
        ObjectNode payload = Jsons.object();
        payload.put("source_id", source);
        payload.put("resource_id", resource);
        payload.put("action", action);
        payload.put("priority_score", score);
        return payload;
    }

    private static void waitUntil(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                Assertions.fail("condition not met within 5 s");
            }
            Thread.sleep(10L);
        }
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
