package io.opsmesh.supervisor;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.opsmesh.agent.AgentRegistration;
import io.opsmesh.agent.AgentRegistry;
import io.opsmesh.agent.AgentStatus;
import io.opsmesh.agent.HealthReport;
import io.opsmesh.bridge.BridgeHealth;
import io.opsmesh.bridge.DeliveryOutcome;
import io.opsmesh.bridge.IntegrationBridge;
import io.opsmesh.bus.MessageBus;
import io.opsmesh.bus.Topics;
import io.opsmesh.conflict.ActionRequest;
import io.opsmesh.conflict.ConflictRecord;
import io.opsmesh.conflict.ConflictResolver;
import io.opsmesh.conflict.RequestOutcome;
import io.opsmesh.emergency.EmergencyEvent;
import io.opsmesh.emergency.EmergencyManager;
import io.opsmesh.emergency.EmergencyThreshold;
import io.opsmesh.emergency.EmergencyType;
import io.opsmesh.emergency.MetricsSnapshot;
import io.opsmesh.model.Message;
import io.opsmesh.model.Priority;
import io.opsmesh.observability.AuditLogger;
import io.opsmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;

/**
 * The coordination loop. Each tick runs collect, evaluate, resolve and forward strictly in
 * that order, then sleeps out the rest of the period. A tick that overruns the period is
 * logged and the next one starts at once; no phase is skipped. A failing phase is logged and
 * counted and the remaining phases still run.
 *
 * <p>Interventions for fired emergencies run on a separate single worker so protocol steps
 * (restarts, escalation, reasoning calls) never stall the tick.
 */
public final class OperationalSupervisor implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(OperationalSupervisor.class);
    public static final String PHASE_COLLECT = "collect";
    public static final String PHASE_EVALUATE = "evaluate";
    public static final String PHASE_RESOLVE = "resolve";
    public static final String PHASE_FORWARD = "forward";
    private static final List<String> PHASES = List.of(PHASE_COLLECT, PHASE_EVALUATE, PHASE_RESOLVE, PHASE_FORWARD);
    private static final String SENDER = "operational-supervisor";
    static final String IMPROVEMENT_CONTRACT_VERSION = "1.1";

    private final MessageBus bus;
    private final AgentRegistry registry;
    private final EmergencyManager emergencies;
    private final ConflictResolver conflicts;
    private final IntegrationBridge bridge;
    private final MetricsSource metricsSource;
    private final AuditLogger auditLogger;
    private final long tickPeriodMs;
    private final long shutdownGraceMs;
    private final LongSupplier clock;
    private final ConcurrentLinkedQueue<ActionRequest> pendingRequests = new ConcurrentLinkedQueue<>();
    private final List<String> subscriptions = new ArrayList<>();
    private final ExecutorService interventionExecutor;

    private final Object metricsLock = new Object();
    private long cycles;
    private long overruns;
    private long phaseErrors;
    private long totalCycleMs;
    private final Map<String, Long> totalPhaseMs = new LinkedHashMap<>();
    private long totalConflicts;
    private long totalEmergencies;
    private long lastCycleAtMs;
    private long interventionsDispatched;
    private long failedInterventions;
    private long failedForwards;

    private volatile boolean running;
    private volatile CountDownLatch stopSignal = new CountDownLatch(1);
    private Thread loopThread;

    public OperationalSupervisor(
            MessageBus bus,
            AgentRegistry registry,
            EmergencyManager emergencies,
            ConflictResolver conflicts,
            IntegrationBridge bridge,
            MetricsSource metricsSource,
            AuditLogger auditLogger,
            long tickPeriodMs,
            long shutdownGraceMs,
            LongSupplier clock
    ) {
        this.bus = bus;
        this.registry = registry;
        this.emergencies = emergencies;
        this.conflicts = conflicts;
        this.bridge = bridge;
        this.metricsSource = metricsSource;
        this.auditLogger = auditLogger;
        this.tickPeriodMs = Math.max(1L, tickPeriodMs);
        this.shutdownGraceMs = Math.max(0L, shutdownGraceMs);
        this.clock = clock == null ? System::currentTimeMillis : clock;
        for (String phase : PHASES) {
            totalPhaseMs.put(phase, 0L);
        }
        this.interventionExecutor = Executors.newSingleThreadExecutor(r -> {
            Thread thread = new Thread(r, "opsmesh-interventions");
            thread.setDaemon(true);
            return thread;
        });
    }

    public synchronized void start() {
        if (running) {
            return;
        }
        subscriptions.add(bus.subscribe(Topics.AGENT_ACTION, SENDER, this::onActionMessage));
        subscriptions.add(bus.subscribe(Topics.DEPLOYMENT_NOTIFICATION, SENDER, this::onDeployment));
        stopSignal = new CountDownLatch(1);
        running = true;
        loopThread = new Thread(this::loop, "opsmesh-supervisor");
        loopThread.setDaemon(true);
        loopThread.start();
        log.info("Supervisor started (tick {} ms)", tickPeriodMs);
    }

    public boolean stop() {
        return stop(shutdownGraceMs);
    }

    /**
     * Signals the loop to stop after the in-flight phase and waits up to {@code graceMs}.
     * A loop still running after that is interrupted.
     *
     * @return {@code true} when the loop drained within the grace period
     */
    public boolean stop(long graceMs) {
        Thread thread;
        synchronized (this) {
            if (!running) {
                return true;
            }
            running = false;
            stopSignal.countDown();
            thread = loopThread;
            loopThread = null;
            for (String id : subscriptions) {
                bus.unsubscribe(id);
            }
            subscriptions.clear();
        }
        boolean graceful = true;
        try {
            thread.join(Math.max(1L, graceMs));
            if (thread.isAlive()) {
                graceful = false;
                log.warn("Supervisor did not drain within {} ms, forcing stop", graceMs);
                thread.interrupt();
                thread.join(1_000L);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            thread.interrupt();
            graceful = false;
        }
        log.info("Supervisor stopped ({})", graceful ? "graceful" : "forced");
        return graceful;
    }

    /**
     * Waits until every intervention dispatched so far has finished.
     */
    public boolean awaitInterventions(long timeoutMs) throws InterruptedException {
        try {
            interventionExecutor.submit(() -> { }).get(Math.max(1L, timeoutMs), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            throw new IllegalStateException("Intervention barrier failed", e.getCause());
        }
    }

    @Override
    public void close() {
        stop();
        interventionExecutor.shutdown();
        try {
            if (!interventionExecutor.awaitTermination(Math.max(1L, shutdownGraceMs), TimeUnit.MILLISECONDS)) {
                log.warn("Interventions still running after {} ms, interrupting", shutdownGraceMs);
                interventionExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            interventionExecutor.shutdownNow();
        }
    }

    public boolean isRunning() {
        return running;
    }

    public AgentRegistration register(String agentId, Collection<String> capabilities) {
        return registry.register(agentId, capabilities, clock.getAsLong());
    }

    public AgentRegistration heartbeat(String agentId, long timestampMs, Map<String, Double> metrics) {
        return registry.heartbeat(agentId, timestampMs, metrics);
    }

    public boolean deregister(String agentId) {
        return registry.deregister(agentId, clock.getAsLong());
    }

    /**
     * Queues a request for the next resolve phase.
     */
    public void submitActionRequest(ActionRequest request) {
        pendingRequests.add(request);
    }

    public int pendingActionRequests() {
        return pendingRequests.size();
    }

    /**
     * Runs one tick's phases in order. Exposed so callers can drive the loop with their own clock.
     */
    public CycleReport runCycle(long nowMs) {
        long cycleStarted = System.nanoTime();
        Map<String, Long> durations = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();

        HealthReport health = null;
        MetricsSnapshot snapshot = null;
        long phaseStarted = System.nanoTime();
        try {
            health = registry.collectHealth(nowMs);
            snapshot = snapshot(nowMs);
        } catch (RuntimeException e) {
            phaseFailed(PHASE_COLLECT, e, errors);
        }
        durations.put(PHASE_COLLECT, elapsedMs(phaseStarted));

        List<EmergencyEvent> fired = new ArrayList<>();
        int dispatched = 0;
        phaseStarted = System.nanoTime();
        try {
            emergencies.expireCooldowns(nowMs);
            if (snapshot != null) {
                fired.addAll(emergencies.evaluate(snapshot));
            }
            if (health != null && !health.newlyOffline().isEmpty()) {
                double silenceSeconds = maxSilenceSeconds(health.newlyOffline(), nowMs);
                emergencies.raise(EmergencyType.DOWNTIME, health.newlyOffline(), silenceSeconds, nowMs)
                        .ifPresent(fired::add);
            }
            for (EmergencyEvent event : fired) {
                dispatchIntervention(event);
                dispatched++;
            }
        } catch (RuntimeException e) {
            phaseFailed(PHASE_EVALUATE, e, errors);
        }
        durations.put(PHASE_EVALUATE, elapsedMs(phaseStarted));

        List<ConflictRecord> resolved = new ArrayList<>();
        int uncontested = 0;
        phaseStarted = System.nanoTime();
        try {
            List<ActionRequest> requests = drainRequests();
            if (!requests.isEmpty()) {
                ConflictResolver.Detection detection = conflicts.detect(requests);
                for (List<ActionRequest> group : detection.conflicts()) {
                    ConflictRecord record = conflicts.resolve(group, nowMs);
                    resolved.add(record);
                    publishConflict(record, nowMs);
                    publishCommand(record.resolution(), record.resourceId(), record.winningSourceId(), record.id(), nowMs);
                }
                for (ActionRequest request : detection.uncontested()) {
                    publishCommand(request.action(), request.resourceId(), request.sourceId(), null, nowMs);
                    uncontested++;
                }
            }
        } catch (RuntimeException e) {
            phaseFailed(PHASE_RESOLVE, e, errors);
        }
        durations.put(PHASE_RESOLVE, elapsedMs(phaseStarted));

        boolean forwarded = false;
        phaseStarted = System.nanoTime();
        try {
            if (bridge != null) {
                publishBridgeHealth(bridge.health(), nowMs);
                if (bridge.validatorConfigured() && (!fired.isEmpty() || !resolved.isEmpty())) {
                    Message trigger = improvementTrigger(fired, resolved, snapshot, nowMs);
                    bridge.submit(trigger).whenComplete((outcome, error) -> onForwardComplete(trigger, outcome, error));
                    forwarded = true;
                }
            }
        } catch (RuntimeException e) {
            phaseFailed(PHASE_FORWARD, e, errors);
        }
        durations.put(PHASE_FORWARD, elapsedMs(phaseStarted));

        long durationMs = elapsedMs(cycleStarted);
        boolean overrun = durationMs > tickPeriodMs;
        long cycle;
        synchronized (metricsLock) {
            cycle = ++cycles;
            if (overrun) {
                overruns++;
            }
            phaseErrors += errors.size();
            totalCycleMs += durationMs;
            for (Map.Entry<String, Long> e : durations.entrySet()) {
                totalPhaseMs.merge(e.getKey(), e.getValue(), Long::sum);
            }
            totalConflicts += resolved.size();
            totalEmergencies += fired.size();
            interventionsDispatched += dispatched;
            lastCycleAtMs = nowMs;
        }
        if (overrun) {
            log.warn("Cycle {} overran tick period: {} ms > {} ms {}", cycle, durationMs, tickPeriodMs, durations);
        }
        return new CycleReport(cycle, nowMs, durationMs, overrun, Map.copyOf(durations), health, List.copyOf(fired),
                dispatched, List.copyOf(resolved), uncontested, forwarded, List.copyOf(errors));
    }

    public CycleMetrics metrics() {
        synchronized (metricsLock) {
            Map<String, Double> avgPhase = new LinkedHashMap<>();
            for (Map.Entry<String, Long> e : totalPhaseMs.entrySet()) {
                avgPhase.put(e.getKey(), cycles == 0L ? 0.0d : (double) e.getValue() / cycles);
            }
            return new CycleMetrics(
                    cycles,
                    overruns,
                    phaseErrors,
                    cycles == 0L ? 0.0d : (double) totalCycleMs / cycles,
                    avgPhase,
                    totalConflicts,
                    totalEmergencies,
                    cycles == 0L ? 0.0d : (double) totalConflicts / cycles,
                    cycles == 0L ? 0.0d : (double) totalEmergencies / cycles,
                    lastCycleAtMs,
                    interventionsDispatched,
                    failedInterventions,
                    failedForwards
            );
        }
    }

    public long tickPeriodMs() {
        return tickPeriodMs;
    }

    private void loop() {
        while (running) {
            long started = System.nanoTime();
            try {
                runCycle(clock.getAsLong());
            } catch (RuntimeException e) {
                // runCycle contains its phases; this only guards the bookkeeping around them.
                log.error("Coordination cycle failed", e);
                synchronized (metricsLock) {
                    phaseErrors++;
                }
            }
            long remaining = tickPeriodMs - elapsedMs(started);
            if (remaining <= 0L) {
                continue;
            }
            try {
                if (stopSignal.await(remaining, TimeUnit.MILLISECONDS)) {
                    break;
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
    }

    private void dispatchIntervention(EmergencyEvent event) {
        CompletableFuture.supplyAsync(() -> emergencies.intervene(event), interventionExecutor)
                .whenComplete((result, error) -> {
                    if (error == null) {
                        return;
                    }
                    log.error("Intervention for emergency {} failed", event.id(), unwrap(error));
                    synchronized (metricsLock) {
                        failedInterventions++;
                    }
                });
    }

    private void onForwardComplete(Message trigger, DeliveryOutcome outcome, Throwable error) {
        if (error != null) {
            log.error("Forwarding {} to validator failed", trigger.id(), unwrap(error));
            synchronized (metricsLock) {
                failedForwards++;
            }
            return;
        }
        if (outcome != null && outcome.status() == DeliveryOutcome.Status.DEAD_LETTERED) {
            log.warn("Forwarded {} ended in dead letters: {}", trigger.id(), outcome.reason());
        }
    }

    private static Throwable unwrap(Throwable error) {
        return error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    }

    private MetricsSnapshot snapshot(long nowMs) {
        Map<String, Double> sums = new TreeMap<>();
        Map<String, Integer> counts = new HashMap<>();
        Map<String, Set<String>> contributors = new HashMap<>();
        for (Map.Entry<String, Map<String, Double>> agent : registry.reportedMetrics().entrySet()) {
            for (Map.Entry<String, Double> metric : agent.getValue().entrySet()) {
                if (metric.getValue() == null || metric.getValue().isNaN()) {
                    continue;
                }
                sums.merge(metric.getKey(), metric.getValue(), Double::sum);
                counts.merge(metric.getKey(), 1, Integer::sum);
                contributors.computeIfAbsent(metric.getKey(), k -> new HashSet<>()).add(agent.getKey());
            }
        }
        Map<String, Double> values = new LinkedHashMap<>();
        for (Map.Entry<String, Double> e : sums.entrySet()) {
            // Rate-limit hits are counts, everything else is averaged across agents.
            values.put(e.getKey(), EmergencyThreshold.METRIC_RATE_LIMIT.equals(e.getKey())
                    ? e.getValue()
                    : e.getValue() / counts.get(e.getKey()));
        }
        Set<String> offline = new HashSet<>();
        double downtimeSeconds = 0.0d;
        for (AgentRegistration registration : registry.list()) {
            if (registration.status() == AgentStatus.OFFLINE) {
                offline.add(registration.agentId());
                downtimeSeconds = Math.max(downtimeSeconds, registration.silenceMs(nowMs) / 1000.0d);
            }
        }
        values.put(EmergencyThreshold.METRIC_DOWNTIME, downtimeSeconds);
        contributors.put(EmergencyThreshold.METRIC_DOWNTIME, offline);
        if (metricsSource != null) {
            Map<String, Double> extra = metricsSource.sample(nowMs);
            if (extra != null) {
                values.putAll(extra);
            }
        }
        return new MetricsSnapshot(nowMs, values, contributors);
    }

    private double maxSilenceSeconds(List<String> agentIds, long nowMs) {
        double max = 0.0d;
        for (String id : agentIds) {
            max = Math.max(max, registry.find(id).map(r -> r.silenceMs(nowMs) / 1000.0d).orElse(0.0d));
        }
        return max;
    }

    private List<ActionRequest> drainRequests() {
        List<ActionRequest> out = new ArrayList<>();
        ActionRequest next;
        while ((next = pendingRequests.poll()) != null) {
            out.add(next);
        }
        return out;
    }

    private void onActionMessage(Message message) {
        JsonNode payload = message.payload();
        if (payload == null || !payload.isObject()) {
            throw new IllegalArgumentException("agent.action payload must be an object");
        }
        String source = payload.path("source_id").asText(message.senderId());
        submitActionRequest(new ActionRequest(
                source,
                payload.path("resource_id").asText(null),
                payload.path("action").asText(null),
                payload.path("priority_score").asDouble(0.0d),
                payload.path("requested_at_ms").asLong(message.createdAtMs())
        ));
    }

    private void onDeployment(Message message) {
        JsonNode payload = message.payload();
        ObjectNode command = Jsons.object();
        command.put("command", "apply_deployment");
        command.put("deployment_id", payload.path("deployment_id").asText());
        command.put("status", payload.path("status").asText());
        if (payload.hasNonNull("prompt_version")) {
            command.put("prompt_version", payload.path("prompt_version").asText());
        }
        command.put("source_message_id", message.id());
        long now = clock.getAsLong();
        JsonNode targets = payload.path("target_agents");
        if (targets.isArray() && targets.size() > 0) {
            for (JsonNode target : targets) {
                bus.publish(Message.create(Topics.AGENT_COMMAND, command, Priority.HIGH, SENDER, now, 0L)
                        .withRecipient(target.asText()));
            }
        } else {
            bus.publish(Message.create(Topics.AGENT_COMMAND, command, Priority.HIGH, SENDER, now, 0L));
        }
        log.info("Deployment {} ({}) forwarded to agents", payload.path("deployment_id").asText(), payload.path("status").asText());
    }

    private void publishConflict(ConflictRecord record, long nowMs) {
        ObjectNode payload = Jsons.object();
        payload.put("conflict_id", record.id());
        payload.put("resource_id", record.resourceId());
        payload.put("resolution", record.resolution());
        payload.put("winner", record.winningSourceId());
        payload.put("resolved_at_ms", record.resolvedAtMs());
        ArrayNode requests = payload.putArray("requests");
        for (RequestOutcome outcome : record.competingRequests()) {
            ObjectNode row = requests.addObject();
            row.put("source_id", outcome.request().sourceId());
            row.put("action", outcome.request().action());
            row.put("priority_score", outcome.request().priorityScore());
            row.put("requested_at_ms", outcome.request().requestedAtMs());
            row.put("rank", outcome.rank());
            row.put("won", outcome.won());
            row.put("reason", outcome.reason());
        }
        bus.publish(Message.create(Topics.CONFLICT_RESOLVED, payload, Priority.HIGH, SENDER, nowMs, 0L));
        if (auditLogger != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("resource_id", record.resourceId());
            details.put("resolution", record.resolution());
            details.put("winner", record.winningSourceId());
            List<String> losers = new ArrayList<>();
            for (RequestOutcome loser : record.losers()) {
                losers.add(loser.request().sourceId() + ":" + loser.request().action() + ":" + loser.reason());
            }
            details.put("losers", losers);
            auditLogger.log(AuditLogger.AuditEvent.of("conflict.resolve", SENDER, record.id(), "resolved", details));
        }
    }

    private void publishCommand(String action, String resourceId, String sourceId, String conflictId, long nowMs) {
        ObjectNode payload = Jsons.object();
        payload.put("command", action);
        payload.put("resource_id", resourceId);
        payload.put("requested_by", sourceId);
        if (conflictId != null) {
            payload.put("conflict_id", conflictId);
        }
        bus.publish(Message.create(Topics.AGENT_COMMAND, payload, Priority.NORMAL, SENDER, nowMs, 0L));
    }

    private void publishBridgeHealth(BridgeHealth health, long nowMs) {
        ObjectNode payload = (ObjectNode) Jsons.valueToTree(health);
        bus.publish(Message.create(Topics.BRIDGE_HEALTH, payload, Priority.LOW, SENDER, nowMs, tickPeriodMs * 5L));
    }

    private Message improvementTrigger(
            List<EmergencyEvent> fired,
            List<ConflictRecord> resolved,
            MetricsSnapshot snapshot,
            long nowMs
    ) {
        ObjectNode payload = Jsons.object();
        payload.put("trigger_type", fired.isEmpty() ? "conflict_summary" : "emergency");
        ObjectNode performance = payload.putObject("performance_data");
        if (snapshot != null) {
            for (Map.Entry<String, Double> e : snapshot.values().entrySet()) {
                performance.put(e.getKey(), e.getValue());
            }
        }
        payload.put("timestamp", Instant.ofEpochMilli(nowMs).toString());
        Set<String> affected = new HashSet<>();
        double maxSeverity = 0.0d;
        ArrayNode emergencyRows = payload.putArray("emergencies");
        for (EmergencyEvent event : fired) {
            affected.addAll(event.affectedAgents());
            maxSeverity = Math.max(maxSeverity, event.severity());
            ObjectNode row = emergencyRows.addObject();
            row.put("emergency_id", event.id());
            row.put("type", event.type().label());
            row.put("severity", event.severity());
            row.put("metric", event.metricName());
            row.put("observed", event.observedValue());
        }
        ArrayNode conflictRows = payload.putArray("conflicts");
        for (ConflictRecord record : resolved) {
            ObjectNode row = conflictRows.addObject();
            row.put("conflict_id", record.id());
            row.put("resource_id", record.resourceId());
            row.put("resolution", record.resolution());
            row.put("winner", record.winningSourceId());
            row.put("competing", record.competingRequests().size());
        }
        ArrayNode affectedRows = payload.putArray("affected_agents");
        affected.stream().sorted().forEach(affectedRows::add);
        payload.put("severity", severityLabel(maxSeverity));
        synchronized (metricsLock) {
            payload.put("cycle", cycles + 1);
        }
        return Message.create(Topics.IMPROVEMENT_TRIGGER, payload, Priority.HIGH, SENDER, nowMs, 0L)
                .withContractVersion(IMPROVEMENT_CONTRACT_VERSION);
    }

    private static String severityLabel(double severity) {
        if (severity >= 0.9d) {
            return "critical";
        }
        if (severity >= 0.7d) {
            return "high";
        }
        if (severity >= 0.4d) {
            return "medium";
        }
        return "low";
    }

    private void phaseFailed(String phase, RuntimeException e, List<String> errors) {
        log.error("Phase {} failed, continuing", phase, e);
        errors.add(phase + ": " + e);
    }

    private static long elapsedMs(long startedNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedNanos);
    }
}
