package io.opsmesh.emergency;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.opsmesh.bus.MessageBus;
import io.opsmesh.bus.Topics;
import io.opsmesh.decision.FallbackChain;
import io.opsmesh.decision.ReasoningService;
import io.opsmesh.model.Message;
import io.opsmesh.model.Priority;
import io.opsmesh.observability.AuditLogger;
import io.opsmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.UUID;
import java.util.function.LongSupplier;

/**
 * Threshold detection with dwell and per-type cooldown, plus ordered intervention protocols.
 *
 * <p>A metric must stay above its threshold for the configured dwell before an event fires.
 * Once a type fires it is muted until its cooldown elapses, whether or not the condition
 * persists. {@link #intervene} always publishes an {@code emergency.raised} /
 * {@code emergency.resolved} pair.
 *
 * <p>Detection scores severity from the threshold alone (heuristic, then base). The reasoning
 * service is only consulted from {@link #intervene}, never while this manager's lock is held.
 */
public final class EmergencyManager {
    private static final Logger log = LoggerFactory.getLogger(EmergencyManager.class);
    private static final String SENDER = "emergency-manager";
    private static final int HISTORY_LIMIT = 500;
    private static final Duration SEVERITY_TIMEOUT = Duration.ofSeconds(3);

    private final MessageBus bus;
    private final AuditLogger auditLogger;
    private final LongSupplier clock;
    private final List<EmergencyThreshold> thresholds;
    private final Map<EmergencyType, List<InterventionStep>> protocols;
    private final FallbackChain<SeverityInput, Double> severityChain;
    private final FallbackChain<EmergencyEvent, Double> assessmentChain;

    private final Map<String, Long> breachSince = new HashMap<>();
    private final Map<EmergencyType, Long> cooldownUntil = new EnumMap<>(EmergencyType.class);
    private final Map<String, EmergencyEvent> active = new LinkedHashMap<>();
    private final Deque<EmergencyEvent> history = new ArrayDeque<>();
    private final Map<EmergencyType, Long> raisedByType = new EnumMap<>(EmergencyType.class);
    private long raised;
    private long suppressed;
    private long resolved;
    private long interventionsSucceeded;
    private long interventionsFailed;

    public EmergencyManager(MessageBus bus, List<EmergencyThreshold> thresholds) {
        this(bus, thresholds, null, null, System::currentTimeMillis);
    }

    public EmergencyManager(
            MessageBus bus,
            List<EmergencyThreshold> thresholds,
            ReasoningService reasoning,
            AuditLogger auditLogger,
            LongSupplier clock
    ) {
        this.bus = bus;
        this.auditLogger = auditLogger;
        this.clock = clock == null ? System::currentTimeMillis : clock;
        this.thresholds = List.copyOf(thresholds == null || thresholds.isEmpty()
                ? EmergencyThreshold.defaults()
                : thresholds);
        this.protocols = new EnumMap<>(new DefaultInterventions(bus, auditLogger, reasoning, this.clock).protocols());
        this.severityChain = FallbackChain.<SeverityInput, Double>named("emergency-severity")
                .then("heuristic", 0.6d, EmergencyManager::heuristicSeverity)
                .then("base", 0.3d, input -> Optional.of(input.threshold().baseSeverity()))
                .orElse(1.0d);
        this.assessmentChain = FallbackChain.<EmergencyEvent, Double>named("emergency-assessment")
                .then("reasoning", 0.9d,
                        event -> reasoning != null && reasoning.available(),
                        event -> reasoningSeverity(reasoning, event))
                .orElse(null);
    }

    /**
     * Replaces the ordered protocol list for one type.
     */
    public synchronized void setProtocol(EmergencyType type, List<InterventionStep> steps) {
        protocols.put(type, List.copyOf(steps));
    }

    public synchronized List<InterventionStep> protocol(EmergencyType type) {
        return protocols.getOrDefault(type, List.of());
    }

    public synchronized List<EmergencyEvent> evaluate(MetricsSnapshot snapshot) {
        long now = snapshot.capturedAtMs();
        List<EmergencyEvent> fired = new ArrayList<>();
        for (EmergencyThreshold threshold : thresholds) {
            String key = threshold.type().label() + ":" + threshold.metricName();
            OptionalDouble observed = snapshot.value(threshold.metricName());
            if (observed.isEmpty() || observed.getAsDouble() <= threshold.threshold()) {
                breachSince.remove(key);
                continue;
            }
            long since = breachSince.computeIfAbsent(key, k -> now);
            if (now - since < threshold.dwellMs()) {
                continue;
            }
            if (inCooldown(threshold.type(), now)) {
                suppressed++;
                continue;
            }
            fired.add(fire(threshold, observed.getAsDouble(), snapshot.contributorsOf(threshold.metricName()), now));
        }
        return fired;
    }

    /**
     * Raises an event directly, skipping dwell. The per-type cooldown still applies.
     */
    public synchronized Optional<EmergencyEvent> raise(
            EmergencyType type,
            Collection<String> affectedAgents,
            double observedValue,
            long nowMs
    ) {
        EmergencyThreshold threshold = thresholdFor(type);
        if (inCooldown(type, nowMs)) {
            suppressed++;
            log.debug("Emergency {} suppressed by cooldown", type.label());
            return Optional.empty();
        }
        Set<String> agents = affectedAgents == null ? Set.of() : Set.copyOf(affectedAgents);
        return Optional.of(fire(threshold, observedValue, agents, nowMs));
    }

    /**
     * Runs the type's protocol in order until one step reports success.
     *
     * <p>May block on the reasoning service; call it from a worker, not the coordination loop.
     */
    public InterventionResult intervene(EmergencyEvent detected) {
        EmergencyEvent event = reassess(detected);
        List<InterventionStep> steps = protocol(event.type());
        publishRaised(event);
        List<InterventionStep.StepOutcome> attempts = new ArrayList<>();
        InterventionProtocol resolvedBy = null;
        for (InterventionStep step : steps) {
            InterventionStep.StepOutcome outcome;
            try {
                outcome = step.handler().apply(event);
                if (outcome == null) {
                    outcome = InterventionStep.StepOutcome.fail(step.protocol(), "no outcome");
                }
            } catch (Exception e) {
                log.warn("Intervention {} for emergency {} failed: {}", step.protocol().label(), event.id(), e.toString());
                outcome = InterventionStep.StepOutcome.fail(step.protocol(), e.getMessage() == null ? e.toString() : e.getMessage());
            }
            attempts.add(outcome);
            if (outcome.success()) {
                resolvedBy = step.protocol();
                break;
            }
        }
        long now = clock.getAsLong();
        InterventionResult result = new InterventionResult(event.id(), event.type(), resolvedBy != null,
                resolvedBy, List.copyOf(attempts), now);
        synchronized (this) {
            if (result.succeeded()) {
                interventionsSucceeded++;
                if (active.remove(event.id()) != null) {
                    resolved++;
                }
            } else {
                interventionsFailed++;
            }
        }
        if (result.succeeded()) {
            log.info("Emergency {} handled by {}", event.id(), resolvedBy.label());
        } else {
            log.error("Emergency {} ({}) not handled by any of {} protocol steps", event.id(), event.type().label(), steps.size());
        }
        audit("emergency.intervene", event.id(), result.succeeded() ? "handled" : "unhandled", interventionDetails(result));
        publishResolved(event, result);
        return result;
    }

    /**
     * Marks an active emergency as resolved by an operator. Cooldown is left in place.
     */
    public synchronized boolean resolve(String emergencyId, String notes, long nowMs) {
        EmergencyEvent event = active.remove(emergencyId);
        if (event == null) {
            return false;
        }
        resolved++;
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", event.type().label());
        details.put("notes", notes == null ? "" : notes);
        details.put("resolved_at_ms", nowMs);
        audit("emergency.resolve", emergencyId, "resolved", details);
        log.info("Emergency {} resolved manually", emergencyId);
        return true;
    }

    /**
     * Drops elapsed cooldowns and clears active events whose cooldown has passed.
     *
     * @return ids of events cleared by expiry
     */
    public synchronized List<String> expireCooldowns(long nowMs) {
        cooldownUntil.entrySet().removeIf(e -> e.getValue() <= nowMs);
        List<String> cleared = new ArrayList<>();
        active.values().removeIf(event -> {
            if (event.cooldownUntilMs() <= nowMs) {
                cleared.add(event.id());
                return true;
            }
            return false;
        });
        resolved += cleared.size();
        return cleared;
    }

    public synchronized boolean inCooldown(EmergencyType type, long nowMs) {
        Long until = cooldownUntil.get(type);
        return until != null && nowMs < until;
    }

    public synchronized List<EmergencyEvent> activeEmergencies() {
        return List.copyOf(active.values());
    }

    public synchronized List<EmergencyEvent> history(int limit) {
        List<EmergencyEvent> out = new ArrayList<>(history);
        int from = Math.max(0, out.size() - Math.max(0, limit));
        return List.copyOf(out.subList(from, out.size()));
    }

    public synchronized Statistics statistics() {
        return new Statistics(raised, suppressed, resolved, interventionsSucceeded, interventionsFailed,
                active.size(), Map.copyOf(raisedByType));
    }

    public List<EmergencyThreshold> thresholds() {
        return thresholds;
    }

    private EmergencyThreshold thresholdFor(EmergencyType type) {
        for (EmergencyThreshold threshold : thresholds) {
            if (threshold.type() == type) {
                return threshold;
            }
        }
        for (EmergencyThreshold threshold : EmergencyThreshold.defaults()) {
            if (threshold.type() == type) {
                return threshold;
            }
        }
        throw new IllegalArgumentException("No threshold configured for " + type.label());
    }

    private EmergencyEvent fire(EmergencyThreshold threshold, double observed, Set<String> agents, long now) {
        FallbackChain.Decision<Double> severity = severityChain.decide(new SeverityInput(threshold, observed));
        EmergencyEvent event = new EmergencyEvent(
                "emg_" + UUID.randomUUID(),
                threshold.type(),
                clamp(severity.value()),
                now,
                now + threshold.cooldownMs(),
                agents,
                threshold.metricName(),
                observed,
                threshold.threshold(),
                severity.source()
        );
        cooldownUntil.put(threshold.type(), event.cooldownUntilMs());
        active.put(event.id(), event);
        history.addLast(event);
        while (history.size() > HISTORY_LIMIT) {
            history.removeFirst();
        }
        raised++;
        raisedByType.merge(threshold.type(), 1L, Long::sum);
        log.warn("Emergency {} detected: {} (severity {} via {})", event.id(), event.describe(),
                event.severity(), event.severitySource());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", event.type().label());
        details.put("severity", event.severity());
        details.put("metric", event.metricName());
        details.put("observed", observed);
        details.put("threshold", threshold.threshold());
        details.put("affected_agents", new ArrayList<>(agents));
        audit("emergency.detect", event.id(), "raised", details);
        return event;
    }

    private EmergencyEvent reassess(EmergencyEvent event) {
        FallbackChain.Decision<Double> decision = assessmentChain.decide(event);
        if (decision.value() == null) {
            return event;
        }
        EmergencyEvent assessed = event.withSeverity(clamp(decision.value()), decision.source());
        synchronized (this) {
            active.replace(assessed.id(), assessed);
        }
        log.info("Emergency {} reassessed: severity {} -> {} via {}", event.id(), event.severity(),
                assessed.severity(), assessed.severitySource());
        return assessed;
    }

    private void publishRaised(EmergencyEvent event) {
        if (bus == null) {
            return;
        }
        ObjectNode payload = eventPayload(event);
        bus.publish(Message.create(Topics.EMERGENCY_RAISED, payload, Priority.CRITICAL, SENDER, clock.getAsLong(), 0L));
    }

    private void publishResolved(EmergencyEvent event, InterventionResult result) {
        if (bus == null) {
            return;
        }
        ObjectNode payload = eventPayload(event);
        payload.put("handled", result.succeeded());
        if (result.resolvedBy() == null) {
            payload.putNull("resolved_by");
        } else {
            payload.put("resolved_by", result.resolvedBy().label());
        }
        ArrayNode attempts = payload.putArray("attempts");
        for (InterventionStep.StepOutcome outcome : result.attempts()) {
            ObjectNode row = attempts.addObject();
            row.put("protocol", outcome.protocol().label());
            row.put("success", outcome.success());
            row.put("detail", outcome.detail());
        }
        bus.publish(Message.create(Topics.EMERGENCY_RESOLVED, payload, Priority.HIGH, SENDER, clock.getAsLong(), 0L));
    }

    private static ObjectNode eventPayload(EmergencyEvent event) {
        ObjectNode payload = Jsons.object();
        payload.put("emergency_id", event.id());
        payload.put("type", event.type().label());
        payload.put("severity", event.severity());
        payload.put("severity_source", event.severitySource());
        payload.put("detected_at_ms", event.detectedAtMs());
        payload.put("cooldown_until_ms", event.cooldownUntilMs());
        payload.put("metric", event.metricName());
        payload.put("observed", event.observedValue());
        payload.put("threshold", event.thresholdValue());
        ArrayNode agents = payload.putArray("affected_agents");
        event.affectedAgents().stream().sorted().forEach(agents::add);
        return payload;
    }

    private static Map<String, Object> interventionDetails(InterventionResult result) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("type", result.type().label());
        details.put("resolved_by", result.resolvedBy() == null ? "" : result.resolvedBy().label());
        List<String> attempted = new ArrayList<>();
        for (InterventionStep.StepOutcome outcome : result.attempts()) {
            attempted.add(outcome.protocol().label() + (outcome.success() ? ":ok" : ":failed"));
        }
        details.put("attempts", attempted);
        return details;
    }

    private void audit(String action, String resource, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            auditLogger.log(AuditLogger.AuditEvent.of(action, SENDER, resource, result, details));
        }
    }

    private static Optional<Double> reasoningSeverity(ReasoningService reasoning, EmergencyEvent event) {
        ObjectNode context = Jsons.object();
        context.put("type", event.type().label());
        context.put("metric", event.metricName());
        context.put("observed", event.observedValue());
        context.put("threshold", event.thresholdValue());
        context.put("detected_severity", event.severity());
        context.put("affected_agent_count", event.affectedAgents().size());
        try {
            String answer = reasoning.complete("emergency_severity", context, SEVERITY_TIMEOUT);
            if (answer == null || answer.isBlank()) {
                return Optional.empty();
            }
            double value = Double.parseDouble(answer.trim());
            if (Double.isNaN(value) || value < 0.0d || value > 1.0d) {
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            log.debug("Reasoning severity answer was not a number");
            return Optional.empty();
        } catch (Exception e) {
            log.warn("Reasoning severity unavailable: {}", e.toString());
            return Optional.empty();
        }
    }

    // Overshoot ratio: just over the threshold maps to 0.5, double the threshold or more to 1.0.
    private static Optional<Double> heuristicSeverity(SeverityInput input) {
        double threshold = input.threshold().threshold();
        if (threshold <= 0.0d || input.observed() <= threshold) {
            return Optional.empty();
        }
        double overshoot = (input.observed() - threshold) / threshold;
        return Optional.of(clamp(0.5d + 0.5d * overshoot));
    }

    private static double clamp(double value) {
        return Math.max(0.0d, Math.min(1.0d, value));
    }

    private record SeverityInput(EmergencyThreshold threshold, double observed) {
    }

    public record Statistics(
            long raised,
            long suppressed,
            long resolved,
            long interventionsSucceeded,
            long interventionsFailed,
            int active,
            Map<EmergencyType, Long> raisedByType
    ) {
    }
}
