package io.opsmesh.emergency;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.opsmesh.bus.MessageBus;
import io.opsmesh.bus.PublishResult;
import io.opsmesh.bus.Topics;
import io.opsmesh.decision.ReasoningService;
import io.opsmesh.model.Message;
import io.opsmesh.model.Priority;
import io.opsmesh.observability.AuditLogger;
import io.opsmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.LongSupplier;

/**
 * Built-in intervention steps. Automated steps turn into {@code agent.command} messages for
 * the affected agents (or a broadcast when none are known); escalation notifies a human.
 */
public final class DefaultInterventions {
    private static final Logger log = LoggerFactory.getLogger(DefaultInterventions.class);
    private static final String SENDER = "emergency-manager";
    private static final Duration SUMMARY_TIMEOUT = Duration.ofSeconds(5);

    private final MessageBus bus;
    private final AuditLogger auditLogger;
    private final ReasoningService reasoning;
    private final LongSupplier clock;

    public DefaultInterventions(MessageBus bus, AuditLogger auditLogger, ReasoningService reasoning, LongSupplier clock) {
        this.bus = bus;
        this.auditLogger = auditLogger;
        this.reasoning = reasoning;
        this.clock = clock == null ? System::currentTimeMillis : clock;
    }

    public Map<EmergencyType, List<InterventionStep>> protocols() {
        Map<EmergencyType, List<InterventionStep>> out = new EnumMap<>(EmergencyType.class);
        out.put(EmergencyType.FAILURE_RATE, List.of(
                step(InterventionProtocol.ACTIVATE_FALLBACK),
                step(InterventionProtocol.REDUCE_LOAD),
                step(InterventionProtocol.ESCALATE_TO_HUMAN)));
        out.put(EmergencyType.LATENCY, List.of(
                step(InterventionProtocol.REDUCE_LOAD),
                step(InterventionProtocol.THROTTLE_REQUESTS),
                step(InterventionProtocol.ESCALATE_TO_HUMAN)));
        out.put(EmergencyType.DOWNTIME, List.of(
                step(InterventionProtocol.RESTART_AGENTS),
                step(InterventionProtocol.REDISTRIBUTE_WORKLOAD),
                step(InterventionProtocol.ESCALATE_TO_HUMAN)));
        out.put(EmergencyType.RESOURCE_EXHAUSTION, List.of(
                step(InterventionProtocol.CLEAR_CACHES),
                step(InterventionProtocol.REDUCE_LOAD),
                step(InterventionProtocol.ESCALATE_TO_HUMAN)));
        out.put(EmergencyType.RATE_LIMIT, List.of(
                step(InterventionProtocol.THROTTLE_REQUESTS),
                step(InterventionProtocol.ACTIVATE_FALLBACK),
                step(InterventionProtocol.ESCALATE_TO_HUMAN)));
        return out;
    }

    public InterventionStep step(InterventionProtocol protocol) {
        return switch (protocol) {
            case ESCALATE_TO_HUMAN -> new InterventionStep(protocol, this::escalate);
            case RESTART_AGENTS -> new InterventionStep(protocol, event -> {
                if (event.affectedAgents().isEmpty()) {
                    return InterventionStep.StepOutcome.fail(protocol, "no affected agents to restart");
                }
                return command(protocol, event);
            });
            default -> new InterventionStep(protocol, event -> command(protocol, event));
        };
    }

    private InterventionStep.StepOutcome command(InterventionProtocol protocol, EmergencyEvent event) {
        if (bus == null) {
            return InterventionStep.StepOutcome.fail(protocol, "no message bus attached");
        }
        long now = clock.getAsLong();
        List<String> targets = new ArrayList<>(event.affectedAgents());
        targets.sort(String::compareTo);
        int accepted = 0;
        if (targets.isEmpty()) {
            accepted += send(commandMessage(protocol, event, now)) ? 1 : 0;
        } else {
            for (String agentId : targets) {
                accepted += send(commandMessage(protocol, event, now).withRecipient(agentId)) ? 1 : 0;
            }
        }
        if (accepted == 0) {
            return InterventionStep.StepOutcome.fail(protocol, "command rejected by bus");
        }
        String scope = targets.isEmpty() ? "broadcast" : accepted + "/" + targets.size() + " agents";
        return InterventionStep.StepOutcome.ok(protocol, protocol.label() + " sent (" + scope + ")");
    }

    private Message commandMessage(InterventionProtocol protocol, EmergencyEvent event, long now) {
        ObjectNode payload = Jsons.object();
        payload.put("command", protocol.label());
        payload.put("emergency_id", event.id());
        payload.put("emergency_type", event.type().label());
        payload.put("severity", event.severity());
        return Message.create(Topics.AGENT_COMMAND, payload, Priority.CRITICAL, SENDER, now, 0L);
    }

    private boolean send(Message message) {
        PublishResult result = bus.offer(message);
        return result.accepted();
    }

    private InterventionStep.StepOutcome escalate(EmergencyEvent event) {
        String summary = event.describe();
        if (reasoning != null && reasoning.available()) {
            try {
                ObjectNode context = Jsons.object();
                context.put("type", event.type().label());
                context.put("severity", event.severity());
                context.put("metric", event.metricName());
                context.put("observed", event.observedValue());
                context.put("threshold", event.thresholdValue());
                ArrayNode agents = context.putArray("affected_agents");
                event.affectedAgents().forEach(agents::add);
                String text = reasoning.complete("emergency_summary", context, SUMMARY_TIMEOUT);
                if (text != null && !text.isBlank()) {
                    summary = text.trim();
                }
            } catch (Exception e) {
                log.warn("Reasoning summary for emergency {} unavailable: {}", event.id(), e.toString());
            }
        }
        log.error("HUMAN ATTENTION REQUIRED: emergency {} ({}, severity {}): {}",
                event.id(), event.type().label(), event.severity(), summary);
        if (auditLogger != null) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("type", event.type().label());
            details.put("severity", event.severity());
            details.put("affected_agents", new ArrayList<>(event.affectedAgents()));
            details.put("summary", summary);
            auditLogger.log(AuditLogger.AuditEvent.of("emergency.escalate", SENDER, event.id(), "notified", details));
        }
        return InterventionStep.StepOutcome.ok(InterventionProtocol.ESCALATE_TO_HUMAN, "operators notified");
    }
}
