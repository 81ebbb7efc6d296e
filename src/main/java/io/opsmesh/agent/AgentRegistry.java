package io.opsmesh.agent;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.opsmesh.bus.MessageBus;
import io.opsmesh.bus.Topics;
import io.opsmesh.model.Message;
import io.opsmesh.model.Priority;
import io.opsmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered workers and their liveness.
 *
 * <p>Every mutation goes through {@link ConcurrentHashMap#compute} on the agent's key, so
 * heartbeats racing the health sweep never lose updates. An agent silent for
 * {@code missedHeartbeats x interval} degrades, after twice that it goes offline, and after
 * {@code evictionMultiplier x interval} it is evicted.
 */
public final class AgentRegistry {
    private static final Logger log = LoggerFactory.getLogger(AgentRegistry.class);
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 10_000L;
    public static final int DEFAULT_MISSED_HEARTBEATS = 3;
    public static final int DEFAULT_EVICTION_MULTIPLIER = 10;

    private final Map<String, AgentRegistration> agents = new ConcurrentHashMap<>();
    private final long heartbeatIntervalMs;
    private final int missedHeartbeats;
    private final long evictAfterMs;
    private final MessageBus bus;

    public AgentRegistry(MessageBus bus) {
        this(bus, DEFAULT_HEARTBEAT_INTERVAL_MS, DEFAULT_MISSED_HEARTBEATS, DEFAULT_EVICTION_MULTIPLIER);
    }

    public AgentRegistry(MessageBus bus, long heartbeatIntervalMs, int missedHeartbeats, int evictionMultiplier) {
        this.bus = bus;
        this.heartbeatIntervalMs = Math.max(1L, heartbeatIntervalMs);
        this.missedHeartbeats = Math.max(1, missedHeartbeats);
        long offlineAfter = offlineAfterMs();
        this.evictAfterMs = Math.max(offlineAfter + this.heartbeatIntervalMs,
                Math.max(1, evictionMultiplier) * this.heartbeatIntervalMs);
    }

    public AgentRegistration register(String agentId, Collection<String> capabilities, long nowMs) {
        if (agentId == null || agentId.isBlank()) {
            throw new IllegalArgumentException("agent_id is required");
        }
        String id = agentId.trim();
        AgentRegistration fresh = new AgentRegistration(
                id,
                capabilities == null ? Set.of() : new HashSet<>(capabilities),
                AgentStatus.ACTIVE,
                nowMs,
                nowMs,
                nowMs,
                Map.of()
        );
        AgentRegistration existing = agents.putIfAbsent(id, fresh);
        if (existing != null) {
            throw new IllegalArgumentException("Agent already registered: " + id);
        }
        log.info("Agent {} registered with capabilities {}", id, fresh.capabilities());
        publish(new StatusTransition(id, null, AgentStatus.ACTIVE, "registered", nowMs, 0L));
        return fresh;
    }

    public AgentRegistration heartbeat(String agentId, long timestampMs) {
        return heartbeat(agentId, timestampMs, null);
    }

    /**
     * Records a heartbeat. A degraded or offline agent returns to active.
     *
     * @param metrics latest self-reported metrics, or {@code null} to keep the previous ones
     */
    public AgentRegistration heartbeat(String agentId, long timestampMs, Map<String, Double> metrics) {
        StatusTransition[] transition = new StatusTransition[1];
        AgentRegistration updated = agents.computeIfPresent(agentId, (id, current) -> {
            AgentRegistration next = current.withHeartbeat(timestampMs, metrics, timestampMs);
            if (current.status() != AgentStatus.ACTIVE) {
                transition[0] = new StatusTransition(id, current.status(), AgentStatus.ACTIVE,
                        "heartbeat_resumed", timestampMs, current.silenceMs(timestampMs));
            }
            return next;
        });
        if (updated == null) {
            throw new IllegalArgumentException("Unknown agent: " + agentId);
        }
        if (transition[0] != null) {
            log.info("Agent {} recovered ({} -> active)", agentId, transition[0].from().label());
            publish(transition[0]);
        }
        return updated;
    }

    public boolean deregister(String agentId, long nowMs) {
        AgentRegistration removed = agents.remove(agentId);
        if (removed == null) {
            return false;
        }
        log.info("Agent {} deregistered", agentId);
        publish(new StatusTransition(agentId, removed.status(), AgentStatus.OFFLINE, "deregistered",
                nowMs, removed.silenceMs(nowMs)));
        return true;
    }

    public Optional<AgentRegistration> find(String agentId) {
        return Optional.ofNullable(agents.get(agentId));
    }

    public Set<AgentRegistration> listActive() {
        Set<AgentRegistration> out = new HashSet<>();
        for (AgentRegistration registration : agents.values()) {
            if (registration.status() == AgentStatus.ACTIVE) {
                out.add(registration);
            }
        }
        return out;
    }

    public List<AgentRegistration> list() {
        List<AgentRegistration> out = new ArrayList<>(agents.values());
        out.sort((a, b) -> a.agentId().compareTo(b.agentId()));
        return out;
    }

    public Map<AgentStatus, Integer> counts() {
        Map<AgentStatus, Integer> counts = new EnumMap<>(AgentStatus.class);
        for (AgentStatus status : AgentStatus.values()) {
            counts.put(status, 0);
        }
        for (AgentRegistration registration : agents.values()) {
            counts.merge(registration.status(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Latest metrics per agent that is not offline, keyed by agent id.
     */
    public Map<String, Map<String, Double>> reportedMetrics() {
        Map<String, Map<String, Double>> out = new LinkedHashMap<>();
        for (AgentRegistration registration : list()) {
            if (registration.status() != AgentStatus.OFFLINE && !registration.metrics().isEmpty()) {
                out.put(registration.agentId(), registration.metrics());
            }
        }
        return out;
    }

    /**
     * Sweeps every agent for missed heartbeats and applies the resulting transitions.
     */
    public HealthReport collectHealth(long nowMs) {
        List<StatusTransition> transitions = new ArrayList<>();
        List<String> newlyOffline = new ArrayList<>();
        List<String> evicted = new ArrayList<>();
        for (String agentId : new ArrayList<>(agents.keySet())) {
            agents.computeIfPresent(agentId, (id, current) -> {
                long silence = current.silenceMs(nowMs);
                if (silence > evictAfterMs && current.status() == AgentStatus.OFFLINE) {
                    evicted.add(id);
                    return null;
                }
                AgentRegistration next = current;
                if (next.status() == AgentStatus.ACTIVE && silence > degradeAfterMs()) {
                    transitions.add(new StatusTransition(id, AgentStatus.ACTIVE, AgentStatus.DEGRADED,
                            "missed_heartbeats", nowMs, silence));
                    next = next.withStatus(AgentStatus.DEGRADED, nowMs);
                }
                if (next.status() == AgentStatus.DEGRADED && silence > offlineAfterMs()) {
                    transitions.add(new StatusTransition(id, AgentStatus.DEGRADED, AgentStatus.OFFLINE,
                            "missed_heartbeats", nowMs, silence));
                    newlyOffline.add(id);
                    next = next.withStatus(AgentStatus.OFFLINE, nowMs);
                }
                return next;
            });
        }
        for (StatusTransition transition : transitions) {
            log.warn("Agent {} {} -> {} after {} ms of silence",
                    transition.agentId(), transition.from().label(), transition.to().label(), transition.silenceMs());
            publish(transition);
        }
        for (String id : evicted) {
            log.info("Agent {} evicted after prolonged silence", id);
        }
        return new HealthReport(nowMs, List.copyOf(transitions), List.copyOf(newlyOffline), List.copyOf(evicted), counts());
    }

    public long heartbeatIntervalMs() {
        return heartbeatIntervalMs;
    }

    public long degradeAfterMs() {
        return missedHeartbeats * heartbeatIntervalMs;
    }

    public long offlineAfterMs() {
        return 2L * missedHeartbeats * heartbeatIntervalMs;
    }

    public long evictAfterMs() {
        return evictAfterMs;
    }

    private void publish(StatusTransition transition) {
        if (bus == null) {
            return;
        }
        ObjectNode payload = Jsons.object();
        payload.put("agent_id", transition.agentId());
        if (transition.from() == null) {
            payload.putNull("from");
        } else {
            payload.put("from", transition.from().label());
        }
        payload.put("to", transition.to().label());
        payload.put("reason", transition.reason());
        payload.put("at_ms", transition.atMs());
        payload.put("silence_ms", transition.silenceMs());
        Priority priority = transition.to() == AgentStatus.OFFLINE ? Priority.HIGH : Priority.NORMAL;
        bus.publish(Message.create(Topics.AGENT_STATUS, payload, priority, "agent-registry", transition.atMs(), 0L));
    }
}
