package io.opsmesh.observability;

import io.opsmesh.agent.AgentStatus;
import io.opsmesh.bridge.BridgeHealth;
import io.opsmesh.bus.BusStats;
import io.opsmesh.emergency.EmergencyManager;
import io.opsmesh.emergency.EmergencyType;
import io.opsmesh.runtime.OpsMeshRuntime;
import io.opsmesh.supervisor.CycleMetrics;

import java.util.Locale;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(OpsMeshRuntime.MetricsOutcome metrics) {
        StringBuilder sb = new StringBuilder();
        BusStats bus = metrics.bus();
        appendGauge(sb, "opsmesh_bus_published_total", "Messages accepted or offered to the bus", null, null, bus.published());
        appendGauge(sb, "opsmesh_bus_delivered_total", "Handler deliveries that succeeded", null, null, bus.delivered());
        appendGauge(sb, "opsmesh_bus_expired_total", "Messages dropped because their ttl elapsed", null, null, bus.expired());
        appendGauge(sb, "opsmesh_bus_backpressure_dropped_total", "Messages dropped by full topic queues", null, null, bus.backpressureDropped());
        appendGauge(sb, "opsmesh_bus_handler_failures_total", "Handler invocations that threw", null, null, bus.handlerFailures());
        appendGauge(sb, "opsmesh_bus_pending", "Messages waiting in topic queues", null, null, bus.pending());
        appendGauge(sb, "opsmesh_bus_subscriptions", "Active subscriptions", null, null, bus.subscriptions());
        for (BusStats.SubscriptionStats sub : bus.subscribers()) {
            String subscriber = sub.subscriberId() == null ? sub.subscriptionId() : sub.subscriberId();
            appendGauge(sb, "opsmesh_bus_subscriber_failed_total", "Failed deliveries per subscriber", "subscriber",
                    subscriber + "@" + sub.topic(), sub.failed());
        }

        for (Map.Entry<AgentStatus, Integer> e : metrics.agents().entrySet()) {
            appendGauge(sb, "opsmesh_agents", "Registered agents grouped by status", "status", e.getKey().label(), e.getValue());
        }

        CycleMetrics cycle = metrics.cycle();
        appendGauge(sb, "opsmesh_cycles_total", "Coordination cycles completed", null, null, cycle.cycles());
        appendGauge(sb, "opsmesh_cycle_overruns_total", "Cycles that exceeded the tick period", null, null, cycle.overruns());
        appendGauge(sb, "opsmesh_cycle_phase_errors_total", "Phase exceptions caught by the loop", null, null, cycle.phaseErrors());
        appendGauge(sb, "opsmesh_cycle_avg_ms", "Average cycle duration in milliseconds", null, null, cycle.avgCycleMs());
        for (Map.Entry<String, Double> e : cycle.avgPhaseMs().entrySet()) {
            appendGauge(sb, "opsmesh_phase_avg_ms", "Average phase duration in milliseconds", "phase", e.getKey(), e.getValue());
        }
        appendGauge(sb, "opsmesh_conflicts_per_cycle", "Resolved conflicts per cycle", null, null, cycle.conflictsPerCycle());
        appendGauge(sb, "opsmesh_emergencies_per_cycle", "Emergencies raised per cycle", null, null, cycle.emergenciesPerCycle());
        appendGauge(sb, "opsmesh_interventions_dispatched_total", "Interventions handed to the intervention worker", null, null,
                cycle.interventionsDispatched());
        appendGauge(sb, "opsmesh_interventions_failed_total", "Interventions that ended with an exception", null, null,
                cycle.failedInterventions());
        appendGauge(sb, "opsmesh_forward_failures_total", "Improvement triggers whose delivery ended with an exception", null, null,
                cycle.failedForwards());

        EmergencyManager.Statistics emergencies = metrics.emergencies();
        appendGauge(sb, "opsmesh_emergencies_active", "Unresolved emergencies", null, null, emergencies.active());
        appendGauge(sb, "opsmesh_emergencies_suppressed_total", "Emergencies suppressed by cooldown", null, null, emergencies.suppressed());
        for (EmergencyType type : EmergencyType.values()) {
            appendGauge(sb, "opsmesh_emergencies_raised_total", "Emergencies raised grouped by type", "type", type.label(),
                    emergencies.raisedByType().getOrDefault(type, 0L));
        }

        BridgeHealth bridge = metrics.bridge();
        if (bridge != null) {
            appendGauge(sb, "opsmesh_bridge_circuit_state", "Circuit breaker state (0=closed,1=half_open,2=open)", null, null,
                    switch (bridge.circuitState()) {
                        case CLOSED -> 0;
                        case HALF_OPEN -> 1;
                        case OPEN -> 2;
                    });
            appendGauge(sb, "opsmesh_bridge_circuit_trips_total", "Times the breaker opened", null, null, bridge.circuitTrips());
            appendGauge(sb, "opsmesh_bridge_dead_letter_depth", "Messages waiting in the dead-letter queue", null, null, bridge.deadLetterDepth());
            appendGauge(sb, "opsmesh_bridge_processed_total", "Messages delivered to the validator", null, null, bridge.processed());
            appendGauge(sb, "opsmesh_bridge_failed_total", "Messages that ended in the dead-letter queue", null, null, bridge.failed());
            appendGauge(sb, "opsmesh_bridge_retried_total", "Retry attempts made", null, null, bridge.retried());
            appendGauge(sb, "opsmesh_bridge_status", "Bridge status marker", "status", bridge.status().label(), 1);
        }
        return sb.toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        appendSample(sb, metric, help, label, labelValue, Long.toString(value));
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, double value) {
        appendSample(sb, metric, help, label, labelValue, String.format(Locale.ROOT, "%.3f", value));
    }

    private static void appendSample(StringBuilder sb, String metric, String help, String label, String labelValue, String value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
