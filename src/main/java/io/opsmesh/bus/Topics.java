package io.opsmesh.bus;

public final class Topics {
    public static final String AGENT_STATUS = "agent.status";
    public static final String AGENT_COMMAND = "agent.command";
    public static final String AGENT_ACTION = "agent.action";
    public static final String EMERGENCY_RAISED = "emergency.raised";
    public static final String EMERGENCY_RESOLVED = "emergency.resolved";
    public static final String CONFLICT_RESOLVED = "conflict.resolved";
    public static final String BRIDGE_HEALTH = "bridge.health";
    public static final String IMPROVEMENT_TRIGGER = "improvement_trigger";
    public static final String DEPLOYMENT_NOTIFICATION = "deployment_notification";

    private Topics() {
    }
}
