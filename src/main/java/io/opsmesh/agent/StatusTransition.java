package io.opsmesh.agent;

/**
 * A single agent status change. {@code from} is {@code null} for a fresh registration.
 */
public record StatusTransition(
        String agentId,
        AgentStatus from,
        AgentStatus to,
        String reason,
        long atMs,
        long silenceMs
) {
}
