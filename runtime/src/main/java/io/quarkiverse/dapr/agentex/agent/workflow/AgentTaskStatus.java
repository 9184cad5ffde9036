package io.quarkiverse.dapr.agentex.agent.workflow;

/**
 * Snapshot of an {@link AgentTaskWorkflow}, set as the Dapr workflow custom status after every
 * turn so observers can follow the task.
 *
 * @param agentName     human-readable name of the agent
 * @param phase         {@code WAITING} between turns, {@code RUNNING} during one, {@code COMPLETED} at the end
 * @param turns         number of agent turns completed
 * @param lastMessageId id of the last agent message persisted for the task
 * @param lastOutput    text output of the last turn
 */
public record AgentTaskStatus(
        String agentName,
        Phase phase,
        int turns,
        String lastMessageId,
        String lastOutput) {

    public enum Phase {
        WAITING,
        RUNNING,
        COMPLETED
    }
}
