package io.quarkiverse.dapr.agentex.agent.workflow;

/**
 * External event sent to {@link AgentTaskWorkflow} via {@code DaprWorkflowClient.raiseEvent()}.
 * <p>
 * Two event types are used:
 * <ul>
 *   <li>{@code "message"}: a user message; the workflow runs one agent turn for it.</li>
 *   <li>{@code "done"}: the task is finished; the workflow completes.</li>
 * </ul>
 *
 * @param type    event discriminator: {@code "message"} or {@code "done"}
 * @param content the user message text (null for "done" events)
 */
public record TaskEvent(String type, String content) {

    public static final String MESSAGE = "message";
    public static final String DONE = "done";

    public static TaskEvent message(String content) {
        return new TaskEvent(MESSAGE, content);
    }

    public static TaskEvent done() {
        return new TaskEvent(DONE, null);
    }
}
