package io.quarkiverse.dapr.agentex.agent.workflow;

/**
 * Input record for {@link AgentTaskWorkflow}.
 *
 * @param taskId       id of the agent task; also used as the workflow instance id
 * @param agentName    human-readable agent name, shown in the workflow custom status
 * @param traceId      trace the task's spans belong to; may be {@code null}
 * @param parentSpanId span the agent invocations are parented to; may be {@code null}
 * @param retryPolicy  engine retry policy for each agent turn; {@code null} means
 *                     {@link InvokeRetryPolicy#defaults()}
 */
public record AgentTaskInput(
        String taskId,
        String agentName,
        String traceId,
        String parentSpanId,
        InvokeRetryPolicy retryPolicy) {

    public InvokeRetryPolicy retryPolicyOrDefault() {
        return retryPolicy != null ? retryPolicy : InvokeRetryPolicy.defaults();
    }
}
