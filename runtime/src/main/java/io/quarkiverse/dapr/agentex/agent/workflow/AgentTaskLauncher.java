package io.quarkiverse.dapr.agentex.agent.workflow;

import java.time.Duration;
import java.util.UUID;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.dapr.workflows.client.DaprWorkflowClient;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

/**
 * Client-side entry point for agent tasks: starts an {@link AgentTaskWorkflow}, forwards user
 * messages to it and finishes it.
 */
@ApplicationScoped
public class AgentTaskLauncher {

    private static final Logger LOG = Logger.getLogger(AgentTaskLauncher.class);

    @Inject
    DaprWorkflowClient workflowClient;

    @ConfigProperty(name = "agentex.invoke.max-attempts", defaultValue = "3")
    int maxAttempts;

    @ConfigProperty(name = "agentex.invoke.first-retry-interval", defaultValue = "PT1S")
    Duration firstRetryInterval;

    @ConfigProperty(name = "agentex.invoke.backoff-coefficient", defaultValue = "2.0")
    double backoffCoefficient;

    /**
     * Starts a task with a fresh id.
     *
     * @return the task id, which is also the workflow instance id
     */
    public String start(String agentName, String traceId, String parentSpanId) {
        return start(UUID.randomUUID().toString(), agentName, traceId, parentSpanId);
    }

    public String start(String taskId, String agentName, String traceId, String parentSpanId) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId must not be blank");
        }
        String name = (agentName != null && !agentName.isBlank()) ? agentName : "agent";
        workflowClient.scheduleNewWorkflow(AgentTaskWorkflow.class,
                new AgentTaskInput(taskId, name, traceId, parentSpanId, retryPolicy()), taskId);
        LOG.infof("[Task:%s] AgentTaskWorkflow scheduled — agent=%s", taskId, name);
        return taskId;
    }

    InvokeRetryPolicy retryPolicy() {
        return InvokeRetryPolicy.of(maxAttempts, firstRetryInterval, backoffCoefficient);
    }

    public void sendMessage(String taskId, String content) {
        LOG.debugf("[Task:%s] Sending message event", taskId);
        workflowClient.raiseEvent(taskId, AgentTaskWorkflow.EVENT_NAME, TaskEvent.message(content));
    }

    public void finish(String taskId) {
        LOG.infof("[Task:%s] Sending done event to AgentTaskWorkflow", taskId);
        workflowClient.raiseEvent(taskId, AgentTaskWorkflow.EVENT_NAME, TaskEvent.done());
    }
}
