package io.quarkiverse.dapr.agentex.config;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import io.dapr.workflows.runtime.WorkflowRuntime;
import io.dapr.workflows.runtime.WorkflowRuntimeBuilder;
import io.quarkiverse.dapr.agentex.agent.activities.StreamingInvokeActivity;
import io.quarkiverse.dapr.agentex.agent.workflow.AgentTaskWorkflow;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;

/**
 * Registers {@link AgentTaskWorkflow} and {@link StreamingInvokeActivity} with the Dapr workflow
 * runtime when the application starts, and stops the runtime on shutdown.
 */
@ApplicationScoped
public class AgentexWorkflowWorker {

    private static final Logger LOG = Logger.getLogger(AgentexWorkflowWorker.class);

    @ConfigProperty(name = "agentex.worker.enabled", defaultValue = "true")
    boolean enabled;

    private WorkflowRuntime runtime;

    void onStart(@Observes @Initialized(ApplicationScoped.class) Object event) {
        if (!enabled) {
            LOG.info("Agentex workflow worker disabled (agentex.worker.enabled=false)");
            return;
        }
        start(new WorkflowRuntimeBuilder());
    }

    synchronized void start(WorkflowRuntimeBuilder builder) {
        if (runtime != null) {
            return;
        }
        runtime = builder
                .registerWorkflow(AgentTaskWorkflow.class)
                .registerActivity(StreamingInvokeActivity.class)
                .build();
        runtime.start(false);
        LOG.infof("Agentex workflow worker started — workflow=%s, activity=%s",
                AgentTaskWorkflow.class.getName(), StreamingInvokeActivity.class.getName());
    }

    boolean isRunning() {
        return runtime != null;
    }

    @PreDestroy
    synchronized void stop() {
        if (runtime == null) {
            return;
        }
        try {
            runtime.close();
            LOG.info("Agentex workflow worker stopped");
        } catch (Exception e) {
            LOG.warnf("Failed to stop workflow runtime: %s", e.getMessage());
        } finally {
            runtime = null;
        }
    }
}
