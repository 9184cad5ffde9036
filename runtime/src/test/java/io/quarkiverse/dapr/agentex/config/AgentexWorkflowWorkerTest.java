package io.quarkiverse.dapr.agentex.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.RETURNS_SELF;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.dapr.workflows.runtime.WorkflowRuntime;
import io.dapr.workflows.runtime.WorkflowRuntimeBuilder;
import io.quarkiverse.dapr.agentex.agent.activities.StreamingInvokeActivity;
import io.quarkiverse.dapr.agentex.agent.workflow.AgentTaskWorkflow;

class AgentexWorkflowWorkerTest {

    private WorkflowRuntimeBuilder builder;
    private WorkflowRuntime runtime;
    private AgentexWorkflowWorker worker;

    @BeforeEach
    void setUp() {
        builder = mock(WorkflowRuntimeBuilder.class, RETURNS_SELF);
        runtime = mock(WorkflowRuntime.class);
        when(builder.build()).thenReturn(runtime);
        worker = new AgentexWorkflowWorker();
        worker.enabled = true;
    }

    @Test
    void startShouldRegisterTaskWorkflowAndInvokeActivity() {
        worker.start(builder);

        verify(builder).registerWorkflow(AgentTaskWorkflow.class);
        verify(builder).registerActivity(StreamingInvokeActivity.class);
        verify(runtime).start(false);
        assertThat(worker.isRunning()).isTrue();
    }

    @Test
    void startShouldBeIdempotent() {
        worker.start(builder);
        worker.start(builder);

        verify(builder, times(1)).build();
    }

    @Test
    void stopShouldCloseRuntime() {
        worker.start(builder);

        worker.stop();

        verify(runtime).close();
        assertThat(worker.isRunning()).isFalse();
    }

    @Test
    void stopWithoutStartShouldDoNothing() {
        worker.stop();

        verify(runtime, never()).close();
        assertThat(worker.isRunning()).isFalse();
    }
}
