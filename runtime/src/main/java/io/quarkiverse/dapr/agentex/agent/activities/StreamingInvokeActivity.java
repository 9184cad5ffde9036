package io.quarkiverse.dapr.agentex.agent.activities;

import org.jboss.logging.Logger;

import io.quarkiverse.dapr.agentex.agent.DurableCaller;
import io.quarkiverse.dapr.agentex.agent.FinalResult;
import io.quarkiverse.dapr.agentex.context.ExecutionContext;
import io.quarkiverse.dapr.agentex.interceptor.BoundaryInterceptor;
import io.quarkiverse.dapr.agentex.interceptor.ContextAwareActivity;
import io.quarkiverse.dapr.agentex.interceptor.ContextPropagationInterceptor;
import jakarta.enterprise.inject.spi.CDI;

/**
 * Dapr Workflow Activity that runs one agent turn on behalf of an
 * {@link io.quarkiverse.dapr.agentex.agent.workflow.AgentTaskWorkflow}.
 * <p>
 * <h3>How it works</h3>
 * <ol>
 *   <li>Receives {@link InvokeAgentInput}; {@link ContextAwareActivity} installs the task id,
 *       trace id and parent span id found in its headers before this activity's code runs.</li>
 *   <li>Hands the turn to {@link DurableCaller}, which streams the agent's output to the task
 *       channel and persists the final message.</li>
 *   <li>Returns the {@link FinalResult}, stored in the Dapr workflow history so replays of the
 *       workflow see the same result without streaming again.</li>
 * </ol>
 * A failure propagates to the engine, which retries the activity according to the workflow's
 * {@link io.quarkiverse.dapr.agentex.agent.workflow.InvokeRetryPolicy}.
 */
public class StreamingInvokeActivity extends ContextAwareActivity<InvokeAgentInput> {

    private static final Logger LOG = Logger.getLogger(StreamingInvokeActivity.class);

    private final DurableCaller durableCaller;

    /**
     * Used by the Dapr workflow runtime, which instantiates activities reflectively.
     */
    public StreamingInvokeActivity() {
        this(CDI.current().select(DurableCaller.class).get(), new ContextPropagationInterceptor());
    }

    StreamingInvokeActivity(DurableCaller durableCaller, BoundaryInterceptor interceptor) {
        super(InvokeAgentInput.class, interceptor);
        this.durableCaller = durableCaller;
    }

    @Override
    protected Object execute(InvokeAgentInput input, ExecutionContext context) {
        LOG.infof("[Task:%s][Invocation:%s] StreamingInvokeActivity started — priorMessages=%d, resume=%s",
                context.taskId(), input.invocationId(),
                input.priorMessages() == null ? 0 : input.priorMessages().size(),
                input.resumeToken() != null);
        FinalResult result = durableCaller.invoke(input.toRequest());
        LOG.infof("[Task:%s][Invocation:%s] StreamingInvokeActivity completed — message=%s, blocks=%d",
                context.taskId(), input.invocationId(), result.messageId(), result.content().size());
        return result;
    }
}
