package io.quarkiverse.dapr.agentex.interceptor;

import io.dapr.workflows.WorkflowActivity;
import io.dapr.workflows.WorkflowActivityContext;
import io.quarkiverse.dapr.agentex.context.ExecutionContext;
import io.quarkiverse.dapr.agentex.context.ExecutionContextHolder;

/**
 * Base class for activities that need the caller's execution context.
 * <p>
 * {@link #run(WorkflowActivityContext)} decodes the headers carried in the input, installs the
 * context for the current thread, delegates to {@link #execute(HeaderCarrier, ExecutionContext)}
 * and always clears the holder afterwards, so a pooled worker thread never carries one task's
 * identifiers into the next activity it runs.
 *
 * @param <I> activity input type
 */
public abstract class ContextAwareActivity<I extends HeaderCarrier> implements WorkflowActivity {

    private final Class<I> inputType;
    private final BoundaryInterceptor interceptor;

    protected ContextAwareActivity(Class<I> inputType) {
        this(inputType, new ContextPropagationInterceptor());
    }

    protected ContextAwareActivity(Class<I> inputType, BoundaryInterceptor interceptor) {
        this.inputType = inputType;
        this.interceptor = interceptor;
    }

    @Override
    public final Object run(WorkflowActivityContext ctx) {
        I input = ctx.getInput(inputType);
        try {
            ExecutionContext context = interceptor.onInboundReceipt(input == null ? null : input.headers());
            return execute(input, context);
        } finally {
            ExecutionContextHolder.clear();
        }
    }

    /**
     * Activity body. {@link ExecutionContextHolder#get()} returns {@code context} for the
     * duration of this call.
     */
    protected abstract Object execute(I input, ExecutionContext context);
}
