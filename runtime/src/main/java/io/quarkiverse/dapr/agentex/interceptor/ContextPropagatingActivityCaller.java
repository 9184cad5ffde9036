package io.quarkiverse.dapr.agentex.interceptor;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

import io.dapr.workflows.WorkflowContext;
import io.dapr.workflows.WorkflowTaskOptions;
import io.quarkiverse.dapr.agentex.context.ExecutionContext;

/**
 * Workflow-side half of the boundary: builds the header map for an activity call, lets the
 * {@link BoundaryInterceptor} stamp the workflow's identifiers into it and schedules the activity
 * with the headers embedded in its input.
 * <p>
 * Everything here runs inside workflow code and is replayed, so it does nothing but build
 * values and delegate to {@link WorkflowContext#callActivity}.
 */
public class ContextPropagatingActivityCaller {

    private final BoundaryInterceptor interceptor;

    public ContextPropagatingActivityCaller() {
        this(new ContextPropagationInterceptor());
    }

    public ContextPropagatingActivityCaller(BoundaryInterceptor interceptor) {
        this.interceptor = interceptor;
    }

    public <I extends HeaderCarrier, O> O call(WorkflowContext ctx, String activityName, ExecutionContext callerState,
            Function<Map<String, String>, I> inputFactory, WorkflowTaskOptions options, Class<O> resultType) {
        Map<String, String> headers = new LinkedHashMap<>();
        interceptor.onOutboundDispatch(callerState, headers);
        I input = inputFactory.apply(Map.copyOf(headers));
        return ctx.callActivity(activityName, input, options, resultType).await();
    }
}
