package io.quarkiverse.dapr.agentex.interceptor;

/**
 * Header keys under which {@link ContextPropagationInterceptor} stamps the execution context
 * onto an outgoing activity invocation.
 */
public final class StreamingHeaders {

    public static final String TASK_ID = "streaming-task-id";
    public static final String TRACE_ID = "streaming-trace-id";
    public static final String PARENT_SPAN_ID = "streaming-parent-span-id";

    private StreamingHeaders() {
    }
}
