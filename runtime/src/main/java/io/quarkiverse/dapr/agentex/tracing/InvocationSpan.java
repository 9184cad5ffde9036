package io.quarkiverse.dapr.agentex.tracing;

import java.util.Map;

/**
 * A started span. Exactly one of {@link #end(Map)} or {@link #fail(Throwable)} is called.
 */
public interface InvocationSpan {

    String traceId();

    String spanId();

    String parentSpanId();

    void end(Map<String, Object> output);

    void fail(Throwable error);
}
