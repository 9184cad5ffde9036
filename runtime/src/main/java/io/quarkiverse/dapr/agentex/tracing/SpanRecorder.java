package io.quarkiverse.dapr.agentex.tracing;

import java.util.Map;

/**
 * Starts spans inside an existing trace. Implementations forward them to whatever tracing
 * backend the application uses.
 */
public interface SpanRecorder {

    InvocationSpan start(String traceId, String parentSpanId, String name, Map<String, Object> input);
}
