package io.quarkiverse.dapr.agentex.interceptor;

import java.util.Map;

/**
 * Implemented by activity input records that carry out-of-band headers next to their
 * declared payload.
 * <p>
 * Dapr Workflows has no header map on {@code callActivity}, so the headers travel inside the
 * serialized input. They are written only by {@link ContextPropagatingActivityCaller} and read
 * only by {@link ContextAwareActivity}; activity code never sees them.
 */
public interface HeaderCarrier {

    Map<String, String> headers();
}
