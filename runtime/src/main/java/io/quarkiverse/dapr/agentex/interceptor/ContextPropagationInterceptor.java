package io.quarkiverse.dapr.agentex.interceptor;

import java.util.Map;

import org.jboss.logging.Logger;

import io.quarkiverse.dapr.agentex.context.ExecutionContext;
import io.quarkiverse.dapr.agentex.context.ExecutionContextHolder;
import jakarta.enterprise.context.ApplicationScoped;

/**
 * Default {@link BoundaryInterceptor}: copies task id, trace id and parent span id into the
 * {@link StreamingHeaders} keys and back.
 * <p>
 * A missing or malformed header is treated as absent. The activity then runs with a partial
 * or {@link ExecutionContext#EMPTY} context, which every reader tolerates.
 */
@ApplicationScoped
public class ContextPropagationInterceptor implements BoundaryInterceptor {

    private static final Logger LOG = Logger.getLogger(ContextPropagationInterceptor.class);

    static final int MAX_VALUE_LENGTH = 512;

    @Override
    public void onOutboundDispatch(ExecutionContext callerState, Map<String, String> outgoingHeaders) {
        if (callerState == null) {
            return;
        }
        putIfPresent(outgoingHeaders, StreamingHeaders.TASK_ID, callerState.taskId());
        putIfPresent(outgoingHeaders, StreamingHeaders.TRACE_ID, callerState.traceId());
        putIfPresent(outgoingHeaders, StreamingHeaders.PARENT_SPAN_ID, callerState.parentSpanId());
    }

    @Override
    public ExecutionContext onInboundReceipt(Map<String, String> incomingHeaders) {
        ExecutionContext context = decode(incomingHeaders);
        ExecutionContextHolder.set(context);
        if (context.hasTaskId()) {
            LOG.debugf("[Task:%s] Execution context installed — traceId=%s, parentSpanId=%s",
                    context.taskId(), context.traceId(), context.parentSpanId());
        } else {
            LOG.debug("No task id in activity headers — running without streaming context");
        }
        return context;
    }

    static ExecutionContext decode(Map<String, String> headers) {
        if (headers == null || headers.isEmpty()) {
            return ExecutionContext.EMPTY;
        }
        String taskId = readValue(headers, StreamingHeaders.TASK_ID);
        String traceId = readValue(headers, StreamingHeaders.TRACE_ID);
        String parentSpanId = readValue(headers, StreamingHeaders.PARENT_SPAN_ID);
        if (taskId == null && traceId == null && parentSpanId == null) {
            return ExecutionContext.EMPTY;
        }
        return new ExecutionContext(taskId, traceId, parentSpanId);
    }

    private static String readValue(Map<String, String> headers, String key) {
        String value = headers.get(key);
        if (value == null) {
            return null;
        }
        if (!isWellFormed(value)) {
            LOG.warnf("Ignoring malformed header %s (length=%d)", key, value.length());
            return null;
        }
        return value;
    }

    private static boolean isWellFormed(String value) {
        if (value.isBlank() || value.length() > MAX_VALUE_LENGTH) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (Character.isISOControl(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static void putIfPresent(Map<String, String> headers, String key, String value) {
        if (value != null && !value.isBlank()) {
            headers.put(key, value);
        }
    }
}
