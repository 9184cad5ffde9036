package io.quarkiverse.dapr.agentex.context;

/**
 * Ambient identifiers threaded from a task workflow into the activities it dispatches.
 * <p>
 * Every field is optional. {@link #EMPTY} is the normal value outside of any dispatch
 * boundary (unit tests, background jobs that are not tied to an agent task).
 *
 * @param taskId        the agent task the streamed output belongs to
 * @param traceId       trace to attach spans to
 * @param parentSpanId  span the invocation span is a child of
 */
public record ExecutionContext(String taskId, String traceId, String parentSpanId) {

    public static final ExecutionContext EMPTY = new ExecutionContext(null, null, null);

    public static ExecutionContext ofTask(String taskId) {
        return new ExecutionContext(taskId, null, null);
    }

    public boolean hasTaskId() {
        return taskId != null && !taskId.isBlank();
    }

    public boolean hasTraceId() {
        return traceId != null && !traceId.isBlank();
    }

    public boolean isEmpty() {
        return taskId == null && traceId == null && parentSpanId == null;
    }
}
