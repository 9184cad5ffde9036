package io.quarkiverse.dapr.agentex.interceptor;

import java.util.Map;

import io.quarkiverse.dapr.agentex.context.ExecutionContext;

/**
 * The two hooks that run where control crosses from a task workflow into an activity.
 */
public interface BoundaryInterceptor {

    /**
     * Runs on the workflow side just before an activity is scheduled.
     * <p>
     * Workflow code is replayed by the engine, so implementations must be pure: no I/O, no
     * clock, no randomness, no blocking. Only {@code outgoingHeaders} may be modified.
     *
     * @param callerState      the identifiers the workflow keeps in its own state
     * @param outgoingHeaders  mutable header map of the activity invocation being dispatched
     */
    void onOutboundDispatch(ExecutionContext callerState, Map<String, String> outgoingHeaders);

    /**
     * Runs on the activity side once per execution, before any activity code.
     * Installs the decoded context in {@link io.quarkiverse.dapr.agentex.context.ExecutionContextHolder}.
     *
     * @param incomingHeaders  headers received with the invocation, possibly empty
     * @return the installed context, {@link ExecutionContext#EMPTY} when nothing usable was received
     */
    ExecutionContext onInboundReceipt(Map<String, String> incomingHeaders);
}
