package io.quarkiverse.dapr.agentex.context;

import java.util.concurrent.Callable;

/**
 * Thread-local holder for the {@link ExecutionContext} of the activity execution running on
 * the current thread.
 * <p>
 * Populated once by {@link io.quarkiverse.dapr.agentex.interceptor.BoundaryInterceptor#onInboundReceipt}
 * before any activity code runs, read by {@link io.quarkiverse.dapr.agentex.agent.DurableCaller},
 * and cleared when the activity finishes so a pooled worker thread never carries identifiers
 * into an unrelated execution.
 */
public class ExecutionContextHolder {

    private static final ThreadLocal<ExecutionContext> CONTEXT = new ThreadLocal<>();

    private ExecutionContextHolder() {
    }

    /**
     * Installs the context for the current execution.
     *
     * @throws IllegalStateException if a context was already installed and not cleared
     */
    public static void set(ExecutionContext context) {
        if (CONTEXT.get() != null) {
            throw new IllegalStateException("ExecutionContext already set for this execution: " + CONTEXT.get());
        }
        CONTEXT.set(context != null ? context : ExecutionContext.EMPTY);
    }

    /**
     * Returns the installed context, or {@link ExecutionContext#EMPTY}. Never throws.
     */
    public static ExecutionContext get() {
        ExecutionContext context = CONTEXT.get();
        return context != null ? context : ExecutionContext.EMPTY;
    }

    public static void clear() {
        CONTEXT.remove();
    }

    /**
     * Runs {@code callable} with {@code context} installed and clears it afterwards.
     */
    public static <T> T callWith(ExecutionContext context, Callable<T> callable) throws Exception {
        set(context);
        try {
            return callable.call();
        } finally {
            clear();
        }
    }
}
