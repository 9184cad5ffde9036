package io.quarkiverse.dapr.agentex.agent;

import io.quarkiverse.dapr.agentex.context.ExecutionContext;

/**
 * Record of one {@link DurableCaller} attempt.
 *
 * @param invocationId unit of work the attempt belongs to
 * @param attempt      1-based attempt number as seen by this worker
 * @param context      execution context the attempt ran with
 * @param result       result on success, otherwise {@code null}
 * @param error        failure, otherwise {@code null}
 */
public record RetryableInvocation(
        String invocationId,
        int attempt,
        ExecutionContext context,
        FinalResult result,
        Throwable error) {

    public boolean isPending() {
        return result == null && error == null;
    }

    public boolean isSucceeded() {
        return result != null;
    }

    public boolean isFailed() {
        return error != null;
    }

    RetryableInvocation withResult(FinalResult result) {
        return new RetryableInvocation(invocationId, attempt, context, result, null);
    }

    RetryableInvocation withError(Throwable error) {
        return new RetryableInvocation(invocationId, attempt, context, null, error);
    }
}
