package io.quarkiverse.dapr.agentex.agent.workflow;

import java.time.Duration;

import io.dapr.workflows.WorkflowTaskOptions;
import io.dapr.workflows.WorkflowTaskRetryPolicy;

/**
 * Engine-side retry policy of the invoke activity. A failed agent turn is retried by the
 * workflow engine, never by the activity itself.
 * <p>
 * Travels inside {@link AgentTaskInput}, so the interval is kept in milliseconds.
 */
public record InvokeRetryPolicy(int maxAttempts, long firstRetryIntervalMillis, double backoffCoefficient) {

    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final Duration DEFAULT_FIRST_RETRY_INTERVAL = Duration.ofSeconds(1);
    public static final double DEFAULT_BACKOFF_COEFFICIENT = 2.0;

    public InvokeRetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1, was " + maxAttempts);
        }
        if (firstRetryIntervalMillis <= 0) {
            throw new IllegalArgumentException("firstRetryInterval must be positive, was " + firstRetryIntervalMillis + " ms");
        }
        if (backoffCoefficient < 1.0) {
            throw new IllegalArgumentException("backoffCoefficient must be at least 1.0, was " + backoffCoefficient);
        }
    }

    public static InvokeRetryPolicy of(int maxAttempts, Duration firstRetryInterval, double backoffCoefficient) {
        return new InvokeRetryPolicy(maxAttempts, firstRetryInterval.toMillis(), backoffCoefficient);
    }

    public static InvokeRetryPolicy defaults() {
        return of(DEFAULT_MAX_ATTEMPTS, DEFAULT_FIRST_RETRY_INTERVAL, DEFAULT_BACKOFF_COEFFICIENT);
    }

    public Duration firstRetryInterval() {
        return Duration.ofMillis(firstRetryIntervalMillis);
    }

    public WorkflowTaskOptions toTaskOptions() {
        WorkflowTaskRetryPolicy retryPolicy = WorkflowTaskRetryPolicy.newBuilder()
                .setMaxNumberOfAttempts(maxAttempts)
                .setFirstRetryInterval(firstRetryInterval())
                .setBackoffCoefficient(backoffCoefficient)
                .build();
        return new WorkflowTaskOptions(retryPolicy);
    }
}
