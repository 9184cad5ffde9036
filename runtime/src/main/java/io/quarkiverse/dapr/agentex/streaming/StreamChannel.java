package io.quarkiverse.dapr.agentex.streaming;

/**
 * Ordered, append-only, per-task channel that streaming sessions publish to.
 * <p>
 * Delivery may be at-least-once; subscribers deduplicate on message id and sequence.
 */
public interface StreamChannel {

    void publish(String taskId, StreamUpdate update);
}
