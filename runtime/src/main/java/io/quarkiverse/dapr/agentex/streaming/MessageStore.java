package io.quarkiverse.dapr.agentex.streaming;

import java.util.Optional;

/**
 * Durable sink for final messages, keyed by task id and message id.
 * <p>
 * {@link #upsert} must be idempotent: writing the same message twice leaves one record.
 */
public interface MessageStore {

    void upsert(String taskId, String messageId, AccumulatedMessage message);

    Optional<AccumulatedMessage> find(String taskId, String messageId);
}
