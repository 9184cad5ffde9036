package io.quarkiverse.dapr.agentex.streaming;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link MessageStore} backed by a {@link ConcurrentHashMap}. Messages are lost on restart.
 * <p>
 * The map is keyed by the (taskId, messageId) pair, so repeating an upsert replaces the record
 * instead of adding a second one.
 */
public class InMemoryMessageStore implements MessageStore {

    private record MessageKey(String taskId, String messageId) {
    }

    private final Map<MessageKey, AccumulatedMessage> messages = new ConcurrentHashMap<>();

    @Override
    public void upsert(String taskId, String messageId, AccumulatedMessage message) {
        messages.put(new MessageKey(taskId, messageId), message);
    }

    @Override
    public Optional<AccumulatedMessage> find(String taskId, String messageId) {
        return Optional.ofNullable(messages.get(new MessageKey(taskId, messageId)));
    }

    /**
     * All stored messages of {@code taskId}, in no particular order.
     */
    public List<AccumulatedMessage> messages(String taskId) {
        return messages.values().stream()
                .filter(message -> taskId.equals(message.taskId()))
                .toList();
    }

    public int size() {
        return messages.size();
    }
}
