package io.quarkiverse.dapr.agentex.streaming;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * {@link StreamChannel} that keeps every update in memory, one ordered log per task.
 * Used for local development and tests.
 */
public class InMemoryStreamChannel implements StreamChannel {

    private final Map<String, List<StreamUpdate>> logs = new ConcurrentHashMap<>();

    @Override
    public void publish(String taskId, StreamUpdate update) {
        List<StreamUpdate> log = logs.computeIfAbsent(taskId, id -> new ArrayList<>());
        synchronized (log) {
            log.add(update);
        }
    }

    /**
     * All updates published for {@code taskId}, in publish order.
     */
    public List<StreamUpdate> updates(String taskId) {
        List<StreamUpdate> log = logs.get(taskId);
        if (log == null) {
            return List.of();
        }
        synchronized (log) {
            return List.copyOf(log);
        }
    }

    /**
     * Updates of one message, in publish order.
     */
    public List<StreamUpdate> updates(String taskId, String messageId) {
        return updates(taskId).stream()
                .filter(update -> messageId.equals(update.messageId()))
                .toList();
    }

    public void cleanup(String taskId) {
        logs.remove(taskId);
    }
}
