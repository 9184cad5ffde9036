package io.quarkiverse.dapr.agentex.streaming.consumer;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.NavigableMap;
import java.util.TreeMap;

import io.quarkiverse.dapr.agentex.streaming.ContentComposer;
import io.quarkiverse.dapr.agentex.streaming.MessageContent;
import io.quarkiverse.dapr.agentex.streaming.StreamUpdate;

/**
 * Consumer-side view of one session, rebuilt from the updates seen on the channel.
 * <p>
 * Content is composed in sequence order whatever the arrival order, so a START redelivered
 * after later events still puts its seed in front.
 */
public final class TrackedSession {

    private final String taskId;
    private final String messageId;
    private final NavigableMap<Long, StreamUpdate> updates = new TreeMap<>();
    private Instant lastUpdateAt;
    private boolean done;

    TrackedSession(String taskId, String messageId) {
        this.taskId = taskId;
        this.messageId = messageId;
    }

    synchronized boolean apply(StreamUpdate update, Instant receivedAt) {
        if (updates.putIfAbsent(update.sequence(), update) != null) {
            return false;
        }
        lastUpdateAt = receivedAt;
        if (update.kind() == StreamUpdate.Kind.DONE) {
            done = true;
        }
        return true;
    }

    synchronized boolean isAbandoned(Instant now, Duration timeout) {
        return !done && lastUpdateAt.plus(timeout).isBefore(now);
    }

    public String taskId() {
        return taskId;
    }

    public String messageId() {
        return messageId;
    }

    public synchronized boolean isDone() {
        return done;
    }

    public synchronized Instant lastUpdateAt() {
        return lastUpdateAt;
    }

    public synchronized int updateCount() {
        return updates.size();
    }

    public synchronized List<MessageContent> content() {
        StreamUpdate first = updates.isEmpty() ? null : updates.firstEntry().getValue();
        ContentComposer composer = first != null && first.kind() == StreamUpdate.Kind.START
                ? new ContentComposer(first.seed())
                : new ContentComposer();
        for (StreamUpdate update : updates.values()) {
            if (update.kind() != StreamUpdate.Kind.START) {
                composer.apply(update.event());
            }
        }
        return composer.blocks();
    }
}
