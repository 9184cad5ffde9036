package io.quarkiverse.dapr.agentex.streaming;

import java.util.List;
import java.util.UUID;

/**
 * Opens {@link StreamingSession}s against one {@link StreamChannel} and {@link MessageStore}.
 * <p>
 * Prefer {@link #withSession}, which guarantees the session ends closed or aborted whatever the
 * callback does. {@link #open} hands out a raw session for callers that manage the scope themselves.
 */
public class StreamingAccumulator {

    /**
     * Body of a scoped session.
     */
    @FunctionalInterface
    public interface SessionCallback<T> {
        T apply(StreamingSession session);
    }

    private final StreamChannel channel;
    private final MessageStore store;
    private final boolean publishStartMarker;

    public StreamingAccumulator(StreamChannel channel, MessageStore store) {
        this(channel, store, true);
    }

    public StreamingAccumulator(StreamChannel channel, MessageStore store, boolean publishStartMarker) {
        this.channel = channel;
        this.store = store;
        this.publishStartMarker = publishStartMarker;
    }

    public StreamingSession open(String taskId, MessageAuthor author, List<MessageContent> seed) {
        return open(taskId, UUID.randomUUID().toString(), author, seed);
    }

    public StreamingSession open(String taskId, String messageId, MessageAuthor author, List<MessageContent> seed) {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId is required to open a streaming session");
        }
        StreamingSession session = new StreamingSession(taskId, messageId, author, seed, channel, store);
        session.open(publishStartMarker);
        return session;
    }

    public <T> T withSession(String taskId, MessageAuthor author, List<MessageContent> seed,
            SessionCallback<T> callback) {
        return withSession(taskId, UUID.randomUUID().toString(), author, seed, callback);
    }

    /**
     * Runs {@code callback} inside a fresh session. If the callback returns with the session still
     * open, the session is closed. If it throws, an open session is aborted and the exception is
     * rethrown unchanged.
     */
    public <T> T withSession(String taskId, String messageId, MessageAuthor author, List<MessageContent> seed,
            SessionCallback<T> callback) {
        StreamingSession session = open(taskId, messageId, author, seed);
        T result;
        try {
            result = callback.apply(session);
        } catch (Throwable e) {
            if (session.state() == SessionState.OPEN) {
                session.abort(e);
            }
            throw e;
        }
        if (session.state() == SessionState.OPEN) {
            session.close();
        }
        return result;
    }
}
