package io.quarkiverse.dapr.agentex.streaming;

import java.util.List;

import org.jboss.logging.Logger;

/**
 * One streaming session for a single (task, message) pair.
 * <p>
 * Every {@link #publish(StreamEvent)} is folded into the message being composed and forwarded
 * to the task's {@link StreamChannel} right away, in call order. {@link #close()} writes the
 * final message to the {@link MessageStore} once and then emits the terminal marker.
 * {@link #abort(Throwable)} drops the partial message without writing it.
 * <p>
 * Sessions are obtained from {@link StreamingAccumulator}. Publishing to, or closing, a session
 * that is no longer open throws {@link StreamingSessionException}.
 */
public class StreamingSession {

    private static final Logger LOG = Logger.getLogger(StreamingSession.class);

    private final String taskId;
    private final String messageId;
    private final MessageAuthor author;
    private final StreamChannel channel;
    private final MessageStore store;
    private final List<MessageContent> seed;
    private final ContentComposer composer;

    private SessionState state = SessionState.OPENING;
    private long nextSequence;

    StreamingSession(String taskId, String messageId, MessageAuthor author, List<MessageContent> seed,
            StreamChannel channel, MessageStore store) {
        this.taskId = taskId;
        this.messageId = messageId;
        this.author = author;
        this.seed = seed == null ? List.of() : List.copyOf(seed);
        this.channel = channel;
        this.store = store;
        this.composer = new ContentComposer(this.seed);
    }

    synchronized void open(boolean publishStartMarker) {
        if (state != SessionState.OPENING) {
            throw new StreamingSessionException(describe("cannot open session in state " + state));
        }
        if (publishStartMarker) {
            send(StreamUpdate.start(taskId, messageId, nextSequence++, seed));
        }
        state = SessionState.OPEN;
        LOG.infof("[Task:%s][Message:%s] Streaming session opened — author=%s, seedBlocks=%d",
                taskId, messageId, author, seed.size());
    }

    /**
     * Appends {@code event} to the message and forwards it to the channel. A {@link StreamEvent.Done}
     * closes the session, as {@link #close()} does.
     */
    public synchronized void publish(StreamEvent event) {
        requireOpen("publish");
        if (event.isTerminal()) {
            close();
            return;
        }
        composer.apply(event);
        send(StreamUpdate.event(taskId, messageId, nextSequence++, event));
    }

    /**
     * Persists the message with {@code final=true}, then publishes the terminal marker.
     *
     * @return the persisted message
     * @throws MessagePersistenceException if the store rejects the write; the session is then aborted
     *         and no terminal marker is published
     */
    public synchronized AccumulatedMessage close() {
        requireOpen("close");
        state = SessionState.CLOSING;
        composer.apply(StreamEvent.done());
        AccumulatedMessage message = new AccumulatedMessage(taskId, messageId, author, composer.blocks(), true);
        try {
            store.upsert(taskId, messageId, message);
        } catch (RuntimeException e) {
            state = SessionState.ABORTED;
            LOG.errorf("[Task:%s][Message:%s] Failed to persist final message — %s",
                    taskId, messageId, e.getMessage());
            throw new MessagePersistenceException(describe("failed to persist final message"), e);
        }
        send(StreamUpdate.done(taskId, messageId, nextSequence++));
        state = SessionState.CLOSED;
        LOG.infof("[Task:%s][Message:%s] Streaming session closed — blocks=%d, updates=%d",
                taskId, messageId, message.content().size(), nextSequence);
        return message;
    }

    /**
     * Discards the partial message. Updates already published stay on the channel; no terminal
     * marker is sent, so consumers see the session as abandoned.
     */
    public synchronized void abort(Throwable cause) {
        if (state == SessionState.ABORTED) {
            return;
        }
        if (state == SessionState.CLOSED) {
            throw new StreamingSessionException(describe("cannot abort a closed session"));
        }
        state = SessionState.ABORTED;
        LOG.warnf("[Task:%s][Message:%s] Streaming session aborted after %d updates — %s",
                taskId, messageId, nextSequence, cause == null ? "no cause" : cause.toString());
    }

    public synchronized SessionState state() {
        return state;
    }

    /**
     * Snapshot of the message as composed so far. {@code finalMessage} is set once the session is closed.
     */
    public synchronized AccumulatedMessage message() {
        return new AccumulatedMessage(taskId, messageId, author, composer.blocks(), state == SessionState.CLOSED);
    }

    public String taskId() {
        return taskId;
    }

    public String messageId() {
        return messageId;
    }

    public MessageAuthor author() {
        return author;
    }

    private void requireOpen(String operation) {
        if (state != SessionState.OPEN) {
            throw new StreamingSessionException(describe("cannot " + operation + " session in state " + state));
        }
    }

    private void send(StreamUpdate update) {
        try {
            channel.publish(taskId, update);
            LOG.debugf("[Task:%s][Message:%s] Published %s #%d", taskId, messageId, update.kind(), update.sequence());
        } catch (RuntimeException e) {
            // Delivery is fire-and-forget; subscribers detect gaps through the missing sequence.
            LOG.warnf("[Task:%s][Message:%s] Failed to publish %s #%d — %s",
                    taskId, messageId, update.kind(), update.sequence(), e.getMessage());
        }
    }

    private String describe(String problem) {
        return "[Task:" + taskId + "][Message:" + messageId + "] " + problem;
    }
}
