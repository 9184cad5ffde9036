package io.quarkiverse.dapr.agentex.streaming.consumer;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.jboss.logging.Logger;

import io.quarkiverse.dapr.agentex.streaming.StreamUpdate;

/**
 * Subscriber-side bookkeeping for a task channel.
 * <p>
 * Drops transport duplicates by {@code (messageId, sequence)} and rebuilds each message's
 * content from the updates it has seen. A session that never received its terminal marker and
 * has been silent for longer than a timeout is reported by {@link #abandoned}; this is how a
 * consumer learns that an attempt failed and its partial content should give way to the
 * retry's new message.
 */
public class StreamSessionTracker {

    private static final Logger LOG = Logger.getLogger(StreamSessionTracker.class);

    private final Clock clock;
    private final Map<String, TrackedSession> sessions = new LinkedHashMap<>();

    public StreamSessionTracker() {
        this(Clock.systemUTC());
    }

    public StreamSessionTracker(Clock clock) {
        this.clock = clock;
    }

    /**
     * @return {@code false} if the update is a duplicate and was ignored
     */
    public synchronized boolean accept(StreamUpdate update) {
        TrackedSession session = sessions.computeIfAbsent(update.messageId(),
                id -> new TrackedSession(update.taskId(), id));
        boolean fresh = session.apply(update, clock.instant());
        if (!fresh) {
            LOG.debugf("[Task:%s][Message:%s] Dropping duplicate update #%d",
                    update.taskId(), update.messageId(), update.sequence());
        }
        return fresh;
    }

    /**
     * Sessions without a terminal marker whose last update is older than {@code timeout}.
     */
    public synchronized List<TrackedSession> abandoned(Instant now, Duration timeout) {
        List<TrackedSession> result = new ArrayList<>();
        for (TrackedSession session : sessions.values()) {
            if (session.isAbandoned(now, timeout)) {
                result.add(session);
            }
        }
        return result;
    }

    public List<TrackedSession> abandoned(Duration timeout) {
        return abandoned(clock.instant(), timeout);
    }

    public synchronized Optional<TrackedSession> session(String messageId) {
        return Optional.ofNullable(sessions.get(messageId));
    }

    /**
     * Sessions of {@code taskId} in the order their first update arrived.
     */
    public synchronized List<TrackedSession> sessions(String taskId) {
        return sessions.values().stream()
                .filter(session -> taskId.equals(session.taskId()))
                .toList();
    }

    public synchronized void forget(String messageId) {
        sessions.remove(messageId);
    }
}
