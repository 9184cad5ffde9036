package io.quarkiverse.dapr.agentex.agent;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.quarkiverse.dapr.agentex.context.ExecutionContext;

/**
 * Keeps the attempts of every unit of work that has not succeeded yet.
 * <p>
 * The engine retries a failed activity with the same invocation id, so the ledger can number
 * attempts. Entries are dropped once an attempt succeeds, once an attempt fails for good, when
 * no attempt started for longer than the retention period, or when the ledger is full (oldest
 * first). Counts are per worker process: an attempt retried on another worker starts again at 1
 * there.
 */
public class InvocationLedger {

    static final int DEFAULT_MAX_ENTRIES = 1024;
    static final Duration DEFAULT_RETENTION = Duration.ofMinutes(30);

    private static final class Entry {
        private final List<RetryableInvocation> history = new ArrayList<>();
        private int started;
        private Instant lastStartedAt;
    }

    private final int maxEntries;
    private final Duration retention;
    private final Clock clock;

    // Ordered by last begin(), oldest first. Guarded by this.
    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public InvocationLedger() {
        this(DEFAULT_MAX_ENTRIES, DEFAULT_RETENTION, Clock.systemUTC());
    }

    public InvocationLedger(int maxEntries, Duration retention, Clock clock) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries must be at least 1, was " + maxEntries);
        }
        this.maxEntries = maxEntries;
        this.retention = retention;
        this.clock = clock;
    }

    public synchronized RetryableInvocation begin(String invocationId, ExecutionContext context) {
        Instant now = clock.instant();
        evictExpired(now);
        Entry entry = entries.remove(invocationId);
        if (entry == null) {
            entry = new Entry();
        }
        entry.started++;
        entry.lastStartedAt = now;
        entries.put(invocationId, entry);
        while (entries.size() > maxEntries) {
            Iterator<String> oldest = entries.keySet().iterator();
            oldest.next();
            oldest.remove();
        }
        RetryableInvocation attempt = new RetryableInvocation(invocationId, entry.started, context, null, null);
        entry.history.add(attempt);
        return attempt;
    }

    public synchronized RetryableInvocation succeeded(RetryableInvocation attempt, FinalResult result) {
        entries.remove(attempt.invocationId());
        return attempt.withResult(result);
    }

    /**
     * Records a failure the engine will retry. An attempt no longer tracked (its invocation
     * succeeded or was evicted meanwhile) is left out of the history.
     */
    public synchronized RetryableInvocation failed(RetryableInvocation attempt, Throwable error) {
        RetryableInvocation failed = attempt.withError(error);
        Entry entry = entries.get(attempt.invocationId());
        if (entry != null) {
            List<RetryableInvocation> history = entry.history;
            for (int i = 0; i < history.size(); i++) {
                if (history.get(i) == attempt) {
                    history.set(i, failed);
                    break;
                }
            }
        }
        return failed;
    }

    /**
     * Records a failure nobody will retry and forgets the invocation.
     */
    public synchronized RetryableInvocation failedForGood(RetryableInvocation attempt, Throwable error) {
        entries.remove(attempt.invocationId());
        return attempt.withError(error);
    }

    /**
     * Number of attempts started for {@code invocationId} that did not end in success yet.
     */
    public synchronized int attempts(String invocationId) {
        Entry entry = entries.get(invocationId);
        return entry == null ? 0 : entry.history.size();
    }

    public synchronized List<RetryableInvocation> history(String invocationId) {
        Entry entry = entries.get(invocationId);
        return entry == null ? List.of() : List.copyOf(entry.history);
    }

    public synchronized int size() {
        return entries.size();
    }

    private void evictExpired(Instant now) {
        Iterator<Entry> oldestFirst = entries.values().iterator();
        while (oldestFirst.hasNext()) {
            if (!oldestFirst.next().lastStartedAt.plus(retention).isBefore(now)) {
                return;
            }
            oldestFirst.remove();
        }
    }
}
