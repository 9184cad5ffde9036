package io.quarkiverse.dapr.agentex.streaming;

/**
 * Lifecycle of a {@link StreamingSession}.
 * <p>
 * {@code OPENING -> OPEN -> CLOSING -> CLOSED} on success,
 * {@code OPENING -> OPEN -> ABORTED} on failure. A failed final write moves
 * {@code CLOSING -> ABORTED}.
 */
public enum SessionState {
    OPENING,
    OPEN,
    CLOSING,
    CLOSED,
    ABORTED;

    public boolean isTerminal() {
        return this == CLOSED || this == ABORTED;
    }
}
