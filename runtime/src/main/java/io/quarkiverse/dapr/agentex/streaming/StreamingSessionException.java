package io.quarkiverse.dapr.agentex.streaming;

/**
 * Thrown when a session is used after it stopped being open, e.g. a second {@code close()}.
 */
public class StreamingSessionException extends IllegalStateException {

    public StreamingSessionException(String message) {
        super(message);
    }
}
