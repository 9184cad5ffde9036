package io.quarkiverse.dapr.agentex.streaming;

/**
 * The final message of a successful stream could not be written to the {@link MessageStore}.
 * Fails the unit of work so the engine retries it.
 */
public class MessagePersistenceException extends RuntimeException {

    public MessagePersistenceException(String message, Throwable cause) {
        super(message, cause);
    }
}
