package io.quarkiverse.dapr.agentex.streaming;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

import io.dapr.client.DaprClient;
import io.dapr.client.domain.State;

/**
 * A {@link MessageStore} backed by Dapr's key-value state store.
 * <p>
 * Messages are stored under the key {@code messages:<taskId>:<messageId>}, both ids URL-encoded
 * so a {@code ':'} inside an id cannot make two messages share a key. Dapr state writes are
 * last-write-wins per key, so a repeated upsert of the same message is harmless.
 */
public class DaprMessageStore implements MessageStore {

    static final String KEY_PREFIX = "messages:";

    private final DaprClient daprClient;
    private final String stateStoreName;

    public DaprMessageStore(DaprClient daprClient, String stateStoreName) {
        this.daprClient = daprClient;
        this.stateStoreName = stateStoreName;
    }

    @Override
    public void upsert(String taskId, String messageId, AccumulatedMessage message) {
        daprClient.saveState(stateStoreName, key(taskId, messageId), message).block();
    }

    @Override
    public Optional<AccumulatedMessage> find(String taskId, String messageId) {
        State<AccumulatedMessage> state = daprClient
                .getState(stateStoreName, key(taskId, messageId), AccumulatedMessage.class)
                .block();
        if (state == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(state.getValue());
    }

    static String key(String taskId, String messageId) {
        return KEY_PREFIX + encode(taskId) + ":" + encode(messageId);
    }

    private static String encode(String id) {
        return URLEncoder.encode(id, StandardCharsets.UTF_8);
    }
}
