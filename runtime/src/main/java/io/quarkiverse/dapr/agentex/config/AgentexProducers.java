package io.quarkiverse.dapr.agentex.config;

import java.util.Optional;

import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import io.dapr.client.DaprClient;
import io.dapr.client.DaprClientBuilder;
import io.dapr.workflows.client.DaprWorkflowClient;
import io.quarkiverse.dapr.agentex.agent.AgentCapability;
import io.quarkiverse.dapr.agentex.agent.ChatModelAgentCapability;
import io.quarkiverse.dapr.agentex.agent.DurableCaller;
import io.quarkiverse.dapr.agentex.agent.InvocationLedger;
import io.quarkiverse.dapr.agentex.streaming.DaprMessageStore;
import io.quarkiverse.dapr.agentex.streaming.DaprStreamChannel;
import io.quarkiverse.dapr.agentex.streaming.InMemoryMessageStore;
import io.quarkiverse.dapr.agentex.streaming.InMemoryStreamChannel;
import io.quarkiverse.dapr.agentex.streaming.MessageStore;
import io.quarkiverse.dapr.agentex.streaming.StreamChannel;
import io.quarkiverse.dapr.agentex.streaming.StreamingAccumulator;
import io.quarkiverse.dapr.agentex.tracing.LoggingSpanRecorder;
import io.quarkiverse.dapr.agentex.tracing.SpanRecorder;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;

/**
 * CDI producers wiring the streaming pipeline from {@code agentex.*} configuration.
 * <p>
 * {@code agentex.transport=dapr} (the default) publishes to Dapr pub/sub and persists to a Dapr
 * state store; {@code in-memory} keeps both in the JVM for local development.
 */
@ApplicationScoped
public class AgentexProducers {

    private static final Logger LOG = Logger.getLogger(AgentexProducers.class);

    static final String TRANSPORT_DAPR = "dapr";
    static final String TRANSPORT_IN_MEMORY = "in-memory";

    @ConfigProperty(name = "agentex.transport", defaultValue = TRANSPORT_DAPR)
    String transport;

    @ConfigProperty(name = "agentex.streaming.pubsub", defaultValue = "pubsub")
    String pubsubName;

    @ConfigProperty(name = "agentex.streaming.topic-prefix", defaultValue = "task:")
    String topicPrefix;

    @ConfigProperty(name = "agentex.streaming.publish-start-marker", defaultValue = "true")
    boolean publishStartMarker;

    @ConfigProperty(name = "agentex.messages.statestore", defaultValue = "statestore")
    String stateStoreName;

    @ConfigProperty(name = "agentex.agent.system-message")
    Optional<String> systemMessage;

    @ConfigProperty(name = "agentex.agent.model-name")
    Optional<String> modelName;

    @Produces
    @Singleton
    DaprClient daprClient() {
        return new DaprClientBuilder().build();
    }

    void closeDaprClient(@Disposes DaprClient client) {
        close("DaprClient", client);
    }

    @Produces
    @Singleton
    DaprWorkflowClient daprWorkflowClient() {
        return new DaprWorkflowClient();
    }

    void closeDaprWorkflowClient(@Disposes DaprWorkflowClient client) {
        close("DaprWorkflowClient", client);
    }

    @Produces
    @Singleton
    StreamChannel streamChannel(Instance<DaprClient> daprClient) {
        if (inMemory()) {
            LOG.info("Using in-memory stream channel");
            return new InMemoryStreamChannel();
        }
        LOG.infof("Publishing stream updates to Dapr pub/sub %s, topic prefix '%s'", pubsubName, topicPrefix);
        return new DaprStreamChannel(daprClient.get(), pubsubName, topicPrefix);
    }

    @Produces
    @Singleton
    MessageStore messageStore(Instance<DaprClient> daprClient) {
        if (inMemory()) {
            LOG.info("Using in-memory message store");
            return new InMemoryMessageStore();
        }
        LOG.infof("Persisting final messages to Dapr state store %s", stateStoreName);
        return new DaprMessageStore(daprClient.get(), stateStoreName);
    }

    @Produces
    @Singleton
    StreamingAccumulator streamingAccumulator(StreamChannel channel, MessageStore store) {
        return new StreamingAccumulator(channel, store, publishStartMarker);
    }

    @Produces
    @Singleton
    SpanRecorder spanRecorder() {
        return new LoggingSpanRecorder();
    }

    @Produces
    @Singleton
    InvocationLedger invocationLedger() {
        return new InvocationLedger();
    }

    /**
     * Adapts the application's LangChain4j chat models. Applications with their own
     * {@link AgentCapability} replace this producer with an {@code @Alternative}.
     */
    @Produces
    @Singleton
    AgentCapability agentCapability(Instance<StreamingChatModel> streamingModel, Instance<ChatModel> chatModel) {
        if (!streamingModel.isResolvable() && !chatModel.isResolvable()) {
            throw new IllegalStateException(
                    "No AgentCapability available: provide a StreamingChatModel or ChatModel bean, "
                            + "or an alternative AgentCapability");
        }
        return new ChatModelAgentCapability(
                streamingModel.isResolvable() ? streamingModel.get() : null,
                chatModel.isResolvable() ? chatModel.get() : null,
                systemMessage.orElse(null),
                modelName.orElse(null));
    }

    @Produces
    @Singleton
    DurableCaller durableCaller(AgentCapability capability, StreamingAccumulator accumulator,
            SpanRecorder spanRecorder, InvocationLedger ledger) {
        return new DurableCaller(capability, accumulator, spanRecorder, ledger);
    }

    boolean inMemory() {
        if (TRANSPORT_IN_MEMORY.equalsIgnoreCase(transport)) {
            return true;
        }
        if (!TRANSPORT_DAPR.equalsIgnoreCase(transport)) {
            throw new IllegalArgumentException(
                    "Unknown agentex.transport '" + transport + "', expected 'dapr' or 'in-memory'");
        }
        return false;
    }

    private static void close(String name, AutoCloseable closeable) {
        try {
            closeable.close();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Interrupted while closing %s", name);
        } catch (Exception e) {
            LOG.warnf("Failed to close %s: %s", name, e.getMessage());
        }
    }
}
