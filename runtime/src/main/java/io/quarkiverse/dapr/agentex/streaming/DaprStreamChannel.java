package io.quarkiverse.dapr.agentex.streaming;

import io.dapr.client.DaprClient;

/**
 * {@link StreamChannel} that publishes each update to a Dapr pub/sub topic named
 * {@code topicPrefix + taskId}.
 */
public class DaprStreamChannel implements StreamChannel {

    private final DaprClient daprClient;
    private final String pubsubName;
    private final String topicPrefix;

    public DaprStreamChannel(DaprClient daprClient, String pubsubName, String topicPrefix) {
        this.daprClient = daprClient;
        this.pubsubName = pubsubName;
        this.topicPrefix = topicPrefix;
    }

    @Override
    public void publish(String taskId, StreamUpdate update) {
        daprClient.publishEvent(pubsubName, topic(taskId), update).block();
    }

    public String topic(String taskId) {
        return topicPrefix + taskId;
    }
}
