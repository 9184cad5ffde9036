package io.quarkiverse.dapr.agentex.streaming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.dapr.client.DaprClient;
import reactor.core.publisher.Mono;

class DaprStreamChannelTest {

    private DaprClient daprClient;
    private DaprStreamChannel channel;

    @BeforeEach
    void setUp() {
        daprClient = mock(DaprClient.class);
        channel = new DaprStreamChannel(daprClient, "pubsub", "task:");
    }

    @Test
    void publishShouldTargetPerTaskTopic() {
        StreamUpdate update = StreamUpdate.event("t1", "m1", 1, StreamEvent.text("Hel"));
        when(daprClient.publishEvent(eq("pubsub"), eq("task:t1"), any(StreamUpdate.class))).thenReturn(Mono.empty());

        channel.publish("t1", update);

        verify(daprClient).publishEvent("pubsub", "task:t1", update);
        assertThat(channel.topic("t2")).isEqualTo("task:t2");
    }

    @Test
    void publishShouldSurfaceTransportFailure() {
        when(daprClient.publishEvent(eq("pubsub"), eq("task:t1"), any(StreamUpdate.class)))
                .thenReturn(Mono.error(new IllegalStateException("broker down")));

        assertThatThrownBy(() -> channel.publish("t1", StreamUpdate.done("t1", "m1", 2)))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("broker down");
    }
}
