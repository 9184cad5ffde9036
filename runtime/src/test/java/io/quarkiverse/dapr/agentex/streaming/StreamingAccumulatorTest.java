package io.quarkiverse.dapr.agentex.streaming;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class StreamingAccumulatorTest {

    private InMemoryStreamChannel channel;
    private MessageStore store;
    private StreamingAccumulator accumulator;

    @BeforeEach
    void setUp() {
        channel = new InMemoryStreamChannel();
        store = mock(MessageStore.class);
        accumulator = new StreamingAccumulator(channel, store);
    }

    private List<StreamEvent> eventsOnChannel(String taskId, String messageId) {
        return channel.updates(taskId, messageId).stream()
                .filter(update -> update.event() != null)
                .map(StreamUpdate::event)
                .toList();
    }

    @Test
    void deltasThenDoneShouldStreamInOrderAndPersistOnce() {
        StreamingSession session = accumulator.open("t1", "m1", MessageAuthor.AGENT, List.of());

        session.publish(StreamEvent.text("Hel"));
        session.publish(StreamEvent.text("lo"));
        session.publish(StreamEvent.done());

        assertThat(eventsOnChannel("t1", "m1"))
                .containsExactly(StreamEvent.text("Hel"), StreamEvent.text("lo"), StreamEvent.done());
        ArgumentCaptor<AccumulatedMessage> persisted = ArgumentCaptor.forClass(AccumulatedMessage.class);
        verify(store, times(1)).upsert(eq("t1"), eq("m1"), persisted.capture());
        assertThat(persisted.getValue().content()).containsExactly(new TextContent("Hello"));
        assertThat(persisted.getValue().finalMessage()).isTrue();
        assertThat(persisted.getValue().author()).isEqualTo(MessageAuthor.AGENT);
        assertThat(session.state()).isEqualTo(SessionState.CLOSED);
    }

    @Test
    void channelShouldObserveEveryPublishInCallOrder() {
        List<StreamEvent> published = new ArrayList<>();
        StringBuilder expectedText = new StringBuilder();
        for (int i = 0; i < 50; i++) {
            if (i % 7 == 3) {
                published.add(StreamEvent.full(new ToolRequestContent("call-" + i, "tool", "{}")));
            } else {
                String fragment = "f" + i + ";";
                published.add(StreamEvent.text(fragment));
                expectedText.append(fragment);
            }
        }

        StreamingSession session = accumulator.open("t1", "m1", MessageAuthor.AGENT, List.of());
        published.forEach(session::publish);
        AccumulatedMessage message = session.close();

        List<StreamEvent> observed = eventsOnChannel("t1", "m1");
        assertThat(observed.subList(0, published.size())).containsExactlyElementsOf(published);
        assertThat(observed.get(observed.size() - 1)).isEqualTo(StreamEvent.done());
        assertThat(message.text()).isEqualTo(expectedText.toString());
        List<MessageContent> fullBlocks = message.content().stream()
                .filter(block -> block instanceof ToolRequestContent)
                .toList();
        assertThat(fullBlocks).hasSize(7);
        assertThat(message.content().get(1)).isEqualTo(new ToolRequestContent("call-3", "tool", "{}"));
    }

    @Test
    void sequenceNumbersShouldIncreaseFromStartMarker() {
        StreamingSession session = accumulator.open("t1", "m1", MessageAuthor.AGENT, List.of());
        session.publish(StreamEvent.text("a"));
        session.publish(StreamEvent.reasoning("b"));
        session.close();

        List<StreamUpdate> updates = channel.updates("t1", "m1");
        assertThat(updates).extracting(StreamUpdate::sequence).containsExactly(0L, 1L, 2L, 3L);
        assertThat(updates).extracting(StreamUpdate::kind).containsExactly(
                StreamUpdate.Kind.START, StreamUpdate.Kind.EVENT, StreamUpdate.Kind.EVENT, StreamUpdate.Kind.DONE);
    }

    @Test
    void startMarkerShouldCarrySeedAndCanBeDisabled() {
        List<MessageContent> seed = List.of(new TextContent("Draft: "));
        accumulator.open("t1", "m1", MessageAuthor.AGENT, seed);

        StreamUpdate start = channel.updates("t1", "m1").get(0);
        assertThat(start.kind()).isEqualTo(StreamUpdate.Kind.START);
        assertThat(start.seed()).isEqualTo(seed);

        StreamingAccumulator withoutMarker = new StreamingAccumulator(channel, store, false);
        withoutMarker.open("t1", "m2", MessageAuthor.AGENT, seed);
        assertThat(channel.updates("t1", "m2")).isEmpty();
    }

    @Test
    void seededSessionShouldContinueSeedText() {
        StreamingSession session = accumulator.open("t1", "m1", MessageAuthor.AGENT, List.of(new TextContent("Draft: ")));

        session.publish(StreamEvent.text("done"));
        AccumulatedMessage message = session.close();

        assertThat(message.content()).containsExactly(new TextContent("Draft: done"));
    }

    @Test
    void failureMidStreamShouldAbortWithoutPersisting() {
        AtomicReference<StreamingSession> sessionRef = new AtomicReference<>();

        assertThatThrownBy(() -> accumulator.withSession("t1", "m1", MessageAuthor.AGENT, List.of(), session -> {
            sessionRef.set(session);
            session.publish(StreamEvent.text("par"));
            throw new IllegalStateException("connection dropped");
        })).isInstanceOf(IllegalStateException.class).hasMessage("connection dropped");

        verify(store, never()).upsert(anyString(), anyString(), any());
        assertThat(sessionRef.get().state()).isEqualTo(SessionState.ABORTED);
        assertThat(channel.updates("t1", "m1"))
                .extracting(StreamUpdate::kind)
                .doesNotContain(StreamUpdate.Kind.DONE);
    }

    @Test
    void sessionAfterAbortedOneShouldPersistOnlyItsOwnContent() {
        InMemoryMessageStore messages = new InMemoryMessageStore();
        StreamingAccumulator accumulator = new StreamingAccumulator(channel, messages);

        assertThatThrownBy(() -> accumulator.withSession("t1", "m1", MessageAuthor.AGENT, List.of(), session -> {
            session.publish(StreamEvent.text("par"));
            throw new RuntimeException("dropped");
        })).isInstanceOf(RuntimeException.class);

        accumulator.withSession("t1", "m2", MessageAuthor.AGENT, List.of(), session -> {
            session.publish(StreamEvent.text("tial"));
            session.publish(StreamEvent.done());
            return null;
        });

        assertThat(messages.find("t1", "m1")).isEmpty();
        assertThat(messages.find("t1", "m2")).hasValueSatisfying(message -> {
            assertThat(message.content()).containsExactly(new TextContent("tial"));
            assertThat(message.finalMessage()).isTrue();
        });
        assertThat(messages.size()).isEqualTo(1);
    }

    @Test
    void toolRequestFollowedByTextShouldProduceTwoBlocks() {
        ToolRequestContent toolRequest = new ToolRequestContent("call-1", "X", "{}");

        AccumulatedMessage message = accumulator.withSession("t1", "m1", MessageAuthor.AGENT, List.of(), session -> {
            session.publish(StreamEvent.full(toolRequest));
            session.publish(StreamEvent.text("ok"));
            session.publish(StreamEvent.done());
            return session.message();
        });

        assertThat(message.content()).containsExactly(toolRequest, new TextContent("ok"));
        assertThat(message.finalMessage()).isTrue();
    }

    @Test
    void withSessionShouldCloseSessionLeftOpenByCallback() {
        StreamingSession session = accumulator.withSession("t1", "m1", MessageAuthor.USER, List.of(), s -> {
            s.publish(StreamEvent.text("hi"));
            return s;
        });

        assertThat(session.state()).isEqualTo(SessionState.CLOSED);
        verify(store).upsert(eq("t1"), eq("m1"), any(AccumulatedMessage.class));
    }

    @Test
    void withSessionShouldMintDistinctMessageIds() {
        String first = accumulator.withSession("t1", MessageAuthor.AGENT, List.of(), StreamingSession::messageId);
        String second = accumulator.withSession("t1", MessageAuthor.AGENT, List.of(), StreamingSession::messageId);

        assertThat(first).isNotBlank().isNotEqualTo(second);
    }

    @Test
    void publishAfterCloseShouldFail() {
        StreamingSession session = accumulator.open("t1", "m1", MessageAuthor.AGENT, List.of());
        session.close();

        assertThatThrownBy(() -> session.publish(StreamEvent.text("late")))
                .isInstanceOf(StreamingSessionException.class)
                .hasMessageContaining("CLOSED");
        assertThatThrownBy(session::close)
                .isInstanceOf(StreamingSessionException.class);
        verify(store, times(1)).upsert(anyString(), anyString(), any());
    }

    @Test
    void closeAfterAbortShouldFail() {
        StreamingSession session = accumulator.open("t1", "m1", MessageAuthor.AGENT, List.of());
        session.abort(new RuntimeException("cancelled"));

        assertThatThrownBy(session::close).isInstanceOf(StreamingSessionException.class);
        assertThatCode(() -> session.abort(null)).doesNotThrowAnyException();
        verify(store, never()).upsert(anyString(), anyString(), any());
    }

    @Test
    void persistenceFailureShouldAbortSessionAndSurface() {
        doThrow(new RuntimeException("state store unavailable"))
                .when(store).upsert(anyString(), anyString(), any());
        StreamingSession session = accumulator.open("t1", "m1", MessageAuthor.AGENT, List.of());
        session.publish(StreamEvent.text("Hello"));

        assertThatThrownBy(() -> session.publish(StreamEvent.done()))
                .isInstanceOf(MessagePersistenceException.class)
                .hasRootCauseMessage("state store unavailable");

        assertThat(session.state()).isEqualTo(SessionState.ABORTED);
        assertThat(channel.updates("t1", "m1"))
                .extracting(StreamUpdate::kind)
                .doesNotContain(StreamUpdate.Kind.DONE);
    }

    @Test
    void channelFailureShouldNotFailSession() {
        StreamChannel failingChannel = mock(StreamChannel.class);
        doThrow(new RuntimeException("pubsub down")).when(failingChannel).publish(anyString(), any());
        StreamingAccumulator accumulator = new StreamingAccumulator(failingChannel, store);

        StreamingSession session = accumulator.open("t1", "m1", MessageAuthor.AGENT, List.of());
        session.publish(StreamEvent.text("still"));
        AccumulatedMessage message = session.close();

        assertThat(message.text()).isEqualTo("still");
        verify(store).upsert("t1", "m1", message);
    }

    @Test
    void openShouldRequireTaskId() {
        assertThatThrownBy(() -> accumulator.open(" ", MessageAuthor.AGENT, List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
