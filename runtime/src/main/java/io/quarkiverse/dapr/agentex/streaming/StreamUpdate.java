package io.quarkiverse.dapr.agentex.streaming;

import java.util.List;

/**
 * The envelope published to a task's channel.
 * <p>
 * {@code sequence} starts at {@code 0} with the {@link Kind#START} marker and increases by one
 * for every update of the session; consumers deduplicate on {@code (messageId, sequence)}.
 *
 * @param taskId    task whose channel carries the update
 * @param messageId message the update belongs to
 * @param sequence  position within the session
 * @param kind      marker or event
 * @param event     the event for {@link Kind#EVENT} and {@link Kind#DONE}, {@code null} for {@link Kind#START}
 * @param seed      content the message was opened with, only set on {@link Kind#START}
 */
public record StreamUpdate(
        String taskId,
        String messageId,
        long sequence,
        Kind kind,
        StreamEvent event,
        List<MessageContent> seed) {

    public enum Kind {
        START,
        EVENT,
        DONE
    }

    public static StreamUpdate start(String taskId, String messageId, long sequence, List<MessageContent> seed) {
        return new StreamUpdate(taskId, messageId, sequence, Kind.START, null,
                seed == null ? List.of() : List.copyOf(seed));
    }

    public static StreamUpdate event(String taskId, String messageId, long sequence, StreamEvent event) {
        return new StreamUpdate(taskId, messageId, sequence, Kind.EVENT, event, null);
    }

    public static StreamUpdate done(String taskId, String messageId, long sequence) {
        return new StreamUpdate(taskId, messageId, sequence, Kind.DONE, StreamEvent.done(), null);
    }
}
