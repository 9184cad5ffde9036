package io.quarkiverse.dapr.agentex.streaming;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * The composed result of one streaming session, as handed to the {@link MessageStore}.
 *
 * @param taskId       owning task
 * @param messageId    id minted when the session opened
 * @param author       who the message is attributed to
 * @param content      composed content blocks in arrival order
 * @param finalMessage {@code true} once the session completed successfully
 */
public record AccumulatedMessage(
        String taskId,
        String messageId,
        MessageAuthor author,
        List<MessageContent> content,
        @JsonProperty("final") boolean finalMessage) {

    public AccumulatedMessage {
        content = content == null ? List.of() : List.copyOf(content);
    }

    /**
     * Concatenation of all text blocks, which is what a non-streaming caller sees as the output.
     */
    @JsonIgnore
    public String text() {
        return textOf(content);
    }

    public static String textOf(List<MessageContent> content) {
        StringBuilder sb = new StringBuilder();
        for (MessageContent block : content) {
            if (block instanceof TextContent text) {
                sb.append(text.content());
            }
        }
        return sb.toString();
    }
}
