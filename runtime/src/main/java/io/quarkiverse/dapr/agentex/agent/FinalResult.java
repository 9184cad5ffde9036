package io.quarkiverse.dapr.agentex.agent;

import java.util.List;

import io.quarkiverse.dapr.agentex.streaming.MessageContent;

/**
 * The materialized outcome of one agent turn, the value the workflow engine records for the activity.
 *
 * @param messageId   id of the persisted message, {@code null} when the call ran without streaming
 * @param output      concatenated text output
 * @param content     all composed content blocks
 * @param resumeToken token to pass with the next turn
 */
public record FinalResult(String messageId, String output, List<MessageContent> content, String resumeToken) {

    public FinalResult {
        content = content == null ? List.of() : List.copyOf(content);
    }
}
