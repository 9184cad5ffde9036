package io.quarkiverse.dapr.agentex.agent;

import java.util.List;

import io.quarkiverse.dapr.agentex.streaming.MessageContent;

/**
 * Input of one {@link DurableCaller#invoke(AgentRequest)}.
 *
 * @param invocationId  stable id of the unit of work; identical across engine retries
 * @param prompt        the new user input
 * @param priorMessages conversation history, oldest first
 * @param resumeToken   opaque token of the previous turn, forwarded to the capability unchanged; may be {@code null}
 * @param seed          content the streamed message starts with; may be empty
 */
public record AgentRequest(
        String invocationId,
        String prompt,
        List<ConversationMessage> priorMessages,
        String resumeToken,
        List<MessageContent> seed) {

    public AgentRequest {
        priorMessages = priorMessages == null ? List.of() : List.copyOf(priorMessages);
        seed = seed == null ? List.of() : List.copyOf(seed);
    }
}
