package io.quarkiverse.dapr.agentex.agent.activities;

import java.util.List;
import java.util.Map;

import io.quarkiverse.dapr.agentex.agent.AgentRequest;
import io.quarkiverse.dapr.agentex.agent.ConversationMessage;
import io.quarkiverse.dapr.agentex.interceptor.HeaderCarrier;
import io.quarkiverse.dapr.agentex.streaming.MessageContent;

/**
 * Input for {@link StreamingInvokeActivity}. {@code headers} is filled by the boundary interceptor;
 * the other fields are the agent turn itself.
 */
public record InvokeAgentInput(
        Map<String, String> headers,
        String invocationId,
        String prompt,
        List<ConversationMessage> priorMessages,
        String resumeToken,
        List<MessageContent> seed) implements HeaderCarrier {

    public InvokeAgentInput {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }

    public AgentRequest toRequest() {
        return new AgentRequest(invocationId, prompt, priorMessages, resumeToken, seed);
    }
}
