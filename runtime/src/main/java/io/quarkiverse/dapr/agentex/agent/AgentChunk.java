package io.quarkiverse.dapr.agentex.agent;

import io.quarkiverse.dapr.agentex.streaming.GuardrailContent;
import io.quarkiverse.dapr.agentex.streaming.MessageContent;
import io.quarkiverse.dapr.agentex.streaming.ToolRequestContent;
import io.quarkiverse.dapr.agentex.streaming.ToolResponseContent;

/**
 * One native output unit of an {@link AgentCapability}, before translation into a stream event.
 *
 * @param kind       what the chunk carries
 * @param text       fragment for the delta kinds
 * @param content    complete block for tool calls, tool results and guardrail notices
 * @param responseId id of the finished response, only on {@link Kind#COMPLETED}
 */
public record AgentChunk(Kind kind, String text, MessageContent content, String responseId) {

    public enum Kind {
        TEXT_DELTA,
        REASONING_DELTA,
        TOOL_CALL,
        TOOL_RESULT,
        GUARDRAIL,
        COMPLETED
    }

    public static AgentChunk textDelta(String text) {
        return new AgentChunk(Kind.TEXT_DELTA, text, null, null);
    }

    public static AgentChunk reasoningDelta(String text) {
        return new AgentChunk(Kind.REASONING_DELTA, text, null, null);
    }

    public static AgentChunk toolCall(String toolCallId, String name, String arguments) {
        return new AgentChunk(Kind.TOOL_CALL, null, new ToolRequestContent(toolCallId, name, arguments), null);
    }

    public static AgentChunk toolResult(String toolCallId, String name, String result) {
        return new AgentChunk(Kind.TOOL_RESULT, null, new ToolResponseContent(toolCallId, name, result), null);
    }

    public static AgentChunk guardrail(String guardrailName, String message) {
        return new AgentChunk(Kind.GUARDRAIL, null, new GuardrailContent(guardrailName, message), null);
    }

    public static AgentChunk completed(String responseId) {
        return new AgentChunk(Kind.COMPLETED, null, null, responseId);
    }
}
