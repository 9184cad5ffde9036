package io.quarkiverse.dapr.agentex.streaming;

/**
 * A tool invocation requested by the agent.
 *
 * @param toolCallId id correlating the request with its {@link ToolResponseContent}
 * @param name       tool name
 * @param arguments  arguments as the raw JSON string produced by the model
 */
public record ToolRequestContent(String toolCallId, String name, String arguments) implements MessageContent {
}
