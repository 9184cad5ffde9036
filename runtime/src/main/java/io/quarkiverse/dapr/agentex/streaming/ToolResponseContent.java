package io.quarkiverse.dapr.agentex.streaming;

public record ToolResponseContent(String toolCallId, String name, String content) implements MessageContent {
}
