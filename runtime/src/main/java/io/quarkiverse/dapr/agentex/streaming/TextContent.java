package io.quarkiverse.dapr.agentex.streaming;

public record TextContent(String content) implements MessageContent {

    @Override
    public ContentKind deltaKind() {
        return ContentKind.TEXT;
    }
}
