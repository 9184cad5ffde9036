package io.quarkiverse.dapr.agentex.streaming;

public record ReasoningContent(String content) implements MessageContent {

    @Override
    public ContentKind deltaKind() {
        return ContentKind.REASONING;
    }
}
