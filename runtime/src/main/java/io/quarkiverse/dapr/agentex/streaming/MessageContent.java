package io.quarkiverse.dapr.agentex.streaming;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One composed content block of an {@link AccumulatedMessage}.
 * <p>
 * Serialized with a {@code type} discriminator so that stream updates and persisted messages
 * can be read back by consumers that only see JSON.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextContent.class, name = "text"),
        @JsonSubTypes.Type(value = ReasoningContent.class, name = "reasoning"),
        @JsonSubTypes.Type(value = ToolRequestContent.class, name = "tool_request"),
        @JsonSubTypes.Type(value = ToolResponseContent.class, name = "tool_response"),
        @JsonSubTypes.Type(value = GuardrailContent.class, name = "guardrail")
})
public sealed interface MessageContent
        permits TextContent, ReasoningContent, ToolRequestContent, ToolResponseContent, GuardrailContent {

    /**
     * The delta kind this block can be continued with, or {@code null} for content that only
     * ever arrives whole.
     */
    default ContentKind deltaKind() {
        return null;
    }

    static MessageContent ofKind(ContentKind kind, String content) {
        return switch (kind) {
            case TEXT -> new TextContent(content);
            case REASONING -> new ReasoningContent(content);
        };
    }
}
