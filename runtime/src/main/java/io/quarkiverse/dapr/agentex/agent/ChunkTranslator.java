package io.quarkiverse.dapr.agentex.agent;

import java.util.Optional;

import io.quarkiverse.dapr.agentex.streaming.StreamEvent;

/**
 * Maps {@link AgentChunk}s to {@link StreamEvent}s for one invocation and remembers the response
 * id reported by the completion chunk.
 */
class ChunkTranslator {

    private String responseId;

    Optional<StreamEvent> translate(AgentChunk chunk) {
        return switch (chunk.kind()) {
            case TEXT_DELTA -> fragment(chunk).map(StreamEvent::text);
            case REASONING_DELTA -> fragment(chunk).map(StreamEvent::reasoning);
            case TOOL_CALL, TOOL_RESULT, GUARDRAIL -> Optional.of(StreamEvent.full(chunk.content()));
            case COMPLETED -> {
                responseId = chunk.responseId();
                yield Optional.empty();
            }
        };
    }

    String responseId() {
        return responseId;
    }

    // Empty fragments carry nothing and would only split blocks.
    private static Optional<String> fragment(AgentChunk chunk) {
        return chunk.text() == null || chunk.text().isEmpty() ? Optional.empty() : Optional.of(chunk.text());
    }
}
