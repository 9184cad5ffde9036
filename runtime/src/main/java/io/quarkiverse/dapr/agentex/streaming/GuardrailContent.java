package io.quarkiverse.dapr.agentex.streaming;

/**
 * Notice that a guardrail intervened in the agent's output.
 */
public record GuardrailContent(String guardrailName, String message) implements MessageContent {
}
