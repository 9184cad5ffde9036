package io.quarkiverse.dapr.agentex.streaming;

/**
 * Kinds of content that arrive incrementally as {@link StreamEvent.Delta} fragments.
 */
public enum ContentKind {
    TEXT,
    REASONING
}
