package io.quarkiverse.dapr.agentex.streaming;

public enum MessageAuthor {
    USER,
    AGENT
}
