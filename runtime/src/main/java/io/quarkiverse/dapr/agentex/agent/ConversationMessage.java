package io.quarkiverse.dapr.agentex.agent;

import io.quarkiverse.dapr.agentex.streaming.MessageAuthor;

/**
 * One earlier message of the conversation, handed to the agent as history.
 */
public record ConversationMessage(MessageAuthor author, String content) {

    public static ConversationMessage user(String content) {
        return new ConversationMessage(MessageAuthor.USER, content);
    }

    public static ConversationMessage agent(String content) {
        return new ConversationMessage(MessageAuthor.AGENT, content);
    }
}
