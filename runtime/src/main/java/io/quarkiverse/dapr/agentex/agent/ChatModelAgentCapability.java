package io.quarkiverse.dapr.agentex.agent;

import java.util.ArrayList;
import java.util.List;

import org.jboss.logging.Logger;

import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.StreamingChatModel;
import dev.langchain4j.model.chat.request.ChatRequest;
import dev.langchain4j.model.chat.response.ChatResponse;
import dev.langchain4j.model.chat.response.StreamingChatResponseHandler;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

/**
 * {@link AgentCapability} backed by LangChain4j chat models.
 * <p>
 * Streaming turns go through the {@link StreamingChatModel}: every partial response becomes a
 * text delta, tool execution requests of the completed response become tool call chunks and the
 * response id is reported as the completion chunk. Non-streaming turns use the {@link ChatModel}
 * when one is configured and fall back to the streaming model otherwise.
 * <p>
 * LangChain4j chat requests carry the whole history, so the resume token is not sent to the
 * model; the history in {@link AgentRequest#priorMessages()} is.
 */
public class ChatModelAgentCapability implements AgentCapability {

    private static final Logger LOG = Logger.getLogger(ChatModelAgentCapability.class);

    private final StreamingChatModel streamingModel;
    private final ChatModel chatModel;
    private final String systemMessage;
    private final String modelName;

    public ChatModelAgentCapability(StreamingChatModel streamingModel, ChatModel chatModel, String systemMessage,
            String modelName) {
        if (streamingModel == null && chatModel == null) {
            throw new IllegalArgumentException("Either a StreamingChatModel or a ChatModel is required");
        }
        this.streamingModel = streamingModel;
        this.chatModel = chatModel;
        this.systemMessage = systemMessage;
        this.modelName = modelName;
    }

    @Override
    public String modelName() {
        return modelName != null ? modelName : AgentCapability.super.modelName();
    }

    @Override
    public Flux<AgentChunk> execute(AgentRequest request, boolean streaming) {
        ChatRequest chatRequest = ChatRequest.builder().messages(toMessages(request)).build();
        if (streaming && streamingModel != null) {
            return stream(chatRequest);
        }
        if (chatModel != null) {
            return Flux.defer(() -> Flux.fromIterable(toChunks(chatModel.chat(chatRequest))));
        }
        return stream(chatRequest);
    }

    /**
     * LangChain4j offers no way to stop a streaming call, so cancelling the returned flux only
     * detaches it: the model may keep generating, and its later callbacks are dropped.
     */
    private Flux<AgentChunk> stream(ChatRequest chatRequest) {
        return Flux.create(sink -> {
            SinkHandler handler = new SinkHandler(sink);
            sink.onCancel(handler::cancel);
            streamingModel.chat(chatRequest, handler);
        });
    }

    List<ChatMessage> toMessages(AgentRequest request) {
        List<ChatMessage> messages = new ArrayList<>();
        if (systemMessage != null && !systemMessage.isBlank()) {
            messages.add(SystemMessage.from(systemMessage));
        }
        for (ConversationMessage prior : request.priorMessages()) {
            switch (prior.author()) {
                case USER -> messages.add(UserMessage.from(prior.content()));
                case AGENT -> messages.add(AiMessage.from(prior.content()));
            }
        }
        messages.add(UserMessage.from(request.prompt()));
        return messages;
    }

    static List<AgentChunk> toChunks(ChatResponse response) {
        List<AgentChunk> chunks = new ArrayList<>();
        AiMessage aiMessage = response.aiMessage();
        if (aiMessage.text() != null && !aiMessage.text().isEmpty()) {
            chunks.add(AgentChunk.textDelta(aiMessage.text()));
        }
        chunks.addAll(toolCalls(aiMessage));
        chunks.add(AgentChunk.completed(response.metadata().id()));
        return chunks;
    }

    private static List<AgentChunk> toolCalls(AiMessage aiMessage) {
        if (!aiMessage.hasToolExecutionRequests()) {
            return List.of();
        }
        List<AgentChunk> chunks = new ArrayList<>();
        for (ToolExecutionRequest toolRequest : aiMessage.toolExecutionRequests()) {
            chunks.add(AgentChunk.toolCall(toolRequest.id(), toolRequest.name(), toolRequest.arguments()));
        }
        return chunks;
    }

    static final class SinkHandler implements StreamingChatResponseHandler {

        private final FluxSink<AgentChunk> sink;
        private boolean receivedPartial;
        private volatile boolean cancelled;

        SinkHandler(FluxSink<AgentChunk> sink) {
            this.sink = sink;
        }

        void cancel() {
            cancelled = true;
            LOG.debug("Streaming chat response cancelled — later partial responses are dropped");
        }

        boolean isCancelled() {
            return cancelled;
        }

        @Override
        public void onPartialResponse(String partialResponse) {
            if (cancelled) {
                return;
            }
            receivedPartial = true;
            sink.next(AgentChunk.textDelta(partialResponse));
        }

        @Override
        public void onCompleteResponse(ChatResponse completeResponse) {
            if (cancelled) {
                return;
            }
            if (receivedPartial) {
                toolCalls(completeResponse.aiMessage()).forEach(sink::next);
                sink.next(AgentChunk.completed(completeResponse.metadata().id()));
            } else {
                toChunks(completeResponse).forEach(sink::next);
            }
            sink.complete();
        }

        @Override
        public void onError(Throwable error) {
            if (cancelled) {
                LOG.debugf("Streaming chat model failed after cancellation — %s", error.getMessage());
                return;
            }
            LOG.warnf("Streaming chat model failed — %s", error.getMessage());
            sink.error(error);
        }
    }
}
