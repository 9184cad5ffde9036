package io.quarkiverse.dapr.agentex.agent;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Consumer;

import org.jboss.logging.Logger;

import io.quarkiverse.dapr.agentex.context.ExecutionContext;
import io.quarkiverse.dapr.agentex.context.ExecutionContextHolder;
import io.quarkiverse.dapr.agentex.streaming.AccumulatedMessage;
import io.quarkiverse.dapr.agentex.streaming.ContentComposer;
import io.quarkiverse.dapr.agentex.streaming.MessageAuthor;
import io.quarkiverse.dapr.agentex.streaming.MessageContent;
import io.quarkiverse.dapr.agentex.streaming.StreamEvent;
import io.quarkiverse.dapr.agentex.streaming.StreamingAccumulator;
import io.quarkiverse.dapr.agentex.tracing.InvocationSpan;
import io.quarkiverse.dapr.agentex.tracing.SpanRecorder;
import reactor.core.Exceptions;
import reactor.core.publisher.Flux;

/**
 * Invokes the {@link AgentCapability} from inside an activity.
 * <p>
 * <h3>How it works</h3>
 * <ol>
 *   <li>Reads the {@link ExecutionContext} installed for the current activity execution.</li>
 *   <li>With a task id, opens a {@link StreamingAccumulator} session, runs the capability in
 *       streaming mode and publishes every translated chunk as it arrives. When the capability's
 *       stream ends the session is closed, which persists the final message.</li>
 *   <li>Without a task id, runs the capability without streaming and never touches the
 *       channel or the message store.</li>
 *   <li>Returns a {@link FinalResult} that holds the whole output, so the workflow engine can
 *       record it and replay the workflow without streaming again.</li>
 * </ol>
 * Failures of the capability abort the session and are rethrown unchanged; retrying is left
 * to the engine's retry policy for the activity.
 */
public class DurableCaller {

    private static final Logger LOG = Logger.getLogger(DurableCaller.class);

    static final String SPAN_NAME = "streaming_model_get_response";

    private final AgentCapability capability;
    private final StreamingAccumulator accumulator;
    private final SpanRecorder spanRecorder;
    private final InvocationLedger ledger;

    public DurableCaller(AgentCapability capability, StreamingAccumulator accumulator, SpanRecorder spanRecorder,
            InvocationLedger ledger) {
        this.capability = capability;
        this.accumulator = accumulator;
        this.spanRecorder = spanRecorder;
        this.ledger = ledger;
    }

    /**
     * One-off invocation under a fresh invocation id. Nothing retries it, so a failure is final.
     */
    public FinalResult invoke(String prompt, List<ConversationMessage> priorMessages, String resumeToken) {
        return invoke(new AgentRequest(UUID.randomUUID().toString(), prompt, priorMessages, resumeToken, List.of()),
                false);
    }

    /**
     * Invocation of a unit of work the engine retries under the same invocation id on failure.
     */
    public FinalResult invoke(AgentRequest request) {
        return invoke(request, true);
    }

    private FinalResult invoke(AgentRequest request, boolean retriedByEngine) {
        ExecutionContext context = ExecutionContextHolder.get();
        RetryableInvocation attempt = ledger.begin(request.invocationId(), context);
        if (attempt.attempt() > 1) {
            LOG.infof("[Invocation:%s] Retry attempt %d — previous partial output is superseded by a new message",
                    request.invocationId(), attempt.attempt());
        }

        InvocationSpan span = startSpan(context, request);
        try {
            FinalResult result = context.hasTaskId()
                    ? invokeStreaming(context.taskId(), request)
                    : invokePlain(request);
            ledger.succeeded(attempt, result);
            if (span != null) {
                span.end(spanOutput(result));
            }
            return result;
        } catch (Throwable e) {
            recordFailure(attempt, span, e, retriedByEngine);
            LOG.errorf("[Invocation:%s] Agent call failed on attempt %d — %s",
                    request.invocationId(), attempt.attempt(), e.getMessage());
            throw e;
        }
    }

    // The caller must see the agent's own error, so bookkeeping failures are only attached to it.
    private void recordFailure(RetryableInvocation attempt, InvocationSpan span, Throwable error,
            boolean retriedByEngine) {
        try {
            if (retriedByEngine) {
                ledger.failed(attempt, error);
            } else {
                ledger.failedForGood(attempt, error);
            }
            if (span != null) {
                span.fail(error);
            }
        } catch (RuntimeException bookkeeping) {
            LOG.warnf("[Invocation:%s] Could not record failed attempt %d — %s",
                    attempt.invocationId(), attempt.attempt(), bookkeeping.getMessage());
            error.addSuppressed(bookkeeping);
        }
    }

    private FinalResult invokeStreaming(String taskId, AgentRequest request) {
        return accumulator.withSession(taskId, MessageAuthor.AGENT, request.seed(), session -> {
            LOG.infof("[Task:%s][Message:%s] Invoking agent with streaming — invocation=%s, priorMessages=%d",
                    taskId, session.messageId(), request.invocationId(), request.priorMessages().size());
            ChunkTranslator translator = new ChunkTranslator();
            drain(capability.execute(request, true), chunk -> translator.translate(chunk).ifPresent(session::publish));
            session.publish(StreamEvent.done());
            AccumulatedMessage message = session.message();
            return new FinalResult(session.messageId(), message.text(), message.content(),
                    resumeToken(translator, request));
        });
    }

    private FinalResult invokePlain(AgentRequest request) {
        LOG.debugf("[Invocation:%s] No task in execution context — invoking agent without streaming",
                request.invocationId());
        ContentComposer composer = new ContentComposer(request.seed());
        ChunkTranslator translator = new ChunkTranslator();
        drain(capability.execute(request, false), chunk -> translator.translate(chunk).ifPresent(composer::apply));
        composer.apply(StreamEvent.done());
        List<MessageContent> content = composer.blocks();
        return new FinalResult(null, AccumulatedMessage.textOf(content), content, resumeToken(translator, request));
    }

    private InvocationSpan startSpan(ExecutionContext context, AgentRequest request) {
        if (!context.hasTraceId()) {
            return null;
        }
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("model", capability.modelName());
        input.put("invocation_id", request.invocationId());
        input.put("prior_messages", request.priorMessages().size());
        input.put("has_resume_token", request.resumeToken() != null);
        return spanRecorder.start(context.traceId(), context.parentSpanId(), SPAN_NAME, input);
    }

    private static Map<String, Object> spanOutput(FinalResult result) {
        Map<String, Object> output = new LinkedHashMap<>();
        output.put("message_id", result.messageId());
        output.put("content_blocks", result.content().size());
        output.put("response_id", result.resumeToken());
        return output;
    }

    /**
     * Feeds every chunk to {@code consumer} on the calling thread. Reactor wraps checked errors
     * of the capability when blocking on it; they are rethrown as the capability raised them.
     */
    private static void drain(Flux<AgentChunk> chunks, Consumer<AgentChunk> consumer) {
        try {
            for (AgentChunk chunk : chunks.toIterable()) {
                consumer.accept(chunk);
            }
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause == e) {
                throw e;
            }
            throw DurableCaller.<RuntimeException> rethrow(cause);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T extends Throwable> T rethrow(Throwable error) throws T {
        throw (T) error;
    }

    // Keep the caller's token when the capability does not report a new one.
    private static String resumeToken(ChunkTranslator translator, AgentRequest request) {
        return translator.responseId() != null ? translator.responseId() : request.resumeToken();
    }
}
