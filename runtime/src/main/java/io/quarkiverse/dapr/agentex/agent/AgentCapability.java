package io.quarkiverse.dapr.agentex.agent;

import reactor.core.publisher.Flux;

/**
 * The external agent runner, seen as a source of output chunks.
 */
public interface AgentCapability {

    /**
     * Runs one agent turn.
     *
     * @param request   prompt, history and the opaque resume token of the previous turn
     * @param streaming {@code true} to receive incremental chunks as they are produced; with
     *                  {@code false} the capability may emit whole blocks only
     * @return the turn's chunks, ending with a {@link AgentChunk.Kind#COMPLETED} chunk on success.
     *         The flux may fail at any point, including after chunks were emitted.
     */
    Flux<AgentChunk> execute(AgentRequest request, boolean streaming);

    /**
     * Name reported on tracing spans.
     */
    default String modelName() {
        return getClass().getSimpleName();
    }
}
