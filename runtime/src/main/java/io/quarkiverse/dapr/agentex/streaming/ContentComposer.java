package io.quarkiverse.dapr.agentex.streaming;

import java.util.ArrayList;
import java.util.List;

/**
 * Folds {@link StreamEvent}s into ordered content blocks.
 * <p>
 * Consecutive {@link StreamEvent.Delta} fragments of the same {@link ContentKind} are appended
 * to one open block. A kind change, a {@link StreamEvent.Full} or {@link StreamEvent.Done}
 * closes the open block. A {@code Full} always becomes its own block. Blocks keep arrival order.
 * <p>
 * Not thread-safe; owned by a single {@link StreamingSession}.
 */
public class ContentComposer {

    private final List<MessageContent> closed = new ArrayList<>();
    private ContentKind openKind;
    private StringBuilder openBuffer;

    public ContentComposer() {
        this(List.of());
    }

    /**
     * @param seed initial blocks. When the last one is text or reasoning it stays open, so
     *             deltas of the same kind continue it.
     */
    public ContentComposer(List<MessageContent> seed) {
        if (seed == null || seed.isEmpty()) {
            return;
        }
        int last = seed.size() - 1;
        closed.addAll(seed.subList(0, last));
        MessageContent tail = seed.get(last);
        ContentKind tailKind = tail.deltaKind();
        if (tailKind == null) {
            closed.add(tail);
        } else {
            openKind = tailKind;
            openBuffer = new StringBuilder(textOf(tail));
        }
    }

    public void apply(StreamEvent event) {
        switch (event.type()) {
            case DELTA -> {
                StreamEvent.Delta delta = (StreamEvent.Delta) event;
                if (openKind != delta.kind()) {
                    closeOpenBlock();
                    openKind = delta.kind();
                    openBuffer = new StringBuilder();
                }
                openBuffer.append(delta.fragment());
            }
            case FULL -> {
                closeOpenBlock();
                closed.add(((StreamEvent.Full) event).content());
            }
            case DONE -> closeOpenBlock();
        }
    }

    /**
     * Snapshot of the blocks composed so far, including the open block.
     */
    public List<MessageContent> blocks() {
        List<MessageContent> snapshot = new ArrayList<>(closed.size() + 1);
        snapshot.addAll(closed);
        if (openKind != null) {
            snapshot.add(MessageContent.ofKind(openKind, openBuffer.toString()));
        }
        return List.copyOf(snapshot);
    }

    private void closeOpenBlock() {
        if (openKind != null) {
            closed.add(MessageContent.ofKind(openKind, openBuffer.toString()));
            openKind = null;
            openBuffer = null;
        }
    }

    private static String textOf(MessageContent content) {
        if (content instanceof TextContent text) {
            return text.content() == null ? "" : text.content();
        }
        if (content instanceof ReasoningContent reasoning) {
            return reasoning.content() == null ? "" : reasoning.content();
        }
        return "";
    }
}
