package io.quarkiverse.dapr.agentex.streaming;

import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One unit of progress for a single output message.
 * <p>
 * {@link Delta} carries an incremental text or reasoning fragment, {@link Full} one complete
 * content unit and {@link Done} terminates the message.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.EXISTING_PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = StreamEvent.Delta.class, name = "DELTA"),
        @JsonSubTypes.Type(value = StreamEvent.Full.class, name = "FULL"),
        @JsonSubTypes.Type(value = StreamEvent.Done.class, name = "DONE")
})
public sealed interface StreamEvent permits StreamEvent.Delta, StreamEvent.Full, StreamEvent.Done {

    enum Type {
        DELTA,
        FULL,
        DONE
    }

    @JsonProperty("type")
    Type type();

    record Delta(ContentKind kind, String fragment) implements StreamEvent {

        public Delta {
            Objects.requireNonNull(kind, "kind");
            Objects.requireNonNull(fragment, "fragment");
        }

        @Override
        public Type type() {
            return Type.DELTA;
        }
    }

    record Full(MessageContent content) implements StreamEvent {

        public Full {
            Objects.requireNonNull(content, "content");
        }

        @Override
        public Type type() {
            return Type.FULL;
        }
    }

    record Done() implements StreamEvent {

        @Override
        public Type type() {
            return Type.DONE;
        }
    }

    static Delta text(String fragment) {
        return new Delta(ContentKind.TEXT, fragment);
    }

    static Delta reasoning(String fragment) {
        return new Delta(ContentKind.REASONING, fragment);
    }

    static Full full(MessageContent content) {
        return new Full(content);
    }

    static Done done() {
        return new Done();
    }

    @JsonIgnore
    default boolean isTerminal() {
        return type() == Type.DONE;
    }
}
