package io.quarkiverse.dapr.agentex.tracing;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;

import org.jboss.logging.Logger;

/**
 * {@link SpanRecorder} that writes span boundaries to the log. It is the default when the
 * application does not provide its own recorder.
 */
public class LoggingSpanRecorder implements SpanRecorder {

    private static final Logger LOG = Logger.getLogger(LoggingSpanRecorder.class);

    @Override
    public InvocationSpan start(String traceId, String parentSpanId, String name, Map<String, Object> input) {
        String spanId = UUID.randomUUID().toString();
        LOG.infof("[Trace:%s][Span:%s] %s started — parent=%s, input=%s", traceId, spanId, name, parentSpanId, input);
        return new LoggedSpan(traceId, spanId, parentSpanId, name, Instant.now());
    }

    private record LoggedSpan(String traceId, String spanId, String parentSpanId, String name, Instant startedAt)
            implements InvocationSpan {

        @Override
        public void end(Map<String, Object> output) {
            LOG.infof("[Trace:%s][Span:%s] %s ended in %d ms — output=%s",
                    traceId, spanId, name, elapsed().toMillis(), output);
        }

        @Override
        public void fail(Throwable error) {
            LOG.warnf("[Trace:%s][Span:%s] %s failed in %d ms — %s",
                    traceId, spanId, name, elapsed().toMillis(), error.toString());
        }

        private Duration elapsed() {
            return Duration.between(startedAt, Instant.now());
        }
    }
}
