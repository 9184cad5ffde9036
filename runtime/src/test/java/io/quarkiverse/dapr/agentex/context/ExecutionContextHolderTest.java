package io.quarkiverse.dapr.agentex.context;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.concurrent.CompletableFuture;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ExecutionContextHolderTest {

    @AfterEach
    void tearDown() {
        ExecutionContextHolder.clear();
    }

    @Test
    void getShouldReturnEmptyContextWhenNothingInstalled() {
        ExecutionContext context = ExecutionContextHolder.get();

        assertThat(context).isSameAs(ExecutionContext.EMPTY);
        assertThat(context.hasTaskId()).isFalse();
        assertThat(context.isEmpty()).isTrue();
    }

    @Test
    void getShouldReturnInstalledContext() {
        ExecutionContextHolder.set(new ExecutionContext("t1", "trace-1", "span-1"));

        assertThat(ExecutionContextHolder.get().taskId()).isEqualTo("t1");
        assertThat(ExecutionContextHolder.get().traceId()).isEqualTo("trace-1");
        assertThat(ExecutionContextHolder.get().parentSpanId()).isEqualTo("span-1");
    }

    @Test
    void setShouldRejectSecondInstallWithoutClear() {
        ExecutionContextHolder.set(ExecutionContext.ofTask("t1"));

        assertThatThrownBy(() -> ExecutionContextHolder.set(ExecutionContext.ofTask("t2")))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("already set");
        assertThat(ExecutionContextHolder.get().taskId()).isEqualTo("t1");
    }

    @Test
    void setShouldTreatNullAsEmpty() {
        ExecutionContextHolder.set(null);

        assertThat(ExecutionContextHolder.get()).isEqualTo(ExecutionContext.EMPTY);
    }

    @Test
    void clearShouldAllowNextExecutionToInstallItsOwnContext() {
        ExecutionContextHolder.set(ExecutionContext.ofTask("t1"));
        ExecutionContextHolder.clear();

        assertThat(ExecutionContextHolder.get()).isEqualTo(ExecutionContext.EMPTY);
        ExecutionContextHolder.set(ExecutionContext.ofTask("t2"));
        assertThat(ExecutionContextHolder.get().taskId()).isEqualTo("t2");
    }

    @Test
    void callWithShouldClearEvenWhenCallableFails() {
        assertThatThrownBy(() -> ExecutionContextHolder.callWith(ExecutionContext.ofTask("t1"), () -> {
            assertThat(ExecutionContextHolder.get().taskId()).isEqualTo("t1");
            throw new IllegalArgumentException("boom");
        })).isInstanceOf(IllegalArgumentException.class);

        assertThat(ExecutionContextHolder.get()).isEqualTo(ExecutionContext.EMPTY);
    }

    @Test
    void contextShouldNotBeVisibleFromAnotherThread() throws Exception {
        ExecutionContextHolder.set(ExecutionContext.ofTask("t1"));

        ExecutionContext seenByOtherThread = CompletableFuture.supplyAsync(ExecutionContextHolder::get).get();

        assertThat(seenByOtherThread).isEqualTo(ExecutionContext.EMPTY);
    }
}
