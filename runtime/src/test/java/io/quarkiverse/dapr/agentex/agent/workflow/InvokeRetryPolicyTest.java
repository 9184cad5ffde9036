package io.quarkiverse.dapr.agentex.agent.workflow;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Duration;

import org.junit.jupiter.api.Test;

import io.dapr.workflows.WorkflowTaskOptions;

class InvokeRetryPolicyTest {

    @Test
    void defaultsShouldAllowThreeAttempts() {
        InvokeRetryPolicy policy = InvokeRetryPolicy.defaults();

        assertThat(policy.maxAttempts()).isEqualTo(3);
        assertThat(policy.firstRetryInterval()).isEqualTo(Duration.ofSeconds(1));
        assertThat(policy.backoffCoefficient()).isEqualTo(2.0);
    }

    @Test
    void toTaskOptionsShouldCarryRetryPolicy() {
        WorkflowTaskOptions options = InvokeRetryPolicy.of(5, Duration.ofMillis(250), 1.5).toTaskOptions();

        assertThat(options.getRetryPolicy()).isNotNull();
        assertThat(options.getRetryPolicy().getMaxNumberOfAttempts()).isEqualTo(5);
        assertThat(options.getRetryPolicy().getFirstRetryInterval()).isEqualTo(Duration.ofMillis(250));
        assertThat(options.getRetryPolicy().getBackoffCoefficient()).isEqualTo(1.5);
    }

    @Test
    void shouldRejectInvalidValues() {
        assertThatThrownBy(() -> InvokeRetryPolicy.of(0, Duration.ofSeconds(1), 2.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InvokeRetryPolicy.of(3, Duration.ZERO, 2.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InvokeRetryPolicy.of(3, Duration.ofSeconds(1), 0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void taskInputShouldFallBackToDefaults() {
        assertThat(new AgentTaskInput("t1", "a", null, null, null).retryPolicyOrDefault())
                .isEqualTo(InvokeRetryPolicy.defaults());
    }
}
