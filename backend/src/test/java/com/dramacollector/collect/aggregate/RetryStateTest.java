package com.dramacollector.collect.aggregate;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RetryStateTest {

    @Test
    void backoffDoublesUntilCapped() {
        BackoffPolicy policy = new BackoffPolicy(5, Duration.ofMillis(1_000), Duration.ofMillis(5_000));

        assertThat(policy.delayFor(1)).isEqualTo(Duration.ofMillis(1_000));
        assertThat(policy.delayFor(2)).isEqualTo(Duration.ofMillis(2_000));
        assertThat(policy.delayFor(3)).isEqualTo(Duration.ofMillis(4_000));
        assertThat(policy.delayFor(4)).isEqualTo(Duration.ofMillis(5_000));
        assertThat(policy.delayFor(200)).isEqualTo(Duration.ofMillis(5_000));
    }

    @Test
    void zeroBaseDelayNeverWaits() {
        BackoffPolicy policy = new BackoffPolicy(3, Duration.ZERO, Duration.ofSeconds(30));

        assertThat(policy.delayFor(3)).isZero();
    }

    @Test
    void retriesAreBoundedByPolicy() {
        RetryState state = new RetryState(new BackoffPolicy(2, Duration.ofMillis(100), Duration.ofSeconds(1)));

        state.beginAttempt();
        assertThat(state.canRetry()).isTrue();
        assertThat(state.nextDelay()).isEqualTo(Duration.ofMillis(100));
        state.beginAttempt();
        assertThat(state.nextDelay()).isEqualTo(Duration.ofMillis(200));
        state.beginAttempt();

        assertThat(state.canRetry()).isFalse();
        assertThat(state.attempts()).isEqualTo(3);
        assertThat(state.retries()).isEqualTo(2);
        assertThatThrownBy(state::nextDelay).isInstanceOf(IllegalStateException.class);
    }
}
