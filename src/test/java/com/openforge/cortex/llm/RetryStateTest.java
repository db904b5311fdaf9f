package com.openforge.cortex.llm;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class RetryStateTest {

    @Test
    void shouldStartOnAcceleratorWithoutRetry() {
        RetryState initial = RetryState.initial();

        assertThat(initial.attempt()).isZero();
        assertThat(initial.forceCpu()).isFalse();
        assertThat(initial.isRetry()).isFalse();
    }

    @Test
    void shouldForceCpuFromFirstRetryOn() {
        RetryState first = RetryState.initial().next();
        RetryState second = first.next();

        assertThat(first).isEqualTo(new RetryState(1, true));
        assertThat(second).isEqualTo(new RetryState(2, true));
        assertThat(second.canRetry()).isFalse();
    }

    @Test
    void shouldRefuseToExceedRetryCeiling() {
        RetryState last = RetryState.initial().next().next();

        assertThatThrownBy(last::next).isInstanceOf(IllegalStateException.class);
        assertThat(RetryState.MAX_ATTEMPTS).isEqualTo(3);
    }
}
