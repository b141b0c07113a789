package com.steadyretry;

import com.steadyretry.error.RetryErrors;
import com.steadyretry.policy.AttemptBudget;
import com.steadyretry.policy.RetryCallArgs;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

class RetryTest {

    @Test
    @DisplayName("runs against the wall clock by default")
    void withWallClock() {
        List<Integer> attempts = new ArrayList<>();

        Throwable thrown = catchThrowable(() -> Retry.call(new RetryCallArgs()
                .setOperation(() -> {
                    throw new IOException("bah");
                })
                .setNotifyHook((e, attempt) -> attempts.add(attempt))
                .setAttempts(AttemptBudget.of(5))
                .setDelay(Duration.ofNanos(1000))));

        assertThat(RetryErrors.isAttemptsExceeded(thrown)).isTrue();
        assertThat(attempts).containsExactly(1, 2, 3, 4, 5);
    }

    @Test
    @DisplayName("invalid arguments fail before the operation is invoked")
    void invalidArgsNeverInvoke() {
        AtomicBoolean called = new AtomicBoolean();

        Throwable thrown = catchThrowable(() -> Retry.call(new RetryCallArgs()
                .setOperation(() -> called.set(true))
                .setAttempts(Retry.UNLIMITED_ATTEMPTS)
                .setDelay(Duration.ofMinutes(1))
                .setBackoffFactor(-2.0)));

        assertThat(RetryErrors.isInvalidConfiguration(thrown)).isTrue();
        assertThat(thrown).hasMessage("backoff factor of -2.0 not valid");
        assertThat(called).isFalse();
    }

    @Test
    @DisplayName("scaleDuration delegates to the delay scaler")
    void scaleDuration() {
        assertThat(Retry.scaleDuration(Duration.ofMinutes(1), Duration.ZERO, 2.5))
                .isEqualTo(Duration.ofSeconds(150));
    }
}
