package com.steadyretry.policy;

import com.steadyretry.common.CancellationSignal;
import com.steadyretry.common.Clock;

import java.time.Duration;
import java.util.Objects;
import java.util.function.Predicate;

/**
 * Validated, fully defaulted settings of one retry session. Build it through {@link RetryCallArgs#validate()}.
 *
 * @param operation            action to invoke
 * @param attempts             invocation cap
 * @param delay                delay before the second attempt
 * @param backoffFactor        multiplier applied to the delay after each failed attempt, at least 1
 * @param maxDelay             delay ceiling, {@link Duration#ZERO} for none
 * @param fatalErrorClassifier accepts errors that must not be retried
 * @param notifier             failed-attempt hook
 * @param stopSignal           external stop flag
 * @param clock                time source for delays
 */
public record RetryPolicy(
        RetryableOperation operation,
        AttemptBudget attempts,
        Duration delay,
        double backoffFactor,
        Duration maxDelay,
        Predicate<Exception> fatalErrorClassifier,
        RetryNotifier notifier,
        CancellationSignal stopSignal,
        Clock clock
) {

    public RetryPolicy {
        Objects.requireNonNull(operation, "operation");
        Objects.requireNonNull(attempts, "attempts");
        Objects.requireNonNull(delay, "delay");
        Objects.requireNonNull(maxDelay, "maxDelay");
        Objects.requireNonNull(fatalErrorClassifier, "fatalErrorClassifier");
        Objects.requireNonNull(notifier, "notifier");
        Objects.requireNonNull(stopSignal, "stopSignal");
        Objects.requireNonNull(clock, "clock");
    }

    public boolean isFatal(Exception error) {
        return fatalErrorClassifier.test(error);
    }

    public boolean hasMaxDelay() {
        return !maxDelay.isZero();
    }
}
