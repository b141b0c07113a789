package com.steadyretry.policy;

import com.steadyretry.common.CancellationSignal;
import com.steadyretry.common.Clock;
import com.steadyretry.common.WallClock;
import com.steadyretry.error.InvalidRetryConfigurationException;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.experimental.Accessors;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Caller-supplied retry arguments. Mutable and unchecked; {@link #validate()} turns them into an immutable
 * {@link RetryPolicy} without touching this instance.
 */
@NoArgsConstructor
@Getter
@Setter
@Accessors(chain = true)
public class RetryCallArgs {

    /** Required. */
    private RetryableOperation operation;

    /** Required: {@link AttemptBudget#of(int)} or {@link AttemptBudget#unbounded()}. */
    private AttemptBudget attempts;

    /** Required, non-negative. Delay before the second attempt. */
    private Duration delay;

    /** Optional, at least 1. Null means 1 (constant delay). */
    private Double backoffFactor;

    /** Optional ceiling. Null or zero means none. */
    private Duration maxDelay;

    /** Optional. Errors it accepts end the session immediately and are rethrown as-is. */
    private Predicate<Exception> fatalErrorClassifier;

    /** Optional. */
    private RetryNotifier notifyHook;

    /** Optional. Polled between attempts. */
    private CancellationSignal stopSignal;

    /** Optional. Null means {@link WallClock#INSTANCE}. */
    private Clock clock;

    /**
     * Checks the arguments in a fixed order (operation, attempts, delay, backoff factor, max delay; first failure
     * wins) and fills in defaults.
     *
     * @throws InvalidRetryConfigurationException naming the missing or invalid field
     */
    public RetryPolicy validate() {
        if (operation == null) {
            throw InvalidRetryConfigurationException.missing("operation");
        }
        if (attempts == null) {
            throw InvalidRetryConfigurationException.missing("attempts");
        }
        if (delay == null) {
            throw InvalidRetryConfigurationException.missing("delay");
        }
        if (delay.isNegative()) {
            throw InvalidRetryConfigurationException.invalidValue("negative delay", delay);
        }
        double factor = 1.0;
        if (backoffFactor != null) {
            if (Double.isNaN(backoffFactor) || backoffFactor < 1.0) {
                throw InvalidRetryConfigurationException.invalidValue("backoff factor", backoffFactor);
            }
            factor = backoffFactor;
        }
        if (maxDelay != null && maxDelay.isNegative()) {
            throw InvalidRetryConfigurationException.invalidValue("negative max delay", maxDelay);
        }
        return new RetryPolicy(
                operation,
                attempts,
                delay,
                factor,
                maxDelay != null ? maxDelay : Duration.ZERO,
                fatalErrorClassifier != null ? fatalErrorClassifier : error -> false,
                notifyHook != null ? notifyHook : RetryNotifier.NONE,
                stopSignal != null ? stopSignal : CancellationSignal.never(),
                clock != null ? clock : WallClock.INSTANCE);
    }
}
