package com.steadyretry;

import com.steadyretry.common.DelayScaler;
import com.steadyretry.loop.RetryLoop;
import com.steadyretry.policy.AttemptBudget;
import com.steadyretry.policy.RetryCallArgs;

import java.time.Duration;

/**
 * Entry points: run a retry session, or compute a single backoff step.
 */
public final class Retry {

    /** Attempt budget with no cap. */
    public static final AttemptBudget UNLIMITED_ATTEMPTS = AttemptBudget.unbounded();

    private Retry() {
    }

    /**
     * Validates {@code args} and retries the operation until it succeeds, fails fatally, runs out of attempts or is
     * stopped. Returns normally on success.
     *
     * @throws com.steadyretry.error.InvalidRetryConfigurationException before any invocation, for bad arguments
     * @throws com.steadyretry.error.AttemptsExceededException           the budget ran out
     * @throws com.steadyretry.error.RetryStoppedException               the stop signal was asserted
     * @throws Exception                                                 a fatal operation error, unchanged
     */
    public static void call(RetryCallArgs args) throws Exception {
        new RetryLoop(args.validate()).run();
    }

    /**
     * See {@link DelayScaler#scale(Duration, Duration, double)}.
     */
    public static Duration scaleDuration(Duration current, Duration max, double factor) {
        return DelayScaler.scale(current, max, factor);
    }
}
