package com.steadyretry.loop;

import com.steadyretry.common.DelayScaler;
import com.steadyretry.error.AttemptsExceededException;
import com.steadyretry.error.RetryStoppedException;
import com.steadyretry.policy.RetryPolicy;

import java.time.Duration;
import java.util.concurrent.ExecutionException;

/**
 * Drives one retry session on the calling thread. A loop instance runs once.
 * <p>
 * Per attempt: invoke, return on success, rethrow fatal errors, notify, then check the attempt budget before the stop
 * signal (exhaustion wins when both hold on the final attempt), wait {@code currentDelay} and scale it. The stop signal
 * is only polled between attempts, so the first attempt always runs and an in-flight call is never cut short.
 */
public final class RetryLoop {

    private final RetryPolicy policy;
    private volatile RetryState state = RetryState.RUNNING;
    private volatile int attemptCount;

    public RetryLoop(RetryPolicy policy) {
        if (policy == null) {
            throw new IllegalArgumentException("policy must not be null");
        }
        this.policy = policy;
    }

    /**
     * Runs the session to a terminal state.
     *
     * @throws AttemptsExceededException the budget ran out
     * @throws RetryStoppedException     the stop signal was asserted, or the delay wait was interrupted
     * @throws Exception                 a fatal operation error, unchanged
     * @throws Error                     thrown by the operation or the notify hook, unchanged; the state stays
     *                                   {@link RetryState#RUNNING}
     */
    public void run() throws Exception {
        if (attemptCount > 0) {
            throw new IllegalStateException("retry loop already ran, state " + state);
        }
        Duration currentDelay = policy.delay();
        for (int attempt = 1; ; attempt = nextAttempt(attempt)) {
            attemptCount = attempt;
            Exception lastError;
            try {
                policy.operation().call();
                state = RetryState.SUCCEEDED;
                return;
            } catch (Exception e) {
                lastError = e;
            }

            if (policy.isFatal(lastError)) {
                state = RetryState.FATAL_FAILED;
                throw lastError;
            }
            policy.notifier().onFailedAttempt(lastError, attempt);

            if (policy.attempts().isExhaustedBy(attempt)) {
                state = RetryState.ATTEMPTS_EXHAUSTED;
                throw new AttemptsExceededException(lastError);
            }
            if (policy.stopSignal().isCancelled()) {
                state = RetryState.STOPPED;
                throw new RetryStoppedException(lastError);
            }

            awaitDelay(currentDelay, lastError);
            currentDelay = DelayScaler.scale(currentDelay, policy.maxDelay(), policy.backoffFactor());
        }
    }

    /**
     * Attempt numbers saturate at {@link Integer#MAX_VALUE} so an unbounded session never reports a negative one.
     */
    static int nextAttempt(int attempt) {
        return attempt == Integer.MAX_VALUE ? attempt : attempt + 1;
    }

    private void awaitDelay(Duration delay, Exception lastError) {
        try {
            policy.clock().after(delay).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw stoppedWhileWaiting(lastError, e);
        } catch (ExecutionException e) {
            throw stoppedWhileWaiting(lastError, e.getCause() != null ? e.getCause() : e);
        }
    }

    private RetryStoppedException stoppedWhileWaiting(Exception lastError, Throwable reason) {
        state = RetryState.STOPPED;
        RetryStoppedException stopped = new RetryStoppedException(lastError);
        stopped.addSuppressed(reason);
        return stopped;
    }

    public RetryState getState() {
        return state;
    }

    /**
     * Invocations made so far, including the one that ended the session.
     */
    public int getAttemptCount() {
        return attemptCount;
    }

    public RetryPolicy getPolicy() {
        return policy;
    }
}
