package com.steadyretry.support;

import com.steadyretry.common.CancellationSignal;
import com.steadyretry.common.Clock;
import com.steadyretry.error.AttemptsExceededException;
import com.steadyretry.error.RetryStoppedException;
import com.steadyretry.loop.RetryLoop;
import com.steadyretry.policy.AttemptBudget;
import com.steadyretry.policy.RetryCallArgs;
import com.steadyretry.policy.RetryableOperation;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Reusable retry settings. Each {@code execute} call runs a fresh session built from {@link #newCallArgs(String)}.
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class RetryTemplate {

    private final AttemptBudget attempts;
    private final Duration delay;
    private final double backoffFactor;
    private final Duration maxDelay;
    private final Clock clock;
    private final boolean logFailedAttempts;

    /**
     * Fresh arguments pre-filled with this template's settings; the caller sets the operation and anything else.
     */
    public RetryCallArgs newCallArgs(String taskDescription) {
        return new RetryCallArgs()
                .setAttempts(attempts)
                .setDelay(delay)
                .setBackoffFactor(backoffFactor)
                .setMaxDelay(maxDelay)
                .setClock(clock)
                .setNotifyHook(logFailedAttempts ? new LoggingRetryNotifier(taskDescription) : null);
    }

    public void execute(String taskDescription, RetryableOperation operation) throws Exception {
        execute(taskDescription, operation, null, null);
    }

    /**
     * @param fatalErrorClassifier optional, see {@link RetryCallArgs#setFatalErrorClassifier(Predicate)}
     * @param stopSignal           optional
     */
    public void execute(String taskDescription, RetryableOperation operation,
                        Predicate<Exception> fatalErrorClassifier, CancellationSignal stopSignal) throws Exception {
        RetryCallArgs args = newCallArgs(taskDescription)
                .setOperation(operation)
                .setFatalErrorClassifier(fatalErrorClassifier)
                .setStopSignal(stopSignal);
        run(taskDescription, args);
    }

    /**
     * Runs a session from caller-built arguments, logging how it ended.
     */
    public void run(String taskDescription, RetryCallArgs args) throws Exception {
        RetryLoop loop = new RetryLoop(args.validate());
        log.debug("Starting '{}' (attempts={}, delay={}, backoffFactor={}, maxDelay={})",
                taskDescription, args.getAttempts(), args.getDelay(), args.getBackoffFactor(), args.getMaxDelay());
        try {
            loop.run();
        } catch (AttemptsExceededException e) {
            log.info("'{}' gave up after {} attempts: {}", taskDescription, loop.getAttemptCount(), e.getMessage());
            throw e;
        } catch (RetryStoppedException e) {
            log.info("'{}' stopped after {} attempts: {}", taskDescription, loop.getAttemptCount(), e.getMessage());
            throw e;
        }
        log.debug("'{}' succeeded after {} attempt(s)", taskDescription, loop.getAttemptCount());
    }
}
