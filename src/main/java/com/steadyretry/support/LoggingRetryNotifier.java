package com.steadyretry.support;

import com.steadyretry.policy.RetryNotifier;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Notify hook that logs each failed attempt at WARN, with the stack trace at DEBUG. A null description logs as
 * "retryable operation".
 */
@Slf4j
@Getter
@RequiredArgsConstructor
public class LoggingRetryNotifier implements RetryNotifier {

    private static final String DEFAULT_DESCRIPTION = "retryable operation";

    private final String taskDescription;

    @Override
    public void onFailedAttempt(Exception lastError, int attempt) {
        String task = taskDescription != null ? taskDescription : DEFAULT_DESCRIPTION;
        log.warn("Attempt {} for '{}' failed: {}", attempt, task, lastError.getMessage());
        log.debug("Attempt {} for '{}' failure detail", attempt, task, lastError);
    }
}
