package com.steadyretry.policy;

/**
 * Observer of failed, non-fatal attempts. Called after every such attempt, including the last one, and never on
 * success.
 */
@FunctionalInterface
public interface RetryNotifier {

    RetryNotifier NONE = (lastError, attempt) -> {
    };

    /**
     * @param lastError error thrown by the operation
     * @param attempt   1-based attempt number
     */
    void onFailedAttempt(Exception lastError, int attempt);
}
