package com.steadyretry.policy;

/**
 * The fallible action a retry session re-invokes. Throwing any {@link Exception} counts as a failed attempt.
 */
@FunctionalInterface
public interface RetryableOperation {

    void call() throws Exception;
}
