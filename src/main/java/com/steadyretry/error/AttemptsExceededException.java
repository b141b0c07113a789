package com.steadyretry.error;

/**
 * The attempt budget ran out. The last operation error is both {@link #getLastError()} and the cause.
 */
public class AttemptsExceededException extends RetryException {

    private final Exception lastError;

    public AttemptsExceededException(Exception lastError) {
        super("attempt count exceeded: " + describe(lastError), lastError);
        this.lastError = lastError;
    }

    public Exception getLastError() {
        return lastError;
    }
}
