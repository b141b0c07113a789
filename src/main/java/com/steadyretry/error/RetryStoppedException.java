package com.steadyretry.error;

/**
 * The stop signal was asserted between attempts. The last operation error is both {@link #getLastError()} and the
 * cause.
 */
public class RetryStoppedException extends RetryException {

    private final Exception lastError;

    public RetryStoppedException(Exception lastError) {
        super("retry stopped: " + describe(lastError), lastError);
        this.lastError = lastError;
    }

    public Exception getLastError() {
        return lastError;
    }
}
