package com.steadyretry.loop;

/**
 * Lifecycle of a {@link RetryLoop}. Every state except {@link #RUNNING} is terminal.
 * <p>
 * Only {@link Exception}s count as failed attempts. An {@link Error} from the operation, or anything thrown by the
 * notify hook, escapes {@link RetryLoop#run()} unclassified and leaves the loop in {@link #RUNNING}.
 */
public enum RetryState {
    RUNNING,
    SUCCEEDED,
    /** The classifier marked the error fatal; it was rethrown unchanged. */
    FATAL_FAILED,
    ATTEMPTS_EXHAUSTED,
    /** Stop signal observed between attempts, or the wait for a delay was interrupted. */
    STOPPED;

    public boolean isTerminal() {
        return this != RUNNING;
    }
}
