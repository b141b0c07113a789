package com.steadyretry.error;

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;

/**
 * Classification helpers. Each predicate walks the cause chain, so a retry exception wrapped by the caller is still
 * recognised.
 */
public final class RetryErrors {

    private RetryErrors() {
    }

    public static boolean isAttemptsExceeded(Throwable error) {
        return find(error, AttemptsExceededException.class) != null;
    }

    public static boolean isRetryStopped(Throwable error) {
        return find(error, RetryStoppedException.class) != null;
    }

    public static boolean isInvalidConfiguration(Throwable error) {
        return find(error, InvalidRetryConfigurationException.class) != null;
    }

    /**
     * Last operation error carried by an {@link AttemptsExceededException} or {@link RetryStoppedException} in the
     * cause chain of {@code error}; otherwise {@code error} itself.
     */
    public static Throwable lastError(Throwable error) {
        AttemptsExceededException exceeded = find(error, AttemptsExceededException.class);
        if (exceeded != null) {
            return exceeded.getLastError();
        }
        RetryStoppedException stopped = find(error, RetryStoppedException.class);
        if (stopped != null) {
            return stopped.getLastError();
        }
        return error;
    }

    static <T extends Throwable> T find(Throwable error, Class<T> type) {
        Set<Throwable> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        Throwable current = error;
        while (current != null && seen.add(current)) {
            if (type.isInstance(current)) {
                return type.cast(current);
            }
            current = current.getCause();
        }
        return null;
    }
}
