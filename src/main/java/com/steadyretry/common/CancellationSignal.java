package com.steadyretry.common;

/**
 * External, one-way stop flag. Queries never block and, once true, stay true.
 */
@FunctionalInterface
public interface CancellationSignal {

    CancellationSignal NEVER = () -> false;

    boolean isCancelled();

    static CancellationSignal never() {
        return NEVER;
    }
}
