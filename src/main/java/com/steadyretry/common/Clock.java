package com.steadyretry.common;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;

/**
 * Time source for retry sessions. The retry loop only calls {@link #after(Duration)}, once per inter-attempt delay;
 * {@link #now()} is there for the implementation's own bookkeeping.
 */
public interface Clock {

    Instant now();

    /**
     * Single-fire completion signal that completes with the fire time once {@code duration} has elapsed.
     */
    CompletableFuture<Instant> after(Duration duration);
}
