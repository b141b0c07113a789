package com.steadyretry.common;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Real-time {@link Clock}: delays run on the common pool's delayed executor, so no thread sleeps per wait.
 */
public final class WallClock implements Clock {

    public static final WallClock INSTANCE = new WallClock();

    private static final Duration MAX_NANOS = Duration.ofNanos(Long.MAX_VALUE);

    private WallClock() {
    }

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public CompletableFuture<Instant> after(Duration duration) {
        if (duration == null || duration.isZero() || duration.isNegative()) {
            return CompletableFuture.completedFuture(now());
        }
        return CompletableFuture.supplyAsync(
                this::now,
                CompletableFuture.delayedExecutor(delayNanos(duration), TimeUnit.NANOSECONDS));
    }

    /**
     * Nanoseconds to wait, saturating at {@link Long#MAX_VALUE} (about 292 years) for longer durations.
     */
    static long delayNanos(Duration duration) {
        return duration.compareTo(MAX_NANOS) >= 0 ? Long.MAX_VALUE : duration.toNanos();
    }

    @Override
    public String toString() {
        return "WallClock";
    }
}
