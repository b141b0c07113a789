package com.steadyretry.common;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test clock: records every requested delay and completes immediately.
 */
public class RecordingClock implements Clock {

    private final List<Duration> delays = new CopyOnWriteArrayList<>();

    @Override
    public Instant now() {
        return Instant.now();
    }

    @Override
    public CompletableFuture<Instant> after(Duration duration) {
        delays.add(duration);
        return CompletableFuture.completedFuture(now());
    }

    public List<Duration> getDelays() {
        return List.copyOf(delays);
    }
}
