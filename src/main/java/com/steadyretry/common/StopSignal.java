package com.steadyretry.common;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * {@link CancellationSignal} asserted by calling {@link #stop()}, typically from another thread.
 */
public class StopSignal implements CancellationSignal {

    private final AtomicBoolean stopped = new AtomicBoolean(false);

    /**
     * Asserts the signal. Returns true only for the call that actually flipped it.
     */
    public boolean stop() {
        return stopped.compareAndSet(false, true);
    }

    @Override
    public boolean isCancelled() {
        return stopped.get();
    }

    @Override
    public String toString() {
        return "StopSignal[stopped=" + stopped.get() + "]";
    }
}
