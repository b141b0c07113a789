package com.steadyretry.common;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class StopSignalTest {

    @Test
    @DisplayName("stop is one-way and idempotent")
    void stopIsOneWay() {
        StopSignal signal = new StopSignal();
        assertThat(signal.isCancelled()).isFalse();

        assertThat(signal.stop()).isTrue();
        assertThat(signal.stop()).isFalse();
        assertThat(signal.isCancelled()).isTrue();
        assertThat(signal.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("stop asserted from another thread is visible")
    void stopFromOtherThread() throws InterruptedException {
        StopSignal signal = new StopSignal();
        Thread stopper = new Thread(signal::stop);
        stopper.start();
        stopper.join();
        assertThat(signal.isCancelled()).isTrue();
    }

    @Test
    @DisplayName("never signal is never cancelled")
    void neverSignal() {
        assertThat(CancellationSignal.never().isCancelled()).isFalse();
    }
}
