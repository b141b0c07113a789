package com.steadyretry.common;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.RoundingMode;
import java.time.Duration;

/**
 * Backoff arithmetic: next delay = current * |factor|, clamped to an optional ceiling.
 */
public final class DelayScaler {

    /** Longest representable {@link Duration}; scaled results saturate here. */
    public static final Duration MAX_DURATION = Duration.ofSeconds(Long.MAX_VALUE, 999_999_999);

    private static final BigInteger NANOS_PER_SECOND = BigInteger.valueOf(1_000_000_000L);
    private static final BigInteger MAX_SECONDS = BigInteger.valueOf(Long.MAX_VALUE);

    private DelayScaler() {
    }

    /**
     * Scales {@code current} by {@code factor}. The sign of the factor is ignored and fractional factors are applied
     * exactly, truncating to whole nanoseconds (1m * 2.5 = 2m30s, 1m * 0.5 = 30s, factor 0 gives zero). Works over the
     * whole {@link Duration} range; results beyond it saturate at {@link #MAX_DURATION}.
     *
     * @param current delay to scale
     * @param max     ceiling; null or zero means no ceiling
     * @param factor  multiplier, any finite or infinite value except NaN
     */
    public static Duration scale(Duration current, Duration max, double factor) {
        if (current == null) {
            throw new IllegalArgumentException("current delay must not be null");
        }
        if (Double.isNaN(factor)) {
            throw new IllegalArgumentException("backoff factor must be a number");
        }
        boolean capped = max != null && !max.isZero();
        double magnitude = Math.abs(factor);
        Duration scaled;
        if (Double.isInfinite(magnitude)) {
            scaled = current.isZero() ? Duration.ZERO : MAX_DURATION;
        } else {
            scaled = toDuration(toNanos(current).multiply(BigDecimal.valueOf(magnitude)));
        }
        if (capped && scaled.compareTo(max) > 0) {
            return max;
        }
        return scaled;
    }

    private static BigDecimal toNanos(Duration duration) {
        return BigDecimal.valueOf(duration.getSeconds())
                .scaleByPowerOfTen(9)
                .add(BigDecimal.valueOf(duration.getNano()));
    }

    private static Duration toDuration(BigDecimal nanos) {
        BigInteger[] secondsAndNanos = nanos.setScale(0, RoundingMode.DOWN)
                .toBigIntegerExact()
                .divideAndRemainder(NANOS_PER_SECOND);
        if (secondsAndNanos[0].compareTo(MAX_SECONDS) > 0) {
            return MAX_DURATION;
        }
        return Duration.ofSeconds(secondsAndNanos[0].longValueExact(), secondsAndNanos[1].longValueExact());
    }
}
