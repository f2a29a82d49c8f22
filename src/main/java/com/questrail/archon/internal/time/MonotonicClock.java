package com.questrail.archon.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for reply deadlines, frame waits and the emulated exposure timer.
 *
 * <p>All elapsed-time logic in this library uses a monotonic clock. Wall-clock
 * time is used only in observability events.</p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     * Values are only meaningful for elapsed time computations.
     */
    long nowNanos();

    /**
     * Milliseconds elapsed since an earlier {@link #nowNanos()} reading.
     */
    default long millisSince(long startNanos) {
        return (nowNanos() - startNanos) / 1_000_000L;
    }
}
