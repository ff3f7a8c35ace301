package com.questrail.busline.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for bundler intervals and tick cadence.
 *
 * <p>
 * Values are only meaningful for elapsed time computations. Wall-clock time is
 * used for observability timestamps only (see {@link WallClock}).
 * </p>
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds.
     */
    long nowNanos();
}
