package com.questrail.push.protocol.binary.internal.time;

/**
 * Time source for flush timers.
 *
 * <p>Values are only meaningful relative to each other. Timer deadlines are
 * always computed from this clock, never from wall-clock time, so that clock
 * adjustments cannot stall or burst the flush cadence.</p>
 */
public interface MonotonicClock
{
    /**
     * Current tick in nanoseconds.
     */
    long nowNanos();
}
