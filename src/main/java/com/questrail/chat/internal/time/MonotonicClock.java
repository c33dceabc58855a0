package com.questrail.chat.internal.time;

/**
 * MonotonicClock
 * =============================================================================
 * Time source for every delay the room runtime waits on: release retry
 * backoff, typing heartbeats and inactivity timers.
 *
 * <h2>Binding invariant</h2>
 * Retry spacing and timer deadlines MUST be computed from a monotonic source.
 * Wall-clock time ({@code Instant.now()}) is only used for observability
 * timestamps, see {@link WallClock}.
 */
public interface MonotonicClock
{
    /**
     * Returns a monotonically increasing tick value in nanoseconds. Values are
     * only meaningful for elapsed time computations.
     */
    long nowNanos();
}
