package com.questrail.chat.internal.time;

/**
 * Production {@link MonotonicClock} backed by {@link System#nanoTime()}.
 * <p>
 * For deterministic tests, use a manually advanced clock instead.
 */
public enum SystemMonotonicClock implements MonotonicClock {
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
