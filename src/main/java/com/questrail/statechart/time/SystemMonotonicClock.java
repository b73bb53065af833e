package com.questrail.statechart.time;

/**
 * {@link MonotonicClock} backed by {@link System#nanoTime()}. Unaffected by
 * wall-clock adjustments; thread-safe.
 */
public enum SystemMonotonicClock implements MonotonicClock
{
    INSTANCE;

    @Override
    public long nowNanos() {
        return System.nanoTime();
    }
}
