package com.questrail.statechart.time;

/**
 * MonotonicClock
 * =============================================================================
 * Clock that timer slots are armed against.
 *
 * <h2>Deadlines</h2>
 * A slot's deadline is the reading at the moment it is armed plus the timed
 * transition's delay. Readings never go backwards, so a wall-clock adjustment
 * cannot make a slot expire early or late.
 */
public interface MonotonicClock
{
    /** Reading in nanoseconds; only differences between readings are meaningful. */
    long nowNanos();

    /** Reading in the millisecond unit of timer delays. */
    default long nowMillis() {
        return nowNanos() / 1_000_000L;
    }
}
