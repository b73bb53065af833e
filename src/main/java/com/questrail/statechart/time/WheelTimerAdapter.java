package com.questrail.statechart.time;

import io.netty.util.HashedWheelTimer;
import io.netty.util.Timeout;
import io.netty.util.Timer;

import java.util.Objects;
import java.util.concurrent.TimeUnit;

/**
 * WheelTimerAdapter
 * -----------------------------------------------------------------------------
 * {@link TimerAdapter} backed by Netty's {@link HashedWheelTimer}: constant
 * time arm and cancel with tick-granular precision, which matches the timer
 * wheels common on embedded targets.
 *
 * <h2>Ownership</h2>
 * A wheel created by {@link #create(long)} is owned and stopped by
 * {@link #close()}; a wheel passed to the constructor is not.
 */
public final class WheelTimerAdapter implements TimerAdapter, AutoCloseable
{
    private final Timer wheel;
    private final boolean owned;
    private final MonotonicClock clock;
    private volatile ExpiryListener listener;
    private Timeout[] pending = new Timeout[0];
    private long[] handles = new long[0];

    public WheelTimerAdapter(Timer wheel, MonotonicClock clock) {
        this(wheel, false, clock);
    }

    private WheelTimerAdapter(Timer wheel, boolean owned, MonotonicClock clock) {
        this.wheel = Objects.requireNonNull(wheel, "wheel");
        this.owned = owned;
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /** Creates an adapter owning a new wheel with the given tick duration. */
    public static WheelTimerAdapter create(long tickMillis) {
        HashedWheelTimer wheel = new HashedWheelTimer(tickMillis, TimeUnit.MILLISECONDS);
        return new WheelTimerAdapter(wheel, true, SystemMonotonicClock.INSTANCE);
    }

    @Override
    public synchronized void attach(ExpiryListener listener, int slots) {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.pending = new Timeout[slots];
        this.handles = new long[slots];
    }

    @Override
    public synchronized void start(long handle, long durationMillis) {
        int slot = TimerHandles.slot(handle);
        if (pending[slot] != null) {
            pending[slot].cancel();
        }
        handles[slot] = handle;
        long deadline = nowMillis() + durationMillis;
        pending[slot] = wheel.newTimeout(t -> listener.expired(handle, deadline), durationMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public synchronized void cancel(long handle) {
        int slot = TimerHandles.slot(handle);
        if (slot < pending.length && pending[slot] != null && handles[slot] == handle) {
            pending[slot].cancel();
            pending[slot] = null;
        }
    }

    @Override
    public long nowMillis() {
        return clock.nowMillis();
    }

    @Override
    public void close() {
        if (owned) {
            wheel.stop();
        }
    }
}
