package com.questrail.statechart.time;

import java.time.Duration;
import java.util.Objects;

/**
 * {@link TimerAdapter} on top of a {@link MonotonicScheduler}. Expiries arrive
 * on the scheduler's thread, so the instance always delivers them through its
 * queue.
 */
public final class ScheduledTimerAdapter implements TimerAdapter
{
    private final MonotonicScheduler scheduler;
    private final MonotonicClock clock;
    private volatile ExpiryListener listener;
    private Cancellable[] pending = new Cancellable[0];
    private long[] handles = new long[0];

    public ScheduledTimerAdapter(MonotonicScheduler scheduler, MonotonicClock clock) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized void attach(ExpiryListener listener, int slots) {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.pending = new Cancellable[slots];
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
        pending[slot] = scheduler.scheduleAfter(Duration.ofMillis(durationMillis), clock,
                () -> listener.expired(handle, deadline));
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
}
