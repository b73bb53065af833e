package com.questrail.statechart.time;

import java.util.Arrays;
import java.util.Objects;

/**
 * VirtualTimerAdapter
 * -----------------------------------------------------------------------------
 * Externally clocked timer table for simulation, deterministic replay and
 * targets that feed elapsed time into the engine.
 *
 * <h2>Semantics</h2>
 * Time moves only in {@link #advance(long)}. Expiries within the advanced
 * interval are delivered one at a time in deadline order (ties by slot), and
 * {@link #nowMillis()} equals the expiring deadline while each listener call
 * runs. A periodic timer re-armed from the listener therefore keeps its phase.
 *
 * Storage is one entry per slot, allocated in {@link #attach}. Not
 * thread-safe; owned by the instance's thread.
 */
public final class VirtualTimerAdapter implements TimerAdapter
{
    private ExpiryListener listener;
    private long now;
    private long[] handles = new long[0];
    private long[] deadlines = new long[0];
    private boolean[] armed = new boolean[0];

    public VirtualTimerAdapter() {
        this(0);
    }

    public VirtualTimerAdapter(long startMillis) {
        this.now = startMillis;
    }

    @Override
    public void attach(ExpiryListener listener, int slots) {
        this.listener = Objects.requireNonNull(listener, "listener");
        this.handles = new long[slots];
        this.deadlines = new long[slots];
        this.armed = new boolean[slots];
    }

    @Override
    public void start(long handle, long durationMillis) {
        int slot = TimerHandles.slot(handle);
        handles[slot] = handle;
        deadlines[slot] = now + durationMillis;
        armed[slot] = true;
    }

    @Override
    public void cancel(long handle) {
        int slot = TimerHandles.slot(handle);
        if (slot < armed.length && handles[slot] == handle) {
            armed[slot] = false;
        }
    }

    @Override
    public long nowMillis() {
        return now;
    }

    /**
     * Advances virtual time by {@code elapsedMillis}, delivering due expiries.
     *
     * @return the number of expiries delivered
     */
    public int advance(long elapsedMillis) {
        if (elapsedMillis < 0) {
            throw new IllegalArgumentException("Cannot advance virtual time backwards");
        }
        if (listener == null) {
            throw new IllegalStateException("No listener attached");
        }
        long target = now + elapsedMillis;
        int delivered = 0;
        while (true) {
            int next = -1;
            for (int s = 0; s < armed.length; s++) {
                if (armed[s] && deadlines[s] <= target && (next < 0 || deadlines[s] < deadlines[next])) {
                    next = s;
                }
            }
            if (next < 0) {
                break;
            }
            armed[next] = false;
            now = Math.max(now, deadlines[next]);
            delivered++;
            listener.expired(handles[next], deadlines[next]);
        }
        now = target;
        return delivered;
    }

    /** Number of armed slots. */
    public int armedCount() {
        int n = 0;
        for (boolean a : armed) {
            if (a) {
                n++;
            }
        }
        return n;
    }

    @Override
    public String toString() {
        return "VirtualTimerAdapter[now=" + now + ", armed=" + Arrays.toString(armed) + "]";
    }
}
