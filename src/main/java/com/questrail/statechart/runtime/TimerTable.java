package com.questrail.statechart.runtime;

import com.questrail.statechart.model.Machine;
import com.questrail.statechart.model.Transition;
import com.questrail.statechart.time.TimerHandles;

/**
 * Per-slot timer bookkeeping of one instance.
 *
 * Each timed transition owns one slot. A slot's generation is bumped when its
 * source state exits, so an expiry carrying an older handle, whether still in
 * the adapter or already queued, is recognized as stale.
 */
final class TimerTable
{
    private final int[] transitionOfSlot;
    private final int[] generation;
    private final boolean[] armed;

    TimerTable(Machine machine) {
        int slots = machine.timerSlots();
        this.transitionOfSlot = new int[slots];
        this.generation = new int[slots];
        this.armed = new boolean[slots];
        for (Transition t : machine.transitions()) {
            if (t.timerSlot() >= 0) {
                transitionOfSlot[t.timerSlot()] = t.index();
            }
        }
    }

    int slots() {
        return generation.length;
    }

    int transition(int slot) {
        return transitionOfSlot[slot];
    }

    /** Arms the slot under its current generation and returns the handle. */
    long arm(int slot) {
        armed[slot] = true;
        return TimerHandles.handle(slot, generation[slot]);
    }

    /** Handle of the slot's current generation. */
    long handle(int slot) {
        return TimerHandles.handle(slot, generation[slot]);
    }

    /** Invalidates every outstanding handle of the slot. */
    void cancel(int slot) {
        armed[slot] = false;
        generation[slot]++;
    }

    /** A one-shot timer fired; its handle stays current until the source exits. */
    void expired(int slot) {
        armed[slot] = false;
    }

    boolean isCurrent(long handle) {
        int slot = TimerHandles.slot(handle);
        return slot >= 0 && slot < generation.length
                && TimerHandles.generation(handle) == generation[slot];
    }

    boolean isArmed(int slot) {
        return armed[slot];
    }
}
