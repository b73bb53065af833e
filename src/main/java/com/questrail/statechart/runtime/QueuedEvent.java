package com.questrail.statechart.runtime;

import com.questrail.statechart.api.Event;

/**
 * Mutable queue slot: an event handle with its payload, or a timer expiry.
 * Slots are allocated once and copied between, never shared.
 */
final class QueuedEvent
{
    static final int TIMER = -1;

    int event = TIMER;
    final long[] args;
    long timerHandle = -1;
    boolean rearmed;

    QueuedEvent(int width) {
        this.args = new long[width];
    }

    boolean isTimer() {
        return event == TIMER;
    }

    void setEvent(int event, long[] source, int width) {
        this.event = event;
        System.arraycopy(source, 0, args, 0, width);
        this.timerHandle = -1;
        this.rearmed = false;
    }

    void setEvent(int event, Event source) {
        this.event = event;
        for (int i = 0; i < source.width(); i++) {
            args[i] = source.arg(i);
        }
        this.timerHandle = -1;
        this.rearmed = false;
    }

    void setTimer(long handle, boolean rearmed) {
        this.event = TIMER;
        this.timerHandle = handle;
        this.rearmed = rearmed;
    }

    void copyFrom(QueuedEvent other) {
        this.event = other.event;
        System.arraycopy(other.args, 0, args, 0, args.length);
        this.timerHandle = other.timerHandle;
        this.rearmed = other.rearmed;
    }
}
