package com.questrail.statechart.runtime;

import com.questrail.statechart.model.EventDecl;
import com.questrail.statechart.model.FieldDecl;

/**
 * Read-only view of the payload of the event being processed.
 *
 * One instance is reused for every step; guards and actions must not retain
 * it beyond the call they receive it in. Outside an event-triggered step
 * (entry of the initial configuration, completion and timer steps) the view
 * is empty.
 */
public final class Payload
{
    private static final long[] NONE = new long[0];

    private EventDecl event;
    private long[] args = NONE;
    private int width;

    Payload() {
    }

    void bind(EventDecl event, long[] args) {
        this.event = event;
        this.args = args;
        this.width = event.width();
    }

    void clear() {
        this.event = null;
        this.args = NONE;
        this.width = 0;
    }

    /** Name of the triggering event, or {@code null} when the view is empty. */
    public String eventName() {
        return event == null ? null : event.name();
    }

    public int width() {
        return width;
    }

    public long get(int index) {
        if (index < 0 || index >= width) {
            throw new IndexOutOfBoundsException("Payload index " + index + " out of " + width);
        }
        return args[index];
    }

    public long get(String fieldName) {
        if (event == null) {
            throw new IllegalStateException("No event payload in scope");
        }
        FieldDecl f = event.field(fieldName)
                .orElseThrow(() -> new IllegalArgumentException(
                        "Event " + event.name() + " has no field " + fieldName));
        return args[f.index()];
    }

    public boolean getBoolean(String fieldName) {
        return get(fieldName) != 0;
    }

    long[] snapshot() {
        long[] copy = new long[width];
        System.arraycopy(args, 0, copy, 0, width);
        return copy;
    }
}
