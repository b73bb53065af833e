package com.questrail.statechart.api;

import java.util.Arrays;
import java.util.Objects;

/**
 * An externally supplied event: a declared event name plus its payload
 * arguments in declaration order, already in the runtime {@code long} encoding
 * (booleans as 0/1, enumerations as ordinals).
 *
 * Events are copied into preallocated queue slots on enqueue; the instance
 * keeps no reference to this object.
 */
public final class Event
{
    private final String name;
    private final long[] args;

    private Event(String name, long[] args) {
        this.name = Objects.requireNonNull(name, "name");
        this.args = args;
    }

    public static Event of(String name, long... args) {
        return new Event(name, args.clone());
    }

    public String name() {
        return name;
    }

    public int width() {
        return args.length;
    }

    public long arg(int index) {
        return args[index];
    }

    public long[] args() {
        return args.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Event other)) {
            return false;
        }
        return name.equals(other.name) && Arrays.equals(args, other.args);
    }

    @Override
    public int hashCode() {
        return 31 * name.hashCode() + Arrays.hashCode(args);
    }

    @Override
    public String toString() {
        return args.length == 0 ? name : name + Arrays.toString(args);
    }
}
