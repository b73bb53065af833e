package com.questrail.statechart.model;

import java.util.Objects;

/**
 * A named partition of a composite or parallel state holding a tree of
 * vertices. At runtime each region has its own active cursor.
 */
public final class Region
{
    private final int index;
    private final String name;
    private final String uid;
    private final int owner;
    private final int[] members;
    private final int[] initials;

    Region(int index, String name, String uid, int owner, int[] members, int[] initials) {
        this.index = index;
        this.name = Objects.requireNonNull(name, "name");
        this.uid = Objects.requireNonNull(uid, "uid");
        this.owner = owner;
        this.members = members.clone();
        this.initials = initials.clone();
    }

    public int index() {
        return index;
    }

    public String name() {
        return name;
    }

    public String uid() {
        return uid;
    }

    /** Handle of the owning composite or parallel state. */
    public int owner() {
        return owner;
    }

    /** Direct member vertices in declaration order. */
    public int[] members() {
        return members.clone();
    }

    /**
     * Initial pseudostates declared in this region. A well-formed region has
     * exactly one; the array is kept whole so that the analyzer can report
     * violations.
     */
    public int[] initials() {
        return initials.clone();
    }

    /** The single initial pseudostate, or {@code -1} if there is not exactly one. */
    public int initial() {
        return initials.length == 1 ? initials[0] : -1;
    }

    @Override
    public String toString() {
        return "region " + uid;
    }
}
