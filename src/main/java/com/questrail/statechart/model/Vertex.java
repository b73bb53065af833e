package com.questrail.statechart.model;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Vertex
 * -----------------------------------------------------------------------------
 * A node of the region tree: a state or a pseudostate.
 *
 * <h2>Arena representation</h2>
 * Vertices, regions and transitions live in flat lists owned by
 * {@link Machine} and refer to each other by small integer handles (their
 * {@code index}). Back-references such as "parent region" or "history target"
 * are therefore plain indices rather than object pointers, which keeps the
 * containment tree acyclic and lets runtime bookkeeping be sized up front.
 *
 * <h2>Identity</h2>
 * {@link #name()} is the local name (unique within the owning region);
 * {@link #uid()} is the stable identifier used by diagnostics and traces.
 */
public final class Vertex
{
    private final int index;
    private final String name;
    private final String uid;
    private final VertexKind kind;
    private final int parentRegion;
    private final int[] regions;
    private final int[] outgoing;
    private final int[] incoming;
    private final List<Action> entryActions;
    private final List<Action> exitActions;
    private final int[] deferredEvents;

    Vertex(int index,
           String name,
           String uid,
           VertexKind kind,
           int parentRegion,
           int[] regions,
           int[] outgoing,
           int[] incoming,
           List<Action> entryActions,
           List<Action> exitActions,
           int[] deferredEvents) {
        this.index = index;
        this.name = Objects.requireNonNull(name, "name");
        this.uid = Objects.requireNonNull(uid, "uid");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.parentRegion = parentRegion;
        this.regions = regions.clone();
        this.outgoing = outgoing.clone();
        this.incoming = incoming.clone();
        this.entryActions = List.copyOf(entryActions);
        this.exitActions = List.copyOf(exitActions);
        this.deferredEvents = deferredEvents.clone();
        Arrays.sort(this.deferredEvents);
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

    public VertexKind kind() {
        return kind;
    }

    public boolean isState() {
        return kind.isState();
    }

    /** Handle of the region containing this vertex, or {@code -1} for the machine root. */
    public int parentRegion() {
        return parentRegion;
    }

    public boolean isRoot() {
        return parentRegion < 0;
    }

    /** Owned regions, ordered lexicographically by region name. */
    public int[] regions() {
        return regions.clone();
    }

    public int regionCount() {
        return regions.length;
    }

    public int region(int position) {
        return regions[position];
    }

    /** Outgoing transitions in declaration order. */
    public int[] outgoing() {
        return outgoing.clone();
    }

    public int outgoingCount() {
        return outgoing.length;
    }

    public int outgoing(int position) {
        return outgoing[position];
    }

    /** Incoming transitions in declaration order. */
    public int[] incoming() {
        return incoming.clone();
    }

    public List<Action> entryActions() {
        return entryActions;
    }

    public List<Action> exitActions() {
        return exitActions;
    }

    /** Events this state itself declares as deferred (ancestors not included). */
    public int[] deferredEvents() {
        return deferredEvents.clone();
    }

    public boolean defers(int eventIndex) {
        return Arrays.binarySearch(deferredEvents, eventIndex) >= 0;
    }

    @Override
    public String toString() {
        return kind + " " + uid;
    }
}
