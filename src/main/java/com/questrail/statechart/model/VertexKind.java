package com.questrail.statechart.model;

/**
 * Kinds of vertices in the region tree.
 *
 * The first three are states (they can be active and carry entry/exit
 * behavior); the rest are pseudostates, which are transient routing points.
 * History is the only pseudostate with persistent runtime data.
 */
public enum VertexKind
{
    SIMPLE,
    COMPOSITE,
    PARALLEL,

    INITIAL,
    FINAL,
    CHOICE,
    JUNCTION,
    HISTORY_SHALLOW,
    HISTORY_DEEP,
    FORK,
    JOIN,
    ENTRY_POINT,
    EXIT_POINT;

    public boolean isState() {
        return this == SIMPLE || this == COMPOSITE || this == PARALLEL;
    }

    public boolean isPseudostate() {
        return !isState();
    }

    public boolean isHistory() {
        return this == HISTORY_SHALLOW || this == HISTORY_DEEP;
    }

    /**
     * Pseudostates whose outgoing branches are chosen before any exit happens.
     */
    public boolean isStaticChain() {
        return this == JUNCTION || this == ENTRY_POINT || this == EXIT_POINT;
    }

    /** Whether a region may hold an active cursor on this vertex. */
    public boolean isActivatable() {
        return isState() || this == FINAL;
    }
}
