package com.questrail.statechart.model;

/**
 * Transition variants.
 */
public enum TransitionKind
{
    /** Exits the source (up to the LCA) and enters the target. */
    EXTERNAL,
    /** Runs its actions without exiting or entering anything. */
    INTERNAL,
    /** Like external, but does not exit the source when the target is nested inside it. */
    LOCAL,
    /** Triggered by the completion event of its source. */
    COMPLETION,
    /** Fires once, a fixed delay after its source state was entered. */
    TIMED_ONE_SHOT,
    /** Fires repeatedly with a fixed period while its source state stays active. */
    TIMED_PERIODIC;

    public boolean isTimed() {
        return this == TIMED_ONE_SHOT || this == TIMED_PERIODIC;
    }
}
