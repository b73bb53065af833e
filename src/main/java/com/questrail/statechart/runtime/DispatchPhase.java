package com.questrail.statechart.runtime;

/**
 * Phases of one run-to-completion step.
 */
public enum DispatchPhase
{
    /** Between steps; the only phase in which the next event may be taken. */
    IDLE,

    /** Computing the enabled transition of every active region. */
    SELECTING,

    /** Running exits, transition actions and entries. */
    EXECUTING,

    /** Processing completion events synthesized by the step. */
    RESOLVING_COMPLETIONS
}
