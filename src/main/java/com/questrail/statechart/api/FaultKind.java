package com.questrail.statechart.api;

/**
 * Runtime fault categories.
 */
public enum FaultKind
{
    /** Queue full under the {@code ERROR} policy; the event was rejected. */
    QUEUE_OVERFLOW(false),

    /** Queue full under the {@code ASSERT} policy. */
    QUEUE_ASSERTION(true),

    /** More than the permitted number of chained completion events. */
    COMPLETION_OVERFLOW(true),

    /** An extern guard or action procedure threw. */
    EXTERN_FAILURE(true),

    /** Inline arithmetic overflowed or divided by zero. */
    ARITHMETIC(true),

    /** An assignment produced a value outside the field's declared domain. */
    DOMAIN_VIOLATION(true),

    /** No branch of a choice pseudostate was enabled. */
    NO_ENABLED_BRANCH(true),

    /** {@code send} named a machine with no registered instance. */
    UNKNOWN_MACHINE(false);

    private final boolean fatal;

    FaultKind(boolean fatal) {
        this.fatal = fatal;
    }

    /** Fatal faults halt the instance. */
    public boolean fatal() {
        return fatal;
    }
}
