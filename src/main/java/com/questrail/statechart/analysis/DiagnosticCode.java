package com.questrail.statechart.analysis;

/**
 * Typed compile-time fault and advisory codes.
 *
 * The message text attached to a {@link Diagnostic} is informational only;
 * tools and tests match on the code.
 */
public enum DiagnosticCode
{
    // Hierarchy / well-formedness
    DUPLICATE_NAME(Severity.ERROR),
    MISSING_INITIAL(Severity.ERROR),
    MULTIPLE_INITIAL(Severity.ERROR),
    PARALLEL_TOO_FEW_REGIONS(Severity.ERROR),
    NESTING_TOO_DEEP(Severity.ERROR),
    REGION_CROSSING(Severity.ERROR),
    ILLEGAL_TRANSITION(Severity.ERROR),
    INVALID_TIMER(Severity.ERROR),
    INLINE_ARITHMETIC_DISABLED(Severity.ERROR),

    // Determinism
    NONDETERMINISM(Severity.ERROR),
    PRIORITY_RESOLVED(Severity.WARNING),
    TAUTOLOGICAL_GUARD(Severity.WARNING),
    DEAD_TRANSITION(Severity.WARNING),
    CHOICE_NOT_EXHAUSTIVE(Severity.ERROR),
    GUARD_TOO_COMPLEX(Severity.WARNING),
    TYPE_MISMATCH(Severity.ERROR),

    // Structure / reachability
    UNREACHABLE_STATE(Severity.ERROR),
    DEFERRAL_CYCLE(Severity.ERROR),
    FORK_MISMATCH(Severity.ERROR),
    JOIN_MISMATCH(Severity.ERROR),
    FORK_JOIN_REGION_MISMATCH(Severity.ERROR);

    private final Severity defaultSeverity;

    DiagnosticCode(Severity defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public Severity defaultSeverity() {
        return defaultSeverity;
    }
}
