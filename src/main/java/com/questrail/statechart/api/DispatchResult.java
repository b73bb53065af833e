package com.questrail.statechart.api;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of one run-to-completion step.
 *
 * <p>Steps take events in queue order, so the event a step processed is not
 * necessarily the one handed to {@link StatechartInstance#dispatch}; an event
 * raised earlier is processed first and the dispatched one stays queued.
 *
 * @param event            label of the processed event: its name, {@code "init"},
 *                         {@code "timer(<transition uid>)"} or {@code "timer(stale)"};
 *                         empty when nothing was processed
 * @param consumed         whether an event was taken from the queue and not deferred
 * @param transitionsFired stable identifiers of fired transitions, in firing order,
 *                         including those fired by the completion chain
 * @param fault            non-fatal fault observed during the step, if any
 */
public record DispatchResult(String event, boolean consumed, List<String> transitionsFired, Optional<Fault> fault)
{
    private static final DispatchResult IDLE = new DispatchResult("", false, List.of(), Optional.empty());

    public DispatchResult {
        Objects.requireNonNull(event, "event");
        transitionsFired = List.copyOf(transitionsFired);
        Objects.requireNonNull(fault, "fault");
    }

    /** Nothing was pending. */
    public static DispatchResult idle() {
        return IDLE;
    }

    /** {@code event} was not accepted into the queue. */
    public static DispatchResult rejected(String event, Fault fault) {
        return new DispatchResult(event, false, List.of(), Optional.of(fault));
    }

    public boolean fired(String transitionUid) {
        return transitionsFired.contains(transitionUid);
    }
}
