package com.questrail.statechart.api;

import java.util.List;
import java.util.Optional;

/**
 * StatechartInstance
 * -----------------------------------------------------------------------------
 * Public surface of one running machine instance.
 *
 * <h2>Threading</h2>
 * {@link #enqueue(Event)} may be called from any thread. Every other method
 * belongs to the single thread that owns the instance; one event and the
 * completion chain it induces are fully processed before the next event is
 * accepted.
 */
public interface StatechartInstance extends EventSink
{
    String machineName();

    /**
     * Enters the initial configuration, including any completion chain it
     * triggers. Must be called exactly once before any other processing.
     */
    DispatchResult init();

    /**
     * Enqueues the event and processes the next pending event. Events already
     * queued, including ones raised by earlier steps, are processed first;
     * {@link DispatchResult#event()} names the event this step took.
     */
    DispatchResult dispatch(Event event);

    /** Processes the next pending event; returns {@link DispatchResult#idle()} if none. */
    DispatchResult processNext();

    /** Processes pending events until the queue is empty; returns the number of steps. */
    int drain();

    /**
     * Advances the virtual clock, delivering every timer that expires in the
     * interval in deadline order.
     *
     * @throws IllegalStateException if the instance is not driven by a virtual clock
     */
    List<DispatchResult> tick(long elapsedMillis);

    // ---------------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------------

    /** Active child (state or final) of the region with this uid, if the region is active. */
    Optional<String> activeChild(String regionUid);

    /** Uids of the active leaf states and finals, ordered by region. */
    List<String> activeLeaves();

    /** Uids of every active state, outermost first within each region. */
    List<String> activeStates();

    boolean isActive(String vertexUid);

    /** Recorded history of a history pseudostate: the leaf path it will restore. */
    List<String> history(String historyUid);

    int queueOccupancy();

    int deferredCount();

    /** Uids of transitions whose timers are armed. */
    List<String> armedTimers();

    /** Whether every top-level region has reached a final state. */
    boolean isTerminated();

    /** Whether a fatal fault halted the instance. */
    boolean isHalted();
}
