package com.questrail.statechart.model;

import java.util.List;
import java.util.Objects;

/**
 * Transition
 * -----------------------------------------------------------------------------
 * Immutable edge of the state graph.
 *
 * <h2>Ordering</h2>
 * Among transitions competing for the same event in the same state, the one
 * with the lowest {@link #priority()} number wins. Transitions with equal
 * priority must carry statically disjoint guards. {@link #index()} is the
 * declaration order and is used only to make iteration stable; it never
 * decides between two enabled transitions.
 */
public final class Transition
{
    public static final int DEFAULT_PRIORITY = 100;

    private final int index;
    private final String uid;
    private final TransitionKind kind;
    private final int source;
    private final int target;
    private final int trigger;
    private final Guard guard;
    private final List<Action> actions;
    private final int priority;
    private final boolean explicitPriority;
    private final long delayMillis;
    private final int timerSlot;

    Transition(int index,
               String uid,
               TransitionKind kind,
               int source,
               int target,
               int trigger,
               Guard guard,
               List<Action> actions,
               int priority,
               boolean explicitPriority,
               long delayMillis,
               int timerSlot) {
        this.index = index;
        this.uid = Objects.requireNonNull(uid, "uid");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.source = source;
        this.target = target;
        this.trigger = trigger;
        this.guard = Objects.requireNonNull(guard, "guard");
        this.actions = List.copyOf(actions);
        this.priority = priority;
        this.explicitPriority = explicitPriority;
        this.delayMillis = delayMillis;
        this.timerSlot = timerSlot;
    }

    public int index() {
        return index;
    }

    public String uid() {
        return uid;
    }

    public TransitionKind kind() {
        return kind;
    }

    public int source() {
        return source;
    }

    /** Target vertex handle, or {@code -1} for a targetless (internal) transition. */
    public int target() {
        return target;
    }

    public boolean hasTarget() {
        return target >= 0;
    }

    /** Trigger event handle, or {@code -1} for completion, timed and pseudostate-outgoing transitions. */
    public int trigger() {
        return trigger;
    }

    public boolean hasTrigger() {
        return trigger >= 0;
    }

    public Guard guard() {
        return guard;
    }

    public List<Action> actions() {
        return actions;
    }

    public int priority() {
        return priority;
    }

    /** Whether the priority was declared by the author rather than defaulted. */
    public boolean explicitPriority() {
        return explicitPriority;
    }

    /** Delay (one-shot) or period (periodic) for timed transitions, otherwise 0. */
    public long delayMillis() {
        return delayMillis;
    }

    /** Slot in the instance timer table, or {@code -1} for untimed transitions. */
    public int timerSlot() {
        return timerSlot;
    }

    @Override
    public String toString() {
        return kind + " " + uid;
    }
}
