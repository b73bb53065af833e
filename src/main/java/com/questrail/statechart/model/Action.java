package com.questrail.statechart.model;

import java.util.List;
import java.util.Objects;

/**
 * Action
 * -----------------------------------------------------------------------------
 * One step of an ordered action list (transition effect, entry or exit).
 *
 * Actions never influence transition selection within the same dispatch step:
 * {@link Raise} and {@link Send} only enqueue, and {@link Assign} mutates the
 * context after guards for the step have already been evaluated.
 */
public sealed interface Action
        permits Action.Call, Action.Raise, Action.Send, Action.Defer, Action.Assign
{
    /** Short stable description used in trace records. */
    String describe();

    /**
     * Invoke an extern action procedure.
     *
     * @param name extern name
     * @param slot dense slot in the machine's extern action table, {@code -1} while unresolved
     */
    record Call(String name, int slot) implements Action {
        public Call {
            Objects.requireNonNull(name, "name");
        }

        @Override
        public String describe() {
            return "call " + name;
        }
    }

    /** Enqueue an event to this instance's own external queue. */
    record Raise(String event, int eventIndex, List<ValueExpr> args) implements Action {
        public Raise {
            Objects.requireNonNull(event, "event");
            args = List.copyOf(args);
        }

        @Override
        public String describe() {
            return "raise " + event;
        }
    }

    /** Enqueue an event to another instance, resolved by machine name at run time. */
    record Send(String machine, String event, List<ValueExpr> args) implements Action {
        public Send {
            Objects.requireNonNull(machine, "machine");
            Objects.requireNonNull(event, "event");
            args = List.copyOf(args);
        }

        @Override
        public String describe() {
            return "send " + machine + "." + event;
        }
    }

    /**
     * Hold the triggering event in the deferral buffer of the transition's source
     * state. Only meaningful in the effect list of an internal transition.
     */
    record Defer(String event, int eventIndex) implements Action {
        public Defer {
            Objects.requireNonNull(event, "event");
        }

        @Override
        public String describe() {
            return "defer " + event;
        }
    }

    /** Inline assignment to a context field. */
    record Assign(FieldRef target, ValueExpr value) implements Action {
        public Assign {
            Objects.requireNonNull(target, "target");
            Objects.requireNonNull(value, "value");
        }

        @Override
        public String describe() {
            return target + " = " + value;
        }
    }
}
