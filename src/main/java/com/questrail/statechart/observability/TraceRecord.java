package com.questrail.statechart.observability;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * One run-to-completion step as seen from outside.
 *
 * Every identifier is a stable uid from the model, so a trace stays valid when
 * states are renamed.
 *
 * @param sequence         monotonic step number within the instance, starting at 1
 * @param machine          machine name
 * @param event            event identity: the event name, {@code timer(<transition uid>)},
 *                         or {@code init}
 * @param payload          payload snapshot in the runtime encoding
 * @param before           active leaves before the step
 * @param after            active leaves after the step
 * @param transitionsFired fired transition uids in order
 * @param actionsExecuted  executed actions as {@code <owner uid>: <action>} in order
 */
public record TraceRecord(long sequence,
                          String machine,
                          String event,
                          long[] payload,
                          List<String> before,
                          List<String> after,
                          List<String> transitionsFired,
                          List<String> actionsExecuted)
{
    public TraceRecord {
        Objects.requireNonNull(machine, "machine");
        Objects.requireNonNull(event, "event");
        payload = payload.clone();
        before = List.copyOf(before);
        after = List.copyOf(after);
        transitionsFired = List.copyOf(transitionsFired);
        actionsExecuted = List.copyOf(actionsExecuted);
    }

    @Override
    public long[] payload() {
        return payload.clone();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TraceRecord r)) {
            return false;
        }
        return sequence == r.sequence
                && machine.equals(r.machine)
                && event.equals(r.event)
                && Arrays.equals(payload, r.payload)
                && before.equals(r.before)
                && after.equals(r.after)
                && transitionsFired.equals(r.transitionsFired)
                && actionsExecuted.equals(r.actionsExecuted);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(sequence, machine, event, before, after, transitionsFired, actionsExecuted);
        return 31 * h + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "#" + sequence + " " + machine + " " + event
                + (payload.length == 0 ? "" : Arrays.toString(payload))
                + " " + before + " -> " + after
                + " fired=" + transitionsFired;
    }
}
