package com.questrail.statechart.simulation;

import com.questrail.statechart.api.Event;

import java.util.Objects;

/**
 * One scripted interaction with a simulated instance.
 */
public sealed interface ScenarioStep
{
    /** Enqueue the event and process one step. */
    record Dispatch(Event event) implements ScenarioStep {
        public Dispatch {
            Objects.requireNonNull(event, "event");
        }
    }

    /** Enqueue the event without processing. */
    record Enqueue(Event event) implements ScenarioStep {
        public Enqueue {
            Objects.requireNonNull(event, "event");
        }
    }

    /** Process the next queued event, if any. */
    record ProcessNext() implements ScenarioStep {}

    /** Process queued events until the queue is empty. */
    record Drain() implements ScenarioStep {}

    /** Advance virtual time. */
    record Tick(long elapsedMillis) implements ScenarioStep {
        public Tick {
            if (elapsedMillis < 0) {
                throw new IllegalArgumentException("elapsedMillis must be >= 0");
            }
        }
    }
}
