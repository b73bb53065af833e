package com.questrail.statechart.simulation;

import com.questrail.statechart.api.DispatchResult;
import com.questrail.statechart.api.Fault;
import com.questrail.statechart.observability.TraceRecord;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of running a {@link Scenario}.
 *
 * @param scenario    scenario name
 * @param trace       every step record, starting with {@code init}
 * @param results     dispatch results in order, including those of timer steps
 * @param finalLeaves active leaves when the scenario ended
 * @param fatal       the fatal fault that halted the instance, if any
 */
public record SimulationResult(String scenario,
                               List<TraceRecord> trace,
                               List<DispatchResult> results,
                               List<String> finalLeaves,
                               Optional<Fault> fatal)
{
    public SimulationResult {
        Objects.requireNonNull(scenario, "scenario");
        trace = List.copyOf(trace);
        results = List.copyOf(results);
        finalLeaves = List.copyOf(finalLeaves);
        Objects.requireNonNull(fatal, "fatal");
    }

    public boolean halted() {
        return fatal.isPresent();
    }

    /** Fired transition uids across the whole run, in order. */
    public List<String> firedTransitions() {
        return trace.stream().flatMap(r -> r.transitionsFired().stream()).toList();
    }
}
