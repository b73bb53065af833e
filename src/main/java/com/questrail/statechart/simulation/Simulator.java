package com.questrail.statechart.simulation;

import com.questrail.statechart.analysis.ValidatedMachine;
import com.questrail.statechart.api.DispatchResult;
import com.questrail.statechart.api.FatalFaultException;
import com.questrail.statechart.api.Fault;
import com.questrail.statechart.runtime.CapabilityTable;
import com.questrail.statechart.runtime.DispatchEngine;
import com.questrail.statechart.time.VirtualTimerAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Simulator
 * -----------------------------------------------------------------------------
 * Runs scripted scenarios against fresh instances on a virtual clock and
 * records their traces.
 *
 * Every run builds a new {@link DispatchEngine} with a new
 * {@link VirtualTimerAdapter} starting at time zero and new capabilities from
 * the supplier, so two runs of the same scenario start from identical state.
 * A fatal fault ends the run; it is reported in the result rather than thrown.
 */
public final class Simulator
{
    private static final Logger log = LoggerFactory.getLogger(Simulator.class);

    private final ValidatedMachine machine;
    private final Supplier<CapabilityTable> capabilities;

    public Simulator(ValidatedMachine machine) {
        this(machine, CapabilityTable::empty);
    }

    public Simulator(ValidatedMachine machine, Supplier<CapabilityTable> capabilities) {
        this.machine = Objects.requireNonNull(machine, "machine");
        this.capabilities = Objects.requireNonNull(capabilities, "capabilities");
    }

    public SimulationResult run(Scenario scenario) {
        Objects.requireNonNull(scenario, "scenario");
        CollectingTraceSink sink = new CollectingTraceSink();
        DispatchEngine engine = DispatchEngine.builder(machine)
                .withCapabilities(capabilities.get())
                .withTimers(new VirtualTimerAdapter())
                .withTrace(sink)
                .build();

        List<DispatchResult> results = new ArrayList<>();
        Fault fatal = null;
        try {
            results.add(engine.init());
            for (ScenarioStep step : scenario.steps()) {
                apply(engine, step, results);
            }
        } catch (FatalFaultException ex) {
            fatal = ex.fault();
            log.debug("Scenario {} halted: {}", scenario.name(), fatal);
        }
        return new SimulationResult(scenario.name(), sink.records(), results,
                engine.activeLeaves(), Optional.ofNullable(fatal));
    }

    private static void apply(DispatchEngine engine, ScenarioStep step, List<DispatchResult> results) {
        if (step instanceof ScenarioStep.Dispatch d) {
            results.add(engine.dispatch(d.event()));
        } else if (step instanceof ScenarioStep.Enqueue e) {
            engine.enqueue(e.event());
        } else if (step instanceof ScenarioStep.ProcessNext) {
            results.add(engine.processNext());
        } else if (step instanceof ScenarioStep.Drain) {
            while (engine.queueOccupancy() > 0) {
                results.add(engine.processNext());
            }
        } else if (step instanceof ScenarioStep.Tick t) {
            results.addAll(engine.tick(t.elapsedMillis()));
        }
    }
}
