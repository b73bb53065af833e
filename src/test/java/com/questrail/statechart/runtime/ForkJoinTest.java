package com.questrail.statechart.runtime;

import com.questrail.statechart.Machines;
import com.questrail.statechart.Recorder;
import com.questrail.statechart.api.DispatchResult;
import com.questrail.statechart.api.Event;
import com.questrail.statechart.model.MachineBuilder;
import com.questrail.statechart.model.RegionRef;
import com.questrail.statechart.model.VertexRef;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.statechart.model.Actions.call;
import static org.junit.jupiter.api.Assertions.*;

/**
 * ForkJoinTest
 * -----------------------------------------------------------------------------
 * A fork enters both regions of {@code Pipeline.Work} in one compound
 * transition; the join fires once, only after both regions arrived.
 */
class ForkJoinTest
{
    private final Recorder recorder = new Recorder();
    private DispatchEngine engine;

    @BeforeEach
    void setUp() {
        engine = DispatchEngine.builder(Machines.validate(Machines.pipeline()))
                .withCapabilities(recorder.table(
                        "enterWork", "enterA", "enterB", "exitWork", "exitA", "exitB",
                        "enterEnd", "forkA", "forkB", "joined"))
                .build();
        engine.init();
    }

    @Test
    void forkEntersEveryRegionInOneStep() {
        DispatchResult r = engine.dispatch(Event.of("SPLIT"));

        assertEquals(List.of("Pipeline.Work.a.A", "Pipeline.Work.b.B"), engine.activeLeaves());
        assertEquals(List.of("Pipeline.Start#1", "Pipeline.F#2", "Pipeline.F#1"), r.transitionsFired());
        assertEquals(List.of("forkA", "forkB", "enterWork", "enterA", "enterB"), recorder.log());
    }

    @Test
    void joinWaitsForEveryRegion() {
        engine.dispatch(Event.of("SPLIT"));

        DispatchResult first = engine.dispatch(Event.of("DONE_A"));

        assertEquals(List.of("Pipeline.Work.a.A#1"), first.transitionsFired());
        assertEquals(List.of("Pipeline.Work.a.A", "Pipeline.Work.b.B"), engine.activeLeaves());
        assertEquals(0, recorder.count("joined"));
    }

    @Test
    void joinFiresExactlyOnceAfterBothArrive() {
        engine.dispatch(Event.of("SPLIT"));
        engine.dispatch(Event.of("DONE_A"));
        engine.dispatch(Event.of("DONE_A"));
        recorder.clear();

        DispatchResult r = engine.dispatch(Event.of("DONE_B"));

        assertTrue(r.fired("Pipeline.Work.b.B#1"));
        assertTrue(r.fired("Pipeline.J#1"));
        assertEquals(List.of("Pipeline.End"), engine.activeLeaves());
        assertEquals(List.of("exitA", "exitB", "exitWork", "joined", "enterEnd"), recorder.log());

        engine.dispatch(Event.of("DONE_A"));
        engine.dispatch(Event.of("DONE_B"));
        assertEquals(1, recorder.count("joined"));
        assertEquals(1, recorder.count("enterEnd"));
    }

    @Test
    void arrivalOrderDoesNotMatter() {
        engine.dispatch(Event.of("SPLIT"));
        engine.dispatch(Event.of("DONE_B"));
        assertEquals(0, recorder.count("joined"));

        engine.dispatch(Event.of("DONE_A"));

        assertEquals(1, recorder.count("joined"));
        assertEquals(List.of("Pipeline.End"), engine.activeLeaves());
    }

    // ---------------------------------------------------------------------
    // Unequal depth
    // ---------------------------------------------------------------------

    /**
     * Start --GO--> F forks into P.z.Flat and the composite P.a.Deep, whose
     * default entry continues to Inner. Regions and branches are declared
     * z before a.
     */
    private static MachineBuilder unevenFork() {
        MachineBuilder b = MachineBuilder.machine("Uneven");
        b.event("GO");

        VertexRef start = b.state("Start");
        VertexRef p = b.parallel("P");
        VertexRef fork = b.fork(b.root(), "F");
        b.initial(b.root(), start);

        RegionRef rz = b.region(p, "z");
        RegionRef ra = b.region(p, "a");
        VertexRef flat = b.state(rz, "Flat");
        VertexRef deep = b.state(ra, "Deep");
        VertexRef inner = b.state(deep, "Inner");
        b.initial(rz, flat);
        b.initial(ra, deep);
        b.initial(deep, inner);

        b.onExit(start, call("exitStart"));
        b.onEntry(p, call("enterP"));
        b.onEntry(flat, call("enterFlat"));
        b.onEntry(deep, call("enterDeep"));
        b.onEntry(inner, call("enterInner"));

        b.transition(start, fork).on("GO").then(call("toFork"));
        b.transition(fork, flat).then(call("forkZ"));
        b.transition(fork, deep).then(call("forkA"));
        return b;
    }

    @Test
    void forkIntoRegionsOfUnequalDepthFollowsRegionOrder() {
        Recorder log = new Recorder();
        DispatchEngine uneven = DispatchEngine.builder(Machines.validate(unevenFork()))
                .withCapabilities(log.table(
                        "exitStart", "enterP", "enterFlat", "enterDeep", "enterInner", "toFork", "forkZ", "forkA"))
                .build();
        uneven.init();

        DispatchResult r = uneven.dispatch(Event.of("GO"));

        assertEquals(List.of("exitStart", "toFork", "forkA", "forkZ", "enterP", "enterDeep", "enterInner", "enterFlat"),
                log.log());
        assertEquals(List.of("Uneven.Start#1", "Uneven.F#2", "Uneven.F#1"), r.transitionsFired());
        assertEquals(List.of("Uneven.P.a.Deep.Inner", "Uneven.P.z.Flat"), uneven.activeLeaves());
    }
}
