package com.questrail.statechart;

import com.questrail.statechart.analysis.StatechartCompiler;
import com.questrail.statechart.analysis.ValidatedMachine;
import com.questrail.statechart.model.FieldDecl;
import com.questrail.statechart.model.FieldType;
import com.questrail.statechart.model.Machine;
import com.questrail.statechart.model.MachineBuilder;
import com.questrail.statechart.model.RegionRef;
import com.questrail.statechart.model.TargetConfig;
import com.questrail.statechart.model.VertexRef;

import static com.questrail.statechart.model.Actions.assign;
import static com.questrail.statechart.model.Actions.call;
import static com.questrail.statechart.model.Actions.value;
import static com.questrail.statechart.model.Guards.ctx;
import static com.questrail.statechart.model.Guards.gt;
import static com.questrail.statechart.model.Guards.payload;

/**
 * Machines
 * -----------------------------------------------------------------------------
 * Sample machines shared by the analysis, runtime and simulation tests.
 *
 * Extern actions are named after what they mark ({@code enterRunning},
 * {@code exitIdle}, ...) so tests can bind them to a recorder and assert on
 * the order of side effects.
 */
public final class Machines
{
    private Machines() {
    }

    public static ValidatedMachine validate(Machine machine) {
        return new StatechartCompiler().compile(machine).orThrow();
    }

    public static ValidatedMachine validate(MachineBuilder builder) {
        return validate(builder.build());
    }

    /**
     * Idle --START[speed > 0]--> Running, Running --STOP--> Idle,
     * Running after 5000 ms --> Timeout, Timeout --STOP--> Idle.
     *
     * Transition uids: {@code Motor.Idle#1} (start), {@code Motor.Running#1}
     * (stop), {@code Motor.Running#2} (timeout), {@code Motor.Timeout#1}.
     */
    public static MachineBuilder motor(TargetConfig config) {
        MachineBuilder b = MachineBuilder.machine("Motor").config(config);
        b.context("speed", FieldType.range(0, 100));
        b.event("START", FieldDecl.of("speed", FieldType.range(0, 100)));
        b.event("STOP");

        VertexRef idle = b.state("Idle");
        VertexRef running = b.state("Running");
        VertexRef timeout = b.state("Timeout");
        b.initial(b.root(), idle);

        b.onEntry(running, call("enterRunning"));
        b.onExit(running, call("exitRunning"));

        b.transition(idle, running).on("START")
                .when(gt(payload("speed"), 0))
                .then(assign(ctx("speed"), value(payload("speed"))));
        b.transition(running, idle).on("STOP").then(assign(ctx("speed"), 0));
        b.after(running, 5000, timeout);
        b.transition(timeout, idle).on("STOP");
        return b;
    }

    public static MachineBuilder motor() {
        return motor(TargetConfig.defaults());
    }

    /**
     * Root starts in Paused. Playing holds Track1 and Track2 and a shallow
     * history {@code Player.Playing.H} defaulting to Track1.
     */
    public static MachineBuilder player() {
        MachineBuilder b = MachineBuilder.machine("Player");
        b.event("NEXT");
        b.event("PAUSE");
        b.event("RESUME");

        VertexRef paused = b.state("Paused");
        VertexRef playing = b.state("Playing");
        VertexRef track1 = b.state(playing, "Track1");
        VertexRef track2 = b.state(playing, "Track2");
        VertexRef history = b.shallowHistory(playing);
        b.initial(playing, track1);
        b.initial(b.root(), paused);
        b.transition(history, track1);

        b.onEntry(playing, call("enterPlaying"));
        b.onEntry(track1, call("enterTrack1"));
        b.onEntry(track2, call("enterTrack2"));

        b.transition(track1, track2).on("NEXT");
        b.transition(track2, track1).on("NEXT");
        b.transition(playing, paused).on("PAUSE");
        b.transition(paused, history).on("RESUME");
        return b;
    }

    /**
     * Outer holds Mid (Leaf1, Leaf2) and a deep history {@code Deep.Outer.H*}
     * without default transition. Outer --OUT--> Away --BACK--> H*.
     */
    public static MachineBuilder deep() {
        MachineBuilder b = MachineBuilder.machine("Deep");
        b.event("NEXT");
        b.event("OUT");
        b.event("BACK");
        b.event("SHALLOW");

        VertexRef outer = b.state("Outer");
        VertexRef away = b.state("Away");
        VertexRef mid = b.state(outer, "Mid");
        VertexRef leaf1 = b.state(mid, "Leaf1");
        VertexRef leaf2 = b.state(mid, "Leaf2");
        VertexRef history = b.deepHistory(outer);
        b.initial(b.root(), outer);
        b.initial(outer, mid);
        b.initial(mid, leaf1);

        b.onEntry(leaf1, call("enterLeaf1"));
        b.onEntry(leaf2, call("enterLeaf2"));

        b.transition(leaf1, leaf2).on("NEXT");
        b.transition(outer, away).on("OUT");
        b.transition(away, history).on("BACK");
        b.transition(away, outer).on("SHALLOW");
        return b;
    }

    /**
     * Start --SPLIT--> fork into Work/a.A and Work/b.B; A --DONE_A--> join,
     * B --DONE_B--> join; the join continues to End.
     */
    public static MachineBuilder pipeline() {
        MachineBuilder b = MachineBuilder.machine("Pipeline");
        b.event("SPLIT");
        b.event("DONE_A");
        b.event("DONE_B");

        VertexRef start = b.state("Start");
        VertexRef work = b.parallel("Work");
        VertexRef end = b.state("End");
        VertexRef fork = b.fork(b.root(), "F");
        VertexRef join = b.join(b.root(), "J");
        b.initial(b.root(), start);

        RegionRef rb = b.region(work, "b");
        RegionRef ra = b.region(work, "a");
        VertexRef a = b.state(ra, "A");
        VertexRef bb = b.state(rb, "B");
        b.initial(ra, a);
        b.initial(rb, bb);

        b.onEntry(work, call("enterWork"));
        b.onEntry(a, call("enterA"));
        b.onEntry(bb, call("enterB"));
        b.onExit(work, call("exitWork"));
        b.onExit(a, call("exitA"));
        b.onExit(bb, call("exitB"));
        b.onEntry(end, call("enterEnd"));

        b.transition(start, fork).on("SPLIT");
        b.transition(fork, bb).then(call("forkB"));
        b.transition(fork, a).then(call("forkA"));
        b.transition(a, join).on("DONE_A");
        b.transition(bb, join).on("DONE_B");
        b.transition(join, end).then(call("joined"));
        return b;
    }

    /**
     * Idle --GO--> C; C's only region starts in a final state and C's
     * completion transition re-enters C, so the chain never settles.
     */
    public static MachineBuilder completionLoop() {
        MachineBuilder b = MachineBuilder.machine("Loop");
        b.event("GO");

        VertexRef idle = b.state("Idle");
        VertexRef c = b.state("C");
        VertexRef done = b.finalState(c, "Done");
        b.initial(b.root(), idle);
        b.initial(c, done);

        b.onEntry(c, call("enterC"));
        b.transition(idle, c).on("GO");
        b.completion(c, c);
        return b;
    }

    /**
     * Idle --JOB--> Busy, Busy defers JOB, Busy --DONE--> Idle.
     */
    public static MachineBuilder worker(TargetConfig config) {
        MachineBuilder b = MachineBuilder.machine("Worker").config(config);
        b.event("JOB", FieldDecl.of("id", FieldType.range(0, 9)));
        b.event("DONE");
        b.context("current", FieldType.range(0, 9));

        VertexRef idle = b.state("Idle");
        VertexRef busy = b.state("Busy");
        b.initial(b.root(), idle);
        b.defer(busy, "JOB");

        b.transition(idle, busy).on("JOB").then(assign(ctx("current"), value(payload("id"))));
        b.transition(busy, idle).on("DONE");
        return b;
    }

    public static MachineBuilder worker() {
        return worker(TargetConfig.defaults());
    }
}
