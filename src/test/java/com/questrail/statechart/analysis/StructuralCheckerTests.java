package com.questrail.statechart.analysis;

import com.questrail.statechart.Machines;
import com.questrail.statechart.model.FieldType;
import com.questrail.statechart.model.Machine;
import com.questrail.statechart.model.MachineBuilder;
import com.questrail.statechart.model.RegionRef;
import com.questrail.statechart.model.TargetConfig;
import com.questrail.statechart.model.VertexRef;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.questrail.statechart.model.Actions.assign;
import static com.questrail.statechart.model.Guards.ctx;
import static com.questrail.statechart.model.Guards.gt;
import static org.junit.jupiter.api.Assertions.*;

class StructuralCheckerTests
{
    private static List<Diagnostic> check(MachineBuilder b) {
        Machine m = b.build();
        HierarchyResolver h = new HierarchyResolver(m);
        Diagnostics out = new Diagnostics();
        new StructuralChecker(m, h, new TransitionTable(m, h)).check(out);
        return out.all();
    }

    private static List<DiagnosticCode> codes(MachineBuilder b) {
        return check(b).stream().map(Diagnostic::code).toList();
    }

    private static MachineBuilder machine(String... events) {
        MachineBuilder b = MachineBuilder.machine("M");
        for (String e : events) {
            b.event(e);
        }
        return b;
    }

    @Test
    void sampleMachinesPass() {
        assertTrue(check(Machines.motor()).isEmpty());
        assertTrue(check(Machines.player()).isEmpty());
        assertTrue(check(Machines.deep()).isEmpty());
        assertTrue(check(Machines.pipeline()).isEmpty());
        assertTrue(check(Machines.worker()).isEmpty());
    }

    // ---------------------------------------------------------------------
    // Transition shape
    // ---------------------------------------------------------------------

    @Test
    void stateTransitionWithoutTriggerIsIllegal() {
        MachineBuilder b = machine();
        VertexRef s = b.state("S");
        VertexRef t = b.state("T");
        b.initial(b.root(), s);
        b.transition(s, t);

        List<Diagnostic> d = check(b);

        assertEquals(1, d.size());
        assertEquals(DiagnosticCode.ILLEGAL_TRANSITION, d.get(0).code());
        assertEquals("M.S#1", d.get(0).subject());
    }

    @Test
    void timedTransitionsNeedAPositiveDelay() {
        MachineBuilder b = machine();
        VertexRef s = b.state("S");
        VertexRef t = b.state("T");
        b.initial(b.root(), s);
        b.after(s, 0, t);

        assertEquals(List.of(DiagnosticCode.INVALID_TIMER), codes(b));
    }

    @Test
    void timedAndCompletionTransitionsCarryNoTrigger() {
        MachineBuilder b = machine("GO");
        VertexRef s = b.state("S");
        VertexRef t = b.state("T");
        b.initial(b.root(), s);
        b.after(s, 100, t).on("GO");
        b.completion(t, s).on("GO");

        assertEquals(List.of(DiagnosticCode.ILLEGAL_TRANSITION, DiagnosticCode.ILLEGAL_TRANSITION), codes(b));
    }

    @Test
    void defaultTransitionsCarryNoGuard() {
        MachineBuilder b = machine();
        b.context("x", FieldType.range(0, 3));
        VertexRef s = b.state("S");
        b.initial(b.root(), s).when(gt(ctx("x"), 1));

        assertEquals(List.of(DiagnosticCode.ILLEGAL_TRANSITION), codes(b));
    }

    @Test
    void localTransitionMustStayNested() {
        MachineBuilder b = machine("GO");
        VertexRef s = b.state("S");
        VertexRef t = b.state("T");
        b.initial(b.root(), s);
        b.local(s, t).on("GO");

        assertEquals(List.of(DiagnosticCode.ILLEGAL_TRANSITION), codes(b));
    }

    @Test
    void finalStatesHaveNoOutgoingTransitions() {
        MachineBuilder b = machine();
        VertexRef s = b.state("S");
        VertexRef done = b.finalState(b.root(), "Done");
        b.initial(b.root(), s);
        b.completion(s, done);
        b.transition(done, s);

        assertTrue(codes(b).contains(DiagnosticCode.ILLEGAL_TRANSITION));
        assertTrue(check(b).stream().anyMatch(d -> d.subject().equals("M.Done")));
    }

    @Test
    void choiceWithoutBranchesIsIllegal() {
        MachineBuilder b = machine("GO");
        VertexRef s = b.state("S");
        VertexRef c = b.choice(b.root(), "C");
        b.initial(b.root(), s);
        b.transition(s, c).on("GO");

        List<Diagnostic> d = check(b);

        assertEquals(1, d.size());
        assertEquals("M.C", d.get(0).subject());
    }

    @Test
    void assignmentsNeedInlineArithmetic() {
        MachineBuilder b = MachineBuilder.machine("M")
                .config(TargetConfig.builder().withInlineArithmetic(false).build());
        b.context("x", FieldType.range(0, 3));
        b.event("GO");
        VertexRef s = b.state("S");
        b.initial(b.root(), s);
        b.onEntry(s, assign(ctx("x"), 1));
        b.internal(s).on("GO").then(assign(ctx("x"), 2));

        List<Diagnostic> d = check(b);

        assertEquals(2, d.size());
        assertTrue(d.stream().allMatch(x -> x.code() == DiagnosticCode.INLINE_ARITHMETIC_DISABLED));
    }

    // ---------------------------------------------------------------------
    // Fork / join
    // ---------------------------------------------------------------------

    private static MachineBuilder parallelOfThree(boolean forkToAll) {
        MachineBuilder b = MachineBuilder.machine("M");
        b.event("GO");
        b.event("DONE");
        VertexRef start = b.state("Start");
        VertexRef p = b.parallel("P");
        VertexRef end = b.state("End");
        b.initial(b.root(), start);
        RegionRef ra = b.region(p, "a");
        RegionRef rb = b.region(p, "b");
        RegionRef rc = b.region(p, "c");
        VertexRef x = b.state(ra, "X");
        VertexRef y = b.state(rb, "Y");
        VertexRef z = b.state(rc, "Z");
        b.initial(ra, x);
        b.initial(rb, y);
        b.initial(rc, z);

        VertexRef fork = b.fork(b.root(), "F");
        VertexRef join = b.join(b.root(), "J");
        b.transition(start, fork).on("GO");
        b.transition(fork, x);
        b.transition(fork, y);
        if (forkToAll) {
            b.transition(fork, z);
        }
        b.transition(x, join).on("DONE");
        b.transition(y, join).on("DONE");
        b.transition(z, join).on("DONE");
        b.transition(join, end);
        return b;
    }

    @Test
    void matchingForkAndJoinPass() {
        assertTrue(check(parallelOfThree(true)).isEmpty());
    }

    @Test
    void forkAndJoinOverDifferentRegions() {
        List<Diagnostic> d = check(parallelOfThree(false));

        assertEquals(1, d.size());
        assertEquals(DiagnosticCode.FORK_JOIN_REGION_MISMATCH, d.get(0).code());
        assertEquals("M.F", d.get(0).subject());
    }

    @Test
    void forkNeedsTwoTargets() {
        MachineBuilder b = MachineBuilder.machine("M");
        b.event("GO");
        VertexRef s = b.state("S");
        VertexRef t = b.state("T");
        VertexRef fork = b.fork(b.root(), "F");
        b.initial(b.root(), s);
        b.transition(s, fork).on("GO");
        b.transition(fork, t);

        assertEquals(List.of(DiagnosticCode.FORK_MISMATCH), codes(b));
    }

    @Test
    void forkTargetsMustLieInOneParallelState() {
        MachineBuilder b = MachineBuilder.machine("M");
        b.event("GO");
        VertexRef s = b.state("S");
        VertexRef t = b.state("T");
        VertexRef u = b.state("U");
        VertexRef fork = b.fork(b.root(), "F");
        b.initial(b.root(), s);
        b.transition(s, fork).on("GO");
        b.transition(fork, t);
        b.transition(fork, u);

        assertTrue(codes(b).contains(DiagnosticCode.FORK_MISMATCH));
    }

    @Test
    void joinMustCoverEveryRegion() {
        MachineBuilder partial = MachineBuilder.machine("M");
        partial.event("GO");
        VertexRef p = partial.parallel("P");
        VertexRef end = partial.state("End");
        RegionRef ra = partial.region(p, "a");
        RegionRef rb = partial.region(p, "b");
        VertexRef x = partial.state(ra, "X");
        VertexRef x2 = partial.state(ra, "X2");
        VertexRef y = partial.state(rb, "Y");
        partial.initial(partial.root(), p);
        partial.initial(ra, x);
        partial.initial(rb, y);
        partial.transition(x, x2).on("GO");
        VertexRef join = partial.join(partial.root(), "J");
        partial.transition(x, join).on("GO").priority(1);
        partial.transition(x2, join).on("GO");
        partial.transition(join, end);

        assertTrue(codes(partial).contains(DiagnosticCode.JOIN_MISMATCH));
    }

    // ---------------------------------------------------------------------
    // Reachability and deferral
    // ---------------------------------------------------------------------

    @Test
    void stateWithoutIncomingPathIsUnreachable() {
        MachineBuilder b = MachineBuilder.machine("M");
        b.initial(b.root(), b.state("S"));
        b.state("Orphan");

        List<Diagnostic> d = check(b);

        assertEquals(1, d.size());
        assertEquals(DiagnosticCode.UNREACHABLE_STATE, d.get(0).code());
        assertEquals("M.Orphan", d.get(0).subject());
    }

    @Test
    void deferringWithoutAnyWayOutIsACycle() {
        MachineBuilder b = MachineBuilder.machine("M");
        b.event("GO");
        b.event("JOB");
        VertexRef idle = b.state("Idle");
        VertexRef stuck = b.state("Stuck");
        b.initial(b.root(), idle);
        b.transition(idle, stuck).on("GO");
        b.defer(stuck, "JOB");

        List<Diagnostic> d = check(b);

        assertEquals(1, d.size());
        assertEquals(DiagnosticCode.DEFERRAL_CYCLE, d.get(0).code());
        assertEquals("M.Stuck", d.get(0).subject());
        assertTrue(d.get(0).message().contains("JOB"));
    }

    @Test
    void deferringStatesThatOnlyReachEachOtherFormACycle() {
        MachineBuilder b = MachineBuilder.machine("M");
        b.event("GO");
        b.event("FLIP");
        b.event("JOB");
        VertexRef idle = b.state("Idle");
        VertexRef ping = b.state("Ping");
        VertexRef pong = b.state("Pong");
        b.initial(b.root(), idle);
        b.transition(idle, ping).on("GO");
        b.transition(ping, pong).on("FLIP");
        b.transition(pong, ping).on("FLIP");
        b.defer(ping, "JOB");
        b.defer(pong, "JOB");

        assertEquals(List.of(DiagnosticCode.DEFERRAL_CYCLE), codes(b));
    }
}
