package com.questrail.statechart.analysis;

import com.questrail.statechart.Machines;
import com.questrail.statechart.model.FieldType;
import com.questrail.statechart.model.Machine;
import com.questrail.statechart.model.MachineBuilder;
import com.questrail.statechart.model.VertexRef;
import org.junit.jupiter.api.Test;

import static com.questrail.statechart.model.Guards.ctx;
import static com.questrail.statechart.model.Guards.ge;
import static org.junit.jupiter.api.Assertions.*;

class StatechartCompilerTests
{
    private final StatechartCompiler compiler = new StatechartCompiler();

    // ---------------------------------------------------------------------
    // Accept / reject
    // ---------------------------------------------------------------------

    @Test
    void sampleMachinesAreAccepted() {
        for (MachineBuilder b : new MachineBuilder[] {
                Machines.motor(), Machines.player(), Machines.deep(),
                Machines.pipeline(), Machines.completionLoop(), Machines.worker()}) {
            AnalysisReport report = compiler.compile(b.build());

            assertTrue(report.accepted(), report.diagnostics()::toString);
            assertTrue(report.errors().isEmpty());
        }
    }

    @Test
    void warningsDoNotReject() {
        MachineBuilder b = MachineBuilder.machine("M");
        b.context("x", FieldType.range(0, 3));
        b.event("GO");
        VertexRef s = b.state("S");
        b.initial(b.root(), s);
        b.internal(s).on("GO").when(ge(ctx("x"), 0));

        AnalysisReport report = compiler.compile(b.build());

        assertTrue(report.accepted());
        assertEquals(1, report.warnings().size());
        assertTrue(report.has(DiagnosticCode.TAUTOLOGICAL_GUARD));
        assertEquals("M", report.orThrow().name());
    }

    @Test
    void oneRunReportsFaultsFromEveryPass() {
        MachineBuilder b = MachineBuilder.machine("M");
        b.event("GO");
        VertexRef s = b.state("S");
        VertexRef t = b.state("T");
        b.state("T");
        b.state("Orphan");
        b.initial(b.root(), s);
        b.transition(s, t).on("GO");
        b.transition(s, s).on("GO");

        AnalysisReport report = compiler.compile(b.build());

        assertFalse(report.accepted());
        assertTrue(report.has(DiagnosticCode.DUPLICATE_NAME));
        assertTrue(report.has(DiagnosticCode.NONDETERMINISM));
        assertTrue(report.has(DiagnosticCode.UNREACHABLE_STATE));
        assertTrue(report.withCode(DiagnosticCode.UNREACHABLE_STATE).stream()
                .anyMatch(d -> d.subject().equals("M.Orphan")));
    }

    @Test
    void rejectedReportListsErrorsWhenForced() {
        MachineBuilder b = MachineBuilder.machine("M");
        b.event("GO");
        VertexRef s = b.state("S");
        b.initial(b.root(), s);
        b.internal(s).on("GO");
        b.internal(s).on("GO");

        AnalysisReport report = compiler.compile(b.build());
        IllegalStateException ex = assertThrows(IllegalStateException.class, report::orThrow);

        assertTrue(ex.getMessage().startsWith("Machine M rejected:\n"));
        assertTrue(ex.getMessage().contains("NONDETERMINISM [M.S#2]"));
    }

    // ---------------------------------------------------------------------
    // Validated machine
    // ---------------------------------------------------------------------

    @Test
    void candidateListsFollowHierarchicalOverride() {
        ValidatedMachine vm = compiler.compile(Machines.deep().build()).orThrow();
        Machine m = vm.machine();
        TransitionTable table = vm.table();
        int next = m.eventHandle("NEXT");
        int out = m.eventHandle("OUT");
        int leaf1 = m.vertex("Deep.Outer.Mid.Leaf1").index();
        int leaf2 = m.vertex("Deep.Outer.Mid.Leaf2").index();

        assertEquals(leaf1, table.winner(leaf1, next));
        assertArrayEquals(new int[] {m.transition("Deep.Outer.Mid.Leaf1#1").index()}, table.candidates(leaf1, next));
        assertEquals(-1, table.winner(leaf2, next));
        assertEquals(0, table.candidates(leaf2, next).length);
        assertEquals(m.vertex("Deep.Outer").index(), table.winner(leaf2, out));
    }

    @Test
    void describeOutlinesTheRegionTree() {
        ValidatedMachine vm = compiler.compile(Machines.motor().build()).orThrow();

        String outline = vm.describe();

        assertTrue(outline.startsWith("COMPOSITE Motor\n  region main\n"));
        assertTrue(outline.contains("    SIMPLE Motor.Idle\n"));
        assertSame(vm.hierarchy(), vm.table().hierarchy());
    }
}
