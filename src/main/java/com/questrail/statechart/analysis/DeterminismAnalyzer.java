package com.questrail.statechart.analysis;

import com.questrail.statechart.model.Action;
import com.questrail.statechart.model.EventDecl;
import com.questrail.statechart.model.FieldType;
import com.questrail.statechart.model.Guard;
import com.questrail.statechart.model.Literal;
import com.questrail.statechart.model.Machine;
import com.questrail.statechart.model.Transition;
import com.questrail.statechart.model.Vertex;
import com.questrail.statechart.model.VertexKind;

import java.util.List;
import java.util.Objects;

/**
 * DeterminismAnalyzer
 * -----------------------------------------------------------------------------
 * Proves that at most one transition can be selected for every
 * (state, event) pair, and flags guards that are unconditional or dead.
 *
 * <h2>Competing groups</h2>
 * Because of hierarchical override, the candidates for any (leaf, event) pair
 * are exactly the own transitions of one state on that event (see
 * {@link TransitionTable#winner(int, int)}). It is therefore sufficient to
 * analyze, for every state, each group of its own transitions that share a
 * trigger, plus:
 * <ul>
 *   <li>the state's completion transitions</li>
 *   <li>the outgoing branches of every choice, junction, entry point and exit point</li>
 * </ul>
 *
 * <h2>Rules within a group</h2>
 * Transitions are ordered by priority number, then declaration order.
 * <ul>
 *   <li>Equal priority, guards not provably disjoint: {@code NONDETERMINISM} (error)</li>
 *   <li>Distinct priorities, guards overlap: {@code PRIORITY_RESOLVED} (warning)</li>
 *   <li>Guard is a contradiction, or a lower-numbered transition is
 *       unconditional: {@code DEAD_TRANSITION} (warning)</li>
 *   <li>Non-trivial guard is a tautology: {@code TAUTOLOGICAL_GUARD} (warning)</li>
 * </ul>
 * A choice must additionally be exhaustive: the disjunction of its branch
 * guards must be a tautology.
 */
public final class DeterminismAnalyzer
{
    private final Machine machine;
    private final TransitionTable table;
    private final GuardSolver solver = new GuardSolver();

    public DeterminismAnalyzer(Machine machine, TransitionTable table) {
        this.machine = Objects.requireNonNull(machine, "machine");
        this.table = Objects.requireNonNull(table, "table");
    }

    public void analyze(Diagnostics out) {
        Objects.requireNonNull(out, "out");

        checkTypes(out);

        int events = machine.events().size();
        for (Vertex v : machine.vertices()) {
            if (v.isState()) {
                for (int e = 0; e < events; e++) {
                    analyzeGroup(table.own(v.index(), e), out);
                }
                analyzeGroup(table.completions(v.index()), out);
                continue;
            }
            VertexKind kind = v.kind();
            if (kind == VertexKind.CHOICE || kind.isStaticChain()) {
                int[] branches = table.branches(v.index());
                analyzeGroup(branches, out);
                if (kind == VertexKind.CHOICE && branches.length > 0) {
                    checkExhaustive(v, branches, out);
                }
            }
        }
    }

    // ---------------------------------------------------------------------
    // Group analysis
    // ---------------------------------------------------------------------

    private void analyzeGroup(int[] group, Diagnostics out) {
        if (group.length == 0) {
            return;
        }

        boolean[] dead = new boolean[group.length];
        boolean[] unconditional = new boolean[group.length];

        for (int i = 0; i < group.length; i++) {
            Transition t = machine.transition(group[i]);
            if (provenContradiction(t, out)) {
                dead[i] = true;
                out.report(DiagnosticCode.DEAD_TRANSITION, t.uid(), "Guard " + t.guard() + " can never hold");
            } else if (provenTautology(t, out)) {
                unconditional[i] = true;
                if (!t.guard().isTrivial()) {
                    out.report(DiagnosticCode.TAUTOLOGICAL_GUARD, t.uid(),
                            "Guard " + t.guard() + " always holds; the transition is unconditional");
                }
            }
        }

        for (int i = 0; i < group.length; i++) {
            if (dead[i]) {
                continue;
            }
            Transition a = machine.transition(group[i]);
            for (int j = i + 1; j < group.length; j++) {
                if (dead[j]) {
                    continue;
                }
                Transition b = machine.transition(group[j]);
                if (a.priority() == b.priority()) {
                    if (!provenDisjoint(a, b, out)) {
                        out.report(DiagnosticCode.NONDETERMINISM, b.uid(),
                                "Guards of " + a.uid() + " and " + b.uid() + " may both hold at priority "
                                        + a.priority() + ": " + a.guard() + " / " + b.guard());
                    }
                } else if (unconditional[i]) {
                    dead[j] = true;
                    out.report(DiagnosticCode.DEAD_TRANSITION, b.uid(),
                            "Shadowed by unconditional transition " + a.uid() + " at priority " + a.priority());
                } else if (!provenDisjoint(a, b, out)) {
                    out.report(DiagnosticCode.PRIORITY_RESOLVED, b.uid(),
                            "Overlaps " + a.uid() + "; resolved by priority " + a.priority() + " < " + b.priority());
                }
            }
        }
    }

    private void checkExhaustive(Vertex choice, int[] branches, Diagnostics out) {
        Guard any = machine.transition(branches[0]).guard();
        for (int i = 1; i < branches.length; i++) {
            any = new Guard.Or(any, machine.transition(branches[i]).guard());
        }
        boolean exhaustive;
        try {
            exhaustive = solver.tautology(any);
        } catch (GuardSolver.TooComplexException ex) {
            out.report(DiagnosticCode.GUARD_TOO_COMPLEX, choice.uid(), ex.getMessage());
            exhaustive = false;
        }
        if (!exhaustive) {
            out.report(DiagnosticCode.CHOICE_NOT_EXHAUSTIVE, choice.uid(),
                    "Branch guards of choice do not cover every case; add an unguarded branch");
        }
    }

    private boolean provenContradiction(Transition t, Diagnostics out) {
        try {
            return solver.contradiction(t.guard());
        } catch (GuardSolver.TooComplexException ex) {
            out.report(DiagnosticCode.GUARD_TOO_COMPLEX, t.uid(), ex.getMessage());
            return false;
        }
    }

    private boolean provenTautology(Transition t, Diagnostics out) {
        try {
            return solver.tautology(t.guard());
        } catch (GuardSolver.TooComplexException ex) {
            out.report(DiagnosticCode.GUARD_TOO_COMPLEX, t.uid(), ex.getMessage());
            return false;
        }
    }

    private boolean provenDisjoint(Transition a, Transition b, Diagnostics out) {
        try {
            return solver.disjoint(a.guard(), b.guard());
        } catch (GuardSolver.TooComplexException ex) {
            out.report(DiagnosticCode.GUARD_TOO_COMPLEX, b.uid(), ex.getMessage());
            return false;
        }
    }

    // ---------------------------------------------------------------------
    // Type checking
    // ---------------------------------------------------------------------

    private void checkTypes(Diagnostics out) {
        for (Transition t : machine.transitions()) {
            checkGuardTypes(t.guard(), t.uid(), out);
            checkActionTypes(t.actions(), t.uid(), out);
        }
        for (Vertex v : machine.vertices()) {
            checkActionTypes(v.entryActions(), v.uid(), out);
            checkActionTypes(v.exitActions(), v.uid(), out);
        }
    }

    private void checkGuardTypes(Guard guard, String subject, Diagnostics out) {
        if (guard instanceof Guard.Not n) {
            checkGuardTypes(n.operand(), subject, out);
        } else if (guard instanceof Guard.And a) {
            checkGuardTypes(a.left(), subject, out);
            checkGuardTypes(a.right(), subject, out);
        } else if (guard instanceof Guard.Or o) {
            checkGuardTypes(o.left(), subject, out);
            checkGuardTypes(o.right(), subject, out);
        } else if (guard instanceof Guard.Compare c) {
            checkComparison(c, subject, out);
        }
    }

    private void checkComparison(Guard.Compare c, String subject, Diagnostics out) {
        FieldType type = c.field().type();
        Literal literal = c.literal();

        if (type instanceof FieldType.Bool && !(literal instanceof Literal.BoolLiteral)) {
            out.report(DiagnosticCode.TYPE_MISMATCH, subject,
                    "Boolean field " + c.field() + " compared with " + literal);
            return;
        }
        if (type instanceof FieldType.IntRange && !(literal instanceof Literal.IntLiteral)) {
            out.report(DiagnosticCode.TYPE_MISMATCH, subject,
                    "Integer field " + c.field() + " compared with " + literal);
            return;
        }
        if (type instanceof FieldType.Enumeration en) {
            if (!(literal instanceof Literal.EnumLiteral el)) {
                out.report(DiagnosticCode.TYPE_MISMATCH, subject,
                        "Enumeration field " + c.field() + " compared with " + literal);
                return;
            }
            if (!el.resolved()) {
                out.report(DiagnosticCode.TYPE_MISMATCH, subject,
                        "Unknown variant '" + el.variant() + "' of " + en);
                return;
            }
        }
        if (!type.ordered() && !c.op().isEquality()) {
            out.report(DiagnosticCode.TYPE_MISMATCH, subject,
                    "Ordering operator " + c.op().symbol() + " applied to unordered field " + c.field());
        }
    }

    private void checkActionTypes(List<Action> actions, String subject, Diagnostics out) {
        for (Action a : actions) {
            if (a instanceof Action.Raise r) {
                EventDecl e = machine.event(r.eventIndex());
                if (r.args().size() != e.width()) {
                    out.report(DiagnosticCode.TYPE_MISMATCH, subject,
                            "raise " + e.name() + " passes " + r.args().size() + " argument(s); "
                                    + e.width() + " expected");
                }
            }
        }
    }
}
