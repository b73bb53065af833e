package com.questrail.statechart.analysis;

import com.questrail.statechart.model.Action;
import com.questrail.statechart.model.Machine;
import com.questrail.statechart.model.Region;
import com.questrail.statechart.model.Transition;
import com.questrail.statechart.model.TransitionKind;
import com.questrail.statechart.model.ValueExpr;
import com.questrail.statechart.model.Vertex;
import com.questrail.statechart.model.VertexKind;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * StructuralChecker
 * -----------------------------------------------------------------------------
 * Graph-level checks that do not depend on guard semantics.
 *
 * <h2>Checks</h2>
 * <ul>
 *   <li><b>Transition shape</b>: triggers, targets and delays appropriate to
 *       the transition kind and to the kind of the source pseudostate; inline
 *       assignment only where the target configuration enables it.</li>
 *   <li><b>Fork / join</b>: a fork enters two or more region-top-level states
 *       of distinct regions of one parallel state; a join collects one source
 *       from every region of one parallel state; a fork and a join on the same
 *       parallel state cover the same regions.</li>
 *   <li><b>Reachability</b>: every state is entered by some path from the
 *       initial configuration, expanding composite and parallel entry.</li>
 *   <li><b>Deferral cycles</b>: for each event, the greatest set of reachable
 *       states that defer it without consuming it, closed under every
 *       successor, must be empty. A state in such a set would hold the event
 *       forever.</li>
 * </ul>
 */
public final class StructuralChecker
{
    private final Machine machine;
    private final HierarchyResolver hierarchy;
    private final TransitionTable table;

    public StructuralChecker(Machine machine, HierarchyResolver hierarchy, TransitionTable table) {
        this.machine = Objects.requireNonNull(machine, "machine");
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
        this.table = Objects.requireNonNull(table, "table");
    }

    public void check(Diagnostics out) {
        Objects.requireNonNull(out, "out");
        checkTransitionShapes(out);
        checkForksAndJoins(out);
        boolean[] reached = checkReachability(out);
        checkDeferralCycles(reached, out);
    }

    // ---------------------------------------------------------------------
    // Transition shape
    // ---------------------------------------------------------------------

    private void checkTransitionShapes(Diagnostics out) {
        boolean arithmetic = machine.config().inlineArithmetic();

        for (Transition t : machine.transitions()) {
            Vertex source = machine.vertex(t.source());
            TransitionKind kind = t.kind();

            if (t.hasTarget() && machine.vertex(t.target()).kind() == VertexKind.INITIAL) {
                illegal(t, "An initial pseudostate cannot be a transition target", out);
            }
            if (kind == TransitionKind.INTERNAL && t.hasTarget()) {
                illegal(t, "Internal transitions have no target", out);
            }
            if ((kind == TransitionKind.COMPLETION || kind.isTimed()) && t.hasTrigger()) {
                illegal(t, kind + " transitions carry no event trigger", out);
            }
            if (kind.isTimed() && t.delayMillis() <= 0) {
                out.report(DiagnosticCode.INVALID_TIMER, t.uid(), "Timer delay must be positive, was " + t.delayMillis());
            }
            if (kind == TransitionKind.LOCAL
                    && !hierarchy.isAncestor(t.source(), t.target())
                    && !hierarchy.isAncestor(t.target(), t.source())) {
                illegal(t, "Local transition target must be nested in the source or contain it", out);
            }

            if (source.isState()) {
                if ((kind == TransitionKind.EXTERNAL || kind == TransitionKind.LOCAL || kind == TransitionKind.INTERNAL)
                        && !t.hasTrigger()) {
                    illegal(t, "Transition from state " + source.uid() + " has no trigger; use a completion transition", out);
                }
            } else {
                checkPseudostateEdge(source, t, out);
            }

            if (!arithmetic) {
                checkArithmetic(t.actions(), t.uid(), out);
            }
        }

        for (Vertex v : machine.vertices()) {
            if (!arithmetic) {
                checkArithmetic(v.entryActions(), v.uid(), out);
                checkArithmetic(v.exitActions(), v.uid(), out);
            }
            int n = v.outgoingCount();
            switch (v.kind()) {
                case INITIAL:
                    if (n != 1) {
                        out.report(DiagnosticCode.ILLEGAL_TRANSITION, v.uid(),
                                "Initial pseudostate must have exactly one outgoing transition, has " + n);
                    }
                    break;
                case FINAL:
                    if (n != 0) {
                        out.report(DiagnosticCode.ILLEGAL_TRANSITION, v.uid(), "Final states have no outgoing transitions");
                    }
                    break;
                case HISTORY_SHALLOW:
                case HISTORY_DEEP:
                    if (n > 1) {
                        out.report(DiagnosticCode.ILLEGAL_TRANSITION, v.uid(),
                                "History pseudostate has at most one default transition, has " + n);
                    }
                    break;
                case CHOICE:
                case JUNCTION:
                case ENTRY_POINT:
                case EXIT_POINT:
                case JOIN:
                    if (n == 0) {
                        out.report(DiagnosticCode.ILLEGAL_TRANSITION, v.uid(), v.kind() + " has no outgoing transition");
                    }
                    break;
                default:
                    break;
            }
        }
    }

    private void checkPseudostateEdge(Vertex source, Transition t, Diagnostics out) {
        if (t.kind() != TransitionKind.EXTERNAL) {
            illegal(t, "Transitions leaving a pseudostate must be plain external transitions", out);
            return;
        }
        if (t.hasTrigger()) {
            illegal(t, "Transitions leaving a pseudostate carry no trigger", out);
        }
        if (!t.hasTarget()) {
            illegal(t, "Transitions leaving a pseudostate need a target", out);
            return;
        }
        if (source.kind() == VertexKind.INITIAL || source.kind().isHistory()) {
            if (!t.guard().isTrivial()) {
                illegal(t, "Default transitions carry no guard", out);
            }
            int owner = machine.region(source.parentRegion()).owner();
            if (!hierarchy.isAncestor(owner, t.target())) {
                illegal(t, "Default transition of " + source.uid() + " must stay inside "
                        + machine.vertex(owner).uid(), out);
            }
        }
    }

    private void checkArithmetic(List<Action> actions, String subject, Diagnostics out) {
        for (Action a : actions) {
            boolean uses = false;
            if (a instanceof Action.Assign) {
                uses = true;
            } else if (a instanceof Action.Raise r) {
                uses = r.args().stream().anyMatch(ValueExpr::isArithmetic);
            } else if (a instanceof Action.Send s) {
                uses = s.args().stream().anyMatch(ValueExpr::isArithmetic);
            }
            if (uses) {
                out.report(DiagnosticCode.INLINE_ARITHMETIC_DISABLED, subject,
                        "'" + a.describe() + "' needs inline arithmetic, which the target configuration disables");
            }
        }
    }

    private static void illegal(Transition t, String message, Diagnostics out) {
        out.report(DiagnosticCode.ILLEGAL_TRANSITION, t.uid(), message);
    }

    // ---------------------------------------------------------------------
    // Fork / join
    // ---------------------------------------------------------------------

    private void checkForksAndJoins(Diagnostics out) {
        List<Coverage> forks = new ArrayList<>();
        List<Coverage> joins = new ArrayList<>();

        for (Vertex v : machine.vertices()) {
            if (v.kind() == VertexKind.FORK) {
                checkFork(v, forks, out);
            } else if (v.kind() == VertexKind.JOIN) {
                checkJoin(v, joins, out);
            }
        }

        for (Coverage f : forks) {
            for (Coverage j : joins) {
                if (f.parallel() == j.parallel() && !f.regions().equals(j.regions())) {
                    out.report(DiagnosticCode.FORK_JOIN_REGION_MISMATCH, f.pseudostate(),
                            "Fork covers regions " + regionNames(f.regions())
                                    + " of " + machine.vertex(f.parallel()).uid()
                                    + " but join " + j.pseudostate() + " covers " + regionNames(j.regions()));
                }
            }
        }
    }

    /** Regions of one parallel state touched by a fork or join. */
    private record Coverage(String pseudostate, int parallel, BitSet regions) {}

    private void checkFork(Vertex fork, List<Coverage> forks, Diagnostics out) {
        int[] outgoing = fork.outgoing();
        if (outgoing.length < 2) {
            out.report(DiagnosticCode.FORK_MISMATCH, fork.uid(), "Fork needs at least two targets, has " + outgoing.length);
            return;
        }
        int parallel = -1;
        BitSet covered = new BitSet();
        for (int t : outgoing) {
            Transition tr = machine.transition(t);
            if (!tr.hasTarget()) {
                return;
            }
            Vertex target = machine.vertex(tr.target());
            if (!target.isState()) {
                out.report(DiagnosticCode.FORK_MISMATCH, tr.uid(), "Fork target " + target.uid() + " is not a state");
                return;
            }
            if (!tr.guard().isTrivial()) {
                out.report(DiagnosticCode.FORK_MISMATCH, tr.uid(), "Fork branches carry no guard");
            }
            int owner = machine.region(target.parentRegion()).owner();
            if (parallel < 0) {
                parallel = owner;
            }
            if (owner != parallel || machine.vertex(owner).kind() != VertexKind.PARALLEL) {
                out.report(DiagnosticCode.FORK_MISMATCH, fork.uid(),
                        "Fork targets must be top-level states of the regions of one parallel state");
                return;
            }
            if (covered.get(target.parentRegion())) {
                out.report(DiagnosticCode.FORK_MISMATCH, tr.uid(),
                        "Fork enters region " + machine.region(target.parentRegion()).uid() + " twice");
                return;
            }
            covered.set(target.parentRegion());
        }
        forks.add(new Coverage(fork.uid(), parallel, covered));
    }

    private void checkJoin(Vertex join, List<Coverage> joins, Diagnostics out) {
        int[] incoming = join.incoming();
        if (incoming.length < 2) {
            out.report(DiagnosticCode.JOIN_MISMATCH, join.uid(), "Join needs at least two sources, has " + incoming.length);
            return;
        }
        int parallel = machine.transition(incoming[0]).source();
        for (int t : incoming) {
            Transition tr = machine.transition(t);
            if (!machine.vertex(tr.source()).isState()) {
                out.report(DiagnosticCode.JOIN_MISMATCH, tr.uid(), "Join sources must be states");
                return;
            }
            int src = tr.source();
            if (hierarchy.isAncestorOrSelf(src, parallel)) {
                parallel = src;
            } else if (!hierarchy.isAncestorOrSelf(parallel, src)) {
                parallel = hierarchy.lca(parallel, src);
            }
        }
        if (machine.vertex(parallel).kind() != VertexKind.PARALLEL) {
            out.report(DiagnosticCode.JOIN_MISMATCH, join.uid(), "Join sources do not lie in regions of one parallel state");
            return;
        }
        BitSet covered = new BitSet();
        for (int t : incoming) {
            int region = hierarchy.regionContaining(parallel, machine.transition(t).source());
            if (covered.get(region)) {
                out.report(DiagnosticCode.JOIN_MISMATCH, join.uid(),
                        "Join has more than one source in region " + machine.region(region).uid());
                return;
            }
            covered.set(region);
        }
        Vertex p = machine.vertex(parallel);
        if (covered.cardinality() != p.regionCount()) {
            out.report(DiagnosticCode.JOIN_MISMATCH, join.uid(),
                    "Join sources cover " + covered.cardinality() + " of " + p.regionCount() + " regions of " + p.uid());
            return;
        }
        joins.add(new Coverage(join.uid(), parallel, covered));
    }

    private String regionNames(BitSet regions) {
        TreeSet<String> names = new TreeSet<>();
        regions.stream().forEach(r -> names.add(machine.region(r).name()));
        return names.toString();
    }

    // ---------------------------------------------------------------------
    // Reachability
    // ---------------------------------------------------------------------

    private boolean[] checkReachability(Diagnostics out) {
        Reach reach = new Reach();
        reach.activate(Machine.ROOT);
        reach.drain();

        for (Vertex v : machine.vertices()) {
            if (v.isState() && !v.isRoot() && !reach.reached[v.index()]) {
                out.report(DiagnosticCode.UNREACHABLE_STATE, v.uid(), "State is never entered");
            }
        }
        return reach.reached;
    }

    /** Breadth-first exploration of the transition graph with region expansion. */
    private final class Reach
    {
        final boolean[] reached = new boolean[machine.vertices().size()];
        final boolean[] pseudoVisited = new boolean[machine.vertices().size()];
        final boolean[] regionEntered = new boolean[machine.regions().size()];
        final Deque<Integer> work = new ArrayDeque<>();

        void drain() {
            while (!work.isEmpty()) {
                int s = work.poll();
                Vertex v = machine.vertex(s);
                for (int i = 0; i < v.outgoingCount(); i++) {
                    follow(machine.transition(v.outgoing(i)));
                }
            }
        }

        void follow(Transition t) {
            if (t.hasTarget()) {
                enter(t.target());
            }
        }

        void enter(int vertex) {
            Vertex v = machine.vertex(vertex);
            if (v.isState()) {
                activate(vertex);
                return;
            }
            if (pseudoVisited[vertex]) {
                return;
            }
            pseudoVisited[vertex] = true;
            activate(machine.region(v.parentRegion()).owner());
            if (v.kind().isHistory()) {
                enterRegion(v.parentRegion());
            }
            for (int i = 0; i < v.outgoingCount(); i++) {
                follow(machine.transition(v.outgoing(i)));
            }
        }

        /** Marks the state and its ancestors active, expanding every region entered by default. */
        void activate(int state) {
            int[] path = hierarchy.path(state);
            for (int i = 0; i < path.length; i++) {
                int s = path[i];
                if (!reached[s]) {
                    reached[s] = true;
                    work.add(s);
                }
                Vertex sv = machine.vertex(s);
                int onPath = i + 1 < path.length ? machine.vertex(path[i + 1]).parentRegion() : -1;
                for (int r = 0; r < sv.regionCount(); r++) {
                    int region = sv.region(r);
                    if (region != onPath && (onPath < 0 || sv.kind() == VertexKind.PARALLEL)) {
                        enterRegion(region);
                    }
                }
            }
        }

        void enterRegion(int region) {
            if (regionEntered[region]) {
                return;
            }
            regionEntered[region] = true;
            Region r = machine.region(region);
            for (int init : r.initials()) {
                enter(init);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Deferral cycles
    // ---------------------------------------------------------------------

    private void checkDeferralCycles(boolean[] reached, Diagnostics out) {
        int n = machine.vertices().size();
        List<BitSet> successors = successorSets();

        for (int e = 0; e < machine.events().size(); e++) {
            BitSet holding = new BitSet(n);
            for (Vertex v : machine.vertices()) {
                int s = v.index();
                if (v.isState() && !v.isRoot() && reached[s] && defersEffectively(s, e)
                        && table.candidates(s, e).length == 0) {
                    holding.set(s);
                }
            }

            boolean changed = true;
            while (changed) {
                changed = false;
                for (int s = holding.nextSetBit(0); s >= 0; s = holding.nextSetBit(s + 1)) {
                    BitSet escape = (BitSet) successors.get(s).clone();
                    escape.andNot(holding);
                    if (!escape.isEmpty()) {
                        holding.clear(s);
                        changed = true;
                    }
                }
            }

            if (!holding.isEmpty()) {
                List<String> uids = new ArrayList<>();
                holding.stream().forEach(s -> uids.add(machine.vertex(s).uid()));
                out.report(DiagnosticCode.DEFERRAL_CYCLE, uids.get(0),
                        "Event " + machine.event(e).name() + " is deferred forever in " + uids);
            }
        }
    }

    private boolean defersEffectively(int state, int event) {
        if (machine.vertex(state).defers(event)) {
            return true;
        }
        for (int a : hierarchy.ancestors(state)) {
            if (machine.vertex(a).defers(event)) {
                return true;
            }
        }
        return false;
    }

    /**
     * For every state, the states that any transition leaving it, one of its
     * ancestors or one of its descendants can activate.
     */
    private List<BitSet> successorSets() {
        int n = machine.vertices().size();
        List<BitSet> targets = new ArrayList<>(machine.transitions().size());
        for (Transition t : machine.transitions()) {
            BitSet set = new BitSet(n);
            if (t.hasTarget()) {
                collectStates(t.target(), set, new BitSet(n));
            }
            targets.add(set);
        }

        List<BitSet> successors = new ArrayList<>(n);
        for (int s = 0; s < n; s++) {
            BitSet succ = new BitSet(n);
            if (machine.vertex(s).isState()) {
                for (Transition t : machine.transitions()) {
                    int src = t.source();
                    if (machine.vertex(src).isState()
                            && (src == s || hierarchy.isAncestor(src, s) || hierarchy.isAncestor(s, src))) {
                        succ.or(targets.get(t.index()));
                    }
                }
            }
            successors.add(succ);
        }
        return successors;
    }

    private void collectStates(int vertex, BitSet into, BitSet visited) {
        if (visited.get(vertex)) {
            return;
        }
        visited.set(vertex);
        Vertex v = machine.vertex(vertex);
        if (v.isState()) {
            into.set(vertex);
            return;
        }
        if (v.kind() == VertexKind.FINAL) {
            return;
        }
        if (v.kind().isHistory()) {
            into.set(machine.region(v.parentRegion()).owner());
        }
        for (int i = 0; i < v.outgoingCount(); i++) {
            Transition t = machine.transition(v.outgoing(i));
            if (t.hasTarget()) {
                collectStates(t.target(), into, visited);
            }
        }
    }
}
