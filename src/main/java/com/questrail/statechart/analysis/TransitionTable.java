package com.questrail.statechart.analysis;

import com.questrail.statechart.model.Machine;
import com.questrail.statechart.model.Transition;
import com.questrail.statechart.model.TransitionKind;
import com.questrail.statechart.model.Vertex;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * TransitionTable
 * =============================================================================
 * Precomputed candidate lists shared by the determinism analyzer and the
 * dispatch engine.
 *
 * <h2>Layout</h2>
 * <ul>
 *   <li>{@code byEvent[vertex][event]}: the vertex's own transitions triggered
 *       by the event</li>
 *   <li>{@code completions[vertex]}: the vertex's completion transitions</li>
 *   <li>{@code branches[vertex]}: all outgoing transitions of a pseudostate</li>
 * </ul>
 * Every list is ordered by ascending priority number, then declaration order.
 * Returned arrays are the table's own storage and must not be modified.
 *
 * <h2>Hierarchical override</h2>
 * {@link #winner(int, int)} scans a leaf and then its ancestors, innermost
 * first, and stops at the first state that defines <em>any</em> transition on
 * the event, whether or not its guards hold. Outer transitions on that event
 * are never candidates below such a state.
 */
public final class TransitionTable
{
    private static final int[] NONE = new int[0];

    private final HierarchyResolver hierarchy;
    private final int[][][] byEvent;
    private final int[][] completions;
    private final int[][] branches;

    public TransitionTable(Machine machine, HierarchyResolver hierarchy) {
        Objects.requireNonNull(machine, "machine");
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");

        int vertices = machine.vertices().size();
        int events = machine.events().size();
        Comparator<Transition> order = Comparator
                .comparingInt(Transition::priority)
                .thenComparingInt(Transition::index);

        this.byEvent = new int[vertices][][];
        this.completions = new int[vertices][];
        this.branches = new int[vertices][];

        for (Vertex v : machine.vertices()) {
            List<List<Transition>> perEvent = new ArrayList<>(events);
            for (int e = 0; e < events; e++) {
                perEvent.add(new ArrayList<>());
            }
            List<Transition> completion = new ArrayList<>();
            List<Transition> all = new ArrayList<>();
            for (int t : v.outgoing()) {
                Transition tr = machine.transition(t);
                all.add(tr);
                if (tr.hasTrigger()) {
                    perEvent.get(tr.trigger()).add(tr);
                } else if (tr.kind() == TransitionKind.COMPLETION) {
                    completion.add(tr);
                }
            }

            int[][] row = new int[events][];
            for (int e = 0; e < events; e++) {
                row[e] = sorted(perEvent.get(e), order);
            }
            byEvent[v.index()] = row;
            completions[v.index()] = sorted(completion, order);
            branches[v.index()] = v.isState() ? NONE : sorted(all, order);
        }
    }

    private static int[] sorted(List<Transition> transitions, Comparator<Transition> order) {
        if (transitions.isEmpty()) {
            return NONE;
        }
        return transitions.stream().sorted(order).mapToInt(Transition::index).toArray();
    }

    /** Transitions of {@code vertex} itself triggered by {@code event}. */
    public int[] own(int vertex, int event) {
        return byEvent[vertex][event];
    }

    /**
     * Innermost state on the path from {@code leaf} to the root defining any
     * transition on {@code event}, or {@code -1}.
     */
    public int winner(int leaf, int event) {
        if (byEvent[leaf][event].length > 0) {
            return leaf;
        }
        for (int d = hierarchy.depth(leaf) - 1; d >= 0; d--) {
            int a = hierarchy.ancestor(leaf, d);
            if (byEvent[a][event].length > 0) {
                return a;
            }
        }
        return -1;
    }

    /** Candidate list for (leaf, event) after hierarchical override. */
    public int[] candidates(int leaf, int event) {
        int w = winner(leaf, event);
        return w < 0 ? NONE : byEvent[w][event];
    }

    public int[] completions(int state) {
        return completions[state];
    }

    /** Outgoing branches of a pseudostate; empty for states. */
    public int[] branches(int pseudostate) {
        return branches[pseudostate];
    }

    public HierarchyResolver hierarchy() {
        return hierarchy;
    }
}
