package com.questrail.statechart.analysis;

import com.questrail.statechart.model.Machine;
import com.questrail.statechart.model.Region;
import com.questrail.statechart.model.Transition;
import com.questrail.statechart.model.TransitionKind;
import com.questrail.statechart.model.Vertex;
import com.questrail.statechart.model.VertexKind;

import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * HierarchyResolver
 * =============================================================================
 * Ancestor chains, depths and least common ancestors over the containment tree
 * of a {@link Machine}.
 *
 * <h2>Role in the architecture</h2>
 * The resolver is shared by the compile-time passes and by the dispatch
 * engine. Both therefore compute exit and entry sets from the same chains,
 * which is what keeps the analyzer's view of a transition identical to what
 * the engine executes.
 *
 * <h2>Caching</h2>
 * All chains are computed once, eagerly, when the resolver is constructed.
 * Queries are array lookups and never allocate except where a copy is returned
 * to a caller.
 *
 * <h2>Conventions</h2>
 * <ul>
 *   <li>{@link #ancestors(int)} runs from the root down to the parent state of
 *       the vertex; the vertex itself is excluded.</li>
 *   <li>{@link #depth(int)} of the root is 0; top-level states have depth 1.</li>
 *   <li>{@link #lca(int, int)} is the deepest common <em>proper</em> ancestor,
 *       so {@code lca(a, a)} is the parent of {@code a}.</li>
 * </ul>
 */
public final class HierarchyResolver
{
    private final Machine machine;
    private final int[] parent;
    private final int[][] ancestors;

    /**
     * @throws HierarchyException if a vertex refers to a missing region or the
     *                            containment relation is cyclic
     */
    public HierarchyResolver(Machine machine) {
        this.machine = Objects.requireNonNull(machine, "machine");

        int n = machine.vertices().size();
        this.parent = new int[n];
        for (Vertex v : machine.vertices()) {
            if (v.isRoot()) {
                if (v.index() != Machine.ROOT) {
                    throw new HierarchyException("Vertex " + v.uid() + " has no containing region");
                }
                parent[v.index()] = -1;
                continue;
            }
            if (v.parentRegion() >= machine.regions().size()) {
                throw new HierarchyException("Vertex " + v.uid() + " refers to unknown region " + v.parentRegion());
            }
            parent[v.index()] = machine.region(v.parentRegion()).owner();
        }

        this.ancestors = new int[n][];
        for (int v = 0; v < n; v++) {
            ancestors[v] = chainOf(v, n);
        }
    }

    private int[] chainOf(int v, int limit) {
        int[] reversed = new int[limit];
        int count = 0;
        int p = parent[v];
        while (p >= 0) {
            if (count == limit) {
                throw new HierarchyException("Containment cycle through " + machine.vertex(v).uid());
            }
            reversed[count++] = p;
            p = parent[p];
        }
        if (count > 0 && reversed[count - 1] != Machine.ROOT) {
            throw new HierarchyException("Vertex " + machine.vertex(v).uid() + " is not contained in the machine root");
        }
        int[] chain = new int[count];
        for (int i = 0; i < count; i++) {
            chain[i] = reversed[count - 1 - i];
        }
        return chain;
    }

    public Machine machine() {
        return machine;
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /** Parent state of the vertex, or {@code -1} for the root. */
    public int parent(int vertex) {
        return parent[vertex];
    }

    /** Chain from the root down to the parent state; excludes the vertex. */
    public int[] ancestors(int vertex) {
        return ancestors[vertex].clone();
    }

    /** Chain from the root down to and including the vertex. */
    public int[] path(int vertex) {
        int[] a = ancestors[vertex];
        int[] p = Arrays.copyOf(a, a.length + 1);
        p[a.length] = vertex;
        return p;
    }

    /** The ancestor of {@code vertex} at the given depth (0 is the root); no copy is made. */
    public int ancestor(int vertex, int depth) {
        return ancestors[vertex][depth];
    }

    public int depth(int vertex) {
        return ancestors[vertex].length;
    }

    /** Whether {@code ancestor} is a proper ancestor of {@code vertex}. */
    public boolean isAncestor(int ancestor, int vertex) {
        int[] chain = ancestors[vertex];
        int d = depth(ancestor);
        return d < chain.length && chain[d] == ancestor;
    }

    public boolean isAncestorOrSelf(int ancestor, int vertex) {
        return ancestor == vertex || isAncestor(ancestor, vertex);
    }

    /**
     * Deepest common proper ancestor of two vertices.
     *
     * @throws HierarchyException if the vertices share no ancestor (one of them
     *                            is the root)
     */
    public int lca(int a, int b) {
        int[] ca = ancestors[a];
        int[] cb = ancestors[b];
        int len = Math.min(ca.length, cb.length);
        int common = -1;
        for (int i = 0; i < len && ca[i] == cb[i]; i++) {
            common = ca[i];
        }
        if (common < 0) {
            throw new HierarchyException("No common ancestor for "
                    + machine.vertex(a).uid() + " and " + machine.vertex(b).uid());
        }
        return common;
    }

    /**
     * The state whose region contents a transition exits and re-enters.
     * Returns {@code -1} for targetless transitions.
     *
     * <ul>
     *   <li>external, completion and timed: {@code lca(source, target)}</li>
     *   <li>local with the target nested in the source: the source itself</li>
     *   <li>local with the source nested in the target: the target itself</li>
     * </ul>
     */
    public int scope(Transition t) {
        if (!t.hasTarget()) {
            return -1;
        }
        int s = t.source();
        int g = t.target();
        if (t.kind() == TransitionKind.LOCAL) {
            if (isAncestor(s, g)) {
                return s;
            }
            if (isAncestor(g, s)) {
                return g;
            }
        }
        return lca(s, g);
    }

    /**
     * Region of {@code ancestor} that contains {@code vertex}, or {@code -1}
     * if {@code ancestor} is not a proper ancestor.
     */
    public int regionContaining(int ancestor, int vertex) {
        int child = childTowards(ancestor, vertex);
        return child < 0 ? -1 : machine.vertex(child).parentRegion();
    }

    /**
     * Direct child of {@code ancestor} on the path to {@code vertex} (possibly
     * the vertex itself), or {@code -1} if {@code ancestor} is not a proper
     * ancestor.
     */
    public int childTowards(int ancestor, int vertex) {
        if (!isAncestor(ancestor, vertex)) {
            return -1;
        }
        int d = depth(ancestor);
        int[] chain = ancestors[vertex];
        return d + 1 < chain.length ? chain[d + 1] : vertex;
    }

    // ---------------------------------------------------------------------
    // Well-formedness
    // ---------------------------------------------------------------------

    /**
     * Reports containment faults that do not make the hierarchy undefined:
     * duplicate names, initial pseudostate counts, parallel region counts,
     * nesting depth and transitions between orthogonal regions.
     */
    public void checkWellFormedness(Diagnostics out) {
        Objects.requireNonNull(out, "out");

        for (Region region : machine.regions()) {
            Map<String, Integer> seen = new HashMap<>();
            for (int m : region.members()) {
                Vertex v = machine.vertex(m);
                if (v.kind() == VertexKind.INITIAL) {
                    continue;
                }
                Integer prev = seen.putIfAbsent(v.name(), m);
                if (prev != null) {
                    out.report(DiagnosticCode.DUPLICATE_NAME, v.uid(),
                            "Name '" + v.name() + "' is already used in " + region.uid());
                }
            }
            int initials = region.initials().length;
            if (initials == 0) {
                out.report(DiagnosticCode.MISSING_INITIAL, region.uid(), "Region has no initial pseudostate");
            } else if (initials > 1) {
                out.report(DiagnosticCode.MULTIPLE_INITIAL, region.uid(),
                        "Region has " + initials + " initial pseudostates");
            }
        }

        int maxDepth = machine.config().maxNestingDepth();
        for (Vertex v : machine.vertices()) {
            if (v.regionCount() > 1) {
                Map<String, Integer> names = new HashMap<>();
                for (int r : v.regions()) {
                    if (names.putIfAbsent(machine.region(r).name(), r) != null) {
                        out.report(DiagnosticCode.DUPLICATE_NAME, machine.region(r).uid(),
                                "Region name '" + machine.region(r).name() + "' is already used in " + v.uid());
                    }
                }
            }
            if (v.kind() == VertexKind.PARALLEL && v.regionCount() < 2) {
                out.report(DiagnosticCode.PARALLEL_TOO_FEW_REGIONS, v.uid(),
                        "Parallel state owns " + v.regionCount() + " region(s); at least 2 are required");
            }
            if (v.isState() && depth(v.index()) > maxDepth) {
                out.report(DiagnosticCode.NESTING_TOO_DEEP, v.uid(),
                        "Nesting depth " + depth(v.index()) + " exceeds the configured maximum of " + maxDepth);
            }
        }

        for (Transition t : machine.transitions()) {
            checkRegionCrossing(t, out);
        }
    }

    private void checkRegionCrossing(Transition t, Diagnostics out) {
        if (!t.hasTarget()) {
            return;
        }
        VertexKind sourceKind = machine.vertex(t.source()).kind();
        VertexKind targetKind = machine.vertex(t.target()).kind();
        // fork and join edges are validated by the structural checker
        if (sourceKind == VertexKind.FORK || targetKind == VertexKind.JOIN) {
            return;
        }
        if (t.source() == Machine.ROOT || t.target() == Machine.ROOT) {
            out.report(DiagnosticCode.ILLEGAL_TRANSITION, t.uid(), "The machine root cannot be a transition endpoint");
            return;
        }
        int l = lca(t.source(), t.target());
        if (regionContaining(l, t.source()) != regionContaining(l, t.target())) {
            out.report(DiagnosticCode.REGION_CROSSING, t.uid(),
                    "Transition from " + machine.vertex(t.source()).uid() + " to " + machine.vertex(t.target()).uid()
                            + " crosses orthogonal regions of " + machine.vertex(l).uid() + " without a fork or join");
        }
    }
}
