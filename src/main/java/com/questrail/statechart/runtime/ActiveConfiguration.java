package com.questrail.statechart.runtime;

import com.questrail.statechart.model.Machine;
import com.questrail.statechart.model.Region;
import com.questrail.statechart.model.Vertex;
import com.questrail.statechart.model.VertexKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.BitSet;
import java.util.List;

/**
 * ActiveConfiguration
 * =============================================================================
 * Mutable runtime state of one instance apart from the context: which vertex
 * each region holds, recorded histories, join arrivals and pending
 * completions.
 *
 * <h2>Representation</h2>
 * <ul>
 *   <li>{@code cursor[region]}: the active state or final of the region, or
 *       {@code -1} when the region is inactive. A state is active iff it is
 *       the cursor of its parent region; the root is always active.</li>
 *   <li>shallow history: the direct child held when the owner last exited</li>
 *   <li>deep history: a snapshot of the cursors of the history's region and
 *       every region nested below it</li>
 *   <li>join arrivals: one bit per incoming transition of each join</li>
 *   <li>completion FIFO: at most one pending completion per state</li>
 * </ul>
 * Every array is sized from the machine when the instance is created.
 */
public final class ActiveConfiguration
{
    private final Machine machine;

    final int[] cursor;
    final int[] directive;

    final boolean[] historyRecorded;
    final int[] shallowHistory;
    final int[][] deepRegions;
    final int[][] deepHistory;

    final BitSet[] arrivals;

    private final int[] completionRing;
    private final boolean[] completionPending;
    private int completionHead;
    private int completionSize;

    ActiveConfiguration(Machine machine) {
        this.machine = machine;
        int regions = machine.regions().size();
        int vertices = machine.vertices().size();

        this.cursor = new int[regions];
        this.directive = new int[regions];
        Arrays.fill(cursor, -1);
        Arrays.fill(directive, -1);

        this.historyRecorded = new boolean[vertices];
        this.shallowHistory = new int[vertices];
        this.deepRegions = new int[vertices][];
        this.deepHistory = new int[vertices][];
        this.arrivals = new BitSet[vertices];
        Arrays.fill(shallowHistory, -1);

        for (Vertex v : machine.vertices()) {
            if (v.kind() == VertexKind.HISTORY_DEEP) {
                List<Integer> below = new ArrayList<>();
                collectRegions(v.parentRegion(), below);
                deepRegions[v.index()] = below.stream().mapToInt(Integer::intValue).toArray();
                deepHistory[v.index()] = new int[below.size()];
                Arrays.fill(deepHistory[v.index()], -1);
            } else if (v.kind() == VertexKind.JOIN) {
                arrivals[v.index()] = new BitSet(v.incoming().length);
            }
        }

        this.completionRing = new int[vertices];
        this.completionPending = new boolean[vertices];
    }

    private void collectRegions(int region, List<Integer> out) {
        out.add(region);
        for (int m : machine.region(region).members()) {
            Vertex member = machine.vertex(m);
            for (int r : member.regions()) {
                collectRegions(r, out);
            }
        }
    }

    // ---------------------------------------------------------------------
    // Queries
    // ---------------------------------------------------------------------

    /** Cursor of the region, or {@code -1}. */
    public int activeChild(int region) {
        return cursor[region];
    }

    public boolean isActive(int vertex) {
        Vertex v = machine.vertex(vertex);
        return v.isRoot() || cursor[v.parentRegion()] == vertex;
    }

    /** Whether the region's cursor is a final pseudostate. */
    public boolean isFinal(int region) {
        int c = cursor[region];
        return c >= 0 && machine.vertex(c).kind() == VertexKind.FINAL;
    }

    /** Whether every region of the state holds a final. */
    public boolean allRegionsFinal(int state) {
        Vertex v = machine.vertex(state);
        if (v.regionCount() == 0) {
            return false;
        }
        for (int r : v.regions()) {
            if (!isFinal(r)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Writes the active leaves (states without regions, and finals) into
     * {@code out} in depth-first order over lexicographically ordered regions,
     * which is lexicographic order of region path.
     *
     * @return the number of leaves written
     */
    public int leaves(int[] out) {
        return collectLeaves(Machine.ROOT, out, 0);
    }

    private int collectLeaves(int state, int[] out, int n) {
        Vertex v = machine.vertex(state);
        for (int i = 0; i < v.regionCount(); i++) {
            int c = cursor[v.region(i)];
            if (c < 0) {
                continue;
            }
            if (machine.vertex(c).regionCount() == 0) {
                out[n++] = c;
            } else {
                n = collectLeaves(c, out, n);
            }
        }
        return n;
    }

    /** Active states, outermost first within each region, excluding the root. */
    public int states(int[] out) {
        return collectStates(Machine.ROOT, out, 0);
    }

    private int collectStates(int state, int[] out, int n) {
        Vertex v = machine.vertex(state);
        for (int i = 0; i < v.regionCount(); i++) {
            int c = cursor[v.region(i)];
            if (c >= 0 && machine.vertex(c).isState()) {
                out[n++] = c;
                n = collectStates(c, out, n);
            }
        }
        return n;
    }

    // ---------------------------------------------------------------------
    // History
    // ---------------------------------------------------------------------

    /** Records the history pseudostate from the live cursors. */
    void recordHistory(int history) {
        Vertex h = machine.vertex(history);
        if (h.kind() == VertexKind.HISTORY_SHALLOW) {
            shallowHistory[history] = cursor[h.parentRegion()];
        } else {
            int[] regions = deepRegions[history];
            int[] snapshot = deepHistory[history];
            for (int i = 0; i < regions.length; i++) {
                snapshot[i] = cursor[regions[i]];
            }
        }
        historyRecorded[history] = true;
    }

    public boolean hasHistory(int history) {
        return historyRecorded[history];
    }

    /** Shallow history: the recorded direct child, or {@code -1}. */
    public int shallowHistory(int history) {
        return shallowHistory[history];
    }

    /** Deep history: the recorded cursor of {@code region}, or {@code -1}. */
    public int deepHistory(int history, int region) {
        int[] regions = deepRegions[history];
        for (int i = 0; i < regions.length; i++) {
            if (regions[i] == region) {
                return deepHistory[history][i];
            }
        }
        return -1;
    }

    /** Loads a deep snapshot into the entry directives of the regions below the history. */
    void restoreDirectives(int history) {
        int[] regions = deepRegions[history];
        int[] snapshot = deepHistory[history];
        for (int i = 0; i < regions.length; i++) {
            directive[regions[i]] = snapshot[i];
        }
    }

    // ---------------------------------------------------------------------
    // Completion FIFO
    // ---------------------------------------------------------------------

    /** Queues a completion of {@code state}; returns {@code false} if one is already pending. */
    boolean offerCompletion(int state) {
        if (completionPending[state]) {
            return false;
        }
        completionPending[state] = true;
        completionRing[(completionHead + completionSize) % completionRing.length] = state;
        completionSize++;
        return true;
    }

    /** Next pending completion, or {@code -1}. */
    int pollCompletion() {
        if (completionSize == 0) {
            return -1;
        }
        int state = completionRing[completionHead];
        completionHead = (completionHead + 1) % completionRing.length;
        completionSize--;
        completionPending[state] = false;
        return state;
    }

    void clearCompletions() {
        Arrays.fill(completionPending, false);
        completionHead = 0;
        completionSize = 0;
    }
}
