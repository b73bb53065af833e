package com.questrail.statechart.analysis;

import com.questrail.statechart.model.Machine;
import com.questrail.statechart.model.Region;
import com.questrail.statechart.model.Vertex;

import java.util.Objects;

/**
 * A {@link Machine} accepted by {@link StatechartCompiler}, bundled with the
 * hierarchy and candidate tables the analyzer proved it against. Instances can
 * only be obtained from a compile run without errors, so the dispatch engine
 * never sees an unvalidated model.
 */
public final class ValidatedMachine
{
    private final Machine machine;
    private final HierarchyResolver hierarchy;
    private final TransitionTable table;

    ValidatedMachine(Machine machine, HierarchyResolver hierarchy, TransitionTable table) {
        this.machine = Objects.requireNonNull(machine, "machine");
        this.hierarchy = Objects.requireNonNull(hierarchy, "hierarchy");
        this.table = Objects.requireNonNull(table, "table");
    }

    public Machine machine() {
        return machine;
    }

    public HierarchyResolver hierarchy() {
        return hierarchy;
    }

    public TransitionTable table() {
        return table;
    }

    public String name() {
        return machine.name();
    }

    /**
     * Indented outline of the region tree keyed by stable identifiers, for
     * trace tooling and debugging.
     */
    public String describe() {
        StringBuilder sb = new StringBuilder();
        describe(machine.root(), 0, sb);
        return sb.toString();
    }

    private void describe(Vertex v, int indent, StringBuilder sb) {
        sb.append("  ".repeat(indent)).append(v.kind()).append(' ').append(v.uid()).append('\n');
        for (int i = 0; i < v.regionCount(); i++) {
            Region r = machine.region(v.region(i));
            sb.append("  ".repeat(indent + 1)).append("region ").append(r.name()).append('\n');
            for (int m : r.members()) {
                describe(machine.vertex(m), indent + 2, sb);
            }
        }
    }

    @Override
    public String toString() {
        return "ValidatedMachine[" + machine.name() + "]";
    }
}
