package com.questrail.statechart.analysis;

import com.questrail.statechart.model.Machine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * StatechartCompiler
 * =============================================================================
 * Compile-time pipeline: hierarchy, well-formedness, determinism and
 * structure.
 *
 * <h2>Pass order</h2>
 * <ol>
 *   <li>{@link HierarchyResolver} construction. A {@link HierarchyException}
 *       here aborts the run; nothing downstream is meaningful without
 *       ancestor chains.</li>
 *   <li>Well-formedness of the containment tree.</li>
 *   <li>{@link DeterminismAnalyzer} over the shared {@link TransitionTable}.</li>
 *   <li>{@link StructuralChecker}.</li>
 * </ol>
 * Passes 2 to 4 always run to completion so that one run reports as many
 * faults as possible. The resulting {@link AnalysisReport} carries a
 * {@link ValidatedMachine} only if no error was reported.
 */
public final class StatechartCompiler
{
    private static final Logger log = LoggerFactory.getLogger(StatechartCompiler.class);

    /**
     * @throws HierarchyException if the containment tree is undefined
     */
    public AnalysisReport compile(Machine machine) {
        Objects.requireNonNull(machine, "machine");

        Diagnostics diagnostics = new Diagnostics();
        HierarchyResolver hierarchy = new HierarchyResolver(machine);
        hierarchy.checkWellFormedness(diagnostics);

        TransitionTable table = new TransitionTable(machine, hierarchy);
        new DeterminismAnalyzer(machine, table).analyze(diagnostics);
        new StructuralChecker(machine, hierarchy, table).check(diagnostics);

        for (Diagnostic d : diagnostics.all()) {
            if (d.isError()) {
                log.warn("{}: {}", machine.name(), d);
            } else {
                log.debug("{}: {}", machine.name(), d);
            }
        }

        Optional<ValidatedMachine> validated = diagnostics.hasErrors()
                ? Optional.empty()
                : Optional.of(new ValidatedMachine(machine, hierarchy, table));

        log.debug("Compiled {}: {} error(s), {} diagnostic(s) total, accepted={}",
                machine.name(), diagnostics.errorCount(), diagnostics.all().size(), validated.isPresent());

        return new AnalysisReport(machine.name(), diagnostics.all(), validated);
    }
}
