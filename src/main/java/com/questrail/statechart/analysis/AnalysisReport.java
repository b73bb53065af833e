package com.questrail.statechart.analysis;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Outcome of compiling one machine.
 *
 * @param machineName name of the analyzed machine
 * @param diagnostics every finding, in the order the passes reported them
 * @param validated   the accepted machine; present only when no diagnostic is an error
 */
public record AnalysisReport(String machineName,
                             List<Diagnostic> diagnostics,
                             Optional<ValidatedMachine> validated)
{
    public AnalysisReport {
        Objects.requireNonNull(machineName, "machineName");
        diagnostics = List.copyOf(diagnostics);
        Objects.requireNonNull(validated, "validated");
    }

    public boolean accepted() {
        return validated.isPresent();
    }

    public List<Diagnostic> errors() {
        return diagnostics.stream().filter(Diagnostic::isError).toList();
    }

    public List<Diagnostic> warnings() {
        return diagnostics.stream().filter(d -> d.severity() == Severity.WARNING).toList();
    }

    public boolean has(DiagnosticCode code) {
        return diagnostics.stream().anyMatch(d -> d.code() == code);
    }

    public List<Diagnostic> withCode(DiagnosticCode code) {
        return diagnostics.stream().filter(d -> d.code() == code).toList();
    }

    /**
     * Returns the validated machine.
     *
     * @throws IllegalStateException if the machine was rejected
     */
    public ValidatedMachine orThrow() {
        return validated.orElseThrow(() -> new IllegalStateException(
                "Machine " + machineName + " rejected:\n" + errors().stream()
                        .map(Diagnostic::toString)
                        .collect(Collectors.joining("\n"))));
    }
}
