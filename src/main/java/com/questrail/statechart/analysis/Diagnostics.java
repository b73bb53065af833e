package com.questrail.statechart.analysis;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mutable collector threaded through the analysis passes. Passes keep going
 * after reporting so that one run surfaces as many faults as possible.
 */
public final class Diagnostics
{
    private final List<Diagnostic> items = new ArrayList<>();

    public void report(DiagnosticCode code, String subject, String message) {
        items.add(new Diagnostic(code.defaultSeverity(), code, subject, message));
    }

    public void report(Severity severity, DiagnosticCode code, String subject, String message) {
        items.add(new Diagnostic(severity, code, subject, message));
    }

    public boolean hasErrors() {
        for (Diagnostic d : items) {
            if (d.isError()) {
                return true;
            }
        }
        return false;
    }

    public int errorCount() {
        return (int) items.stream().filter(Diagnostic::isError).count();
    }

    public List<Diagnostic> all() {
        return Collections.unmodifiableList(items);
    }
}
