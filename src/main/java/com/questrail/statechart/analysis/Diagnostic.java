package com.questrail.statechart.analysis;

import java.util.Objects;

/**
 * One compile-time finding.
 *
 * @param severity error, warning or info
 * @param code     typed fault code
 * @param subject  stable identifier of the vertex, region or transition concerned
 * @param message  human-readable detail
 */
public record Diagnostic(Severity severity, DiagnosticCode code, String subject, String message)
{
    public Diagnostic {
        Objects.requireNonNull(severity, "severity");
        Objects.requireNonNull(code, "code");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(message, "message");
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        return severity + " " + code + " [" + subject + "]: " + message;
    }
}
