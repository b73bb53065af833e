package com.questrail.statechart.api;

import java.util.Objects;

/**
 * A runtime fault.
 *
 * @param kind    category
 * @param subject stable identifier of the machine element involved (state,
 *                transition or event), or the machine name
 * @param message human-readable detail
 */
public record Fault(FaultKind kind, String subject, String message)
{
    public Fault {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(subject, "subject");
        Objects.requireNonNull(message, "message");
    }

    public boolean fatal() {
        return kind.fatal();
    }

    @Override
    public String toString() {
        return kind + " [" + subject + "]: " + message;
    }
}
