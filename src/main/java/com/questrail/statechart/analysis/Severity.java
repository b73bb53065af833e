package com.questrail.statechart.analysis;

/**
 * Severity of a compile-time {@link Diagnostic}. Any {@link #ERROR} rejects
 * the machine.
 */
public enum Severity
{
    ERROR,
    WARNING,
    INFO
}
