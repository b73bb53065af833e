package com.questrail.statechart.analysis;

/**
 * Raised when the containment tree is malformed in a way that leaves ancestor
 * chains or least common ancestors undefined. Analysis cannot continue past
 * this fault.
 */
public final class HierarchyException extends RuntimeException
{
    public HierarchyException(String message) {
        super(message);
    }
}
