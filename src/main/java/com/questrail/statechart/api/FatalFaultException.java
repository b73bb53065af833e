package com.questrail.statechart.api;

import java.util.Objects;

/**
 * Thrown when an instance hits a fatal fault. The instance is halted and
 * rejects further processing.
 */
public final class FatalFaultException extends RuntimeException
{
    private final Fault fault;

    public FatalFaultException(Fault fault) {
        super(Objects.requireNonNull(fault, "fault").toString());
        this.fault = fault;
    }

    public FatalFaultException(Fault fault, Throwable cause) {
        super(Objects.requireNonNull(fault, "fault").toString(), cause);
        this.fault = fault;
    }

    public Fault fault() {
        return fault;
    }
}
