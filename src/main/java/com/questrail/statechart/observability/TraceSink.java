package com.questrail.statechart.observability;

import com.questrail.statechart.api.Fault;

/**
 * Receives trace records and faults from a running instance.
 * Implementations can provide logging, recording or forwarding to tooling.
 */
public interface TraceSink
{
    /**
     * Called after every completed run-to-completion step.
     * @param record the step, keyed by stable uids
     */
    void onStep(TraceRecord record);

    /**
     * Called for every runtime fault, fatal or not.
     * @param machine name of the machine that observed the fault
     * @param fault   the fault
     */
    void onFault(String machine, Fault fault);
}
