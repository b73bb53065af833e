package com.questrail.statechart.simulation;

import com.questrail.statechart.api.Fault;
import com.questrail.statechart.observability.TraceRecord;
import com.questrail.statechart.observability.TraceSink;

import java.util.ArrayList;
import java.util.List;

/**
 * Trace sink that keeps every record and fault in memory, in arrival order.
 */
public final class CollectingTraceSink implements TraceSink
{
    private final List<TraceRecord> records = new ArrayList<>();
    private final List<Fault> faults = new ArrayList<>();

    @Override
    public synchronized void onStep(TraceRecord record) {
        records.add(record);
    }

    @Override
    public synchronized void onFault(String machine, Fault fault) {
        faults.add(fault);
    }

    public synchronized List<TraceRecord> records() {
        return List.copyOf(records);
    }

    public synchronized List<Fault> faults() {
        return List.copyOf(faults);
    }

    public synchronized void clear() {
        records.clear();
        faults.clear();
    }
}
