package com.questrail.statechart.observability;

import com.questrail.statechart.api.Fault;

/**
 * No-op sink. Instances using it skip building trace records entirely.
 */
public final class NullTraceSink implements TraceSink
{
    public static final NullTraceSink INSTANCE = new NullTraceSink();

    private NullTraceSink() {}

    @Override
    public void onStep(TraceRecord record) {}

    @Override
    public void onFault(String machine, Fault fault) {}
}
