package com.questrail.statechart.runtime;

/**
 * Host implementation of an extern action. Runs on the instance's thread and
 * may read the payload and write the context.
 */
@FunctionalInterface
public interface ActionProcedure
{
    void run(Context context, Payload payload);
}
