package com.questrail.statechart.runtime;

/**
 * Host implementation of an extern guard. Must be side-effect free.
 */
@FunctionalInterface
public interface GuardFunction
{
    boolean test(Context context, Payload payload);
}
