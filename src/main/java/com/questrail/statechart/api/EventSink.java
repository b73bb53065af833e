package com.questrail.statechart.api;

/**
 * Anything that accepts events into a bounded queue. Implementations must be
 * safe to call from any thread.
 */
public interface EventSink
{
    /**
     * Offers an event under the receiving queue's overflow policy.
     *
     * @throws FatalFaultException if the queue is full under the {@code ASSERT} policy
     * @throws IllegalArgumentException if the event is not declared by the receiver
     */
    EnqueueOutcome enqueue(Event event);
}
