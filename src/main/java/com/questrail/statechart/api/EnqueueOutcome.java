package com.questrail.statechart.api;

/**
 * Result of offering an event to a bounded queue.
 */
public enum EnqueueOutcome
{
    /** Stored; nothing was lost. */
    ACCEPTED,

    /** Stored after discarding the oldest queued event ({@code DROP_OLDEST}). */
    ACCEPTED_DROPPED_OLDEST,

    /** Discarded because the queue is full ({@code DROP_NEWEST}). */
    DROPPED,

    /** Rejected because the queue is full ({@code ERROR}); the caller sees a fault. */
    REJECTED;

    public boolean stored() {
        return this == ACCEPTED || this == ACCEPTED_DROPPED_OLDEST;
    }
}
