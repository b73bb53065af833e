package com.questrail.statechart.model;

/**
 * What a bounded event queue does when an event arrives while it is full.
 */
public enum OverflowPolicy
{
    /** Discard the oldest queued event and admit the new one. */
    DROP_OLDEST,
    /** Discard the arriving event. */
    DROP_NEWEST,
    /** Reject the arriving event and report a fault to the caller. */
    ERROR,
    /** Treat the overflow as a fatal modeling defect. */
    ASSERT
}
