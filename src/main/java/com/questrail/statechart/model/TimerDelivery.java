package com.questrail.statechart.model;

/**
 * How an expired timer reaches the dispatcher.
 */
public enum TimerDelivery
{
    /** The expiry is processed as its own run-to-completion step inside {@code tick}. */
    DIRECT,
    /** The expiry is appended to the external queue and processed by a later dispatch. */
    QUEUED
}
