package com.questrail.statechart.time;

/**
 * Handle to one pending timer expiry.
 *
 * {@link ScheduledTimerAdapter} keeps one per timer slot and cancels it when
 * the slot's source state exits or the slot is re-armed. A cancelled expiry
 * that already ran is harmless: its handle carries an older generation and the
 * engine drops it as stale.
 */
public interface Cancellable
{
    /**
     * Withdraws the pending expiry.
     *
     * @return {@code false} if the expiry already ran or was withdrawn
     */
    boolean cancel();
}
