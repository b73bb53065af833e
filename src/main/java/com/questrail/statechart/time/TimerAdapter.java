package com.questrail.statechart.time;

/**
 * TimerAdapter
 * =============================================================================
 * Boundary between a machine instance and whatever drives time.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>The instance calls {@link #attach(ExpiryListener, int)} once, with the
 *       number of timer slots its machine needs.</li>
 *   <li>{@link #start(long, long)} arms the slot encoded in the handle (see
 *       {@link TimerHandles}); re-arming a slot replaces its previous timer.</li>
 *   <li>{@link #cancel(long)} disarms the slot if it still holds that handle.</li>
 *   <li>On expiry the adapter calls {@link ExpiryListener#expired(long, long)}
 *       with the handle and the deadline it was armed for.</li>
 * </ul>
 * The instance also checks generations itself, so an adapter that delivers an
 * expiry racing with a cancel cannot fire a transition of an exited state.
 */
public interface TimerAdapter
{
    @FunctionalInterface
    interface ExpiryListener
    {
        void expired(long handle, long deadlineMillis);
    }

    void attach(ExpiryListener listener, int slots);

    void start(long handle, long durationMillis);

    void cancel(long handle);

    long nowMillis();
}
