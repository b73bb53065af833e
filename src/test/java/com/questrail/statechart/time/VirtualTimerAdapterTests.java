package com.questrail.statechart.time;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class VirtualTimerAdapterTests
{
    private record Expiry(long handle, long deadline, long nowDuringCall) {}

    private VirtualTimerAdapter timers;
    private List<Expiry> expiries;

    @BeforeEach
    void setUp() {
        timers = new VirtualTimerAdapter();
        expiries = new ArrayList<>();
        timers.attach((handle, deadline) -> expiries.add(new Expiry(handle, deadline, timers.nowMillis())), 3);
    }

    // ---------------------------------------------------------------------
    // Handles
    // ---------------------------------------------------------------------

    @Test
    void handlesCarrySlotAndGeneration() {
        long h = TimerHandles.handle(7, 42);

        assertEquals(7, TimerHandles.slot(h));
        assertEquals(42, TimerHandles.generation(h));
        assertEquals(-1, TimerHandles.generation(TimerHandles.handle(0, -1)));
        assertNotEquals(TimerHandles.handle(1, 1), TimerHandles.handle(1, 2));
    }

    // ---------------------------------------------------------------------
    // Expiry
    // ---------------------------------------------------------------------

    @Test
    void expiriesAreDeliveredInDeadlineOrder() {
        long late = TimerHandles.handle(0, 1);
        long early = TimerHandles.handle(1, 1);
        timers.start(late, 300);
        timers.start(early, 100);

        assertEquals(0, timers.advance(99));
        assertEquals(2, timers.advance(500));

        assertEquals(List.of(
                new Expiry(early, 100, 100),
                new Expiry(late, 300, 300)), expiries);
        assertEquals(599, timers.nowMillis());
    }

    @Test
    void tiesAreBrokenBySlot() {
        timers.start(TimerHandles.handle(2, 1), 50);
        timers.start(TimerHandles.handle(0, 1), 50);

        timers.advance(50);

        assertEquals(0, TimerHandles.slot(expiries.get(0).handle()));
        assertEquals(2, TimerHandles.slot(expiries.get(1).handle()));
    }

    @Test
    void rearmingFromTheListenerKeepsThePhase() {
        long periodic = TimerHandles.handle(0, 1);
        VirtualTimerAdapter clock = new VirtualTimerAdapter(1000);
        List<Long> deadlines = new ArrayList<>();
        clock.attach((handle, deadline) -> {
            deadlines.add(deadline);
            clock.start(handle, 40);
        }, 1);
        clock.start(periodic, 40);

        assertEquals(3, clock.advance(130));

        assertEquals(List.of(1040L, 1080L, 1120L), deadlines);
        assertEquals(1, clock.armedCount());
    }

    @Test
    void rearmingReplacesTheEarlierTimer() {
        long first = TimerHandles.handle(0, 1);
        long second = TimerHandles.handle(0, 2);
        timers.start(first, 10);
        timers.start(second, 20);

        timers.advance(100);

        assertEquals(1, expiries.size());
        assertEquals(second, expiries.get(0).handle());
    }

    // ---------------------------------------------------------------------
    // Cancellation
    // ---------------------------------------------------------------------

    @Test
    void cancelDisarmsTheSlot() {
        long h = TimerHandles.handle(1, 1);
        timers.start(h, 10);
        timers.cancel(h);

        assertEquals(0, timers.armedCount());
        assertEquals(0, timers.advance(100));
    }

    @Test
    void staleCancelLeavesTheNewerTimerArmed() {
        long stale = TimerHandles.handle(1, 1);
        long current = TimerHandles.handle(1, 2);
        timers.start(stale, 10);
        timers.start(current, 10);

        timers.cancel(stale);

        assertEquals(1, timers.armedCount());
        assertEquals(1, timers.advance(10));
    }

    @Test
    void timeNeverMovesBackwards() {
        assertThrows(IllegalArgumentException.class, () -> timers.advance(-1));
        assertThrows(IllegalStateException.class, () -> new VirtualTimerAdapter().advance(1));
    }
}
