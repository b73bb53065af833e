package com.questrail.statechart.time;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ScheduledTimerAdapterTests
 * -----------------------------------------------------------------------------
 * Runs the adapter on a {@link DeterministicScheduler} so expiries happen only
 * when the test advances the clock and drains due tasks.
 */
class ScheduledTimerAdapterTests
{
    private ManualMonotonicClock clock;
    private DeterministicScheduler scheduler;
    private ScheduledTimerAdapter timers;
    private List<long[]> expiries;

    @BeforeEach
    void setUp() {
        clock = new ManualMonotonicClock();
        scheduler = new DeterministicScheduler(clock);
        timers = new ScheduledTimerAdapter(scheduler, clock);
        expiries = new ArrayList<>();
        timers.attach((handle, deadline) -> expiries.add(new long[] {handle, deadline}), 2);
    }

    @Test
    void expiryFiresOnceTheDeadlinePasses() {
        long h = TimerHandles.handle(0, 1);
        timers.start(h, 250);

        clock.advanceMillis(249);
        assertEquals(0, scheduler.runDueTasks());

        clock.advanceMillis(1);
        assertEquals(1, scheduler.runDueTasks());

        assertEquals(1, expiries.size());
        assertEquals(h, expiries.get(0)[0]);
        assertEquals(250, expiries.get(0)[1]);
    }

    @Test
    void rearmingCancelsThePendingTask() {
        timers.start(TimerHandles.handle(0, 1), 100);
        timers.start(TimerHandles.handle(0, 2), 200);

        assertEquals(1, scheduler.pendingCount());

        clock.advanceMillis(300);
        scheduler.runDueTasks();

        assertEquals(1, expiries.size());
        assertEquals(2, TimerHandles.generation(expiries.get(0)[0]));
    }

    @Test
    void cancelOnlyMatchesTheCurrentHandle() {
        long current = TimerHandles.handle(1, 5);
        timers.start(current, 10);

        timers.cancel(TimerHandles.handle(1, 4));
        assertEquals(1, scheduler.pendingCount());

        timers.cancel(current);
        assertEquals(0, scheduler.pendingCount());

        clock.advanceMillis(10);
        assertEquals(0, scheduler.runDueTasks());
    }

    @Test
    void nowFollowsTheClock() {
        clock.advanceMillis(1234);

        assertEquals(1234, timers.nowMillis());
    }

    @Test
    void negativeDelayIsRejectedBySchedulerDefault() {
        assertThrows(IllegalArgumentException.class,
                () -> scheduler.scheduleAfter(Duration.ofMillis(-1), clock, () -> { }));
    }
}
