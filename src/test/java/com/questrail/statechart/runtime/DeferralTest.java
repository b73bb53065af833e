package com.questrail.statechart.runtime;

import com.questrail.statechart.Machines;
import com.questrail.statechart.api.DispatchResult;
import com.questrail.statechart.api.Event;
import com.questrail.statechart.model.OverflowPolicy;
import com.questrail.statechart.model.TargetConfig;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeferralTest
{
    private static DispatchEngine worker(TargetConfig config) {
        DispatchEngine engine = DispatchEngine.builder(Machines.validate(Machines.worker(config))).build();
        engine.init();
        return engine;
    }

    @Test
    void deferredEventIsHeldWhileBusy() {
        DispatchEngine engine = worker(TargetConfig.defaults());
        engine.dispatch(Event.of("JOB", 1));
        assertEquals(List.of("Worker.Busy"), engine.activeLeaves());
        assertEquals(1, engine.context().get("current"));

        DispatchResult r = engine.dispatch(Event.of("JOB", 2));

        assertFalse(r.consumed());
        assertTrue(r.transitionsFired().isEmpty());
        assertEquals(1, engine.deferredCount());
        assertEquals(0, engine.queueOccupancy());
        assertEquals(1, engine.context().get("current"));
    }

    @Test
    void leavingTheDeferringStateReleasesToTheFrontOfTheQueue() {
        DispatchEngine engine = worker(TargetConfig.defaults());
        engine.dispatch(Event.of("JOB", 1));
        engine.dispatch(Event.of("JOB", 2));

        engine.dispatch(Event.of("DONE"));

        assertEquals(List.of("Worker.Idle"), engine.activeLeaves());
        assertEquals(0, engine.deferredCount());
        assertEquals(1, engine.queueOccupancy());

        DispatchResult r = engine.processNext();

        assertTrue(r.fired("Worker.Idle#1"));
        assertEquals(List.of("Worker.Busy"), engine.activeLeaves());
        assertEquals(2, engine.context().get("current"));
    }

    @Test
    void releasedEventsKeepArrivalOrderAheadOfNewerEvents() {
        DispatchEngine engine = worker(TargetConfig.defaults());
        engine.dispatch(Event.of("JOB", 1));
        engine.dispatch(Event.of("JOB", 2));
        engine.dispatch(Event.of("JOB", 3));
        assertEquals(2, engine.deferredCount());

        engine.enqueue(Event.of("DONE"));
        engine.enqueue(Event.of("JOB", 9));
        engine.processNext();
        assertEquals(3, engine.queueOccupancy());

        // JOB(2) runs, then JOB(3) and JOB(9) are deferred again in order
        engine.processNext();
        assertEquals(2, engine.context().get("current"));
        engine.processNext();
        engine.processNext();
        assertEquals(2, engine.deferredCount());
        assertEquals(0, engine.queueOccupancy());

        engine.dispatch(Event.of("DONE"));
        engine.processNext();
        assertEquals(3, engine.context().get("current"));
        assertEquals(1, engine.queueOccupancy());
    }

    @Test
    void fullDeferralBufferDropsTheOldestUnderDropOldest() {
        TargetConfig config = TargetConfig.builder()
                .withQueueCapacity(2)
                .withOverflowPolicy(OverflowPolicy.DROP_OLDEST)
                .build();
        DispatchEngine engine = worker(config);
        engine.dispatch(Event.of("JOB", 1));
        engine.dispatch(Event.of("JOB", 2));
        engine.dispatch(Event.of("JOB", 3));
        engine.dispatch(Event.of("JOB", 4));
        assertEquals(2, engine.deferredCount());

        engine.dispatch(Event.of("DONE"));
        engine.processNext();

        assertEquals(3, engine.context().get("current"));
    }

    @Test
    void fullDeferralBufferReportsFaultUnderError() {
        TargetConfig config = TargetConfig.builder()
                .withQueueCapacity(1)
                .withOverflowPolicy(OverflowPolicy.ERROR)
                .build();
        DispatchEngine engine = worker(config);
        engine.dispatch(Event.of("JOB", 1));
        engine.dispatch(Event.of("JOB", 2));

        DispatchResult r = engine.dispatch(Event.of("JOB", 3));

        assertTrue(r.fault().isPresent());
        assertEquals(1, engine.deferredCount());
        assertFalse(engine.isHalted());
    }
}
