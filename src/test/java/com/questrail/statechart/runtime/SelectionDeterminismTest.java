package com.questrail.statechart.runtime;

import com.questrail.statechart.Machines;
import com.questrail.statechart.analysis.ValidatedMachine;
import com.questrail.statechart.api.DispatchResult;
import com.questrail.statechart.api.Event;
import com.questrail.statechart.model.FieldType;
import com.questrail.statechart.model.MachineBuilder;
import com.questrail.statechart.model.RegionRef;
import com.questrail.statechart.model.VertexRef;
import org.junit.jupiter.api.Test;

import static com.questrail.statechart.model.Guards.and;
import static com.questrail.statechart.model.Guards.ctx;
import static com.questrail.statechart.model.Guards.ge;
import static com.questrail.statechart.model.Guards.is;
import static com.questrail.statechart.model.Guards.isFalse;
import static com.questrail.statechart.model.Guards.isTrue;
import static com.questrail.statechart.model.Guards.lt;
import static org.junit.jupiter.api.Assertions.*;

/**
 * SelectionDeterminismTest
 * -----------------------------------------------------------------------------
 * For an accepted machine, every combination of guarded field values selects
 * at most one transition per region.
 */
class SelectionDeterminismTest
{
    private static ValidatedMachine machine() {
        MachineBuilder b = MachineBuilder.machine("Sel");
        b.context("x", FieldType.range(0, 9));
        b.context("armed", FieldType.bool());
        b.context("mode", FieldType.enumeration("Mode", "OFF", "AUTO", "MANUAL"));
        b.event("GO");

        VertexRef p = b.parallel("P");
        b.initial(b.root(), p);
        RegionRef left = b.region(p, "left");
        RegionRef right = b.region(p, "right");

        VertexRef l = b.state(left, "L");
        VertexRef low = b.state(left, "Low");
        VertexRef mid = b.state(left, "Mid");
        VertexRef high = b.state(left, "High");
        b.initial(left, l);
        b.transition(l, low).on("GO").when(lt(ctx("x"), 3));
        b.transition(l, mid).on("GO").when(and(ge(ctx("x"), 3), lt(ctx("x"), 7)));
        b.transition(l, high).on("GO").when(and(ge(ctx("x"), 7), isTrue(ctx("armed"))));

        VertexRef r = b.state(right, "R");
        VertexRef auto = b.state(right, "Auto");
        VertexRef manual = b.state(right, "Manual");
        b.initial(right, r);
        b.transition(r, auto).on("GO").when(is(ctx("mode"), "AUTO"));
        b.transition(r, manual).on("GO").when(and(is(ctx("mode"), "MANUAL"), isFalse(ctx("armed"))));
        b.transition(r, manual).on("GO").when(ge(ctx("x"), 5)).priority(200);

        return Machines.validate(b);
    }

    @Test
    void atMostOneTransitionPerRegionForEveryAssignment() {
        ValidatedMachine vm = machine();
        int checked = 0;

        for (long x = 0; x <= 9; x++) {
            for (long armed = 0; armed <= 1; armed++) {
                for (long mode = 0; mode <= 2; mode++) {
                    DispatchEngine engine = DispatchEngine.builder(vm).build();
                    engine.init();
                    engine.context().set("x", x);
                    engine.context().set("armed", armed);
                    engine.context().set("mode", mode);

                    DispatchResult result = engine.dispatch(Event.of("GO"));

                    long left = result.transitionsFired().stream().filter(t -> t.startsWith("Sel.P.left.")).count();
                    long right = result.transitionsFired().stream().filter(t -> t.startsWith("Sel.P.right.")).count();
                    assertTrue(left <= 1, () -> "left fired " + result.transitionsFired());
                    assertTrue(right <= 1, () -> "right fired " + result.transitionsFired());
                    checked++;
                }
            }
        }

        assertEquals(60, checked);
    }

    @Test
    void explicitPriorityPicksTheLowerNumber() {
        DispatchEngine engine = DispatchEngine.builder(machine()).build();
        engine.init();
        engine.context().set("x", 6);
        engine.context().set("mode", 1);

        DispatchResult result = engine.dispatch(Event.of("GO"));

        assertTrue(result.fired("Sel.P.right.R#1"));
        assertFalse(result.fired("Sel.P.right.R#3"));
        assertTrue(engine.activeLeaves().contains("Sel.P.right.Auto"));
    }
}
