package com.questrail.statechart.runtime;

import com.questrail.statechart.model.FieldType;
import com.questrail.statechart.model.Machine;
import com.questrail.statechart.model.MachineBuilder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ContextTest
{
    private Context context;

    @BeforeEach
    void setUp() {
        MachineBuilder b = MachineBuilder.machine("Ctx");
        b.context("armed", FieldType.bool());
        b.context("level", FieldType.range(-5, 5));
        b.context("floor", FieldType.range(3, 7));
        b.context("mode", FieldType.enumeration("Mode", "OFF", "AUTO", "MANUAL"));
        b.initial(b.root(), b.state("S"));
        Machine machine = b.build();
        context = new Context(machine);
    }

    @Test
    void fieldsStartAtZeroOrTheirMinimum() {
        assertFalse(context.getBoolean("armed"));
        assertEquals(0, context.get("level"));
        assertEquals(3, context.get("floor"));
        assertEquals("OFF", context.getVariant("mode"));
        assertEquals(4, context.size());
    }

    @Test
    void writesWithinTheDomainAreStored() {
        context.setBoolean("armed", true);
        context.set("level", -5);
        context.setVariant("mode", "MANUAL");

        assertTrue(context.getBoolean("armed"));
        assertEquals(-5, context.get("level"));
        assertEquals("MANUAL", context.getVariant("mode"));
        assertEquals(2, context.get("mode"));
    }

    @Test
    void writesOutsideTheDomainAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> context.set("level", 6));
        assertThrows(IllegalArgumentException.class, () -> context.set("floor", 2));
        assertThrows(IllegalArgumentException.class, () -> context.set("armed", 2));
        assertThrows(IllegalArgumentException.class, () -> context.setVariant("mode", "TURBO"));
        assertEquals(0, context.get("level"));
    }

    @Test
    void unknownOrMistypedFieldsAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> context.get("speed"));
        assertThrows(IllegalArgumentException.class, () -> context.getVariant("level"));
    }

    @Test
    void snapshotIsACopy() {
        long[] snapshot = context.snapshot();
        context.set("level", 4);

        assertEquals(0, snapshot[1]);
        assertEquals(4, context.get(1));
    }
}
