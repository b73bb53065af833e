package com.questrail.statechart.mapping;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ArrayHandleIndexTests
{
    @Test
    void providesBidirectionalLookupInGivenOrder() {
        ArrayHandleIndex<String> index = new ArrayHandleIndex<>(List.of("Motor.Idle", "Motor.Running", "Motor.Timeout"));

        assertEquals(0, index.handleOf("Motor.Idle"));
        assertEquals(2, index.handleOf("Motor.Timeout"));
        assertEquals("Motor.Running", index.keyAt(1));
        assertEquals(3, index.size());
        assertEquals(List.of("Motor.Idle", "Motor.Running", "Motor.Timeout"), index.keys());
    }

    @Test
    void findAndContainsAreNonThrowing() {
        ArrayHandleIndex<String> index = new ArrayHandleIndex<>(List.of("START", "STOP"));

        assertEquals(1, index.find("STOP").getAsInt());
        assertTrue(index.find("PAUSE").isEmpty());
        assertTrue(index.contains("START"));
        assertFalse(index.contains("PAUSE"));
    }

    @Test
    void unknownKeyThrows() {
        ArrayHandleIndex<String> index = new ArrayHandleIndex<>(List.of("START"));

        assertThrows(IllegalArgumentException.class, () -> index.handleOf("STOP"));
        assertThrows(IndexOutOfBoundsException.class, () -> index.keyAt(1));
        assertThrows(IndexOutOfBoundsException.class, () -> index.keyAt(-1));
    }

    @Test
    void duplicateOrNullKeysAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new ArrayHandleIndex<>(List.of("A", "B", "A")));
        assertThrows(NullPointerException.class, () -> new ArrayHandleIndex<>(Arrays.asList("A", null)));
    }

    @Test
    void emptyIndexIsPermitted() {
        ArrayHandleIndex<String> index = new ArrayHandleIndex<>(List.of());

        assertEquals(0, index.size());
        assertFalse(index.contains("anything"));
    }

    @Test
    void keysViewIsUnmodifiable() {
        ArrayHandleIndex<String> index = new ArrayHandleIndex<>(List.of("A"));

        assertThrows(UnsupportedOperationException.class, () -> index.keys().add("B"));
    }
}
