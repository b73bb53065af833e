package com.questrail.statechart.time;

/**
 * Encoding of timer handles: the timer slot in the high 32 bits and the arm
 * generation in the low 32 bits. A handle from an earlier generation of the
 * same slot identifies a cancelled timer.
 */
public final class TimerHandles
{
    private TimerHandles() {
    }

    public static long handle(int slot, int generation) {
        return ((long) slot << 32) | (generation & 0xFFFF_FFFFL);
    }

    public static int slot(long handle) {
        return (int) (handle >>> 32);
    }

    public static int generation(long handle) {
        return (int) handle;
    }
}
