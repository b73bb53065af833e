package com.questrail.statechart.observability;

import com.questrail.statechart.api.Fault;
import com.questrail.statechart.api.FaultKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TraceRecordTests
{
    private static TraceRecord record(long... payload) {
        return new TraceRecord(4, "Motor", "START", payload,
                List.of("Motor.Idle"), List.of("Motor.Running"),
                List.of("Motor.Idle#1"), List.of("Motor.Running: enterRunning()"));
    }

    @Test
    void equalityComparesPayloadContents() {
        assertEquals(record(40), record(40));
        assertEquals(record(40).hashCode(), record(40).hashCode());
        assertNotEquals(record(40), record(41));
    }

    @Test
    void payloadIsCopiedInAndOut() {
        long[] payload = {7};
        TraceRecord r = record(payload);

        payload[0] = 8;
        r.payload()[0] = 9;

        assertArrayEquals(new long[] {7}, r.payload());
    }

    @Test
    void toStringShowsTheStep() {
        assertEquals("#4 Motor START[40] [Motor.Idle] -> [Motor.Running] fired=[Motor.Idle#1]",
                record(40).toString());
        assertEquals("#4 Motor START [Motor.Idle] -> [Motor.Running] fired=[Motor.Idle#1]",
                record().toString());
    }

    @Test
    void sinksAcceptStepsAndFaults() {
        Fault fault = new Fault(FaultKind.QUEUE_OVERFLOW, "Motor", "queue full");

        assertDoesNotThrow(() -> {
            Slf4jTraceSink sink = new Slf4jTraceSink();
            sink.onStep(record(40));
            sink.onFault("Motor", fault);
            NullTraceSink.INSTANCE.onStep(record(40));
            NullTraceSink.INSTANCE.onFault("Motor", fault);
        });
    }
}
