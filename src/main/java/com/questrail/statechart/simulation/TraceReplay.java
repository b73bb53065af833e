package com.questrail.statechart.simulation;

import com.questrail.statechart.observability.TraceRecord;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Deterministic replay: re-runs a scenario and compares the new trace with a
 * recorded one, record by record.
 */
public final class TraceReplay
{
    /**
     * Result of a replay.
     *
     * @param divergence index of the first differing record, or {@code -1}
     * @param expected   the recorded record at that index, if any
     * @param actual     the replayed record at that index, if any
     */
    public record Report(int divergence, Optional<TraceRecord> expected, Optional<TraceRecord> actual)
    {
        public boolean identical() {
            return divergence < 0;
        }

        @Override
        public String toString() {
            return identical()
                    ? "identical"
                    : "diverged at #" + divergence + ": expected " + expected.map(TraceRecord::toString).orElse("<end>")
                      + ", got " + actual.map(TraceRecord::toString).orElse("<end>");
        }
    }

    private final Simulator simulator;

    public TraceReplay(Simulator simulator) {
        this.simulator = Objects.requireNonNull(simulator, "simulator");
    }

    public Report replay(Scenario scenario, List<TraceRecord> recorded) {
        Objects.requireNonNull(recorded, "recorded");
        return compare(recorded, simulator.run(scenario).trace());
    }

    /** Compares two traces; equal traces yield an identical report. */
    public static Report compare(List<TraceRecord> expected, List<TraceRecord> actual) {
        int n = Math.max(expected.size(), actual.size());
        for (int i = 0; i < n; i++) {
            Optional<TraceRecord> e = i < expected.size() ? Optional.of(expected.get(i)) : Optional.empty();
            Optional<TraceRecord> a = i < actual.size() ? Optional.of(actual.get(i)) : Optional.empty();
            if (!e.equals(a)) {
                return new Report(i, e, a);
            }
        }
        return new Report(-1, Optional.empty(), Optional.empty());
    }
}
