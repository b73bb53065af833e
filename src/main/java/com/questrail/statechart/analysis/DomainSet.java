package com.questrail.statechart.analysis;

import com.questrail.statechart.model.CompareOp;

import java.util.Arrays;

/**
 * Immutable finite union of disjoint, sorted, closed {@code long} intervals.
 *
 * Used by {@link GuardSolver} to represent the values of one field still
 * permitted by a conjunction of comparisons.
 */
final class DomainSet
{
    static final DomainSet EMPTY = new DomainSet(new long[0]);

    // [lo0, hi0, lo1, hi1, ...], sorted, non-overlapping, non-adjacent
    private final long[] bounds;

    private DomainSet(long[] bounds) {
        this.bounds = bounds;
    }

    static DomainSet range(long lo, long hi) {
        return lo > hi ? EMPTY : new DomainSet(new long[] {lo, hi});
    }

    /** Values {@code x} of {@code [min, max]} for which {@code x op literal} holds. */
    static DomainSet of(long min, long max, CompareOp op, long literal) {
        switch (op) {
            case EQ:
                return literal < min || literal > max ? EMPTY : range(literal, literal);
            case NE: {
                DomainSet below = literal <= min ? EMPTY : range(min, Math.min(max, literal - 1));
                DomainSet above = literal >= max ? EMPTY : range(Math.max(min, literal + 1), max);
                return below.union(above);
            }
            case LT:
                return literal <= min ? EMPTY : range(min, Math.min(max, literal - 1));
            case LE:
                return literal < min ? EMPTY : range(min, Math.min(max, literal));
            case GT:
                return literal >= max ? EMPTY : range(Math.max(min, literal + 1), max);
            case GE:
                return literal > max ? EMPTY : range(Math.max(min, literal), max);
            default:
                throw new IllegalArgumentException("Unsupported operator: " + op);
        }
    }

    boolean isEmpty() {
        return bounds.length == 0;
    }

    boolean contains(long value) {
        for (int i = 0; i < bounds.length; i += 2) {
            if (value >= bounds[i] && value <= bounds[i + 1]) {
                return true;
            }
        }
        return false;
    }

    DomainSet intersect(DomainSet other) {
        long[] out = new long[bounds.length + other.bounds.length];
        int n = 0;
        int i = 0;
        int j = 0;
        while (i < bounds.length && j < other.bounds.length) {
            long lo = Math.max(bounds[i], other.bounds[j]);
            long hi = Math.min(bounds[i + 1], other.bounds[j + 1]);
            if (lo <= hi) {
                out[n++] = lo;
                out[n++] = hi;
            }
            if (bounds[i + 1] < other.bounds[j + 1]) {
                i += 2;
            } else {
                j += 2;
            }
        }
        return n == 0 ? EMPTY : new DomainSet(Arrays.copyOf(out, n));
    }

    DomainSet union(DomainSet other) {
        if (isEmpty()) {
            return other;
        }
        if (other.isEmpty()) {
            return this;
        }
        long[] merged = new long[bounds.length + other.bounds.length];
        int n = 0;
        int i = 0;
        int j = 0;
        while (i < bounds.length || j < other.bounds.length) {
            long lo;
            long hi;
            if (j >= other.bounds.length || (i < bounds.length && bounds[i] <= other.bounds[j])) {
                lo = bounds[i];
                hi = bounds[i + 1];
                i += 2;
            } else {
                lo = other.bounds[j];
                hi = other.bounds[j + 1];
                j += 2;
            }
            if (n > 0 && (merged[n - 1] == Long.MAX_VALUE || lo <= merged[n - 1] + 1)) {
                merged[n - 1] = Math.max(merged[n - 1], hi);
            } else {
                merged[n++] = lo;
                merged[n++] = hi;
            }
        }
        return new DomainSet(Arrays.copyOf(merged, n));
    }

    @Override
    public String toString() {
        if (isEmpty()) {
            return "{}";
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < bounds.length; i += 2) {
            if (i > 0) {
                sb.append(" U ");
            }
            sb.append('[').append(bounds[i]).append("..").append(bounds[i + 1]).append(']');
        }
        return sb.toString();
    }
}
