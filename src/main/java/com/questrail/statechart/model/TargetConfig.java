package com.questrail.statechart.model;

import java.util.Objects;

/**
 * TargetConfig
 * -----------------------------------------------------------------------------
 * Target-profile settings carried by a {@link Machine}. Every value here sizes
 * or parameterizes runtime storage that is allocated once, at instance
 * creation.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li><b>queueCapacity</b>: slots in the external event queue; the deferral
 *       buffer has the same capacity.</li>
 *   <li><b>overflowPolicy</b>: behavior when the queue is full.</li>
 *   <li><b>maxNestingDepth</b>: deepest permitted state nesting (root is depth 0).</li>
 *   <li><b>timerDelivery</b>: whether timer expiries run inline in {@code tick}
 *       or are queued.</li>
 *   <li><b>inlineArithmetic</b>: whether {@link Action.Assign} is permitted.</li>
 * </ul>
 */
public record TargetConfig(
        int queueCapacity,
        OverflowPolicy overflowPolicy,
        int maxNestingDepth,
        TimerDelivery timerDelivery,
        boolean inlineArithmetic
) {
    public TargetConfig {
        Objects.requireNonNull(overflowPolicy, "overflowPolicy");
        Objects.requireNonNull(timerDelivery, "timerDelivery");

        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1");
        }
        if (maxNestingDepth < 1) {
            throw new IllegalArgumentException("maxNestingDepth must be >= 1");
        }
    }

    /**
     * Defaults suitable for simulation and tests:
     * <ul>
     *   <li>queueCapacity: 16</li>
     *   <li>overflowPolicy: ERROR</li>
     *   <li>maxNestingDepth: 8</li>
     *   <li>timerDelivery: DIRECT</li>
     *   <li>inlineArithmetic: enabled</li>
     * </ul>
     */
    public static TargetConfig defaults() {
        return new TargetConfig(16, OverflowPolicy.ERROR, 8, TimerDelivery.DIRECT, true);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int queueCapacity = 16;
        private OverflowPolicy overflowPolicy = OverflowPolicy.ERROR;
        private int maxNestingDepth = 8;
        private TimerDelivery timerDelivery = TimerDelivery.DIRECT;
        private boolean inlineArithmetic = true;

        public Builder withQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
            return this;
        }

        public Builder withOverflowPolicy(OverflowPolicy overflowPolicy) {
            this.overflowPolicy = overflowPolicy;
            return this;
        }

        public Builder withMaxNestingDepth(int maxNestingDepth) {
            this.maxNestingDepth = maxNestingDepth;
            return this;
        }

        public Builder withTimerDelivery(TimerDelivery timerDelivery) {
            this.timerDelivery = timerDelivery;
            return this;
        }

        public Builder withInlineArithmetic(boolean enabled) {
            this.inlineArithmetic = enabled;
            return this;
        }

        public TargetConfig build() {
            return new TargetConfig(queueCapacity, overflowPolicy, maxNestingDepth, timerDelivery, inlineArithmetic);
        }
    }
}
