package io.sortview.core;

import java.time.Duration;
import java.util.Objects;

/**
 * Immutable configuration for sorted projections.
 * <p>
 * Use the builder pattern to create custom configurations:
 * <pre>
 * SortViewConfiguration config = SortViewConfiguration.builder()
 *     .incremental(true)
 *     .stepBudget(Duration.ofMillis(2))
 *     .maxMergeSize(4096)
 *     .build();
 * </pre>
 * <p>
 * All configuration is immutable once built.
 *
 * @see io.sortview.runtime.SortedProjection
 */
public final class SortViewConfiguration {

    private static final SortViewConfiguration DEFAULTS = builder().build();

    // Initial sorting mode of new projections
    private final boolean incremental;

    // Cooperative stepping
    private final Duration stepBudget;
    private final int maxMergeSize;

    private SortViewConfiguration(Builder builder) {
        this.incremental = builder.incremental;
        this.stepBudget = builder.stepBudget;
        this.maxMergeSize = builder.maxMergeSize;
    }

    /**
     * Create a new builder for SortViewConfiguration.
     *
     * @return a new Builder instance
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * The configuration used when none is given.
     *
     * @return the default configuration
     */
    public static SortViewConfiguration defaults() {
        return DEFAULTS;
    }

    /**
     * Check if new projections start in incremental mode.
     *
     * @return true if sorting is spread over cooperative steps (default: false)
     */
    public boolean incremental() {
        return incremental;
    }

    /**
     * Get the wall-clock budget of a single cooperative sort step.
     * A step always performs at least one unit of sort work, so a zero budget
     * means exactly one unit per step.
     *
     * @return step budget (default: 1 ms)
     */
    public Duration stepBudget() {
        return stepBudget;
    }

    /**
     * Get the maximum number of entries an incremental merge may move before it yields.
     *
     * @return merge cap, 0 for unbounded (default: 1024)
     */
    public int maxMergeSize() {
        return maxMergeSize;
    }

    @Override
    public String toString() {
        return "SortViewConfiguration{incremental=" + incremental
                + ", stepBudget=" + stepBudget
                + ", maxMergeSize=" + maxMergeSize + '}';
    }

    /**
     * Builder for SortViewConfiguration.
     * <p>
     * Provides a fluent API for building configuration instances.
     */
    public static class Builder {
        private boolean incremental = false;
        private Duration stepBudget = Duration.ofMillis(1);
        private int maxMergeSize = 1024;

        private Builder() {
        }

        /**
         * Enable or disable incremental sorting for new projections.
         *
         * @param incremental true to sort in cooperative steps
         * @return this builder for method chaining
         */
        public Builder incremental(boolean incremental) {
            this.incremental = incremental;
            return this;
        }

        /**
         * Set the wall-clock budget of one cooperative sort step.
         *
         * @param stepBudget the budget, zero or positive
         * @return this builder for method chaining
         */
        public Builder stepBudget(Duration stepBudget) {
            this.stepBudget = Objects.requireNonNull(stepBudget, "stepBudget");
            return this;
        }

        /**
         * Set the merge cap applied to incremental sessions.
         *
         * @param maxMergeSize number of entries, 0 for unbounded
         * @return this builder for method chaining
         */
        public Builder maxMergeSize(int maxMergeSize) {
            this.maxMergeSize = maxMergeSize;
            return this;
        }

        /**
         * Build the immutable SortViewConfiguration.
         *
         * @return a new SortViewConfiguration instance
         * @throws IllegalArgumentException if a value is out of range
         */
        public SortViewConfiguration build() {
            if (stepBudget.isNegative()) {
                throw new IllegalArgumentException("stepBudget must not be negative: " + stepBudget);
            }
            if (maxMergeSize < 0) {
                throw new IllegalArgumentException("maxMergeSize must not be negative: " + maxMergeSize);
            }
            return new SortViewConfiguration(this);
        }
    }
}
