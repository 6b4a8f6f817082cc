/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.bfgs;

/**
 * Options of the BFGS optimizer.
 * <p>
 * Instances are immutable. Values that are not set on the builder fall back
 * to the defaults returned by {@link #defaults()}:
 * <ul>
 *   <li>maxIterations: 400</li>
 *   <li>tolX: 1e-6</li>
 *   <li>tolFun: 1e-6</li>
 *   <li>backtrack: 0.5</li>
 *   <li>display: {@link Display#SILENT}</li>
 * </ul>
 */
public final class Options {

    private final int maxIterations;
    private final double tolX;
    private final double tolFun;
    private final double backtrack;
    private final Display display;

    private Options(Builder builder) {
        this.maxIterations = builder.maxIterations;
        this.tolX = builder.tolX;
        this.tolFun = builder.tolFun;
        this.backtrack = builder.backtrack;
        this.display = builder.display;
    }

    /**
     * Creates a new builder for options.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates default options.
     * @return Default options
     */
    public static Options defaults() {
        return builder().build();
    }

    /**
     * Gets the maximum number of iterations.
     * @return Maximum iterations
     */
    public int getMaxIterations() {
        return maxIterations;
    }

    /**
     * Gets the step size tolerance, compared with the infinity norm of the step.
     * @return Step tolerance
     */
    public double getTolX() {
        return tolX;
    }

    /**
     * Gets the tolerance on the change of the objective value.
     * @return Function value tolerance
     */
    public double getTolFun() {
        return tolFun;
    }

    /**
     * Gets the shrink factor applied to the step at each backtracking trial.
     * @return Backtracking factor in (0, 1)
     */
    public double getBacktrack() {
        return backtrack;
    }

    /**
     * Gets the verbosity of the built-in progress reporting.
     * @return Display level
     */
    public Display getDisplay() {
        return display;
    }

    /**
     * Creates a builder initialized with these options.
     * @return Builder copy
     */
    public Builder toBuilder() {
        return builder()
                .maxIterations(maxIterations)
                .tolX(tolX)
                .tolFun(tolFun)
                .backtrack(backtrack)
                .display(display);
    }

    /**
     * Builder for options.
     */
    public static final class Builder {
        private int maxIterations = 400;
        private double tolX = 1e-6;
        private double tolFun = 1e-6;
        private double backtrack = 0.5;
        private Display display = Display.SILENT;

        private Builder() {}

        /**
         * Sets the maximum number of iterations.
         * <p>Zero is accepted: the optimizer then only evaluates the starting point.</p>
         * @param value Maximum iterations (must be non-negative)
         * @return This builder
         */
        public Builder maxIterations(int value) {
            if (value < 0) {
                throw new IllegalArgumentException("Max iterations must be non-negative");
            }
            this.maxIterations = value;
            return this;
        }

        /**
         * Sets the step size tolerance.
         * @param value Step tolerance (must be positive)
         * @return This builder
         */
        public Builder tolX(double value) {
            if (value <= 0 || Double.isNaN(value)) {
                throw new IllegalArgumentException("Step tolerance must be positive");
            }
            this.tolX = value;
            return this;
        }

        /**
         * Sets the function value tolerance.
         * @param value Function value tolerance (must be positive)
         * @return This builder
         */
        public Builder tolFun(double value) {
            if (value <= 0 || Double.isNaN(value)) {
                throw new IllegalArgumentException("Function tolerance must be positive");
            }
            this.tolFun = value;
            return this;
        }

        /**
         * Sets the backtracking shrink factor.
         * @param value Shrink factor (must be in (0, 1))
         * @return This builder
         */
        public Builder backtrack(double value) {
            if (!(value > 0 && value < 1)) {
                throw new IllegalArgumentException("Backtracking factor must be in (0, 1)");
            }
            this.backtrack = value;
            return this;
        }

        /**
         * Sets the display level.
         * @param value Display level
         * @return This builder
         */
        public Builder display(Display value) {
            if (value == null) {
                throw new IllegalArgumentException("Display cannot be null");
            }
            this.display = value;
            return this;
        }

        /**
         * Builds the options.
         * @return Options
         */
        public Options build() {
            return new Options(this);
        }
    }

    @Override
    public String toString() {
        return "Options{" +
                "maxIterations=" + maxIterations +
                ", tolX=" + tolX +
                ", tolFun=" + tolFun +
                ", backtrack=" + backtrack +
                ", display=" + display +
                '}';
    }
}
