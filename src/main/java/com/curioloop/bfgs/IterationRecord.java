/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.bfgs;

/**
 * Progress snapshot passed to a {@link ProgressObserver} after each iteration.
 * <p>
 * Iteration 0 describes the starting point: its value change is NaN and
 * no step has been taken.
 * </p>
 */
public final class IterationRecord {

    private final int iteration;
    private final double functionValue;
    private final double valueChange;
    private final double gradientNorm;
    private final int backtracks;
    private final double stepScale;

    /**
     * Creates an iteration record.
     * @param iteration Iteration index (0 for the starting point)
     * @param functionValue Current function value
     * @param valueChange Change from the previous iteration's value
     * @param gradientNorm Infinity norm of the current gradient
     * @param backtracks Backtracking steps taken in this iteration
     * @param stepScale Scale of the accepted step, 0 when no step was accepted
     */
    public IterationRecord(int iteration, double functionValue, double valueChange,
                           double gradientNorm, int backtracks, double stepScale) {
        this.iteration = iteration;
        this.functionValue = functionValue;
        this.valueChange = valueChange;
        this.gradientNorm = gradientNorm;
        this.backtracks = backtracks;
        this.stepScale = stepScale;
    }

    /**
     * Gets the iteration index.
     * @return Iteration index, 0 for the starting point
     */
    public int getIteration() {
        return iteration;
    }

    /**
     * Gets the function value at the current point.
     * @return Function value
     */
    public double getFunctionValue() {
        return functionValue;
    }

    /**
     * Gets the change of the function value from the previous iteration.
     * @return Value change, NaN for the starting point
     */
    public double getValueChange() {
        return valueChange;
    }

    /**
     * Gets the infinity norm of the current gradient.
     * @return Gradient infinity norm
     */
    public double getGradientNorm() {
        return gradientNorm;
    }

    /**
     * Gets the number of backtracking steps taken in this iteration.
     * @return Backtrack count
     */
    public int getBacktracks() {
        return backtracks;
    }

    /**
     * Gets the scale of the accepted step.
     * @return Step scale, 0 when no step was accepted
     */
    public double getStepScale() {
        return stepScale;
    }

    @Override
    public String toString() {
        return "IterationRecord{" +
                "iteration=" + iteration +
                ", functionValue=" + functionValue +
                ", valueChange=" + valueChange +
                ", gradientNorm=" + gradientNorm +
                ", backtracks=" + backtracks +
                ", stepScale=" + stepScale +
                '}';
    }
}
