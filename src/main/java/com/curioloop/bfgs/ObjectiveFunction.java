/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.bfgs;

/**
 * Functional interface for objective functions.
 * <p>
 * The objective function computes the function value and, on request,
 * the gradient at a given point. The two modes form a cost contract:
 * line search trials only ask for the value, accepted points ask for both.
 * </p>
 * <p>
 * Implementations must be deterministic: evaluating the same point twice
 * must give the same value, whatever the mode.
 * </p>
 */
@FunctionalInterface
public interface ObjectiveFunction {

    /**
     * Evaluates the objective function and optionally its gradient.
     * <p>
     * When gradient is not null, the implementation should compute and store
     * the partial derivatives in the gradient array. When gradient is null,
     * only the function value needs to be computed.
     * </p>
     *
     * @param x Current point (read-only)
     * @param gradient Output array for gradient (may be null)
     * @return Function value at x
     */
    double evaluate(double[] x, double[] gradient);

    /**
     * Evaluates the function value only.
     * @param x Current point (read-only)
     * @return Function value at x
     */
    default double value(double[] x) {
        return evaluate(x, null);
    }
}
