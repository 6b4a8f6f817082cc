/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.bfgs;

import java.util.Arrays;

/**
 * Result of an optimization run.
 */
public final class OptimizationResult {

    private final double[] solution;
    private final double functionValue;
    private final OptimizationStatus status;
    private final int iterations;
    private final int evaluations;
    private final double[][] hessian;

    /**
     * Creates an optimization result.
     * @param solution Solution vector
     * @param functionValue Function value at the solution
     * @param status Optimization status
     * @param iterations Number of iterations
     * @param evaluations Number of objective evaluations
     * @param hessian Final curvature matrix
     */
    public OptimizationResult(double[] solution, double functionValue,
                              OptimizationStatus status, int iterations, int evaluations,
                              double[][] hessian) {
        this.solution = solution != null ? solution.clone() : new double[0];
        this.functionValue = functionValue;
        this.status = status;
        this.iterations = iterations;
        this.evaluations = evaluations;
        this.hessian = copy(hessian);
    }

    /**
     * Gets the solution vector.
     * @return Copy of solution vector
     */
    public double[] getSolution() {
        return solution.clone();
    }

    /**
     * Gets the function value at the solution.
     * @return Function value
     */
    public double getFunctionValue() {
        return functionValue;
    }

    /**
     * Gets the optimization status.
     * @return Status
     */
    public OptimizationStatus getStatus() {
        return status;
    }

    /**
     * Checks if the optimization converged successfully.
     * @return true if converged
     */
    public boolean isConverged() {
        return status.isConverged();
    }

    /**
     * Gets the number of iterations performed.
     * @return Iteration count
     */
    public int getIterations() {
        return iterations;
    }

    /**
     * Gets the number of objective evaluations, with or without gradient.
     * @return Evaluation count
     */
    public int getEvaluations() {
        return evaluations;
    }

    /**
     * Gets the final approximation of the Hessian.
     * @return Copy of the curvature matrix
     */
    public double[][] getHessian() {
        return copy(hessian);
    }

    /**
     * Gets the dimension of the solution.
     * @return Solution dimension
     */
    public int getDimension() {
        return solution.length;
    }

    private static double[][] copy(double[][] matrix) {
        if (matrix == null) {
            return new double[0][0];
        }
        double[][] result = new double[matrix.length][];
        for (int i = 0; i < matrix.length; i++) {
            result[i] = matrix[i].clone();
        }
        return result;
    }

    @Override
    public String toString() {
        return "OptimizationResult{" +
                "status=" + status +
                ", functionValue=" + functionValue +
                ", iterations=" + iterations +
                ", evaluations=" + evaluations +
                ", solution=" + Arrays.toString(solution) +
                '}';
    }
}
