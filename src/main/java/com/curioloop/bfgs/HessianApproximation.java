/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.bfgs;

import java.util.logging.Logger;

import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.apache.commons.math3.util.FastMath;
import org.apache.commons.math3.util.Precision;

import static java.lang.String.format;

/**
 * Dense approximation of the Hessian maintained by BFGS secant updates.
 * <p>
 * The matrix approximates the Hessian itself, not its inverse. Search
 * directions are obtained by solving {@code H p = g} with an LU
 * decomposition.
 * </p>
 * <p>
 * An update is applied only when the curvature condition
 * {@code y'dx > sqrt(eps) * |y| * |dx|} holds and {@code dx'H dx > 0}, which
 * keeps the matrix positive definite.
 * </p>
 */
final class HessianApproximation {

    private static final Logger logger = Logger.getLogger(HessianApproximation.class.getName());

    /** Relative threshold of the curvature condition */
    static final double CURVATURE_EPSILON = FastMath.sqrt(Precision.EPSILON);

    private final int dimension;
    private RealMatrix matrix;

    /**
     * Creates an identity approximation.
     * @param dimension Problem dimension
     */
    HessianApproximation(int dimension) {
        this.dimension = dimension;
        this.matrix = MatrixUtils.createRealIdentityMatrix(dimension);
    }

    /**
     * Creates an approximation starting from the given square matrix.
     * @param initial Initial matrix (copied)
     */
    HessianApproximation(double[][] initial) {
        this.dimension = initial.length;
        this.matrix = MatrixUtils.createRealMatrix(initial);
    }

    /**
     * Solves {@code H p = g}.
     * <p>
     * A singular matrix is reset to identity, so the direction degrades to
     * the gradient itself.
     * </p>
     *
     * @param gradient Gradient at the current point
     * @return Direction p; the candidate point is {@code x - p}
     */
    double[] direction(double[] gradient) {
        RealVector g = new ArrayRealVector(gradient, false);
        try {
            return new LUDecomposition(matrix, Precision.SAFE_MIN).getSolver().solve(g).toArray();
        } catch (SingularMatrixException e) {
            logger.warning(" Curvature matrix is singular; resetting it to identity.");
            reset();
            return gradient.clone();
        }
    }

    /**
     * Applies the BFGS secant update
     * {@code H + y y' / (y'dx) - (H dx)(H dx)' / (dx'H dx)}.
     *
     * @param dx Position difference between the accepted and previous point
     * @param y Gradient difference between the accepted and previous point
     * @return true if the update was applied, false if the curvature guard skipped it
     */
    boolean update(double[] dx, double[] y) {
        RealVector s = new ArrayRealVector(dx, false);
        RealVector yv = new ArrayRealVector(y, false);
        double ys = yv.dotProduct(s);
        RealVector hs = matrix.operate(s);
        double shs = s.dotProduct(hs);

        if (!(ys > CURVATURE_EPSILON * yv.getNorm() * s.getNorm()) || !(shs > 0)) {
            logger.fine(format(" Skipping BFGS update: y'dx = %g, dx'H dx = %g.", ys, shs));
            return false;
        }

        matrix = matrix
                .add(yv.outerProduct(yv).scalarMultiply(1.0 / ys))
                .subtract(hs.outerProduct(hs).scalarMultiply(1.0 / shs));
        return true;
    }

    /**
     * Resets the approximation to identity.
     */
    void reset() {
        matrix = MatrixUtils.createRealIdentityMatrix(dimension);
    }

    double[][] toArray() {
        return matrix.getData();
    }
}
