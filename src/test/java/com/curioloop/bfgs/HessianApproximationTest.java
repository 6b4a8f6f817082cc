/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.bfgs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the secant update and the direction solve.
 */
public class HessianApproximationTest {

    @Test
    @DisplayName("Identity approximation returns the gradient as direction")
    void testIdentityDirection() {
        HessianApproximation hessian = new HessianApproximation(3);

        double[] p = hessian.direction(new double[]{1.0, -2.0, 0.5});

        assertThat(p).containsExactly(1.0, -2.0, 0.5);
    }

    @Test
    @DisplayName("Updated matrix satisfies the secant equation")
    void testSecantEquation() {
        HessianApproximation hessian = new HessianApproximation(3);
        double[] dx = {0.5, -1.0, 2.0};
        double[] y = {1.5, -0.5, 3.0};

        assertThat(hessian.update(dx, y)).isTrue();

        double[][] h = hessian.toArray();
        for (int i = 0; i < 3; i++) {
            double hdx = 0.0;
            for (int j = 0; j < 3; j++) {
                hdx += h[i][j] * dx[j];
            }
            assertThat(hdx).isCloseTo(y[i], within(1e-12));
        }
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                assertThat(h[i][j]).isCloseTo(h[j][i], within(1e-12));
            }
        }
    }

    @Test
    @DisplayName("Direction solves H p = g after an update")
    void testDirectionAfterUpdate() {
        HessianApproximation hessian = new HessianApproximation(2);
        hessian.update(new double[]{1.0, 0.0}, new double[]{4.0, 0.0});
        double[] g = {2.0, 3.0};

        double[] p = hessian.direction(g);

        double[][] h = hessian.toArray();
        assertThat(h[0][0]).isCloseTo(4.0, within(1e-12));
        assertThat(h[0][0] * p[0] + h[0][1] * p[1]).isCloseTo(g[0], within(1e-12));
        assertThat(h[1][0] * p[0] + h[1][1] * p[1]).isCloseTo(g[1], within(1e-12));
    }

    @Test
    @DisplayName("Negative curvature skips the update")
    void testNegativeCurvatureSkipped() {
        HessianApproximation hessian = new HessianApproximation(2);

        assertThat(hessian.update(new double[]{1.0, 1.0}, new double[]{-1.0, -0.5})).isFalse();
        assertThat(hessian.toArray()).isDeepEqualTo(new double[][]{{1.0, 0.0}, {0.0, 1.0}});
    }

    @Test
    @DisplayName("Non-finite gradient difference skips the update")
    void testNonFiniteDifferenceSkipped() {
        HessianApproximation hessian = new HessianApproximation(1);

        assertThat(hessian.update(new double[]{1.0}, new double[]{Double.NaN})).isFalse();
        assertThat(hessian.toArray()[0][0]).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Reset restores the identity")
    void testReset() {
        HessianApproximation hessian = new HessianApproximation(2);
        hessian.update(new double[]{1.0, 2.0}, new double[]{3.0, 1.0});

        hessian.reset();

        assertThat(hessian.toArray()).isDeepEqualTo(new double[][]{{1.0, 0.0}, {0.0, 1.0}});
    }

    @Test
    @DisplayName("Singular matrix falls back to identity and the gradient direction")
    void testSingularMatrixResets() {
        HessianApproximation hessian = new HessianApproximation(new double[][]{{1.0, 1.0}, {1.0, 1.0}});

        double[] p = hessian.direction(new double[]{3.0, -2.0});

        assertThat(p).containsExactly(3.0, -2.0);
        assertThat(hessian.toArray()).isDeepEqualTo(new double[][]{{1.0, 0.0}, {0.0, 1.0}});
    }

    @Test
    @DisplayName("Non-singular seed matrix is used for the direction")
    void testSeededMatrixDirection() {
        HessianApproximation hessian = new HessianApproximation(new double[][]{{2.0, 0.0}, {0.0, 4.0}});

        double[] p = hessian.direction(new double[]{2.0, 2.0});

        assertThat(p[0]).isCloseTo(1.0, within(1e-12));
        assertThat(p[1]).isCloseTo(0.5, within(1e-12));
        assertThat(hessian.toArray()).isDeepEqualTo(new double[][]{{2.0, 0.0}, {0.0, 4.0}});
    }

    /**
     * f(x) = x0^2 + 2 x1^2 from (1, 1): one backtrack reaches (0, -1).
     * The matrix reported by the optimizer must equal the update recomputed
     * from the recorded step and gradients.
     */
    @Test
    @DisplayName("Optimizer matrix matches a manually recomputed secant update")
    void testOptimizerUpdateMatchesManualUpdate() {
        ObjectiveFunction quadratic = (x, g) -> {
            if (g != null) {
                g[0] = 2 * x[0];
                g[1] = 4 * x[1];
            }
            return x[0] * x[0] + 2 * x[1] * x[1];
        };
        double[] x0 = {1.0, 1.0};

        OptimizationResult result = BfgsOptimizer.minimize(quadratic, x0,
                Options.builder().maxIterations(1).build());

        double[] x1 = result.getSolution();
        assertThat(x1).containsExactly(0.0, -1.0);

        double[] g0 = new double[2];
        double[] g1 = new double[2];
        quadratic.evaluate(x0, g0);
        quadratic.evaluate(x1, g1);
        double[] dx = {x1[0] - x0[0], x1[1] - x0[1]};
        double[] y = {g1[0] - g0[0], g1[1] - g0[1]};

        // H0 = I, so H0 dx = dx
        double ydx = y[0] * dx[0] + y[1] * dx[1];
        double dxdx = dx[0] * dx[0] + dx[1] * dx[1];
        double[][] expected = new double[2][2];
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                expected[i][j] = (i == j ? 1.0 : 0.0) + y[i] * y[j] / ydx - dx[i] * dx[j] / dxdx;
            }
        }

        double[][] actual = result.getHessian();
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 2; j++) {
                assertThat(actual[i][j]).isCloseTo(expected[i][j], within(1e-12));
            }
        }
    }
}
