/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.bfgs;

import java.util.logging.Logger;

import org.apache.commons.math3.util.FastMath;

import static java.lang.String.format;

/**
 * BFGS optimizer for unconstrained minimization.
 * <p>
 * BFGS is a quasi-Newton algorithm that maintains a dense approximation of
 * the Hessian built from gradient and position differences:
 * </p>
 * <pre>
 *   minimize f(x),    x = (x1, x2, ..., xn)
 * </pre>
 * <p>
 * Each iteration solves {@code H p = g} and tries the full step
 * {@code x - p}. When the full step does not decrease the objective, the step
 * is shrunk geometrically by the backtracking factor until it does, or until
 * the step scale falls below {@value #STEP_LOWER_BOUND}. Line search trials
 * only evaluate the objective value; the gradient is requested for accepted
 * points only.
 * </p>
 * <p>
 * The run ends when both the change of the objective value and the infinity
 * norm of the step fall below their tolerances ({@link OptimizationStatus#CONVERGED}),
 * when the line search underflows ({@link OptimizationStatus#STEP_UNDERFLOW}),
 * when the iteration budget is spent ({@link OptimizationStatus#NOT_CONVERGED})
 * or when the progress observer asks to stop
 * ({@link OptimizationStatus#STOPPED_BY_OBSERVER}).
 * </p>
 *
 * <h2>Thread Safety</h2>
 * <p>
 * An optimizer instance only holds immutable configuration; all iteration
 * state lives in a single {@link #optimize(double[])} call. One instance may
 * therefore run concurrently on several threads, provided the objective is
 * reentrant and any observer set with {@link Builder#observer(ProgressObserver)}
 * is thread-safe.
 * </p>
 *
 * <h2>Example usage</h2>
 * <pre>{@code
 * ObjectiveFunction rosenbrock = (x, g) -> {
 *     double f = 100 * Math.pow(x[1] - x[0]*x[0], 2) + Math.pow(1 - x[0], 2);
 *     if (g != null) {
 *         g[0] = -400 * x[0] * (x[1] - x[0]*x[0]) - 2 * (1 - x[0]);
 *         g[1] = 200 * (x[1] - x[0]*x[0]);
 *     }
 *     return f;
 * };
 *
 * BfgsOptimizer optimizer = BfgsOptimizer.builder()
 *     .dimension(2)
 *     .objective(rosenbrock)
 *     .options(Options.builder().maxIterations(500).display(Display.ITER).build())
 *     .build();
 *
 * OptimizationResult result = optimizer.optimize(new double[]{-1.2, 1});
 * }</pre>
 */
public final class BfgsOptimizer {

    private static final Logger logger = Logger.getLogger(BfgsOptimizer.class.getName());

    /** Smallest step scale tried by the line search */
    public static final double STEP_LOWER_BOUND = 1.0e-12;

    private final int dimension;
    private final ObjectiveFunction objective;
    private final Options options;
    private final ProgressObserver observer;

    private BfgsOptimizer(Builder builder) {
        this.dimension = builder.dimension;
        this.objective = builder.objective;
        this.options = builder.options;
        this.observer = builder.observer;
    }

    /**
     * Creates a new builder for the BFGS optimizer.
     * @return New builder
     */
    public static Builder builder() {
        return new Builder();
    }

    // ==================== Convenience static methods ====================

    /**
     * Minimizes a function starting from the given initial point with default options.
     *
     * @param objective Objective function with gradient
     * @param initialPoint Initial guess (not modified)
     * @return Optimization result
     */
    public static OptimizationResult minimize(ObjectiveFunction objective, double[] initialPoint) {
        return minimize(objective, initialPoint, Options.defaults());
    }

    /**
     * Minimizes a function starting from the given initial point.
     *
     * @param objective Objective function with gradient
     * @param initialPoint Initial guess (not modified)
     * @param options Options, or null for defaults
     * @return Optimization result
     */
    public static OptimizationResult minimize(ObjectiveFunction objective, double[] initialPoint,
                                              Options options) {
        if (initialPoint == null || initialPoint.length == 0) {
            throw new IllegalArgumentException("Initial point cannot be null or empty");
        }
        return builder()
                .dimension(initialPoint.length)
                .objective(objective)
                .options(options)
                .build()
                .optimize(initialPoint);
    }

    /**
     * Runs the optimization starting from the given initial point.
     *
     * @param initialPoint Initial guess (not modified)
     * @return Optimization result
     * @throws IllegalArgumentException if the point is null, not finite or of the wrong dimension
     * @throws OptimizationException if the objective is not finite at the initial point
     *         or throws an exception
     */
    public OptimizationResult optimize(double[] initialPoint) {
        if (initialPoint == null || initialPoint.length != dimension) {
            throw new IllegalArgumentException("Initial point must have dimension " + dimension);
        }
        if (!isFinite(initialPoint)) {
            throw new IllegalArgumentException("Initial point must be finite");
        }

        final int maxIterations = options.getMaxIterations();
        final double tolX = options.getTolX();
        final double tolFun = options.getTolFun();
        final double backtrack = options.getBacktrack();
        final ProgressObserver progress = observer != null
                ? observer : LoggingProgressObserver.forDisplay(options.getDisplay());

        Evaluator f = new Evaluator(objective);
        double[] x = initialPoint.clone();
        double[] g = new double[dimension];
        double value = f.evaluate(x, g);
        if (!Double.isFinite(value) || !isFinite(g)) {
            throw new OptimizationException(
                    "Objective is not finite at the initial point", OptimizationStatus.INVALID_ARGUMENT);
        }

        HessianApproximation hessian = new HessianApproximation(dimension);
        OptimizationStatus status = OptimizationStatus.NOT_CONVERGED;
        int t = 0;

        if (progress != null
                && !progress.iterationCompleted(new IterationRecord(0, value, Double.NaN, normInf(g), 0, 0.0))) {
            status = OptimizationStatus.STOPPED_BY_OBSERVER;
        }

        while (!status.isTerminal() && t < maxIterations) {
            t++;
            final double[] xPrev = x;
            final double[] gPrev = g;
            final double valuePrev = value;

            double[] p = hessian.direction(g);
            double[] cx = step(x, p, 1.0);
            double[] cg = new double[dimension];
            double cvalue = f.evaluate(cx, cg);

            int backtracks = 0;
            double eta = 1.0;

            if (cvalue < value) {
                x = cx;
                value = cvalue;
                g = cg;
            } else if (normInf(p) < tolX && FastMath.abs(cvalue - value) < tolFun) {
                // Null step at a stationary point.
                status = OptimizationStatus.CONVERGED;
                eta = 0.0;
            } else {
                // NaN trial values never decrease the objective.
                while (!(cvalue < value) && eta > STEP_LOWER_BOUND) {
                    backtracks++;
                    eta *= backtrack;
                    cx = step(x, p, eta);
                    cvalue = f.value(cx);
                }

                if (cvalue < value) {
                    x = cx;
                    g = new double[dimension];
                    value = f.evaluate(x, g);
                } else {
                    status = OptimizationStatus.STEP_UNDERFLOW;
                    eta = 0.0;
                    logger.fine(format(" Line search underflow at iteration %d after %d backtracks.", t, backtracks));
                }
            }

            if (!status.isTerminal()) {
                double[] dx = subtract(x, xPrev);
                hessian.update(dx, subtract(g, gPrev));

                if (FastMath.abs(value - valuePrev) < tolFun && normInf(dx) < tolX) {
                    status = OptimizationStatus.CONVERGED;
                }
            }

            if (progress != null) {
                IterationRecord record = new IterationRecord(
                        t, value, value - valuePrev, normInf(g), backtracks, eta);
                if (!progress.iterationCompleted(record) && !status.isTerminal()) {
                    status = OptimizationStatus.STOPPED_BY_OBSERVER;
                }
            }
        }

        OptimizationResult result = new OptimizationResult(
                x, value, status, t, f.getCount(), hessian.toArray());
        if (progress != null) {
            progress.terminated(result);
        }
        logger.fine(format(" BFGS finished: %s.", result));
        return result;
    }

    /**
     * Gets the problem dimension.
     * @return Dimension
     */
    public int getDimension() {
        return dimension;
    }

    /**
     * Gets the options.
     * @return Options
     */
    public Options getOptions() {
        return options;
    }

    private static double[] step(double[] x, double[] p, double eta) {
        double[] result = new double[x.length];
        for (int i = 0; i < x.length; i++) {
            result[i] = x[i] - eta * p[i];
        }
        return result;
    }

    private static double[] subtract(double[] a, double[] b) {
        double[] result = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            result[i] = a[i] - b[i];
        }
        return result;
    }

    static double normInf(double[] v) {
        double max = 0.0;
        for (double vi : v) {
            max = FastMath.max(max, FastMath.abs(vi));
        }
        return max;
    }

    private static boolean isFinite(double[] v) {
        for (double vi : v) {
            if (!Double.isFinite(vi)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Counts objective calls of one run and wraps objective failures.
     */
    private static final class Evaluator {
        private final ObjectiveFunction objective;
        private int count;

        Evaluator(ObjectiveFunction objective) {
            this.objective = objective;
        }

        double value(double[] x) {
            count++;
            try {
                return objective.value(x);
            } catch (OptimizationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw failure(e);
            }
        }

        double evaluate(double[] x, double[] gradient) {
            count++;
            try {
                return objective.evaluate(x, gradient);
            } catch (OptimizationException e) {
                throw e;
            } catch (RuntimeException e) {
                throw failure(e);
            }
        }

        private OptimizationException failure(RuntimeException cause) {
            return new OptimizationException("Objective function failed at evaluation " + count, cause);
        }

        int getCount() {
            return count;
        }
    }

    /**
     * Builder for the BFGS optimizer.
     */
    public static final class Builder {
        private int dimension;
        private ObjectiveFunction objective;
        private Options options = Options.defaults();
        private ProgressObserver observer;

        private Builder() {}

        /**
         * Sets the problem dimension.
         * @param n Dimension (must be positive)
         * @return This builder
         */
        public Builder dimension(int n) {
            if (n <= 0) {
                throw new IllegalArgumentException("Dimension must be positive");
            }
            this.dimension = n;
            return this;
        }

        /**
         * Sets the objective function with analytical gradient.
         * @param func Objective function
         * @return This builder
         */
        public Builder objective(ObjectiveFunction func) {
            this.objective = func;
            return this;
        }

        /**
         * Sets the options.
         * @param opts Options, or null for defaults
         * @return This builder
         */
        public Builder options(Options opts) {
            this.options = opts != null ? opts : Options.defaults();
            return this;
        }

        /**
         * Sets a progress observer.
         * <p>
         * An observer set here replaces the logging observer implied by
         * {@link Options#getDisplay()}.
         * </p>
         * @param obs Progress observer, or null to fall back to the display level
         * @return This builder
         */
        public Builder observer(ProgressObserver obs) {
            this.observer = obs;
            return this;
        }

        /**
         * Builds the optimizer.
         * @return BFGS optimizer
         * @throws IllegalArgumentException if configuration is invalid
         */
        public BfgsOptimizer build() {
            if (dimension <= 0) {
                throw new IllegalArgumentException("Dimension must be set");
            }
            if (objective == null) {
                throw new IllegalArgumentException("Objective function is required");
            }

            return new BfgsOptimizer(this);
        }
    }
}
