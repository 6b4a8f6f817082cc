/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.bfgs;

/**
 * Enumeration of optimization status codes.
 * <p>
 * Non-negative codes are terminal statuses returned in an
 * {@link OptimizationResult}. Negative codes are only carried by an
 * {@link OptimizationException}.
 * </p>
 */
public enum OptimizationStatus {

    /** Iteration budget exhausted before the convergence test passed */
    NOT_CONVERGED(0, "Terminated without convergence"),

    /** Value change and step size both below tolerance */
    CONVERGED(1, "Optimization converged successfully"),

    /** Line search found no decreasing step above the lower step bound */
    STEP_UNDERFLOW(2, "Step size underflow"),

    /** Progress observer requested termination */
    STOPPED_BY_OBSERVER(3, "Stopped by progress observer"),

    /** Invalid argument provided */
    INVALID_ARGUMENT(-2, "Invalid argument"),

    /** Objective function error */
    CALLBACK_ERROR(-5, "Callback function error");

    private final int code;
    private final String message;

    OptimizationStatus(int code, String message) {
        this.code = code;
        this.message = message;
    }

    /**
     * Gets the numeric status code.
     * @return Status code
     */
    public int getCode() {
        return code;
    }

    /**
     * Gets the status message.
     * @return Status message
     */
    public String getMessage() {
        return message;
    }

    /**
     * Checks if this status indicates successful convergence.
     * @return true if converged
     */
    public boolean isConverged() {
        return this == CONVERGED;
    }

    /**
     * Checks if this status indicates an error.
     * @return true if error
     */
    public boolean isError() {
        return code < 0;
    }

    /**
     * Checks if this status ends the iteration loop.
     * @return true for every status except {@link #NOT_CONVERGED}
     */
    public boolean isTerminal() {
        return this != NOT_CONVERGED;
    }

    /**
     * Gets the status from a numeric code.
     * @param code Numeric status code
     * @return Corresponding status enum
     * @throws IllegalArgumentException if no status has this code
     */
    public static OptimizationStatus fromCode(int code) {
        for (OptimizationStatus status : values()) {
            if (status.code == code) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown status code: " + code);
    }

    @Override
    public String toString() {
        return name() + "(" + code + "): " + message;
    }
}
