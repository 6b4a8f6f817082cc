/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.bfgs;

/**
 * Exception thrown when optimization cannot produce a result.
 */
public class OptimizationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final OptimizationStatus status;

    /**
     * Creates an optimization exception with status.
     * @param message Error message
     * @param status Optimization status
     */
    public OptimizationException(String message, OptimizationStatus status) {
        super(message);
        this.status = status;
    }

    /**
     * Creates an optimization exception wrapping an objective failure.
     * @param message Error message
     * @param cause Exception thrown by the objective function
     */
    public OptimizationException(String message, Throwable cause) {
        super(message, cause);
        this.status = OptimizationStatus.CALLBACK_ERROR;
    }

    /**
     * Gets the optimization status associated with this exception.
     * @return Optimization status
     */
    public OptimizationStatus getStatus() {
        return status;
    }
}
