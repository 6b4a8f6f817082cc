/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.bfgs;

/**
 * Receives progress notifications from the optimizer.
 * <p>
 * Notifications are delivered synchronously on the optimizing thread.
 * </p>
 */
@FunctionalInterface
public interface ProgressObserver {

    /**
     * Called once for the starting point and once after every iteration.
     *
     * @param record Progress of the iteration
     * @return false to stop the optimization after this iteration
     */
    boolean iterationCompleted(IterationRecord record);

    /**
     * Called once when the optimization terminates normally.
     * @param result Final result
     */
    default void terminated(OptimizationResult result) {
    }
}
