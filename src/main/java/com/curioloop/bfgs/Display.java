/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.bfgs;

/**
 * Verbosity of the built-in progress reporting.
 *
 * @see LoggingProgressObserver
 */
public enum Display {

    /** No output */
    SILENT,

    /** Final status line only */
    FINAL,

    /** Iteration table followed by the final status line */
    ITER;

    /**
     * Checks whether this level includes the output of another level.
     * @param level Level to compare with
     * @return true if this level is at least as verbose
     */
    public boolean includes(Display level) {
        return compareTo(level) >= 0;
    }
}
