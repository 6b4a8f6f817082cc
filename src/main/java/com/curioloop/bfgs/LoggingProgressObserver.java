/*
 * Copyright (c) 2025 curioloop. All rights reserved.
 */
package com.curioloop.bfgs;

import java.util.Locale;
import java.util.logging.Logger;

import static java.lang.String.format;

/**
 * Progress observer that renders the iteration table to a logger.
 * <p>
 * With {@link Display#ITER} a header and one row per iteration are logged;
 * with {@link Display#FINAL} or {@link Display#ITER} a final status line is
 * logged when the optimizer terminates. A row reads:
 * </p>
 * <pre>
 *   Iters             Fval          Fval.ch     1st-ord norm  backtracks
 *       0               9              NaN                6           0
 *       1               0               -9                0           1
 * </pre>
 * <p>
 * Instances keep the header state of a single run and are not thread-safe.
 * </p>
 */
public final class LoggingProgressObserver implements ProgressObserver {

    private static final Logger logger = Logger.getLogger(LoggingProgressObserver.class.getName());

    private static final String HEADER = format(Locale.ROOT, "%7s  %15s  %15s  %15s  %10s",
            "Iters", "Fval", "Fval.ch", "1st-ord norm", "backtracks");

    private static final String ROW = "%7d  %15.6g  %15.6g  %15.6g  %10d";

    private final Display display;
    private final Logger out;
    private boolean headerLogged;

    /**
     * Creates an observer logging to this class's logger.
     * @param display Display level
     */
    public LoggingProgressObserver(Display display) {
        this(display, logger);
    }

    LoggingProgressObserver(Display display, Logger out) {
        if (display == null) {
            throw new IllegalArgumentException("Display cannot be null");
        }
        this.display = display;
        this.out = out;
    }

    /**
     * Creates the observer matching a display level.
     * @param display Display level
     * @return New observer, or null for {@link Display#SILENT}
     */
    public static LoggingProgressObserver forDisplay(Display display) {
        return display == Display.SILENT ? null : new LoggingProgressObserver(display);
    }

    @Override
    public boolean iterationCompleted(IterationRecord record) {
        if (display.includes(Display.ITER)) {
            if (!headerLogged) {
                out.info(HEADER);
                headerLogged = true;
            }
            out.info(format(Locale.ROOT, ROW,
                    record.getIteration(),
                    record.getFunctionValue(),
                    record.getValueChange(),
                    record.getGradientNorm(),
                    record.getBacktracks()));
        }
        return true;
    }

    @Override
    public void terminated(OptimizationResult result) {
        if (display.includes(Display.FINAL)) {
            out.info(format(Locale.ROOT, "BFGS terminated with status %d (%s) after %d iterations",
                    result.getStatus().getCode(), result.getStatus().getMessage(), result.getIterations()));
        }
    }
}
