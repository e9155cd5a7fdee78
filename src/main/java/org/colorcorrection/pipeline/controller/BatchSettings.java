package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.preferences.ColorCorrectionPreferences;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing and sizing parameters for batch runs.
 *
 * @param pollInterval      delay between progress polls and between progress estimates
 * @param maxPollWait       total time a parallel batch is polled before it is abandoned
 * @param parallelThreshold image count at which "process all" uses the parallel strategy
 * @param defaultWorkers    server worker count when the caller does not give one
 * @param resetGrace        delay before a finished job is cleared
 * @param selectionFallback policy for single runs without a selection
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public record BatchSettings(
        Duration pollInterval,
        Duration maxPollWait,
        int parallelThreshold,
        int defaultWorkers,
        Duration resetGrace,
        SelectionFallback selectionFallback
) {

    /** The server caps parallel work at this many workers */
    public static final int MAX_WORKERS = 8;

    public BatchSettings {
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(maxPollWait, "maxPollWait");
        Objects.requireNonNull(resetGrace, "resetGrace");
        Objects.requireNonNull(selectionFallback, "selectionFallback");
        if (pollInterval.isNegative() || pollInterval.isZero()) {
            throw new IllegalArgumentException("Poll interval must be positive");
        }
        if (parallelThreshold < 1) {
            throw new IllegalArgumentException("Parallel threshold must be at least 1");
        }
        checkWorkerCount(defaultWorkers);
    }

    /**
     * Snapshots the current preferences.
     */
    public static BatchSettings fromPreferences() {
        return new BatchSettings(
                Duration.ofMillis(ColorCorrectionPreferences.getPollIntervalMillis()),
                Duration.ofMinutes(ColorCorrectionPreferences.getMaxPollWaitMinutes()),
                ColorCorrectionPreferences.getParallelThreshold(),
                ColorCorrectionPreferences.getDefaultWorkerCount(),
                Duration.ofMillis(ColorCorrectionPreferences.getResetGraceMillis()),
                SelectionFallback.fromName(ColorCorrectionPreferences.getSelectionFallback()));
    }

    public static BatchSettings defaults() {
        return new BatchSettings(Duration.ofMillis(200), Duration.ofMinutes(30), 4, 2,
                Duration.ofSeconds(3), SelectionFallback.FIRST_IMAGE);
    }

    /**
     * @throws IllegalArgumentException if {@code workers} is outside 1..{@value #MAX_WORKERS}
     */
    public static void checkWorkerCount(int workers) {
        if (workers < 1 || workers > MAX_WORKERS) {
            throw new IllegalArgumentException(
                    "Worker count must be between 1 and " + MAX_WORKERS + ", got " + workers);
        }
    }

    public BatchSettings withPollInterval(Duration interval) {
        return new BatchSettings(interval, maxPollWait, parallelThreshold, defaultWorkers,
                resetGrace, selectionFallback);
    }

    public BatchSettings withMaxPollWait(Duration wait) {
        return new BatchSettings(pollInterval, wait, parallelThreshold, defaultWorkers,
                resetGrace, selectionFallback);
    }

    public BatchSettings withResetGrace(Duration grace) {
        return new BatchSettings(pollInterval, maxPollWait, parallelThreshold, defaultWorkers,
                grace, selectionFallback);
    }

    public BatchSettings withSelectionFallback(SelectionFallback fallback) {
        return new BatchSettings(pollInterval, maxPollWait, parallelThreshold, defaultWorkers,
                resetGrace, fallback);
    }
}
