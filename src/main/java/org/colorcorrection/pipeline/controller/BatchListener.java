package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.model.BatchSummary;
import org.colorcorrection.pipeline.model.ImageOutcome;
import org.colorcorrection.pipeline.model.Progress;

/**
 * Receives batch events. Callbacks run on the thread driving the batch and
 * must not block.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public interface BatchListener {

    BatchListener NONE = new BatchListener() {};

    /**
     * Called when confirmed or estimated progress changes. Check
     * {@link Progress#estimated()} to tell them apart.
     */
    default void onProgress(Progress progress) {}

    /**
     * Called exactly once per image when it reaches a terminal status.
     */
    default void onImageFinished(ImageOutcome outcome) {}

    default void onBatchFinished(BatchSummary summary) {}
}
