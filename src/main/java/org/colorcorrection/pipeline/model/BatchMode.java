package org.colorcorrection.pipeline.model;

/**
 * Batch execution strategies.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public enum BatchMode {
    /** Detect and train a new model for each image, one image at a time */
    SEQUENTIAL_TRAIN,
    /** Server trains one model per image using a bounded worker pool */
    PARALLEL_TRAIN,
    /** Server applies the current model to every target image */
    PARALLEL_APPLY
}
