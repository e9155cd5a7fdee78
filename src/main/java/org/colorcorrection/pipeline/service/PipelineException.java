package org.colorcorrection.pipeline.service;

import java.util.OptionalInt;

/**
 * Base class of all failures reported by the pipeline controller.
 * <p>
 * Every failure names the stage it happened in (for example {@code "transport"},
 * {@code "detect-chart"} or {@code "CC"}) and, where known, the image it concerns.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class PipelineException extends Exception {

    private static final int NO_IMAGE = -1;

    private final String stage;
    private final int imageIndex;

    public PipelineException(String stage, String message) {
        this(stage, NO_IMAGE, message, null);
    }

    public PipelineException(String stage, int imageIndex, String message) {
        this(stage, imageIndex, message, null);
    }

    public PipelineException(String stage, int imageIndex, String message, Throwable cause) {
        super(message, cause);
        this.stage = stage;
        this.imageIndex = imageIndex;
    }

    public String getStage() {
        return stage;
    }

    /**
     * @return index of the image the failure concerns, or empty if it is not image specific
     */
    public OptionalInt getImageIndex() {
        return imageIndex < 0 ? OptionalInt.empty() : OptionalInt.of(imageIndex);
    }

    /**
     * @return a copy of this failure attributed to the given image
     */
    public PipelineException forImage(int index) {
        return new PipelineException(stage, index, getMessage(), getCause());
    }
}
