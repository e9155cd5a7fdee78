package org.colorcorrection.pipeline.service;

/**
 * An operation was rejected locally before any remote call was made: another
 * operation is running, no model is available, the selection is empty, and so on.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class PreconditionException extends PipelineException {

    public PreconditionException(String stage, String message) {
        super(stage, message);
    }

    public PreconditionException(String stage, int imageIndex, String message) {
        super(stage, imageIndex, message);
    }

    @Override
    public PreconditionException forImage(int index) {
        return new PreconditionException(getStage(), index, getMessage());
    }
}
