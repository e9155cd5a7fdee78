package org.colorcorrection.pipeline.service;

/**
 * The remote service answered but reported that an operation failed, either with
 * {@code success: false} or with a non-2xx status.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class RemoteStageException extends PipelineException {

    private final int httpStatus;

    public RemoteStageException(String stage, String detail, int httpStatus) {
        this(stage, -1, detail, httpStatus);
    }

    public RemoteStageException(String stage, int imageIndex, String detail, int httpStatus) {
        super(stage, imageIndex, detail);
        this.httpStatus = httpStatus;
    }

    /**
     * @return HTTP status of the failed response
     */
    public int getHttpStatus() {
        return httpStatus;
    }

    @Override
    public RemoteStageException forImage(int index) {
        return new RemoteStageException(getStage(), index, getMessage(), httpStatus);
    }
}
