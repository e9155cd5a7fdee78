package org.colorcorrection.pipeline.service;

/**
 * The remote service could not be reached or returned an unreadable response.
 * <p>
 * Aborts the current operation. In a batch this is fatal for the whole batch,
 * unlike a {@link RemoteStageException} which only fails one image.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class TransportException extends PipelineException {

    public static final String STAGE = "transport";

    public TransportException(String message, Throwable cause) {
        super(STAGE, -1, message, cause);
    }

    public TransportException(int imageIndex, String message, Throwable cause) {
        super(STAGE, imageIndex, message, cause);
    }

    @Override
    public TransportException forImage(int index) {
        return new TransportException(index, getMessage(), getCause());
    }
}
