package org.colorcorrection.pipeline.service;

import org.colorcorrection.pipeline.model.ChartDetection;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.model.CorrectionStage;
import org.colorcorrection.pipeline.model.ImageRef;

import java.nio.file.Path;
import java.util.List;
import java.util.Set;

/**
 * Contract of the remote color correction service.
 * <p>
 * Implemented by {@link PipelineClient}, which talks HTTP to the server. Each
 * method maps to exactly one remote call and carries no workflow logic, so the
 * controller layer can be exercised against an in-memory implementation.
 * <p>
 * Use {@link BackendFactory#getBackend()} to obtain the backend.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public interface PipelineBackend {

    // ==================== Health & Session ====================

    /**
     * Checks if the server is up. Never throws; an unreachable server is reported
     * as unhealthy.
     *
     * @return health status and server version
     */
    PipelineClient.HealthStatus checkHealth();

    /**
     * Uploads images to the server session. Their order becomes the server-side
     * image index.
     *
     * @param files local image files
     * @return the stored images, in upload order
     * @throws PipelineException if the upload fails
     */
    List<PipelineClient.UploadedImage> uploadImages(List<Path> files) throws PipelineException;

    /**
     * Uploads the white reference image used by flat-field correction.
     *
     * @param file local image file
     * @return the stored image
     * @throws PipelineException if the upload fails
     */
    PipelineClient.UploadedImage uploadWhiteImage(Path file) throws PipelineException;

    /**
     * Drops all server-side session state: images, results and the trained model.
     *
     * @throws PipelineException if the server cannot be reached or refuses
     */
    void clearSession() throws PipelineException;

    // ==================== Single Image ====================

    /**
     * Detects the color chart in one image.
     *
     * @param image the image
     * @return the detection; {@code detected} is false when no chart was found
     * @throws PipelineException if the call fails
     */
    ChartDetection detectChart(ImageRef image) throws PipelineException;

    /**
     * Runs the enabled correction stages on one image, training a model when CC is
     * enabled.
     *
     * @param image     the image
     * @param config    run configuration
     * @param batchMode true when called as part of a sequential batch; the server
     *                  then keeps the outputs for batch saving and skips visualizations
     * @return the raw run output
     * @throws PipelineException if the call fails or a stage fails remotely
     */
    PipelineClient.RunResponse runPipeline(ImageRef image, CorrectionConfig config, boolean batchMode)
            throws PipelineException;

    // ==================== Model Reuse ====================

    /**
     * Asks the server whether a trained model is currently held.
     *
     * @return true if a model is available
     * @throws PipelineException if the call fails
     */
    boolean checkModelAvailable() throws PipelineException;

    /**
     * Applies the current model to several images, processed in parallel on the server.
     * Blocks until all images are done.
     *
     * @param targets images to process
     * @param config  run configuration
     * @param workers server worker count
     * @return processed and failed counts, with per-image entries when the server reports them
     * @throws PipelineException if the call fails
     */
    PipelineClient.ApplyResult applyModel(List<ImageRef> targets, CorrectionConfig config, int workers)
            throws PipelineException;

    // ==================== Parallel Batch ====================

    /**
     * Submits a parallel batch that trains a model per image. Returns as soon as the
     * server accepts it; progress is read with {@link #pollProgress()}.
     *
     * @param targets images to process
     * @param config  run configuration
     * @param workers server worker count
     * @return batch id and accepted size
     * @throws PipelineException if the submission fails
     */
    PipelineClient.BatchStart runPipelineBatch(List<ImageRef> targets, CorrectionConfig config, int workers)
            throws PipelineException;

    /**
     * Reads the current state of the parallel batch.
     *
     * @return progress snapshot
     * @throws PipelineException if the call fails
     */
    PipelineClient.BatchProgress pollProgress() throws PipelineException;

    // ==================== Results & Saving ====================

    /**
     * Lists corrected images from interactive runs.
     */
    List<PipelineClient.AvailableImage> listAvailableImages() throws PipelineException;

    /**
     * Lists images processed in batches, with the stages stored for each.
     */
    List<PipelineClient.BatchImage> listBatchImages() throws PipelineException;

    /**
     * Saves stage outputs of interactive runs.
     *
     * @param stages     stages to write
     * @param imageNames filenames of the images to write
     * @param directory  target directory on the server, or null for its default
     * @return what was written
     * @throws PipelineException if the call fails
     */
    PipelineClient.SaveResult saveImages(Set<CorrectionStage> stages, List<String> imageNames, String directory)
            throws PipelineException;

    /**
     * Saves stage outputs of batch-processed images.
     *
     * @param stages       stages to write
     * @param imageIndices indices of the images to write
     * @param directory    target directory on the server, or null for its default
     * @return what was written
     * @throws PipelineException if the call fails
     */
    PipelineClient.SaveResult saveBatchImages(Set<CorrectionStage> stages, List<Integer> imageIndices,
                                              String directory) throws PipelineException;

    /**
     * Persists the current model on the server.
     *
     * @param name   model name
     * @param folder target folder, or null for the server default
     * @return where the model was written
     * @throws PipelineException if the call fails or no model exists
     */
    PipelineClient.SavedModel saveModel(String name, String folder) throws PipelineException;
}
