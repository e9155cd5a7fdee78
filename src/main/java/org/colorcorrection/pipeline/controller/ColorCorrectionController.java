package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.ColorCorrectionChecks;
import org.colorcorrection.pipeline.model.BatchSummary;
import org.colorcorrection.pipeline.model.ChartDetection;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.model.CorrectionStage;
import org.colorcorrection.pipeline.model.ImageRef;
import org.colorcorrection.pipeline.model.ModelStatus;
import org.colorcorrection.pipeline.model.PipelineResult;
import org.colorcorrection.pipeline.model.SaveCandidate;
import org.colorcorrection.pipeline.service.BackendFactory;
import org.colorcorrection.pipeline.service.ImageRegistry;
import org.colorcorrection.pipeline.service.PipelineBackend;
import org.colorcorrection.pipeline.service.PipelineClient;
import org.colorcorrection.pipeline.service.PipelineException;
import org.colorcorrection.pipeline.service.PreconditionException;
import org.colorcorrection.pipeline.utilities.MetricsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Entry point for driving the color correction workflow from a UI, CLI or script.
 * <p>
 * Wires the registry, single-run executor, batch coordinator and save selector
 * around one backend and exposes the user-level operations: load, select,
 * detect, run, process all, apply to others, save and clear. All blocking
 * methods run on the calling thread.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class ColorCorrectionController implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(ColorCorrectionController.class);
    private static ColorCorrectionController instance;

    private final PipelineBackend backend;
    private final ImageRegistry registry;
    private final SingleRunExecutor executor;
    private final BatchCoordinator coordinator;
    private final SaveSelector saveSelector;

    public ColorCorrectionController(PipelineBackend backend, BatchSettings settings) {
        this.backend = backend;
        this.registry = new ImageRegistry();
        this.executor = new SingleRunExecutor(backend, registry, settings.selectionFallback());
        this.coordinator = new BatchCoordinator(backend, registry, executor, settings);
        this.saveSelector = new SaveSelector(backend, registry, coordinator::getLastSummary);

        logger.info("ColorCorrectionController initialized");
    }

    /**
     * Gets the shared controller, configured from the preferences on first use.
     *
     * @return the controller instance
     */
    public static synchronized ColorCorrectionController getInstance() {
        if (instance == null) {
            instance = new ColorCorrectionController(BackendFactory.getBackend(), BatchSettings.fromPreferences());
        }
        return instance;
    }

    public ImageRegistry getRegistry() {
        return registry;
    }

    public BatchCoordinator getCoordinator() {
        return coordinator;
    }

    public SaveSelector getSaveSelector() {
        return saveSelector;
    }

    public boolean checkServerHealth() {
        return ColorCorrectionChecks.checkServerHealth(backend);
    }

    // ==================== Session ====================

    /**
     * Uploads images and registers them.
     *
     * @param files local image files
     * @return refs for the uploaded images
     * @throws PipelineException if another operation is running or the upload fails
     */
    public List<ImageRef> loadImages(List<Path> files) throws PipelineException {
        if (files.isEmpty()) {
            throw new PreconditionException("upload-images", "No files given");
        }
        try (ImageRegistry.RunningLease lease = registry.acquire("upload-images")) {
            List<PipelineClient.UploadedImage> uploaded = backend.uploadImages(files);
            return registry.add(uploaded);
        }
    }

    /**
     * Uploads the white reference image for flat-field correction.
     */
    public void loadWhiteImage(Path file) throws PipelineException {
        try (ImageRegistry.RunningLease lease = registry.acquire("upload-white-image")) {
            registry.setWhiteImage(backend.uploadWhiteImage(file));
            logger.info("White reference image set: {}", file.getFileName());
        }
    }

    /**
     * Clears the server session and forgets all images, results and the model.
     *
     * @throws PipelineException if an operation is running or the server refuses
     */
    public void clear() throws PipelineException {
        try (ImageRegistry.RunningLease lease = registry.acquire("clear-session")) {
            backend.clearSession();
            registry.clear(lease);
            coordinator.clearLastSummary();
        }
    }

    public List<ImageRef> getImages() {
        return registry.getImages();
    }

    public void select(ImageRef image) throws PreconditionException {
        registry.select(image);
    }

    /**
     * Selects the image at a registry index.
     *
     * @throws PreconditionException if no image has that index
     */
    public void select(int index) throws PreconditionException {
        ImageRef ref = registry.get(index).orElseThrow(() ->
                new PreconditionException("select", index, "No image at index " + index));
        registry.select(ref);
    }

    public Optional<ImageRef> getSelected() {
        return registry.getSelected();
    }

    // ==================== Single Image ====================

    public ChartDetection detectChart() throws PipelineException {
        return executor.detectSelected();
    }

    public ChartDetection detectChart(ImageRef image) throws PipelineException {
        return executor.detectChart(image);
    }

    /**
     * Runs the pipeline on the selected image.
     *
     * @see SingleRunExecutor#runSelected(CorrectionConfig)
     */
    public PipelineResult run(CorrectionConfig config) throws PipelineException {
        return executor.runSelected(config);
    }

    public PipelineResult run(ImageRef image, CorrectionConfig config) throws PipelineException {
        return executor.runOne(image, config);
    }

    public Optional<PipelineResult> getResult(ImageRef image) {
        return registry.getResults().get(image);
    }

    public List<PipelineResult> getResults() {
        return registry.getResults().getAll();
    }

    /**
     * @return graded metrics of an image's latest result in FFC, GC, WB, CC order
     */
    public List<MetricsAggregator.StageQuality> getQuality(ImageRef image) {
        return getResult(image)
                .map(result -> MetricsAggregator.aggregate(result.getStageMetrics()))
                .orElse(List.of());
    }

    // ==================== Model ====================

    public ModelStatus getModelStatus() {
        return registry.getModelStatus();
    }

    /**
     * Reconciles the local model status with the server.
     *
     * @return the updated status
     * @throws PipelineException if the server cannot be asked
     */
    public ModelStatus refreshModelStatus() throws PipelineException {
        boolean remote = backend.checkModelAvailable();
        ModelStatus local = registry.getModelStatus();
        if (!remote && local.available()) {
            logger.warn("Server no longer holds the model trained on {}",
                    local.sourceImage() != null ? local.sourceImage().label() : "an unknown image");
            registry.clearModel();
        } else if (remote && !local.available()) {
            registry.recordModel(null);
        }
        return registry.getModelStatus();
    }

    // ==================== Batch ====================

    public BatchSummary processAll(CorrectionConfig config, BatchListener listener) throws PipelineException {
        return coordinator.processAll(config, listener);
    }

    public BatchSummary applyToOthers(CorrectionConfig config, BatchListener listener) throws PipelineException {
        return coordinator.applyToOthers(config, listener);
    }

    public BatchSummary applyToOthers(List<ImageRef> targets, CorrectionConfig config, int workers,
                                      BatchListener listener) throws PipelineException {
        return coordinator.applyToOthers(targets, config, workers, listener);
    }

    public boolean cancelBatch() {
        return coordinator.cancel();
    }

    public Optional<BatchJob> getCurrentJob() {
        return coordinator.getCurrentJob();
    }

    // ==================== Saving ====================

    public List<SaveCandidate> getSaveCandidates() {
        return saveSelector.interactiveCandidates();
    }

    public List<SaveCandidate> getBatchSaveCandidates() throws PipelineException {
        return saveSelector.batchCandidates();
    }

    public PipelineClient.SaveResult save(Set<CorrectionStage> stages, List<SaveCandidate> images,
                                          String directory) throws PipelineException {
        return saveSelector.saveInteractive(stages, images, directory);
    }

    public PipelineClient.SaveResult saveBatch(Set<CorrectionStage> stages, List<SaveCandidate> images,
                                               String directory) throws PipelineException {
        return saveSelector.saveBatch(stages, images, directory);
    }

    public PipelineClient.SavedModel saveModel(String name, String folder) throws PipelineException {
        return saveSelector.saveModel(name, folder);
    }

    @Override
    public void close() {
        coordinator.close();
    }
}
