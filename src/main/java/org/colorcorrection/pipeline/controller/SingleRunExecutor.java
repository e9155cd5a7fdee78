package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.model.ChartDetection;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.model.CorrectionStage;
import org.colorcorrection.pipeline.model.ImageArtifact;
import org.colorcorrection.pipeline.model.ImageRef;
import org.colorcorrection.pipeline.model.PipelineResult;
import org.colorcorrection.pipeline.model.StageMetrics;
import org.colorcorrection.pipeline.service.ImageRegistry;
import org.colorcorrection.pipeline.service.PipelineBackend;
import org.colorcorrection.pipeline.service.PipelineClient;
import org.colorcorrection.pipeline.service.PipelineException;
import org.colorcorrection.pipeline.service.PreconditionException;
import org.colorcorrection.pipeline.utilities.MetricsAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Runs one image through optional chart detection and the full pipeline.
 * <p>
 * Each public operation holds the registry's running gate for its whole
 * duration. The previous result for the image is discarded before the remote
 * call, so a failed re-run leaves no stale result behind. Nothing is retried.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class SingleRunExecutor {

    private static final Logger logger = LoggerFactory.getLogger(SingleRunExecutor.class);

    private final PipelineBackend backend;
    private final ImageRegistry registry;
    private final SelectionFallback selectionFallback;

    public SingleRunExecutor(PipelineBackend backend, ImageRegistry registry, SelectionFallback selectionFallback) {
        this.backend = backend;
        this.registry = registry;
        this.selectionFallback = selectionFallback;
    }

    /**
     * Runs the pipeline on the selected image, applying the selection fallback
     * policy when nothing is selected.
     *
     * @param config run configuration
     * @return the normalized result
     * @throws PipelineException if the run is rejected or fails
     */
    public PipelineResult runSelected(CorrectionConfig config) throws PipelineException {
        return runOne(resolveTarget("run-cc"), config);
    }

    /**
     * Runs the pipeline on one image.
     *
     * @param image  the image
     * @param config run configuration
     * @return the normalized result
     * @throws PreconditionException if another operation is running or the ref is stale
     * @throws PipelineException     if the remote run fails
     */
    public PipelineResult runOne(ImageRef image, CorrectionConfig config) throws PipelineException {
        registry.validate(image);
        try (ImageRegistry.RunningLease lease = registry.acquire("run-cc")) {
            discardResult(image);
            if (config.isDetectChartFirst()) {
                ChartDetection detection = detect(image);
                if (!detection.detected()) {
                    logger.warn("No chart detected on {}, running the pipeline anyway", image.label());
                }
            }
            return execute(image, config, false);
        }
    }

    /**
     * Detects the color chart on one image and records the result in the registry.
     *
     * @param image the image
     * @return the detection
     * @throws PipelineException if the call is rejected or fails
     */
    public ChartDetection detectChart(ImageRef image) throws PipelineException {
        registry.validate(image);
        try (ImageRegistry.RunningLease lease = registry.acquire("detect-chart")) {
            return detect(image);
        }
    }

    /**
     * Detects the chart on the selected image, applying the selection fallback policy.
     */
    public ChartDetection detectSelected() throws PipelineException {
        return detectChart(resolveTarget("detect-chart"));
    }

    /**
     * Resolves the image a single operation targets.
     *
     * @param operation operation name for messages
     * @return the selected image, or the first image under {@link SelectionFallback#FIRST_IMAGE}
     * @throws PreconditionException if no image is loaded, or nothing is selected under
     *                               {@link SelectionFallback#REJECT}
     */
    public ImageRef resolveTarget(String operation) throws PreconditionException {
        Optional<ImageRef> selected = registry.getSelected();
        if (selected.isPresent()) {
            return selected.get();
        }
        if (registry.isEmpty()) {
            throw new PreconditionException(operation, "No images loaded");
        }
        if (selectionFallback == SelectionFallback.REJECT) {
            throw new PreconditionException(operation, "No image selected");
        }
        ImageRef first = registry.getImages().get(0);
        logger.warn("No image selected for {}, falling back to first image {}", operation, first.label());
        return first;
    }

    // ==================== Gate-free internals ====================

    /**
     * Runs chart detection. The caller must hold the running gate.
     */
    ChartDetection detect(ImageRef image) throws PipelineException {
        logger.info("Detecting chart on {}", image.label());
        ChartDetection detection;
        try {
            detection = backend.detectChart(image);
        } catch (PipelineException e) {
            logger.warn("Chart detection failed on {}: {}", image.label(), e.getMessage());
            throw attribute(e, image);
        }
        registry.recordChartDetection(image, detection.detected());
        if (detection.detected()) {
            logger.info("Chart detected on {} (confidence {}, {} patches)", image.label(),
                    String.format("%.2f", detection.confidence()), detection.patches().size());
        } else {
            logger.info("No chart detected on {}: {}", image.label(), detection.message());
        }
        return detection;
    }

    /**
     * Runs the pipeline and stores the result. The caller must hold the running gate.
     *
     * @param batchMode passed through to the server for sequential batches
     */
    PipelineResult execute(ImageRef image, CorrectionConfig config, boolean batchMode) throws PipelineException {
        discardResult(image);
        logger.info("Running pipeline on {} with {}", image.label(), config);

        PipelineClient.RunResponse response;
        try {
            response = backend.runPipeline(image, config, batchMode);
        } catch (PipelineException e) {
            logger.warn("Pipeline failed on {} at stage {}: {}", image.label(), e.getStage(), e.getMessage());
            throw attribute(e, image);
        }

        PipelineResult result = normalize(image, config, response);
        registry.getResults().put(result);

        boolean chartFound = registry.getChartDetected(image).orElse(false)
                || result.getAvailableStages().contains(CorrectionStage.CC);
        if (response.modelSaved()
                || (config.isSaveModel() && chartFound && config.isEnabled(CorrectionStage.CC))) {
            registry.recordModel(image);
        }

        for (String line : MetricsAggregator.summaryLines(result.getStageMetrics(), result.getMethod())) {
            logger.info("  {}", line);
        }
        logger.info("Pipeline finished on {}: stages {}", image.label(), result.getAvailableStages());
        return result;
    }

    private void discardResult(ImageRef image) {
        if (registry.getResults().remove(image).isPresent()) {
            logger.debug("Discarded previous result for {}", image.label());
        }
    }

    /**
     * Converts a raw run response into a {@link PipelineResult}. Stage outputs and
     * metrics whose names do not resolve to a stage are dropped.
     */
    static PipelineResult normalize(ImageRef image, CorrectionConfig config, PipelineClient.RunResponse response) {
        PipelineResult.Builder builder = PipelineResult.builder(image)
                .method(config.getEffectiveMethod())
                .original(response.original())
                .scatterPlot(response.scatterPlot())
                .difference(response.difference())
                .modelSaved(response.modelSaved())
                .log(response.log());

        for (ImageArtifact artifact : response.images()) {
            Optional<CorrectionStage> stage = CorrectionStage.fromKey(artifact.name());
            if (stage.isPresent()) {
                builder.stageImage(stage.get(), artifact);
            } else {
                logger.debug("Ignoring output '{}' with no stage suffix", artifact.name());
            }
        }
        for (Map.Entry<String, StageMetrics> entry : response.deltaE().entrySet()) {
            Optional<CorrectionStage> stage = CorrectionStage.fromKey(entry.getKey());
            if (stage.isPresent()) {
                builder.stageMetrics(stage.get(), entry.getValue());
            } else {
                logger.debug("Ignoring metrics for unknown stage '{}'", entry.getKey());
            }
        }
        return builder.build();
    }

    private static PipelineException attribute(PipelineException e, ImageRef image) {
        return e.getImageIndex().isPresent() ? e : e.forImage(image.index());
    }
}
