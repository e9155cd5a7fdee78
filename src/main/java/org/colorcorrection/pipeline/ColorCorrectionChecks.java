package org.colorcorrection.pipeline;

import org.colorcorrection.pipeline.controller.BatchSettings;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.model.CorrectionStage;
import org.colorcorrection.pipeline.preferences.ColorCorrectionPreferences;
import org.colorcorrection.pipeline.service.BackendFactory;
import org.colorcorrection.pipeline.service.ImageRegistry;
import org.colorcorrection.pipeline.service.PipelineBackend;
import org.colorcorrection.pipeline.service.PipelineClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validation utilities for the color correction pipeline.
 * <p>
 * Checks server availability and configuration before a workflow starts. Each
 * check logs why it failed and returns false rather than throwing.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public final class ColorCorrectionChecks {

    private static final Logger logger = LoggerFactory.getLogger(ColorCorrectionChecks.class);

    private ColorCorrectionChecks() {
        // Utility class - no instantiation
    }

    /**
     * Checks the server configured in the preferences.
     *
     * @return true if the server is available
     */
    public static boolean checkServerHealth() {
        return checkServerHealth(BackendFactory.getBackend());
    }

    /**
     * Checks if the server behind a backend is healthy and responding.
     *
     * @param backend the backend
     * @return true if the server is available
     */
    public static boolean checkServerHealth(PipelineBackend backend) {
        try {
            PipelineClient.HealthStatus health = backend.checkHealth();
            if (health.healthy()) {
                logger.info("Color correction server is healthy (version {})", health.version());
            } else {
                logger.warn("Color correction server health check failed");
            }
            return health.healthy();
        } catch (RuntimeException e) {
            logger.debug("Health check exception: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Validates the batch preferences.
     *
     * @return true if they describe a usable batch configuration
     */
    public static boolean validateBatchPreferences() {
        try {
            BatchSettings settings = BatchSettings.fromPreferences();
            logger.debug("Batch settings: {}", settings);
            return true;
        } catch (IllegalArgumentException e) {
            logger.error("Batch validation failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Validates that a single run can start.
     *
     * @param backend  the backend
     * @param registry the registry
     * @param config   run configuration
     * @return true if the run can start
     */
    public static boolean validateRunConfig(PipelineBackend backend, ImageRegistry registry, CorrectionConfig config) {
        if (registry.isEmpty()) {
            logger.error("Run validation failed: no images loaded");
            return false;
        }
        if (!checkServerHealth(backend)) {
            logger.error("Run validation failed: server not available at {}:{}",
                    ColorCorrectionPreferences.getServerHost(), ColorCorrectionPreferences.getServerPort());
            return false;
        }
        if (config.isEnabled(CorrectionStage.FFC) && registry.getWhiteImage().isEmpty()) {
            logger.warn("Flat-field correction is enabled but no white reference image was uploaded");
        }
        return true;
    }

    /**
     * Validates that the current model can be applied to other images.
     *
     * @param backend  the backend
     * @param registry the registry
     * @return true if a model is available and the server is up
     */
    public static boolean validateApplyConfig(PipelineBackend backend, ImageRegistry registry) {
        if (!registry.getModelStatus().available()) {
            logger.error("Apply validation failed: no trained model available");
            return false;
        }
        if (!checkServerHealth(backend)) {
            logger.error("Apply validation failed: server not available");
            return false;
        }
        return true;
    }
}
