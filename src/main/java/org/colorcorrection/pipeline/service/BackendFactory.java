package org.colorcorrection.pipeline.service;

import org.colorcorrection.pipeline.preferences.ColorCorrectionPreferences;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Factory for obtaining a {@link PipelineBackend} configured from
 * {@link ColorCorrectionPreferences}.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public final class BackendFactory {

    private static final Logger logger = LoggerFactory.getLogger(BackendFactory.class);

    private BackendFactory() {
        // Utility class
    }

    /**
     * Gets an HTTP backend for the configured host, port and timeouts.
     *
     * @return a new backend
     */
    public static PipelineBackend getBackend() {
        String host = ColorCorrectionPreferences.getServerHost();
        int port = ColorCorrectionPreferences.getServerPort();
        logger.debug("Creating pipeline backend for {}:{}", host, port);
        return new PipelineClient(
                String.format("http://%s:%d/api", host, port),
                Duration.ofSeconds(ColorCorrectionPreferences.getConnectTimeoutSeconds()),
                Duration.ofSeconds(ColorCorrectionPreferences.getReadTimeoutSeconds()),
                Duration.ofSeconds(ColorCorrectionPreferences.getWriteTimeoutSeconds()));
    }
}
