package org.colorcorrection.pipeline.model;

import java.util.List;

/**
 * Result of a color chart detection on one image.
 *
 * @param detected      whether a chart was found
 * @param confidence    detection confidence in [0, 1]
 * @param message       server message
 * @param visualization annotated preview, or null
 * @param patches       identified chart patches (empty when not detected)
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public record ChartDetection(
        boolean detected,
        double confidence,
        String message,
        ImageArtifact visualization,
        List<ChartPatch> patches
) {
    public ChartDetection {
        patches = patches == null ? List.of() : List.copyOf(patches);
    }

    public static ChartDetection notDetected(String message) {
        return new ChartDetection(false, 0.0, message, null, List.of());
    }

    /**
     * One measured chart patch.
     */
    public record ChartPatch(int index, String name, double[] rgb) {}
}
