package org.colorcorrection.pipeline.model;

/**
 * Delta E quality score of one correction stage.
 * <p>
 * Lower is better. {@code stdDev} is {@code NaN} when the server did not report it.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public record StageMetrics(double mean, double min, double max, double stdDev) {

    public boolean hasStdDev() {
        return !Double.isNaN(stdDev);
    }
}
