package org.colorcorrection.pipeline.utilities;

import org.colorcorrection.pipeline.model.CorrectionMethod;
import org.colorcorrection.pipeline.model.CorrectionStage;
import org.colorcorrection.pipeline.model.StageMetrics;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Orders per-stage Delta E metrics in pipeline order and grades them.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public final class MetricsAggregator {

    private MetricsAggregator() {
        // Utility class
    }

    /**
     * Quality grade of a mean Delta E.
     */
    public enum QualityBucket {
        EXCELLENT("Excellent", 1.0),
        VERY_GOOD("Very good", 2.0),
        GOOD("Good", 3.5),
        FAIR("Fair", 5.0),
        NEEDS_IMPROVEMENT("Needs improvement", Double.POSITIVE_INFINITY);

        private final String label;
        private final double upperBound;

        QualityBucket(String label, double upperBound) {
            this.label = label;
            this.upperBound = upperBound;
        }

        public String getLabel() {
            return label;
        }

        /**
         * @return exclusive upper bound of the mean Delta E for this bucket
         */
        public double getUpperBound() {
            return upperBound;
        }

        /**
         * Grades a mean Delta E. NaN grades as {@link #NEEDS_IMPROVEMENT}.
         */
        public static QualityBucket classify(double meanDeltaE) {
            for (QualityBucket bucket : values()) {
                if (meanDeltaE < bucket.upperBound) {
                    return bucket;
                }
            }
            return NEEDS_IMPROVEMENT;
        }
    }

    /**
     * Metrics of one stage with its grade.
     */
    public record StageQuality(CorrectionStage stage, StageMetrics metrics, QualityBucket bucket) {}

    /**
     * Orders metrics FFC, GC, WB, CC, keeping only the stages present.
     *
     * @param metrics stage metrics in any order
     * @return graded metrics in pipeline order
     */
    public static List<StageQuality> aggregate(Map<CorrectionStage, StageMetrics> metrics) {
        Map<CorrectionStage, StageMetrics> ordered = new EnumMap<>(CorrectionStage.class);
        ordered.putAll(metrics);
        List<StageQuality> result = new ArrayList<>(ordered.size());
        for (Map.Entry<CorrectionStage, StageMetrics> entry : ordered.entrySet()) {
            if (entry.getValue() == null) {
                continue;
            }
            result.add(new StageQuality(entry.getKey(), entry.getValue(),
                    QualityBucket.classify(entry.getValue().mean())));
        }
        return result;
    }

    /**
     * Same as {@link #aggregate(Map)} for metrics keyed by server stage names.
     * Keys that do not name a stage are ignored.
     */
    public static List<StageQuality> aggregateByName(Map<String, StageMetrics> metrics) {
        Map<CorrectionStage, StageMetrics> byStage = new EnumMap<>(CorrectionStage.class);
        for (Map.Entry<String, StageMetrics> entry : metrics.entrySet()) {
            CorrectionStage.fromKey(entry.getKey()).ifPresent(stage -> byStage.put(stage, entry.getValue()));
        }
        return aggregate(byStage);
    }

    /**
     * Formats one log line per stage, in pipeline order. The CC line names the method.
     *
     * @param metrics stage metrics
     * @param method  method used for color correction, may be null
     * @return summary lines
     */
    public static List<String> summaryLines(Map<CorrectionStage, StageMetrics> metrics, CorrectionMethod method) {
        List<String> lines = new ArrayList<>();
        for (StageQuality quality : aggregate(metrics)) {
            lines.add(formatLine(quality, method));
        }
        return lines;
    }

    static String formatLine(StageQuality quality, CorrectionMethod method) {
        StageMetrics m = quality.metrics();
        String name = quality.stage() == CorrectionStage.CC && method != null
                ? "CC (" + method.wireName() + ")"
                : quality.stage().name();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format(Locale.ROOT, "%-9s Delta E mean %.3f, min %.3f, max %.3f",
                name, m.mean(), m.min(), m.max()));
        if (m.hasStdDev()) {
            sb.append(String.format(Locale.ROOT, ", std %.3f", m.stdDev()));
        }
        sb.append(" - ").append(quality.bucket().getLabel());
        return sb.toString();
    }
}
