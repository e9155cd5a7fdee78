package org.colorcorrection.pipeline.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Configuration of one pipeline run: which stages run and with which parameters.
 * <p>
 * Instances are immutable snapshots. A run captures the config it was started
 * with, so edits made afterwards through {@link #toBuilder()} never reach a run
 * that is already in flight.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class CorrectionConfig {

    /**
     * Flat-field correction parameters.
     */
    public record FlatFieldParams(
            boolean manualCrop,
            int bins,
            int smoothWindow,
            int degree,
            CorrectionMethod fitMethod,
            boolean interactions,
            int maxIterations,
            double tolerance,
            int randomSeed
    ) {
        public FlatFieldParams {
            Objects.requireNonNull(fitMethod, "fitMethod");
            if (bins < 1) {
                throw new IllegalArgumentException("FFC bins must be at least 1");
            }
            if (degree < 1) {
                throw new IllegalArgumentException("FFC degree must be at least 1");
            }
            if (fitMethod == CorrectionMethod.CONVENTIONAL) {
                throw new IllegalArgumentException("FFC fit method must be a regression method");
            }
        }

        public static FlatFieldParams defaults() {
            return new FlatFieldParams(false, 50, 5, 3, CorrectionMethod.PLS, true, 1000, 1e-8, 0);
        }
    }

    /**
     * Gamma correction parameters.
     */
    public record GammaParams(int maxDegree) {
        public GammaParams {
            if (maxDegree < 1) {
                throw new IllegalArgumentException("GC max degree must be at least 1");
            }
        }

        public static GammaParams defaults() {
            return new GammaParams(5);
        }
    }

    /**
     * Color correction parameters.
     * <p>
     * When {@code learned} is false the server runs {@code conventionalAlgorithm}
     * and the regression fields are ignored.
     */
    public record ColorCorrectionParams(
            boolean learned,
            String conventionalAlgorithm,
            CorrectionMethod fitMethod,
            int degree,
            int maxIterations,
            int randomState,
            double tolerance,
            int samples,
            int plsComponents,
            List<Integer> hiddenLayers,
            double learningRate,
            int batchSize,
            int patience,
            double dropoutRate,
            String optimizer,
            boolean batchNorm
    ) {
        public ColorCorrectionParams {
            Objects.requireNonNull(fitMethod, "fitMethod");
            hiddenLayers = hiddenLayers == null ? List.of() : List.copyOf(hiddenLayers);
            if (fitMethod == CorrectionMethod.CONVENTIONAL) {
                throw new IllegalArgumentException(
                        "Learned fit method cannot be CONVENTIONAL; set learned=false instead");
            }
            if (degree < 1) {
                throw new IllegalArgumentException("CC degree must be at least 1");
            }
            if (dropoutRate < 0.0 || dropoutRate >= 1.0) {
                throw new IllegalArgumentException("Dropout rate must be in [0, 1)");
            }
        }

        public static ColorCorrectionParams defaults() {
            return new ColorCorrectionParams(true, "Finlayson 2015", CorrectionMethod.PLS,
                    2, 10000, 0, 1e-8, 50, 1, List.of(64, 32, 16),
                    0.001, 16, 10, 0.2, "adam", true);
        }

        public ColorCorrectionParams withLearned(boolean learned) {
            return new ColorCorrectionParams(learned, conventionalAlgorithm, fitMethod, degree,
                    maxIterations, randomState, tolerance, samples, plsComponents, hiddenLayers,
                    learningRate, batchSize, patience, dropoutRate, optimizer, batchNorm);
        }

        public ColorCorrectionParams withFitMethod(CorrectionMethod method) {
            return new ColorCorrectionParams(learned, conventionalAlgorithm, method, degree,
                    maxIterations, randomState, tolerance, samples, plsComponents, hiddenLayers,
                    learningRate, batchSize, patience, dropoutRate, optimizer, batchNorm);
        }
    }

    private final Set<CorrectionStage> enabledStages;
    private final FlatFieldParams flatField;
    private final GammaParams gamma;
    private final ColorCorrectionParams colorCorrection;
    private final boolean saveModel;
    private final boolean computeDeltaE;
    private final boolean detectChartFirst;

    private CorrectionConfig(Builder builder) {
        this.enabledStages = Collections.unmodifiableSet(EnumSet.copyOf(builder.enabledStages));
        this.flatField = builder.flatField;
        this.gamma = builder.gamma;
        this.colorCorrection = builder.colorCorrection;
        this.saveModel = builder.saveModel;
        this.computeDeltaE = builder.computeDeltaE;
        this.detectChartFirst = builder.detectChartFirst;
    }

    // Getters

    public Set<CorrectionStage> getEnabledStages() {
        return enabledStages;
    }

    public boolean isEnabled(CorrectionStage stage) {
        return enabledStages.contains(stage);
    }

    public FlatFieldParams getFlatField() {
        return flatField;
    }

    public GammaParams getGamma() {
        return gamma;
    }

    public ColorCorrectionParams getColorCorrection() {
        return colorCorrection;
    }

    public boolean isSaveModel() {
        return saveModel;
    }

    public boolean isComputeDeltaE() {
        return computeDeltaE;
    }

    public boolean isDetectChartFirst() {
        return detectChartFirst;
    }

    /**
     * Returns the method sent to the server: the learned fit method when learned
     * color correction is selected, otherwise {@link CorrectionMethod#CONVENTIONAL}.
     */
    public CorrectionMethod getEffectiveMethod() {
        return colorCorrection.learned() ? colorCorrection.fitMethod() : CorrectionMethod.CONVENTIONAL;
    }

    /**
     * Creates a builder initialized with this configuration's values.
     */
    public Builder toBuilder() {
        Builder b = new Builder();
        b.enabledStages = EnumSet.copyOf(enabledStages);
        b.flatField = flatField;
        b.gamma = gamma;
        b.colorCorrection = colorCorrection;
        b.saveModel = saveModel;
        b.computeDeltaE = computeDeltaE;
        b.detectChartFirst = detectChartFirst;
        return b;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CorrectionConfig that = (CorrectionConfig) o;
        return saveModel == that.saveModel &&
                computeDeltaE == that.computeDeltaE &&
                detectChartFirst == that.detectChartFirst &&
                enabledStages.equals(that.enabledStages) &&
                flatField.equals(that.flatField) &&
                gamma.equals(that.gamma) &&
                colorCorrection.equals(that.colorCorrection);
    }

    @Override
    public int hashCode() {
        return Objects.hash(enabledStages, flatField, gamma, colorCorrection,
                saveModel, computeDeltaE, detectChartFirst);
    }

    @Override
    public String toString() {
        return String.format("CorrectionConfig{stages=%s, method=%s, saveModel=%s, deltaE=%s, detectFirst=%s}",
                enabledStages, getEffectiveMethod().wireName(), saveModel, computeDeltaE, detectChartFirst);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for CorrectionConfig. All stages are enabled by default.
     */
    public static class Builder {
        private EnumSet<CorrectionStage> enabledStages = EnumSet.allOf(CorrectionStage.class);
        private FlatFieldParams flatField = FlatFieldParams.defaults();
        private GammaParams gamma = GammaParams.defaults();
        private ColorCorrectionParams colorCorrection = ColorCorrectionParams.defaults();
        private boolean saveModel = false;
        private boolean computeDeltaE = true;
        private boolean detectChartFirst = false;

        public Builder stageEnabled(CorrectionStage stage, boolean enabled) {
            if (enabled) {
                enabledStages.add(stage);
            } else {
                enabledStages.remove(stage);
            }
            return this;
        }

        public Builder ffcEnabled(boolean enabled) {
            return stageEnabled(CorrectionStage.FFC, enabled);
        }

        public Builder gcEnabled(boolean enabled) {
            return stageEnabled(CorrectionStage.GC, enabled);
        }

        public Builder wbEnabled(boolean enabled) {
            return stageEnabled(CorrectionStage.WB, enabled);
        }

        public Builder ccEnabled(boolean enabled) {
            return stageEnabled(CorrectionStage.CC, enabled);
        }

        public Builder flatField(FlatFieldParams flatField) {
            this.flatField = Objects.requireNonNull(flatField, "flatField");
            return this;
        }

        public Builder gamma(GammaParams gamma) {
            this.gamma = Objects.requireNonNull(gamma, "gamma");
            return this;
        }

        public Builder colorCorrection(ColorCorrectionParams colorCorrection) {
            this.colorCorrection = Objects.requireNonNull(colorCorrection, "colorCorrection");
            return this;
        }

        /**
         * Selects the color correction method. {@code CONVENTIONAL} switches to the
         * conventional algorithm; any other value selects learned correction with
         * that fit method.
         *
         * @param method the method
         * @return this builder
         */
        public Builder method(CorrectionMethod method) {
            if (method == CorrectionMethod.CONVENTIONAL) {
                this.colorCorrection = colorCorrection.withLearned(false);
            } else {
                this.colorCorrection = colorCorrection.withLearned(true).withFitMethod(method);
            }
            return this;
        }

        /**
         * Asks the server to keep the trained color correction model so it can be
         * applied to other images.
         */
        public Builder saveModel(boolean saveModel) {
            this.saveModel = saveModel;
            return this;
        }

        public Builder computeDeltaE(boolean computeDeltaE) {
            this.computeDeltaE = computeDeltaE;
            return this;
        }

        /**
         * Runs chart detection before the pipeline in single-image runs.
         */
        public Builder detectChartFirst(boolean detectChartFirst) {
            this.detectChartFirst = detectChartFirst;
            return this;
        }

        public CorrectionConfig build() {
            if (enabledStages.isEmpty()) {
                throw new IllegalStateException("At least one correction stage must be enabled");
            }
            return new CorrectionConfig(this);
        }
    }
}
