package org.colorcorrection.pipeline.model;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Normalized outcome of one pipeline run on one image.
 * <p>
 * Instances are immutable. Stage maps are keyed by {@link CorrectionStage} and
 * iterate in FFC, GC, WB, CC order no matter how the server ordered them.
 * A re-run replaces the result instead of merging into it.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public final class PipelineResult {

    private final ImageRef image;
    private final Map<CorrectionStage, ImageArtifact> stageImages;
    private final Map<CorrectionStage, StageMetrics> stageMetrics;
    private final ImageArtifact original;
    private final ImageArtifact scatterPlot;
    private final ImageArtifact difference;
    private final CorrectionMethod method;
    private final boolean modelSaved;
    private final String log;
    private final Instant createdAt;

    private PipelineResult(Builder builder) {
        this.image = Objects.requireNonNull(builder.image, "image");
        this.stageImages = Collections.unmodifiableMap(new EnumMap<>(builder.stageImages));
        this.stageMetrics = Collections.unmodifiableMap(new EnumMap<>(builder.stageMetrics));
        this.original = builder.original;
        this.scatterPlot = builder.scatterPlot;
        this.difference = builder.difference;
        this.method = builder.method;
        this.modelSaved = builder.modelSaved;
        this.log = builder.log == null ? "" : builder.log;
        this.createdAt = builder.createdAt == null ? Instant.now() : builder.createdAt;
    }

    public ImageRef getImage() {
        return image;
    }

    public Map<CorrectionStage, ImageArtifact> getStageImages() {
        return stageImages;
    }

    public Map<CorrectionStage, StageMetrics> getStageMetrics() {
        return stageMetrics;
    }

    public Set<CorrectionStage> getAvailableStages() {
        return stageImages.keySet();
    }

    public ImageArtifact getOriginal() {
        return original;
    }

    public Optional<ImageArtifact> getScatterPlot() {
        return Optional.ofNullable(scatterPlot);
    }

    public Optional<ImageArtifact> getDifference() {
        return Optional.ofNullable(difference);
    }

    public CorrectionMethod getMethod() {
        return method;
    }

    public boolean isModelSaved() {
        return modelSaved;
    }

    public String getLog() {
        return log;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    /**
     * Returns the output of the last stage that ran, preferring CC.
     */
    public Optional<ImageArtifact> getFinalImage() {
        ImageArtifact last = null;
        for (ImageArtifact artifact : stageImages.values()) {
            last = artifact;
        }
        return Optional.ofNullable(last);
    }

    @Override
    public String toString() {
        return String.format("PipelineResult{image=%s, stages=%s, metrics=%s, method=%s, modelSaved=%s}",
                image.label(), stageImages.keySet(), stageMetrics.keySet(), method, modelSaved);
    }

    public static Builder builder(ImageRef image) {
        return new Builder(image);
    }

    /**
     * Builder for PipelineResult.
     */
    public static class Builder {
        private final ImageRef image;
        private final Map<CorrectionStage, ImageArtifact> stageImages = new EnumMap<>(CorrectionStage.class);
        private final Map<CorrectionStage, StageMetrics> stageMetrics = new EnumMap<>(CorrectionStage.class);
        private ImageArtifact original;
        private ImageArtifact scatterPlot;
        private ImageArtifact difference;
        private CorrectionMethod method;
        private boolean modelSaved;
        private String log;
        private Instant createdAt;

        private Builder(ImageRef image) {
            this.image = image;
        }

        public Builder stageImage(CorrectionStage stage, ImageArtifact artifact) {
            this.stageImages.put(stage, artifact);
            return this;
        }

        public Builder stageMetrics(CorrectionStage stage, StageMetrics metrics) {
            this.stageMetrics.put(stage, metrics);
            return this;
        }

        public Builder original(ImageArtifact original) {
            this.original = original;
            return this;
        }

        public Builder scatterPlot(ImageArtifact scatterPlot) {
            this.scatterPlot = scatterPlot;
            return this;
        }

        public Builder difference(ImageArtifact difference) {
            this.difference = difference;
            return this;
        }

        public Builder method(CorrectionMethod method) {
            this.method = method;
            return this;
        }

        public Builder modelSaved(boolean modelSaved) {
            this.modelSaved = modelSaved;
            return this;
        }

        public Builder log(String log) {
            this.log = log;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public PipelineResult build() {
            return new PipelineResult(this);
        }
    }
}
