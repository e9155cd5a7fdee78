package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.model.BatchSummary;
import org.colorcorrection.pipeline.model.CorrectionStage;
import org.colorcorrection.pipeline.model.ImageArtifact;
import org.colorcorrection.pipeline.model.ImageOutcome;
import org.colorcorrection.pipeline.model.PipelineResult;
import org.colorcorrection.pipeline.model.SaveCandidate;
import org.colorcorrection.pipeline.model.SaveManifest;
import org.colorcorrection.pipeline.service.ImageRegistry;
import org.colorcorrection.pipeline.service.PipelineBackend;
import org.colorcorrection.pipeline.service.PipelineClient;
import org.colorcorrection.pipeline.service.PipelineException;
import org.colorcorrection.pipeline.service.PreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Works out what a save request will write and sends it.
 * <p>
 * Interactive results are keyed by the name prefix of their outputs, which is how
 * the server matches them. Batch results are keyed by image index and are limited
 * to images the last batch's ledger marks as completed.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class SaveSelector {

    private static final Logger logger = LoggerFactory.getLogger(SaveSelector.class);
    private static final DateTimeFormatter MODEL_NAME_FORMAT = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss");

    private final PipelineBackend backend;
    private final ImageRegistry registry;
    private final Supplier<Optional<BatchSummary>> lastBatch;

    public SaveSelector(PipelineBackend backend, ImageRegistry registry,
                        Supplier<Optional<BatchSummary>> lastBatch) {
        this.backend = backend;
        this.registry = registry;
        this.lastBatch = lastBatch;
    }

    /**
     * Computes a manifest: for each selected image, the selected stages it actually has.
     * Images with none of the selected stages get no entry.
     *
     * @param selectedStages stages to save
     * @param selectedImages images to save
     * @return the manifest
     */
    public static SaveManifest computeManifest(Set<CorrectionStage> selectedStages,
                                               List<SaveCandidate> selectedImages) {
        List<String> keys = new ArrayList<>();
        Map<String, Set<CorrectionStage>> entries = new LinkedHashMap<>();
        for (SaveCandidate candidate : selectedImages) {
            keys.add(candidate.key());
            Set<CorrectionStage> stages = EnumSet.noneOf(CorrectionStage.class);
            for (CorrectionStage stage : selectedStages) {
                if (candidate.isAvailable(stage)) {
                    stages.add(stage);
                }
            }
            if (!stages.isEmpty()) {
                entries.put(candidate.key(), stages);
            }
        }
        return new SaveManifest(selectedStages, keys, entries);
    }

    // ==================== Candidates ====================

    /**
     * Candidates from interactive runs, built from the client's result store.
     */
    public List<SaveCandidate> interactiveCandidates() {
        List<SaveCandidate> candidates = new ArrayList<>();
        for (PipelineResult result : registry.getResults().getAll()) {
            if (result.getAvailableStages().isEmpty()) {
                continue;
            }
            candidates.add(new SaveCandidate(outputPrefix(result), result.getImage().label(),
                    result.getAvailableStages()));
        }
        return candidates;
    }

    /**
     * Candidates from the server's list of corrected images. Covers results produced
     * before this client connected.
     */
    public List<SaveCandidate> remoteInteractiveCandidates() throws PipelineException {
        Map<String, Set<CorrectionStage>> byPrefix = new LinkedHashMap<>();
        for (PipelineClient.AvailableImage image : backend.listAvailableImages()) {
            String name = image.name();
            Optional<CorrectionStage> stage = CorrectionStage.fromKey(name);
            if (stage.isEmpty()) {
                continue;
            }
            String prefix = name.substring(0, name.lastIndexOf('_'));
            byPrefix.computeIfAbsent(prefix, k -> EnumSet.noneOf(CorrectionStage.class)).add(stage.get());
        }
        List<SaveCandidate> candidates = new ArrayList<>();
        byPrefix.forEach((prefix, stages) -> candidates.add(new SaveCandidate(prefix, prefix, stages)));
        return candidates;
    }

    /**
     * Candidates from the last batch: images the server lists as batch processed
     * that the ledger also marks completed, each with its own available stages.
     *
     * @throws PreconditionException if no batch has finished
     */
    public List<SaveCandidate> batchCandidates() throws PipelineException {
        BatchSummary summary = lastBatch.get().orElseThrow(() ->
                new PreconditionException("save-batch-images", "No finished batch to save"));
        Set<Integer> completed = new HashSet<>();
        for (ImageOutcome outcome : summary.completedOutcomes()) {
            completed.add(outcome.imageIndex());
        }

        // the server appends on every batch; the latest entry per image wins
        Map<Integer, SaveCandidate> candidates = new LinkedHashMap<>();
        for (PipelineClient.BatchImage image : backend.listBatchImages()) {
            if (!completed.contains(image.imageIndex())) {
                logger.debug("Batch image {} is not completed in the ledger, not offered for saving",
                        image.imageIndex());
                continue;
            }
            Set<CorrectionStage> stages = EnumSet.noneOf(CorrectionStage.class);
            for (String step : image.availableSteps()) {
                CorrectionStage.fromKey(step).ifPresent(stages::add);
            }
            candidates.put(image.imageIndex(), new SaveCandidate(String.valueOf(image.imageIndex()),
                    "[" + (image.imageIndex() + 1) + "] " + image.filename(), stages));
        }
        return new ArrayList<>(candidates.values());
    }

    // ==================== Saving ====================

    /**
     * Saves outputs of interactive runs.
     *
     * @param stages    stages to save
     * @param images    images to save, from {@link #interactiveCandidates()}
     * @param directory target directory on the server, or null for its default
     * @return what the server wrote
     * @throws PreconditionException if the manifest is empty, before any remote call
     */
    public PipelineClient.SaveResult saveInteractive(Set<CorrectionStage> stages, List<SaveCandidate> images,
                                                     String directory) throws PipelineException {
        SaveManifest manifest = requireFiles(computeManifest(stages, images), "save-images");
        try (ImageRegistry.RunningLease lease = registry.acquire("save-images")) {
            logger.info("Saving {}", manifest);
            PipelineClient.SaveResult result = backend.saveImages(manifest.getSelectedStages(),
                    new ArrayList<>(manifest.getEntries().keySet()), directory);
            logSaveResult(result, manifest);
            return result;
        }
    }

    /**
     * Saves outputs of batch-processed images.
     *
     * @param stages    stages to save
     * @param images    images to save, from {@link #batchCandidates()}
     * @param directory target directory on the server, or null for its default
     * @return what the server wrote
     * @throws PreconditionException if the manifest is empty, before any remote call
     */
    public PipelineClient.SaveResult saveBatch(Set<CorrectionStage> stages, List<SaveCandidate> images,
                                               String directory) throws PipelineException {
        SaveManifest manifest = requireFiles(computeManifest(stages, images), "save-batch-images");
        List<Integer> indices = new ArrayList<>();
        for (String key : manifest.getEntries().keySet()) {
            try {
                indices.add(Integer.parseInt(key));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Batch save keys must be image indices, got '" + key + "'", e);
            }
        }
        try (ImageRegistry.RunningLease lease = registry.acquire("save-batch-images")) {
            logger.info("Saving batch {}", manifest);
            PipelineClient.SaveResult result = backend.saveBatchImages(manifest.getSelectedStages(),
                    indices, directory);
            logSaveResult(result, manifest);
            return result;
        }
    }

    /**
     * Persists the current model on the server.
     *
     * @param name   model name, or null for a timestamped default
     * @param folder target folder, or null for the server default
     * @return where the model was written
     * @throws PreconditionException if no model is available
     */
    public PipelineClient.SavedModel saveModel(String name, String folder) throws PipelineException {
        if (!registry.getModelStatus().available()) {
            throw new PreconditionException("save-model", "No trained model to save");
        }
        String modelName = name == null || name.isBlank()
                ? "model_" + LocalDateTime.now().format(MODEL_NAME_FORMAT) : name;
        try (ImageRegistry.RunningLease lease = registry.acquire("save-model")) {
            return backend.saveModel(modelName, folder);
        }
    }

    private static SaveManifest requireFiles(SaveManifest manifest, String operation) throws PreconditionException {
        if (manifest.getSelectedStages().isEmpty()) {
            throw new PreconditionException(operation, "Select at least one stage to save");
        }
        if (manifest.isEmpty()) {
            throw new PreconditionException(operation, "Nothing to save: no selected image has a selected stage");
        }
        return manifest;
    }

    private static void logSaveResult(PipelineClient.SaveResult result, SaveManifest manifest) {
        logger.info("Saved {} of {} file(s) to {}", result.savedCount(), manifest.getFileCount(), result.directory());
        if (!result.failedFiles().isEmpty()) {
            logger.warn("Failed to save: {}", result.failedFiles());
        }
    }

    /**
     * Name prefix shared by a result's outputs, e.g. {@code "photo"} for
     * {@code "photo_FFC"} and {@code "photo_CC"}.
     */
    static String outputPrefix(PipelineResult result) {
        for (ImageArtifact artifact : result.getStageImages().values()) {
            String name = artifact.name();
            int underscore = name.lastIndexOf('_');
            if (underscore > 0) {
                return name.substring(0, underscore);
            }
        }
        String filename = result.getImage().filename();
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }
}
