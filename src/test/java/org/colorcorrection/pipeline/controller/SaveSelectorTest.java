package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.model.BatchMode;
import org.colorcorrection.pipeline.model.BatchSummary;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.model.CorrectionStage;
import org.colorcorrection.pipeline.model.ImageRef;
import org.colorcorrection.pipeline.model.ImageStatus;
import org.colorcorrection.pipeline.model.SaveCandidate;
import org.colorcorrection.pipeline.model.SaveManifest;
import org.colorcorrection.pipeline.service.FakePipelineBackend;
import org.colorcorrection.pipeline.service.ImageRegistry;
import org.colorcorrection.pipeline.service.PipelineClient;
import org.colorcorrection.pipeline.service.PreconditionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

import static org.colorcorrection.pipeline.service.FakePipelineBackend.uploaded;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SaveSelectorTest {

    private FakePipelineBackend backend;
    private ImageRegistry registry;
    private SaveSelector selector;
    private List<ImageRef> images;
    private final AtomicReference<BatchSummary> lastBatch = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        backend = new FakePipelineBackend();
        registry = new ImageRegistry();
        selector = new SaveSelector(backend, registry, () -> Optional.ofNullable(lastBatch.get()));
        images = registry.add(uploaded("leaf.jpg", "bark.jpg", "moss.jpg"));
    }

    private static SaveCandidate candidate(String key, CorrectionStage... stages) {
        return new SaveCandidate(key, key, stages.length == 0
                ? EnumSet.noneOf(CorrectionStage.class) : EnumSet.of(stages[0], stages));
    }

    @Test
    void manifestCountsOnlyStagesEachImageHas() {
        List<SaveCandidate> selected = List.of(
                candidate("a", CorrectionStage.FFC, CorrectionStage.GC, CorrectionStage.WB, CorrectionStage.CC),
                candidate("b", CorrectionStage.FFC, CorrectionStage.CC),
                candidate("c", CorrectionStage.GC));

        SaveManifest manifest = SaveSelector.computeManifest(
                EnumSet.of(CorrectionStage.FFC, CorrectionStage.CC), selected);

        assertEquals(4, manifest.getFileCount());
        assertEquals(Set.of("a", "b"), manifest.getEntries().keySet());
        assertEquals(List.of("a", "b", "c"), manifest.getSelectedImageKeys());
    }

    @Test
    void emptyManifestIsRejectedBeforeAnyRemoteCall() {
        List<SaveCandidate> selected = List.of(candidate("c", CorrectionStage.GC));

        assertThrows(PreconditionException.class,
                () -> selector.saveInteractive(EnumSet.of(CorrectionStage.CC), selected, null));
        assertThrows(PreconditionException.class,
                () -> selector.saveInteractive(EnumSet.noneOf(CorrectionStage.class), selected, null));
        assertEquals(0, backend.totalCalls());
    }

    @Test
    void interactiveCandidatesUseOutputPrefixes() throws Exception {
        SingleRunExecutor executor = new SingleRunExecutor(backend, registry, SelectionFallback.FIRST_IMAGE);
        backend.runHandler = (image, cfg, batch) ->
                FakePipelineBackend.run("leaf", CorrectionStage.WB, CorrectionStage.CC);
        executor.runOne(images.get(0), CorrectionConfig.builder().build());

        List<SaveCandidate> candidates = selector.interactiveCandidates();

        assertEquals(1, candidates.size());
        assertEquals("leaf", candidates.get(0).key());
        assertEquals(EnumSet.of(CorrectionStage.WB, CorrectionStage.CC), candidates.get(0).availableStages());

        PipelineClient.SaveResult result = selector.saveInteractive(
                EnumSet.of(CorrectionStage.CC, CorrectionStage.FFC), candidates, "/out");

        assertEquals(List.of("leaf"), backend.lastSavedNames);
        assertEquals(1, result.imageCount());
    }

    @Test
    void remoteCandidatesGroupOutputsByPrefix() throws Exception {
        backend.availableImages = List.of(
                new PipelineClient.AvailableImage("leaf_FFC", "leaf_FFC.png"),
                new PipelineClient.AvailableImage("leaf_CC", "leaf_CC.png"),
                new PipelineClient.AvailableImage("my_bark_GC", "my_bark_GC.png"),
                new PipelineClient.AvailableImage("thumbnail", "thumbnail.png"));

        List<SaveCandidate> candidates = selector.remoteInteractiveCandidates();

        assertEquals(2, candidates.size());
        assertEquals("leaf", candidates.get(0).key());
        assertEquals(EnumSet.of(CorrectionStage.FFC, CorrectionStage.CC), candidates.get(0).availableStages());
        assertEquals("my_bark", candidates.get(1).key());
    }

    @Test
    void batchCandidatesRequireAFinishedBatch() {
        assertThrows(PreconditionException.class, () -> selector.batchCandidates());
    }

    @Test
    void batchCandidatesAreLimitedToCompletedImages() throws Exception {
        BatchJob job = new BatchJob(BatchMode.PARALLEL_TRAIN, images, 2, null);
        job.recordOutcome(0, ImageStatus.COMPLETED, null);
        job.recordOutcome(1, ImageStatus.FAILED, "fit failed");
        job.recordOutcome(2, ImageStatus.COMPLETED, null);
        lastBatch.set(job.summarize());
        backend.batchImages = List.of(
                new PipelineClient.BatchImage(0, "leaf.jpg", List.of("FFC", "GC", "WB", "CC")),
                new PipelineClient.BatchImage(1, "bark.jpg", List.of("FFC")),
                new PipelineClient.BatchImage(2, "moss.jpg", List.of("FFC", "GC")));

        List<SaveCandidate> candidates = selector.batchCandidates();

        assertEquals(List.of("0", "2"), candidates.stream().map(SaveCandidate::key).toList());

        PipelineClient.SaveResult result = selector.saveBatch(EnumSet.of(CorrectionStage.CC), candidates, null);

        assertEquals(List.of(0), backend.lastSavedIndices);
        assertEquals(1, result.savedCount());
        assertFalse(registry.isRunning());
    }

    @Test
    void saveModelNeedsAModel() throws Exception {
        assertThrows(PreconditionException.class, () -> selector.saveModel("m", null));

        registry.recordModel(images.get(0));
        PipelineClient.SavedModel saved = selector.saveModel(null, "/models");

        assertTrue(saved.name().startsWith("model_"));
        assertEquals("/models", saved.directory());
    }
}
