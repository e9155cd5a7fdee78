package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.model.ChartDetection;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.model.CorrectionStage;
import org.colorcorrection.pipeline.model.ImageArtifact;
import org.colorcorrection.pipeline.model.ImageRef;
import org.colorcorrection.pipeline.model.PipelineResult;
import org.colorcorrection.pipeline.model.StageMetrics;
import org.colorcorrection.pipeline.service.FakePipelineBackend;
import org.colorcorrection.pipeline.service.ImageRegistry;
import org.colorcorrection.pipeline.service.PipelineClient;
import org.colorcorrection.pipeline.service.PipelineException;
import org.colorcorrection.pipeline.service.PreconditionException;
import org.colorcorrection.pipeline.service.RemoteStageException;
import org.colorcorrection.pipeline.service.TransportException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

import static org.colorcorrection.pipeline.service.FakePipelineBackend.uploaded;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SingleRunExecutorTest {

    private FakePipelineBackend backend;
    private ImageRegistry registry;
    private SingleRunExecutor executor;
    private List<ImageRef> images;
    private final CorrectionConfig config = CorrectionConfig.builder().build();

    @BeforeEach
    void setUp() {
        backend = new FakePipelineBackend();
        registry = new ImageRegistry();
        executor = new SingleRunExecutor(backend, registry, SelectionFallback.FIRST_IMAGE);
        images = registry.add(uploaded("a.jpg", "b.jpg", "c.jpg"));
    }

    @Test
    void resultStagesAreInPipelineOrder() throws Exception {
        PipelineResult result = executor.runOne(images.get(0), config);

        assertEquals(List.of(CorrectionStage.FFC, CorrectionStage.GC, CorrectionStage.WB, CorrectionStage.CC),
                new ArrayList<>(result.getStageImages().keySet()));
        assertEquals(List.of(CorrectionStage.FFC, CorrectionStage.GC, CorrectionStage.WB, CorrectionStage.CC),
                new ArrayList<>(result.getStageMetrics().keySet()));
        assertEquals("a_CC", result.getFinalImage().orElseThrow().name());
        assertSame(result, registry.getResults().get(images.get(0)).orElseThrow());
        assertFalse(registry.isRunning());
    }

    @Test
    void concurrentRunIsRejectedAndGateSurvivesFailure() throws Exception {
        AtomicReference<PipelineException> rejected = new AtomicReference<>();
        backend.runHandler = (image, cfg, batch) -> {
            try {
                executor.runOne(images.get(1), config);
            } catch (PipelineException e) {
                rejected.set(e);
            }
            throw new RemoteStageException("WB", "white balance failed", 500);
        };

        RemoteStageException failure = assertThrows(RemoteStageException.class,
                () -> executor.runOne(images.get(0), config));

        assertInstanceOf(PreconditionException.class, rejected.get());
        assertEquals("WB", failure.getStage());
        assertEquals(0, failure.getImageIndex().getAsInt());
        assertFalse(registry.isRunning());
        assertEquals(1, backend.callCount("run-cc"));

        backend.runHandler = (image, cfg, batch) -> FakePipelineBackend.fullRun("c");
        PipelineResult result = executor.runOne(images.get(2), config);
        assertNotNull(result);
        assertEquals(2, backend.callCount("run-cc"));
    }

    @Test
    void rerunDiscardsPreviousResultBeforeTheRemoteCall() throws Exception {
        executor.runOne(images.get(0), config);
        AtomicBoolean presentDuringCall = new AtomicBoolean(true);
        backend.runHandler = (image, cfg, batch) -> {
            presentDuringCall.set(registry.getResults().get(image).isPresent());
            throw new TransportException(image.index(), "connection reset", null);
        };

        assertThrows(TransportException.class, () -> executor.runOne(images.get(0), config));

        assertFalse(presentDuringCall.get());
        assertTrue(registry.getResults().get(images.get(0)).isEmpty());
    }

    @Test
    void failedDetectFirstStillDiscardsPreviousResult() throws Exception {
        executor.runOne(images.get(0), config);
        backend.detectHandler = image -> {
            throw new RemoteStageException("detect-chart", "model not loaded", 500);
        };

        assertThrows(RemoteStageException.class,
                () -> executor.runOne(images.get(0), config.toBuilder().detectChartFirst(true).build()));

        assertTrue(registry.getResults().get(images.get(0)).isEmpty());
        assertFalse(registry.isRunning());
    }

    @Test
    void staleRefIsRejectedBeforeAnyRemoteCall() throws Exception {
        registry.clear();

        assertThrows(PreconditionException.class, () -> executor.runOne(images.get(0), config));
        assertEquals(0, backend.totalCalls());
    }

    @Test
    void selectedImageIsUsed() throws Exception {
        registry.select(images.get(2));

        assertEquals(images.get(2), executor.runSelected(config).getImage());
    }

    @Test
    void firstImageFallbackWithoutSelection() throws Exception {
        assertEquals(images.get(0), executor.runSelected(config).getImage());
    }

    @Test
    void rejectFallbackWithoutSelection() {
        SingleRunExecutor strict = new SingleRunExecutor(backend, registry, SelectionFallback.REJECT);

        PreconditionException e = assertThrows(PreconditionException.class, () -> strict.runSelected(config));
        assertEquals("No image selected", e.getMessage());
        assertEquals(0, backend.totalCalls());
    }

    @Test
    void noImagesLoaded() {
        SingleRunExecutor empty = new SingleRunExecutor(backend, new ImageRegistry(), SelectionFallback.FIRST_IMAGE);

        assertThrows(PreconditionException.class, () -> empty.detectSelected());
    }

    @Test
    void detectionIsRecorded() throws Exception {
        backend.detectHandler = image -> ChartDetection.notDetected("no chart");

        ChartDetection detection = executor.detectChart(images.get(1));

        assertFalse(detection.detected());
        assertFalse(registry.getChartDetected(images.get(1)).orElseThrow());
        assertTrue(registry.getChartDetected(images.get(0)).isEmpty());
    }

    @Test
    void detectFirstRunsDetectionThenPipeline() throws Exception {
        executor.runOne(images.get(0), config.toBuilder().detectChartFirst(true).build());

        assertEquals(List.of("detect-chart", "run-cc"), backend.getCallLog());
    }

    @Test
    void modelIsRecordedWhenSavedWithColorCorrection() throws Exception {
        executor.runOne(images.get(1), config.toBuilder().saveModel(true).build());

        assertTrue(registry.getModelStatus().available());
        assertEquals(images.get(1), registry.getModelStatus().sourceImage());
    }

    @Test
    void noModelWithoutSaveFlag() throws Exception {
        executor.runOne(images.get(1), config);

        assertFalse(registry.getModelStatus().available());
    }

    @Test
    void noModelWhenColorCorrectionDisabled() throws Exception {
        backend.runHandler = (image, cfg, batch) ->
                FakePipelineBackend.run("b", CorrectionStage.FFC, CorrectionStage.GC);

        executor.runOne(images.get(1), config.toBuilder().ccEnabled(false).saveModel(true).build());

        assertFalse(registry.getModelStatus().available());
    }

    @Test
    void unknownOutputNamesAreDropped() {
        PipelineClient.RunResponse response = new PipelineClient.RunResponse(
                List.of(new ImageArtifact("a_WB", "d"), new ImageArtifact("preview", "d")),
                Map.of("gamma", new StageMetrics(1, 1, 1, Double.NaN)), null, null, null, false, null);

        PipelineResult result = SingleRunExecutor.normalize(images.get(0), config, response);

        assertEquals(List.of(CorrectionStage.WB), new ArrayList<>(result.getAvailableStages()));
        assertTrue(result.getStageMetrics().isEmpty());
        assertEquals("", result.getLog());
    }
}
