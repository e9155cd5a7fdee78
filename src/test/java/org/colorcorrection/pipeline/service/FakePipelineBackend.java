package org.colorcorrection.pipeline.service;

import org.colorcorrection.pipeline.model.ChartDetection;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.model.CorrectionStage;
import org.colorcorrection.pipeline.model.ImageArtifact;
import org.colorcorrection.pipeline.model.ImageRef;
import org.colorcorrection.pipeline.model.StageMetrics;

import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory {@link PipelineBackend} for orchestration tests.
 * <p>
 * Every call is counted by operation name. Behaviour is scripted through the
 * public fields and handlers.
 */
public class FakePipelineBackend implements PipelineBackend {

    @FunctionalInterface
    public interface RunHandler {
        PipelineClient.RunResponse run(ImageRef image, CorrectionConfig config, boolean batchMode)
                throws PipelineException;
    }

    @FunctionalInterface
    public interface DetectHandler {
        ChartDetection detect(ImageRef image) throws PipelineException;
    }

    @FunctionalInterface
    public interface ApplyHandler {
        PipelineClient.ApplyResult apply(List<ImageRef> targets, CorrectionConfig config, int workers)
                throws PipelineException;
    }

    private final Map<String, AtomicInteger> calls = new ConcurrentHashMap<>();
    private final List<String> callLog = Collections.synchronizedList(new ArrayList<>());

    public volatile boolean healthy = true;
    public volatile boolean modelAvailable = false;
    public volatile DetectHandler detectHandler = image -> detected();
    public volatile RunHandler runHandler = (image, config, batchMode) -> fullRun(stem(image.filename()));
    public volatile ApplyHandler applyHandler = (targets, config, workers) ->
            new PipelineClient.ApplyResult(targets.size(), 0, targets.size(), null);
    public final Deque<PipelineClient.BatchProgress> progressScript = new ArrayDeque<>();
    /** Thrown by the next polls, one per call, before the progress script is consulted. */
    public final Deque<PipelineException> pollFailures = new ArrayDeque<>();
    public volatile PipelineException batchStartFailure;
    public volatile List<PipelineClient.BatchImage> batchImages = new ArrayList<>();
    public volatile List<PipelineClient.AvailableImage> availableImages = new ArrayList<>();

    public volatile List<ImageRef> lastBatchTargets;
    public volatile List<String> lastSavedNames;
    public volatile List<Integer> lastSavedIndices;
    public volatile Set<CorrectionStage> lastSavedStages;
    public volatile CorrectionConfig lastRunConfig;

    private PipelineClient.BatchProgress lastProgress;

    private void record(String operation) {
        calls.computeIfAbsent(operation, k -> new AtomicInteger()).incrementAndGet();
        callLog.add(operation);
    }

    public int callCount(String operation) {
        AtomicInteger count = calls.get(operation);
        return count == null ? 0 : count.get();
    }

    public int totalCalls() {
        return callLog.size();
    }

    public List<String> getCallLog() {
        synchronized (callLog) {
            return new ArrayList<>(callLog);
        }
    }

    // ==================== Canned responses ====================

    public static String stem(String filename) {
        int dot = filename.lastIndexOf('.');
        return dot > 0 ? filename.substring(0, dot) : filename;
    }

    public static ChartDetection detected() {
        return new ChartDetection(true, 0.95, "Chart detected", null, List.of());
    }

    public static PipelineClient.RunResponse fullRun(String prefix) {
        return run(prefix, CorrectionStage.values());
    }

    /**
     * A run response with outputs and metrics for the given stages, listed in
     * reverse so that consumers cannot rely on server order.
     */
    public static PipelineClient.RunResponse run(String prefix, CorrectionStage... stages) {
        List<ImageArtifact> images = new ArrayList<>();
        Map<String, StageMetrics> metrics = new LinkedHashMap<>();
        for (int i = stages.length - 1; i >= 0; i--) {
            CorrectionStage stage = stages[i];
            images.add(new ImageArtifact(prefix + "_" + stage.name(), "data:image/png;base64,AAAA"));
            double mean = 4.0 - stage.ordinal();
            metrics.put(stage.name(), new StageMetrics(mean, mean - 0.5, mean + 0.5, 0.25));
        }
        return new PipelineClient.RunResponse(images, metrics, new ImageArtifact(prefix + "_original", "data:o"),
                null, null, false, "ok");
    }

    public static List<PipelineClient.UploadedImage> uploaded(String... filenames) {
        List<PipelineClient.UploadedImage> list = new ArrayList<>();
        for (String name : filenames) {
            list.add(new PipelineClient.UploadedImage(name, "/uploads/" + name));
        }
        return list;
    }

    public static PipelineClient.BatchProgress progress(boolean active, int total, int completed, int failed,
                                                        PipelineClient.ImageProgress... perImage) {
        return new PipelineClient.BatchProgress(active, total, completed, failed, List.of(perImage));
    }

    public static PipelineClient.ImageProgress entry(int index, String status, String error) {
        return new PipelineClient.ImageProgress(index, "img" + index + ".jpg", status, error);
    }

    // ==================== PipelineBackend ====================

    @Override
    public PipelineClient.HealthStatus checkHealth() {
        record("health");
        return new PipelineClient.HealthStatus(healthy, healthy ? "test" : null);
    }

    @Override
    public List<PipelineClient.UploadedImage> uploadImages(List<Path> files) {
        record("upload-images");
        List<PipelineClient.UploadedImage> list = new ArrayList<>();
        for (Path file : files) {
            list.add(new PipelineClient.UploadedImage(file.getFileName().toString(), file.toString()));
        }
        return list;
    }

    @Override
    public PipelineClient.UploadedImage uploadWhiteImage(Path file) {
        record("upload-white-image");
        return new PipelineClient.UploadedImage(file.getFileName().toString(), file.toString());
    }

    @Override
    public void clearSession() {
        record("clear-session");
        modelAvailable = false;
    }

    @Override
    public ChartDetection detectChart(ImageRef image) throws PipelineException {
        record("detect-chart");
        return detectHandler.detect(image);
    }

    @Override
    public PipelineClient.RunResponse runPipeline(ImageRef image, CorrectionConfig config, boolean batchMode)
            throws PipelineException {
        record("run-cc");
        lastRunConfig = config;
        PipelineClient.RunResponse response = runHandler.run(image, config, batchMode);
        if (config.isSaveModel() && config.isEnabled(CorrectionStage.CC)) {
            modelAvailable = true;
        }
        return response;
    }

    @Override
    public boolean checkModelAvailable() {
        record("check-model");
        return modelAvailable;
    }

    @Override
    public PipelineClient.ApplyResult applyModel(List<ImageRef> targets, CorrectionConfig config, int workers)
            throws PipelineException {
        record("apply-cc");
        return applyHandler.apply(targets, config, workers);
    }

    @Override
    public PipelineClient.BatchStart runPipelineBatch(List<ImageRef> targets, CorrectionConfig config, int workers)
            throws PipelineException {
        record("run-cc-parallel");
        if (batchStartFailure != null) {
            throw batchStartFailure;
        }
        lastBatchTargets = List.copyOf(targets);
        return new PipelineClient.BatchStart("batch-1", targets.size(), workers);
    }

    @Override
    public synchronized PipelineClient.BatchProgress pollProgress() throws PipelineException {
        record("poll-progress");
        if (!pollFailures.isEmpty()) {
            throw pollFailures.poll();
        }
        if (!progressScript.isEmpty()) {
            lastProgress = progressScript.poll();
        }
        return lastProgress;
    }

    @Override
    public List<PipelineClient.AvailableImage> listAvailableImages() {
        record("available-images");
        return availableImages;
    }

    @Override
    public List<PipelineClient.BatchImage> listBatchImages() {
        record("batch-images-list");
        return batchImages;
    }

    @Override
    public PipelineClient.SaveResult saveImages(Set<CorrectionStage> stages, List<String> imageNames,
                                                String directory) {
        record("save-images");
        lastSavedStages = stages;
        lastSavedNames = List.copyOf(imageNames);
        return new PipelineClient.SaveResult(stages.size() * imageNames.size(), imageNames.size(),
                directory == null ? "/results" : directory, List.of());
    }

    @Override
    public PipelineClient.SaveResult saveBatchImages(Set<CorrectionStage> stages, List<Integer> imageIndices,
                                                     String directory) {
        record("save-batch-images");
        lastSavedStages = stages;
        lastSavedIndices = List.copyOf(imageIndices);
        return new PipelineClient.SaveResult(stages.size() * imageIndices.size(), imageIndices.size(),
                directory == null ? "/results" : directory, List.of());
    }

    @Override
    public PipelineClient.SavedModel saveModel(String name, String folder) {
        record("save-model");
        String dir = folder == null ? "/models" : folder;
        return new PipelineClient.SavedModel(dir + "/" + name + ".pkl", name, dir);
    }
}
