package org.colorcorrection.pipeline.service;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import okhttp3.*;
import org.colorcorrection.pipeline.model.ChartDetection;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.model.CorrectionStage;
import org.colorcorrection.pipeline.model.ImageArtifact;
import org.colorcorrection.pipeline.model.ImageRef;
import org.colorcorrection.pipeline.model.StageMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;

/**
 * HTTP client for the remote color correction server.
 * <p>
 * Translates each pipeline operation into one HTTP exchange and parses the reply
 * into the records below. It holds no workflow state; sequencing, gating and
 * batch bookkeeping live in the controller layer.
 *
 * <h3>Server Endpoints</h3>
 * <ul>
 *   <li>GET /api/health - Server health check</li>
 *   <li>POST /api/upload-images, /api/upload-white-image - Multipart uploads</li>
 *   <li>POST /api/clear-session - Drop all server-side session state</li>
 *   <li>POST /api/detect-chart - Detect the color chart in one image</li>
 *   <li>POST /api/run-cc - Run the full pipeline on one image</li>
 *   <li>POST /api/run-cc-parallel, GET /api/batch-progress - Parallel batch and its progress</li>
 *   <li>GET /api/check-model, POST /api/apply-cc - Reuse the trained model</li>
 *   <li>GET /api/available-images, /api/batch-images-list - Result listings</li>
 *   <li>POST /api/save-images, /api/save-batch-images, /api/save-model - Persist results</li>
 * </ul>
 * <p>
 * Failures surface as {@link TransportException} when the exchange itself fails and
 * as {@link RemoteStageException} when the server answers with a non-2xx status or
 * {@code "success": false}.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class PipelineClient implements PipelineBackend {

    private static final Logger logger = LoggerFactory.getLogger(PipelineClient.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final MediaType OCTET_STREAM = MediaType.get("application/octet-stream");

    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final Gson gson;

    /**
     * Creates a client with the default timeouts (30 s connect, 300 s read, 60 s write).
     *
     * @param host server hostname
     * @param port server port
     */
    public PipelineClient(String host, int port) {
        this(String.format("http://%s:%d/api", host, port),
                Duration.ofSeconds(30), Duration.ofSeconds(300), Duration.ofSeconds(60));
    }

    /**
     * Creates a client against an explicit API base URL.
     *
     * @param baseUrl        API root, e.g. {@code http://localhost:5000/api}
     * @param connectTimeout connect timeout
     * @param readTimeout    read timeout; single runs train a model and can take minutes
     * @param writeTimeout   write timeout
     */
    public PipelineClient(String baseUrl, Duration connectTimeout, Duration readTimeout, Duration writeTimeout) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;

        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(connectTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .readTimeout(readTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .writeTimeout(writeTimeout.toMillis(), TimeUnit.MILLISECONDS)
                .build();

        this.gson = new GsonBuilder()
                .setPrettyPrinting()
                .create();

        logger.info("PipelineClient initialized with base URL: {}", this.baseUrl);
    }

    public String getBaseUrl() {
        return baseUrl;
    }

    // ==================== Health & Session ====================

    @Override
    public HealthStatus checkHealth() {
        try {
            Request request = new Request.Builder()
                    .url(baseUrl + "/health")
                    .get()
                    .build();

            try (Response response = httpClient.newCall(request).execute()) {
                if (response.isSuccessful() && response.body() != null) {
                    JsonObject json = JsonParser.parseString(response.body().string()).getAsJsonObject();
                    boolean ok = "ok".equals(getString(json, "status", null));
                    return new HealthStatus(ok, getString(json, "version", "unknown"));
                }
            }
        } catch (Exception e) {
            logger.debug("Health check failed: {}", e.getMessage());
        }
        return new HealthStatus(false, null);
    }

    @Override
    public List<UploadedImage> uploadImages(List<Path> files) throws PipelineException {
        if (files.isEmpty()) {
            return List.of();
        }
        MultipartBody.Builder body = new MultipartBody.Builder().setType(MultipartBody.FORM);
        for (Path file : files) {
            body.addFormDataPart("images", file.getFileName().toString(), fileBody(file, "upload-images"));
        }
        Request request = new Request.Builder()
                .url(baseUrl + "/upload-images")
                .post(body.build())
                .build();

        JsonObject json = execute(request, "upload-images", -1);
        List<UploadedImage> uploaded = new ArrayList<>();
        for (JsonElement element : getArray(json, "images")) {
            JsonObject img = element.getAsJsonObject();
            uploaded.add(new UploadedImage(getString(img, "filename", ""), getString(img, "path", null)));
        }
        logger.info("Uploaded {} image(s)", uploaded.size());
        return uploaded;
    }

    @Override
    public UploadedImage uploadWhiteImage(Path file) throws PipelineException {
        RequestBody body = new MultipartBody.Builder()
                .setType(MultipartBody.FORM)
                .addFormDataPart("white_image", file.getFileName().toString(), fileBody(file, "upload-white-image"))
                .build();
        Request request = new Request.Builder()
                .url(baseUrl + "/upload-white-image")
                .post(body)
                .build();

        JsonObject json = execute(request, "upload-white-image", -1);
        JsonObject white = json.has("white_image") && json.get("white_image").isJsonObject()
                ? json.getAsJsonObject("white_image") : json;
        return new UploadedImage(getString(white, "filename", file.getFileName().toString()),
                getString(white, "path", null));
    }

    @Override
    public void clearSession() throws PipelineException {
        postJson("/clear-session", Map.of(), "clear-session", -1);
        logger.info("Server session cleared");
    }

    // ==================== Single Image ====================

    @Override
    public ChartDetection detectChart(ImageRef image) throws PipelineException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("image_index", image.index());
        JsonObject json = postJson("/detect-chart", body, "detect-chart", image.index());

        if (!json.has("detection") || !json.get("detection").isJsonObject()) {
            return ChartDetection.notDetected(getString(json, "message", "No detection in response"));
        }
        JsonObject detection = json.getAsJsonObject("detection");
        List<ChartDetection.ChartPatch> patches = new ArrayList<>();
        for (JsonElement element : getArray(detection, "patch_data")) {
            JsonObject patch = element.getAsJsonObject();
            JsonArray rgbArray = getArray(patch, "rgb");
            double[] rgb = new double[rgbArray.size()];
            for (int i = 0; i < rgb.length; i++) {
                rgb[i] = rgbArray.get(i).getAsDouble();
            }
            patches.add(new ChartDetection.ChartPatch(getInt(patch, "index", patches.size()),
                    getString(patch, "name", ""), rgb));
        }
        return new ChartDetection(
                getBoolean(detection, "detected", false),
                getDouble(detection, "confidence", 0.0),
                getString(detection, "message", ""),
                getArtifact(detection, "visualization", image.filename() + "_chart"),
                patches);
    }

    @Override
    public RunResponse runPipeline(ImageRef image, CorrectionConfig config, boolean batchMode)
            throws PipelineException {
        Map<String, Object> body = buildConfigBody(config);
        body.put("image_index", image.index());
        body.put("is_batch_mode", batchMode);
        body.put("saveCcModel", config.isSaveModel());
        body.put("computeDeltaE", config.isComputeDeltaE());

        JsonObject json = postJson("/run-cc", body, "run-cc", image.index());

        List<ImageArtifact> images = new ArrayList<>();
        for (JsonElement element : getArray(json, "images")) {
            JsonObject img = element.getAsJsonObject();
            images.add(new ImageArtifact(getString(img, "name", ""), getString(img, "data", "")));
        }

        Map<String, StageMetrics> deltaE = new LinkedHashMap<>();
        if (json.has("delta_e_summary") && json.get("delta_e_summary").isJsonObject()) {
            JsonObject summary = json.getAsJsonObject("delta_e_summary");
            for (String key : summary.keySet()) {
                if (!summary.get(key).isJsonObject()) {
                    continue;
                }
                JsonObject m = summary.getAsJsonObject(key);
                double mean = getDouble(m, "DE_mean", Double.NaN);
                deltaE.put(key, new StageMetrics(
                        mean,
                        getDouble(m, "DE_min", mean),
                        getDouble(m, "DE_max", mean),
                        getDouble(m, "DE_std", Double.NaN)));
            }
        }

        return new RunResponse(
                images,
                deltaE,
                getArtifact(json, "original_image", image.filename() + "_original"),
                getArtifact(json, "scatter_plot", image.filename() + "_scatter"),
                getArtifact(json, "diff_image", image.filename() + "_difference"),
                getBoolean(json, "model_saved", false),
                getString(json, "log", ""));
    }

    // ==================== Model Reuse ====================

    @Override
    public boolean checkModelAvailable() throws PipelineException {
        JsonObject json = get("/check-model", "check-model");
        return getBoolean(json, "model_available", false);
    }

    @Override
    public ApplyResult applyModel(List<ImageRef> targets, CorrectionConfig config, int workers)
            throws PipelineException {
        Map<String, Object> body = buildConfigBody(config);
        body.put("image_indices", indicesOf(targets));
        body.put("max_workers", workers);

        JsonObject json = postJson("/apply-cc", body, "apply-cc", -1);
        List<ImageProgress> results = json.has("results") && json.get("results").isJsonArray()
                ? parseImageProgress(json.getAsJsonArray("results"))
                : null;
        return new ApplyResult(
                getInt(json, "processed_count", 0),
                getInt(json, "failed_count", 0),
                getInt(json, "total", targets.size()),
                results);
    }

    // ==================== Parallel Batch ====================

    @Override
    public BatchStart runPipelineBatch(List<ImageRef> targets, CorrectionConfig config, int workers)
            throws PipelineException {
        Map<String, Object> body = buildConfigBody(config);
        body.put("image_indices", indicesOf(targets));
        body.put("max_workers", workers);
        body.put("saveCcModel", config.isSaveModel());
        body.put("computeDeltaE", config.isComputeDeltaE());

        JsonObject json = postJson("/run-cc-parallel", body, "run-cc-parallel", -1);
        BatchStart start = new BatchStart(
                getString(json, "batch_id", ""),
                getInt(json, "total_images", targets.size()),
                getInt(json, "workers", workers));
        logger.info("Parallel batch {} accepted: {} image(s), {} worker(s)",
                start.batchId(), start.totalImages(), start.workers());
        return start;
    }

    @Override
    public BatchProgress pollProgress() throws PipelineException {
        JsonObject json = get("/batch-progress", "poll-progress");
        List<ImageProgress> perImage = json.has("progress") && json.get("progress").isJsonArray()
                ? parseImageProgress(json.getAsJsonArray("progress"))
                : List.of();
        return new BatchProgress(
                getBoolean(json, "active", false),
                getInt(json, "total", 0),
                getInt(json, "completed", 0),
                getInt(json, "failed", 0),
                perImage);
    }

    // ==================== Results & Saving ====================

    @Override
    public List<AvailableImage> listAvailableImages() throws PipelineException {
        JsonObject json = get("/available-images", "available-images");
        List<AvailableImage> images = new ArrayList<>();
        for (JsonElement element : getArray(json, "images")) {
            JsonObject img = element.getAsJsonObject();
            images.add(new AvailableImage(getString(img, "name", ""), getString(img, "filename", "")));
        }
        return images;
    }

    @Override
    public List<BatchImage> listBatchImages() throws PipelineException {
        JsonObject json = get("/batch-images-list", "batch-images-list");
        List<BatchImage> images = new ArrayList<>();
        for (JsonElement element : getArray(json, "images")) {
            JsonObject img = element.getAsJsonObject();
            List<String> steps = new ArrayList<>();
            for (JsonElement step : getArray(img, "available_steps")) {
                steps.add(step.getAsString());
            }
            images.add(new BatchImage(getInt(img, "image_index", 0), getString(img, "filename", "unknown"), steps));
        }
        return images;
    }

    @Override
    public SaveResult saveImages(Set<CorrectionStage> stages, List<String> imageNames, String directory)
            throws PipelineException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("selected_steps", stageNames(stages));
        body.put("selected_images", imageNames);
        if (directory != null && !directory.isBlank()) {
            body.put("directory", directory);
        }
        JsonObject json = postJson("/save-images", body, "save-images", -1);
        return parseSaveResult(json, imageNames.size());
    }

    @Override
    public SaveResult saveBatchImages(Set<CorrectionStage> stages, List<Integer> imageIndices, String directory)
            throws PipelineException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("selected_steps", stageNames(stages));
        body.put("selected_images", imageIndices);
        if (directory != null && !directory.isBlank()) {
            body.put("directory", directory);
        }
        JsonObject json = postJson("/save-batch-images", body, "save-batch-images", -1);
        return parseSaveResult(json, imageIndices.size());
    }

    @Override
    public SavedModel saveModel(String name, String folder) throws PipelineException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("name", name);
        if (folder != null && !folder.isBlank()) {
            body.put("folder", folder);
        }
        JsonObject json = postJson("/save-model", body, "save-model", -1);
        SavedModel saved = new SavedModel(
                getString(json, "path", ""),
                getString(json, "name", name),
                getString(json, "directory", null));
        logger.info("Model saved to: {}", saved.path());
        return saved;
    }

    // ==================== Request Plumbing ====================

    /**
     * Builds the stage flags and per-stage settings shared by run, batch and apply requests.
     */
    private Map<String, Object> buildConfigBody(CorrectionConfig config) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("method", config.getEffectiveMethod().wireName());
        body.put("ffcEnabled", config.isEnabled(CorrectionStage.FFC));
        body.put("gcEnabled", config.isEnabled(CorrectionStage.GC));
        body.put("wbEnabled", config.isEnabled(CorrectionStage.WB));
        body.put("ccEnabled", config.isEnabled(CorrectionStage.CC));

        CorrectionConfig.FlatFieldParams ffc = config.getFlatField();
        Map<String, Object> ffcSettings = new LinkedHashMap<>();
        ffcSettings.put("manual_crop", ffc.manualCrop());
        ffcSettings.put("bins", ffc.bins());
        ffcSettings.put("smooth_window", ffc.smoothWindow());
        ffcSettings.put("degree", ffc.degree());
        ffcSettings.put("fit_method", ffc.fitMethod().wireName());
        ffcSettings.put("interactions", ffc.interactions());
        ffcSettings.put("max_iter", ffc.maxIterations());
        ffcSettings.put("tol", ffc.tolerance());
        ffcSettings.put("verbose", false);
        ffcSettings.put("random_seed", ffc.randomSeed());
        body.put("ffcSettings", ffcSettings);

        Map<String, Object> gcSettings = new LinkedHashMap<>();
        gcSettings.put("max_degree", config.getGamma().maxDegree());
        body.put("gcSettings", gcSettings);

        CorrectionConfig.ColorCorrectionParams cc = config.getColorCorrection();
        Map<String, Object> ccSettings = new LinkedHashMap<>();
        ccSettings.put("cc_method", cc.learned() ? "ours" : "conv");
        ccSettings.put("method", cc.conventionalAlgorithm());
        ccSettings.put("mtd", cc.fitMethod().wireName());
        ccSettings.put("degree", cc.degree());
        ccSettings.put("max_iterations", cc.maxIterations());
        ccSettings.put("random_state", cc.randomState());
        ccSettings.put("tol", cc.tolerance());
        ccSettings.put("verbose", false);
        ccSettings.put("n_samples", cc.samples());
        ccSettings.put("ncomp", cc.plsComponents());
        ccSettings.put("hidden_layers", cc.hiddenLayers());
        ccSettings.put("learning_rate", cc.learningRate());
        ccSettings.put("batch_size", cc.batchSize());
        ccSettings.put("patience", cc.patience());
        ccSettings.put("dropout_rate", cc.dropoutRate());
        ccSettings.put("optim_type", cc.optimizer());
        ccSettings.put("use_batch_norm", cc.batchNorm());
        body.put("ccSettings", ccSettings);
        return body;
    }

    private JsonObject postJson(String path, Map<String, Object> body, String stage, int imageIndex)
            throws PipelineException {
        String json = gson.toJson(body);
        logger.debug("POST {} body: {}", path, json);
        Request request = new Request.Builder()
                .url(baseUrl + path)
                .post(RequestBody.create(json, JSON))
                .build();
        return execute(request, stage, imageIndex);
    }

    private JsonObject get(String path, String stage) throws PipelineException {
        Request request = new Request.Builder()
                .url(baseUrl + path)
                .get()
                .build();
        return execute(request, stage, -1);
    }

    /**
     * Executes a request and returns the parsed JSON body.
     *
     * @throws TransportException   if the call fails or the body is not a JSON object
     * @throws RemoteStageException if the status is not 2xx or the body reports {@code success: false}
     */
    private JsonObject execute(Request request, String stage, int imageIndex) throws PipelineException {
        String text;
        int code;
        try (Response response = httpClient.newCall(request).execute()) {
            code = response.code();
            text = response.body() != null ? response.body().string() : "";
        } catch (IOException e) {
            throw new TransportException(imageIndex,
                    String.format("%s request to %s failed: %s", stage, request.url(), e.getMessage()), e);
        }

        JsonObject json = null;
        try {
            JsonElement parsed = text.isBlank() ? null : JsonParser.parseString(text);
            if (parsed != null && parsed.isJsonObject()) {
                json = parsed.getAsJsonObject();
            }
        } catch (JsonParseException e) {
            logger.debug("Response to {} is not JSON: {}", stage, e.getMessage());
        }

        boolean successful = code >= 200 && code < 300;
        if (!successful || (json != null && !getBoolean(json, "success", true))) {
            String detail = json != null ? getString(json, "error", null) : null;
            if (detail == null) {
                detail = text.isBlank() ? "Unknown error" : text;
            }
            String remoteStage = json != null ? getString(json, "stage", stage) : stage;
            throw new RemoteStageException(remoteStage, imageIndex, detail, code);
        }
        if (json == null) {
            throw new TransportException(imageIndex,
                    String.format("%s returned an unreadable response (HTTP %d)", stage, code), null);
        }
        return json;
    }

    private static RequestBody fileBody(Path file, String stage) throws PipelineException {
        try {
            return RequestBody.create(Files.readAllBytes(file), OCTET_STREAM);
        } catch (IOException e) {
            throw new PipelineException(stage, -1, "Cannot read " + file + ": " + e.getMessage(), e);
        }
    }

    private static List<Integer> indicesOf(List<ImageRef> refs) {
        List<Integer> indices = new ArrayList<>(refs.size());
        for (ImageRef ref : refs) {
            indices.add(ref.index());
        }
        return indices;
    }

    private static List<String> stageNames(Set<CorrectionStage> stages) {
        List<String> names = new ArrayList<>();
        for (CorrectionStage stage : CorrectionStage.values()) {
            if (stages.contains(stage)) {
                names.add(stage.name());
            }
        }
        return names;
    }

    private static List<ImageProgress> parseImageProgress(JsonArray array) {
        List<ImageProgress> list = new ArrayList<>();
        for (JsonElement element : array) {
            JsonObject item = element.getAsJsonObject();
            String status = getString(item, "status", null);
            if (status == null && item.has("success")) {
                status = getBoolean(item, "success", false) ? "completed" : "failed";
            }
            list.add(new ImageProgress(
                    getInt(item, "image_index", -1),
                    getString(item, "filename", ""),
                    status,
                    getString(item, "error", null)));
        }
        return list;
    }

    private static SaveResult parseSaveResult(JsonObject json, int requestedImages) {
        List<String> failedFiles = new ArrayList<>();
        for (JsonElement element : getArray(json, "failed_files")) {
            failedFiles.add(element.isJsonPrimitive() ? element.getAsString() : element.toString());
        }
        return new SaveResult(
                getInt(json, "saved_count", 0),
                getInt(json, "image_count", requestedImages),
                getString(json, "directory", null),
                failedFiles);
    }

    // ==================== JSON Helpers ====================

    private static boolean isPresent(JsonObject obj, String key) {
        return obj.has(key) && !obj.get(key).isJsonNull();
    }

    private static String getString(JsonObject obj, String key, String defaultValue) {
        return isPresent(obj, key) ? obj.get(key).getAsString() : defaultValue;
    }

    private static int getInt(JsonObject obj, String key, int defaultValue) {
        return isPresent(obj, key) ? obj.get(key).getAsInt() : defaultValue;
    }

    private static double getDouble(JsonObject obj, String key, double defaultValue) {
        return isPresent(obj, key) ? obj.get(key).getAsDouble() : defaultValue;
    }

    private static boolean getBoolean(JsonObject obj, String key, boolean defaultValue) {
        return isPresent(obj, key) ? obj.get(key).getAsBoolean() : defaultValue;
    }

    private static JsonArray getArray(JsonObject obj, String key) {
        return isPresent(obj, key) && obj.get(key).isJsonArray() ? obj.getAsJsonArray(key) : new JsonArray();
    }

    private static ImageArtifact getArtifact(JsonObject obj, String key, String name) {
        String data = getString(obj, key, null);
        return data == null || data.isEmpty() ? null : new ImageArtifact(name, data);
    }

    // ==================== Data Classes ====================

    /**
     * Server health information.
     */
    public record HealthStatus(boolean healthy, String version) {}

    /**
     * An image stored on the server after upload.
     */
    public record UploadedImage(String filename, String path) {}

    /**
     * Raw output of a single pipeline run.
     * <p>
     * {@code deltaE} is keyed by the stage name as the server reported it. Optional
     * artifacts are null when the server did not produce them.
     */
    public record RunResponse(
            List<ImageArtifact> images,
            Map<String, StageMetrics> deltaE,
            ImageArtifact original,
            ImageArtifact scatterPlot,
            ImageArtifact difference,
            boolean modelSaved,
            String log
    ) {}

    /**
     * Acknowledgement of a parallel batch submission.
     */
    public record BatchStart(String batchId, int totalImages, int workers) {}

    /**
     * Per-image entry of a batch progress or apply report.
     */
    public record ImageProgress(int imageIndex, String filename, String status, String error) {}

    /**
     * Snapshot of the server's parallel batch state.
     */
    public record BatchProgress(
            boolean active,
            int total,
            int completed,
            int failed,
            List<ImageProgress> perImage
    ) {
        public boolean isFinished() {
            return !active && completed + failed == total;
        }
    }

    /**
     * Result of applying the current model.
     * <p>
     * {@code results} is null when the server only reported counts.
     */
    public record ApplyResult(int processedCount, int failedCount, int total, List<ImageProgress> results) {

        public boolean hasPerImageResults() {
            return results != null;
        }
    }

    /**
     * A corrected image from an interactive run.
     */
    public record AvailableImage(String name, String filename) {}

    /**
     * An image processed in a batch, with the stages stored for it.
     */
    public record BatchImage(int imageIndex, String filename, List<String> availableSteps) {}

    /**
     * Outcome of a save request.
     */
    public record SaveResult(int savedCount, int imageCount, String directory, List<String> failedFiles) {}

    /**
     * Location of a saved model.
     */
    public record SavedModel(String path, String name, String directory) {}
}
