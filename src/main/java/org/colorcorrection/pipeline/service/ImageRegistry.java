package org.colorcorrection.pipeline.service;

import org.colorcorrection.pipeline.model.ImageRef;
import org.colorcorrection.pipeline.model.ModelStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Client-side view of the server session: the loaded images, the explicit
 * selection, the single running gate, the current model status, per-image chart
 * detection flags and the latest per-image results.
 * <p>
 * Only one remote operation that touches the trained model or the session may be
 * in flight at a time. Callers take the gate with {@link #acquire(String)} in a
 * try-with-resources block so that every exit path releases it. Acquisition never
 * blocks: a second caller is rejected with a {@link PreconditionException}.
 * <p>
 * {@link #clear()} starts a new generation. Refs created before it are rejected by
 * every method that takes a ref.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class ImageRegistry {

    private static final Logger logger = LoggerFactory.getLogger(ImageRegistry.class);

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile String runningOperation;

    private final List<ImageRef> images = new ArrayList<>();
    private final Map<Integer, Boolean> chartDetected = new HashMap<>();
    private final ResultStore results = new ResultStore();
    private long generation = 1;
    private ImageRef selected;
    private ModelStatus modelStatus = ModelStatus.NONE;
    private PipelineClient.UploadedImage whiteImage;

    // ==================== Images ====================

    /**
     * Registers uploaded images in upload order. Indices continue after the images
     * already registered, matching the server's session list.
     *
     * @param uploaded images as stored by the server
     * @return refs for the new images
     */
    public synchronized List<ImageRef> add(List<PipelineClient.UploadedImage> uploaded) {
        List<ImageRef> added = new ArrayList<>();
        for (PipelineClient.UploadedImage image : uploaded) {
            int index = images.size();
            ImageRef ref = new ImageRef(index, generation + "-" + index,
                    image.filename(), image.path(), generation);
            images.add(ref);
            added.add(ref);
        }
        logger.info("Registered {} image(s), {} total", added.size(), images.size());
        return added;
    }

    /**
     * Forgets all images, the white reference, the selection, the model status,
     * chart flags and results.
     * All existing refs become invalid.
     *
     * @throws PreconditionException if an operation is running
     */
    public synchronized void clear() throws PreconditionException {
        if (running.get()) {
            throw new PreconditionException("clear",
                    "Cannot clear images while '" + runningOperation + "' is running");
        }
        reset();
    }

    /**
     * Clears the registry on behalf of the operation holding the running gate,
     * so that nothing can start between a server-side clear and this one.
     *
     * @param lease the caller's open lease on this registry's gate
     * @throws IllegalStateException if the lease is closed or belongs to another registry
     */
    public synchronized void clear(RunningLease lease) {
        if (!lease.isActiveFor(this)) {
            throw new IllegalStateException("Lease for '" + lease.getOperation() + "' no longer holds the gate");
        }
        reset();
    }

    private void reset() {
        images.clear();
        chartDetected.clear();
        results.clear();
        selected = null;
        modelStatus = ModelStatus.NONE;
        whiteImage = null;
        generation++;
        logger.info("Registry cleared (generation {})", generation);
    }

    public synchronized List<ImageRef> getImages() {
        return List.copyOf(images);
    }

    /**
     * Records the white reference image used by flat-field correction.
     */
    public synchronized void setWhiteImage(PipelineClient.UploadedImage whiteImage) {
        this.whiteImage = whiteImage;
    }

    public synchronized Optional<PipelineClient.UploadedImage> getWhiteImage() {
        return Optional.ofNullable(whiteImage);
    }

    public synchronized int size() {
        return images.size();
    }

    public synchronized boolean isEmpty() {
        return images.isEmpty();
    }

    public synchronized Optional<ImageRef> get(int index) {
        return index >= 0 && index < images.size() ? Optional.of(images.get(index)) : Optional.empty();
    }

    /**
     * Checks that a ref belongs to the current generation.
     *
     * @param ref the ref to check
     * @throws PreconditionException if the ref is stale or unknown
     */
    public synchronized void validate(ImageRef ref) throws PreconditionException {
        if (ref == null) {
            throw new PreconditionException("registry", "No image given");
        }
        if (ref.generation() != generation
                || ref.index() < 0 || ref.index() >= images.size()
                || !images.get(ref.index()).equals(ref)) {
            throw new PreconditionException("registry", ref.index(),
                    "Image " + ref.label() + " is no longer loaded");
        }
    }

    // ==================== Selection ====================

    public synchronized void select(ImageRef ref) throws PreconditionException {
        validate(ref);
        selected = ref;
        logger.debug("Selected {}", ref.label());
    }

    public synchronized void clearSelection() {
        selected = null;
    }

    public synchronized Optional<ImageRef> getSelected() {
        return Optional.ofNullable(selected);
    }

    /**
     * Images that "apply to others" targets by default: all images except the
     * selected one, or all images when nothing is selected.
     */
    public synchronized List<ImageRef> defaultApplyTargets() {
        List<ImageRef> targets = new ArrayList<>();
        for (ImageRef ref : images) {
            if (!ref.equals(selected)) {
                targets.add(ref);
            }
        }
        return targets;
    }

    // ==================== Running Gate ====================

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return name of the running operation, or null when idle
     */
    public String getRunningOperation() {
        return runningOperation;
    }

    /**
     * Sets or clears the running flag directly. Prefer {@link #acquire(String)}.
     *
     * @param value true to take the gate, false to release it
     * @throws PreconditionException if {@code value} is true and the gate is taken
     */
    public void setRunning(boolean value) throws PreconditionException {
        if (value) {
            acquireGate("operation");
        } else {
            release();
        }
    }

    /**
     * Takes the running gate for the duration of a try-with-resources block.
     *
     * @param operation name of the operation, used in log and error messages
     * @return a lease that releases the gate when closed
     * @throws PreconditionException if another operation holds the gate
     */
    public RunningLease acquire(String operation) throws PreconditionException {
        acquireGate(operation);
        return new RunningLease(operation);
    }

    private synchronized void acquireGate(String operation) throws PreconditionException {
        if (!running.compareAndSet(false, true)) {
            String current = runningOperation;
            logger.warn("Rejected '{}': '{}' is already running", operation, current);
            throw new PreconditionException(operation,
                    "Another operation is already running: " + current);
        }
        runningOperation = operation;
        logger.debug("Running gate taken by '{}'", operation);
    }

    private void release() {
        String operation = runningOperation;
        runningOperation = null;
        if (running.compareAndSet(true, false)) {
            logger.debug("Running gate released by '{}'", operation);
        }
    }

    /**
     * Scoped ownership of the running gate.
     */
    public final class RunningLease implements AutoCloseable {

        private final String operation;
        private boolean closed;

        private RunningLease(String operation) {
            this.operation = operation;
        }

        public String getOperation() {
            return operation;
        }

        private boolean isActiveFor(ImageRegistry registry) {
            return !closed && ImageRegistry.this == registry && running.get();
        }

        @Override
        public void close() {
            if (!closed) {
                closed = true;
                release();
            }
        }
    }

    // ==================== Model & Chart State ====================

    public synchronized ModelStatus getModelStatus() {
        return modelStatus;
    }

    /**
     * Records that the server holds a model.
     *
     * @param source image the model was trained on, or null if unknown
     */
    public synchronized void recordModel(ImageRef source) {
        modelStatus = ModelStatus.trainedOn(source);
        logger.info("Model available, trained on {}", source != null ? source.label() : "an unknown image");
    }

    public synchronized void clearModel() {
        if (modelStatus.available()) {
            logger.info("Model status cleared");
        }
        modelStatus = ModelStatus.NONE;
    }

    public synchronized void recordChartDetection(ImageRef ref, boolean detected) {
        chartDetected.put(ref.index(), detected);
    }

    /**
     * @return whether a chart was detected, or empty if detection has not run for the image
     */
    public synchronized Optional<Boolean> getChartDetected(ImageRef ref) {
        return Optional.ofNullable(chartDetected.get(ref.index()));
    }

    public ResultStore getResults() {
        return results;
    }
}
