package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.model.BatchMode;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.model.ImageRef;
import org.colorcorrection.pipeline.model.ImageStatus;
import org.colorcorrection.pipeline.service.ImageRegistry;
import org.colorcorrection.pipeline.service.PipelineBackend;
import org.colorcorrection.pipeline.service.PipelineClient;
import org.colorcorrection.pipeline.service.PipelineException;
import org.colorcorrection.pipeline.service.PreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Applies the current model to several images without retraining.
 * <p>
 * The server handles the whole batch in one blocking request that reports no
 * intermediate progress. The request runs on a helper thread while this thread
 * moves the estimated progress toward {@code total - 1}; confirmed progress and
 * the ledger are filled from the response only.
 * <p>
 * When the response carries counts without per-image results, each image the
 * server appended to its batch image list during the request is taken as
 * completed. Outcomes that neither the counts nor the list settle are failed as
 * unattributed rather than guessed.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class ParallelApplyStrategy implements BatchStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ParallelApplyStrategy.class);

    private final PipelineBackend backend;
    private final ImageRegistry registry;
    private final BatchSettings settings;

    public ParallelApplyStrategy(PipelineBackend backend, ImageRegistry registry, BatchSettings settings) {
        this.backend = backend;
        this.registry = registry;
        this.settings = settings;
    }

    @Override
    public BatchMode getMode() {
        return BatchMode.PARALLEL_APPLY;
    }

    @Override
    public void checkPreconditions() throws PreconditionException {
        if (!registry.getModelStatus().available()) {
            throw new PreconditionException("apply-cc",
                    "No trained model available. Run correction with model saving on an image first.");
        }
    }

    @Override
    public void execute(BatchJob job, CorrectionConfig config) throws PipelineException {
        if (!backend.checkModelAvailable()) {
            registry.clearModel();
            throw new PreconditionException("apply-cc", "The server no longer holds a trained model");
        }
        for (ImageRef target : job.getTargets()) {
            job.markRunning(target.index());
        }
        logger.info("Applying model from {} to {} image(s) with {} worker(s)",
                registry.getModelStatus().sourceImage() != null
                        ? registry.getModelStatus().sourceImage().label() : "unknown image",
                job.getTotal(), job.getWorkerCount());

        Map<Integer, Integer> listedBefore = countBatchImages();
        PipelineClient.ApplyResult result = awaitApply(job, config);
        fillLedger(job, result, listedBefore);
        job.confirmProgress(job.getTotal(), String.format("Applied to %d/%d (%d failed)",
                result.processedCount(), job.getTotal(), result.failedCount()));
    }

    private PipelineClient.ApplyResult awaitApply(BatchJob job, CorrectionConfig config) throws PipelineException {
        ExecutorService helper = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "apply-model");
            t.setDaemon(true);
            return t;
        });
        try {
            CompletableFuture<PipelineClient.ApplyResult> future = CompletableFuture.supplyAsync(() -> {
                try {
                    return backend.applyModel(job.getTargets(), config, job.getWorkerCount());
                } catch (PipelineException e) {
                    throw new CompletionException(e);
                }
            }, helper);

            boolean cancelLogged = false;
            while (true) {
                try {
                    return future.get(settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
                } catch (TimeoutException e) {
                    interpolate(job);
                    if (job.isCancelled() && !cancelLogged) {
                        logger.info("Apply request cannot be cancelled once sent, waiting for the server");
                        cancelLogged = true;
                    }
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() instanceof CompletionException && e.getCause().getCause() != null
                            ? e.getCause().getCause() : e.getCause();
                    if (cause instanceof PipelineException pe) {
                        throw pe;
                    }
                    throw new PipelineException("apply-cc", -1, "Apply request failed: " + cause, cause);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new PipelineException("apply-cc", "Interrupted while waiting for the apply request");
                }
            }
        } finally {
            helper.shutdownNow();
        }
    }

    /**
     * Moves the estimate a tenth of the remaining distance, at least one image,
     * never reaching the total.
     */
    static int nextEstimate(int current, int total) {
        int increment = Math.max(1, (total - current) / 10);
        return Math.min(total - 1, current + increment);
    }

    private void interpolate(BatchJob job) {
        int current = job.getEstimatedProgress().current();
        int next = nextEstimate(current, job.getTotal());
        if (next > current) {
            job.estimateProgress(next, String.format("Applying model (~%d/%d)", next, job.getTotal()));
        }
    }

    private void fillLedger(BatchJob job, PipelineClient.ApplyResult result, Map<Integer, Integer> listedBefore) {
        if (result.hasPerImageResults()) {
            for (PipelineClient.ImageProgress entry : result.results()) {
                ImageStatus status = ImageStatus.fromWireName(entry.status());
                if (status.isTerminal()) {
                    job.recordOutcome(entry.imageIndex(), status, status == ImageStatus.FAILED
                            ? (entry.error() != null ? entry.error() : "failed on remote") : null);
                }
            }
        } else {
            attributeCounts(job, result, listedBefore);
        }
        int missing = job.failRemaining("not processed by remote");
        if (missing > 0) {
            logger.warn("{} image(s) were not processed by the server", missing);
        }
    }

    /**
     * Turns a counts-only response into per-image outcomes.
     */
    private void attributeCounts(BatchJob job, PipelineClient.ApplyResult result,
                                 Map<Integer, Integer> listedBefore) {
        List<ImageRef> targets = job.getTargets();
        int processed = result.processedCount();
        int failed = result.failedCount();

        if (failed == 0 && processed == targets.size()) {
            recordAll(job, ImageStatus.COMPLETED, null);
            return;
        }
        if (processed == 0) {
            recordAll(job, ImageStatus.FAILED, "reported failed by remote");
            return;
        }

        Set<Integer> added = listedBefore == null ? null : newlyListed(listedBefore);
        if (added != null) {
            Set<Integer> completed = new HashSet<>();
            for (ImageRef target : targets) {
                if (added.contains(target.index())) {
                    completed.add(target.index());
                }
            }
            if (completed.size() == processed) {
                for (ImageRef target : targets) {
                    if (completed.contains(target.index())) {
                        job.recordOutcome(target.index(), ImageStatus.COMPLETED, null);
                    } else {
                        job.recordOutcome(target.index(), ImageStatus.FAILED, "reported failed by remote");
                    }
                }
                return;
            }
            logger.warn("Server reported {} processed but listed {} new batch image(s)", processed, completed.size());
        }
        logger.warn("Cannot tell which images succeeded ({} processed, {} failed); failing all as unattributed",
                processed, failed);
        recordAll(job, ImageStatus.FAILED, String.format(
                "outcome unattributed: server reported %d processed, %d failed", processed, failed));
    }

    private static void recordAll(BatchJob job, ImageStatus status, String detail) {
        for (ImageRef target : job.getTargets()) {
            job.recordOutcome(target.index(), status, detail);
        }
    }

    /**
     * Counts the entries per image index in the server's batch image list.
     *
     * @return the counts, or null if the list could not be read
     */
    private Map<Integer, Integer> countBatchImages() {
        try {
            Map<Integer, Integer> counts = new HashMap<>();
            for (PipelineClient.BatchImage image : backend.listBatchImages()) {
                counts.merge(image.imageIndex(), 1, Integer::sum);
            }
            return counts;
        } catch (PipelineException e) {
            logger.warn("Could not read the batch image list: {}", e.getMessage());
            return null;
        }
    }

    /**
     * @return indices with more list entries than before the request, or null if
     *         the list could not be read
     */
    private Set<Integer> newlyListed(Map<Integer, Integer> before) {
        Map<Integer, Integer> after = countBatchImages();
        if (after == null) {
            return null;
        }
        Set<Integer> added = new HashSet<>();
        for (Map.Entry<Integer, Integer> entry : after.entrySet()) {
            if (entry.getValue() > before.getOrDefault(entry.getKey(), 0)) {
                added.add(entry.getKey());
            }
        }
        return added;
    }
}
