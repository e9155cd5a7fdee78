package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.model.BatchMode;
import org.colorcorrection.pipeline.model.BatchSummary;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.model.ImageRef;
import org.colorcorrection.pipeline.service.ImageRegistry;
import org.colorcorrection.pipeline.service.PipelineBackend;
import org.colorcorrection.pipeline.service.PipelineException;
import org.colorcorrection.pipeline.service.PreconditionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Runs batches over several images with one of three strategies:
 * <ul>
 *   <li>{@link SequentialTrainStrategy} - detect, train and correct image by image</li>
 *   <li>{@link ParallelTrainStrategy} - the same on parallel server workers, polled</li>
 *   <li>{@link ParallelApplyStrategy} - reuse the current model without retraining</li>
 * </ul>
 * Every batch holds the registry's running gate from start to finish. A
 * {@link org.colorcorrection.pipeline.service.TransportException} aborts the batch:
 * the images not yet finished are failed and the exception is rethrown. The
 * finished job stays readable through {@link #getCurrentJob()} for a grace period,
 * and the last summary stays available until the next batch.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class BatchCoordinator implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(BatchCoordinator.class);

    private final ImageRegistry registry;
    private final BatchSettings settings;
    private final Map<BatchMode, BatchStrategy> strategies = new EnumMap<>(BatchMode.class);
    private final AtomicReference<BatchJob> currentJob = new AtomicReference<>();
    private final AtomicReference<BatchSummary> lastSummary = new AtomicReference<>();
    private final ScheduledExecutorService resetScheduler;

    public BatchCoordinator(PipelineBackend backend, ImageRegistry registry,
                            SingleRunExecutor executor, BatchSettings settings) {
        this.registry = registry;
        this.settings = settings;
        register(new SequentialTrainStrategy(executor));
        register(new ParallelTrainStrategy(backend, settings));
        register(new ParallelApplyStrategy(backend, registry, settings));
        this.resetScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "batch-job-reset");
            t.setDaemon(true);
            return t;
        });
    }

    private void register(BatchStrategy strategy) {
        strategies.put(strategy.getMode(), strategy);
    }

    /**
     * Processes every loaded image, training a model per image. Uses the sequential
     * strategy below the parallel threshold and the parallel one from it on.
     *
     * @param config   run configuration
     * @param listener progress listener, may be null
     * @return the batch summary
     * @throws PipelineException if the batch is rejected or aborted
     */
    public BatchSummary processAll(CorrectionConfig config, BatchListener listener) throws PipelineException {
        List<ImageRef> targets = registry.getImages();
        BatchMode mode = targets.size() < settings.parallelThreshold()
                ? BatchMode.SEQUENTIAL_TRAIN : BatchMode.PARALLEL_TRAIN;
        logger.info("Processing all {} image(s) using {}", targets.size(), mode);
        return run(mode, targets, config, settings.defaultWorkers(), listener);
    }

    /**
     * Applies the current model to the default targets: every image except the
     * selected one.
     */
    public BatchSummary applyToOthers(CorrectionConfig config, BatchListener listener) throws PipelineException {
        return applyToOthers(registry.defaultApplyTargets(), config, settings.defaultWorkers(), listener);
    }

    /**
     * Applies the current model to the given images.
     *
     * @param targets  images to correct
     * @param config   run configuration
     * @param workers  server worker count, 1 to {@value BatchSettings#MAX_WORKERS}
     * @param listener progress listener, may be null
     * @return the batch summary
     * @throws PreconditionException if no model is available, before any remote call
     * @throws PipelineException     if the batch fails
     */
    public BatchSummary applyToOthers(List<ImageRef> targets, CorrectionConfig config, int workers,
                                      BatchListener listener) throws PipelineException {
        return run(BatchMode.PARALLEL_APPLY, targets, config, workers, listener);
    }

    /**
     * Runs a batch with an explicit strategy.
     *
     * @param mode     strategy to use
     * @param targets  images to process, in processing order
     * @param config   run configuration
     * @param workers  server worker count, 1 to {@value BatchSettings#MAX_WORKERS}
     * @param listener progress listener, may be null
     * @return the batch summary, outcomes sorted by image index
     * @throws IllegalArgumentException if {@code workers} is out of range
     * @throws PreconditionException    if the batch cannot start
     * @throws PipelineException        if the batch is aborted
     */
    public BatchSummary run(BatchMode mode, List<ImageRef> targets, CorrectionConfig config, int workers,
                            BatchListener listener) throws PipelineException {
        BatchSettings.checkWorkerCount(workers);
        String operation = "batch-" + mode.name().toLowerCase(Locale.ROOT);
        if (targets.isEmpty()) {
            throw new PreconditionException(operation, "No images to process");
        }
        for (ImageRef target : targets) {
            registry.validate(target);
        }
        BatchStrategy strategy = strategies.get(mode);
        strategy.checkPreconditions();

        try (ImageRegistry.RunningLease lease = registry.acquire(operation)) {
            BatchListener effective = listener == null ? BatchListener.NONE : listener;
            BatchJob job = new BatchJob(mode, targets, workers, effective);
            currentJob.set(job);
            lastSummary.set(null);
            logger.info("Starting {} batch: {} image(s), {} worker(s)", mode, targets.size(), workers);

            try {
                strategy.execute(job, config);
            } catch (PipelineException e) {
                int aborted = job.failRemaining("aborted: " + e.getMessage());
                logger.error("{} batch aborted at stage {} ({} image(s) not processed): {}",
                        mode, e.getStage(), aborted, e.getMessage());
                throw e;
            } catch (RuntimeException e) {
                int aborted = job.failRemaining("aborted: " + e);
                logger.error("{} batch failed unexpectedly ({} image(s) not processed)", mode, aborted, e);
                throw e;
            } finally {
                finish(job);
            }

            BatchSummary summary = lastSummary.get();
            logger.info("{} batch finished in {} ms: {} succeeded, {} failed, {} skipped{}",
                    mode, summary.duration().toMillis(), summary.succeeded(), summary.failed(),
                    summary.skipped(), summary.abandoned() ? " (abandoned)" : "");
            job.notifyFinished(summary);
            return summary;
        }
    }

    /**
     * Closes the ledger, publishes the summary and schedules the job reset. Runs on
     * every exit from a batch.
     */
    private void finish(BatchJob job) {
        try {
            int open = job.failRemaining("no final status");
            if (open > 0) {
                logger.warn("{} image(s) were left without a final status", open);
            }
            lastSummary.set(job.summarize());
        } finally {
            scheduleReset(job);
        }
    }

    /**
     * Requests cancellation of the running batch, if any.
     *
     * @return true if a running batch was asked to stop
     */
    public boolean cancel() {
        BatchJob job = currentJob.get();
        if (job == null || !registry.isRunning()) {
            return false;
        }
        job.cancel();
        return true;
    }

    /**
     * @return the running job, or the last finished job until its grace period ends
     */
    public Optional<BatchJob> getCurrentJob() {
        return Optional.ofNullable(currentJob.get());
    }

    /**
     * @return the summary of the last finished batch, kept until the next batch starts
     */
    public Optional<BatchSummary> getLastSummary() {
        return Optional.ofNullable(lastSummary.get());
    }

    /**
     * Forgets the last summary, for example after the session was cleared.
     */
    public void clearLastSummary() {
        lastSummary.set(null);
    }

    public BatchSettings getSettings() {
        return settings;
    }

    private void scheduleReset(BatchJob job) {
        long delay = settings.resetGrace().toMillis();
        if (delay <= 0) {
            currentJob.compareAndSet(job, null);
            return;
        }
        resetScheduler.schedule(() -> {
            if (currentJob.compareAndSet(job, null)) {
                logger.debug("Batch job reset after grace period");
            }
        }, delay, TimeUnit.MILLISECONDS);
    }

    @Override
    public void close() {
        resetScheduler.shutdownNow();
    }
}
