package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.model.BatchMode;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.model.ImageStatus;
import org.colorcorrection.pipeline.service.PipelineBackend;
import org.colorcorrection.pipeline.service.PipelineClient;
import org.colorcorrection.pipeline.service.PipelineException;
import org.colorcorrection.pipeline.service.RemoteStageException;
import org.colorcorrection.pipeline.service.TransportException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Trains and runs a model per image with the work spread over server workers.
 * <p>
 * One request submits the batch; progress is then polled until the server
 * reports it inactive with every image accounted for. Each poll is merged into
 * the ledger. A cursor of the last seen completed and failed counts decides when
 * the per-image list needs scanning, and the ledger's own transition check keeps
 * any image from being reported twice.
 * <p>
 * A failed poll is logged and retried on the next tick; the batch is aborted only
 * after {@value #MAX_CONSECUTIVE_POLL_FAILURES} failed polls in a row. If polling
 * exceeds the wait cap or the job is cancelled, polling stops and the unfinished
 * images are failed as abandoned. The server job is not cancelled and may keep
 * running.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class ParallelTrainStrategy implements BatchStrategy {

    private static final Logger logger = LoggerFactory.getLogger(ParallelTrainStrategy.class);

    static final int MAX_CONSECUTIVE_POLL_FAILURES = 5;

    private final PipelineBackend backend;
    private final BatchSettings settings;

    public ParallelTrainStrategy(PipelineBackend backend, BatchSettings settings) {
        this.backend = backend;
        this.settings = settings;
    }

    @Override
    public BatchMode getMode() {
        return BatchMode.PARALLEL_TRAIN;
    }

    @Override
    public void execute(BatchJob job, CorrectionConfig config) throws PipelineException {
        PipelineClient.BatchStart start = backend.runPipelineBatch(job.getTargets(), config, job.getWorkerCount());
        if (start.totalImages() != job.getTotal()) {
            logger.warn("Server accepted {} image(s) for batch {}, {} were requested",
                    start.totalImages(), start.batchId(), job.getTotal());
        }

        Instant deadline = Instant.now().plus(settings.maxPollWait());
        ProgressCursor cursor = new ProgressCursor();
        int pollFailures = 0;

        while (true) {
            if (job.isCancelled()) {
                abandon(job, "abandoned: cancelled while the server was still processing");
                return;
            }
            if (Instant.now().isAfter(deadline)) {
                abandon(job, "abandoned: no completion after " + formatDuration(settings.maxPollWait()));
                return;
            }

            PipelineClient.BatchProgress progress;
            try {
                progress = backend.pollProgress();
                pollFailures = 0;
            } catch (RemoteStageException | TransportException e) {
                pollFailures++;
                if (pollFailures >= MAX_CONSECUTIVE_POLL_FAILURES) {
                    logger.error("Giving up on batch {} after {} failed progress polls", start.batchId(), pollFailures);
                    throw e;
                }
                logger.warn("Progress poll {} of {} failed for batch {}, retrying: {}",
                        pollFailures, MAX_CONSECUTIVE_POLL_FAILURES, start.batchId(), e.getMessage());
                sleep(settings.pollInterval());
                continue;
            }
            merge(job, progress, cursor);

            if (progress.isFinished()) {
                int missing = job.failRemaining("not reported by remote");
                if (missing > 0) {
                    logger.warn("Batch {} finished but {} image(s) had no final status", start.batchId(), missing);
                }
                return;
            }
            sleep(settings.pollInterval());
        }
    }

    /**
     * Applies one progress snapshot to the job.
     */
    void merge(BatchJob job, PipelineClient.BatchProgress progress, ProgressCursor cursor) {
        boolean advanced = cursor.advance(progress.completed(), progress.failed());
        logger.debug("Poll: active={}, completed={}, failed={}, total={}",
                progress.active(), progress.completed(), progress.failed(), progress.total());

        for (PipelineClient.ImageProgress entry : progress.perImage()) {
            ImageStatus status = ImageStatus.fromWireName(entry.status());
            if (status == ImageStatus.RUNNING) {
                job.markRunning(entry.imageIndex());
            } else if (status.isTerminal() && (advanced || progress.isFinished())) {
                job.recordOutcome(entry.imageIndex(), status, status == ImageStatus.FAILED
                        ? (entry.error() != null ? entry.error() : "failed on remote") : null);
            }
        }

        int reported = Math.min(progress.completed() + progress.failed(), job.getTotal());
        job.confirmProgress(reported, String.format("Processed %d/%d (%d failed)",
                reported, job.getTotal(), progress.failed()));
    }

    private void abandon(BatchJob job, String reason) {
        int abandoned = job.failRemaining(reason);
        job.markAbandoned();
        logger.warn("Parallel batch polling stopped: {} image(s) {}. The server may still be processing.",
                abandoned, reason);
    }

    private static void sleep(Duration interval) throws PipelineException {
        try {
            Thread.sleep(interval.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new PipelineException("poll-progress", "Interrupted while polling batch progress");
        }
    }

    private static String formatDuration(Duration duration) {
        long minutes = duration.toMinutes();
        return minutes > 0 ? minutes + " min" : duration.toMillis() + " ms";
    }

    /**
     * Last completed and failed counts seen from the server.
     */
    static final class ProgressCursor {
        private int completed = -1;
        private int failed = -1;

        /**
         * @return true if either count differs from the last call
         */
        boolean advance(int newCompleted, int newFailed) {
            boolean changed = newCompleted != completed || newFailed != failed;
            completed = newCompleted;
            failed = newFailed;
            return changed;
        }
    }
}
