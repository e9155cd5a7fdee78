package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.model.BatchMode;
import org.colorcorrection.pipeline.model.BatchSummary;
import org.colorcorrection.pipeline.model.ImageOutcome;
import org.colorcorrection.pipeline.model.ImageRef;
import org.colorcorrection.pipeline.model.ImageStatus;
import org.colorcorrection.pipeline.model.Progress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * State of one batch run: the outcome ledger and its progress.
 * <p>
 * The ledger is the only record of which images succeeded; reporting and save
 * eligibility read it and nothing else. An image reaches a terminal status at
 * most once, and {@link BatchListener#onImageFinished} fires on that transition
 * only.
 * <p>
 * Two progress values are kept. Confirmed progress counts images the server has
 * accounted for. Estimated progress is a client-side guess used while a blocking
 * request is in flight; it never touches the ledger. Both only move forward.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class BatchJob {

    private static final Logger logger = LoggerFactory.getLogger(BatchJob.class);

    private final BatchMode mode;
    private final List<ImageRef> targets;
    private final int workerCount;
    private final BatchListener listener;
    private final Instant startedAt = Instant.now();
    private final Map<Integer, ImageOutcome> ledger = new LinkedHashMap<>();

    private Progress progress;
    private Progress estimatedProgress;
    private boolean abandoned;
    private volatile boolean cancelled;

    public BatchJob(BatchMode mode, List<ImageRef> targets, int workerCount, BatchListener listener) {
        if (targets.isEmpty()) {
            throw new IllegalArgumentException("A batch needs at least one image");
        }
        BatchSettings.checkWorkerCount(workerCount);
        this.mode = mode;
        this.targets = List.copyOf(targets);
        this.workerCount = workerCount;
        this.listener = listener == null ? BatchListener.NONE : listener;
        for (ImageRef ref : this.targets) {
            if (ledger.put(ref.index(), ImageOutcome.pending(ref)) != null) {
                throw new IllegalArgumentException("Duplicate batch target " + ref.label());
            }
        }
        this.progress = new Progress(0, this.targets.size(), "Starting", false);
        this.estimatedProgress = new Progress(0, this.targets.size(), "Starting", true);
    }

    public BatchMode getMode() {
        return mode;
    }

    public List<ImageRef> getTargets() {
        return targets;
    }

    public int getTotal() {
        return targets.size();
    }

    public int getWorkerCount() {
        return workerCount;
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    // ==================== Ledger ====================

    public synchronized boolean contains(int imageIndex) {
        return ledger.containsKey(imageIndex);
    }

    public synchronized Optional<ImageOutcome> getOutcome(int imageIndex) {
        return Optional.ofNullable(ledger.get(imageIndex));
    }

    /**
     * @return ledger entries sorted by image index
     */
    public synchronized List<ImageOutcome> getLedger() {
        List<ImageOutcome> list = new ArrayList<>(ledger.values());
        list.sort(Comparator.comparingInt(ImageOutcome::imageIndex));
        return list;
    }

    public synchronized int countTerminal() {
        int count = 0;
        for (ImageOutcome outcome : ledger.values()) {
            if (outcome.status().isTerminal()) {
                count++;
            }
        }
        return count;
    }

    /**
     * Marks a pending image as running. Ignored for unknown or already terminal images.
     */
    public synchronized void markRunning(int imageIndex) {
        ImageOutcome current = ledger.get(imageIndex);
        if (current != null && current.status() == ImageStatus.PENDING) {
            ledger.put(imageIndex, current.withStatus(ImageStatus.RUNNING, null));
        }
    }

    /**
     * Records a terminal status for an image.
     *
     * @param imageIndex image index
     * @param status     a terminal status
     * @param detail     failure or skip reason, or null
     * @return true if this call moved the image to a terminal status; false if the
     *         image is unknown or was already terminal
     */
    public boolean recordOutcome(int imageIndex, ImageStatus status, String detail) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        ImageOutcome updated;
        Progress newProgress;
        synchronized (this) {
            ImageOutcome current = ledger.get(imageIndex);
            if (current == null) {
                logger.debug("Ignoring outcome for image {} which is not in this batch", imageIndex);
                return false;
            }
            if (current.status().isTerminal()) {
                return false;
            }
            updated = current.withStatus(status, detail);
            ledger.put(imageIndex, updated);
            newProgress = advanceConfirmed(countTerminal(), describe(updated));
        }
        logOutcome(updated);
        notifyListener(() -> listener.onImageFinished(updated));
        if (newProgress != null) {
            notifyListener(() -> listener.onProgress(newProgress));
        }
        return true;
    }

    /**
     * Fails every image that has not reached a terminal status.
     *
     * @param detail reason recorded for each image
     * @return number of images failed
     */
    public int failRemaining(String detail) {
        List<Integer> open = new ArrayList<>();
        synchronized (this) {
            for (ImageOutcome outcome : ledger.values()) {
                if (!outcome.status().isTerminal()) {
                    open.add(outcome.imageIndex());
                }
            }
        }
        int failed = 0;
        for (int index : open) {
            if (recordOutcome(index, ImageStatus.FAILED, detail)) {
                failed++;
            }
        }
        return failed;
    }

    private void logOutcome(ImageOutcome outcome) {
        switch (outcome.status()) {
            case COMPLETED -> logger.info("Image [{}] {}: completed", outcome.imageIndex() + 1, outcome.filename());
            case SKIPPED -> logger.info("Image [{}] {}: skipped ({})", outcome.imageIndex() + 1,
                    outcome.filename(), outcome.errorDetail());
            default -> logger.warn("Image [{}] {}: {} ({})", outcome.imageIndex() + 1, outcome.filename(),
                    outcome.status(), outcome.errorDetail());
        }
    }

    private static String describe(ImageOutcome outcome) {
        return outcome.filename() + ": " + outcome.status().name().toLowerCase(Locale.ROOT);
    }

    // ==================== Progress ====================

    public synchronized Progress getProgress() {
        return progress;
    }

    public synchronized Progress getEstimatedProgress() {
        return estimatedProgress;
    }

    /**
     * @return the estimate while it is ahead of confirmed progress, otherwise confirmed progress
     */
    public synchronized Progress getDisplayProgress() {
        return estimatedProgress.current() > progress.current() ? estimatedProgress : progress;
    }

    /**
     * Raises confirmed progress to {@code current}. Lower values are ignored.
     */
    public void confirmProgress(int current, String statusText) {
        Progress newProgress;
        synchronized (this) {
            newProgress = advanceConfirmed(current, statusText);
        }
        if (newProgress != null) {
            Progress confirmed = newProgress;
            notifyListener(() -> listener.onProgress(confirmed));
        }
    }

    /**
     * Raises estimated progress to {@code current}. Lower values are ignored.
     */
    public void estimateProgress(int current, String statusText) {
        Progress newEstimate = null;
        synchronized (this) {
            int bounded = Math.min(current, getTotal());
            if (bounded > estimatedProgress.current()) {
                estimatedProgress = new Progress(bounded, getTotal(), statusText, true);
                newEstimate = estimatedProgress;
            }
        }
        if (newEstimate != null) {
            Progress estimate = newEstimate;
            notifyListener(() -> listener.onProgress(estimate));
        }
    }

    /**
     * Reports the final summary to the listener.
     */
    void notifyFinished(BatchSummary summary) {
        notifyListener(() -> listener.onBatchFinished(summary));
    }

    /**
     * Listener failures are logged and never reach the ledger or the strategy.
     */
    private void notifyListener(Runnable callback) {
        try {
            callback.run();
        } catch (RuntimeException e) {
            logger.warn("Batch listener failed: {}", e.getMessage(), e);
        }
    }

    private Progress advanceConfirmed(int current, String statusText) {
        int bounded = Math.min(current, getTotal());
        if (bounded < progress.current()) {
            return null;
        }
        if (bounded == progress.current() && statusText.equals(progress.statusText())) {
            return null;
        }
        progress = new Progress(bounded, getTotal(), statusText, false);
        return progress;
    }

    // ==================== Lifecycle ====================

    /**
     * Requests cancellation. Strategies check this between remote calls; a call
     * already in flight is not interrupted.
     */
    public void cancel() {
        if (!cancelled) {
            cancelled = true;
            logger.info("Cancellation requested for {} batch", mode);
        }
    }

    public boolean isCancelled() {
        return cancelled;
    }

    /**
     * Flags the job as stopped before the server reported completion.
     */
    public synchronized void markAbandoned() {
        abandoned = true;
    }

    public synchronized boolean isAbandoned() {
        return abandoned;
    }

    /**
     * Builds the final report. Every image must be terminal.
     *
     * @throws IllegalStateException if an image has not reached a terminal status
     */
    public synchronized BatchSummary summarize() {
        int succeeded = 0;
        int failed = 0;
        int skipped = 0;
        for (ImageOutcome outcome : ledger.values()) {
            switch (outcome.status()) {
                case COMPLETED -> succeeded++;
                case FAILED -> failed++;
                case SKIPPED -> skipped++;
                default -> throw new IllegalStateException(
                        "Image [" + (outcome.imageIndex() + 1) + "] has no final status: " + outcome.status());
            }
        }
        return new BatchSummary(mode, getTotal(), succeeded, failed, skipped, abandoned,
                getLedger(), Duration.between(startedAt, Instant.now()));
    }

    @Override
    public synchronized String toString() {
        return String.format("BatchJob{mode=%s, total=%d, progress=%d, estimated=%d, cancelled=%s}",
                mode, getTotal(), progress.current(), estimatedProgress.current(), cancelled);
    }
}
