package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.model.BatchMode;
import org.colorcorrection.pipeline.model.ChartDetection;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.model.ImageRef;
import org.colorcorrection.pipeline.model.ImageStatus;
import org.colorcorrection.pipeline.service.PipelineException;
import org.colorcorrection.pipeline.service.RemoteStageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Trains and runs a model per image, one image at a time.
 * <p>
 * Each image is checked for a chart first. Images without one are skipped. A
 * stage failure reported by the server fails that image only; a transport failure
 * aborts the batch.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class SequentialTrainStrategy implements BatchStrategy {

    private static final Logger logger = LoggerFactory.getLogger(SequentialTrainStrategy.class);

    private final SingleRunExecutor executor;

    public SequentialTrainStrategy(SingleRunExecutor executor) {
        this.executor = executor;
    }

    @Override
    public BatchMode getMode() {
        return BatchMode.SEQUENTIAL_TRAIN;
    }

    @Override
    public void execute(BatchJob job, CorrectionConfig config) throws PipelineException {
        // Batch runs keep the model for batch saving and skip Delta E for speed
        CorrectionConfig batchConfig = config.toBuilder()
                .saveModel(true)
                .computeDeltaE(false)
                .detectChartFirst(false)
                .build();

        int position = 0;
        for (ImageRef image : job.getTargets()) {
            position++;
            if (job.isCancelled()) {
                int abandoned = job.failRemaining("cancelled before processing");
                job.markAbandoned();
                logger.info("Sequential batch cancelled, {} image(s) not processed", abandoned);
                return;
            }
            job.markRunning(image.index());
            job.estimateProgress(position - 1, String.format("Processing %d/%d: %s",
                    position, job.getTotal(), image.filename()));

            try {
                ChartDetection detection = executor.detect(image);
                if (!detection.detected()) {
                    job.recordOutcome(image.index(), ImageStatus.SKIPPED, "No color chart detected");
                    continue;
                }
                executor.execute(image, batchConfig, true);
                job.recordOutcome(image.index(), ImageStatus.COMPLETED, null);
            } catch (RemoteStageException e) {
                job.recordOutcome(image.index(), ImageStatus.FAILED, e.getStage() + ": " + e.getMessage());
            }
        }
    }
}
