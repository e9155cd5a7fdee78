package org.colorcorrection.pipeline.controller;

import org.colorcorrection.pipeline.model.BatchMode;
import org.colorcorrection.pipeline.model.CorrectionConfig;
import org.colorcorrection.pipeline.service.PipelineException;

/**
 * One way of running a batch.
 * <p>
 * Implementations fill the job's ledger and progress. They are called with the
 * registry's running gate already held by {@link BatchCoordinator}.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public interface BatchStrategy {

    BatchMode getMode();

    /**
     * Checks local preconditions before the running gate is taken. No remote call
     * may be made here.
     *
     * @throws PipelineException if the batch cannot start
     */
    default void checkPreconditions() throws PipelineException {}

    /**
     * Runs the batch. On normal return every ledger entry is terminal.
     *
     * @param job    job to fill
     * @param config run configuration
     * @throws PipelineException if the batch is aborted; the caller fails the remaining images
     */
    void execute(BatchJob job, CorrectionConfig config) throws PipelineException;
}
