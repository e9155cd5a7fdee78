package org.colorcorrection.pipeline.model;

import java.time.Duration;
import java.util.List;

/**
 * Final report of a batch run.
 * <p>
 * {@code succeeded + failed + skipped == total} always holds, and the outcomes
 * are sorted by image index.
 *
 * @param mode      strategy that ran
 * @param total     number of target images
 * @param succeeded images completed
 * @param failed    images failed (including abandoned ones)
 * @param skipped   images skipped because no chart was detected
 * @param abandoned true if polling stopped before the server reported completion
 * @param outcomes  per-image outcomes in image order
 * @param duration  wall-clock duration
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public record BatchSummary(
        BatchMode mode,
        int total,
        int succeeded,
        int failed,
        int skipped,
        boolean abandoned,
        List<ImageOutcome> outcomes,
        Duration duration
) {
    public BatchSummary {
        outcomes = List.copyOf(outcomes);
        if (succeeded + failed + skipped != total) {
            throw new IllegalStateException(String.format(
                    "Batch counts do not add up: %d succeeded + %d failed + %d skipped != %d total",
                    succeeded, failed, skipped, total));
        }
    }

    public List<ImageOutcome> completedOutcomes() {
        return outcomes.stream()
                .filter(o -> o.status() == ImageStatus.COMPLETED)
                .toList();
    }
}
