package org.colorcorrection.pipeline.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * An image whose outputs can be saved, with the stages actually available for it.
 *
 * @param key             filename for interactive results, image index for batch results
 * @param label           display label
 * @param availableStages stages that produced an output for this image
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public record SaveCandidate(String key, String label, Set<CorrectionStage> availableStages) {

    public SaveCandidate {
        availableStages = availableStages.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(CorrectionStage.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(availableStages));
    }

    public boolean isAvailable(CorrectionStage stage) {
        return availableStages.contains(stage);
    }
}
