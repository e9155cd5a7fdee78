package org.colorcorrection.pipeline.model;

import java.util.Locale;
import java.util.Optional;

/**
 * The four correction stages of the pipeline.
 * <p>
 * Declaration order is the fixed presentation order (FFC, GC, WB, CC) used
 * wherever stages are listed, regardless of the order the server reports them in.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public enum CorrectionStage {

    /** Flat-field correction: removes vignetting using a white reference image */
    FFC("Flat-Field Correction"),
    /** Gamma correction: polynomial brightness remapping fit from neutral patches */
    GC("Gamma Correction"),
    /** White balance: diagonal channel scaling from neutral patches */
    WB("White Balance"),
    /** Color correction: maps chart patches to reference values */
    CC("Color Correction");

    private final String displayName;

    CorrectionStage(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Resolves a stage from a server key such as {@code "CC"}, {@code "gc"} or an
     * output image name such as {@code "20240101_photo_WB"}.
     *
     * @param key stage name or output image name
     * @return the stage, or empty if the key does not name one
     */
    public static Optional<CorrectionStage> fromKey(String key) {
        if (key == null || key.isBlank()) {
            return Optional.empty();
        }
        String candidate = key.trim();
        int underscore = candidate.lastIndexOf('_');
        if (underscore >= 0) {
            candidate = candidate.substring(underscore + 1);
        }
        try {
            return Optional.of(valueOf(candidate.toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
