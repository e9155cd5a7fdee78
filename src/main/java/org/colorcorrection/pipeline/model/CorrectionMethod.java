package org.colorcorrection.pipeline.model;

import java.util.Locale;

/**
 * Fitting methods understood by the remote pipeline.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public enum CorrectionMethod {
    /** Partial least squares regression */
    PLS,
    /** Neural network regression */
    NN,
    /** Ordinary linear regression */
    LINEAR,
    /** Support vector regression */
    SVM,
    /** Conventional (non-learned) color correction algorithm */
    CONVENTIONAL;

    /**
     * @return the lower-case name the server expects
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static CorrectionMethod fromWireName(String name) {
        return valueOf(name.trim().toUpperCase(Locale.ROOT));
    }
}
