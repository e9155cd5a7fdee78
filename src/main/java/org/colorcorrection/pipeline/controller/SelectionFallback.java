package org.colorcorrection.pipeline.controller;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Locale;

/**
 * What a single run does when no image is explicitly selected.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public enum SelectionFallback {
    /** Run on the first loaded image and log that the fallback was used */
    FIRST_IMAGE,
    /** Reject the run */
    REJECT;

    private static final Logger logger = LoggerFactory.getLogger(SelectionFallback.class);

    /**
     * Parses a policy name, falling back to {@link #FIRST_IMAGE} for unknown values.
     */
    public static SelectionFallback fromName(String name) {
        if (name == null || name.isBlank()) {
            return FIRST_IMAGE;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown selection fallback '{}', using FIRST_IMAGE", name);
            return FIRST_IMAGE;
        }
    }
}
