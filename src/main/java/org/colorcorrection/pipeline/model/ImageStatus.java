package org.colorcorrection.pipeline.model;

import java.util.Locale;

/**
 * Per-image state in a batch outcome ledger.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public enum ImageStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED,
    /** No chart detected; a policy outcome rather than an error */
    SKIPPED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == SKIPPED;
    }

    public static ImageStatus fromWireName(String status) {
        if (status == null) {
            return PENDING;
        }
        return switch (status.trim().toLowerCase(Locale.ROOT)) {
            case "running", "processing" -> RUNNING;
            case "completed", "success" -> COMPLETED;
            case "failed", "error" -> FAILED;
            case "skipped" -> SKIPPED;
            default -> PENDING;
        };
    }
}
