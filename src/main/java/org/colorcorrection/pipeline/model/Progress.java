package org.colorcorrection.pipeline.model;

/**
 * Batch progress snapshot.
 *
 * @param current    number of images accounted for, {@code 0 <= current <= total}
 * @param total      number of images in the batch
 * @param statusText human readable status
 * @param estimated  true when {@code current} is a client-side estimate rather
 *                   than a count confirmed by the server
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public record Progress(int current, int total, String statusText, boolean estimated) {

    public static final Progress IDLE = new Progress(0, 0, "", false);

    public Progress {
        if (total < 0 || current < 0 || current > total) {
            throw new IllegalArgumentException(
                    String.format("Invalid progress %d/%d", current, total));
        }
    }

    public double fraction() {
        return total == 0 ? 0.0 : (double) current / total;
    }

    public boolean isComplete() {
        return total > 0 && current == total;
    }
}
