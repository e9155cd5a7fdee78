package org.colorcorrection.pipeline.model;

/**
 * Ledger entry for one image of a batch.
 *
 * @param imageIndex  registry index of the image
 * @param filename    image filename
 * @param status      current status
 * @param errorDetail failure or skip reason, or null
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public record ImageOutcome(int imageIndex, String filename, ImageStatus status, String errorDetail) {

    public static ImageOutcome pending(ImageRef image) {
        return new ImageOutcome(image.index(), image.filename(), ImageStatus.PENDING, null);
    }

    public ImageOutcome withStatus(ImageStatus newStatus, String detail) {
        return new ImageOutcome(imageIndex, filename, newStatus, detail);
    }
}
