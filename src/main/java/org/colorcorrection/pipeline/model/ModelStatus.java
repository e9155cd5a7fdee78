package org.colorcorrection.pipeline.model;

/**
 * What the client knows about the trained model held by the server.
 * <p>
 * The model itself is owned remotely; only its existence and the image that
 * produced it are tracked here.
 *
 * @param available   whether a current model exists
 * @param sourceImage image whose run produced the model, or null
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public record ModelStatus(boolean available, ImageRef sourceImage) {

    public static final ModelStatus NONE = new ModelStatus(false, null);

    public static ModelStatus trainedOn(ImageRef image) {
        return new ModelStatus(true, image);
    }
}
