package org.colorcorrection.pipeline.model;

/**
 * Reference to an image loaded in the registry.
 * <p>
 * The {@code generation} ties the ref to one registry session; refs from a
 * previous session are rejected once the registry is cleared.
 *
 * @param index      position in the registry (also the server's image index)
 * @param id         stable identifier within the session
 * @param filename   server-side filename
 * @param remotePath server-side path, or null if unknown
 * @param generation registry generation that created this ref
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public record ImageRef(int index, String id, String filename, String remotePath, long generation) {

    /**
     * @return one-based label used in log output, e.g. {@code "[3] photo.jpg"}
     */
    public String label() {
        return "[" + (index + 1) + "] " + filename;
    }
}
