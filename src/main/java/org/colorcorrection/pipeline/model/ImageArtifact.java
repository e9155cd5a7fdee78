package org.colorcorrection.pipeline.model;

/**
 * Opaque reference to an image held by the remote service.
 *
 * @param name server-side name (e.g. {@code "photo_CC"})
 * @param data encoded image data, usually a data URI
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public record ImageArtifact(String name, String data) {}
