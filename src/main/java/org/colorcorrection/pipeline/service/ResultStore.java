package org.colorcorrection.pipeline.service;

import org.colorcorrection.pipeline.model.ImageRef;
import org.colorcorrection.pipeline.model.PipelineResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Latest {@link PipelineResult} per image, keyed by image index.
 * <p>
 * A result is replaced as a whole; the store never merges a new run into an
 * old one.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public class ResultStore {

    private final Map<Integer, PipelineResult> results = new TreeMap<>();

    public synchronized void put(PipelineResult result) {
        results.put(result.getImage().index(), result);
    }

    /**
     * Removes the result for an image.
     *
     * @return the removed result, or empty if there was none
     */
    public synchronized Optional<PipelineResult> remove(ImageRef image) {
        return Optional.ofNullable(results.remove(image.index()));
    }

    public synchronized Optional<PipelineResult> get(ImageRef image) {
        return Optional.ofNullable(results.get(image.index()));
    }

    /**
     * @return all results sorted by image index
     */
    public synchronized List<PipelineResult> getAll() {
        return new ArrayList<>(results.values());
    }

    public synchronized int size() {
        return results.size();
    }

    public synchronized void clear() {
        results.clear();
    }
}
