package org.colorcorrection.pipeline.model;

import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * What a save request will write: the selected stages and images, and for each
 * selected image the stages that are both selected and available.
 * <p>
 * Derived from the current selection every time it changes; never persisted.
 *
 * @author Color Correction Pipeline Team
 * @since 0.1.0
 */
public final class SaveManifest {

    private final Set<CorrectionStage> selectedStages;
    private final List<String> selectedImageKeys;
    private final Map<String, Set<CorrectionStage>> entries;
    private final int fileCount;

    public SaveManifest(Set<CorrectionStage> selectedStages,
                        List<String> selectedImageKeys,
                        Map<String, Set<CorrectionStage>> entries) {
        this.selectedStages = selectedStages.isEmpty()
                ? Collections.unmodifiableSet(EnumSet.noneOf(CorrectionStage.class))
                : Collections.unmodifiableSet(EnumSet.copyOf(selectedStages));
        this.selectedImageKeys = List.copyOf(selectedImageKeys);
        Map<String, Set<CorrectionStage>> copy = new LinkedHashMap<>();
        int count = 0;
        for (Map.Entry<String, Set<CorrectionStage>> entry : entries.entrySet()) {
            copy.put(entry.getKey(), Collections.unmodifiableSet(entry.getValue().isEmpty()
                    ? EnumSet.noneOf(CorrectionStage.class)
                    : EnumSet.copyOf(entry.getValue())));
            count += entry.getValue().size();
        }
        this.entries = Collections.unmodifiableMap(copy);
        this.fileCount = count;
    }

    public Set<CorrectionStage> getSelectedStages() {
        return selectedStages;
    }

    public List<String> getSelectedImageKeys() {
        return selectedImageKeys;
    }

    /**
     * @return image key to the stages that will be written for it, in selection order
     */
    public Map<String, Set<CorrectionStage>> getEntries() {
        return entries;
    }

    /**
     * @return number of files the save will produce
     */
    public int getFileCount() {
        return fileCount;
    }

    public boolean isEmpty() {
        return fileCount == 0;
    }

    @Override
    public String toString() {
        return String.format("SaveManifest{stages=%s, images=%d, files=%d}",
                selectedStages, selectedImageKeys.size(), fileCount);
    }
}
