package de.anton.xrf.analyser.xrf_analyzer.exception;

import java.io.IOException;
import java.util.List;

/**
 * Only part of the expected element maps are cached for a detector/dataset pair.
 * A partial cache is never reused; callers recompute the whole detector.
 */
public class CacheInconsistencyException extends IOException {

    private final List<String> missingElementIds;

    public CacheInconsistencyException(String detectorId, String datasetId, List<String> missingElementIds) {
        super(String.format("Incomplete map cache for detector '%s' in dataset '%s', missing: %s",
                detectorId, datasetId, missingElementIds));
        this.missingElementIds = List.copyOf(missingElementIds);
    }

    public List<String> getMissingElementIds() {
        return missingElementIds;
    }
}
