package de.anton.xrf.analyser.xrf_analyzer.service;

import de.anton.xrf.analyser.xrf_analyzer.algorithms.MapNormalizer;
import de.anton.xrf.analyser.xrf_analyzer.algorithms.MapStatistics;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementMap;
import de.anton.xrf.analyser.xrf_analyzer.model.MapComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Compares two sets of element maps: two detectors of one scan, or one detector across two scans.
 */
public class ComparisonService {

    private static final Logger logger = LoggerFactory.getLogger(ComparisonService.class);

    /**
     * Per-element comparison of two map sets. Only elements present on both sides are included.
     */
    public static class ComparisonReport {
        public final String labelA;
        public final String labelB;
        public final Map<String, MapComparison> statistics;   // Element order of side A
        public final Map<String, ElementMap> normalizedA;
        public final Map<String, ElementMap> normalizedB;
        public final Map<String, ElementMap> differences;     // normalizedA - normalizedB

        private ComparisonReport(String labelA, String labelB, Map<String, MapComparison> statistics,
                                 Map<String, ElementMap> normalizedA, Map<String, ElementMap> normalizedB,
                                 Map<String, ElementMap> differences) {
            this.labelA = labelA;
            this.labelB = labelB;
            this.statistics = Collections.unmodifiableMap(statistics);
            this.normalizedA = Collections.unmodifiableMap(normalizedA);
            this.normalizedB = Collections.unmodifiableMap(normalizedB);
            this.differences = Collections.unmodifiableMap(differences);
        }
    }

    public ComparisonReport compare(Map<String, ElementMap> mapsA, Map<String, ElementMap> mapsB,
                                    String labelA, String labelB) {
        Objects.requireNonNull(mapsA, "Maps A cannot be null.");
        Objects.requireNonNull(mapsB, "Maps B cannot be null.");
        Map<String, MapComparison> statistics = new LinkedHashMap<>();
        Map<String, ElementMap> normalizedA = new LinkedHashMap<>();
        Map<String, ElementMap> normalizedB = new LinkedHashMap<>();
        Map<String, ElementMap> differences = new LinkedHashMap<>();

        for (Map.Entry<String, ElementMap> entry : mapsA.entrySet()) {
            String elementId = entry.getKey();
            ElementMap a = entry.getValue();
            ElementMap b = mapsB.get(elementId);
            if (b == null) {
                logger.warn("Comparison: Element {} missing in {}, skipped.", elementId, labelB);
                continue;
            }
            if (!a.hasSameShape(b)) {
                logger.warn("Comparison: Element {} has different grid shapes in {} and {}, skipped.", elementId, labelA, labelB);
                continue;
            }
            ElementMap normA = MapNormalizer.percentile(a);
            ElementMap normB = MapNormalizer.percentile(b);
            MapComparison comparison = MapStatistics.compare(a, b);
            normalizedA.put(elementId, normA);
            normalizedB.put(elementId, normB);
            differences.put(elementId, MapStatistics.difference(normA, normB));
            statistics.put(elementId, comparison);
            logger.info("Comparison {} vs {}: {} r={} RMS={}", labelA, labelB, elementId,
                    String.format("%.4f", comparison.pearsonNormalized()), String.format("%.4f", comparison.rmsDifference()));
        }
        for (String elementId : mapsB.keySet()) {
            if (!mapsA.containsKey(elementId)) {
                logger.warn("Comparison: Element {} missing in {}, skipped.", elementId, labelA);
            }
        }
        return new ComparisonReport(labelA, labelB, statistics, normalizedA, normalizedB, differences);
    }

    /**
     * Element-wise mean of two detectors' maps, the "stacked" view of a scan.
     * Elements missing on either side are left out.
     */
    public Map<String, ElementMap> averageDetectors(Map<String, ElementMap> mapsA, Map<String, ElementMap> mapsB) {
        Objects.requireNonNull(mapsA, "Maps A cannot be null.");
        Objects.requireNonNull(mapsB, "Maps B cannot be null.");
        Map<String, ElementMap> averaged = new LinkedHashMap<>();
        mapsA.forEach((elementId, a) -> {
            ElementMap b = mapsB.get(elementId);
            if (b != null && a.hasSameShape(b)) {
                averaged.put(elementId, MapStatistics.average(a, b));
            } else {
                logger.warn("Comparison: Element {} cannot be averaged, skipped.", elementId);
            }
        });
        return averaged;
    }
}
