package de.anton.xrf.analyser.xrf_analyzer.service;

import de.anton.xrf.analyser.xrf_analyzer.algorithms.CompositeBuilder;
import de.anton.xrf.analyser.xrf_analyzer.algorithms.CompositeBuilder.ColorLayer;
import de.anton.xrf.analyser.xrf_analyzer.algorithms.CompositeBuilder.WeightedLayer;
import de.anton.xrf.analyser.xrf_analyzer.algorithms.MapNormalizer;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementMap;
import de.anton.xrf.analyser.xrf_analyzer.model.RgbColor;
import de.anton.xrf.analyser.xrf_analyzer.model.RgbImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the standard composite images of a map set with the reference colours and weights.
 */
public class CompositeService {

    private static final Logger logger = LoggerFactory.getLogger(CompositeService.class);

    private final Map<String, RgbColor> compositeColors;
    private final Map<String, RgbColor> pigmentColors;
    private final Map<String, Double> pigmentWeights;

    public CompositeService() {
        this(DatasetDefaults.COMPOSITE_COLORS, DatasetDefaults.PIGMENT_COLORS, DatasetDefaults.PIGMENT_WEIGHTS);
    }

    public CompositeService(Map<String, RgbColor> compositeColors, Map<String, RgbColor> pigmentColors,
                            Map<String, Double> pigmentWeights) {
        this.compositeColors = Objects.requireNonNull(compositeColors, "Composite colours cannot be null.");
        this.pigmentColors = Objects.requireNonNull(pigmentColors, "Pigment colours cannot be null.");
        this.pigmentWeights = Objects.requireNonNull(pigmentWeights, "Pigment weights cannot be null.");
    }

    /**
     * Additive composite of the percentile-normalised maps that have a composite colour.
     */
    public RgbImage additive(Map<String, ElementMap> rawMaps) {
        List<ColorLayer> layers = new ArrayList<>();
        compositeColors.forEach((elementId, color) -> {
            ElementMap map = rawMaps.get(elementId);
            if (map != null) {
                layers.add(new ColorLayer(MapNormalizer.percentile(map), color));
            } else {
                logger.debug("Composite: No map for {}, layer skipped.", elementId);
            }
        });
        return CompositeBuilder.additive(layers, CompositeBuilder.DEFAULT_GAIN);
    }

    /**
     * Direct R/G/B stack of three percentile-normalised maps.
     *
     * @throws IllegalArgumentException If one of the three maps is absent.
     */
    public RgbImage rgbTriplet(Map<String, ElementMap> rawMaps, List<String> elementIds) {
        if (elementIds == null || elementIds.size() != 3) {
            throw new IllegalArgumentException("Exactly three element ids are required for an RGB triplet.");
        }
        ElementMap[] planes = new ElementMap[3];
        for (int i = 0; i < 3; i++) {
            ElementMap map = rawMaps.get(elementIds.get(i));
            if (map == null) {
                throw new IllegalArgumentException("No map for element '" + elementIds.get(i) + "'.");
            }
            planes[i] = MapNormalizer.percentile(map);
        }
        return CompositeBuilder.rgbTriplet(planes[0], planes[1], planes[2]);
    }

    /**
     * Weighted pigment reconstruction from the excess-normalised maps.
     */
    public RgbImage pigmentReconstruction(Map<String, ElementMap> rawMaps) {
        List<WeightedLayer> layers = new ArrayList<>();
        pigmentColors.forEach((elementId, color) -> {
            ElementMap map = rawMaps.get(elementId);
            Double weight = pigmentWeights.get(elementId);
            if (map != null && weight != null) {
                layers.add(new WeightedLayer(MapNormalizer.excess(map), color, weight));
            }
        });
        return CompositeBuilder.weightedReconstruction(layers);
    }
}
