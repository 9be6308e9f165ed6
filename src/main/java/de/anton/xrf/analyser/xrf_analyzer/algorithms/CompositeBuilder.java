package de.anton.xrf.analyser.xrf_analyzer.algorithms;

import de.anton.xrf.analyser.xrf_analyzer.model.ElementMap;
import de.anton.xrf.analyser.xrf_analyzer.model.RgbColor;
import de.anton.xrf.analyser.xrf_analyzer.model.RgbImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Combines normalised element maps into colour images.
 */
public final class CompositeBuilder {

    private static final Logger logger = LoggerFactory.getLogger(CompositeBuilder.class);

    public static final double DEFAULT_GAIN = 1.3;
    /** Below this total weight a pixel keeps its raw weighted colour sum. */
    public static final double MIN_TOTAL_WEIGHT = 1e-6;

    private CompositeBuilder() { throw new IllegalStateException("Utility class"); }

    /** A normalised map tinted with a colour. */
    public record ColorLayer(ElementMap map, RgbColor color) {
        public ColorLayer {
            Objects.requireNonNull(map, "Layer map cannot be null.");
            Objects.requireNonNull(color, "Layer colour cannot be null.");
        }
    }

    /** A normalised map with a pigment colour and a relative weight. */
    public record WeightedLayer(ElementMap map, RgbColor color, double weight) {
        public WeightedLayer {
            Objects.requireNonNull(map, "Layer map cannot be null.");
            Objects.requireNonNull(color, "Layer colour cannot be null.");
            if (!(weight >= 0) || Double.isInfinite(weight)) {
                throw new IllegalArgumentException("Layer weight must be a non-negative finite value. Got: " + weight);
            }
        }
    }

    /**
     * Additive mixing: every layer adds {@code value × colour} to each pixel; the sum is multiplied
     * by {@code gain} and clipped to [0, 1]. Co-located signals mix like overlapping lights.
     */
    public static RgbImage additive(List<ColorLayer> layers, double gain) {
        if (layers == null || layers.isEmpty()) {
            throw new IllegalArgumentException("At least one layer is required for a composite.");
        }
        if (!(gain >= 0) || Double.isInfinite(gain)) {
            throw new IllegalArgumentException("Gain must be a non-negative finite value. Got: " + gain);
        }
        ElementMap first = layers.get(0).map();
        RgbImage image = new RgbImage(first.getRows(), first.getColumns());
        for (ColorLayer layer : layers) {
            requireSameShape(first, layer.map());
            for (int r = 0; r < image.getRows(); r++) {
                for (int c = 0; c < image.getColumns(); c++) {
                    double value = layer.map().get(r, c);
                    for (int ch = 0; ch < 3; ch++) {
                        image.add(r, c, ch, value * layer.color().channel(ch));
                    }
                }
            }
        }
        applyGainAndClip(image, gain);
        logger.debug("Additive composite of {} layers built ({}x{}, gain {})", layers.size(), image.getRows(), image.getColumns(), gain);
        return image;
    }

    public static RgbImage additive(List<ColorLayer> layers) {
        return additive(layers, DEFAULT_GAIN);
    }

    /** Stacks three normalised maps directly as the red, green and blue channels. */
    public static RgbImage rgbTriplet(ElementMap red, ElementMap green, ElementMap blue) {
        Objects.requireNonNull(red, "Red map cannot be null.");
        Objects.requireNonNull(green, "Green map cannot be null.");
        Objects.requireNonNull(blue, "Blue map cannot be null.");
        requireSameShape(red, green);
        requireSameShape(red, blue);
        RgbImage image = new RgbImage(red.getRows(), red.getColumns());
        ElementMap[] planes = {red, green, blue};
        for (int r = 0; r < image.getRows(); r++) {
            for (int c = 0; c < image.getColumns(); c++) {
                for (int ch = 0; ch < 3; ch++) {
                    image.set(r, c, ch, MapNormalizer.clip(planes[ch].get(r, c)));
                }
            }
        }
        return image;
    }

    /**
     * Two-map overlay: A in red, B in green. Yellow marks agreement, pure red or green marks
     * signal seen by only one acquisition.
     */
    public static RgbImage overlay(ElementMap a, ElementMap b) {
        Objects.requireNonNull(a, "Map A cannot be null.");
        Objects.requireNonNull(b, "Map B cannot be null.");
        requireSameShape(a, b);
        RgbImage image = new RgbImage(a.getRows(), a.getColumns());
        for (int r = 0; r < image.getRows(); r++) {
            for (int c = 0; c < image.getColumns(); c++) {
                image.set(r, c, 0, MapNormalizer.clip(a.get(r, c)));
                image.set(r, c, 1, MapNormalizer.clip(b.get(r, c)));
            }
        }
        return image;
    }

    /**
     * Weighted pigment reconstruction: each pixel becomes the weighted mean of the layer colours,
     * {@code Σ(n·w·colour) / Σ(n·w)}, clipped to [0, 1]. Pixels with a total weight of at most
     * {@link #MIN_TOTAL_WEIGHT} keep the undivided sum.
     */
    public static RgbImage weightedReconstruction(List<WeightedLayer> layers) {
        if (layers == null || layers.isEmpty()) {
            throw new IllegalArgumentException("At least one layer is required for a reconstruction.");
        }
        ElementMap first = layers.get(0).map();
        int rows = first.getRows();
        int cols = first.getColumns();
        RgbImage image = new RgbImage(rows, cols);
        double[][] totalWeight = new double[rows][cols];
        for (WeightedLayer layer : layers) {
            requireSameShape(first, layer.map());
            for (int r = 0; r < rows; r++) {
                for (int c = 0; c < cols; c++) {
                    double w = layer.map().get(r, c) * layer.weight();
                    totalWeight[r][c] += w;
                    for (int ch = 0; ch < 3; ch++) {
                        image.add(r, c, ch, w * layer.color().channel(ch));
                    }
                }
            }
        }
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                double denominator = totalWeight[r][c] > MIN_TOTAL_WEIGHT ? totalWeight[r][c] : 1.0;
                for (int ch = 0; ch < 3; ch++) {
                    image.set(r, c, ch, MapNormalizer.clip(image.get(r, c, ch) / denominator));
                }
            }
        }
        return image;
    }

    private static void applyGainAndClip(RgbImage image, double gain) {
        for (int r = 0; r < image.getRows(); r++) {
            for (int c = 0; c < image.getColumns(); c++) {
                for (int ch = 0; ch < 3; ch++) {
                    image.set(r, c, ch, MapNormalizer.clip(image.get(r, c, ch) * gain));
                }
            }
        }
    }

    private static void requireSameShape(ElementMap reference, ElementMap other) {
        if (!reference.hasSameShape(other)) {
            throw new IllegalArgumentException(String.format("Map '%s' is %dx%d, expected %dx%d like '%s'",
                    other.getElementId(), other.getRows(), other.getColumns(),
                    reference.getRows(), reference.getColumns(), reference.getElementId()));
        }
    }
}
