package de.anton.xrf.analyser.xrf_analyzer.service;

import de.anton.xrf.analyser.xrf_analyzer.exception.CacheInconsistencyException;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementDefinition;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementMap;
import de.anton.xrf.analyser.xrf_analyzer.model.NpyArrayIO;
import de.anton.xrf.analyser.xrf_analyzer.model.ScanGrid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Persists element maps as {@code <cacheRoot>/<dataset>/<variant>/<detector>_<element>.npy}.
 * The variant names the settings the maps were computed with (see {@link MappingConfiguration#cacheVariant()});
 * without one the maps live directly in the dataset directory.
 * A detector counts as cached only if the map of every configured element is present.
 */
public class MapCacheService {

    private static final Logger logger = LoggerFactory.getLogger(MapCacheService.class);
    private static final String EXTENSION = ".npy";

    /** Computes the maps of one detector when the cache cannot serve them. */
    @FunctionalInterface
    public interface MapSupplier {
        Map<String, ElementMap> compute() throws IOException, InterruptedException;
    }

    private final Path cacheRoot;
    private final List<ElementDefinition> elements;
    private final ScanGrid grid;
    private final String variant; // null: no settings subdirectory

    public MapCacheService(Path cacheRoot, List<ElementDefinition> elements, ScanGrid grid) {
        this(cacheRoot, elements, grid, null);
    }

    public MapCacheService(Path cacheRoot, List<ElementDefinition> elements, ScanGrid grid, String variant) {
        this.cacheRoot = Objects.requireNonNull(cacheRoot, "Cache root cannot be null.");
        this.elements = List.copyOf(Objects.requireNonNull(elements, "Element definitions cannot be null."));
        this.grid = Objects.requireNonNull(grid, "Scan grid cannot be null.");
        if (variant != null && (variant.isBlank() || variant.contains("/") || variant.contains("\\") || variant.contains(".."))) {
            throw new IllegalArgumentException("Invalid cache variant: '" + variant + "'");
        }
        this.variant = variant;
    }

    /** Cache for the maps computed under the given configuration, separate from every other configuration. */
    public static MapCacheService forConfiguration(Path cacheRoot, MappingConfiguration config) {
        return new MapCacheService(cacheRoot, config.elements(), config.grid(), config.cacheVariant());
    }

    public Path getCacheRoot() {
        return cacheRoot;
    }

    public String getVariant() {
        return variant;
    }

    /** Location of one cache entry. */
    public Path entryPath(String detectorId, String datasetId, String elementId) {
        return datasetDirectory(datasetId).resolve(detectorId + "_" + elementId + EXTENSION);
    }

    private Path datasetDirectory(String datasetId) {
        Path dir = cacheRoot.resolve(datasetId);
        return variant == null ? dir : dir.resolve(variant);
    }

    /**
     * @return true only if every element map of this detector/dataset pair is cached.
     */
    public boolean exists(String detectorId, String datasetId) {
        return missingEntries(detectorId, datasetId).isEmpty();
    }

    /**
     * Loads all element maps of a detector.
     *
     * @return Sealed maps keyed by element id, in definition order.
     * @throws CacheInconsistencyException If only part of the maps are cached (or none).
     * @throws IOException                 If an entry is unreadable or its shape does not match the grid.
     */
    public Map<String, ElementMap> load(String detectorId, String datasetId) throws IOException {
        List<String> missing = missingEntries(detectorId, datasetId);
        if (!missing.isEmpty()) {
            throw new CacheInconsistencyException(detectorId, datasetId, missing);
        }
        Map<String, ElementMap> maps = new LinkedHashMap<>();
        for (ElementDefinition element : elements) {
            Path path = entryPath(detectorId, datasetId, element.getId());
            double[][] data = NpyArrayIO.read(path);
            int columns = data.length == 0 ? 0 : data[0].length;
            if (data.length != grid.getRows() || columns != grid.getColumns()) {
                throw new IOException(String.format("Cached map %s has shape (%d, %d), expected (%d, %d)",
                        path, data.length, columns, grid.getRows(), grid.getColumns()));
            }
            maps.put(element.getId(), ElementMap.of(element.getId(), data));
        }
        logger.info("Cache: Loaded {} maps for detector {} ({}) from {}", maps.size(), detectorId, datasetId, cacheRoot);
        return maps;
    }

    /**
     * Writes one entry per configured element. Extra maps in the argument are ignored.
     *
     * @throws IllegalArgumentException If a configured element has no map or a map has the wrong shape.
     */
    public void save(String detectorId, String datasetId, Map<String, ElementMap> maps) throws IOException {
        Objects.requireNonNull(maps, "Maps cannot be null.");
        for (ElementDefinition element : elements) {
            ElementMap map = maps.get(element.getId());
            if (map == null) {
                throw new IllegalArgumentException("No map for element '" + element.getId() + "' to cache.");
            }
            if (map.getRows() != grid.getRows() || map.getColumns() != grid.getColumns()) {
                throw new IllegalArgumentException("Map '" + element.getId() + "' does not match grid " + grid);
            }
        }
        Files.createDirectories(datasetDirectory(datasetId));
        for (ElementDefinition element : elements) {
            NpyArrayIO.write(entryPath(detectorId, datasetId, element.getId()), maps.get(element.getId()).toArray());
        }
        logger.info("Cache: Saved {} maps for detector {} ({})", elements.size(), detectorId, datasetId);
    }

    /**
     * Returns the cached maps, or computes and caches them. A partial cache is discarded
     * and the whole detector recomputed.
     */
    public Map<String, ElementMap> loadOrCompute(String detectorId, String datasetId, MapSupplier supplier)
            throws IOException, InterruptedException {
        Objects.requireNonNull(supplier, "Map supplier cannot be null.");
        if (exists(detectorId, datasetId)) {
            try {
                return load(detectorId, datasetId);
            } catch (IOException e) {
                logger.warn("Cache: Unusable cache for detector {} ({}), recomputing: {}", detectorId, datasetId, e.getMessage());
            }
        } else {
            List<String> missing = missingEntries(detectorId, datasetId);
            if (missing.size() < elements.size()) {
                CacheInconsistencyException partial = new CacheInconsistencyException(detectorId, datasetId, missing);
                logger.warn("Cache: {}. Recomputing all maps.", partial.getMessage());
            } else {
                logger.info("Cache: No cache for detector {} ({}), computing.", detectorId, datasetId);
            }
        }
        Map<String, ElementMap> maps = supplier.compute();
        save(detectorId, datasetId, maps);
        return maps;
    }

    private List<String> missingEntries(String detectorId, String datasetId) {
        Objects.requireNonNull(detectorId, "Detector id cannot be null.");
        Objects.requireNonNull(datasetId, "Dataset id cannot be null.");
        List<String> missing = new ArrayList<>();
        for (ElementDefinition element : elements) {
            if (!Files.isRegularFile(entryPath(detectorId, datasetId, element.getId()))) {
                missing.add(element.getId());
            }
        }
        return missing;
    }
}
