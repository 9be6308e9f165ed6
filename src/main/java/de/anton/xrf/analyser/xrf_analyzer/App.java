package de.anton.xrf.analyser.xrf_analyzer;

import de.anton.xrf.analyser.xrf_analyzer.exception.CalibrationException;
import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationSource;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementMap;
import de.anton.xrf.analyser.xrf_analyzer.model.IntegrationMode;
import de.anton.xrf.analyser.xrf_analyzer.model.MapComparison;
import de.anton.xrf.analyser.xrf_analyzer.model.MapWorkbookExporter;
import de.anton.xrf.analyser.xrf_analyzer.model.ParseMode;
import de.anton.xrf.analyser.xrf_analyzer.model.RgbImage;
import de.anton.xrf.analyser.xrf_analyzer.service.ComparisonService;
import de.anton.xrf.analyser.xrf_analyzer.service.ComparisonService.ComparisonReport;
import de.anton.xrf.analyser.xrf_analyzer.service.CompositeService;
import de.anton.xrf.analyser.xrf_analyzer.service.DatasetDefaults;
import de.anton.xrf.analyser.xrf_analyzer.service.GridAssemblyService;
import de.anton.xrf.analyser.xrf_analyzer.service.MapCacheService;
import de.anton.xrf.analyser.xrf_analyzer.service.MappingConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line entry point. Builds the element maps of every detector of a dataset
 * (from the cache where possible), compares the detectors and optionally exports a workbook.
 *
 * <pre>
 * App &lt;datasetDir&gt; [datasetLabel] [--cache &lt;dir&gt;] [--export &lt;file.xlsx&gt;]
 *     [--mode FIXED|ADAPTIVE] [--lenient|--strict] [--per-file-calibration]
 * </pre>
 * Spectra of detector {@code d} are expected in {@code <datasetDir>/<d>/None_<n>.mca}.
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;
    private static final Path DEFAULT_CACHE = Paths.get("results", "_npy_cache");

    public static void main(String[] args) {
        int status = run(args);
        if (status != EXIT_OK) {
            System.exit(status);
        }
    }

    /** Parsed command line. */
    static final class Options {
        Path datasetDir;
        String datasetLabel;
        Path cacheDir = DEFAULT_CACHE;
        Path exportFile;
        MappingConfiguration.Builder config = MappingConfiguration.builder();
    }

    /**
     * Runs the whole pipeline and returns the process exit status.
     */
    static int run(String[] args) {
        Options options;
        try {
            options = parseArguments(args);
        } catch (IllegalArgumentException e) {
            logger.error("{}", e.getMessage());
            logger.error("Usage: App <datasetDir> [datasetLabel] [--cache <dir>] [--export <file.xlsx>] "
                    + "[--mode FIXED|ADAPTIVE] [--lenient|--strict] [--per-file-calibration]");
            return EXIT_USAGE;
        }

        try {
            MappingConfiguration config = options.config.build();
            GridAssemblyService assembler = new GridAssemblyService(config);
            MapCacheService cache = MapCacheService.forConfiguration(options.cacheDir, config);

            Map<String, Map<String, ElementMap>> mapsByDetector = new LinkedHashMap<>();
            for (String detectorId : DatasetDefaults.DETECTORS) {
                Path detectorDir = options.datasetDir.resolve(detectorId);
                if (!Files.isDirectory(detectorDir) && !cache.exists(detectorId, options.datasetLabel)) {
                    logger.warn("No spectra directory {} and no cache for detector {}, skipped.", detectorDir, detectorId);
                    continue;
                }
                Map<String, ElementMap> maps = cache.loadOrCompute(detectorId, options.datasetLabel,
                        () -> assembler.assemble(detectorId, detectorDir).maps);
                mapsByDetector.put(detectorId, maps);
            }
            if (mapsByDetector.isEmpty()) {
                logger.error("No detector data found under {}", options.datasetDir);
                return EXIT_FAILURE;
            }

            ComparisonService comparisonService = new ComparisonService();
            List<ComparisonReport> reports = new ArrayList<>();
            Map<String, ElementMap> mapsA = mapsByDetector.get(DatasetDefaults.DETECTOR_A);
            Map<String, ElementMap> mapsB = mapsByDetector.get(DatasetDefaults.DETECTOR_B);
            if (mapsA != null && mapsB != null) {
                reports.add(comparisonService.compare(mapsA, mapsB, DatasetDefaults.DETECTOR_A, DatasetDefaults.DETECTOR_B));
                mapsByDetector.put(DatasetDefaults.STACKED, comparisonService.averageDetectors(mapsA, mapsB));
            }

            Map<String, ElementMap> reference = mapsByDetector.containsKey(DatasetDefaults.STACKED)
                    ? mapsByDetector.get(DatasetDefaults.STACKED)
                    : mapsByDetector.values().iterator().next();
            CompositeService composites = new CompositeService();
            RgbImage additive = composites.additive(reference);
            RgbImage pigments = composites.pigmentReconstruction(reference);
            logger.info("Composites built: additive max {}, reconstruction max {}",
                    String.format("%.3f", additive.max()), String.format("%.3f", pigments.max()));

            if (options.exportFile != null) {
                List<MapComparison> statistics = new ArrayList<>();
                reports.forEach(r -> statistics.addAll(r.statistics.values()));
                new MapWorkbookExporter().export(options.exportFile, mapsByDetector, config.elements(),
                        assembler.getSharedCalibration(), statistics);
            }
            logger.info("Dataset {} finished: {} detector map sets.", options.datasetLabel, mapsByDetector.size());
            return EXIT_OK;
        } catch (CalibrationException e) {
            logger.error("Calibration rejected, nothing processed: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (IllegalArgumentException e) {
            logger.error("Invalid configuration: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (IOException e) {
            logger.error("I/O error while processing dataset {}", options.datasetLabel, e);
            return EXIT_FAILURE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Processing interrupted.");
            return EXIT_FAILURE;
        }
    }

    static Options parseArguments(String[] args) {
        Options options = new Options();
        List<String> positional = new ArrayList<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            switch (arg) {
                case "--cache":
                    options.cacheDir = Paths.get(valueOf(args, ++i, arg));
                    break;
                case "--export":
                    options.exportFile = Paths.get(valueOf(args, ++i, arg));
                    break;
                case "--mode":
                    String modeName = valueOf(args, ++i, arg);
                    IntegrationMode mode = IntegrationMode.fromName(modeName);
                    if (mode == null) {
                        throw new IllegalArgumentException("Unknown integration mode: " + modeName);
                    }
                    options.config.integrationMode(mode);
                    break;
                case "--lenient":
                    options.config.parseMode(ParseMode.LENIENT);
                    break;
                case "--strict":
                    options.config.parseMode(ParseMode.STRICT);
                    break;
                case "--per-file-calibration":
                    options.config.calibrationSource(CalibrationSource.PER_FILE);
                    break;
                default:
                    if (arg.startsWith("--")) {
                        throw new IllegalArgumentException("Unknown option: " + arg);
                    }
                    positional.add(arg);
            }
        }
        if (positional.isEmpty() || positional.size() > 2) {
            throw new IllegalArgumentException("Expected a dataset directory and an optional dataset label.");
        }
        options.datasetDir = Paths.get(positional.get(0));
        options.datasetLabel = positional.size() == 2
                ? positional.get(1)
                : String.valueOf(options.datasetDir.toAbsolutePath().normalize().getFileName());
        return options;
    }

    private static String valueOf(String[] args, int index, String option) {
        if (index >= args.length) {
            throw new IllegalArgumentException("Missing value for " + option);
        }
        return args[index];
    }
}
