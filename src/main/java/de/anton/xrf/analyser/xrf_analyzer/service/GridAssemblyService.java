package de.anton.xrf.analyser.xrf_analyzer.service;

import de.anton.xrf.analyser.xrf_analyzer.algorithms.AdaptiveWindowIntegrator;
import de.anton.xrf.analyser.xrf_analyzer.algorithms.FixedWindowIntegrator;
import de.anton.xrf.analyser.xrf_analyzer.algorithms.LinearCalibration;
import de.anton.xrf.analyser.xrf_analyzer.algorithms.PeakIntegrator;
import de.anton.xrf.analyser.xrf_analyzer.exception.CalibrationException;
import de.anton.xrf.analyser.xrf_analyzer.exception.MissingSourceException;
import de.anton.xrf.analyser.xrf_analyzer.model.AggregateSpectrum;
import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationModel;
import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationSource;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementDefinition;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementMap;
import de.anton.xrf.analyser.xrf_analyzer.model.IntegrationMode;
import de.anton.xrf.analyser.xrf_analyzer.model.PointOutcome;
import de.anton.xrf.analyser.xrf_analyzer.model.ScanGrid;
import de.anton.xrf.analyser.xrf_analyzer.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.IntStream;

/**
 * Service responsible for turning the spectra of one detector into element maps.
 * Every scan point is parsed and integrated independently; a missing or broken file only
 * leaves its grid cell at zero. Configuration and calibration problems are raised before
 * the first file is read.
 */
public class GridAssemblyService {

    private static final Logger logger = LoggerFactory.getLogger(GridAssemblyService.class);

    /**
     * Represents the result of assembling one detector's scan.
     */
    public static class AssemblyResult {
        public final String detectorId;
        public final Map<String, ElementMap> maps; // Definition order, sealed
        public final AggregateSpectrum aggregateSpectrum;
        public final List<PointOutcome> outcomes;  // Ordered by point index
        public final CalibrationModel calibration;
        public final int processedCount;
        public final int missingCount;
        public final int failedCount;
        public final Duration elapsed;

        private AssemblyResult(String detectorId, Map<String, ElementMap> maps, AggregateSpectrum aggregate,
                               List<PointOutcome> outcomes, CalibrationModel calibration, Duration elapsed) {
            this.detectorId = detectorId;
            this.maps = Collections.unmodifiableMap(maps);
            this.aggregateSpectrum = aggregate;
            this.outcomes = Collections.unmodifiableList(outcomes);
            this.calibration = calibration;
            this.processedCount = count(outcomes, PointOutcome.Status.PROCESSED);
            this.missingCount = count(outcomes, PointOutcome.Status.MISSING);
            this.failedCount = count(outcomes, PointOutcome.Status.FAILED);
            this.elapsed = elapsed;
        }

        private static int count(List<PointOutcome> outcomes, PointOutcome.Status status) {
            return (int) outcomes.stream().filter(o -> o.getStatus() == status).count();
        }
    }

    private final MappingConfiguration config;
    private final SpectrumDataService dataService;
    private final CalibrationModel sharedCalibration;
    private final PeakIntegrator integrator;

    /**
     * Prepares an assembler: fits and checks the shared calibration and validates every
     * element line against it.
     *
     * @throws CalibrationException     If the shared calibration is insufficient, degenerate or too poor.
     * @throws IllegalArgumentException If an element line falls outside the detector's channel range.
     */
    public GridAssemblyService(MappingConfiguration config) {
        this.config = Objects.requireNonNull(config, "Configuration cannot be null.");
        this.dataService = new SpectrumDataService(config.parseMode());
        this.sharedCalibration = LinearCalibration.fitChecked(config.calibrationPoints(), config.minRSquared());
        for (ElementDefinition element : config.elements()) {
            element.validateAgainst(sharedCalibration, config.maxChannel());
        }
        this.integrator = createIntegrator(config);
        logger.info("Service: Assembler ready ({}, {} calibration, {} elements, {} parsing). Calibration: {}",
                integrator.getMode(), config.calibrationSource(), config.elements().size(), config.parseMode(), sharedCalibration);
    }

    private static PeakIntegrator createIntegrator(MappingConfiguration config) {
        if (config.integrationMode() == IntegrationMode.ADAPTIVE) {
            return new AdaptiveWindowIntegrator(config.signalBasis(), config.maxSpanKeV());
        }
        return new FixedWindowIntegrator();
    }

    public CalibrationModel getSharedCalibration() {
        return sharedCalibration;
    }

    public MappingConfiguration getConfiguration() {
        return config;
    }

    /**
     * Processes every point of the scan grid for one detector.
     *
     * @param detectorId  Identifier of the detector, used for reporting and caching.
     * @param detectorDir Directory holding the spectrum files of this detector.
     * @return The sealed element maps, the aggregate spectrum and the per-point outcomes.
     * @throws InterruptedException If the calling thread is interrupted. Points not yet
     *                              processed stay at zero; rerunning is safe.
     */
    public AssemblyResult assemble(String detectorId, Path detectorDir) throws InterruptedException {
        Objects.requireNonNull(detectorId, "Detector id cannot be null.");
        Objects.requireNonNull(detectorDir, "Detector directory cannot be null.");
        ScanGrid grid = config.grid();
        int total = grid.getPointCount();
        logger.info("Service: Assembling {} points for detector {} from {}", total, detectorId, detectorDir);

        long start = System.nanoTime();
        Map<String, ElementMap> maps = new LinkedHashMap<>();
        for (ElementDefinition element : config.elements()) {
            maps.put(element.getId(), ElementMap.zeros(element.getId(), grid));
        }
        List<ElementMap> mapList = new ArrayList<>(maps.values());
        Thread caller = Thread.currentThread();
        AtomicInteger done = new AtomicInteger();

        IntStream points = IntStream.rangeClosed(1, total);
        if (config.parallel()) {
            points = points.parallel();
        }
        ScanAccumulator accumulator = points
                .filter(n -> !caller.isInterrupted())
                .mapToObj(n -> {
                    PointWork work = processPoint(n, detectorDir, grid, mapList);
                    int finished = done.incrementAndGet();
                    if (finished % config.progressInterval() == 0) {
                        logger.info("Service: Detector {}: processed {}/{} points ({}%)",
                                detectorId, finished, total, finished * 100 / total);
                    }
                    return work;
                })
                .collect(ScanAccumulator::new, ScanAccumulator::accept, ScanAccumulator::combine);

        if (caller.isInterrupted()) {
            logger.info("Service: Assembly of detector {} interrupted after {} of {} points.", detectorId, done.get(), total);
            throw new InterruptedException("Grid assembly cancelled for detector " + detectorId);
        }

        mapList.forEach(ElementMap::seal);
        accumulator.outcomes.sort(Comparator.comparingInt(PointOutcome::getPointIndex));
        Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
        AssemblyResult result = new AssemblyResult(detectorId, maps, accumulator.aggregate,
                accumulator.outcomes, sharedCalibration, elapsed);
        logger.info("Service: Detector {} done in {} ms: {} processed, {} missing, {} failed.",
                detectorId, elapsed.toMillis(), result.processedCount, result.missingCount, result.failedCount);
        return result;
    }

    /**
     * Parses and integrates one point and writes its cells. Never throws for per-point problems.
     */
    private PointWork processPoint(int pointIndex, Path detectorDir, ScanGrid grid, List<ElementMap> maps) {
        Path file = detectorDir.resolve(config.fileNameFor(pointIndex));
        try {
            Spectrum spectrum = dataService.loadSpectrum(file);
            CalibrationModel calibration = resolveCalibration(spectrum);
            List<ElementDefinition> elements = config.elements();
            double[] values = new double[elements.size()];
            for (int i = 0; i < values.length; i++) {
                values[i] = integrator.integrate(spectrum, elements.get(i), calibration);
            }
            // All values computed before any cell is written, so a failing point leaves no partial row
            int row = grid.rowOf(pointIndex);
            int column = grid.columnOf(pointIndex);
            for (int i = 0; i < values.length; i++) {
                maps.get(i).set(row, column, values[i]);
            }
            return new PointWork(PointOutcome.processed(pointIndex, values), spectrum.getCounts());
        } catch (MissingSourceException e) {
            logger.debug("Service: Point {} missing: {}", pointIndex, file.getFileName());
            return new PointWork(PointOutcome.missing(pointIndex, e.getMessage()), null);
        } catch (IOException | RuntimeException e) {
            logger.warn("Service: Point {} failed ({}): {}", pointIndex, file.getFileName(), e.getMessage());
            return new PointWork(PointOutcome.failed(pointIndex, e.getMessage()), null);
        }
    }

    private CalibrationModel resolveCalibration(Spectrum spectrum) {
        if (config.calibrationSource() != CalibrationSource.PER_FILE) {
            return sharedCalibration;
        }
        if (!spectrum.hasCalibration()) {
            logger.debug("Service: {} has no calibration section, using shared calibration.", spectrum.getSource());
            return sharedCalibration;
        }
        return LinearCalibration.fitChecked(spectrum.getCalibrationPoints(), config.minRSquared());
    }

    /** Outcome of one point plus its counts, which only live until they reach the aggregate. */
    private static final class PointWork {
        final PointOutcome outcome;
        final int[] counts; // null unless processed

        PointWork(PointOutcome outcome, int[] counts) {
            this.outcome = outcome;
            this.counts = counts;
        }
    }

    /** Mutable reduction container, one per stream segment. */
    private static final class ScanAccumulator {
        final AggregateSpectrum aggregate = new AggregateSpectrum();
        final List<PointOutcome> outcomes = new ArrayList<>();

        void accept(PointWork work) {
            outcomes.add(work.outcome);
            if (work.counts != null) {
                aggregate.add(work.counts);
            }
        }

        void combine(ScanAccumulator other) {
            outcomes.addAll(other.outcomes);
            aggregate.merge(other.aggregate);
        }
    }
}
