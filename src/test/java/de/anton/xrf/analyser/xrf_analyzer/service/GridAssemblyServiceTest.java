package de.anton.xrf.analyser.xrf_analyzer.service;

import de.anton.xrf.analyser.xrf_analyzer.algorithms.AdaptiveWindowIntegrator;
import de.anton.xrf.analyser.xrf_analyzer.exception.CalibrationException;
import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationModel;
import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationPoint;
import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationSource;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementDefinition;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementMap;
import de.anton.xrf.analyser.xrf_analyzer.model.IntegrationMode;
import de.anton.xrf.analyser.xrf_analyzer.model.ParseMode;
import de.anton.xrf.analyser.xrf_analyzer.model.PointOutcome;
import de.anton.xrf.analyser.xrf_analyzer.model.ScanGrid;
import de.anton.xrf.analyser.xrf_analyzer.model.SignalBasis;
import de.anton.xrf.analyser.xrf_analyzer.model.Spectrum;
import de.anton.xrf.analyser.xrf_analyzer.model.SpectrumReader;
import de.anton.xrf.analyser.xrf_analyzer.service.GridAssemblyService.AssemblyResult;
import de.anton.xrf.analyser.xrf_analyzer.support.SpectrumFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

/**
 * Tests for {@link GridAssemblyService} on a small 3x4 scan written to a temporary directory.
 */
class GridAssemblyServiceTest {

    private static final ScanGrid GRID = new ScanGrid(3, 4);
    private static final int CHANNELS = 1024;
    private static final ElementDefinition FE = new ElementDefinition("Fe", "Iron", "Kα", 6.400, 2, 219);
    private static final ElementDefinition CU = new ElementDefinition("Cu", "Copper", "Kα", 8.046, 2, 278);

    @TempDir
    Path detectorDir;

    private static MappingConfiguration.Builder baseConfig() {
        return MappingConfiguration.builder()
                .grid(GRID)
                .elements(List.of(FE, CU))
                .progressInterval(5);
    }

    /** Point n carries 10n counts at the Fe line and n counts at the Cu line. */
    private void writeScan(int... skippedPoints) throws IOException {
        outer:
        for (int n = 1; n <= GRID.getPointCount(); n++) {
            for (int skipped : skippedPoints) {
                if (skipped == n) {
                    continue outer;
                }
            }
            int[] counts = SpectrumFixtures.counts(CHANNELS, 219, 10 * n, 278, n);
            SpectrumFixtures.write(detectorDir, "None_" + n + ".mca", SpectrumFixtures.spectrumText(counts));
        }
    }

    @ParameterizedTest
    @ValueSource(booleans = {true, false})
    void fixedModeFillsEveryCellAtItsRasterPosition(boolean parallel) throws Exception {
        writeScan();
        GridAssemblyService service = new GridAssemblyService(baseConfig().parallel(parallel).build());

        AssemblyResult result = service.assemble("10264", detectorDir);

        ElementMap fe = result.maps.get("Fe");
        ElementMap cu = result.maps.get("Cu");
        for (int n = 1; n <= GRID.getPointCount(); n++) {
            assertThat(fe.get(GRID.rowOf(n), GRID.columnOf(n))).isEqualTo(10.0 * n);
            assertThat(cu.get(GRID.rowOf(n), GRID.columnOf(n))).isEqualTo(n);
        }
        assertThat(result.maps.keySet()).containsExactly("Fe", "Cu");
        assertThat(fe.isSealed()).isTrue();
        assertThat(result.processedCount).isEqualTo(12);
        assertThat(result.missingCount).isZero();
        assertThat(result.failedCount).isZero();
        assertThat(result.detectorId).isEqualTo("10264");
    }

    @Test
    void aggregateSpectrumSumsAllParsedSpectra() throws Exception {
        writeScan();
        AssemblyResult result = new GridAssemblyService(baseConfig().build()).assemble("10264", detectorDir);

        double[] sums = result.aggregateSpectrum.getSums();
        assertThat(sums).hasSize(CHANNELS);
        assertThat(sums[219]).isEqualTo(10.0 * 78); // 10 * (1 + ... + 12)
        assertThat(sums[278]).isEqualTo(78.0);
        assertThat(result.aggregateSpectrum.getSpectrumCount()).isEqualTo(12);
    }

    @Test
    void missingFilesLeaveZeroCellsAndDoNotAbort() throws Exception {
        writeScan(1, 6, 12);
        AssemblyResult result = new GridAssemblyService(baseConfig().build()).assemble("19511", detectorDir);

        for (int n : new int[] {1, 6, 12}) {
            for (ElementMap map : result.maps.values()) {
                assertThat(map.get(GRID.rowOf(n), GRID.columnOf(n))).isEqualTo(0.0);
            }
        }
        assertThat(result.maps.get("Fe").get(GRID.rowOf(2), GRID.columnOf(2))).isEqualTo(20.0);
        assertThat(result.missingCount).isEqualTo(3);
        assertThat(result.processedCount).isEqualTo(9);
        assertThat(result.outcomes).hasSize(12);
        assertThat(result.outcomes.get(5).getStatus()).isEqualTo(PointOutcome.Status.MISSING);
        assertThat(result.outcomes).extracting(PointOutcome::getPointIndex).isSorted();
    }

    @Test
    void emptyDirectoryGivesFullShapedZeroMaps() throws Exception {
        AssemblyResult result = new GridAssemblyService(baseConfig().build()).assemble("10264", detectorDir.resolve("absent"));

        assertThat(result.missingCount).isEqualTo(12);
        assertThat(result.maps.get("Fe").getRows()).isEqualTo(3);
        assertThat(result.maps.get("Fe").getColumns()).isEqualTo(4);
        assertThat(result.maps.get("Fe").max()).isZero();
        assertThat(result.aggregateSpectrum.isEmpty()).isTrue();
    }

    @Test
    void malformedFileIsRecordedAsFailedPoint() throws Exception {
        writeScan();
        Files.writeString(detectorDir.resolve("None_7.mca"), "<<DATA>>\n1\ngarbage\n<<END>>\n");

        AssemblyResult result = new GridAssemblyService(baseConfig().parseMode(ParseMode.STRICT).build())
                .assemble("10264", detectorDir);

        PointOutcome outcome = result.outcomes.get(6);
        assertThat(outcome.getStatus()).isEqualTo(PointOutcome.Status.FAILED);
        assertThat(outcome.getReason()).contains("line 3");
        assertThat(result.maps.get("Fe").get(GRID.rowOf(7), GRID.columnOf(7))).isZero();
        assertThat(result.failedCount).isEqualTo(1);
        assertThat(result.aggregateSpectrum.getSpectrumCount()).isEqualTo(11);
    }

    @Test
    void lenientParsingKeepsPointWithMalformedLine() throws Exception {
        writeScan();
        int[] counts = SpectrumFixtures.counts(CHANNELS, 219, 70, 278, 7);
        String text = SpectrumFixtures.spectrumText(counts).replace("<<DATA>>\n", "<<DATA>>\nnot-a-number\n");
        Files.writeString(detectorDir.resolve("None_7.mca"), text);

        AssemblyResult result = new GridAssemblyService(baseConfig().parseMode(ParseMode.LENIENT).build())
                .assemble("10264", detectorDir);

        assertThat(result.failedCount).isZero();
        assertThat(result.maps.get("Fe").get(GRID.rowOf(7), GRID.columnOf(7))).isEqualTo(70.0);
    }

    @Test
    void badSharedCalibrationFailsBeforeAnyFileIsRead() {
        MappingConfiguration tooFew = baseConfig().calibrationPoints(List.of(new CalibrationPoint(219, 6.4))).build();
        MappingConfiguration scattered = baseConfig().calibrationPoints(List.of(
                new CalibrationPoint(0, 1.0), new CalibrationPoint(100, 9.0),
                new CalibrationPoint(200, 2.0), new CalibrationPoint(300, 8.0))).build();

        assertThatThrownBy(() -> new GridAssemblyService(tooFew)).isInstanceOf(CalibrationException.class);
        assertThatThrownBy(() -> new GridAssemblyService(scattered)).isInstanceOf(CalibrationException.class);
    }

    @Test
    void elementOutsideDetectorRangeIsRejectedAtSetup() {
        ElementDefinition beyond = new ElementDefinition("U", "Uranium", "Kα", 98.4, 10);

        assertThatThrownBy(() -> new GridAssemblyService(baseConfig().elements(List.of(FE, beyond)).build()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("outside");
    }

    @Test
    void perFileCalibrationUsesEmbeddedPointsWithSharedFallback() throws Exception {
        // 5.0 keV is channel 50 under the embedded calibration, about channel 170 under the shared one
        ElementDefinition line = new ElementDefinition("X", "Test", "Kα", 5.0, 1);
        List<CalibrationPoint> embedded = List.of(new CalibrationPoint(10, 1.0), new CalibrationPoint(100, 10.0));
        int[] counts = SpectrumFixtures.counts(CHANNELS, 50, 7);
        for (int n = 1; n <= GRID.getPointCount(); n++) {
            List<CalibrationPoint> calibration = n % 2 == 0 ? embedded : List.of();
            SpectrumFixtures.write(detectorDir, "None_" + n + ".mca", SpectrumFixtures.spectrumText(counts, null, calibration));
        }
        MappingConfiguration.Builder config = baseConfig().elements(List.of(line));

        AssemblyResult perFile = new GridAssemblyService(config.calibrationSource(CalibrationSource.PER_FILE).build())
                .assemble("10264", detectorDir);
        AssemblyResult shared = new GridAssemblyService(config.calibrationSource(CalibrationSource.SHARED).build())
                .assemble("10264", detectorDir);

        ElementMap perFileMap = perFile.maps.get("X");
        assertThat(perFileMap.get(GRID.rowOf(2), GRID.columnOf(2))).isEqualTo(7.0);
        assertThat(perFileMap.get(GRID.rowOf(1), GRID.columnOf(1))).isZero();
        assertThat(shared.maps.get("X").max()).isZero();
        assertThat(perFile.processedCount).isEqualTo(12);
    }

    @Test
    void degenerateEmbeddedCalibrationFailsOnlyThatPoint() throws Exception {
        writeScan();
        List<CalibrationPoint> degenerate = List.of(new CalibrationPoint(100, 5.0), new CalibrationPoint(100, 6.0));
        int[] counts = SpectrumFixtures.counts(CHANNELS, 219, 30, 278, 3);
        SpectrumFixtures.write(detectorDir, "None_3.mca", SpectrumFixtures.spectrumText(counts, null, degenerate));

        AssemblyResult result = new GridAssemblyService(baseConfig().calibrationSource(CalibrationSource.PER_FILE).build())
                .assemble("10264", detectorDir);

        assertThat(result.outcomes.get(2).getStatus()).isEqualTo(PointOutcome.Status.FAILED);
        assertThat(result.processedCount).isEqualTo(11);
    }

    @Test
    void adaptiveModeMatchesDirectIntegration() throws Exception {
        int[] counts = SpectrumFixtures.trianglePeak(CHANNELS, 219, 400, 40);
        String text = SpectrumFixtures.spectrumText(counts, 2.0, List.of());
        for (int n = 1; n <= GRID.getPointCount(); n++) {
            SpectrumFixtures.write(detectorDir, "None_" + n + ".mca", text);
        }
        MappingConfiguration config = baseConfig()
                .integrationMode(IntegrationMode.ADAPTIVE)
                .signalBasis(SignalBasis.COUNTS_PER_SECOND)
                .build();
        GridAssemblyService service = new GridAssemblyService(config);

        AssemblyResult result = service.assemble("10264", detectorDir);

        Spectrum spectrum = new SpectrumReader(ParseMode.STRICT).parse(text, "reference");
        CalibrationModel calibration = service.getSharedCalibration();
        double expected = new AdaptiveWindowIntegrator(SignalBasis.COUNTS_PER_SECOND, 1.0).integrate(spectrum, FE, calibration);
        assertThat(expected).isGreaterThan(0.0);
        for (int n = 1; n <= GRID.getPointCount(); n++) {
            assertThat(result.maps.get("Fe").get(GRID.rowOf(n), GRID.columnOf(n))).isCloseTo(expected, within(1e-12));
        }
    }

    @Test
    void rerunIsIdempotent() throws Exception {
        writeScan(4);
        GridAssemblyService service = new GridAssemblyService(baseConfig().build());

        AssemblyResult first = service.assemble("10264", detectorDir);
        AssemblyResult second = service.assemble("10264", detectorDir);

        assertThat(second.maps.get("Fe").toArray()).isDeepEqualTo(first.maps.get("Fe").toArray());
        assertThat(second.outcomes.get(3).getStatus()).isEqualTo(PointOutcome.Status.MISSING);
    }

    @Test
    void interruptedCallerGetsInterruptedException() throws Exception {
        writeScan();
        GridAssemblyService service = new GridAssemblyService(baseConfig().parallel(false).build());

        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> service.assemble("10264", detectorDir)).isInstanceOf(InterruptedException.class);
        } finally {
            Thread.interrupted();
        }
    }
}
