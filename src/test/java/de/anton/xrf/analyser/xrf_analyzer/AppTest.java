package de.anton.xrf.analyser.xrf_analyzer;

import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationSource;
import de.anton.xrf.analyser.xrf_analyzer.model.IntegrationMode;
import de.anton.xrf.analyser.xrf_analyzer.model.NpyArrayIO;
import de.anton.xrf.analyser.xrf_analyzer.model.ParseMode;
import de.anton.xrf.analyser.xrf_analyzer.service.MappingConfiguration;
import de.anton.xrf.analyser.xrf_analyzer.support.SpectrumFixtures;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AppTest {

    @Test
    void parsesAllOptions() {
        App.Options options = App.parseArguments(new String[] {
                "data/panel", "panel_a", "--cache", "tmp/cache", "--export", "out.xlsx",
                "--mode", "adaptive", "--lenient", "--per-file-calibration"});

        MappingConfiguration config = options.config.build();
        assertThat(options.datasetDir).isEqualTo(Paths.get("data/panel"));
        assertThat(options.datasetLabel).isEqualTo("panel_a");
        assertThat(options.cacheDir).isEqualTo(Paths.get("tmp/cache"));
        assertThat(options.exportFile).isEqualTo(Paths.get("out.xlsx"));
        assertThat(config.integrationMode()).isEqualTo(IntegrationMode.ADAPTIVE);
        assertThat(config.parseMode()).isEqualTo(ParseMode.LENIENT);
        assertThat(config.calibrationSource()).isEqualTo(CalibrationSource.PER_FILE);
    }

    @Test
    void datasetLabelDefaultsToDirectoryName() {
        App.Options options = App.parseArguments(new String[] {"scans/panel_b"});

        assertThat(options.datasetLabel).isEqualTo("panel_b");
        assertThat(options.config.build().integrationMode()).isEqualTo(IntegrationMode.FIXED);
    }

    @Test
    void rejectsUnknownOptionsAndMissingValues() {
        assertThatThrownBy(() -> App.parseArguments(new String[] {"d", "--fast"})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> App.parseArguments(new String[] {"d", "--mode"})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> App.parseArguments(new String[] {"d", "--mode", "gaussian"})).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> App.parseArguments(new String[0])).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void runWithoutDetectorDataFails(@TempDir Path dir) {
        int status = App.run(new String[] {dir.toString(), "empty", "--cache", dir.resolve("cache").toString()});

        assertThat(status).isEqualTo(App.EXIT_FAILURE);
    }

    @Test
    void runBuildsCachesAndExportsDataset(@TempDir Path dir) throws Exception {
        Path dataset = dir.resolve("panel_c");
        Files.createDirectories(dataset.resolve("10264"));
        SpectrumFixtures.write(dataset.resolve("19511"), "None_121.mca",
                SpectrumFixtures.spectrumText(SpectrumFixtures.counts(1024, 219, 500, 363, 80)));
        Path cache = dir.resolve("cache");
        Path export = dir.resolve("panel_c.xlsx");

        int status = App.run(new String[] {dataset.toString(), "--cache", cache.toString(), "--export", export.toString()});

        assertThat(status).isEqualTo(App.EXIT_OK);
        assertThat(export).isRegularFile();
        Path entries = cache.resolve("panel_c").resolve("fixed-strict-shared");
        assertThat(entries.resolve("19511_Fe.npy")).isRegularFile();
        assertThat(entries.resolve("10264_Sn.npy")).isRegularFile();
        double[][] fe = NpyArrayIO.read(entries.resolve("19511_Fe.npy"));
        assertThat(fe[1][0]).isEqualTo(500.0);
    }

    @Test
    void cachedFixedMapsAreNotServedToAdaptiveRun(@TempDir Path dir) throws Exception {
        Path dataset = dir.resolve("panel_d");
        Files.createDirectories(dataset.resolve("10264"));
        SpectrumFixtures.write(dataset.resolve("19511"), "None_121.mca",
                SpectrumFixtures.spectrumText(SpectrumFixtures.counts(1024, 219, 500, 363, 80)));
        Path sharedCache = dir.resolve("shared");
        Path freshCache = dir.resolve("fresh");

        assertThat(App.run(new String[] {dataset.toString(), "--cache", sharedCache.toString()})).isEqualTo(App.EXIT_OK);
        assertThat(App.run(new String[] {dataset.toString(), "--cache", sharedCache.toString(), "--mode", "ADAPTIVE"}))
                .isEqualTo(App.EXIT_OK);
        assertThat(App.run(new String[] {dataset.toString(), "--cache", freshCache.toString(), "--mode", "ADAPTIVE"}))
                .isEqualTo(App.EXIT_OK);

        String adaptiveVariant = MappingConfiguration.builder().integrationMode(IntegrationMode.ADAPTIVE).build().cacheVariant();
        double[][] fixed = NpyArrayIO.read(sharedCache.resolve("panel_d").resolve("fixed-strict-shared").resolve("19511_Fe.npy"));
        double[][] adaptiveAfterFixed = NpyArrayIO.read(sharedCache.resolve("panel_d").resolve(adaptiveVariant).resolve("19511_Fe.npy"));
        double[][] adaptiveFresh = NpyArrayIO.read(freshCache.resolve("panel_d").resolve(adaptiveVariant).resolve("19511_Fe.npy"));

        assertThat(fixed[1][0]).isEqualTo(500.0);
        assertThat(adaptiveAfterFixed).isDeepEqualTo(adaptiveFresh);
    }

    @Test
    void runWithBadArgumentsReportsUsage() {
        assertThat(App.run(new String[0])).isEqualTo(App.EXIT_USAGE);
    }
}
