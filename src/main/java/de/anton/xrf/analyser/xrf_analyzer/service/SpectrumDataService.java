package de.anton.xrf.analyser.xrf_analyzer.service;

import de.anton.xrf.analyser.xrf_analyzer.exception.MissingSourceException;
import de.anton.xrf.analyser.xrf_analyzer.exception.SpectrumParseException;
import de.anton.xrf.analyser.xrf_analyzer.model.ParseMode;
import de.anton.xrf.analyser.xrf_analyzer.model.Spectrum;
import de.anton.xrf.analyser.xrf_analyzer.model.SpectrumReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Service responsible for loading spectrum files from disk.
 */
public class SpectrumDataService {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumDataService.class);
    private final SpectrumReader spectrumReader;

    public SpectrumDataService(ParseMode parseMode) {
        this.spectrumReader = new SpectrumReader(parseMode);
    }

    /**
     * Loads the spectrum stored in the given file.
     *
     * @param file The spectrum file.
     * @return The parsed spectrum.
     * @throws MissingSourceException If the file does not exist.
     * @throws SpectrumParseException If the content is malformed.
     * @throws IOException            For other read errors, with the file name added to the message.
     */
    public Spectrum loadSpectrum(Path file) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        if (!Files.isRegularFile(file)) {
            throw new MissingSourceException(file);
        }
        try {
            Spectrum spectrum = spectrumReader.read(file);
            logger.trace("Data Service: Loaded {} ({} channels)", file.getFileName(), spectrum.getChannelCount());
            return spectrum;
        } catch (NoSuchFileException e) {
            // Removed between the existence check and the read
            throw new MissingSourceException(file);
        } catch (SpectrumParseException e) {
            throw e;
        } catch (IOException e) {
            throw new IOException("Failed to read spectrum file " + file + ": " + e.getMessage(), e);
        }
    }

    public ParseMode getParseMode() {
        return spectrumReader.getParseMode();
    }
}
