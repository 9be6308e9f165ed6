package de.anton.xrf.analyser.xrf_analyzer.model;

import de.anton.xrf.analyser.xrf_analyzer.exception.SpectrumParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Reads line-oriented multichannel spectrum records (PMCA text format).
 * Expected layout:
 * - {@code <<PMCA SPECTRUM>>} (optional) followed by {@code KEY - VALUE} metadata lines
 * - {@code <<CALIBRATION>>} (optional): optional {@code LABEL} row, then "channel energy" pairs
 * - {@code <<DATA>>} (mandatory): one integer count per line
 * - {@code <<END>>}: reading stops here, anything after is ignored
 * Other {@code <<...>>} sections (ROI, configuration dumps) are skipped.
 */
public class SpectrumReader {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumReader.class);

    private static final String MARKER_HEADER = "<<PMCA SPECTRUM>>";
    private static final String MARKER_CALIBRATION = "<<CALIBRATION>>";
    private static final String MARKER_DATA = "<<DATA>>";
    private static final String MARKER_END = "<<END>>";
    private static final String CALIBRATION_LABEL = "LABEL";
    private static final String METADATA_SEPARATOR = " - ";

    private enum Section { METADATA, CALIBRATION, DATA, IGNORED }

    private final ParseMode parseMode;

    public SpectrumReader(ParseMode parseMode) {
        this.parseMode = Objects.requireNonNull(parseMode, "Parse mode cannot be null.");
    }

    public ParseMode getParseMode() {
        return parseMode;
    }

    /**
     * Reads a spectrum file.
     *
     * @param file The spectrum file to read.
     * @return The parsed spectrum.
     * @throws IOException If the file cannot be read or is malformed ({@link SpectrumParseException}).
     */
    public Spectrum read(Path file) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        // ISO-8859-1 never fails on stray bytes in instrument headers
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.ISO_8859_1)) {
            return read(reader, file.getFileName().toString());
        }
    }

    /** Parses a spectrum held in memory, mainly for fixtures and tests. */
    public Spectrum parse(String content, String sourceName) throws IOException {
        return read(new StringReader(content), sourceName);
    }

    /**
     * Reads a spectrum from a character stream. The stream is not closed.
     */
    public Spectrum read(Reader input, String sourceName) throws IOException {
        BufferedReader reader = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);
        Map<String, String> metadata = new LinkedHashMap<>();
        List<CalibrationPoint> calibrationPoints = new ArrayList<>();
        List<Integer> counts = new ArrayList<>();
        Section section = Section.METADATA;
        boolean sawData = false;
        int skippedLines = 0;
        int lineNumber = 0;

        String rawLine;
        while ((rawLine = reader.readLine()) != null) {
            lineNumber++;
            String line = rawLine.trim();
            if (line.isEmpty()) {
                continue;
            }

            if (line.startsWith("<<") && line.endsWith(">>")) {
                if (MARKER_END.equals(line)) {
                    break;
                }
                section = sectionFor(line);
                if (section == Section.DATA) {
                    sawData = true;
                }
                continue;
            }

            switch (section) {
                case DATA:
                    Integer count = parseCount(line);
                    if (count != null) {
                        counts.add(count);
                    } else {
                        handleMalformed(sourceName, lineNumber, "invalid count value '" + line + "'");
                        skippedLines++;
                    }
                    break;
                case CALIBRATION:
                    if (line.startsWith(CALIBRATION_LABEL)) {
                        continue;
                    }
                    CalibrationPoint point = parseCalibrationPoint(line);
                    if (point != null) {
                        calibrationPoints.add(point);
                    } else {
                        handleMalformed(sourceName, lineNumber, "invalid calibration line '" + line + "'");
                        skippedLines++;
                    }
                    break;
                case METADATA:
                    int separator = line.indexOf(METADATA_SEPARATOR);
                    if (separator >= 0) {
                        String key = line.substring(0, separator).trim();
                        String value = line.substring(separator + METADATA_SEPARATOR.length()).trim();
                        metadata.put(key, value);
                    } else {
                        logger.trace("{}: ignoring header line {} '{}'", sourceName, lineNumber, line);
                    }
                    break;
                default:
                    // Lines of sections the mapping does not use
                    break;
            }
        }

        if (!sawData) {
            throw new SpectrumParseException(sourceName, 0, "missing " + MARKER_DATA + " section");
        }
        if (skippedLines > 0) {
            logger.debug("{}: skipped {} malformed line(s) in lenient mode", sourceName, skippedLines);
        }

        int[] countArray = new int[counts.size()];
        for (int i = 0; i < countArray.length; i++) {
            countArray[i] = counts.get(i);
        }
        return new Spectrum(sourceName, countArray, metadata, calibrationPoints);
    }

    private static Section sectionFor(String marker) {
        switch (marker) {
            case MARKER_HEADER: return Section.METADATA;
            case MARKER_CALIBRATION: return Section.CALIBRATION;
            case MARKER_DATA: return Section.DATA;
            default: return Section.IGNORED;
        }
    }

    private void handleMalformed(String sourceName, int lineNumber, String message) throws SpectrumParseException {
        if (parseMode == ParseMode.STRICT) {
            throw new SpectrumParseException(sourceName, lineNumber, message);
        }
        logger.trace("{}: skipping line {}: {}", sourceName, lineNumber, message);
    }

    /** @return The non-negative count, or null if the line is not one. */
    private static Integer parseCount(String line) {
        try {
            int value = Integer.parseInt(line);
            return value >= 0 ? value : null;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** @return The point, or null if the line is not two numbers forming a valid point. */
    private static CalibrationPoint parseCalibrationPoint(String line) {
        String[] parts = line.split("\\s+");
        if (parts.length != 2) {
            return null;
        }
        try {
            double channel = Double.parseDouble(parts[0]);
            double energy = Double.parseDouble(parts[1]);
            if (channel != Math.rint(channel) || channel < 0 || channel > Integer.MAX_VALUE) {
                return null;
            }
            return new CalibrationPoint((int) channel, energy);
        } catch (IllegalArgumentException e) {
            // NumberFormatException or an out-of-range point
            return null;
        }
    }
}
