package de.anton.xrf.analyser.xrf_analyzer.service;

import de.anton.xrf.analyser.xrf_analyzer.model.CalibrationPoint;
import de.anton.xrf.analyser.xrf_analyzer.model.ElementDefinition;
import de.anton.xrf.analyser.xrf_analyzer.model.RgbColor;
import de.anton.xrf.analyser.xrf_analyzer.model.ScanGrid;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reference values for the painted-panel scans: canonical calibration lines,
 * grid geometry, element table, detector ids and default colours.
 */
public final class DatasetDefaults {

    private DatasetDefaults() { throw new IllegalStateException("Constants class"); }

    public static final int ROWS = 60;
    public static final int COLUMNS = 120;
    public static final int MAX_CHANNEL = 2048;
    public static final String FILE_NAME_PATTERN = "None_%d.mca";

    public static final String DETECTOR_A = "10264";
    public static final String DETECTOR_B = "19511";
    /** Pseudo-detector holding the mean of both detectors. */
    public static final String STACKED = "stacked";
    public static final List<String> DETECTORS = List.of(DETECTOR_A, DETECTOR_B);

    public static final List<CalibrationPoint> CALIBRATION_POINTS = List.of(
            new CalibrationPoint(219, 6.400),   // Fe Kα
            new CalibrationPoint(278, 8.046),   // Cu Kα
            new CalibrationPoint(363, 10.551),  // Pb Lα
            new CalibrationPoint(436, 12.614),  // Pb Lβ
            new CalibrationPoint(869, 25.271)); // Sn Kα

    public static final List<ElementDefinition> ELEMENTS = List.of(
            new ElementDefinition("Ca", "Calcium", "Kα", 3.692, 15),
            new ElementDefinition("Ti", "Titanium", "Kα", 4.510, 10),
            new ElementDefinition("Fe", "Iron", "Kα", 6.400, 10, 219),
            new ElementDefinition("Cu", "Copper", "Kα", 8.046, 10, 278),
            new ElementDefinition("Pb_La", "Lead", "Lα", 10.551, 10, 363),
            new ElementDefinition("Pb_Lb", "Lead", "Lβ", 12.614, 10, 436),
            new ElementDefinition("Sn", "Tin", "Kα", 25.271, 15, 869));

    /** Colours of the additive composite. Pb Lβ duplicates Pb Lα and is left out. */
    public static final Map<String, RgbColor> COMPOSITE_COLORS = orderedMap(
            "Ca", new RgbColor(0.0, 0.65, 1.0),
            "Ti", new RgbColor(0.65, 0.0, 1.0),
            "Fe", new RgbColor(1.0, 0.2, 0.0),
            "Cu", new RgbColor(0.0, 0.9, 0.15),
            "Pb_La", new RgbColor(1.0, 0.9, 0.0),
            "Sn", new RgbColor(1.0, 0.0, 0.8));

    /** Red, green and blue maps of the direct triplet composite. */
    public static final List<String> RGB_TRIPLET = List.of("Fe", "Cu", "Pb_La");

    /** Pigment colours of the weighted reconstruction (ochre, white, red earth, azurite...). */
    public static final Map<String, RgbColor> PIGMENT_COLORS = orderedMap(
            "Ca", new RgbColor(0.93, 0.87, 0.72),
            "Ti", new RgbColor(0.96, 0.96, 0.94),
            "Fe", new RgbColor(0.68, 0.20, 0.03),
            "Cu", new RgbColor(0.09, 0.27, 0.70),
            "Pb_La", new RgbColor(0.94, 0.91, 0.80),
            "Sn", new RgbColor(0.84, 0.68, 0.03));

    public static final Map<String, Double> PIGMENT_WEIGHTS = Map.of(
            "Ca", 0.45,
            "Ti", 0.40,
            "Fe", 1.5,
            "Cu", 1.4,
            "Pb_La", 0.75,
            "Sn", 1.15);

    public static ScanGrid grid() {
        return new ScanGrid(ROWS, COLUMNS);
    }

    private static Map<String, RgbColor> orderedMap(Object... keyValues) {
        Map<String, RgbColor> map = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            map.put((String) keyValues[i], (RgbColor) keyValues[i + 1]);
        }
        return Collections.unmodifiableMap(map);
    }
}
