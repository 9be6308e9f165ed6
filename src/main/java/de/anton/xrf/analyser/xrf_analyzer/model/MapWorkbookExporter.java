package de.anton.xrf.analyser.xrf_analyzer.model;

import de.anton.xrf.analyser.xrf_analyzer.algorithms.MapNormalizer;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Exports element maps and comparison statistics to an Excel workbook (.xlsx).
 */
public class MapWorkbookExporter {

    private static final Logger logger = LoggerFactory.getLogger(MapWorkbookExporter.class);

    public static final String SUMMARY_SHEET = "Summary";
    public static final String COMPARISON_SHEET = "Comparison";
    private static final int MAX_SHEET_NAME_LENGTH = 31;
    private static final int COLUMN_WIDTH = 20 * 256;

    private static final List<String> SUMMARY_COLUMNS = List.of(
            "Detector", "Element", "Name", "Line", "Energy (keV)", "Centre channel", "Half-width",
            "Min", "Mean", "Max", "P1", "P99");
    private static final List<String> COMPARISON_COLUMNS = List.of(
            "Element", "Pearson r (normalised)", "Pearson r (raw)", "RMS Δ (normalised)", "Slope", "Intercept");

    /**
     * Writes the workbook: a summary sheet, a comparison sheet if statistics are given, and
     * one sheet per detector and element holding the raw map values.
     *
     * @param file            Target file, overwritten if present.
     * @param mapsByDetector  Element maps keyed by detector id, then element id.
     * @param elements        Element definitions, in the order of the summary rows.
     * @param calibration     Shared calibration, used for the centre channel column.
     * @param comparisons     Comparison statistics, may be empty.
     * @throws IOException If the workbook cannot be written.
     */
    public void export(Path file, Map<String, Map<String, ElementMap>> mapsByDetector, List<ElementDefinition> elements,
                       CalibrationModel calibration, Collection<MapComparison> comparisons) throws IOException {
        Objects.requireNonNull(file, "Output file cannot be null.");
        Objects.requireNonNull(mapsByDetector, "Maps cannot be null.");
        Objects.requireNonNull(elements, "Element definitions cannot be null.");
        logger.info("Starting workbook export to: {}", file);
        try (Workbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(file)) {
            CellStyle headerStyle = headerStyle(workbook);
            writeSummary(workbook.createSheet(SUMMARY_SHEET), headerStyle, mapsByDetector, elements, calibration);
            if (comparisons != null && !comparisons.isEmpty()) {
                writeComparison(workbook.createSheet(COMPARISON_SHEET), headerStyle, comparisons);
            }
            for (Map.Entry<String, Map<String, ElementMap>> detector : mapsByDetector.entrySet()) {
                for (ElementDefinition element : elements) {
                    ElementMap map = detector.getValue().get(element.getId());
                    if (map != null) {
                        writeMap(workbook.createSheet(sheetName(detector.getKey(), element.getId())), map);
                    }
                }
            }
            workbook.write(out);
            logger.info("Workbook export completed successfully to: {}", file);
        } catch (IOException e) {
            logger.error("IOException during workbook export to {}", file, e);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error during workbook export to {}", file, e);
            throw new IOException("Unexpected error during workbook export: " + e.getMessage(), e);
        }
    }

    /** Sheet name for a detector/element map, cut to the 31 characters Excel allows. */
    static String sheetName(String detectorId, String elementId) {
        String name = (detectorId + "_" + elementId).replaceAll("[\\\\/?*\\[\\]:]", "-");
        return name.length() > MAX_SHEET_NAME_LENGTH ? name.substring(0, MAX_SHEET_NAME_LENGTH) : name;
    }

    private void writeSummary(Sheet sheet, CellStyle headerStyle, Map<String, Map<String, ElementMap>> mapsByDetector,
                              List<ElementDefinition> elements, CalibrationModel calibration) {
        writeHeader(sheet, headerStyle, SUMMARY_COLUMNS);
        int rowNum = 1;
        for (Map.Entry<String, Map<String, ElementMap>> detector : mapsByDetector.entrySet()) {
            for (ElementDefinition element : elements) {
                ElementMap map = detector.getValue().get(element.getId());
                if (map == null) {
                    continue;
                }
                Row row = sheet.createRow(rowNum++);
                int cellNum = 0;
                row.createCell(cellNum++).setCellValue(detector.getKey());
                row.createCell(cellNum++).setCellValue(element.getId());
                row.createCell(cellNum++).setCellValue(element.getName());
                row.createCell(cellNum++).setCellValue(element.getLineLabel());
                createNumericCell(row, cellNum++, element.getEnergyKeV());
                if (calibration != null) {
                    row.createCell(cellNum++).setCellValue(element.centerChannel(calibration));
                } else {
                    row.createCell(cellNum++, CellType.BLANK);
                }
                row.createCell(cellNum++).setCellValue(element.getHalfWidth());
                double[] values = map.flatten();
                createNumericCell(row, cellNum++, map.min());
                createNumericCell(row, cellNum++, map.mean());
                createNumericCell(row, cellNum++, map.max());
                createNumericCell(row, cellNum++, values.length == 0 ? Double.NaN : MapNormalizer.percentileOf(values, 1));
                createNumericCell(row, cellNum, values.length == 0 ? Double.NaN : MapNormalizer.percentileOf(values, 99));
            }
        }
        sizeColumns(sheet, SUMMARY_COLUMNS.size());
    }

    private void writeComparison(Sheet sheet, CellStyle headerStyle, Collection<MapComparison> comparisons) {
        writeHeader(sheet, headerStyle, COMPARISON_COLUMNS);
        int rowNum = 1;
        for (MapComparison comparison : comparisons) {
            Row row = sheet.createRow(rowNum++);
            row.createCell(0).setCellValue(comparison.elementId());
            createNumericCell(row, 1, comparison.pearsonNormalized());
            createNumericCell(row, 2, comparison.pearsonRaw());
            createNumericCell(row, 3, comparison.rmsDifference());
            createNumericCell(row, 4, comparison.slope());
            createNumericCell(row, 5, comparison.intercept());
        }
        sizeColumns(sheet, COMPARISON_COLUMNS.size());
    }

    private void writeMap(Sheet sheet, ElementMap map) {
        for (int r = 0; r < map.getRows(); r++) {
            Row row = sheet.createRow(r);
            for (int c = 0; c < map.getColumns(); c++) {
                createNumericCell(row, c, map.get(r, c));
            }
        }
    }

    private CellStyle headerStyle(Workbook workbook) {
        Font headerFont = workbook.createFont();
        headerFont.setBold(true);
        CellStyle style = workbook.createCellStyle();
        style.setFont(headerFont);
        return style;
    }

    private void writeHeader(Sheet sheet, CellStyle style, List<String> columns) {
        Row header = sheet.createRow(0);
        for (int i = 0; i < columns.size(); i++) {
            Cell cell = header.createCell(i);
            cell.setCellValue(columns.get(i));
            cell.setCellStyle(style);
        }
    }

    // Fixed widths; autoSizeColumn needs AWT font metrics, which headless hosts often lack
    private void sizeColumns(Sheet sheet, int columnCount) {
        for (int i = 0; i < columnCount; i++) {
            sheet.setColumnWidth(i, COLUMN_WIDTH);
        }
    }

    private void createNumericCell(Row row, int colIndex, double value) {
        if (Double.isFinite(value)) {
            row.createCell(colIndex).setCellValue(value);
        } else {
            row.createCell(colIndex, CellType.BLANK);
        }
    }
}
