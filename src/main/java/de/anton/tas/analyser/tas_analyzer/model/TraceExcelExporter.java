package de.anton.tas.analyser.tas_analyzer.model;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.ss.util.WorkbookUtil;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Exports computed ΔAbs traces to an Excel file (.xlsx), one sheet per trace.
 */
public class TraceExcelExporter {

    private static final Logger logger = LoggerFactory.getLogger(TraceExcelExporter.class);

    static final String HEADER_WAVELENGTH = "Wavelength (nm)";
    static final String HEADER_CHANNEL = "Channel";
    static final String HEADER_DELTA_ABS = "ΔAbs";

    /**
     * Writes every trace to its own sheet, named after the data set.
     * NaN and infinite values are written as blank cells.
     *
     * @param traces   Traces to export; nothing is written if empty.
     * @param filePath Target .xlsx file, overwritten if present.
     * @throws IOException If the workbook cannot be written.
     */
    public void exportTraces(List<TransientAbsorptionTrace> traces, Path filePath) throws IOException {
        if (traces == null || traces.isEmpty()) { logger.warn("No traces provided for Excel export to {}", filePath); return; }
        if (filePath == null) { throw new IllegalArgumentException("Output file path cannot be null."); }

        logger.info("Starting Excel export of {} trace(s) to: {}", traces.size(), filePath);
        try (Workbook workbook = new XSSFWorkbook(); OutputStream fileOut = Files.newOutputStream(filePath)) {
            Font headerFont = workbook.createFont();
            headerFont.setBold(true);
            CellStyle headerStyle = workbook.createCellStyle();
            headerStyle.setFont(headerFont);

            Set<String> usedNames = new HashSet<>();
            int traceNo = 1;
            for (TransientAbsorptionTrace trace : traces) {
                Sheet sheet = workbook.createSheet(uniqueSheetName(trace.getName(), traceNo++, usedNames));

                Row headerRow = sheet.createRow(0);
                createHeaderCell(headerRow, 0, trace.isWavelengthAxis() ? HEADER_WAVELENGTH : HEADER_CHANNEL, headerStyle);
                createHeaderCell(headerRow, 1, HEADER_DELTA_ABS, headerStyle);

                for (int i = 0; i < trace.size(); i++) {
                    Row row = sheet.createRow(i + 1);
                    createNumericCell(row, 0, trace.getXAt(i));
                    createNumericCell(row, 1, trace.getDeltaAbsAt(i));
                }
                sheet.autoSizeColumn(0);
                sheet.autoSizeColumn(1);
                logger.debug("Sheet '{}' written with {} rows.", sheet.getSheetName(), trace.size());
            }

            workbook.write(fileOut);
            logger.info("Excel export completed successfully to: {}", filePath);
        } catch (IOException e) {
            logger.error("IOException during Excel export to {}", filePath, e);
            throw e;
        } catch (RuntimeException e) {
            logger.error("Unexpected error during Excel export to {}", filePath, e);
            throw new IOException("Unexpected error during Excel export: " + e.getMessage(), e);
        }
    }

    private static String uniqueSheetName(String traceName, int traceNo, Set<String> usedNames) {
        String base = (traceName == null || traceName.isBlank()) ? "Trace " + traceNo : WorkbookUtil.createSafeSheetName(traceName);
        String candidate = base;
        int suffix = 2;
        while (!usedNames.add(candidate.toLowerCase())) { // sheet names are case-insensitive
            String tail = " (" + suffix++ + ")";
            candidate = base.substring(0, Math.min(base.length(), 31 - tail.length())) + tail;
        }
        return candidate;
    }

    private void createHeaderCell(Row row, int colIndex, String text, CellStyle style) {
        Cell cell = row.createCell(colIndex);
        cell.setCellValue(text);
        cell.setCellStyle(style);
    }

    private void createNumericCell(Row row, int colIndex, double value) {
        if (!Double.isNaN(value) && !Double.isInfinite(value)) {
            row.createCell(colIndex).setCellValue(value);
        } else {
            row.createCell(colIndex, CellType.BLANK);
        }
    }
}
