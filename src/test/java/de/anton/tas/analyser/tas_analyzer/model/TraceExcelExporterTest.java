package de.anton.tas.analyser.tas_analyzer.model;

import org.apache.poi.ss.usermodel.*;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.Assert.*;

public class TraceExcelExporterTest {

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private final TraceExcelExporter exporter = new TraceExcelExporter();

    @Test
    public void eachTraceGetsItsOwnSheetWithBlankGaps() throws Exception {
        TransientAbsorptionTrace calibrated = new TransientAbsorptionTrace("10ps",
                new double[]{400.0, 400.5, 401.0}, new double[]{-0.1, Double.NaN, 0.2}, 5, true);
        TransientAbsorptionTrace raw = new TransientAbsorptionTrace("10PS",
                new double[]{0, 1}, new double[]{0.01, 0.02}, 1, false);
        Path file = tempFolder.getRoot().toPath().resolve("traces.xlsx");

        exporter.exportTraces(List.of(calibrated, raw), file);

        try (InputStream in = Files.newInputStream(file); Workbook workbook = new XSSFWorkbook(in)) {
            assertEquals(2, workbook.getNumberOfSheets());
            Sheet first = workbook.getSheetAt(0);
            assertEquals("10ps", first.getSheetName());
            assertEquals(TraceExcelExporter.HEADER_WAVELENGTH, first.getRow(0).getCell(0).getStringCellValue());
            assertEquals(TraceExcelExporter.HEADER_DELTA_ABS, first.getRow(0).getCell(1).getStringCellValue());
            assertEquals(400.5, first.getRow(2).getCell(0).getNumericCellValue(), 0.0);
            assertEquals(CellType.BLANK, first.getRow(2).getCell(1, Row.MissingCellPolicy.CREATE_NULL_AS_BLANK).getCellType());
            assertEquals(0.2, first.getRow(3).getCell(1).getNumericCellValue(), 0.0);

            Sheet second = workbook.getSheetAt(1);
            assertEquals("10PS (2)", second.getSheetName());
            assertEquals(TraceExcelExporter.HEADER_CHANNEL, second.getRow(0).getCell(0).getStringCellValue());
            assertEquals(3, second.getPhysicalNumberOfRows());
        }
    }

    @Test
    public void unnamedTraceAndUnsafeNamesGetValidSheetNames() throws Exception {
        TransientAbsorptionTrace unnamed = new TransientAbsorptionTrace(null, new double[]{0}, new double[]{0}, 1, false);
        TransientAbsorptionTrace slashed = new TransientAbsorptionTrace("run/1", new double[]{0}, new double[]{0}, 1, false);
        Path file = tempFolder.getRoot().toPath().resolve("names.xlsx");

        exporter.exportTraces(List.of(unnamed, slashed), file);

        try (InputStream in = Files.newInputStream(file); Workbook workbook = new XSSFWorkbook(in)) {
            assertEquals("Trace 1", workbook.getSheetName(0));
            assertFalse(workbook.getSheetName(1).contains("/"));
        }
    }

    @Test
    public void emptyListWritesNothing() throws Exception {
        Path file = tempFolder.getRoot().toPath().resolve("empty.xlsx");
        exporter.exportTraces(List.of(), file);
        assertFalse(Files.exists(file));
    }
}
