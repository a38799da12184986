package de.anton.tas.analyser.tas_analyzer.controller;

import de.anton.tas.analyser.tas_analyzer.model.*;
import de.anton.tas.analyser.tas_analyzer.service.AnalysisSettings;
import de.anton.tas.analyser.tas_analyzer.service.CalibrationService;
import de.anton.tas.analyser.tas_analyzer.service.TransientAbsorptionService;
import de.anton.tas.analyser.tas_analyzer.view.CalibrationDialog;
import de.anton.tas.analyser.tas_analyzer.view.ChartDialog;
import de.anton.tas.analyser.tas_analyzer.view.MainView;
import de.anton.tas.analyser.tas_analyzer.view.TraceChartFactory;
import org.jfree.chart.JFreeChart;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.swing.*;
import javax.swing.filechooser.FileNameExtensionFilter;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.beans.PropertyChangeEvent;
import java.beans.PropertyChangeListener;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

/**
 * Controller wiring the Swing views to the parser, registry and analysis services.
 * All work runs on the EDT except the Excel export.
 */
public class AppController implements PropertyChangeListener {

    private static final Logger logger = LoggerFactory.getLogger(AppController.class);

    private static final FileNameExtensionFilter JSON_FILTER = new FileNameExtensionFilter("Kalibrierung (*.json)", "json");
    private static final FileNameExtensionFilter XLSX_FILTER = new FileNameExtensionFilter("Excel Dateien (*.xlsx)", "xlsx");
    private static final FileNameExtensionFilter TEXT_FILTER = new FileNameExtensionFilter("Spektren (*.txt, *.csv, *.dat)", "txt", "csv", "dat");
    static final String UNSAVED_NAME = "Aktuell";

    private final MainView mainView;
    private final DatasetRegistry registry;
    private final CalibrationModel calibrationModel;
    private final CalibrationService calibrationService;
    private final TransientAbsorptionService absorptionService;
    private final SpectrumParser parser;
    private final TraceExcelExporter excelExporter;

    private AnalysisSettings settings = AnalysisSettings.defaults();
    private CalibrationDialog calibrationDialog = null;
    private Spectrum calibrationDark = null;

    public AppController(MainView mainView, DatasetRegistry registry, CalibrationModel calibrationModel) {
        this.mainView = mainView;
        this.registry = registry;
        this.calibrationModel = calibrationModel;
        this.calibrationService = new CalibrationService(calibrationModel);
        this.absorptionService = new TransientAbsorptionService();
        this.parser = new SpectrumParser();
        this.excelExporter = new TraceExcelExporter();

        this.registry.addPropertyChangeListener(this);
        this.calibrationModel.addPropertyChangeListener(this);
        initializeListeners();
        mainView.setDataSetNames(registry.list());
        mainView.setCalibrationText(calibrationModel.equationText());
        logger.info("AppController initialized.");
    }

    private void initializeListeners() {
        mainView.getSaveDataSetButton().addActionListener(e -> handleSaveDataSet());
        mainView.getDeleteDataSetButton().addActionListener(e -> handleDeleteDataSets());
        mainView.getPlotDeltaAbsButton().addActionListener(e -> handlePlotDeltaAbs());
        mainView.getPlotDifferenceButton().addActionListener(e -> handlePlotDifference());
        mainView.getTasOverlayButton().addActionListener(e -> handleTasOverlay());
        mainView.getExportExcelButton().addActionListener(e -> handleExportExcel());
        mainView.getLoadCalibrationButton().addActionListener(e -> handleLoadCalibration());
        mainView.getCalibrationButton().addActionListener(e -> showCalibrationDialog());
        mainView.getDataSetList().addMouseListener(new MouseAdapter() {
            @Override
            public void mouseClicked(MouseEvent e) {
                if (e.getClickCount() == 2) {
                    handleShowDataSet(mainView.getDataSetList().getSelectedValue());
                }
            }
        });
    }

    // --- Data sets ---

    private void handleSaveDataSet() {
        String name = mainView.getDataSetNameField().getText();
        if (name == null || name.trim().isEmpty()) {
            showErrorDialogOnEDT("Bitte einen Namen für den Datensatz eingeben.");
            return;
        }
        try {
            Map<SpectrumLabel, Spectrum> spectra = parseSpectraFromView();
            boolean overwrite = registry.contains(name);
            DataSet saved = registry.save(name, spectra);
            mainView.setStatusLabel("Datensatz '" + saved.getName() + "' " + (overwrite ? "überschrieben." : "gespeichert."));
        } catch (SpectrumFormatException e) {
            logger.warn("Data set '{}' not saved: {}", name, e.getMessage());
            showErrorDialogOnEDT("Eingabefehler:\n" + e.getMessage());
        }
    }

    private void handleDeleteDataSets() {
        List<String> selected = mainView.getDataSetList().getSelectedValuesList();
        if (selected.isEmpty()) {
            showInfoDialogOnEDT("Bitte Datensätze zum Löschen auswählen.");
            return;
        }
        int deleted = 0;
        for (String name : selected) {
            if (registry.delete(name)) deleted++;
        }
        mainView.setStatusLabel(deleted + " Datensatz/Datensätze gelöscht.");
    }

    /** Fills the six text areas with a stored data set so it can be inspected or edited. */
    private void handleShowDataSet(String name) {
        if (name == null) return;
        try {
            DataSet dataSet = registry.load(name);
            for (SpectrumLabel label : SpectrumLabel.values()) {
                mainView.getSpectrumArea(label).setText(formatSpectrum(dataSet.get(label)));
            }
            mainView.getDataSetNameField().setText(dataSet.getName());
            mainView.setStatusLabel("Datensatz '" + name + "' geladen.");
        } catch (DataSetNotFoundException e) {
            logger.warn("Selected data set vanished: {}", e.getMessage());
            showErrorDialogOnEDT(e.getMessage());
        }
    }

    // --- ΔAbs ---

    private void handlePlotDeltaAbs() {
        if (!updateSmoothingWidth()) return;
        try {
            Map<SpectrumLabel, Spectrum> spectra = parseSpectraFromView();
            DataSet current = new DataSet(currentName(), spectra);
            TransientAbsorptionTrace trace = absorptionService.compute(current, settings.smoothingWidth(), calibrationModel);
            showChart("ΔAbs - " + current.getName(), TraceChartFactory.createTraceChart("ΔAbs - " + current.getName(), List.of(trace)));
            int gaps = trace.countGaps();
            mainView.setStatusLabel("ΔAbs berechnet (" + trace.size() + " Kanäle" + (gaps > 0 ? ", " + gaps + " undefiniert" : "") + ").");
        } catch (SpectrumFormatException | SpectrumLengthMismatchException e) {
            logger.warn("ΔAbs plot aborted: {}", e.getMessage());
            showErrorDialogOnEDT("ΔAbs konnte nicht berechnet werden:\n" + e.getMessage());
        }
    }

    private void handlePlotDifference() {
        try {
            DataSet current = new DataSet(currentName(), parseSpectraFromView());
            DifferenceSpectra spectra = absorptionService.computeDifferenceSpectra(current, calibrationModel);
            String title = "Differenzspektren - " + current.getName();
            showChart(title, TraceChartFactory.createDifferenceChart(title, spectra, calibrationModel.isCalibrated()));
        } catch (SpectrumFormatException | SpectrumLengthMismatchException e) {
            logger.warn("Difference plot aborted: {}", e.getMessage());
            showErrorDialogOnEDT("Differenzspektren konnten nicht berechnet werden:\n" + e.getMessage());
        }
    }

    private void handleTasOverlay() {
        List<String> names = selectedOrAllNames();
        if (names.isEmpty()) {
            showInfoDialogOnEDT("Keine gespeicherten Datensätze vorhanden.");
            return;
        }
        if (!updateSmoothingWidth()) return;
        try {
            List<TransientAbsorptionTrace> traces = absorptionService.computeAll(registry, names, settings.smoothingWidth(), calibrationModel);
            showChart("TAS Overlay", TraceChartFactory.createTraceChart("TAS Overlay", traces));
            mainView.setStatusLabel(traces.size() + " ΔAbs-Kurve(n) überlagert.");
        } catch (DataSetNotFoundException | SpectrumLengthMismatchException e) {
            logger.warn("Overlay aborted: {}", e.getMessage());
            showErrorDialogOnEDT("Overlay fehlgeschlagen:\n" + e.getMessage());
        }
    }

    private void handleExportExcel() {
        List<String> names = selectedOrAllNames();
        if (names.isEmpty()) {
            showInfoDialogOnEDT("Keine gespeicherten Datensätze zum Exportieren.");
            return;
        }
        if (!updateSmoothingWidth()) return;
        List<TransientAbsorptionTrace> traces;
        try {
            traces = absorptionService.computeAll(registry, names, settings.smoothingWidth(), calibrationModel);
        } catch (DataSetNotFoundException | SpectrumLengthMismatchException e) {
            logger.warn("Export aborted before writing: {}", e.getMessage());
            showErrorDialogOnEDT("Export fehlgeschlagen:\n" + e.getMessage());
            return;
        }
        File file = chooseFile("ΔAbs exportieren", XLSX_FILTER, true);
        if (file == null) return;
        Path outputPath = withExtension(file, ".xlsx");

        logger.info("Exporting {} trace(s) to {}", traces.size(), outputPath);
        mainView.setStatusLabel("Exportiere nach " + outputPath.getFileName() + "...");
        mainView.setBusyState(true);
        SwingWorker<Void, Void> exportWorker = new SwingWorker<>() {
            @Override
            protected Void doInBackground() throws Exception {
                excelExporter.exportTraces(traces, outputPath);
                return null;
            }

            @Override
            protected void done() {
                mainView.setBusyState(false);
                try {
                    get();
                    mainView.setStatusLabel("Exportiert: " + outputPath.getFileName());
                    showInfoDialogOnEDT("Daten exportiert nach:\n" + outputPath);
                } catch (ExecutionException e) {
                    logger.error("Excel export failed", e.getCause());
                    showErrorDialogOnEDT("Fehler beim Exportieren:\n" + formatErrorMessage(e.getCause()));
                    mainView.setStatusLabel("Export fehlgeschlagen.");
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    logger.info("Export worker interrupted.");
                    mainView.setStatusLabel("Export abgebrochen.");
                }
            }
        };
        exportWorker.execute();
    }

    // --- Calibration ---

    private void handleLoadCalibration() {
        File file = chooseFile("Kalibrierung laden", JSON_FILTER, false);
        if (file == null) return;
        try {
            CalibrationCoefficients loaded = calibrationService.loadCalibration(file.toPath());
            logger.info("Calibration loaded from {}: {}", file, loaded);
            mainView.setStatusLabel("Kalibrierung geladen: " + file.getName());
        } catch (IOException e) {
            logger.error("Could not load calibration from {}", file, e);
            showErrorDialogOnEDT("Kalibrierung konnte nicht geladen werden:\n" + formatErrorMessage(e));
        }
    }

    private void showCalibrationDialog() {
        if (calibrationDialog == null) {
            calibrationDialog = new CalibrationDialog(mainView, settings);
            calibrationDialog.getOpenFileButton().addActionListener(e -> handleOpenSpectrumFile());
            calibrationDialog.getSetDarkButton().addActionListener(e -> handleSetCalibrationDark());
            calibrationDialog.getPlotSpectrumButton().addActionListener(e -> handlePlotCalibrationSpectrum());
            calibrationDialog.getDetectPeaksButton().addActionListener(e -> handleDetectPeaks());
            calibrationDialog.getCalibrateButton().addActionListener(e -> handleCalibrate());
            calibrationDialog.getSaveButton().addActionListener(e -> handleSaveCalibration());
            calibrationDialog.getAddRowButton().addActionListener(e -> calibrationDialog.addRow());
            calibrationDialog.getRemoveRowButton().addActionListener(e -> calibrationDialog.removeLastRow());
            calibrationDialog.setEquation(calibrationModel.equationText(), calibrationModel.range());
        }
        calibrationDialog.setVisible(true);
        calibrationDialog.toFront();
    }

    private void handleOpenSpectrumFile() {
        File file = chooseFile("Spektrum öffnen", TEXT_FILTER, false);
        if (file == null) return;
        try {
            calibrationDialog.getSpectrumArea().setText(Files.readString(file.toPath(), StandardCharsets.UTF_8));
            logger.info("Calibration spectrum loaded from {}", file);
        } catch (IOException e) {
            logger.error("Could not read spectrum file {}", file, e);
            showErrorDialogOnEDT("Datei konnte nicht gelesen werden:\n" + formatErrorMessage(e));
        }
    }

    private void handleSetCalibrationDark() {
        try {
            calibrationDark = parser.parse("dark", calibrationDialog.getSpectrumArea().getText());
            calibrationDialog.setDarkInfo("Dunkel: " + calibrationDark.size() + " Kanäle");
        } catch (SpectrumFormatException e) {
            showErrorDialogOnEDT("Eingabefehler:\n" + e.getMessage());
        }
    }

    private void handlePlotCalibrationSpectrum() {
        try {
            Spectrum spectrum = parser.parse("spectrum", calibrationDialog.getSpectrumArea().getText());
            double[][] xy = calibrationService.darkCorrectedAxis(spectrum, calibrationDark);
            String title = calibrationDark != null ? "Spektrum (dunkelkorrigiert)" : "Spektrum";
            calibrationDialog.showChart(TraceChartFactory.createSpectrumChart(title, xy[0], xy[1], calibrationModel.isCalibrated()));
        } catch (SpectrumFormatException | SpectrumLengthMismatchException e) {
            logger.warn("Spectrum plot aborted: {}", e.getMessage());
            showErrorDialogOnEDT(e.getMessage());
        }
    }

    private void handleDetectPeaks() {
        try {
            settings = new AnalysisSettings(settings.smoothingWidth(), calibrationDialog.getProminence(),
                    calibrationDialog.getDistance(), calibrationDialog.getTopK());
            Spectrum spectrum = parser.parse("lamp", calibrationDialog.getSpectrumArea().getText());
            List<Integer> channels = calibrationService.detectCalibrationChannels(spectrum, settings);
            calibrationDialog.setDetectedChannels(channels);
            calibrationDialog.showChart(TraceChartFactory.createPeakChart("Peaks", spectrum.toArray(), channels));
            if (channels.isEmpty()) {
                showInfoDialogOnEDT("Keine Peaks gefunden. Prominenz oder Abstand verringern.");
            }
        } catch (SpectrumFormatException e) {
            showErrorDialogOnEDT("Eingabefehler:\n" + e.getMessage());
        } catch (IllegalArgumentException e) {
            showErrorDialogOnEDT("Ungültiger Parameterwert: " + e.getMessage());
        }
    }

    private void handleCalibrate() {
        try {
            CalibrationCoefficients coefficients = calibrationService.calibrate(calibrationDialog.getCalibrationPoints());
            mainView.setStatusLabel("Kalibriert: a=" + coefficients.a() + ", b=" + coefficients.b());
        } catch (InsufficientCalibrationPointsException e) {
            logger.warn("Calibration rejected: {}", e.getMessage());
            showErrorDialogOnEDT(e.getMessage());
        }
    }

    private void handleSaveCalibration() {
        if (!calibrationModel.isCalibrated()) {
            showInfoDialogOnEDT("Bitte zuerst kalibrieren.");
            return;
        }
        File file = chooseFile("Kalibrierung speichern", JSON_FILTER, true);
        if (file == null) return;
        Path target = withExtension(file, ".json");
        try {
            calibrationService.saveCalibration(target);
            mainView.setStatusLabel("Kalibrierung gespeichert: " + target.getFileName());
        } catch (IOException e) {
            logger.error("Could not save calibration to {}", target, e);
            showErrorDialogOnEDT("Kalibrierung konnte nicht gespeichert werden:\n" + formatErrorMessage(e));
        }
    }

    // --- Helpers ---

    private Map<SpectrumLabel, Spectrum> parseSpectraFromView() throws SpectrumFormatException {
        Map<SpectrumLabel, Spectrum> spectra = new EnumMap<>(SpectrumLabel.class);
        for (SpectrumLabel label : SpectrumLabel.values()) {
            spectra.put(label, parser.parse(label, mainView.getSpectrumArea(label).getText()));
        }
        return spectra;
    }

    /**
     * Takes the spinner's smoothing width into the settings. The spinner accepts typed even
     * values, so a rejected width is reported here and the calling action is skipped.
     *
     * @return false if the width was invalid and an error dialog was shown.
     */
    private boolean updateSmoothingWidth() {
        int width = mainView.getSmoothingWidth();
        try {
            settings = applySmoothingWidth(settings, width);
            return true;
        } catch (IllegalArgumentException e) {
            logger.warn("Rejected smoothing width {}: {}", width, e.getMessage());
            showErrorDialogOnEDT("Ungültiger Parameterwert: " + e.getMessage());
            return false;
        }
    }

    static AnalysisSettings applySmoothingWidth(AnalysisSettings settings, int width) {
        if (width == settings.smoothingWidth()) {
            return settings;
        }
        AnalysisSettings updated = settings.withSmoothingWidth(width);
        logger.debug("Smoothing width set to {}", width);
        return updated;
    }

    private String currentName() {
        String name = mainView.getDataSetNameField().getText();
        return name == null || name.trim().isEmpty() ? UNSAVED_NAME : name;
    }

    private List<String> selectedOrAllNames() {
        List<String> selected = mainView.getDataSetList().getSelectedValuesList();
        return selected.isEmpty() ? registry.list() : selected;
    }

    private void showChart(String title, JFreeChart chart) {
        ChartDialog dialog = new ChartDialog(mainView, title, chart);
        dialog.setVisible(true);
    }

    private File chooseFile(String title, FileNameExtensionFilter filter, boolean save) {
        JFileChooser fileChooser = mainView.getFileChooser();
        fileChooser.setDialogTitle(title);
        fileChooser.resetChoosableFileFilters();
        fileChooser.setFileFilter(filter);
        int rv = save ? fileChooser.showSaveDialog(mainView) : fileChooser.showOpenDialog(mainView);
        if (rv != JFileChooser.APPROVE_OPTION) {
            logger.debug("File selection cancelled: {}", title);
            return null;
        }
        return fileChooser.getSelectedFile();
    }

    static Path withExtension(File file, String extension) {
        String name = file.getName();
        return name.toLowerCase().endsWith(extension) ? file.toPath() : file.toPath().resolveSibling(name + extension);
    }

    static String formatSpectrum(Spectrum spectrum) {
        return Arrays.stream(spectrum.toArray()).mapToObj(Double::toString).collect(Collectors.joining("\n"));
    }

    private void showErrorDialogOnEDT(String message) {
        showDialogOnEDT(message, "Fehler", JOptionPane.ERROR_MESSAGE);
    }

    private void showInfoDialogOnEDT(String message) {
        showDialogOnEDT(message, "Information", JOptionPane.INFORMATION_MESSAGE);
    }

    private void showDialogOnEDT(String message, String title, int messageType) {
        if (SwingUtilities.isEventDispatchThread()) {
            JOptionPane.showMessageDialog(mainView, message, title, messageType);
        } else {
            SwingUtilities.invokeLater(() -> JOptionPane.showMessageDialog(mainView, message, title, messageType));
        }
    }

    /** Dialog text for I/O and export failures; callers already prefix what was attempted. */
    static String formatErrorMessage(Throwable throwable) {
        String msg = throwable.getMessage();
        return msg == null || msg.isBlank() ? throwable.getClass().getSimpleName() : msg;
    }

    @Override
    public void propertyChange(PropertyChangeEvent evt) {
        String propName = evt.getPropertyName();
        logger.debug("Controller received PropertyChangeEvent: Name='{}'", propName);
        SwingUtilities.invokeLater(() -> {
            switch (propName) {
                case DatasetRegistry.PROPERTY_NAMES:
                    mainView.setDataSetNames(registry.list());
                    break;
                case CalibrationModel.PROPERTY_CALIBRATION:
                    mainView.setCalibrationText(calibrationModel.equationText());
                    if (calibrationDialog != null) {
                        calibrationDialog.setEquation(calibrationModel.equationText(), calibrationModel.range());
                    }
                    break;
                default:
                    logger.warn("Unhandled property change event in Controller: {}", propName);
                    break;
            }
        });
    }
}
