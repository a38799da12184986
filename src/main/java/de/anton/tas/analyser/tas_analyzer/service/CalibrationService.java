package de.anton.tas.analyser.tas_analyzer.service;

import de.anton.tas.analyser.tas_analyzer.algorithms.PeakFinder;
import de.anton.tas.analyser.tas_analyzer.model.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Service for the wavelength calibration workflow: detect lamp lines, fit the
 * calibration, load/save it, and prepare dark-corrected spectra for display.
 * Operates on one shared {@link CalibrationModel}.
 */
public class CalibrationService {

    private static final Logger logger = LoggerFactory.getLogger(CalibrationService.class);

    private final CalibrationModel calibrationModel;
    private final CalibrationStore calibrationStore;

    public CalibrationService(CalibrationModel calibrationModel) {
        this(calibrationModel, new CalibrationStore());
    }

    public CalibrationService(CalibrationModel calibrationModel, CalibrationStore calibrationStore) {
        this.calibrationModel = Objects.requireNonNull(calibrationModel, "Calibration model cannot be null.");
        this.calibrationStore = Objects.requireNonNull(calibrationStore, "Calibration store cannot be null.");
    }

    /**
     * Finds candidate calibration channels, tallest first.
     *
     * @return Peak channels; empty when nothing qualifies with the given parameters.
     */
    public List<Integer> detectCalibrationChannels(Spectrum spectrum, double prominence, int distance, int topK) {
        List<Integer> channels = PeakFinder.findPeaks(spectrum, prominence, distance, topK);
        if (channels.isEmpty()) {
            logger.warn("No peaks found (prominence={}, distance={}).", prominence, distance);
        } else {
            logger.info("Detected {} calibration channel(s): {}", channels.size(), channels);
        }
        return channels;
    }

    public List<Integer> detectCalibrationChannels(Spectrum spectrum, AnalysisSettings settings) {
        return detectCalibrationChannels(spectrum, settings.peakProminence(), settings.peakDistance(), settings.peakTopK());
    }

    /**
     * Fits the shared calibration model.
     *
     * @throws InsufficientCalibrationPointsException If the points do not define a line; the model is unchanged.
     */
    public CalibrationCoefficients calibrate(Collection<CalibrationPoint> points) throws InsufficientCalibrationPointsException {
        return calibrationModel.fit(points);
    }

    /**
     * Writes the current coefficients.
     *
     * @throws IllegalStateException If the model is not calibrated.
     */
    public void saveCalibration(Path file) throws IOException {
        CalibrationCoefficients coefficients = calibrationModel.getCoefficients()
                .orElseThrow(() -> new IllegalStateException("Calibrate before saving."));
        calibrationStore.write(coefficients, file);
    }

    /** Reads coefficients from a file and makes them the current calibration. */
    public CalibrationCoefficients loadCalibration(Path file) throws IOException {
        CalibrationCoefficients coefficients = calibrationStore.read(file);
        calibrationModel.importCoefficients(coefficients);
        return coefficients;
    }

    /**
     * Prepares a raw spectrum for plotting: optional dark subtraction, x in wavelength when calibrated.
     *
     * @param dark Dark spectrum, or null to plot the spectrum as is.
     * @return {x, y}
     * @throws SpectrumLengthMismatchException If the dark spectrum has a different length.
     */
    public double[][] darkCorrectedAxis(Spectrum spectrum, Spectrum dark) throws SpectrumLengthMismatchException {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        Spectrum corrected = dark == null ? spectrum : spectrum.minus(dark);
        return new double[][]{calibrationModel.axis(corrected.size()), corrected.toArray()};
    }

    public CalibrationModel getCalibrationModel() { return calibrationModel; }
}
