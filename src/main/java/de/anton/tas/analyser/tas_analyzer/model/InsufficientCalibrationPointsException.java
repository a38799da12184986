package de.anton.tas.analyser.tas_analyzer.model;

/**
 * Thrown when a calibration fit is requested with fewer than two usable points
 * or with all points on the same channel. The calibration model is left unchanged.
 */
public class InsufficientCalibrationPointsException extends TasAnalysisException {

    private final int validPoints;
    private final int distinctChannels;

    public InsufficientCalibrationPointsException(int validPoints, int distinctChannels) {
        super(String.format("At least 2 calibration points on 2 distinct channels are required (got %d valid point(s), %d distinct channel(s)).",
                            validPoints, distinctChannels));
        this.validPoints = validPoints;
        this.distinctChannels = distinctChannels;
    }

    public int getValidPoints() { return validPoints; }
    public int getDistinctChannels() { return distinctChannels; }
}
