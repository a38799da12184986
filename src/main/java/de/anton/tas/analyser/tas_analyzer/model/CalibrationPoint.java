package de.anton.tas.analyser.tas_analyzer.model;

/**
 * A known (channel, wavelength) pair used to fit the calibration line.
 *
 * @param channel    Detector channel, fractional values allowed.
 * @param wavelength Wavelength in nm observed at that channel.
 */
public record CalibrationPoint(double channel, double wavelength) {

    /** @return true if both coordinates are finite numbers. */
    public boolean isValid() {
        return Double.isFinite(channel) && Double.isFinite(wavelength);
    }
}
