package de.anton.tas.analyser.tas_analyzer.model;

/**
 * Coefficients of the affine mapping wavelength = a·channel + b.
 * This is also the flat record written to and read from calibration files.
 *
 * @param a Slope, nm per channel.
 * @param b Intercept, wavelength at channel 0.
 */
public record CalibrationCoefficients(double a, double b) {

    public double wavelengthAt(double channel) {
        return a * channel + b;
    }
}
