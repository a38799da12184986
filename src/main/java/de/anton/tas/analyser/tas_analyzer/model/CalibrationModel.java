package de.anton.tas.analyser.tas_analyzer.model;

import org.apache.commons.math3.stat.regression.SimpleRegression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.*;

/**
 * Holds the channel → wavelength calibration of the detector.
 * Starts uncalibrated; in that state {@link #apply(double)} is the identity, so consumers
 * can always call it regardless of whether a calibration exists.
 * A successful fit or import replaces the coefficients entirely; a failed fit leaves them untouched.
 * Not thread-safe.
 */
public class CalibrationModel {
    private static final Logger logger = LoggerFactory.getLogger(CalibrationModel.class);

    /** Number of detector channels (0..1343). */
    public static final int MAX_CHANNEL = 1344;
    public static final String PROPERTY_CALIBRATION = "calibration";

    private CalibrationCoefficients coefficients = null; // null = uncalibrated
    private double rangeStart = 0;
    private double rangeEnd = MAX_CHANNEL - 1;

    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }

    /**
     * Fits wavelength = a·channel + b to the given points.
     * Two points give the exact line through them, more points an ordinary least-squares fit.
     * Points with non-finite coordinates are ignored.
     *
     * @param points The calibration points, in any order.
     * @return The new coefficients.
     * @throws InsufficientCalibrationPointsException If fewer than two valid points or fewer than two
     *                                                distinct channels remain. The model is not modified.
     */
    public CalibrationCoefficients fit(Collection<CalibrationPoint> points) throws InsufficientCalibrationPointsException {
        Objects.requireNonNull(points, "Calibration points cannot be null.");
        List<CalibrationPoint> valid = new ArrayList<>(points.size());
        Set<Double> channels = new HashSet<>();
        for (CalibrationPoint p : points) {
            if (p == null || !p.isValid()) {
                logger.warn("Ignoring invalid calibration point: {}", p);
                continue;
            }
            valid.add(p);
            channels.add(p.channel() + 0.0); // folds -0.0 into 0.0
        }
        if (valid.size() < 2 || channels.size() < 2) {
            logger.warn("Calibration fit rejected: {} valid point(s), {} distinct channel(s). Keeping previous state (calibrated={}).",
                        valid.size(), channels.size(), isCalibrated());
            throw new InsufficientCalibrationPointsException(valid.size(), channels.size());
        }

        CalibrationCoefficients fitted;
        if (valid.size() == 2) {
            CalibrationPoint p1 = valid.get(0), p2 = valid.get(1);
            double a = (p2.wavelength() - p1.wavelength()) / (p2.channel() - p1.channel());
            double b = p1.wavelength() - a * p1.channel();
            fitted = new CalibrationCoefficients(a, b);
        } else {
            SimpleRegression regression = new SimpleRegression(true);
            for (CalibrationPoint p : valid) {
                regression.addData(p.channel(), p.wavelength());
            }
            fitted = new CalibrationCoefficients(regression.getSlope(), regression.getIntercept());
            logger.debug("Least-squares calibration over {} points, R²={}", valid.size(), regression.getRSquare());
        }
        logger.info("Calibration fitted from {} points: {}", valid.size(), formatEquation(fitted));
        setCoefficients(fitted);
        return fitted;
    }

    /**
     * Replaces the current coefficients unconditionally, e.g. with values read from a calibration file.
     * The originating instrument is not checked.
     */
    public void importCoefficients(CalibrationCoefficients imported) {
        Objects.requireNonNull(imported, "Imported coefficients cannot be null.");
        logger.info("Calibration imported: {}", formatEquation(imported));
        setCoefficients(imported);
    }

    /** Returns the model to the uncalibrated state. */
    public void clear() {
        if (coefficients != null) {
            logger.info("Calibration cleared.");
        }
        setCoefficients(null);
    }

    private void setCoefficients(CalibrationCoefficients newCoefficients) {
        CalibrationCoefficients old = this.coefficients;
        this.coefficients = newCoefficients;
        if (newCoefficients == null) {
            rangeStart = 0;
            rangeEnd = MAX_CHANNEL - 1;
        } else {
            rangeStart = newCoefficients.b();
            rangeEnd = newCoefficients.wavelengthAt(MAX_CHANNEL - 1);
        }
        support.firePropertyChange(PROPERTY_CALIBRATION, old, newCoefficients);
    }

    // --- Transform ---

    /** Forward transform of one channel; identity when uncalibrated. */
    public double apply(double channel) {
        return coefficients == null ? channel : coefficients.wavelengthAt(channel);
    }

    /** Forward transform of a channel sequence; returns a new array. */
    public double[] apply(double[] channels) {
        Objects.requireNonNull(channels, "Channel array cannot be null.");
        double[] out = new double[channels.length];
        for (int i = 0; i < channels.length; i++) {
            out[i] = apply(channels[i]);
        }
        return out;
    }

    /** @return x values for channels 0..n-1, in wavelength if calibrated. */
    public double[] axis(int n) {
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = apply(i);
        }
        return out;
    }

    // --- Getters ---
    public boolean isCalibrated() { return coefficients != null; }
    public Optional<CalibrationCoefficients> getCoefficients() { return Optional.ofNullable(coefficients); }

    /** @return {start, end} of the observable range: wavelengths of channel 0 and MAX_CHANNEL-1, or the channel range itself when uncalibrated. */
    public double[] range() { return new double[]{rangeStart, rangeEnd}; }

    public String equationText() {
        return coefficients == null ? "λ = a·ch + b (uncalibrated)" : formatEquation(coefficients);
    }

    private static String formatEquation(CalibrationCoefficients c) {
        return String.format(Locale.ROOT, "λ = %.6f·ch + %.6f", c.a(), c.b());
    }

    @Override
    public String toString() {
        return "CalibrationModel{" + equationText() + ", range=" + Arrays.toString(range()) + '}';
    }
}
