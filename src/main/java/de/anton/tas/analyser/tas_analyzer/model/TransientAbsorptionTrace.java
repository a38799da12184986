package de.anton.tas.analyser.tas_analyzer.model;

import java.util.Objects;

/**
 * Computed ΔAbs values aligned 1:1 with detector channels. Derived data, never stored.
 * Y values may contain NaN where the log ratio was undefined.
 */
public final class TransientAbsorptionTrace {

    private final String name;            // data set name, null for ad-hoc input
    private final double[] x;             // wavelength (calibrated) or channel
    private final double[] deltaAbs;
    private final int smoothingWidth;
    private final boolean wavelengthAxis;

    public TransientAbsorptionTrace(String name, double[] x, double[] deltaAbs, int smoothingWidth, boolean wavelengthAxis) {
        Objects.requireNonNull(x, "x values cannot be null.");
        Objects.requireNonNull(deltaAbs, "ΔAbs values cannot be null.");
        if (x.length != deltaAbs.length) {
            throw new IllegalArgumentException("x and ΔAbs arrays must have the same length");
        }
        this.name = name;
        this.x = x.clone();
        this.deltaAbs = deltaAbs.clone();
        this.smoothingWidth = smoothingWidth;
        this.wavelengthAxis = wavelengthAxis;
    }

    public String getName() { return name; }
    public int size() { return x.length; }
    public double getXAt(int i) { return x[i]; }
    public double getDeltaAbsAt(int i) { return deltaAbs[i]; }
    public double[] getX() { return x.clone(); }
    public double[] getDeltaAbs() { return deltaAbs.clone(); }
    public int getSmoothingWidth() { return smoothingWidth; }
    public boolean isWavelengthAxis() { return wavelengthAxis; }

    /** @return Number of channels whose ΔAbs is NaN. */
    public int countGaps() {
        int gaps = 0;
        for (double v : deltaAbs) {
            if (Double.isNaN(v)) gaps++;
        }
        return gaps;
    }

    @Override
    public String toString() {
        return String.format("TransientAbsorptionTrace(name=%s, size=%d, width=%d, axis=%s)",
            name, x.length, smoothingWidth, wavelengthAxis ? "wavelength" : "channel");
    }
}
