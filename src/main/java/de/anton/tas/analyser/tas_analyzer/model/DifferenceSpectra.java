package de.anton.tas.analyser.tas_analyzer.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Normalized pump-induced intensity changes shown next to the ΔAbs trace.
 * Every array is scaled so that its largest magnitude is 1. Arrays are copied on the way in
 * and on the way out.
 *
 * @param x          Wavelength or channel axis.
 * @param reference  |ref_p0 - ref0| normalized.
 * @param signal     |sig_p0 - sig0| normalized.
 * @param difference |reference - signal| normalized.
 */
public record DifferenceSpectra(double[] x, double[] reference, double[] signal, double[] difference) {

    public DifferenceSpectra {
        Objects.requireNonNull(x, "x values cannot be null.");
        Objects.requireNonNull(reference, "Reference curve cannot be null.");
        Objects.requireNonNull(signal, "Signal curve cannot be null.");
        Objects.requireNonNull(difference, "Difference curve cannot be null.");
        if (reference.length != x.length || signal.length != x.length || difference.length != x.length) {
            throw new IllegalArgumentException("All difference spectra must have the same length as x");
        }
        x = x.clone();
        reference = reference.clone();
        signal = signal.clone();
        difference = difference.clone();
    }

    @Override public double[] x() { return x.clone(); }
    @Override public double[] reference() { return reference.clone(); }
    @Override public double[] signal() { return signal.clone(); }
    @Override public double[] difference() { return difference.clone(); }

    public int size() { return x.length; }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof DifferenceSpectra)) return false;
        DifferenceSpectra other = (DifferenceSpectra) o;
        return Arrays.equals(x, other.x) && Arrays.equals(reference, other.reference)
            && Arrays.equals(signal, other.signal) && Arrays.equals(difference, other.difference);
    }

    @Override
    public int hashCode() {
        int result = Arrays.hashCode(x);
        result = 31 * result + Arrays.hashCode(reference);
        result = 31 * result + Arrays.hashCode(signal);
        result = 31 * result + Arrays.hashCode(difference);
        return result;
    }

    @Override
    public String toString() {
        return String.format("DifferenceSpectra(size=%d)", x.length);
    }
}
