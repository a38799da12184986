package de.anton.tas.analyser.tas_analyzer.model;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An immutable sequence of detector intensities indexed by channel 0..N-1.
 */
public final class Spectrum {

    private final double[] intensity;

    public Spectrum(double[] intensity) {
        Objects.requireNonNull(intensity, "Intensity array cannot be null.");
        this.intensity = intensity.clone();
    }

    public static Spectrum of(double... intensity) {
        return new Spectrum(intensity);
    }

    public int size() { return intensity.length; }
    public boolean isEmpty() { return intensity.length == 0; }
    public double getIntensityAt(int channel) { return intensity[channel]; }

    /** @return A copy of the intensity values. */
    public double[] toArray() {
        return intensity.clone();
    }

    /**
     * Subtracts a dark spectrum channel by channel.
     *
     * @throws SpectrumLengthMismatchException If the two spectra differ in length.
     */
    public Spectrum minus(Spectrum dark) throws SpectrumLengthMismatchException {
        Objects.requireNonNull(dark, "Dark spectrum cannot be null.");
        if (dark.size() != size()) {
            Map<String, Integer> lengths = new LinkedHashMap<>();
            lengths.put("spectrum", size());
            lengths.put("dark", dark.size());
            throw new SpectrumLengthMismatchException(lengths);
        }
        double[] corrected = new double[intensity.length];
        for (int i = 0; i < intensity.length; i++) {
            corrected[i] = intensity[i] - dark.intensity[i];
        }
        return new Spectrum(corrected);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Arrays.equals(intensity, ((Spectrum) o).intensity);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(intensity);
    }

    @Override
    public String toString() {
        return "Spectrum{size=" + intensity.length + "}";
    }
}
