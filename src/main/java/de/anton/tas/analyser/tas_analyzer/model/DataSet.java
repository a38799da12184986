package de.anton.tas.analyser.tas_analyzer.model;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * A named pump/probe measurement: exactly one spectrum for each {@link SpectrumLabel}.
 * Spectrum lengths are not compared here; that happens when a trace is computed.
 */
public final class DataSet {

    private final String name;
    private final Map<SpectrumLabel, Spectrum> spectra;

    /**
     * @throws IllegalArgumentException If the name is blank or a label has no spectrum.
     */
    public DataSet(String name, Map<SpectrumLabel, Spectrum> spectra) {
        Objects.requireNonNull(name, "Data set name cannot be null.");
        Objects.requireNonNull(spectra, "Spectra map cannot be null.");
        if (name.trim().isEmpty()) {
            throw new IllegalArgumentException("Data set name cannot be blank.");
        }
        EnumMap<SpectrumLabel, Spectrum> copy = new EnumMap<>(SpectrumLabel.class);
        for (SpectrumLabel label : SpectrumLabel.values()) {
            Spectrum s = spectra.get(label);
            if (s == null) {
                throw new IllegalArgumentException("Data set '" + name + "' is missing spectrum '" + label + "'.");
            }
            copy.put(label, s);
        }
        this.name = name.trim();
        this.spectra = Collections.unmodifiableMap(copy);
    }

    public String getName() { return name; }
    public Spectrum get(SpectrumLabel label) { return spectra.get(label); }

    /** @return An unmodifiable map in label declaration order. */
    public Map<SpectrumLabel, Spectrum> getSpectra() { return spectra; }

    /** @return A copy of this data set under another name. */
    public DataSet withName(String newName) {
        return new DataSet(newName, spectra);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DataSet that = (DataSet) o;
        return name.equals(that.name) && spectra.equals(that.spectra);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, spectra);
    }

    @Override
    public String toString() {
        return "DataSet{name='" + name + "', spectra=" + spectra + '}';
    }
}
