package de.anton.tas.analyser.tas_analyzer.model;

import java.util.Collections;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown when the spectra feeding one computation do not share a common length.
 */
public class SpectrumLengthMismatchException extends TasAnalysisException {

    private final Map<String, Integer> lengths;

    /**
     * @param lengths Spectrum label to length, in the order the spectra were supplied.
     */
    public SpectrumLengthMismatchException(Map<String, Integer> lengths) {
        super("Spectra must all have the same length: " + lengths.entrySet().stream()
                .map(e -> e.getKey() + "=" + e.getValue())
                .collect(Collectors.joining(", ")));
        this.lengths = Collections.unmodifiableMap(lengths);
    }

    public Map<String, Integer> getLengths() { return lengths; }
}
