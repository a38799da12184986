package de.anton.tas.analyser.tas_analyzer.model;

/**
 * Thrown when a line of raw spectrum text cannot be read as numbers.
 * Carries the spectrum label and the 1-based line number (0 if the whole text is unusable).
 */
public class SpectrumFormatException extends TasAnalysisException {

    private final String label;
    private final int lineNumber;

    public SpectrumFormatException(String label, int lineNumber, String message) {
        super(lineNumber > 0
              ? String.format("Spectrum '%s', line %d: %s", label, lineNumber, message)
              : String.format("Spectrum '%s': %s", label, message));
        this.label = label;
        this.lineNumber = lineNumber;
    }

    public String getLabel() { return label; }
    public int getLineNumber() { return lineNumber; }
}
