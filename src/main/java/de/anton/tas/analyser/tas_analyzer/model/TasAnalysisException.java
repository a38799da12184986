package de.anton.tas.analyser.tas_analyzer.model;

/**
 * Base type for the recoverable errors of the calibration and ΔAbs pipeline.
 * Callers are expected to report these to the user and let them correct the input.
 */
public class TasAnalysisException extends Exception {

    public TasAnalysisException(String message) {
        super(message);
    }

    public TasAnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
