package de.anton.tas.analyser.tas_analyzer.service;

import de.anton.tas.analyser.tas_analyzer.algorithms.MovingAverageFilter;

/**
 * Immutable configuration for calibration peak search and ΔAbs smoothing.
 */
public record AnalysisSettings(
    int smoothingWidth,      // odd moving-average width for ΔAbs
    double peakProminence,   // minimum prominence for calibration peaks
    int peakDistance,        // minimum channel distance between calibration peaks
    int peakTopK             // number of peaks offered as calibration channels
) {
    public static final double DEFAULT_PEAK_PROMINENCE = 50.0;
    public static final int DEFAULT_PEAK_DISTANCE = 100;
    public static final int DEFAULT_PEAK_TOP_K = 5;

    public AnalysisSettings {
        if (smoothingWidth < 1 || smoothingWidth % 2 == 0) throw new IllegalArgumentException("Smoothing width must be a positive odd number.");
        if (peakProminence < 0) throw new IllegalArgumentException("Peak prominence must be >= 0.");
        if (peakDistance < 1) throw new IllegalArgumentException("Peak distance must be >= 1.");
    }

    public static AnalysisSettings defaults() {
        return new AnalysisSettings(MovingAverageFilter.DEFAULT_WIDTH, DEFAULT_PEAK_PROMINENCE, DEFAULT_PEAK_DISTANCE, DEFAULT_PEAK_TOP_K);
    }

    public AnalysisSettings withSmoothingWidth(int width) {
        return new AnalysisSettings(width, peakProminence, peakDistance, peakTopK);
    }

    public AnalysisSettings withPeakSearch(double prominence, int distance) {
        return new AnalysisSettings(smoothingWidth, prominence, distance, peakTopK);
    }
}
