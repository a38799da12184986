package de.anton.tas.analyser.tas_analyzer.algorithms;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Centered moving average with an odd window width.
 * Samples outside the array count as 0 and the sum is always divided by the full width,
 * so the first and last (width-1)/2 outputs are pulled towards zero.
 * A NaN inside a window makes that output NaN.
 */
public final class MovingAverageFilter {

    private static final Logger logger = LoggerFactory.getLogger(MovingAverageFilter.class);
    public static final int DEFAULT_WIDTH = 5;

    private MovingAverageFilter() {
        throw new IllegalStateException("Utility class should not be instantiated.");
    }

    /**
     * @param values Input samples; not modified.
     * @param width  Odd window width >= 1. Width 1 returns a copy of the input.
     * @return A new array of the same length.
     */
    public static double[] smooth(double[] values, int width) {
        Objects.requireNonNull(values, "Input values cannot be null.");
        if (width < 1 || width % 2 == 0) {
            throw new IllegalArgumentException("Smoothing width must be a positive odd number, got " + width);
        }
        if (width == 1) {
            return values.clone();
        }

        int n = values.length;
        int half = (width - 1) / 2;
        double[] smoothed = new double[n];
        for (int i = 0; i < n; i++) {
            double sum = 0.0;
            int from = Math.max(0, i - half);
            int to = Math.min(n - 1, i + half);
            for (int j = from; j <= to; j++) {
                sum += values[j];
            }
            smoothed[i] = sum / width;
        }
        logger.trace("Moving average applied: n={}, width={}", n, width);
        return smoothed;
    }
}
