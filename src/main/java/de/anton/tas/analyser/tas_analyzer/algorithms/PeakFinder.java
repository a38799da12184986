package de.anton.tas.analyser.tas_analyzer.algorithms;

import de.anton.tas.analyser.tas_analyzer.model.Spectrum;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Finds calibration lines in a raw spectrum: local maxima filtered by minimum channel
 * distance and minimum prominence, returned tallest first.
 * <p>
 * A flat-topped maximum is reported once, at the first channel of the plateau.
 * Samples at either end of the spectrum are never peaks.
 */
public class PeakFinder {

    private static final Logger logger = LoggerFactory.getLogger(PeakFinder.class);

    private final double minProminence;
    private final int minDistance;
    private final int topK;

    /**
     * @param minProminence Minimum height above the higher of the two bounding valleys (>= 0).
     * @param minDistance   Minimum distance in channels between two reported peaks (>= 1).
     * @param topK          Maximum number of peaks returned; 0 or less returns all.
     */
    public PeakFinder(double minProminence, int minDistance, int topK) {
        if (Double.isNaN(minProminence) || minProminence < 0) throw new IllegalArgumentException("Minimum prominence must be >= 0.");
        if (minDistance < 1) throw new IllegalArgumentException("Minimum distance must be >= 1 channel.");
        this.minProminence = minProminence;
        this.minDistance = minDistance;
        this.topK = topK;
    }

    public static List<Integer> findPeaks(Spectrum spectrum, double minProminence, int minDistance, int topK) {
        return new PeakFinder(minProminence, minDistance, topK).find(spectrum);
    }

    /**
     * @return Peak channels ordered by descending intensity (ties: lower channel first);
     *         empty if nothing qualifies.
     */
    public List<Integer> find(Spectrum spectrum) {
        Objects.requireNonNull(spectrum, "Spectrum cannot be null.");
        double[] x = spectrum.toArray();

        List<Integer> candidates = localMaxima(x);
        List<Integer> spaced = selectByDistance(x, candidates);

        List<Integer> peaks = new ArrayList<>(spaced.size());
        for (int p : spaced) {
            double prominence = prominence(x, p);
            if (prominence >= minProminence) {
                peaks.add(p);
            } else {
                logger.trace("Candidate at channel {} dropped, prominence {} < {}", p, prominence, minProminence);
            }
        }

        peaks.sort(byDescendingIntensity(x));
        if (topK > 0 && peaks.size() > topK) {
            peaks = new ArrayList<>(peaks.subList(0, topK));
        }
        logger.debug("PeakFinder: {} local maxima, {} after distance {}, {} returned (prominence >= {}, topK={}): {}",
                     candidates.size(), spaced.size(), minDistance, peaks.size(), minProminence, topK, peaks);
        return peaks;
    }

    /** Local maxima in scan order; a plateau counts once, at its first index. */
    static List<Integer> localMaxima(double[] x) {
        List<Integer> maxima = new ArrayList<>();
        int last = x.length - 1;
        int i = 1;
        while (i < last) {
            if (x[i - 1] < x[i]) {
                int ahead = i + 1;
                while (ahead < last && x[ahead] == x[i]) {
                    ahead++;
                }
                if (x[ahead] < x[i]) {
                    maxima.add(i);
                    i = ahead; // skip the rest of the plateau
                    continue;
                }
            }
            i++;
        }
        return maxima;
    }

    /**
     * Height of the peak above the higher of its two bases. Each base is the lowest sample
     * passed while walking outwards until a strictly higher sample or the spectrum edge.
     */
    static double prominence(double[] x, int peak) {
        double height = x[peak];

        double leftMin = height;
        for (int i = peak; i >= 0 && x[i] <= height; i--) {
            if (x[i] < leftMin) leftMin = x[i];
        }
        double rightMin = height;
        for (int i = peak; i < x.length && x[i] <= height; i++) {
            if (x[i] < rightMin) rightMin = x[i];
        }
        return height - Math.max(leftMin, rightMin);
    }

    /** Greedy by intensity: keeps a candidate only if no taller kept candidate is closer than minDistance. */
    private List<Integer> selectByDistance(double[] x, List<Integer> candidates) {
        if (minDistance <= 1 || candidates.size() < 2) {
            return candidates;
        }
        List<Integer> byHeight = new ArrayList<>(candidates);
        byHeight.sort(byDescendingIntensity(x));

        List<Integer> kept = new ArrayList<>();
        for (int c : byHeight) {
            boolean tooClose = false;
            for (int k : kept) {
                if (Math.abs(c - k) < minDistance) { tooClose = true; break; }
            }
            if (!tooClose) {
                kept.add(c);
            }
        }
        Collections.sort(kept); // back to scan order
        return kept;
    }

    private static Comparator<Integer> byDescendingIntensity(double[] x) {
        return Comparator.<Integer>comparingDouble(i -> x[i]).reversed().thenComparing(Comparator.naturalOrder());
    }

    public double getMinProminence() { return minProminence; }
    public int getMinDistance() { return minDistance; }
    public int getTopK() { return topK; }
}
