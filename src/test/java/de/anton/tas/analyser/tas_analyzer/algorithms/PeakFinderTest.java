package de.anton.tas.analyser.tas_analyzer.algorithms;

import de.anton.tas.analyser.tas_analyzer.model.Spectrum;
import org.junit.Test;

import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

public class PeakFinderTest {

    private static double[] gaussian(int n, int center, double height, double sigma) {
        double[] y = new double[n];
        for (int i = 0; i < n; i++) {
            double d = i - center;
            y[i] = height * Math.exp(-d * d / (2 * sigma * sigma));
        }
        return y;
    }

    private static double[] add(double[] a, double[] b) {
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) out[i] = a[i] + b[i];
        return out;
    }

    @Test
    public void singleBumpIsFoundWhenProminenceReachesThreshold() {
        Spectrum spectrum = new Spectrum(gaussian(1344, 500, 100.0, 10.0));

        assertEquals(List.of(500), PeakFinder.findPeaks(spectrum, 100.0, 1, 0));
        assertEquals(List.of(500), PeakFinder.findPeaks(spectrum, 50.0, 100, 5));
        assertTrue(PeakFinder.findPeaks(spectrum, 100.5, 1, 0).isEmpty());
    }

    @Test
    public void closerPeaksThanMinDistanceKeepOnlyTheTaller() {
        double[] y = add(gaussian(600, 100, 100.0, 5.0), gaussian(600, 150, 80.0, 5.0));
        Spectrum spectrum = new Spectrum(y);

        assertEquals(List.of(100), PeakFinder.findPeaks(spectrum, 10.0, 100, 0));
        assertEquals(List.of(100, 150), PeakFinder.findPeaks(spectrum, 10.0, 50, 0));
    }

    @Test
    public void returnedPeaksRespectMinDistance() {
        double[] y = new double[1000];
        for (int i = 0; i < y.length; i++) {
            y[i] = 50 + 40 * Math.sin(i / 7.0) + 20 * Math.cos(i / 3.0);
        }
        int minDistance = 60;
        List<Integer> peaks = PeakFinder.findPeaks(new Spectrum(y), 0.0, minDistance, 0);

        assertTrue(peaks.size() > 1);
        for (int i = 0; i < peaks.size(); i++) {
            for (int j = i + 1; j < peaks.size(); j++) {
                assertTrue(Math.abs(peaks.get(i) - peaks.get(j)) >= minDistance);
            }
        }
    }

    @Test
    public void plateauIsReportedAtItsFirstChannel() {
        Spectrum spectrum = Spectrum.of(0, 1, 3, 3, 3, 1, 0);
        assertEquals(List.of(2), PeakFinder.findPeaks(spectrum, 0.0, 1, 0));
    }

    @Test
    public void edgesAndFlatSpectraHaveNoPeaks() {
        assertTrue(PeakFinder.findPeaks(Spectrum.of(5, 1, 0, 1, 5), 0.0, 1, 0).isEmpty());
        assertTrue(PeakFinder.findPeaks(Spectrum.of(2, 2, 2, 2), 0.0, 1, 0).isEmpty());
        assertTrue(PeakFinder.findPeaks(Spectrum.of(), 0.0, 1, 0).isEmpty());
    }

    @Test
    public void topKReturnsTallestFirstWithLowerChannelOnTies() {
        Spectrum spectrum = Spectrum.of(0, 5, 0, 9, 0, 5, 0, 7, 0);

        assertEquals(List.of(3, 7, 1, 5), PeakFinder.findPeaks(spectrum, 0.0, 1, 0));
        assertEquals(List.of(3, 7), PeakFinder.findPeaks(spectrum, 0.0, 1, 2));
    }

    @Test
    public void prominenceIsMeasuredAgainstTheHigherBase() {
        double[] y = {0, 10, 4, 6, 2, 0};
        // peak at 3 is bounded by the taller peak at 1: left base 4, right base 0
        assertEquals(2.0, PeakFinder.prominence(y, 3), 1e-12);
        assertEquals(10.0, PeakFinder.prominence(y, 1), 1e-12);
        assertEquals(List.of(1, 3), PeakFinder.localMaxima(y));
    }

    @Test
    public void invalidParametersAreRejected() {
        assertThrows(IllegalArgumentException.class, () -> new PeakFinder(-1.0, 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new PeakFinder(0.0, 0, 0));
    }
}
