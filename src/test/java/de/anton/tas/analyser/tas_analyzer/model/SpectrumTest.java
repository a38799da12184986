package de.anton.tas.analyser.tas_analyzer.model;

import org.junit.Test;

import static org.junit.Assert.*;

public class SpectrumTest {

    @Test
    public void darkSubtractionIsElementwise() throws Exception {
        assertEquals(Spectrum.of(9, 18, 27), Spectrum.of(10, 20, 30).minus(Spectrum.of(1, 2, 3)));
    }

    @Test
    public void darkOfDifferentLengthIsRejected() {
        SpectrumLengthMismatchException e = assertThrows(SpectrumLengthMismatchException.class,
                () -> Spectrum.of(1, 2, 3).minus(Spectrum.of(1, 2)));
        assertEquals(Integer.valueOf(2), e.getLengths().get("dark"));
    }

    @Test
    public void arraysAreDefensivelyCopied() {
        double[] values = {1, 2};
        Spectrum spectrum = new Spectrum(values);
        values[0] = 99;
        spectrum.toArray()[1] = 99;
        assertEquals(Spectrum.of(1, 2), spectrum);
    }

    @Test
    public void labelsResolveFromDisplayNames() {
        assertEquals(SpectrumLabel.DARK_SIG, SpectrumLabel.fromDisplayName("dark_sig"));
        assertEquals(SpectrumLabel.REF_P, SpectrumLabel.fromDisplayName("ref_p"));
        assertNull(SpectrumLabel.fromDisplayName("pump"));
        assertEquals("sig_p", SpectrumLabel.SIG_P.toString());
    }
}
