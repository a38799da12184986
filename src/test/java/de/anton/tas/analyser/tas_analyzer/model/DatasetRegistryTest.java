package de.anton.tas.analyser.tas_analyzer.model;

import org.junit.Before;
import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class DatasetRegistryTest {

    private DatasetRegistry registry;

    @Before
    public void setUp() {
        registry = new DatasetRegistry();
    }

    static Map<SpectrumLabel, Spectrum> spectra(double value, int n) {
        Map<SpectrumLabel, Spectrum> map = new EnumMap<>(SpectrumLabel.class);
        for (SpectrumLabel label : SpectrumLabel.values()) {
            double[] y = new double[n];
            Arrays.fill(y, value + label.ordinal());
            map.put(label, new Spectrum(y));
        }
        return map;
    }

    @Test
    public void savedDataSetLoadsBackUnchanged() throws Exception {
        Map<SpectrumLabel, Spectrum> input = spectra(100, 10);
        registry.save("1ps", input);

        DataSet loaded = registry.load("1ps");

        assertEquals("1ps", loaded.getName());
        for (SpectrumLabel label : SpectrumLabel.values()) {
            assertEquals(input.get(label), loaded.get(label));
        }
    }

    @Test
    public void unknownNameThrowsNotFound() {
        DataSetNotFoundException e = assertThrows(DataSetNotFoundException.class, () -> registry.load("nope"));
        assertEquals("nope", e.getName());
    }

    @Test
    public void overwriteKeepsPositionAndReplacesContent() throws Exception {
        registry.save("a", spectra(1, 5));
        registry.save("b", spectra(2, 5));
        registry.save("a", spectra(3, 5));

        assertEquals(List.of("a", "b"), registry.list());
        assertEquals(Spectrum.of(3, 3, 3, 3, 3), registry.load("a").get(SpectrumLabel.DARK_REF));
    }

    @Test
    public void deleteRemovesOnlyExistingNames() {
        registry.save("a", spectra(1, 5));

        assertFalse(registry.delete("missing"));
        assertTrue(registry.delete("a"));
        assertTrue(registry.isEmpty());
        assertThrows(DataSetNotFoundException.class, () -> registry.load("a"));
    }

    @Test
    public void incompleteOrUnnamedDataSetsAreRejected() {
        Map<SpectrumLabel, Spectrum> partial = spectra(1, 5);
        partial.remove(SpectrumLabel.SIG_P);

        assertThrows(IllegalArgumentException.class, () -> registry.save("x", partial));
        assertThrows(IllegalArgumentException.class, () -> registry.save("  ", spectra(1, 5)));
        assertEquals(0, registry.size());
    }

    @Test
    public void listenersSeeNameChanges() {
        List<Object> events = new ArrayList<>();
        registry.addPropertyChangeListener(evt -> events.add(evt.getNewValue()));

        registry.save("a", spectra(1, 5));
        registry.save("b", spectra(1, 5));
        registry.delete("a");

        assertEquals(List.of(List.of("a"), List.of("a", "b"), List.of("b")), events);
    }
}
