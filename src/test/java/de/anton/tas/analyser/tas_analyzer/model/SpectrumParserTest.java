package de.anton.tas.analyser.tas_analyzer.model;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.Assert.*;

public class SpectrumParserTest {

    @Rule
    public TemporaryFolder tempFolder = new TemporaryFolder();

    private final SpectrumParser parser = new SpectrumParser();

    @Test
    public void singleColumnIsIntensity() throws Exception {
        assertEquals(Spectrum.of(1, 2.5, 3), parser.parse("ref", "1\n2.5\n3\n"));
    }

    @Test
    public void twoColumnsUseTheLastAsIntensity() throws Exception {
        assertEquals(Spectrum.of(10, 20, 30), parser.parse("sig", "0\t10\r\n1, 20\n2,30"));
    }

    @Test
    public void blankLinesAreSkipped() throws Exception {
        assertEquals(Spectrum.of(4, 5), parser.parse(SpectrumLabel.REF_P, "\n4\n\n  \n5"));
    }

    @Test
    public void badLineReportsItsNumber() {
        SpectrumFormatException e = assertThrows(SpectrumFormatException.class,
                () -> parser.parse("DARK_ref", "1\n\nabc\n4"));
        assertEquals(3, e.getLineNumber());
        assertEquals("DARK_ref", e.getLabel());
        assertTrue(e.getMessage().contains("line 3"));
    }

    @Test
    public void nonNumericChannelColumnIsAnError() {
        SpectrumFormatException e = assertThrows(SpectrumFormatException.class, () -> parser.parse("ref", "x 10"));
        assertEquals(1, e.getLineNumber());
    }

    @Test
    public void tooManyColumnsAndNonFiniteValuesAreErrors() {
        assertThrows(SpectrumFormatException.class, () -> parser.parse("ref", "1 2 3"));
        assertThrows(SpectrumFormatException.class, () -> parser.parse("ref", "1\nNaN"));
        assertThrows(SpectrumFormatException.class, () -> parser.parse("ref", "Infinity"));
    }

    @Test
    public void semicolonIsNotASeparator() {
        SpectrumFormatException e = assertThrows(SpectrumFormatException.class, () -> parser.parse("sig", "1 10\n2;30"));
        assertEquals(2, e.getLineNumber());
    }

    @Test
    public void emptyInputHasNoData() {
        SpectrumFormatException e = assertThrows(SpectrumFormatException.class, () -> parser.parse("sig_p", "  \n \n"));
        assertEquals(0, e.getLineNumber());
        assertThrows(SpectrumFormatException.class, () -> parser.parse("sig_p", (String) null));
    }

    @Test
    public void readsFromFile() throws Exception {
        Path file = tempFolder.newFile("lamp.txt").toPath();
        Files.writeString(file, "0 100\n1 200\n", StandardCharsets.UTF_8);
        assertEquals(Spectrum.of(100, 200), parser.parse("lamp", file));
    }
}
