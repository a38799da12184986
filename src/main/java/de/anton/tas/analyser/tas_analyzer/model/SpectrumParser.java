package de.anton.tas.analyser.tas_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Reads raw spectra pasted from the spectrometer software or loaded from text files.
 * Each non-blank line holds either "intensity" or "channel intensity"; separators may be
 * whitespace, tabs or commas. The intensity is always the last column.
 */
public class SpectrumParser {

    private static final Logger logger = LoggerFactory.getLogger(SpectrumParser.class);
    private static final Pattern SEPARATOR = Pattern.compile("[\\s,]+");

    /**
     * Parses one spectrum.
     *
     * @param label Name of the spectrum, used in error messages.
     * @param text  Raw text, one sample per line.
     * @return The parsed spectrum.
     * @throws SpectrumFormatException If the text is empty or a line is not numeric. No partial result is returned.
     */
    public Spectrum parse(String label, String text) throws SpectrumFormatException {
        Objects.requireNonNull(label, "Label cannot be null.");
        if (text == null || text.trim().isEmpty()) {
            throw new SpectrumFormatException(label, 0, "no data");
        }

        String[] lines = text.split("\\R");
        double[] values = new double[lines.length];
        int count = 0;
        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = SEPARATOR.split(line);
            if (parts.length > 2) {
                throw new SpectrumFormatException(label, i + 1, "expected 'value' or 'index value', found " + parts.length + " columns");
            }
            // every column must be numeric, the last one is the intensity
            for (String part : parts) {
                values[count] = parseNumber(label, i + 1, part);
            }
            count++;
            logger.trace("[{}] line {} -> {}", label, i + 1, values[count - 1]);
        }
        if (count == 0) {
            throw new SpectrumFormatException(label, 0, "no data");
        }

        double[] intensity = new double[count];
        System.arraycopy(values, 0, intensity, 0, count);
        logger.debug("Parsed spectrum '{}' with {} channels.", label, count);
        return new Spectrum(intensity);
    }

    public Spectrum parse(SpectrumLabel label, String text) throws SpectrumFormatException {
        return parse(label.getDisplayName(), text);
    }

    /**
     * Reads a UTF-8 text file and parses it.
     *
     * @throws IOException             If the file cannot be read.
     * @throws SpectrumFormatException If the content is not a valid spectrum.
     */
    public Spectrum parse(String label, Path file) throws IOException, SpectrumFormatException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        logger.info("Reading spectrum '{}' from {}", label, file.toAbsolutePath());
        String content = Files.readString(file, StandardCharsets.UTF_8);
        return parse(label, content);
    }

    private static double parseNumber(String label, int lineNumber, String token) throws SpectrumFormatException {
        try {
            double v = Double.parseDouble(token);
            if (Double.isNaN(v) || Double.isInfinite(v)) {
                throw new SpectrumFormatException(label, lineNumber, "non-finite value '" + token + "'");
            }
            return v;
        } catch (NumberFormatException e) {
            throw new SpectrumFormatException(label, lineNumber, "not a number: '" + token + "'");
        }
    }
}
