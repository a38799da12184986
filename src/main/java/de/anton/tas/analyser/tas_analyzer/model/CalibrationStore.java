package de.anton.tas.analyser.tas_analyzer.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Reads and writes the calibration record as JSON: {"a": slope, "b": intercept}.
 * No version or instrument information is stored; unknown fields are ignored on read.
 */
public class CalibrationStore {

    private static final Logger logger = LoggerFactory.getLogger(CalibrationStore.class);
    static final String FIELD_A = "a";
    static final String FIELD_B = "b";

    private final ObjectMapper objectMapper;

    public CalibrationStore() {
        this.objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);
    }

    public void write(CalibrationCoefficients coefficients, Path file) throws IOException {
        Objects.requireNonNull(coefficients, "Coefficients cannot be null.");
        Objects.requireNonNull(file, "Output file cannot be null.");
        ObjectNode node = objectMapper.createObjectNode();
        node.put(FIELD_A, coefficients.a());
        node.put(FIELD_B, coefficients.b());
        try {
            objectMapper.writeValue(file.toFile(), node);
        } catch (IOException e) {
            logger.error("Could not write calibration to {}", file.toAbsolutePath(), e);
            throw e;
        }
        logger.info("Calibration saved to {}", file.toAbsolutePath());
    }

    /**
     * @throws IOException If the file cannot be read, is not JSON, or lacks a numeric "a" or "b".
     */
    public CalibrationCoefficients read(Path file) throws IOException {
        Objects.requireNonNull(file, "Input file cannot be null.");
        if (!Files.isRegularFile(file)) {
            throw new IOException("Calibration file not found: " + file.toAbsolutePath());
        }
        JsonNode root = objectMapper.readTree(file.toFile());
        if (root == null || !root.isObject()) {
            throw new IOException("Calibration file does not contain a JSON object: " + file.getFileName());
        }
        CalibrationCoefficients coefficients = new CalibrationCoefficients(
                requireNumber(root, FIELD_A, file), requireNumber(root, FIELD_B, file));
        logger.info("Calibration read from {}: a={}, b={}", file.toAbsolutePath(), coefficients.a(), coefficients.b());
        return coefficients;
    }

    private static double requireNumber(JsonNode root, String field, Path file) throws IOException {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            throw new IOException("Calibration file " + file.getFileName() + " has no field '" + field + "'.");
        }
        if (value.isNumber()) {
            return value.doubleValue();
        }
        if (value.isTextual()) {
            try {
                return Double.parseDouble(value.textValue().trim());
            } catch (NumberFormatException e) {
                throw new IOException("Field '" + field + "' in " + file.getFileName() + " is not a number: " + value.textValue(), e);
            }
        }
        throw new IOException("Field '" + field + "' in " + file.getFileName() + " is not a number.");
    }
}
