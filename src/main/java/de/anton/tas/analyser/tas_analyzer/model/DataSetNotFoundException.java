package de.anton.tas.analyser.tas_analyzer.model;

/**
 * Thrown when a data set name is not present in the {@link DatasetRegistry}.
 */
public class DataSetNotFoundException extends TasAnalysisException {

    private final String name;

    public DataSetNotFoundException(String name) {
        super("Data set not found: '" + name + "'");
        this.name = name;
    }

    public String getName() { return name; }
}
