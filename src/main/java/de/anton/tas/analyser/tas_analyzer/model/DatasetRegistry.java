package de.anton.tas.analyser.tas_analyzer.model;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.beans.PropertyChangeListener;
import java.beans.PropertyChangeSupport;
import java.util.*;

/**
 * In-memory store of named data sets, kept in the order they were first saved.
 * Saving under an existing name overwrites that entry in place. Not thread-safe.
 */
public class DatasetRegistry {
    private static final Logger logger = LoggerFactory.getLogger(DatasetRegistry.class);

    public static final String PROPERTY_NAMES = "dataSetNames";

    private final Map<String, DataSet> dataSets = new LinkedHashMap<>();
    private final PropertyChangeSupport support = new PropertyChangeSupport(this);

    public void addPropertyChangeListener(PropertyChangeListener pcl) { support.addPropertyChangeListener(pcl); }
    public void removePropertyChangeListener(PropertyChangeListener pcl) { support.removePropertyChangeListener(pcl); }

    /**
     * Stores the six spectra under the given name, replacing any data set of that name.
     *
     * @return The stored data set.
     * @throws IllegalArgumentException If the name is blank or a spectrum is missing.
     */
    public DataSet save(String name, Map<SpectrumLabel, Spectrum> spectra) {
        DataSet dataSet = new DataSet(name, spectra);
        List<String> oldNames = list();
        DataSet previous = dataSets.put(dataSet.getName(), dataSet);
        if (previous != null) {
            logger.info("Data set '{}' overwritten.", dataSet.getName());
        } else {
            logger.info("Data set '{}' saved ({} data sets in registry).", dataSet.getName(), dataSets.size());
        }
        support.firePropertyChange(PROPERTY_NAMES, oldNames, list());
        return dataSet;
    }

    /** Stores an already built data set under its own name. */
    public DataSet save(DataSet dataSet) {
        Objects.requireNonNull(dataSet, "Data set cannot be null.");
        return save(dataSet.getName(), dataSet.getSpectra());
    }

    /**
     * @throws DataSetNotFoundException If no data set has this name.
     */
    public DataSet load(String name) throws DataSetNotFoundException {
        DataSet dataSet = name == null ? null : dataSets.get(name.trim());
        if (dataSet == null) {
            logger.debug("Lookup of unknown data set '{}'.", name);
            throw new DataSetNotFoundException(name);
        }
        return dataSet;
    }

    /** @return true if a data set was removed. */
    public boolean delete(String name) {
        if (name == null) return false;
        List<String> oldNames = list();
        DataSet removed = dataSets.remove(name.trim());
        if (removed == null) {
            logger.debug("Delete ignored, no data set named '{}'.", name);
            return false;
        }
        logger.info("Data set '{}' deleted.", removed.getName());
        support.firePropertyChange(PROPERTY_NAMES, oldNames, list());
        return true;
    }

    /** @return Data set names in insertion order (unmodifiable snapshot). */
    public List<String> list() {
        return List.copyOf(dataSets.keySet());
    }

    public boolean contains(String name) { return name != null && dataSets.containsKey(name.trim()); }
    public int size() { return dataSets.size(); }
    public boolean isEmpty() { return dataSets.isEmpty(); }
}
