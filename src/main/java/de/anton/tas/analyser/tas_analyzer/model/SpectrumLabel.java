package de.anton.tas.analyser.tas_analyzer.model;

/**
 * The six roles a raw spectrum can play in one pump/probe measurement.
 * Includes the short display name used for the input boxes and in messages.
 */
public enum SpectrumLabel {
    DARK_REF("DARK_ref"),   // Dark baseline of the reference channel
    DARK_SIG("DARK_sig"),   // Dark baseline of the signal channel
    REF("ref"),             // Reference, probe only
    SIG("sig"),             // Signal, probe only
    REF_P("ref_p"),         // Reference with pump
    SIG_P("sig_p");         // Signal with pump

    private final String displayName;

    SpectrumLabel(String displayName) {
        this.displayName = displayName;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return displayName;
    }

    /**
     * Finds a label by its display name (case-insensitive).
     *
     * @param displayName The display name to search for.
     * @return The matching label, or null if no label has this name.
     */
    public static SpectrumLabel fromDisplayName(String displayName) {
        if (displayName == null) {
            return null;
        }
        for (SpectrumLabel label : values()) {
            if (label.displayName.equalsIgnoreCase(displayName.trim())) {
                return label;
            }
        }
        return null;
    }
}
