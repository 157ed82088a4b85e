package com.ttennebkram.spectral.metadata;

/**
 * How the forward transform stores the magnitude spectrum.
 */
public enum MagnitudeOutputMode {

    /** Scaled into [0,1] by the plane maximum (optionally gamma-adjusted first). Good for display. */
    NORMALIZED,

    /** Stored as computed (log-compressed if enabled), no scaling. Preserves values for reconstruction. */
    RAW;

    /**
     * Parse a stored name, returning null for unknown or missing values.
     */
    public static MagnitudeOutputMode fromName(String name) {
        if (name == null) return null;
        for (MagnitudeOutputMode mode : values()) {
            if (mode.name().equalsIgnoreCase(name)) {
                return mode;
            }
        }
        return null;
    }
}
