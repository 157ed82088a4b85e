package com.ttennebkram.spectral.fft;

/**
 * Quality level of the inverse transform.
 * LOW and MEDIUM use the fast polynomial sine/cosine; HIGH and above use exact
 * trigonometry and smooth contrast-enhanced phase before reconstruction.
 */
public enum ReconstructionQuality {
    LOW,
    MEDIUM,
    HIGH,
    ULTRA;

    public boolean isAtLeast(ReconstructionQuality other) {
        return compareTo(other) >= 0;
    }

    public static ReconstructionQuality fromName(String name, ReconstructionQuality defaultValue) {
        if (name == null) return defaultValue;
        for (ReconstructionQuality quality : values()) {
            if (quality.name().equalsIgnoreCase(name)) {
                return quality;
            }
        }
        return defaultValue;
    }
}
