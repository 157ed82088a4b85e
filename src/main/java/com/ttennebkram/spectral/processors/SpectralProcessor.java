package com.ttennebkram.spectral.processors;

import java.util.Map;

/**
 * Interface for self-contained spectral node processors.
 * Each processor encapsulates:
 * - Processing logic (OpenCV operations)
 * - Settings taken from the host's property map
 */
public interface SpectralProcessor {

    /**
     * Get the node type name (e.g., "FourierTransform").
     */
    String getNodeType();

    /**
     * Get the category for toolbar grouping.
     */
    String getCategory();

    /**
     * Get a description of this processor for tooltips.
     */
    String getDescription();

    /**
     * Read settings from the host's node properties map.
     * Missing or mistyped entries fall back to the defaults.
     *
     * @param properties The node properties (not modified)
     */
    void configure(Map<String, Object> properties);

    /**
     * Current settings, using the same keys {@link #configure(Map)} reads.
     */
    Map<String, Object> currentProperties();
}
