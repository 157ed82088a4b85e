package com.ttennebkram.spectral.processors;

import org.opencv.core.Mat;

import java.util.Map;

/**
 * Abstract base class for spectral processors.
 * Provides the annotation-backed identity and typed property helpers.
 */
public abstract class SpectralProcessorBase implements SpectralProcessor {

    private ProcessorInfo info() {
        ProcessorInfo info = getClass().getAnnotation(ProcessorInfo.class);
        if (info == null) {
            throw new IllegalStateException(getClass().getName() + " is missing @ProcessorInfo");
        }
        return info;
    }

    @Override
    public String getNodeType() {
        return info().nodeType();
    }

    /**
     * Display name from the annotation, or the node type if none is declared.
     */
    public String getDisplayName() {
        String displayName = info().displayName();
        return displayName.isEmpty() ? info().nodeType() : displayName;
    }

    @Override
    public String getCategory() {
        return info().category();
    }

    @Override
    public String getDescription() {
        return info().description();
    }

    /**
     * Standard null/empty check for input validation.
     * Call at the start of process() method.
     */
    protected boolean isInvalidInput(Mat input) {
        return input == null || input.empty();
    }

    /**
     * Helper to safely get an int from the properties map.
     */
    protected int getInt(Map<String, Object> props, String key, int defaultValue) {
        Object val = props.get(key);
        if (val instanceof Number) {
            return ((Number) val).intValue();
        }
        return defaultValue;
    }

    /**
     * Helper to safely get a double from the properties map.
     */
    protected double getDouble(Map<String, Object> props, String key, double defaultValue) {
        Object val = props.get(key);
        if (val instanceof Number) {
            return ((Number) val).doubleValue();
        }
        return defaultValue;
    }

    /**
     * Helper to safely get a boolean from the properties map.
     */
    protected boolean getBoolean(Map<String, Object> props, String key, boolean defaultValue) {
        Object val = props.get(key);
        if (val instanceof Boolean) {
            return (Boolean) val;
        }
        return defaultValue;
    }

    /**
     * Helper to safely get a String from the properties map.
     */
    protected String getString(Map<String, Object> props, String key, String defaultValue) {
        Object val = props.get(key);
        if (val instanceof String) {
            return (String) val;
        }
        return defaultValue;
    }
}
