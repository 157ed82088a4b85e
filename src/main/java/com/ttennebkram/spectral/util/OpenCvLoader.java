package com.ttennebkram.spectral.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact.
 * Safe to call multiple times - only loads once per class loader.
 */
public final class OpenCvLoader {

    private static final Logger LOG = LoggerFactory.getLogger(OpenCvLoader.class);

    private static boolean loaded = false;

    private OpenCvLoader() {
    }

    /**
     * Load the native library if it has not been loaded yet.
     *
     * @throws IllegalStateException if the native library cannot be loaded on this platform
     */
    public static synchronized void ensureLoaded() {
        if (loaded) return;

        try {
            nu.pattern.OpenCV.loadLocally();
        } catch (RuntimeException | UnsatisfiedLinkError e) {
            throw new IllegalStateException("Failed to load OpenCV native library: " + e.getMessage(), e);
        }
        loaded = true;
        LOG.debug("OpenCV native library loaded");
    }
}
