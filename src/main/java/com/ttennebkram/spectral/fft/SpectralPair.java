package com.ttennebkram.spectral.fft;

import org.opencv.core.Mat;

/**
 * Magnitude and phase spectra of a 4-channel image.
 * Either side may be null or empty, for example when an input port is not connected yet.
 */
public final class SpectralPair {

    private final Mat magnitude;
    private final Mat phase;

    public SpectralPair(Mat magnitude, Mat phase) {
        this.magnitude = magnitude;
        this.phase = phase;
    }

    public static SpectralPair empty() {
        return new SpectralPair(null, null);
    }

    public Mat getMagnitude() {
        return magnitude;
    }

    public Mat getPhase() {
        return phase;
    }

    public boolean isEmpty() {
        return magnitude == null || magnitude.empty() || phase == null || phase.empty();
    }

    /**
     * Release both spectra.
     */
    public void release() {
        if (magnitude != null) magnitude.release();
        if (phase != null) phase.release();
    }
}
