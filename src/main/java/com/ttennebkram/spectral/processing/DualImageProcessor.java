package com.ttennebkram.spectral.processing;

import org.opencv.core.Mat;

/**
 * Functional interface for processing two input images.
 * Used by dual-input nodes such as the inverse Fourier transform (magnitude + phase).
 */
@FunctionalInterface
public interface DualImageProcessor {
    /**
     * Process two input images and return the result.
     * Either input may be null if not yet received.
     *
     * @param input1 First input image (may be null)
     * @param input2 Second input image (may be null)
     * @return Processed output image, empty if there was nothing to process
     */
    Mat process(Mat input1, Mat input2);
}
