package com.ttennebkram.spectral.processing;

import org.opencv.core.Mat;

/**
 * Functional interface for processing one input image into several outputs.
 */
@FunctionalInterface
public interface MultiImageProcessor {
    /**
     * @param input Input image (may be null if not yet received)
     * @return One Mat per output port; the caller releases each
     */
    Mat[] process(Mat input);
}
