package com.ttennebkram.spectral.fft;

import org.opencv.core.Core;
import org.opencv.core.Mat;

/**
 * Polar to rectangular conversion with OpenCV's {@link Core#polarToCart}.
 */
public class ExactPolarToRectangular implements PolarToRectangular {

    // OpenCV evaluates sine and cosine in single precision
    static final double MAX_ABSOLUTE_ERROR = 1e-5;

    @Override
    public void toRectangular(Mat magnitude, Mat phase, Mat real, Mat imaginary) {
        Core.polarToCart(magnitude, phase, real, imaginary);
    }

    @Override
    public double maxAbsoluteError() {
        return MAX_ABSOLUTE_ERROR;
    }
}
