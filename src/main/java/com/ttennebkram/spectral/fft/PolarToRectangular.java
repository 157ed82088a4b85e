package com.ttennebkram.spectral.fft;

import org.opencv.core.Mat;

/**
 * Converts polar spectrum planes to real and imaginary planes.
 *
 * Inputs are single-channel CV_32F planes of the same size; the outputs are
 * (re)allocated to match. Phase is in radians, nominally in [-pi, pi].
 */
public interface PolarToRectangular {

    void toRectangular(Mat magnitude, Mat phase, Mat real, Mat imaginary);

    /**
     * Upper bound on the absolute error of the sine and cosine used, per unit magnitude.
     */
    double maxAbsoluteError();
}
