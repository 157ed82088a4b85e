package com.ttennebkram.spectral.fft;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * Polar to rectangular conversion with truncated Taylor polynomials.
 *
 * The angle is wrapped to [-pi, pi] and folded into [-pi/2, pi/2] before
 * evaluation (sin(pi - x) = sin(x), cos(pi - x) = -cos(x)). On the folded range
 * the sine series through x^9 and the cosine series through x^8 stay within
 * 1e-4 of the exact values.
 */
public class FastPolarToRectangular implements PolarToRectangular {

    static final double MAX_ABSOLUTE_ERROR = 1e-4;

    private static final double TWO_PI = 2.0 * Math.PI;
    private static final double HALF_PI = Math.PI / 2.0;

    @Override
    public void toRectangular(Mat magnitudePlane, Mat phasePlane, Mat realPlane, Mat imaginaryPlane) {
        float[] magnitude = SpectralMath.toArray(magnitudePlane);
        float[] phase = SpectralMath.toArray(phasePlane);
        float[] real = new float[magnitude.length];
        float[] imaginary = new float[magnitude.length];
        for (int i = 0; i < magnitude.length; i++) {
            double x = Math.IEEEremainder(phase[i], TWO_PI);
            double cosSign = 1.0;
            if (x > HALF_PI) {
                x = Math.PI - x;
                cosSign = -1.0;
            } else if (x < -HALF_PI) {
                x = -Math.PI - x;
                cosSign = -1.0;
            }
            double m = magnitude[i];
            real[i] = (float) (m * cosSign * cos(x));
            imaginary[i] = (float) (m * sin(x));
        }
        realPlane.create(magnitudePlane.rows(), magnitudePlane.cols(), CvType.CV_32F);
        imaginaryPlane.create(magnitudePlane.rows(), magnitudePlane.cols(), CvType.CV_32F);
        realPlane.put(0, 0, real);
        imaginaryPlane.put(0, 0, imaginary);
    }

    @Override
    public double maxAbsoluteError() {
        return MAX_ABSOLUTE_ERROR;
    }

    static double sin(double x) {
        double x2 = x * x;
        return x * (1.0 - x2 / 6.0 * (1.0 - x2 / 20.0 * (1.0 - x2 / 42.0 * (1.0 - x2 / 72.0))));
    }

    static double cos(double x) {
        double x2 = x * x;
        return 1.0 - x2 / 2.0 * (1.0 - x2 / 12.0 * (1.0 - x2 / 30.0 * (1.0 - x2 / 56.0)));
    }
}
