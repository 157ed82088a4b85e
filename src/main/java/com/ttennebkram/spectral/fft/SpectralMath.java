package com.ttennebkram.spectral.fft;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-plane DFT helpers shared by the forward and inverse transforms.
 * All planes are single-channel CV_32F, spectra are two-channel CV_32FC2.
 */
public final class SpectralMath {

    /** Guard for divisions by plane maxima and window weights. */
    public static final double EPSILON = 1e-10;

    // Relative to the largest bin; below this a bin's phase is noise
    static final double NEGLIGIBLE_MAGNITUDE = 1e-6;

    private SpectralMath() {
    }

    // ===== Sizes =====

    static int nextPowerOf2(int n) {
        int power = 1;
        while (power < n) {
            power *= 2;
        }
        return power;
    }

    /**
     * DFT size for a dimension of length n under the given strategy. Always >= n.
     */
    public static int paddedSize(int n, PaddingStrategy strategy) {
        switch (strategy) {
            case NONE:
                return n;
            case POWER_OF_TWO_PREFERRED: {
                int pow2 = nextPowerOf2(n);
                int optimal = Core.getOptimalDFTSize(n);
                // Use power of 2 if it adds less than 25% overhead
                if (pow2 <= optimal * 1.25) {
                    return pow2;
                }
                return optimal % 2 == 0 ? optimal : optimal + 1;
            }
            case OPENCV_OPTIMAL:
            default:
                return Core.getOptimalDFTSize(n);
        }
    }

    // ===== Quadrant swap =====

    /**
     * Move the zero frequency of a spectrum of the given padded size from the
     * corner to (paddedCols/2, paddedRows/2). For odd sizes the left and top
     * quadrants of the result are one sample smaller than the right and bottom.
     *
     * @return a new Mat, the input is not modified
     */
    public static Mat centerSpectrum(Mat spectrum, int paddedRows, int paddedCols) {
        checkSpectrumSize(spectrum, paddedRows, paddedCols);
        return swapQuadrants(spectrum, paddedCols - paddedCols / 2, paddedRows - paddedRows / 2);
    }

    /**
     * Undo {@link #centerSpectrum}. Uses the same quadrant sizes, derived from
     * the stored padded dimensions, with the complementary split point. For
     * even sizes this is the same swap again.
     *
     * @return a new Mat, the input is not modified
     */
    public static Mat uncenterSpectrum(Mat spectrum, int paddedRows, int paddedCols) {
        checkSpectrumSize(spectrum, paddedRows, paddedCols);
        return swapQuadrants(spectrum, paddedCols / 2, paddedRows / 2);
    }

    /**
     * Exchange the four quadrants split at (splitX, splitY) diagonally:
     * top-left with bottom-right, top-right with bottom-left. Quadrants keep
     * their own sizes, so the result is a circular shift by (-splitX, -splitY).
     */
    static Mat swapQuadrants(Mat src, int splitX, int splitY) {
        int cols = src.cols();
        int rows = src.rows();
        int restX = cols - splitX;
        int restY = rows - splitY;

        Mat dst = new Mat(src.size(), src.type());
        copyBlock(src, new Rect(0, 0, splitX, splitY), dst, new Rect(restX, restY, splitX, splitY));        // Top-Left
        copyBlock(src, new Rect(splitX, 0, restX, splitY), dst, new Rect(0, restY, restX, splitY));         // Top-Right
        copyBlock(src, new Rect(0, splitY, splitX, restY), dst, new Rect(restX, 0, splitX, restY));         // Bottom-Left
        copyBlock(src, new Rect(splitX, splitY, restX, restY), dst, new Rect(0, 0, restX, restY));          // Bottom-Right
        return dst;
    }

    private static void copyBlock(Mat src, Rect from, Mat dst, Rect to) {
        if (from.width <= 0 || from.height <= 0) {
            return;
        }
        Mat source = src.submat(from);
        Mat target = dst.submat(to);
        source.copyTo(target);
        source.release();
        target.release();
    }

    private static void checkSpectrumSize(Mat spectrum, int paddedRows, int paddedCols) {
        if (spectrum.rows() != paddedRows || spectrum.cols() != paddedCols) {
            throw new IllegalArgumentException("Spectrum is " + spectrum.rows() + "x" + spectrum.cols()
                + " but the padded size is " + paddedRows + "x" + paddedCols);
        }
    }

    // ===== Padding and cropping =====

    /**
     * Zero-pad a plane at the bottom and right to the given size.
     */
    public static Mat padTo(Mat plane, int rows, int cols) {
        Mat padded = new Mat();
        Core.copyMakeBorder(plane, padded, 0, rows - plane.rows(), 0, cols - plane.cols(),
            Core.BORDER_CONSTANT, Scalar.all(0));
        return padded;
    }

    /**
     * Copy the top-left rows x cols region of a plane.
     */
    public static Mat cropTo(Mat plane, int rows, int cols) {
        Mat roi = plane.submat(new Rect(0, 0, cols, rows));
        Mat cropped = roi.clone();
        roi.release();
        return cropped;
    }

    // ===== Window =====

    /**
     * Separable Hann window of the given size, or null when a dimension is too
     * small for a window (OpenCV needs at least 2x2).
     */
    public static Mat createHannWindow(int rows, int cols) {
        if (rows < 2 || cols < 2) {
            return null;
        }
        Mat window = new Mat();
        Imgproc.createHanningWindow(window, new Size(cols, rows), CvType.CV_32F);
        return window;
    }

    /**
     * Multiply a plane by the Hann window in place.
     *
     * @return true if a window was applied
     */
    public static boolean applyHannWindow(Mat plane) {
        Mat window = createHannWindow(plane.rows(), plane.cols());
        if (window == null) {
            return false;
        }
        Core.multiply(plane, window, plane);
        window.release();
        return true;
    }

    /**
     * Divide a plane by the Hann window in place where the window weight is at
     * least minWeight. Samples near the border, where the window falls to zero,
     * cannot be recovered and are left as they are.
     */
    public static void removeHannWindow(Mat plane, double minWeight) {
        Mat window = createHannWindow(plane.rows(), plane.cols());
        if (window == null) {
            return;
        }
        Mat mask = new Mat();
        Mat divided = new Mat();
        try {
            Core.compare(window, new Scalar(Math.max(minWeight, EPSILON)), mask, Core.CMP_GE);
            Core.divide(plane, window, divided);
            divided.copyTo(plane, mask);
        } finally {
            window.release();
            mask.release();
            divided.release();
        }
    }

    // ===== Polar conversion =====

    /**
     * Split a complex spectrum into magnitude and phase planes. Phase is the
     * angle of each bin in (-pi, pi]; bins whose magnitude is negligible
     * next to the largest one get phase 0, since the sign of a rounding
     * residue would otherwise decide between -pi and pi.
     *
     * @return {magnitude, phase}
     */
    public static Mat[] toPolar(Mat complex) {
        List<Mat> planes = new ArrayList<>();
        Core.split(complex, planes);
        Mat magnitude = new Mat();
        Mat phase = new Mat();
        Mat mask = new Mat();
        try {
            Core.cartToPolar(planes.get(0), planes.get(1), magnitude, phase);

            // cartToPolar answers in [0, 2pi)
            Core.compare(phase, new Scalar(Math.PI), mask, Core.CMP_GT);
            Core.subtract(phase, new Scalar(2.0 * Math.PI), phase, mask);

            double floor = Math.max(maxValue(magnitude) * NEGLIGIBLE_MAGNITUDE, EPSILON);
            Core.compare(magnitude, new Scalar(floor), mask, Core.CMP_LE);
            phase.setTo(Scalar.all(0), mask);
            return new Mat[]{magnitude, phase};
        } catch (RuntimeException e) {
            magnitude.release();
            phase.release();
            throw e;
        } finally {
            mask.release();
            for (Mat p : planes) p.release();
        }
    }

    /**
     * Build a complex spectrum from magnitude and phase (radians) planes.
     */
    public static Mat toComplex(Mat magnitude, Mat phase, PolarToRectangular strategy) {
        Mat real = new Mat();
        Mat imaginary = new Mat();
        try {
            strategy.toRectangular(magnitude, phase, real, imaginary);
            List<Mat> planes = new ArrayList<>();
            planes.add(real);
            planes.add(imaginary);
            Mat complex = new Mat();
            Core.merge(planes, complex);
            return complex;
        } finally {
            real.release();
            imaginary.release();
        }
    }

    // ===== DFT =====

    /**
     * Complex DFT of a real plane.
     */
    public static Mat forwardDft(Mat plane) {
        List<Mat> planes = new ArrayList<>();
        planes.add(plane);
        planes.add(Mat.zeros(plane.size(), CvType.CV_32F));
        Mat complex = new Mat();
        Core.merge(planes, complex);
        planes.get(1).release();

        Core.dft(complex, complex);
        return complex;
    }

    /**
     * Scaled inverse DFT of a complex spectrum, returning the real part.
     */
    public static Mat inverseDftReal(Mat complex) {
        Mat spatial = new Mat();
        Core.idft(complex, spatial, Core.DFT_SCALE);

        List<Mat> planes = new ArrayList<>();
        Core.split(spatial, planes);
        spatial.release();
        planes.get(1).release();
        return planes.get(0);
    }

    // ===== Plane access =====

    public static double maxValue(Mat plane) {
        return Core.minMaxLoc(plane).maxVal;
    }

    public static double minValue(Mat plane) {
        return Core.minMaxLoc(plane).minVal;
    }

    /**
     * Clamp a plane to [min, max] in place.
     */
    public static void clamp(Mat plane, double min, double max) {
        Core.min(plane, new Scalar(max), plane);
        Core.max(plane, new Scalar(min), plane);
    }

    /**
     * Copy a continuous CV_32F plane into a new array.
     */
    public static float[] toArray(Mat plane) {
        Mat continuous = plane.isContinuous() ? plane : plane.clone();
        float[] data = new float[(int) continuous.total()];
        continuous.get(0, 0, data);
        if (continuous != plane) {
            continuous.release();
        }
        return data;
    }

    public static Mat fromArray(float[] data, int rows, int cols) {
        Mat plane = new Mat(rows, cols, CvType.CV_32F);
        plane.put(0, 0, data);
        return plane;
    }

    /**
     * Convert a plane to CV_32F, always returning a new Mat owned by the caller.
     */
    public static Mat toFloat(Mat plane) {
        Mat converted = new Mat();
        if (plane.type() == CvType.CV_32F) {
            plane.copyTo(converted);
        } else {
            plane.convertTo(converted, CvType.CV_32F);
        }
        return converted;
    }
}
