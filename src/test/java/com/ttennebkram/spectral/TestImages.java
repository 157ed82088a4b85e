package com.ttennebkram.spectral;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.ArrayList;
import java.util.List;

/**
 * Synthetic CV_32FC4 test images and comparison helpers.
 */
public final class TestImages {

    private TestImages() {
    }

    /**
     * Uniform color channels at the given level, alpha 1.
     */
    public static Mat constant(int rows, int cols, double value) {
        return new Mat(rows, cols, CvType.CV_32FC4, new Scalar(value, value, value, 1.0));
    }

    /**
     * Smooth, low-frequency pattern in roughly [0.2, 0.8] with a different
     * phase per channel, alpha 1.
     */
    public static Mat pattern(int rows, int cols) {
        float[] data = new float[rows * cols * 4];
        for (int y = 0; y < rows; y++) {
            for (int x = 0; x < cols; x++) {
                int i = (y * cols + x) * 4;
                double u = 2.0 * Math.PI * x / cols;
                double v = 2.0 * Math.PI * y / rows;
                data[i] = (float) (0.5 + 0.2 * Math.sin(u) + 0.1 * Math.cos(v));
                data[i + 1] = (float) (0.5 + 0.15 * Math.cos(u + v));
                data[i + 2] = (float) (0.45 + 0.2 * Math.sin(2 * v) * Math.cos(u));
                data[i + 3] = 1.0f;
            }
        }
        Mat image = new Mat(rows, cols, CvType.CV_32FC4);
        image.put(0, 0, data);
        return image;
    }

    /**
     * Mean absolute difference over the first {@code channels} channels.
     */
    public static double meanAbsoluteError(Mat a, Mat b, int channels) {
        List<Mat> aPlanes = new ArrayList<>();
        List<Mat> bPlanes = new ArrayList<>();
        Core.split(a, aPlanes);
        Core.split(b, bPlanes);
        double sum = 0.0;
        Mat diff = new Mat();
        for (int c = 0; c < channels; c++) {
            Core.absdiff(aPlanes.get(c), bPlanes.get(c), diff);
            sum += Core.mean(diff).val[0];
        }
        diff.release();
        for (Mat m : aPlanes) m.release();
        for (Mat m : bPlanes) m.release();
        return sum / channels;
    }

    public static double channelMin(Mat image, int channel) {
        Mat plane = channel(image, channel);
        double min = Core.minMaxLoc(plane).minVal;
        plane.release();
        return min;
    }

    public static double channelMax(Mat image, int channel) {
        Mat plane = channel(image, channel);
        double max = Core.minMaxLoc(plane).maxVal;
        plane.release();
        return max;
    }

    public static Mat channel(Mat image, int channel) {
        Mat plane = new Mat();
        Core.extractChannel(image, plane, channel);
        return plane;
    }
}
