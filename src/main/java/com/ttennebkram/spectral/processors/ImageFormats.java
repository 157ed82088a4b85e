package com.ttennebkram.spectral.processors;

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

/**
 * Conversion of node inputs to the CV_32FC4 raster the transforms work on.
 */
public final class ImageFormats {

    private ImageFormats() {
    }

    /**
     * Convert a 1-, 3- or 4-channel image to CV_32FC4 in [0,1].
     * 8-bit input is scaled by 1/255, 16-bit by 1/65535; float input is kept as is.
     * Added alpha is 1.0.
     *
     * @return a new Mat owned by the caller
     * @throws IllegalArgumentException for other channel counts
     */
    public static Mat toRgbaFloat(Mat input) {
        int channels = input.channels();
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels
                + " (expected 1, 3 or 4)");
        }

        Mat floating = new Mat();
        switch (input.depth()) {
            case CvType.CV_8U:
                input.convertTo(floating, CvType.CV_32F, 1.0 / 255.0);
                break;
            case CvType.CV_16U:
                input.convertTo(floating, CvType.CV_32F, 1.0 / 65535.0);
                break;
            case CvType.CV_32F:
                input.copyTo(floating);
                break;
            default:
                input.convertTo(floating, CvType.CV_32F);
                break;
        }

        if (channels == 4) {
            return floating;
        }
        Mat rgba = new Mat();
        Imgproc.cvtColor(floating, rgba, channels == 1 ? Imgproc.COLOR_GRAY2RGBA : Imgproc.COLOR_RGB2RGBA);
        floating.release();
        return rgba;
    }
}
