package com.ttennebkram.spectral.fft;

import com.ttennebkram.spectral.metadata.ReconstructionMetadata;
import com.ttennebkram.spectral.util.OpenCvLoader;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reconstructs a CV_32FC4 image from magnitude and phase spectra.
 * <p>
 * With metadata from {@link ForwardSpectralTransform} the magnitude is de-normalized
 * exactly; without it the magnitude ceiling is estimated and the result is only an
 * approximation. Instances hold no per-call state and may be shared.
 */
public class InverseSpectralTransform {

    private static final Logger LOG = LoggerFactory.getLogger(InverseSpectralTransform.class);

    private static final int COLOR_CHANNELS = 3;
    private static final int IMAGE_CHANNELS = 4;

    // Window weights below this are too close to zero to divide by
    static final double MIN_WINDOW_WEIGHT = 0.05;

    // Brightness boost for dark heuristic reconstructions
    static final double DARK_THRESHOLD = 0.3;
    static final double BRIGHTNESS_TARGET = 0.8;
    static final double MAX_BRIGHTNESS_FACTOR = 10.0;

    // Approximate inverse of the CLAHE phase equalization
    private static final Size PHASE_SMOOTHING_KERNEL = new Size(3, 3);
    private static final double PHASE_SMOOTHING_SIGMA = 0.5;

    public InverseSpectralTransform() {
        OpenCvLoader.ensureLoaded();
    }

    public Mat transform(SpectralPair spectra, Optional<ReconstructionMetadata> metadata) {
        return transform(spectra, metadata, InverseOptions.defaults());
    }

    public Mat transform(Mat magnitude, Mat phase, Optional<ReconstructionMetadata> metadata, InverseOptions options) {
        return transform(new SpectralPair(magnitude, phase), metadata, options);
    }

    /**
     * @return the reconstructed image, or an empty Mat when either spectrum is missing
     * @throws IllegalArgumentException if the spectra differ in shape or are not 4-channel
     */
    public Mat transform(SpectralPair spectra, Optional<ReconstructionMetadata> metadata, InverseOptions options) {
        if (spectra == null || spectra.isEmpty()) {
            LOG.debug("Inverse transform skipped: magnitude or phase missing");
            return new Mat();
        }
        Mat magnitude = spectra.getMagnitude();
        Mat phase = spectra.getPhase();
        if (magnitude.rows() != phase.rows() || magnitude.cols() != phase.cols()
                || magnitude.channels() != phase.channels()) {
            throw new IllegalArgumentException("Magnitude (" + describe(magnitude) + ") and phase ("
                + describe(phase) + ") spectra must have the same shape");
        }
        if (magnitude.channels() != IMAGE_CHANNELS) {
            throw new IllegalArgumentException("Inverse transform expects 4-channel spectra, got "
                + magnitude.channels() + " channels");
        }

        int rows = magnitude.rows();
        int cols = magnitude.cols();
        ReconstructionPlan plan = ReconstructionPlan.resolve(metadata, options, rows, cols);
        PolarToRectangular polarToRectangular = options.getPolarToRectangular();
        int transformedChannels = plan.isAlphaTransformed() ? IMAGE_CHANNELS : COLOR_CHANNELS;
        LOG.debug("Inverse transform {}x{} with {}, quality={}, scale={}",
            rows, cols, plan, options.getQuality(), options.getMagnitudeScale());

        List<Mat> magnitudePlanes = new ArrayList<>();
        List<Mat> phasePlanes = new ArrayList<>();
        Core.split(magnitude, magnitudePlanes);
        Core.split(phase, phasePlanes);
        List<Mat> channels = null;
        try {
            List<Supplier<Mat>> tasks = new ArrayList<>();
            for (int c = 0; c < transformedChannels; c++) {
                int channel = c;
                Mat magnitudePlane = magnitudePlanes.get(c);
                Mat phasePlane = phasePlanes.get(c);
                tasks.add(() -> reconstructChannel(channel, magnitudePlane, phasePlane, plan, options, polarToRectangular));
            }
            channels = new ArrayList<>(ChannelRunner.runAll(tasks, options.getChannelExecutor(), Mat::release));

            if (plan.isHeuristic() && options.isBrightnessBoost()) {
                boostBrightness(channels.subList(0, COLOR_CHANNELS));
            }
            if (!plan.isAlphaTransformed()) {
                channels.add(Mat.ones(rows, cols, CvType.CV_32F));
            }

            Mat image = new Mat();
            Core.merge(channels, image);
            return image;
        } finally {
            for (Mat m : magnitudePlanes) m.release();
            for (Mat m : phasePlanes) m.release();
            if (channels != null) {
                for (Mat m : channels) m.release();
            }
        }
    }

    private Mat reconstructChannel(int channel, Mat storedMagnitude, Mat storedPhase, ReconstructionPlan plan,
                                   InverseOptions options, PolarToRectangular polarToRectangular) {
        Mat magnitude = SpectralMath.toFloat(storedMagnitude);
        Mat phase = SpectralMath.toFloat(storedPhase);
        Mat complex = null;
        Mat padded = null;
        Mat uncentered = null;
        Mat spatial = null;
        try {
            restoreMagnitude(channel, magnitude, plan, options.getMagnitudeScale());

            // x * 2pi - pi
            Core.multiply(phase, new Scalar(2.0 * Math.PI), phase);
            Core.subtract(phase, new Scalar(Math.PI), phase);
            if (plan.isPhaseEnhanced() && options.getQuality().isAtLeast(ReconstructionQuality.HIGH)) {
                Imgproc.GaussianBlur(phase, phase, PHASE_SMOOTHING_KERNEL, PHASE_SMOOTHING_SIGMA);
            }

            complex = SpectralMath.toComplex(magnitude, phase, polarToRectangular);
            padded = SpectralMath.padTo(complex, plan.getPaddedRows(), plan.getPaddedCols());

            Mat spectrum = padded;
            if (plan.isCentered()) {
                uncentered = SpectralMath.uncenterSpectrum(padded, plan.getPaddedRows(), plan.getPaddedCols());
                spectrum = uncentered;
            }

            spatial = SpectralMath.inverseDftReal(spectrum);
            Mat result = SpectralMath.cropTo(spatial, plan.getOriginalRows(), plan.getOriginalCols());
            if (plan.isWindowed()) {
                SpectralMath.removeHannWindow(result, MIN_WINDOW_WEIGHT);
            }
            SpectralMath.clamp(result, 0.0, 1.0);
            return result;
        } finally {
            magnitude.release();
            phase.release();
            if (complex != null) complex.release();
            if (padded != null) padded.release();
            if (uncentered != null) uncentered.release();
            if (spatial != null) spatial.release();
        }
    }

    /**
     * Undo normalization, gamma and log compression in place, then apply the magnitude scale.
     */
    private static void restoreMagnitude(int channel, Mat magnitude, ReconstructionPlan plan, double magnitudeScale) {
        double min = SpectralMath.minValue(magnitude);
        double max = SpectralMath.maxValue(magnitude);
        if (plan.isNormalized(min, max)) {
            Core.multiply(magnitude, new Scalar(plan.normalizationCeiling(channel)), magnitude);
            double gamma = plan.getMagnitudeGamma();
            if (gamma != 1.0) {
                Core.max(magnitude, new Scalar(0.0), magnitude);
                Core.pow(magnitude, 1.0 / gamma, magnitude);
            }
        }
        if (plan.isLogApplied()) {
            Core.exp(magnitude, magnitude);
            Core.subtract(magnitude, new Scalar(1.0), magnitude);
        }
        if (magnitudeScale != 1.0) {
            Core.multiply(magnitude, new Scalar(magnitudeScale), magnitude);
        }
    }

    /**
     * Brighten color planes whose common maximum stays below the dark threshold.
     */
    private static void boostBrightness(List<Mat> colorPlanes) {
        double max = 0.0;
        for (Mat plane : colorPlanes) {
            max = Math.max(max, SpectralMath.maxValue(plane));
        }
        if (max >= DARK_THRESHOLD || max <= SpectralMath.EPSILON) {
            return;
        }
        double factor = Math.min(BRIGHTNESS_TARGET / max, MAX_BRIGHTNESS_FACTOR);
        LOG.debug("Heuristic reconstruction is dark (max {}), brightening by {}", max, factor);
        for (Mat plane : colorPlanes) {
            Core.multiply(plane, new Scalar(factor), plane);
            SpectralMath.clamp(plane, 0.0, 1.0);
        }
    }

    private static String describe(Mat m) {
        return m.rows() + "x" + m.cols() + "x" + m.channels();
    }
}
