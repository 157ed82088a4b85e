package com.ttennebkram.spectral.fft;

import com.ttennebkram.spectral.metadata.MagnitudeOutputMode;
import com.ttennebkram.spectral.metadata.ReconstructionMetadata;
import com.ttennebkram.spectral.util.OpenCvLoader;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.CLAHE;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

/**
 * Decomposes a CV_32FC4 image into magnitude and phase spectra, one DFT per channel.
 * <p>
 * Magnitude is optionally log-compressed and normalized to [0,1]; phase is mapped from
 * (-pi, pi] to [0,1]. Everything the inverse needs to undo those steps is returned as
 * {@link ReconstructionMetadata}. Instances hold no per-call state and may be shared.
 */
public class ForwardSpectralTransform {

    private static final Logger LOG = LoggerFactory.getLogger(ForwardSpectralTransform.class);

    private static final int COLOR_CHANNELS = 3;
    private static final int IMAGE_CHANNELS = 4;

    public ForwardSpectralTransform() {
        OpenCvLoader.ensureLoaded();
    }

    /**
     * Transform with default options.
     */
    public ForwardResult transform(Mat image) {
        return transform(image, ForwardOptions.defaults());
    }

    /**
     * @param image CV_32FC4 image; null or empty yields an empty result
     * @throws IllegalArgumentException if the image does not have 4 channels
     */
    public ForwardResult transform(Mat image, ForwardOptions options) {
        if (image == null || image.empty()) {
            LOG.debug("Forward transform skipped: no input image");
            return ForwardResult.empty();
        }
        if (image.channels() != IMAGE_CHANNELS) {
            throw new IllegalArgumentException("Forward transform expects a 4-channel image, got "
                + image.channels() + " channels");
        }

        int rows = image.rows();
        int cols = image.cols();
        int paddedRows = SpectralMath.paddedSize(rows, options.getPaddingStrategy());
        int paddedCols = SpectralMath.paddedSize(cols, options.getPaddingStrategy());
        int transformedChannels = options.isTransformAlphaChannel() ? IMAGE_CHANNELS : COLOR_CHANNELS;

        LOG.debug("Forward transform {}x{} (padded {}x{}), log={}, center={}, window={}, phaseContrast={}, alpha={}, mode={}",
            rows, cols, paddedRows, paddedCols, options.isApplyLogCompression(), options.isCenterZeroFrequency(),
            options.isApplyWindow(), options.isEnhancePhaseContrast(), options.isTransformAlphaChannel(),
            options.getMagnitudeOutputMode());

        List<Mat> planes = new ArrayList<>();
        Core.split(image, planes);
        List<ChannelSpectrum> spectra = null;
        try {
            List<Supplier<ChannelSpectrum>> tasks = new ArrayList<>();
            for (int c = 0; c < transformedChannels; c++) {
                Mat plane = planes.get(c);
                tasks.add(() -> transformChannel(plane, paddedRows, paddedCols, options));
            }
            spectra = ChannelRunner.runAll(tasks, options.getChannelExecutor(), ChannelSpectrum::release);

            List<Mat> magnitudePlanes = new ArrayList<>();
            List<Mat> phasePlanes = new ArrayList<>();
            for (ChannelSpectrum spectrum : spectra) {
                magnitudePlanes.add(spectrum.magnitude);
                phasePlanes.add(spectrum.phase);
            }
            if (!options.isTransformAlphaChannel()) {
                magnitudePlanes.add(Mat.ones(rows, cols, CvType.CV_32F));
                phasePlanes.add(Mat.ones(rows, cols, CvType.CV_32F));
            }

            Mat magnitude = new Mat();
            Mat phase = new Mat();
            try {
                Core.merge(magnitudePlanes, magnitude);
                Core.merge(phasePlanes, phase);
                ReconstructionMetadata metadata = buildMetadata(spectra, rows, cols, paddedRows, paddedCols, options);
                return new ForwardResult(new SpectralPair(magnitude, phase), metadata);
            } catch (RuntimeException e) {
                magnitude.release();
                phase.release();
                throw e;
            } finally {
                if (!options.isTransformAlphaChannel()) {
                    magnitudePlanes.get(COLOR_CHANNELS).release();
                    phasePlanes.get(COLOR_CHANNELS).release();
                }
            }
        } finally {
            for (Mat plane : planes) plane.release();
            if (spectra != null) {
                for (ChannelSpectrum spectrum : spectra) spectrum.release();
            }
        }
    }

    private ChannelSpectrum transformChannel(Mat channel, int paddedRows, int paddedCols, ForwardOptions options) {
        int rows = channel.rows();
        int cols = channel.cols();

        Mat plane = SpectralMath.toFloat(channel);
        Mat padded = null;
        Mat complex = null;
        Mat centered = null;
        Mat[] polar = null;
        try {
            if (options.isApplyWindow()) {
                SpectralMath.applyHannWindow(plane);
            }
            padded = SpectralMath.padTo(plane, paddedRows, paddedCols);
            complex = SpectralMath.forwardDft(padded);

            Mat spectrum = complex;
            if (options.isCenterZeroFrequency()) {
                centered = SpectralMath.centerSpectrum(complex, paddedRows, paddedCols);
                spectrum = centered;
            }

            polar = SpectralMath.toPolar(spectrum);
            Mat magnitude = polar[0];
            Mat phase = polar[1];

            double preLogMax = SpectralMath.maxValue(magnitude);
            double postLogMax = preLogMax;
            if (options.isApplyLogCompression()) {
                Core.add(magnitude, new Scalar(1.0), magnitude);
                Core.log(magnitude, magnitude);
                postLogMax = SpectralMath.maxValue(magnitude);
            }

            if (options.getMagnitudeOutputMode() == MagnitudeOutputMode.NORMALIZED) {
                normalize(magnitude, options.getMagnitudeGamma());
            }

            // (phase + pi) / 2pi
            Core.add(phase, new Scalar(Math.PI), phase);
            Core.multiply(phase, new Scalar(1.0 / (2.0 * Math.PI)), phase);
            SpectralMath.clamp(phase, 0.0, 1.0);

            if (options.isEnhancePhaseContrast()) {
                equalizePhase(phase, options.getPhaseClipLimit(), options.getPhaseTileSize());
            }

            return new ChannelSpectrum(
                SpectralMath.cropTo(magnitude, rows, cols),
                SpectralMath.cropTo(phase, rows, cols),
                preLogMax,
                postLogMax);
        } finally {
            plane.release();
            if (padded != null) padded.release();
            if (complex != null) complex.release();
            if (centered != null) centered.release();
            if (polar != null) {
                for (Mat m : polar) m.release();
            }
        }
    }

    /**
     * Optional gamma, then scale so the largest value is 1.
     */
    private static void normalize(Mat magnitude, double gamma) {
        if (gamma != 1.0) {
            Core.pow(magnitude, gamma, magnitude);
        }
        double max = SpectralMath.maxValue(magnitude);
        if (max > SpectralMath.EPSILON) {
            Core.multiply(magnitude, new Scalar(1.0 / max), magnitude);
        }
    }

    /**
     * CLAHE on an 8-bit copy of the [0,1] phase plane, written back in place.
     */
    private static void equalizePhase(Mat phase, double clipLimit, int tileSize) {
        if (phase.rows() < 2 || phase.cols() < 2) {
            return;
        }
        // Tile grid no larger than the plane
        Size tiles = new Size(Math.min(tileSize, phase.cols()), Math.min(tileSize, phase.rows()));
        Mat phase8 = new Mat();
        Mat equalized = new Mat();
        try {
            phase.convertTo(phase8, CvType.CV_8U, 255.0);
            CLAHE clahe = Imgproc.createCLAHE(clipLimit, tiles);
            clahe.apply(phase8, equalized);
            equalized.convertTo(phase, CvType.CV_32F, 1.0 / 255.0);
        } finally {
            phase8.release();
            equalized.release();
        }
    }

    private static ReconstructionMetadata buildMetadata(List<ChannelSpectrum> spectra, int rows, int cols,
                                                        int paddedRows, int paddedCols, ForwardOptions options) {
        double[] preLogMaxima = new double[spectra.size()];
        double[] postLogMaxima = new double[spectra.size()];
        for (int c = 0; c < spectra.size(); c++) {
            preLogMaxima[c] = spectra.get(c).preLogMax;
            postLogMaxima[c] = spectra.get(c).postLogMax;
        }

        // The window is skipped for planes too small to carry one
        boolean windowApplied = options.isApplyWindow() && rows >= 2 && cols >= 2;

        return ReconstructionMetadata.builder()
            .originalSize(rows, cols)
            .paddedSize(paddedRows, paddedCols)
            .logTransformApplied(options.isApplyLogCompression())
            .centeringApplied(options.isCenterZeroFrequency())
            .windowApplied(windowApplied)
            .phaseContrastEnhanced(options.isEnhancePhaseContrast())
            .alphaChannelTransformed(options.isTransformAlphaChannel())
            .magnitudeMaxima(preLogMaxima[0], postLogMaxima[0])
            .channelMaxima(preLogMaxima, postLogMaxima)
            .magnitudeOutputMode(options.getMagnitudeOutputMode())
            .magnitudeGamma(options.getMagnitudeGamma())
            .build();
    }

    private static final class ChannelSpectrum {
        private final Mat magnitude;
        private final Mat phase;
        private final double preLogMax;
        private final double postLogMax;

        private ChannelSpectrum(Mat magnitude, Mat phase, double preLogMax, double postLogMax) {
            this.magnitude = magnitude;
            this.phase = phase;
            this.preLogMax = preLogMax;
            this.postLogMax = postLogMax;
        }

        private void release() {
            magnitude.release();
            phase.release();
        }
    }
}
