package com.ttennebkram.spectral.fft;

import com.ttennebkram.spectral.util.OpenCvLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@DisplayName("PolarToRectangular")
class PolarToRectangularTest {

    private static final int SAMPLES = 20001;

    @BeforeAll
    static void loadOpenCv() {
        OpenCvLoader.ensureLoaded();
    }

    private static Mat sweep(double from, double to) {
        float[] phase = new float[SAMPLES];
        for (int i = 0; i < SAMPLES; i++) {
            phase[i] = (float) (from + (to - from) * i / (SAMPLES - 1));
        }
        return SpectralMath.fromArray(phase, 1, SAMPLES);
    }

    private static Mat ones() {
        return new Mat(1, SAMPLES, CvType.CV_32F, new Scalar(1.0));
    }

    @Test
    @DisplayName("Fast conversion stays within its error bound of the exact one on [-pi, pi]")
    void fastMatchesExactOnPrincipalRange() {
        Mat phase = sweep(-Math.PI, Math.PI);
        Mat magnitude = ones();
        Mat fastRe = new Mat();
        Mat fastIm = new Mat();
        Mat exactRe = new Mat();
        Mat exactIm = new Mat();

        new FastPolarToRectangular().toRectangular(magnitude, phase, fastRe, fastIm);
        new ExactPolarToRectangular().toRectangular(magnitude, phase, exactRe, exactIm);

        float[] fr = SpectralMath.toArray(fastRe);
        float[] fi = SpectralMath.toArray(fastIm);
        float[] er = SpectralMath.toArray(exactRe);
        float[] ei = SpectralMath.toArray(exactIm);
        double worst = 0.0;
        for (int i = 0; i < SAMPLES; i++) {
            worst = Math.max(worst, Math.abs(fr[i] - er[i]));
            worst = Math.max(worst, Math.abs(fi[i] - ei[i]));
        }
        assertThat(worst).isLessThan(new FastPolarToRectangular().maxAbsoluteError());
    }

    @Test
    @DisplayName("Exact conversion matches Math.cos and Math.sin within its bound")
    void exactMatchesMath() {
        Mat phasePlane = sweep(-Math.PI, Math.PI);
        Mat re = new Mat();
        Mat im = new Mat();
        ExactPolarToRectangular exact = new ExactPolarToRectangular();

        exact.toRectangular(ones(), phasePlane, re, im);

        float[] phase = SpectralMath.toArray(phasePlane);
        float[] real = SpectralMath.toArray(re);
        float[] imaginary = SpectralMath.toArray(im);
        for (int i = 0; i < SAMPLES; i += 13) {
            assertThat((double) real[i]).isCloseTo(Math.cos(phase[i]), within(exact.maxAbsoluteError()));
            assertThat((double) imaginary[i]).isCloseTo(Math.sin(phase[i]), within(exact.maxAbsoluteError()));
        }
    }

    @Test
    @DisplayName("Fast conversion wraps angles outside [-pi, pi]")
    void fastWrapsLargeAngles() {
        Mat phasePlane = sweep(-4 * Math.PI, 4 * Math.PI);
        Mat re = new Mat();
        Mat im = new Mat();

        new FastPolarToRectangular().toRectangular(ones(), phasePlane, re, im);

        float[] phase = SpectralMath.toArray(phasePlane);
        float[] real = SpectralMath.toArray(re);
        float[] imaginary = SpectralMath.toArray(im);
        for (int i = 0; i < SAMPLES; i += 97) {
            assertThat((double) real[i]).isCloseTo(Math.cos(phase[i]), within(1e-4));
            assertThat((double) imaginary[i]).isCloseTo(Math.sin(phase[i]), within(1e-4));
        }
    }

    @Test
    @DisplayName("Polynomials match sine and cosine on the folded range")
    void polynomialsOnFoldedRange() {
        for (double x = -Math.PI / 2; x <= Math.PI / 2; x += 0.001) {
            assertThat(FastPolarToRectangular.sin(x)).isCloseTo(Math.sin(x), within(1e-5));
            assertThat(FastPolarToRectangular.cos(x)).isCloseTo(Math.cos(x), within(5e-5));
        }
    }

    @Test
    @DisplayName("Magnitude scales both components")
    void magnitudeScales() {
        Mat re = new Mat();
        Mat im = new Mat();

        new ExactPolarToRectangular().toRectangular(new Mat(1, 1, CvType.CV_32F, new Scalar(2.0)),
            new Mat(1, 1, CvType.CV_32F, new Scalar(Math.PI / 2)), re, im);

        assertThat(re.get(0, 0)[0]).isCloseTo(0.0, within(1e-5));
        assertThat(im.get(0, 0)[0]).isCloseTo(2.0, within(1e-5));
    }

    @Test
    @DisplayName("Inverse options pick fast trigonometry below HIGH quality")
    void defaultStrategyFollowsQuality() {
        assertThat(InverseOptions.builder().quality(ReconstructionQuality.LOW).build().getPolarToRectangular())
            .isInstanceOf(FastPolarToRectangular.class);
        assertThat(InverseOptions.builder().quality(ReconstructionQuality.MEDIUM).build().getPolarToRectangular())
            .isInstanceOf(FastPolarToRectangular.class);
        assertThat(InverseOptions.builder().quality(ReconstructionQuality.HIGH).build().getPolarToRectangular())
            .isInstanceOf(ExactPolarToRectangular.class);
        assertThat(InverseOptions.builder().quality(ReconstructionQuality.LOW)
            .polarToRectangular(new ExactPolarToRectangular()).build().getPolarToRectangular())
            .isInstanceOf(ExactPolarToRectangular.class);
    }
}
