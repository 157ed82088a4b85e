package com.ttennebkram.spectral.fft;

import com.ttennebkram.spectral.TestImages;
import com.ttennebkram.spectral.metadata.MagnitudeOutputMode;
import com.ttennebkram.spectral.metadata.ReconstructionMetadata;
import com.ttennebkram.spectral.util.OpenCvLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("ForwardSpectralTransform")
class ForwardSpectralTransformTest {

    private static ForwardSpectralTransform forward;

    @BeforeAll
    static void setUp() {
        OpenCvLoader.ensureLoaded();
        forward = new ForwardSpectralTransform();
    }

    @Test
    @DisplayName("Without log compression magnitudes are non-negative and phases lie in [0,1]")
    void rawMagnitudesNonNegative() {
        Mat image = TestImages.pattern(40, 48);
        ForwardOptions options = ForwardOptions.builder()
            .applyLogCompression(false)
            .magnitudeOutputMode(MagnitudeOutputMode.RAW)
            .build();

        ForwardResult result = forward.transform(image, options);

        for (int c = 0; c < 4; c++) {
            assertThat(TestImages.channelMin(result.getSpectra().getMagnitude(), c)).isGreaterThanOrEqualTo(0.0);
            assertThat(TestImages.channelMin(result.getSpectra().getPhase(), c)).isGreaterThanOrEqualTo(0.0);
            assertThat(TestImages.channelMax(result.getSpectra().getPhase(), c)).isLessThanOrEqualTo(1.0);
        }
        // Raw, uncompressed: the largest bin is the DC term
        assertThat(TestImages.channelMax(result.getSpectra().getMagnitude(), 0)).isGreaterThan(1.0);
    }

    @Test
    @DisplayName("Phases stay in [0,1] with contrast enhancement and windowing")
    void phaseRangeWithEnhancement() {
        Mat image = TestImages.pattern(33, 27);
        ForwardOptions options = ForwardOptions.builder()
            .applyWindow(true)
            .enhancePhaseContrast(true)
            .build();

        ForwardResult result = forward.transform(image, options);

        for (int c = 0; c < 3; c++) {
            assertThat(TestImages.channelMin(result.getSpectra().getPhase(), c)).isGreaterThanOrEqualTo(0.0);
            assertThat(TestImages.channelMax(result.getSpectra().getPhase(), c)).isLessThanOrEqualTo(1.0);
        }
    }

    @Test
    @DisplayName("Normalized magnitudes peak at exactly 1, with or without gamma")
    void normalizedMagnitudePeaksAtOne() {
        Mat image = TestImages.pattern(32, 32);

        ForwardResult plain = forward.transform(image, ForwardOptions.defaults());
        ForwardResult gamma = forward.transform(image, ForwardOptions.builder().magnitudeGamma(0.7).build());

        for (int c = 0; c < 3; c++) {
            assertThat(TestImages.channelMax(plain.getSpectra().getMagnitude(), c)).isCloseTo(1.0, within(1e-6));
            assertThat(TestImages.channelMax(gamma.getSpectra().getMagnitude(), c)).isCloseTo(1.0, within(1e-6));
            assertThat(TestImages.channelMin(plain.getSpectra().getMagnitude(), c)).isGreaterThanOrEqualTo(0.0);
        }
        assertThat(gamma.getMetadata().get().getMagnitudeGamma()).isEqualTo(0.7);
    }

    @Test
    @DisplayName("Untransformed alpha passes through as constant 1.0 planes")
    void alphaPlanesAreOne() {
        Mat image = TestImages.pattern(16, 16);

        ForwardResult result = forward.transform(image, ForwardOptions.defaults());

        assertThat(TestImages.channelMin(result.getSpectra().getMagnitude(), 3)).isEqualTo(1.0);
        assertThat(TestImages.channelMax(result.getSpectra().getMagnitude(), 3)).isEqualTo(1.0);
        assertThat(TestImages.channelMin(result.getSpectra().getPhase(), 3)).isEqualTo(1.0);
        assertThat(TestImages.channelMax(result.getSpectra().getPhase(), 3)).isEqualTo(1.0);
        assertThat(result.getMetadata().get().isAlphaChannelTransformed()).isFalse();
    }

    @Test
    @DisplayName("Spectra are CV_32FC4 at the input size")
    void outputShape() {
        Mat image = TestImages.pattern(61, 50);

        ForwardResult result = forward.transform(image, ForwardOptions.defaults());

        assertThat(result.getSpectra().getMagnitude().type()).isEqualTo(CvType.CV_32FC4);
        assertThat(result.getSpectra().getPhase().type()).isEqualTo(CvType.CV_32FC4);
        assertThat(result.getSpectra().getMagnitude().rows()).isEqualTo(61);
        assertThat(result.getSpectra().getMagnitude().cols()).isEqualTo(50);
    }

    @Test
    @DisplayName("Metadata records geometry, flags and maxima")
    void metadataContents() {
        Mat image = TestImages.constant(61, 32, 0.5);
        ForwardOptions options = ForwardOptions.builder()
            .enhancePhaseContrast(false)
            .applyWindow(false)
            .paddingStrategy(PaddingStrategy.OPENCV_OPTIMAL)
            .build();

        ReconstructionMetadata md = forward.transform(image, options).getMetadata().orElseThrow();

        assertThat(md.getOriginalRows()).isEqualTo(61);
        assertThat(md.getOriginalCols()).isEqualTo(32);
        assertThat(md.getPaddedRows()).isEqualTo(64);
        assertThat(md.getPaddedCols()).isEqualTo(32);
        assertThat(md.hasGeometry()).isTrue();
        assertThat(md.isLogTransformApplied()).isTrue();
        assertThat(md.isCenteringApplied()).isTrue();
        assertThat(md.isWindowApplied()).isFalse();
        assertThat(md.isPhaseContrastEnhanced()).isFalse();
        assertThat(md.getMagnitudeOutputMode()).contains(MagnitudeOutputMode.NORMALIZED);
        assertThat(md.isCurrentFormat()).isTrue();

        // DC term of a constant image is the sum of its samples
        double dc = 0.5 * 61 * 32;
        assertThat(md.getPreLogMagnitudeMax()).isCloseTo(dc, within(dc * 1e-5));
        assertThat(md.getPostLogMagnitudeMax()).isCloseTo(Math.log1p(dc), within(1e-4));
        assertThat(md.getChannelPreLogMaxima()).hasSize(3);
        assertThat(md.getChannelPostLogMaxima()).hasSize(3);
    }

    @Test
    @DisplayName("Default settings leave awkward sizes unpadded")
    void defaultsDoNotPad() {
        ReconstructionMetadata md = forward.transform(TestImages.constant(61, 50, 0.5), ForwardOptions.defaults())
            .getMetadata().orElseThrow();

        assertThat(md.getPaddedRows()).isEqualTo(61);
        assertThat(md.getPaddedCols()).isEqualTo(50);
    }

    @Test
    @DisplayName("Per-channel maxima follow each channel's own level")
    void perChannelMaxima() {
        Mat image = new Mat(16, 16, CvType.CV_32FC4, new Scalar(0.2, 0.5, 0.8, 1.0));

        ReconstructionMetadata md = forward.transform(image, ForwardOptions.defaults()).getMetadata().orElseThrow();

        assertThat(md.getChannelPreLogMaxima()[0]).isCloseTo(0.2 * 256, within(1e-2));
        assertThat(md.getChannelPreLogMaxima()[1]).isCloseTo(0.5 * 256, within(1e-2));
        assertThat(md.getChannelPreLogMaxima()[2]).isCloseTo(0.8 * 256, within(1e-2));
        assertThat(md.getPreLogMagnitudeMax()).isEqualTo(md.getChannelPreLogMaxima()[0]);
    }

    @Test
    @DisplayName("Without log compression the post-log maximum equals the pre-log one")
    void postLogEqualsPreLogWithoutLog() {
        Mat image = TestImages.pattern(20, 20);

        ReconstructionMetadata md = forward.transform(image,
            ForwardOptions.builder().applyLogCompression(false).build()).getMetadata().orElseThrow();

        assertThat(md.getPostLogMagnitudeMax()).isEqualTo(md.getPreLogMagnitudeMax());
    }

    @Test
    @DisplayName("Transformed alpha gets its own maxima")
    void transformedAlpha() {
        Mat image = TestImages.pattern(16, 16);

        ForwardResult result = forward.transform(image, ForwardOptions.builder().transformAlphaChannel(true).build());

        ReconstructionMetadata md = result.getMetadata().orElseThrow();
        assertThat(md.isAlphaChannelTransformed()).isTrue();
        assertThat(md.getChannelPreLogMaxima()).hasSize(4);
        assertThat(TestImages.channelMin(result.getSpectra().getMagnitude(), 3)).isLessThan(1.0);
    }

    @Test
    @DisplayName("Window flag is not recorded for images too thin to window")
    void windowSkippedForThinImage() {
        Mat image = TestImages.constant(1, 8, 0.5);

        ReconstructionMetadata md = forward.transform(image, ForwardOptions.builder().applyWindow(true).build())
            .getMetadata().orElseThrow();

        assertThat(md.isWindowApplied()).isFalse();
    }

    @Test
    @DisplayName("Rejects images that are not 4-channel")
    void rejectsWrongChannelCount() {
        Mat image = new Mat(8, 8, CvType.CV_32FC3, new Scalar(0.5, 0.5, 0.5));

        assertThatThrownBy(() -> forward.transform(image, ForwardOptions.defaults()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("3 channels");
    }

    @Test
    @DisplayName("Null or empty input yields an empty result without metadata")
    void emptyInput() {
        ForwardResult fromNull = forward.transform(null, ForwardOptions.defaults());
        ForwardResult fromEmpty = forward.transform(new Mat(), ForwardOptions.defaults());

        assertThat(fromNull.isEmpty()).isTrue();
        assertThat(fromNull.getMetadata()).isEmpty();
        assertThat(fromEmpty.isEmpty()).isTrue();
        assertThat(fromEmpty.getMetadata()).isEmpty();
    }

    @Test
    @DisplayName("Options reject invalid values")
    void optionValidation() {
        assertThatThrownBy(() -> ForwardOptions.builder().magnitudeGamma(0.0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ForwardOptions.builder().magnitudeGamma(Double.NaN))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ForwardOptions.builder().phaseTileSize(0))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ForwardOptions.builder().phaseClipLimit(-1))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
