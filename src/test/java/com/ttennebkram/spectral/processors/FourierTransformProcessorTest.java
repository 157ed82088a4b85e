package com.ttennebkram.spectral.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.spectral.TestImages;
import com.ttennebkram.spectral.fft.ForwardOptions;
import com.ttennebkram.spectral.fft.PaddingStrategy;
import com.ttennebkram.spectral.metadata.MagnitudeOutputMode;
import com.ttennebkram.spectral.metadata.MetadataChannel;
import com.ttennebkram.spectral.metadata.ReconstructionMetadata;
import com.ttennebkram.spectral.metadata.ReconstructionMetadataCodec;
import com.ttennebkram.spectral.metadata.SpectralMetadataKeys;
import com.ttennebkram.spectral.util.OpenCvLoader;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("FourierTransformProcessor")
class FourierTransformProcessorTest {

    @BeforeAll
    static void loadOpenCv() {
        OpenCvLoader.ensureLoaded();
    }

    @Test
    @DisplayName("Annotation supplies node identity")
    void identity() {
        FourierTransformProcessor processor = new FourierTransformProcessor();

        assertThat(processor.getNodeType()).isEqualTo("FourierTransform");
        assertThat(processor.getDisplayName()).isEqualTo("Fourier Transform");
        assertThat(processor.getCategory()).isEqualTo("Frequency");
        assertThat(processor.getOutputCount()).isEqualTo(2);
        assertThat(processor.getOutputLabels()).containsExactly("Magnitude", "Phase");
    }

    @Test
    @DisplayName("Produces magnitude and phase and fills the metadata channel")
    void writesMetadata() {
        FourierTransformProcessor processor = new FourierTransformProcessor();
        MetadataChannel channel = new MetadataChannel();
        Mat input = new Mat(24, 30, CvType.CV_8UC3, new Scalar(40, 120, 200));

        Mat[] outputs = processor.processMultiOutput(input, channel);

        assertThat(outputs).hasSize(2);
        assertThat(outputs[0].type()).isEqualTo(CvType.CV_32FC4);
        assertThat(outputs[1].type()).isEqualTo(CvType.CV_32FC4);
        assertThat(outputs[0].rows()).isEqualTo(24);
        assertThat(outputs[0].cols()).isEqualTo(30);

        assertThat(channel.contains(SpectralMetadataKeys.FORWARD_PARAMETERS)).isTrue();
        assertThat(channel.contains(SpectralMetadataKeys.RECONSTRUCTION_PARAMETERS)).isTrue();
        JsonObject info = channel.getObject(SpectralMetadataKeys.RECONSTRUCTION_INFO).orElseThrow();
        assertThat(info.get("nodeInstanceId").getAsString()).isEqualTo(processor.getNodeInstanceId());
        assertThat(info.has("timestamp")).isTrue();
        assertThat(channel.history()).containsExactly("Fourier Transform");

        ReconstructionMetadata metadata = ReconstructionMetadataCodec.read(channel).orElseThrow();
        assertThat(metadata.getOriginalRows()).isEqualTo(24);
        assertThat(metadata.getOriginalCols()).isEqualTo(30);
        assertThat(metadata.hasMagnitudeMaxima()).isTrue();
    }

    @Test
    @DisplayName("With storage disabled only the flags are written")
    void storeMetadataDisabled() {
        FourierTransformProcessor processor = new FourierTransformProcessor();
        Map<String, Object> props = new HashMap<>();
        props.put("storeMetadata", false);
        processor.configure(props);
        MetadataChannel channel = new MetadataChannel();

        processor.processMultiOutput(TestImages.pattern(16, 16), channel);

        assertThat(channel.contains(SpectralMetadataKeys.FORWARD_PARAMETERS)).isTrue();
        assertThat(channel.contains(SpectralMetadataKeys.RECONSTRUCTION_PARAMETERS)).isFalse();
        assertThat(channel.contains(SpectralMetadataKeys.RECONSTRUCTION_INFO)).isFalse();
        assertThat(ReconstructionMetadataCodec.read(channel).orElseThrow().hasMagnitudeMaxima()).isFalse();
    }

    @Test
    @DisplayName("Missing input yields two empty outputs and no metadata")
    void emptyInput() {
        FourierTransformProcessor processor = new FourierTransformProcessor();
        MetadataChannel channel = new MetadataChannel();

        Mat[] outputs = processor.processMultiOutput(new Mat(), channel);
        Mat[] fromNull = processor.createMultiImageProcessor(channel).process(null);

        assertThat(outputs).hasSize(2);
        assertThat(outputs[0].empty()).isTrue();
        assertThat(outputs[1].empty()).isTrue();
        assertThat(fromNull[0].empty()).isTrue();
        assertThat(channel.asJson().size()).isZero();
    }

    @Test
    @DisplayName("Configured properties drive the forward options")
    void configureBuildsOptions() {
        FourierTransformProcessor processor = new FourierTransformProcessor();
        Map<String, Object> props = new HashMap<>();
        props.put("applyLogTransform", false);
        props.put("applyWindow", true);
        props.put("enhancePreview", true);
        props.put("magnitudeOutputMode", "raw");
        props.put("paddingStrategy", "POWER_OF_TWO_PREFERRED");
        props.put("phaseTileSize", 4);
        processor.configure(props);

        ForwardOptions options = processor.buildOptions();

        assertThat(options.isApplyLogCompression()).isFalse();
        assertThat(options.isApplyWindow()).isTrue();
        assertThat(options.getMagnitudeGamma()).isEqualTo(FourierTransformProcessor.PREVIEW_GAMMA);
        assertThat(options.getMagnitudeOutputMode()).isEqualTo(MagnitudeOutputMode.RAW);
        assertThat(options.getPaddingStrategy()).isEqualTo(PaddingStrategy.POWER_OF_TWO_PREFERRED);
        assertThat(options.getPhaseTileSize()).isEqualTo(4);
        assertThat(processor.currentProperties())
            .containsEntry("applyLogTransform", false)
            .containsEntry("magnitudeOutputMode", "RAW");
    }

    @Test
    @DisplayName("Current properties configure an equivalent processor")
    void currentPropertiesRestore() {
        FourierTransformProcessor original = new FourierTransformProcessor();
        Map<String, Object> props = new HashMap<>();
        props.put("centerFFT", false);
        props.put("transformAlpha", true);
        props.put("phaseClipLimit", 3.5);
        original.configure(props);

        FourierTransformProcessor restored = new FourierTransformProcessor();
        restored.configure(original.currentProperties());

        assertThat(restored.currentProperties()).isEqualTo(original.currentProperties());
        assertThat(restored.getNodeInstanceId()).isEqualTo(original.getNodeInstanceId());
    }

    @Test
    @DisplayName("Unknown enum names fall back to defaults")
    void unknownNamesFallBack() {
        FourierTransformProcessor processor = new FourierTransformProcessor();
        Map<String, Object> props = new HashMap<>();
        props.put("magnitudeOutputMode", "sideways");
        props.put("paddingStrategy", "lots");
        processor.configure(props);

        ForwardOptions options = processor.buildOptions();

        assertThat(options.getMagnitudeOutputMode()).isEqualTo(ForwardOptions.DEFAULT_MAGNITUDE_OUTPUT_MODE);
        assertThat(options.getPaddingStrategy()).isEqualTo(ForwardOptions.DEFAULT_PADDING_STRATEGY);
    }
}
