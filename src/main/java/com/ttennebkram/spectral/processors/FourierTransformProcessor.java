package com.ttennebkram.spectral.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.spectral.fft.ForwardOptions;
import com.ttennebkram.spectral.fft.ForwardResult;
import com.ttennebkram.spectral.fft.ForwardSpectralTransform;
import com.ttennebkram.spectral.fft.PaddingStrategy;
import com.ttennebkram.spectral.metadata.MagnitudeOutputMode;
import com.ttennebkram.spectral.metadata.MetadataChannel;
import com.ttennebkram.spectral.metadata.ReconstructionMetadata;
import com.ttennebkram.spectral.metadata.ReconstructionMetadataCodec;
import com.ttennebkram.spectral.metadata.SpectralMetadataKeys;
import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Executor;

/**
 * Fourier Transform processor - splits an image into magnitude and phase spectra.
 * Output 1 is the magnitude, output 2 the phase, both CV_32FC4.
 * Reconstruction parameters are written to the metadata channel for the inverse node.
 */
@ProcessorInfo(
    nodeType = "FourierTransform",
    displayName = "Fourier Transform",
    category = "Frequency",
    description = "Fourier Transform\nCore.dft(src, dst) per channel\nOutputs magnitude and phase",
    outputCount = 2
)
public class FourierTransformProcessor extends SpectralProcessorBase implements MultiOutputProcessor {

    private static final Logger LOG = LoggerFactory.getLogger(FourierTransformProcessor.class);

    // Magnitude gamma used when the preview is enhanced
    static final double PREVIEW_GAMMA = 0.7;

    private static final String[] OUTPUT_LABELS = {"Magnitude", "Phase"};

    // Property keys
    static final String APPLY_LOG_TRANSFORM = "applyLogTransform";
    static final String CENTER_FFT = "centerFFT";
    static final String APPLY_WINDOW = "applyWindow";
    static final String ENHANCE_PHASE_CONTRAST = "enhancePhaseContrast";
    static final String TRANSFORM_ALPHA = "transformAlpha";
    static final String ENHANCE_PREVIEW = "enhancePreview";
    static final String MAGNITUDE_OUTPUT_MODE = "magnitudeOutputMode";
    static final String PADDING_STRATEGY = "paddingStrategy";
    static final String PHASE_CLIP_LIMIT = "phaseClipLimit";
    static final String PHASE_TILE_SIZE = "phaseTileSize";
    static final String STORE_METADATA = "storeMetadata";
    static final String NODE_INSTANCE_ID = "nodeInstanceId";

    private final ForwardSpectralTransform transform = new ForwardSpectralTransform();

    // Properties with defaults
    private boolean applyLogTransform = ForwardOptions.DEFAULT_APPLY_LOG_COMPRESSION;
    private boolean centerFFT = ForwardOptions.DEFAULT_CENTER_ZERO_FREQUENCY;
    private boolean applyWindow = ForwardOptions.DEFAULT_APPLY_WINDOW;
    private boolean enhancePhaseContrast = ForwardOptions.DEFAULT_ENHANCE_PHASE_CONTRAST;
    private boolean transformAlpha = ForwardOptions.DEFAULT_TRANSFORM_ALPHA_CHANNEL;
    private boolean enhancePreview = false;
    private MagnitudeOutputMode magnitudeOutputMode = ForwardOptions.DEFAULT_MAGNITUDE_OUTPUT_MODE;
    private PaddingStrategy paddingStrategy = ForwardOptions.DEFAULT_PADDING_STRATEGY;
    private double phaseClipLimit = ForwardOptions.DEFAULT_PHASE_CLIP_LIMIT;
    private int phaseTileSize = ForwardOptions.DEFAULT_PHASE_TILE_SIZE;
    private boolean storeMetadata = true;
    private String nodeInstanceId = UUID.randomUUID().toString();

    private Executor channelExecutor;

    @Override
    public int getOutputCount() {
        return OUTPUT_LABELS.length;
    }

    @Override
    public String[] getOutputLabels() {
        return OUTPUT_LABELS.clone();
    }

    /**
     * Run channels on the given executor; null runs them on the calling thread.
     */
    public void setChannelExecutor(Executor channelExecutor) {
        this.channelExecutor = channelExecutor;
    }

    public String getNodeInstanceId() {
        return nodeInstanceId;
    }

    ForwardOptions buildOptions() {
        return ForwardOptions.builder()
            .applyLogCompression(applyLogTransform)
            .centerZeroFrequency(centerFFT)
            .applyWindow(applyWindow)
            .enhancePhaseContrast(enhancePhaseContrast)
            .transformAlphaChannel(transformAlpha)
            .magnitudeOutputMode(magnitudeOutputMode)
            .magnitudeGamma(enhancePreview ? PREVIEW_GAMMA : 1.0)
            .paddingStrategy(paddingStrategy)
            .phaseClipLimit(phaseClipLimit)
            .phaseTileSize(phaseTileSize)
            .channelExecutor(channelExecutor)
            .build();
    }

    @Override
    public Mat[] processMultiOutput(Mat input, MetadataChannel metadata) {
        if (isInvalidInput(input)) {
            return new Mat[]{new Mat(), new Mat()};
        }

        Mat rgba = ImageFormats.toRgbaFloat(input);
        ForwardResult result;
        try {
            result = transform.transform(rgba, buildOptions());
        } finally {
            rgba.release();
        }

        if (metadata != null) {
            result.getMetadata().ifPresent(md -> injectMetadata(metadata, md));
        }
        return new Mat[]{result.getSpectra().getMagnitude(), result.getSpectra().getPhase()};
    }

    private void injectMetadata(MetadataChannel channel, ReconstructionMetadata metadata) {
        ReconstructionMetadataCodec.writeParameters(channel, metadata);
        if (storeMetadata) {
            ReconstructionMetadataCodec.writeReconstruction(channel, metadata);

            JsonObject info = new JsonObject();
            info.addProperty("nodeInstanceId", nodeInstanceId);
            info.addProperty("timestamp", Instant.now().toString());
            info.addProperty("version", metadata.getFormatVersion());
            channel.putIfAbsent(SpectralMetadataKeys.RECONSTRUCTION_INFO, info);
        } else {
            LOG.debug("Node {} not storing reconstruction data, inverse will estimate magnitudes", nodeInstanceId);
        }
        channel.appendHistory(getDisplayName());
    }

    @Override
    public void configure(Map<String, Object> props) {
        applyLogTransform = getBoolean(props, APPLY_LOG_TRANSFORM, ForwardOptions.DEFAULT_APPLY_LOG_COMPRESSION);
        centerFFT = getBoolean(props, CENTER_FFT, ForwardOptions.DEFAULT_CENTER_ZERO_FREQUENCY);
        applyWindow = getBoolean(props, APPLY_WINDOW, ForwardOptions.DEFAULT_APPLY_WINDOW);
        enhancePhaseContrast = getBoolean(props, ENHANCE_PHASE_CONTRAST, ForwardOptions.DEFAULT_ENHANCE_PHASE_CONTRAST);
        transformAlpha = getBoolean(props, TRANSFORM_ALPHA, ForwardOptions.DEFAULT_TRANSFORM_ALPHA_CHANNEL);
        enhancePreview = getBoolean(props, ENHANCE_PREVIEW, false);
        magnitudeOutputMode = parseOutputMode(getString(props, MAGNITUDE_OUTPUT_MODE, null));
        paddingStrategy = PaddingStrategy.fromName(getString(props, PADDING_STRATEGY, null),
            ForwardOptions.DEFAULT_PADDING_STRATEGY);
        phaseClipLimit = getDouble(props, PHASE_CLIP_LIMIT, ForwardOptions.DEFAULT_PHASE_CLIP_LIMIT);
        phaseTileSize = getInt(props, PHASE_TILE_SIZE, ForwardOptions.DEFAULT_PHASE_TILE_SIZE);
        storeMetadata = getBoolean(props, STORE_METADATA, true);
        nodeInstanceId = getString(props, NODE_INSTANCE_ID, nodeInstanceId);
    }

    @Override
    public Map<String, Object> currentProperties() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(APPLY_LOG_TRANSFORM, applyLogTransform);
        props.put(CENTER_FFT, centerFFT);
        props.put(APPLY_WINDOW, applyWindow);
        props.put(ENHANCE_PHASE_CONTRAST, enhancePhaseContrast);
        props.put(TRANSFORM_ALPHA, transformAlpha);
        props.put(ENHANCE_PREVIEW, enhancePreview);
        props.put(MAGNITUDE_OUTPUT_MODE, magnitudeOutputMode.name());
        props.put(PADDING_STRATEGY, paddingStrategy.name());
        props.put(PHASE_CLIP_LIMIT, phaseClipLimit);
        props.put(PHASE_TILE_SIZE, phaseTileSize);
        props.put(STORE_METADATA, storeMetadata);
        props.put(NODE_INSTANCE_ID, nodeInstanceId);
        return props;
    }

    private static MagnitudeOutputMode parseOutputMode(String name) {
        MagnitudeOutputMode mode = MagnitudeOutputMode.fromName(name);
        return mode != null ? mode : ForwardOptions.DEFAULT_MAGNITUDE_OUTPUT_MODE;
    }
}
