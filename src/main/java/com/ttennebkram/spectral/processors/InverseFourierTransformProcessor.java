package com.ttennebkram.spectral.processors;

import com.google.gson.JsonObject;
import com.ttennebkram.spectral.fft.ExactPolarToRectangular;
import com.ttennebkram.spectral.fft.FastPolarToRectangular;
import com.ttennebkram.spectral.fft.InverseOptions;
import com.ttennebkram.spectral.fft.InverseSpectralTransform;
import com.ttennebkram.spectral.fft.PolarToRectangular;
import com.ttennebkram.spectral.fft.ReconstructionQuality;
import com.ttennebkram.spectral.metadata.MetadataChannel;
import com.ttennebkram.spectral.metadata.ReconstructionMetadata;
import com.ttennebkram.spectral.metadata.ReconstructionMetadataCodec;
import com.ttennebkram.spectral.metadata.SpectralMetadataKeys;
import com.ttennebkram.spectral.processing.DualImageProcessor;
import org.opencv.core.Mat;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Executor;

/**
 * Inverse Fourier Transform processor - rebuilds an image from magnitude (input 1)
 * and phase (input 2). Reads reconstruction parameters from the metadata channel
 * when auto-detect is on and falls back to the assumed settings otherwise.
 */
@ProcessorInfo(
    nodeType = "InverseFourierTransform",
    displayName = "Inverse Fourier Transform",
    category = "Frequency",
    description = "Inverse Fourier Transform\nCore.idft(src, dst, DFT_SCALE) per channel\nInputs: magnitude, phase",
    dualInput = true
)
public class InverseFourierTransformProcessor extends SpectralProcessorBase {

    /** Polar-to-rectangular choice: follow the quality level, or force one. */
    public enum TrigMode {
        AUTO,
        EXACT,
        FAST
    }

    // Property keys
    static final String AUTO_DETECT_PARAMETERS = "autoDetectParameters";
    static final String ASSUME_LOG_TRANSFORM = "assumeLogTransform";
    static final String ASSUME_CENTERED = "assumeCentered";
    static final String ASSUME_WINDOWED = "assumeWindowed";
    static final String ASSUME_PHASE_ENHANCED = "assumePhaseEnhanced";
    static final String ASSUME_ALPHA_TRANSFORMED = "assumeAlphaTransformed";
    static final String MAGNITUDE_SCALE = "magnitudeScale";
    static final String QUALITY = "quality";
    static final String TRIG_MODE = "trigMode";
    static final String BRIGHTNESS_BOOST = "brightnessBoost";

    private final InverseSpectralTransform transform = new InverseSpectralTransform();

    // Properties with defaults
    private boolean autoDetectParameters = InverseOptions.DEFAULT_AUTO_DETECT;
    private boolean assumeLogTransform = InverseOptions.DEFAULT_ASSUMED_LOG_TRANSFORM;
    private boolean assumeCentered = InverseOptions.DEFAULT_ASSUMED_CENTERED;
    private boolean assumeWindowed = InverseOptions.DEFAULT_ASSUMED_WINDOWED;
    private boolean assumePhaseEnhanced = InverseOptions.DEFAULT_ASSUMED_PHASE_ENHANCED;
    private boolean assumeAlphaTransformed = InverseOptions.DEFAULT_ASSUMED_ALPHA_TRANSFORMED;
    private double magnitudeScale = InverseOptions.DEFAULT_MAGNITUDE_SCALE;
    private ReconstructionQuality quality = InverseOptions.DEFAULT_QUALITY;
    private TrigMode trigMode = TrigMode.AUTO;
    private boolean brightnessBoost = InverseOptions.DEFAULT_BRIGHTNESS_BOOST;

    private Executor channelExecutor;

    /**
     * Run channels on the given executor; null runs them on the calling thread.
     */
    public void setChannelExecutor(Executor channelExecutor) {
        this.channelExecutor = channelExecutor;
    }

    InverseOptions buildOptions() {
        return InverseOptions.builder()
            .autoDetect(autoDetectParameters)
            .assumedLogTransform(assumeLogTransform)
            .assumedCentered(assumeCentered)
            .assumedWindowed(assumeWindowed)
            .assumedPhaseEnhanced(assumePhaseEnhanced)
            .assumedAlphaTransformed(assumeAlphaTransformed)
            .magnitudeScale(magnitudeScale)
            .quality(quality)
            .polarToRectangular(polarToRectangular(trigMode))
            .brightnessBoost(brightnessBoost)
            .channelExecutor(channelExecutor)
            .build();
    }

    private static PolarToRectangular polarToRectangular(TrigMode mode) {
        switch (mode) {
            case EXACT:
                return new ExactPolarToRectangular();
            case FAST:
                return new FastPolarToRectangular();
            case AUTO:
            default:
                return null;
        }
    }

    /**
     * Reconstruct an image from its spectra.
     *
     * @param magnitude Magnitude spectrum (may be null if not yet received)
     * @param phase Phase spectrum (may be null if not yet received)
     * @param metadata The side channel flowing with the spectra, may be null
     * @return CV_32FC4 image, empty if either input is missing
     */
    public Mat processDual(Mat magnitude, Mat phase, MetadataChannel metadata) {
        if (isInvalidInput(magnitude) || isInvalidInput(phase)) {
            return new Mat();
        }

        InverseOptions options = buildOptions();
        Optional<ReconstructionMetadata> reconstruction = options.isAutoDetect()
            ? ReconstructionMetadataCodec.read(metadata)
            : Optional.empty();

        Mat magnitudeRgba = ImageFormats.toRgbaFloat(magnitude);
        Mat phaseRgba = null;
        Mat output;
        try {
            phaseRgba = ImageFormats.toRgbaFloat(phase);
            output = transform.transform(magnitudeRgba, phaseRgba, reconstruction, options);
        } finally {
            magnitudeRgba.release();
            if (phaseRgba != null) phaseRgba.release();
        }

        if (metadata != null) {
            metadata.putIfAbsent(SpectralMetadataKeys.INVERSE_PARAMETERS, settingsUsed(reconstruction.isPresent()));
            metadata.appendHistory(getDisplayName());
        }
        return output;
    }

    /**
     * Create a DualImageProcessor lambda bound to a metadata channel.
     */
    public DualImageProcessor createDualImageProcessor(MetadataChannel metadata) {
        return (magnitude, phase) -> processDual(magnitude, phase, metadata);
    }

    @Override
    public void configure(Map<String, Object> props) {
        autoDetectParameters = getBoolean(props, AUTO_DETECT_PARAMETERS, InverseOptions.DEFAULT_AUTO_DETECT);
        assumeLogTransform = getBoolean(props, ASSUME_LOG_TRANSFORM, InverseOptions.DEFAULT_ASSUMED_LOG_TRANSFORM);
        assumeCentered = getBoolean(props, ASSUME_CENTERED, InverseOptions.DEFAULT_ASSUMED_CENTERED);
        assumeWindowed = getBoolean(props, ASSUME_WINDOWED, InverseOptions.DEFAULT_ASSUMED_WINDOWED);
        assumePhaseEnhanced = getBoolean(props, ASSUME_PHASE_ENHANCED, InverseOptions.DEFAULT_ASSUMED_PHASE_ENHANCED);
        assumeAlphaTransformed = getBoolean(props, ASSUME_ALPHA_TRANSFORMED, InverseOptions.DEFAULT_ASSUMED_ALPHA_TRANSFORMED);
        magnitudeScale = getDouble(props, MAGNITUDE_SCALE, InverseOptions.DEFAULT_MAGNITUDE_SCALE);
        quality = ReconstructionQuality.fromName(getString(props, QUALITY, null), InverseOptions.DEFAULT_QUALITY);
        trigMode = parseTrigMode(getString(props, TRIG_MODE, null));
        brightnessBoost = getBoolean(props, BRIGHTNESS_BOOST, InverseOptions.DEFAULT_BRIGHTNESS_BOOST);
    }

    @Override
    public Map<String, Object> currentProperties() {
        Map<String, Object> props = new LinkedHashMap<>();
        props.put(AUTO_DETECT_PARAMETERS, autoDetectParameters);
        props.put(ASSUME_LOG_TRANSFORM, assumeLogTransform);
        props.put(ASSUME_CENTERED, assumeCentered);
        props.put(ASSUME_WINDOWED, assumeWindowed);
        props.put(ASSUME_PHASE_ENHANCED, assumePhaseEnhanced);
        props.put(ASSUME_ALPHA_TRANSFORMED, assumeAlphaTransformed);
        props.put(MAGNITUDE_SCALE, magnitudeScale);
        props.put(QUALITY, quality.name());
        props.put(TRIG_MODE, trigMode.name());
        props.put(BRIGHTNESS_BOOST, brightnessBoost);
        return props;
    }

    /**
     * The settings this node ran with, recorded for downstream nodes.
     */
    private JsonObject settingsUsed(boolean metadataUsed) {
        JsonObject json = new JsonObject();
        json.addProperty(AUTO_DETECT_PARAMETERS, autoDetectParameters);
        json.addProperty(ASSUME_LOG_TRANSFORM, assumeLogTransform);
        json.addProperty(ASSUME_CENTERED, assumeCentered);
        json.addProperty(ASSUME_WINDOWED, assumeWindowed);
        json.addProperty(ASSUME_PHASE_ENHANCED, assumePhaseEnhanced);
        json.addProperty(ASSUME_ALPHA_TRANSFORMED, assumeAlphaTransformed);
        json.addProperty(MAGNITUDE_SCALE, magnitudeScale);
        json.addProperty(QUALITY, quality.name());
        json.addProperty(TRIG_MODE, trigMode.name());
        json.addProperty(BRIGHTNESS_BOOST, brightnessBoost);
        json.addProperty("metadataUsed", metadataUsed);
        return json;
    }

    private static TrigMode parseTrigMode(String name) {
        if (name != null) {
            for (TrigMode mode : TrigMode.values()) {
                if (mode.name().equalsIgnoreCase(name)) {
                    return mode;
                }
            }
        }
        return TrigMode.AUTO;
    }
}
