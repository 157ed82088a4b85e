package com.ttennebkram.spectral.fft;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Settings for {@link InverseSpectralTransform}. The {@code assumed*} flags
 * describe what the forward transform is believed to have done; with
 * {@code autoDetect} they are replaced by metadata whenever it is available.
 */
public final class InverseOptions {

    public static final boolean DEFAULT_ASSUMED_LOG_TRANSFORM = true;
    public static final boolean DEFAULT_ASSUMED_CENTERED = true;
    public static final boolean DEFAULT_ASSUMED_WINDOWED = false;
    public static final boolean DEFAULT_ASSUMED_PHASE_ENHANCED = true;
    public static final boolean DEFAULT_ASSUMED_ALPHA_TRANSFORMED = false;
    public static final boolean DEFAULT_AUTO_DETECT = true;
    public static final double DEFAULT_MAGNITUDE_SCALE = 1.0;
    public static final ReconstructionQuality DEFAULT_QUALITY = ReconstructionQuality.HIGH;
    public static final boolean DEFAULT_BRIGHTNESS_BOOST = true;

    private static final InverseOptions DEFAULTS = builder().build();

    private final boolean assumedLogTransform;
    private final boolean assumedCentered;
    private final boolean assumedWindowed;
    private final boolean assumedPhaseEnhanced;
    private final boolean assumedAlphaTransformed;
    private final boolean autoDetect;
    private final double magnitudeScale;
    private final ReconstructionQuality quality;
    private final PolarToRectangular polarToRectangular;
    private final boolean brightnessBoost;
    private final Executor channelExecutor;

    private InverseOptions(Builder builder) {
        this.assumedLogTransform = builder.assumedLogTransform;
        this.assumedCentered = builder.assumedCentered;
        this.assumedWindowed = builder.assumedWindowed;
        this.assumedPhaseEnhanced = builder.assumedPhaseEnhanced;
        this.assumedAlphaTransformed = builder.assumedAlphaTransformed;
        this.autoDetect = builder.autoDetect;
        this.magnitudeScale = builder.magnitudeScale;
        this.quality = builder.quality;
        this.polarToRectangular = builder.polarToRectangular;
        this.brightnessBoost = builder.brightnessBoost;
        this.channelExecutor = builder.channelExecutor;
    }

    public static InverseOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isAssumedLogTransform() {
        return assumedLogTransform;
    }

    public boolean isAssumedCentered() {
        return assumedCentered;
    }

    public boolean isAssumedWindowed() {
        return assumedWindowed;
    }

    public boolean isAssumedPhaseEnhanced() {
        return assumedPhaseEnhanced;
    }

    public boolean isAssumedAlphaTransformed() {
        return assumedAlphaTransformed;
    }

    public boolean isAutoDetect() {
        return autoDetect;
    }

    public double getMagnitudeScale() {
        return magnitudeScale;
    }

    public ReconstructionQuality getQuality() {
        return quality;
    }

    /**
     * The explicitly configured strategy, or the quality default:
     * fast polynomials below HIGH, exact trigonometry otherwise.
     */
    public PolarToRectangular getPolarToRectangular() {
        if (polarToRectangular != null) {
            return polarToRectangular;
        }
        return quality.isAtLeast(ReconstructionQuality.HIGH)
            ? new ExactPolarToRectangular()
            : new FastPolarToRectangular();
    }

    /** Whether dark heuristic reconstructions may be brightened. */
    public boolean isBrightnessBoost() {
        return brightnessBoost;
    }

    public Executor getChannelExecutor() {
        return channelExecutor;
    }

    public static final class Builder {
        private boolean assumedLogTransform = DEFAULT_ASSUMED_LOG_TRANSFORM;
        private boolean assumedCentered = DEFAULT_ASSUMED_CENTERED;
        private boolean assumedWindowed = DEFAULT_ASSUMED_WINDOWED;
        private boolean assumedPhaseEnhanced = DEFAULT_ASSUMED_PHASE_ENHANCED;
        private boolean assumedAlphaTransformed = DEFAULT_ASSUMED_ALPHA_TRANSFORMED;
        private boolean autoDetect = DEFAULT_AUTO_DETECT;
        private double magnitudeScale = DEFAULT_MAGNITUDE_SCALE;
        private ReconstructionQuality quality = DEFAULT_QUALITY;
        private PolarToRectangular polarToRectangular;
        private boolean brightnessBoost = DEFAULT_BRIGHTNESS_BOOST;
        private Executor channelExecutor;

        private Builder() {
        }

        public Builder assumedLogTransform(boolean value) {
            this.assumedLogTransform = value;
            return this;
        }

        public Builder assumedCentered(boolean value) {
            this.assumedCentered = value;
            return this;
        }

        public Builder assumedWindowed(boolean value) {
            this.assumedWindowed = value;
            return this;
        }

        public Builder assumedPhaseEnhanced(boolean value) {
            this.assumedPhaseEnhanced = value;
            return this;
        }

        public Builder assumedAlphaTransformed(boolean value) {
            this.assumedAlphaTransformed = value;
            return this;
        }

        public Builder autoDetect(boolean value) {
            this.autoDetect = value;
            return this;
        }

        public Builder magnitudeScale(double value) {
            if (!(value >= 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Magnitude scale must be a non-negative finite number: " + value);
            }
            this.magnitudeScale = value;
            return this;
        }

        public Builder quality(ReconstructionQuality value) {
            this.quality = Objects.requireNonNull(value, "quality");
            return this;
        }

        public Builder polarToRectangular(PolarToRectangular value) {
            this.polarToRectangular = value;
            return this;
        }

        public Builder brightnessBoost(boolean value) {
            this.brightnessBoost = value;
            return this;
        }

        public Builder channelExecutor(Executor value) {
            this.channelExecutor = value;
            return this;
        }

        public InverseOptions build() {
            return new InverseOptions(this);
        }
    }
}
