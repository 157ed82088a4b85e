package com.ttennebkram.spectral.fft;

import com.ttennebkram.spectral.metadata.MagnitudeOutputMode;

import java.util.Objects;
import java.util.concurrent.Executor;

/**
 * Settings for {@link ForwardSpectralTransform}. Immutable; use {@link #builder()}.
 */
public final class ForwardOptions {

    public static final boolean DEFAULT_APPLY_LOG_COMPRESSION = true;
    public static final boolean DEFAULT_CENTER_ZERO_FREQUENCY = true;
    public static final boolean DEFAULT_APPLY_WINDOW = false;
    public static final boolean DEFAULT_ENHANCE_PHASE_CONTRAST = true;
    public static final boolean DEFAULT_TRANSFORM_ALPHA_CHANNEL = false;
    public static final MagnitudeOutputMode DEFAULT_MAGNITUDE_OUTPUT_MODE = MagnitudeOutputMode.NORMALIZED;
    public static final double DEFAULT_MAGNITUDE_GAMMA = 1.0;
    // Spectra are cropped to the image size, so only unpadded spectra invert exactly
    public static final PaddingStrategy DEFAULT_PADDING_STRATEGY = PaddingStrategy.NONE;

    // CLAHE settings for phase contrast enhancement
    public static final double DEFAULT_PHASE_CLIP_LIMIT = 2.0;
    public static final int DEFAULT_PHASE_TILE_SIZE = 8;

    private static final ForwardOptions DEFAULTS = builder().build();

    private final boolean applyLogCompression;
    private final boolean centerZeroFrequency;
    private final boolean applyWindow;
    private final boolean enhancePhaseContrast;
    private final boolean transformAlphaChannel;
    private final MagnitudeOutputMode magnitudeOutputMode;
    private final double magnitudeGamma;
    private final PaddingStrategy paddingStrategy;
    private final double phaseClipLimit;
    private final int phaseTileSize;
    private final Executor channelExecutor;

    private ForwardOptions(Builder builder) {
        this.applyLogCompression = builder.applyLogCompression;
        this.centerZeroFrequency = builder.centerZeroFrequency;
        this.applyWindow = builder.applyWindow;
        this.enhancePhaseContrast = builder.enhancePhaseContrast;
        this.transformAlphaChannel = builder.transformAlphaChannel;
        this.magnitudeOutputMode = builder.magnitudeOutputMode;
        this.magnitudeGamma = builder.magnitudeGamma;
        this.paddingStrategy = builder.paddingStrategy;
        this.phaseClipLimit = builder.phaseClipLimit;
        this.phaseTileSize = builder.phaseTileSize;
        this.channelExecutor = builder.channelExecutor;
    }

    public static ForwardOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isApplyLogCompression() {
        return applyLogCompression;
    }

    public boolean isCenterZeroFrequency() {
        return centerZeroFrequency;
    }

    public boolean isApplyWindow() {
        return applyWindow;
    }

    public boolean isEnhancePhaseContrast() {
        return enhancePhaseContrast;
    }

    public boolean isTransformAlphaChannel() {
        return transformAlphaChannel;
    }

    public MagnitudeOutputMode getMagnitudeOutputMode() {
        return magnitudeOutputMode;
    }

    /** Gamma applied to the magnitude before normalization; 1.0 leaves it unchanged. */
    public double getMagnitudeGamma() {
        return magnitudeGamma;
    }

    public PaddingStrategy getPaddingStrategy() {
        return paddingStrategy;
    }

    public double getPhaseClipLimit() {
        return phaseClipLimit;
    }

    public int getPhaseTileSize() {
        return phaseTileSize;
    }

    /** Executor for per-channel work, or null to run on the calling thread. */
    public Executor getChannelExecutor() {
        return channelExecutor;
    }

    public static final class Builder {
        private boolean applyLogCompression = DEFAULT_APPLY_LOG_COMPRESSION;
        private boolean centerZeroFrequency = DEFAULT_CENTER_ZERO_FREQUENCY;
        private boolean applyWindow = DEFAULT_APPLY_WINDOW;
        private boolean enhancePhaseContrast = DEFAULT_ENHANCE_PHASE_CONTRAST;
        private boolean transformAlphaChannel = DEFAULT_TRANSFORM_ALPHA_CHANNEL;
        private MagnitudeOutputMode magnitudeOutputMode = DEFAULT_MAGNITUDE_OUTPUT_MODE;
        private double magnitudeGamma = DEFAULT_MAGNITUDE_GAMMA;
        private PaddingStrategy paddingStrategy = DEFAULT_PADDING_STRATEGY;
        private double phaseClipLimit = DEFAULT_PHASE_CLIP_LIMIT;
        private int phaseTileSize = DEFAULT_PHASE_TILE_SIZE;
        private Executor channelExecutor;

        private Builder() {
        }

        public Builder applyLogCompression(boolean value) {
            this.applyLogCompression = value;
            return this;
        }

        public Builder centerZeroFrequency(boolean value) {
            this.centerZeroFrequency = value;
            return this;
        }

        public Builder applyWindow(boolean value) {
            this.applyWindow = value;
            return this;
        }

        public Builder enhancePhaseContrast(boolean value) {
            this.enhancePhaseContrast = value;
            return this;
        }

        public Builder transformAlphaChannel(boolean value) {
            this.transformAlphaChannel = value;
            return this;
        }

        public Builder magnitudeOutputMode(MagnitudeOutputMode value) {
            this.magnitudeOutputMode = Objects.requireNonNull(value, "magnitudeOutputMode");
            return this;
        }

        public Builder magnitudeGamma(double value) {
            if (!(value > 0) || Double.isInfinite(value)) {
                throw new IllegalArgumentException("Magnitude gamma must be a positive finite number: " + value);
            }
            this.magnitudeGamma = value;
            return this;
        }

        public Builder paddingStrategy(PaddingStrategy value) {
            this.paddingStrategy = Objects.requireNonNull(value, "paddingStrategy");
            return this;
        }

        public Builder phaseClipLimit(double value) {
            if (!(value > 0)) {
                throw new IllegalArgumentException("Phase clip limit must be positive: " + value);
            }
            this.phaseClipLimit = value;
            return this;
        }

        public Builder phaseTileSize(int value) {
            if (value < 1) {
                throw new IllegalArgumentException("Phase tile size must be at least 1: " + value);
            }
            this.phaseTileSize = value;
            return this;
        }

        public Builder channelExecutor(Executor value) {
            this.channelExecutor = value;
            return this;
        }

        public ForwardOptions build() {
            return new ForwardOptions(this);
        }
    }
}
