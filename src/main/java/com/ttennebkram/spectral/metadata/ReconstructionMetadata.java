package com.ttennebkram.spectral.metadata;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable record of exactly which lossy or configurable steps a forward
 * Fourier transform applied, and the values needed to undo them.
 *
 * Geometry and magnitude maxima are optional: a record decoded from a channel
 * that only carries the forward flags reports {@link #hasGeometry()} and
 * {@link #hasMagnitudeMaxima()} as false, and the inverse transform estimates
 * what is missing.
 */
public final class ReconstructionMetadata {

    /** Format version written by this implementation. */
    public static final String CURRENT_FORMAT_VERSION = "1.0";

    private final String formatVersion;

    private final int originalRows;
    private final int originalCols;
    private final int paddedRows;
    private final int paddedCols;

    private final boolean logTransformApplied;
    private final boolean centeringApplied;
    private final boolean windowApplied;
    private final boolean phaseContrastEnhanced;
    private final boolean alphaChannelTransformed;

    private final double preLogMagnitudeMax;
    private final double postLogMagnitudeMax;
    private final double[] channelPreLogMaxima;
    private final double[] channelPostLogMaxima;

    private final MagnitudeOutputMode magnitudeOutputMode;
    private final double magnitudeGamma;

    private ReconstructionMetadata(Builder builder) {
        this.formatVersion = builder.formatVersion;
        this.originalRows = builder.originalRows;
        this.originalCols = builder.originalCols;
        this.paddedRows = builder.paddedRows;
        this.paddedCols = builder.paddedCols;
        this.logTransformApplied = builder.logTransformApplied;
        this.centeringApplied = builder.centeringApplied;
        this.windowApplied = builder.windowApplied;
        this.phaseContrastEnhanced = builder.phaseContrastEnhanced;
        this.alphaChannelTransformed = builder.alphaChannelTransformed;
        this.preLogMagnitudeMax = builder.preLogMagnitudeMax;
        this.postLogMagnitudeMax = builder.postLogMagnitudeMax;
        this.channelPreLogMaxima = builder.channelPreLogMaxima.clone();
        this.channelPostLogMaxima = builder.channelPostLogMaxima.clone();
        this.magnitudeOutputMode = builder.magnitudeOutputMode;
        this.magnitudeGamma = builder.magnitudeGamma;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getFormatVersion() {
        return formatVersion;
    }

    public boolean isCurrentFormat() {
        return CURRENT_FORMAT_VERSION.equals(formatVersion);
    }

    public int getOriginalRows() {
        return originalRows;
    }

    public int getOriginalCols() {
        return originalCols;
    }

    public int getPaddedRows() {
        return paddedRows;
    }

    public int getPaddedCols() {
        return paddedCols;
    }

    /**
     * True when original and padded dimensions are all known and consistent.
     */
    public boolean hasGeometry() {
        return originalRows > 0 && originalCols > 0
            && paddedRows >= originalRows && paddedCols >= originalCols;
    }

    public boolean isLogTransformApplied() {
        return logTransformApplied;
    }

    public boolean isCenteringApplied() {
        return centeringApplied;
    }

    public boolean isWindowApplied() {
        return windowApplied;
    }

    public boolean isPhaseContrastEnhanced() {
        return phaseContrastEnhanced;
    }

    public boolean isAlphaChannelTransformed() {
        return alphaChannelTransformed;
    }

    /** Maximum magnitude of channel 0 before log compression, NaN when unknown. */
    public double getPreLogMagnitudeMax() {
        return preLogMagnitudeMax;
    }

    /** Maximum magnitude of channel 0 after log compression, NaN when unknown. */
    public double getPostLogMagnitudeMax() {
        return postLogMagnitudeMax;
    }

    public boolean hasMagnitudeMaxima() {
        return !Double.isNaN(preLogMagnitudeMax) && !Double.isNaN(postLogMagnitudeMax);
    }

    public double[] getChannelPreLogMaxima() {
        return channelPreLogMaxima.clone();
    }

    public double[] getChannelPostLogMaxima() {
        return channelPostLogMaxima.clone();
    }

    /**
     * Pre-log maximum for a channel. Prefers the per-channel value and falls
     * back to the channel 0 value; NaN when neither is known.
     */
    public double preLogMaximumFor(int channel) {
        if (channel >= 0 && channel < channelPreLogMaxima.length && !Double.isNaN(channelPreLogMaxima[channel])) {
            return channelPreLogMaxima[channel];
        }
        return preLogMagnitudeMax;
    }

    /**
     * Post-log maximum for a channel, with the same fallback as {@link #preLogMaximumFor(int)}.
     */
    public double postLogMaximumFor(int channel) {
        if (channel >= 0 && channel < channelPostLogMaxima.length && !Double.isNaN(channelPostLogMaxima[channel])) {
            return channelPostLogMaxima[channel];
        }
        return postLogMagnitudeMax;
    }

    public Optional<MagnitudeOutputMode> getMagnitudeOutputMode() {
        return Optional.ofNullable(magnitudeOutputMode);
    }

    public double getMagnitudeGamma() {
        return magnitudeGamma;
    }

    public Builder toBuilder() {
        return new Builder()
            .formatVersion(formatVersion)
            .originalSize(originalRows, originalCols)
            .paddedSize(paddedRows, paddedCols)
            .logTransformApplied(logTransformApplied)
            .centeringApplied(centeringApplied)
            .windowApplied(windowApplied)
            .phaseContrastEnhanced(phaseContrastEnhanced)
            .alphaChannelTransformed(alphaChannelTransformed)
            .magnitudeMaxima(preLogMagnitudeMax, postLogMagnitudeMax)
            .channelMaxima(channelPreLogMaxima, channelPostLogMaxima)
            .magnitudeOutputMode(magnitudeOutputMode)
            .magnitudeGamma(magnitudeGamma);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReconstructionMetadata)) return false;
        ReconstructionMetadata that = (ReconstructionMetadata) o;
        return originalRows == that.originalRows
            && originalCols == that.originalCols
            && paddedRows == that.paddedRows
            && paddedCols == that.paddedCols
            && logTransformApplied == that.logTransformApplied
            && centeringApplied == that.centeringApplied
            && windowApplied == that.windowApplied
            && phaseContrastEnhanced == that.phaseContrastEnhanced
            && alphaChannelTransformed == that.alphaChannelTransformed
            && Double.compare(preLogMagnitudeMax, that.preLogMagnitudeMax) == 0
            && Double.compare(postLogMagnitudeMax, that.postLogMagnitudeMax) == 0
            && Double.compare(magnitudeGamma, that.magnitudeGamma) == 0
            && Arrays.equals(channelPreLogMaxima, that.channelPreLogMaxima)
            && Arrays.equals(channelPostLogMaxima, that.channelPostLogMaxima)
            && magnitudeOutputMode == that.magnitudeOutputMode
            && Objects.equals(formatVersion, that.formatVersion);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(formatVersion, originalRows, originalCols, paddedRows, paddedCols,
            logTransformApplied, centeringApplied, windowApplied, phaseContrastEnhanced,
            alphaChannelTransformed, preLogMagnitudeMax, postLogMagnitudeMax,
            magnitudeOutputMode, magnitudeGamma);
        result = 31 * result + Arrays.hashCode(channelPreLogMaxima);
        result = 31 * result + Arrays.hashCode(channelPostLogMaxima);
        return result;
    }

    @Override
    public String toString() {
        return "ReconstructionMetadata{" +
            "version=" + formatVersion +
            ", original=" + originalRows + "x" + originalCols +
            ", padded=" + paddedRows + "x" + paddedCols +
            ", log=" + logTransformApplied +
            ", centered=" + centeringApplied +
            ", windowed=" + windowApplied +
            ", phaseEnhanced=" + phaseContrastEnhanced +
            ", alpha=" + alphaChannelTransformed +
            ", preLogMax=" + preLogMagnitudeMax +
            ", postLogMax=" + postLogMagnitudeMax +
            ", mode=" + magnitudeOutputMode +
            ", gamma=" + magnitudeGamma +
            '}';
    }

    /**
     * Builder for {@link ReconstructionMetadata}. Unset geometry stays unknown (0),
     * unset maxima stay NaN.
     */
    public static final class Builder {
        private String formatVersion = CURRENT_FORMAT_VERSION;
        private int originalRows;
        private int originalCols;
        private int paddedRows;
        private int paddedCols;
        private boolean logTransformApplied;
        private boolean centeringApplied;
        private boolean windowApplied;
        private boolean phaseContrastEnhanced;
        private boolean alphaChannelTransformed;
        private double preLogMagnitudeMax = Double.NaN;
        private double postLogMagnitudeMax = Double.NaN;
        private double[] channelPreLogMaxima = new double[0];
        private double[] channelPostLogMaxima = new double[0];
        private MagnitudeOutputMode magnitudeOutputMode;
        private double magnitudeGamma = 1.0;

        private Builder() {
        }

        public Builder formatVersion(String formatVersion) {
            this.formatVersion = formatVersion;
            return this;
        }

        public Builder originalSize(int rows, int cols) {
            this.originalRows = rows;
            this.originalCols = cols;
            return this;
        }

        public Builder paddedSize(int rows, int cols) {
            this.paddedRows = rows;
            this.paddedCols = cols;
            return this;
        }

        public Builder logTransformApplied(boolean applied) {
            this.logTransformApplied = applied;
            return this;
        }

        public Builder centeringApplied(boolean applied) {
            this.centeringApplied = applied;
            return this;
        }

        public Builder windowApplied(boolean applied) {
            this.windowApplied = applied;
            return this;
        }

        public Builder phaseContrastEnhanced(boolean enhanced) {
            this.phaseContrastEnhanced = enhanced;
            return this;
        }

        public Builder alphaChannelTransformed(boolean transformed) {
            this.alphaChannelTransformed = transformed;
            return this;
        }

        public Builder magnitudeMaxima(double preLogMax, double postLogMax) {
            this.preLogMagnitudeMax = preLogMax;
            this.postLogMagnitudeMax = postLogMax;
            return this;
        }

        public Builder channelMaxima(double[] preLogMaxima, double[] postLogMaxima) {
            this.channelPreLogMaxima = preLogMaxima != null ? preLogMaxima.clone() : new double[0];
            this.channelPostLogMaxima = postLogMaxima != null ? postLogMaxima.clone() : new double[0];
            return this;
        }

        public Builder magnitudeOutputMode(MagnitudeOutputMode mode) {
            this.magnitudeOutputMode = mode;
            return this;
        }

        public Builder magnitudeGamma(double gamma) {
            this.magnitudeGamma = gamma;
            return this;
        }

        public ReconstructionMetadata build() {
            return new ReconstructionMetadata(this);
        }
    }
}
