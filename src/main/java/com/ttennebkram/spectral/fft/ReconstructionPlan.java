package com.ttennebkram.spectral.fft;

import com.ttennebkram.spectral.metadata.MagnitudeOutputMode;
import com.ttennebkram.spectral.metadata.ReconstructionMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Settings for one inverse call, resolved once from the options and whatever
 * metadata is available. Metadata wins over the assumed flags when auto-detect
 * is on; values the metadata does not carry come from heuristics.
 */
final class ReconstructionPlan {

    private static final Logger LOG = LoggerFactory.getLogger(ReconstructionPlan.class);

    // DC term of a mid-gray image is 0.5 * rows * cols
    private static final double HEURISTIC_MEAN_LEVEL = 0.5;

    private final boolean logApplied;
    private final boolean centered;
    private final boolean windowed;
    private final boolean phaseEnhanced;
    private final boolean alphaTransformed;
    private final int originalRows;
    private final int originalCols;
    private final int paddedRows;
    private final int paddedCols;
    private final ReconstructionMetadata metadata;
    private final boolean metadataMaxima;

    private ReconstructionPlan(boolean logApplied, boolean centered, boolean windowed, boolean phaseEnhanced,
                               boolean alphaTransformed, int originalRows, int originalCols,
                               int paddedRows, int paddedCols, ReconstructionMetadata metadata) {
        this.logApplied = logApplied;
        this.centered = centered;
        this.windowed = windowed;
        this.phaseEnhanced = phaseEnhanced;
        this.alphaTransformed = alphaTransformed;
        this.originalRows = originalRows;
        this.originalCols = originalCols;
        this.paddedRows = paddedRows;
        this.paddedCols = paddedCols;
        this.metadata = metadata;
        this.metadataMaxima = metadata != null && metadata.hasMagnitudeMaxima();
    }

    /**
     * @param rows rows of the spectra being inverted
     * @param cols columns of the spectra being inverted
     */
    static ReconstructionPlan resolve(Optional<ReconstructionMetadata> metadata, InverseOptions options,
                                      int rows, int cols) {
        if (!options.isAutoDetect() || !metadata.isPresent()) {
            if (options.isAutoDetect()) {
                LOG.debug("No reconstruction metadata, using assumed settings and heuristics");
            }
            return new ReconstructionPlan(options.isAssumedLogTransform(), options.isAssumedCentered(),
                options.isAssumedWindowed(), options.isAssumedPhaseEnhanced(), options.isAssumedAlphaTransformed(),
                rows, cols, rows, cols, null);
        }

        ReconstructionMetadata md = metadata.get();
        int paddedRows = rows;
        int paddedCols = cols;
        if (md.hasGeometry()) {
            if (md.getOriginalRows() == rows && md.getOriginalCols() == cols) {
                paddedRows = md.getPaddedRows();
                paddedCols = md.getPaddedCols();
            } else {
                LOG.warn("Reconstruction metadata describes a {}x{} image but the spectra are {}x{}; ignoring stored geometry",
                    md.getOriginalRows(), md.getOriginalCols(), rows, cols);
            }
        }
        if (!md.hasMagnitudeMaxima()) {
            LOG.debug("Reconstruction metadata carries no magnitude maxima, estimating the magnitude ceiling");
        }

        return new ReconstructionPlan(md.isLogTransformApplied(), md.isCenteringApplied(), md.isWindowApplied(),
            md.isPhaseContrastEnhanced(), md.isAlphaChannelTransformed(),
            rows, cols, paddedRows, paddedCols, md);
    }

    boolean isLogApplied() {
        return logApplied;
    }

    boolean isCentered() {
        return centered;
    }

    boolean isWindowed() {
        return windowed;
    }

    boolean isPhaseEnhanced() {
        return phaseEnhanced;
    }

    boolean isAlphaTransformed() {
        return alphaTransformed;
    }

    int getOriginalRows() {
        return originalRows;
    }

    int getOriginalCols() {
        return originalCols;
    }

    int getPaddedRows() {
        return paddedRows;
    }

    int getPaddedCols() {
        return paddedCols;
    }

    /**
     * True when magnitudes are de-normalized with estimated rather than recorded maxima.
     */
    boolean isHeuristic() {
        return !metadataMaxima;
    }

    /**
     * Whether a channel's stored magnitude is display-normalized. A recorded output
     * mode decides; otherwise the plane's value range does.
     */
    boolean isNormalized(double planeMin, double planeMax) {
        if (metadata != null) {
            Optional<MagnitudeOutputMode> mode = metadata.getMagnitudeOutputMode();
            if (mode.isPresent()) {
                return mode.get() == MagnitudeOutputMode.NORMALIZED;
            }
        }
        return planeMin >= 0.0 && planeMax <= 1.0;
    }

    /**
     * Gamma applied before normalization, 1.0 when none was recorded.
     */
    double getMagnitudeGamma() {
        return metadata != null ? metadata.getMagnitudeGamma() : 1.0;
    }

    /**
     * Value the channel's magnitude had before it was divided down to 1, in the
     * stored (log and gamma compressed) domain.
     */
    double normalizationCeiling(int channel) {
        double ceiling;
        if (metadataMaxima) {
            ceiling = logApplied ? metadata.postLogMaximumFor(channel) : metadata.preLogMaximumFor(channel);
        } else {
            ceiling = heuristicCeiling();
        }
        return Math.pow(Math.max(ceiling, 0.0), getMagnitudeGamma());
    }

    private double heuristicCeiling() {
        double dc = HEURISTIC_MEAN_LEVEL * originalRows * originalCols;
        return logApplied ? Math.log1p(dc) : dc;
    }

    @Override
    public String toString() {
        return "ReconstructionPlan{" +
            "log=" + logApplied +
            ", centered=" + centered +
            ", windowed=" + windowed +
            ", phaseEnhanced=" + phaseEnhanced +
            ", alpha=" + alphaTransformed +
            ", original=" + originalRows + "x" + originalCols +
            ", padded=" + paddedRows + "x" + paddedCols +
            ", heuristic=" + isHeuristic() +
            '}';
    }
}
