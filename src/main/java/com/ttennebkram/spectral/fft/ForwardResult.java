package com.ttennebkram.spectral.fft;

import com.ttennebkram.spectral.metadata.ReconstructionMetadata;

import java.util.Optional;

/**
 * Output of a forward transform: the spectra and the metadata describing how to invert them.
 * Empty input yields an empty pair and no metadata.
 */
public final class ForwardResult {

    private static final ForwardResult EMPTY = new ForwardResult(SpectralPair.empty(), null);

    private final SpectralPair spectra;
    private final ReconstructionMetadata metadata;

    ForwardResult(SpectralPair spectra, ReconstructionMetadata metadata) {
        this.spectra = spectra;
        this.metadata = metadata;
    }

    static ForwardResult empty() {
        return EMPTY;
    }

    public SpectralPair getSpectra() {
        return spectra;
    }

    public Optional<ReconstructionMetadata> getMetadata() {
        return Optional.ofNullable(metadata);
    }

    public boolean isEmpty() {
        return spectra.isEmpty();
    }
}
