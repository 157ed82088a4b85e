package com.ttennebkram.spectral.metadata;

/**
 * Top-level keys this subsystem reserves in the pipeline metadata channel.
 */
public final class SpectralMetadataKeys {

    /** Configuration flags of the forward run. */
    public static final String FORWARD_PARAMETERS = "fourier.transform.parameters";

    /** Numeric values needed to undo the lossy forward steps. */
    public static final String RECONSTRUCTION_PARAMETERS = "fourier.reconstruction.parameters";

    /** Provenance of the forward run (node instance, timestamp, format version). */
    public static final String RECONSTRUCTION_INFO = "fourier.reconstruction.info";

    /** Settings the inverse node actually used. */
    public static final String INVERSE_PARAMETERS = "fourier.inverse.parameters";

    /** Arrow-joined list of processing steps. Appended to, never replaced. */
    public static final String PROCESSING_HISTORY = "processing.history";

    private SpectralMetadataKeys() {
    }
}
