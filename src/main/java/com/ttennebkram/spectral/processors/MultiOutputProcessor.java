package com.ttennebkram.spectral.processors;

import com.ttennebkram.spectral.metadata.MetadataChannel;
import com.ttennebkram.spectral.processing.MultiImageProcessor;
import org.opencv.core.Mat;

/**
 * Interface for processors that produce multiple outputs.
 *
 * Example: FourierTransform (magnitude and phase)
 */
public interface MultiOutputProcessor extends SpectralProcessor {

    /**
     * Get the number of outputs this processor produces.
     */
    int getOutputCount();

    /**
     * Get labels for each output (for UI display and tooltips).
     * @return Array of output labels matching getOutputCount()
     */
    String[] getOutputLabels();

    /**
     * Process an input image and return multiple outputs.
     *
     * @param input The input Mat (do not modify or release)
     * @param metadata The side channel flowing with the image, may be null
     * @return Array of output Mats (caller will release each)
     */
    Mat[] processMultiOutput(Mat input, MetadataChannel metadata);

    /**
     * Create a MultiImageProcessor lambda bound to a metadata channel.
     */
    default MultiImageProcessor createMultiImageProcessor(MetadataChannel metadata) {
        return input -> processMultiOutput(input, metadata);
    }
}
