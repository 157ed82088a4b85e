package com.ttennebkram.spectral.fft;

/**
 * Rule for choosing the DFT size of each dimension.
 *
 * The forward transform crops its spectra back to the image size, which drops
 * the bins the padding added. Only {@link #NONE} keeps every bin, so it is the
 * one that reconstructs exactly. The padded strategies trade that for a faster
 * DFT on awkward sizes and leave a small reconstruction error.
 */
public enum PaddingStrategy {

    /** {@code Core.getOptimalDFTSize(n)}: smallest 2^a * 3^b * 5^c >= n. */
    OPENCV_OPTIMAL,

    /** Next power of two if it adds less than 25% over the OpenCV size, otherwise an even OpenCV size. */
    POWER_OF_TWO_PREFERRED,

    /** No padding. OpenCV's DFT handles any size, just more slowly for large primes. */
    NONE;

    public static PaddingStrategy fromName(String name, PaddingStrategy defaultValue) {
        if (name == null) return defaultValue;
        for (PaddingStrategy strategy : values()) {
            if (strategy.name().equalsIgnoreCase(name)) {
                return strategy;
            }
        }
        return defaultValue;
    }
}
