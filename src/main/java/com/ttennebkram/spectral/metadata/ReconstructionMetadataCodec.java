package com.ttennebkram.spectral.metadata;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Encodes {@link ReconstructionMetadata} into the two reserved metadata channel
 * entries and decodes it back.
 *
 * The forward-parameters entry carries the configuration flags, the
 * reconstruction entry carries geometry and magnitude maxima. Decoding needs the
 * flags; the numeric entry is optional (partial metadata). Malformed entries are
 * logged and treated as absent, records with an unknown format version are
 * decoded best-effort from the fields this version understands.
 */
public final class ReconstructionMetadataCodec {

    private static final Logger LOG = LoggerFactory.getLogger(ReconstructionMetadataCodec.class);

    private static final Set<String> KNOWN_VERSIONS = Set.of(ReconstructionMetadata.CURRENT_FORMAT_VERSION);

    // Forward parameter fields
    static final String FORMAT_VERSION = "formatVersion";
    static final String APPLY_LOG_TRANSFORM = "applyLogTransform";
    static final String CENTER_FFT = "centerFFT";
    static final String APPLY_WINDOW = "applyWindow";
    static final String ENHANCE_PHASE_CONTRAST = "enhancePhaseContrast";
    static final String TRANSFORM_ALPHA = "transformAlpha";
    static final String MAGNITUDE_OUTPUT_MODE = "magnitudeOutputMode";
    static final String MAGNITUDE_GAMMA = "magnitudeGamma";

    // Reconstruction fields
    static final String ORIGINAL_ROWS = "originalRows";
    static final String ORIGINAL_COLS = "originalCols";
    static final String PADDED_ROWS = "paddedRows";
    static final String PADDED_COLS = "paddedCols";
    static final String PRE_LOG_MAX = "preLogMagnitudeMax";
    static final String POST_LOG_MAX = "postLogMagnitudeMax";
    static final String CHANNEL_PRE_LOG_MAXIMA = "channelPreLogMaxima";
    static final String CHANNEL_POST_LOG_MAXIMA = "channelPostLogMaxima";

    private ReconstructionMetadataCodec() {
    }

    // ===== Encoding =====

    public static JsonObject encodeParameters(ReconstructionMetadata metadata) {
        JsonObject json = new JsonObject();
        json.addProperty(FORMAT_VERSION, metadata.getFormatVersion());
        json.addProperty(APPLY_LOG_TRANSFORM, metadata.isLogTransformApplied());
        json.addProperty(CENTER_FFT, metadata.isCenteringApplied());
        json.addProperty(APPLY_WINDOW, metadata.isWindowApplied());
        json.addProperty(ENHANCE_PHASE_CONTRAST, metadata.isPhaseContrastEnhanced());
        json.addProperty(TRANSFORM_ALPHA, metadata.isAlphaChannelTransformed());
        metadata.getMagnitudeOutputMode().ifPresent(mode -> json.addProperty(MAGNITUDE_OUTPUT_MODE, mode.name()));
        json.addProperty(MAGNITUDE_GAMMA, metadata.getMagnitudeGamma());
        return json;
    }

    public static JsonObject encodeReconstruction(ReconstructionMetadata metadata) {
        JsonObject json = new JsonObject();
        json.addProperty(FORMAT_VERSION, metadata.getFormatVersion());
        if (metadata.hasGeometry()) {
            json.addProperty(ORIGINAL_ROWS, metadata.getOriginalRows());
            json.addProperty(ORIGINAL_COLS, metadata.getOriginalCols());
            json.addProperty(PADDED_ROWS, metadata.getPaddedRows());
            json.addProperty(PADDED_COLS, metadata.getPaddedCols());
        }
        if (metadata.hasMagnitudeMaxima()) {
            json.addProperty(PRE_LOG_MAX, metadata.getPreLogMagnitudeMax());
            json.addProperty(POST_LOG_MAX, metadata.getPostLogMagnitudeMax());
        }
        double[] preMaxima = metadata.getChannelPreLogMaxima();
        double[] postMaxima = metadata.getChannelPostLogMaxima();
        if (preMaxima.length > 0 && preMaxima.length == postMaxima.length) {
            json.add(CHANNEL_PRE_LOG_MAXIMA, toJsonArray(preMaxima));
            json.add(CHANNEL_POST_LOG_MAXIMA, toJsonArray(postMaxima));
        }
        return json;
    }

    /**
     * Write the forward flags entry. First writer wins.
     *
     * @return true if this call wrote the entry
     */
    public static boolean writeParameters(MetadataChannel channel, ReconstructionMetadata metadata) {
        boolean written = channel.putIfAbsent(SpectralMetadataKeys.FORWARD_PARAMETERS, encodeParameters(metadata));
        if (!written) {
            LOG.debug("Keeping existing {} entry", SpectralMetadataKeys.FORWARD_PARAMETERS);
        }
        return written;
    }

    /**
     * Write the numeric reconstruction entry. First writer wins.
     *
     * @return true if this call wrote the entry
     */
    public static boolean writeReconstruction(MetadataChannel channel, ReconstructionMetadata metadata) {
        boolean written = channel.putIfAbsent(SpectralMetadataKeys.RECONSTRUCTION_PARAMETERS, encodeReconstruction(metadata));
        if (!written) {
            LOG.debug("Keeping existing {} entry", SpectralMetadataKeys.RECONSTRUCTION_PARAMETERS);
        }
        return written;
    }

    // ===== Decoding =====

    /**
     * Read reconstruction metadata from a channel.
     *
     * @return the decoded record, or empty if the channel carries no usable forward flags
     */
    public static Optional<ReconstructionMetadata> read(MetadataChannel channel) {
        if (channel == null) {
            return Optional.empty();
        }
        return decode(channel.getObject(SpectralMetadataKeys.FORWARD_PARAMETERS).orElse(null),
            channel.getObject(SpectralMetadataKeys.RECONSTRUCTION_PARAMETERS).orElse(null));
    }

    /**
     * Decode the two entries. Either argument may be null.
     */
    public static Optional<ReconstructionMetadata> decode(JsonObject parameters, JsonObject reconstruction) {
        if (parameters == null) {
            if (reconstruction != null) {
                LOG.warn("Ignoring {} entry without matching {} entry",
                    SpectralMetadataKeys.RECONSTRUCTION_PARAMETERS, SpectralMetadataKeys.FORWARD_PARAMETERS);
            }
            return Optional.empty();
        }

        ReconstructionMetadata.Builder builder = ReconstructionMetadata.builder();
        try {
            String version = getString(parameters, FORMAT_VERSION, "unknown");
            if (!KNOWN_VERSIONS.contains(version)) {
                LOG.warn("Unrecognized reconstruction metadata version '{}', decoding known fields only", version);
            }
            builder.formatVersion(version)
                .logTransformApplied(getBoolean(parameters, APPLY_LOG_TRANSFORM, false))
                .centeringApplied(getBoolean(parameters, CENTER_FFT, false))
                .windowApplied(getBoolean(parameters, APPLY_WINDOW, false))
                .phaseContrastEnhanced(getBoolean(parameters, ENHANCE_PHASE_CONTRAST, false))
                .alphaChannelTransformed(getBoolean(parameters, TRANSFORM_ALPHA, false))
                .magnitudeOutputMode(MagnitudeOutputMode.fromName(getString(parameters, MAGNITUDE_OUTPUT_MODE, null)))
                .magnitudeGamma(positiveOrDefault(getDouble(parameters, MAGNITUDE_GAMMA, 1.0), 1.0));
        } catch (RuntimeException e) {
            LOG.warn("Malformed {} entry, treating metadata as absent: {}",
                SpectralMetadataKeys.FORWARD_PARAMETERS, e.getMessage());
            return Optional.empty();
        }

        if (reconstruction != null) {
            try {
                decodeReconstruction(reconstruction, builder);
            } catch (RuntimeException e) {
                LOG.warn("Malformed {} entry, using forward flags only: {}",
                    SpectralMetadataKeys.RECONSTRUCTION_PARAMETERS, e.getMessage());
                builder.originalSize(0, 0)
                    .paddedSize(0, 0)
                    .magnitudeMaxima(Double.NaN, Double.NaN)
                    .channelMaxima(null, null);
            }
        }
        return Optional.of(builder.build());
    }

    private static void decodeReconstruction(JsonObject json, ReconstructionMetadata.Builder builder) {
        if (json.has(ORIGINAL_ROWS) && json.has(ORIGINAL_COLS)) {
            int rows = json.get(ORIGINAL_ROWS).getAsInt();
            int cols = json.get(ORIGINAL_COLS).getAsInt();
            int paddedRows = getInt(json, PADDED_ROWS, rows);
            int paddedCols = getInt(json, PADDED_COLS, cols);
            builder.originalSize(rows, cols).paddedSize(paddedRows, paddedCols);
        }
        if (json.has(PRE_LOG_MAX) && json.has(POST_LOG_MAX)) {
            builder.magnitudeMaxima(json.get(PRE_LOG_MAX).getAsDouble(), json.get(POST_LOG_MAX).getAsDouble());
        }
        if (json.has(CHANNEL_PRE_LOG_MAXIMA) && json.has(CHANNEL_POST_LOG_MAXIMA)) {
            builder.channelMaxima(toDoubleArray(json.getAsJsonArray(CHANNEL_PRE_LOG_MAXIMA)),
                toDoubleArray(json.getAsJsonArray(CHANNEL_POST_LOG_MAXIMA)));
        }
    }

    // ===== JSON helpers =====

    private static JsonArray toJsonArray(double[] values) {
        JsonArray array = new JsonArray();
        for (double value : values) {
            array.add(value);
        }
        return array;
    }

    private static double[] toDoubleArray(JsonArray array) {
        double[] values = new double[array.size()];
        for (int i = 0; i < values.length; i++) {
            values[i] = array.get(i).getAsDouble();
        }
        return values;
    }

    private static double positiveOrDefault(double value, double defaultValue) {
        return value > 0 && !Double.isInfinite(value) ? value : defaultValue;
    }

    private static String getString(JsonObject json, String key, String defaultValue) {
        JsonElement element = json.get(key);
        return element != null && !element.isJsonNull() ? element.getAsString() : defaultValue;
    }

    private static boolean getBoolean(JsonObject json, String key, boolean defaultValue) {
        JsonElement element = json.get(key);
        return element != null && !element.isJsonNull() ? element.getAsBoolean() : defaultValue;
    }

    private static int getInt(JsonObject json, String key, int defaultValue) {
        JsonElement element = json.get(key);
        return element != null && !element.isJsonNull() ? element.getAsInt() : defaultValue;
    }

    private static double getDouble(JsonObject json, String key, double defaultValue) {
        JsonElement element = json.get(key);
        return element != null && !element.isJsonNull() ? element.getAsDouble() : defaultValue;
    }
}
