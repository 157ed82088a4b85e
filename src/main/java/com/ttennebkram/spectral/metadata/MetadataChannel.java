package com.ttennebkram.spectral.metadata;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * String-keyed metadata map that travels with images through the host pipeline.
 *
 * The host owns the backing {@link JsonObject} and passes it by reference from
 * node to node. Entries are append-only: {@link #putIfAbsent} never replaces an
 * existing key, so re-evaluating a node keeps the first run's values. The only
 * exception is the processing history, which each node extends.
 *
 * Not thread-safe. The host serializes access to a channel.
 */
public final class MetadataChannel {

    static final String HISTORY_SEPARATOR = " -> ";

    private final JsonObject entries;

    public MetadataChannel() {
        this(new JsonObject());
    }

    public MetadataChannel(JsonObject entries) {
        this.entries = Objects.requireNonNull(entries, "entries");
    }

    public boolean contains(String key) {
        return entries.has(key);
    }

    /**
     * Add an entry unless the key is already present.
     *
     * @return true if the entry was written, false if an earlier writer owns the key
     */
    public boolean putIfAbsent(String key, JsonElement value) {
        Objects.requireNonNull(value, "value");
        if (entries.has(key)) {
            return false;
        }
        entries.add(key, value.deepCopy());
        return true;
    }

    /**
     * Get a copy of an object-valued entry. Entries of any other shape are reported as absent.
     */
    public Optional<JsonObject> getObject(String key) {
        JsonElement element = entries.get(key);
        if (element == null || !element.isJsonObject()) {
            return Optional.empty();
        }
        return Optional.of(element.getAsJsonObject().deepCopy());
    }

    /**
     * Append a step to the processing history.
     */
    public void appendHistory(String step) {
        JsonElement existing = entries.get(SpectralMetadataKeys.PROCESSING_HISTORY);
        if (existing != null && existing.isJsonPrimitive() && !existing.getAsString().isEmpty()) {
            entries.addProperty(SpectralMetadataKeys.PROCESSING_HISTORY,
                existing.getAsString() + HISTORY_SEPARATOR + step);
        } else {
            entries.addProperty(SpectralMetadataKeys.PROCESSING_HISTORY, step);
        }
    }

    public List<String> history() {
        JsonElement existing = entries.get(SpectralMetadataKeys.PROCESSING_HISTORY);
        if (existing == null || !existing.isJsonPrimitive() || existing.getAsString().isEmpty()) {
            return new ArrayList<>();
        }
        return new ArrayList<>(Arrays.asList(existing.getAsString().split(HISTORY_SEPARATOR)));
    }

    /**
     * The live backing object, for handing the channel on to the next node.
     */
    public JsonObject asJson() {
        return entries;
    }

    @Override
    public String toString() {
        return entries.toString();
    }
}
