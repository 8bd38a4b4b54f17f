package org.assetsync.changes.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * New values for metadata fields of one existing asset. Committed with a single synchronous PATCH.
 *
 * @param assetRef the asset's href
 * @param fields field id to new value; each value is a {@code String}, {@code Boolean} or {@code List<String>}
 */
public record MetadataChange(String assetRef, Map<String, Object> fields) implements Change {
    public MetadataChange {
        Objects.requireNonNull(assetRef, "assetRef");
        Objects.requireNonNull(fields, "fields");
        if (fields.isEmpty()) {
            throw new IllegalArgumentException("A metadata change needs at least one field");
        }
        var copy = new LinkedHashMap<String, Object>();
        fields.forEach((fieldId, value) -> copy.put(Objects.requireNonNull(fieldId, "field id"), checkValue(fieldId, value)));
        fields = Collections.unmodifiableMap(copy);
    }

    public static MetadataChange of(String assetRef, int fieldId, Object value) {
        return new MetadataChange(assetRef, Map.of(String.valueOf(fieldId), value));
    }

    private static Object checkValue(String fieldId, Object value) {
        if (value instanceof String || value instanceof Boolean) {
            return value;
        }
        if (value instanceof List) {
            return List.copyOf(requireStrings((List<?>) value));
        }
        throw new IllegalArgumentException("Unsupported value for field " + fieldId + ": "
            + (value == null ? "null" : value.getClass().getSimpleName()));
    }

    @SuppressWarnings("unchecked")
    static List<String> requireStrings(List<?> values) {
        for (Object v : values) {
            if (!(v instanceof String)) {
                throw new IllegalArgumentException("List values must all be strings");
            }
        }
        return (List<String>) values;
    }

    @Override
    public Kind kind() {
        return Kind.METADATA;
    }
}
