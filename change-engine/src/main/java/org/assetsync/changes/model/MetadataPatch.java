package org.assetsync.changes.model;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * An edit directive for one metadata field of a new upload.
 *
 * @param id the metadata field id
 * @param action how {@code value} is combined with the existing value
 * @param value a string, or a list of strings for bag fields
 */
public record MetadataPatch(int id, Action action, Object value) {
    public enum Action {
        ADD("add"),
        APPEND("append"),
        PREPEND("prepend"),
        ERASE("erase");

        private final String wireName;

        Action(String wireName) {
            this.wireName = wireName;
        }

        @JsonValue
        public String wireName() {
            return wireName;
        }
    }

    public MetadataPatch {
        Objects.requireNonNull(action, "action");
        if (!(value instanceof String) && !(value instanceof List) && !(value == null && action == Action.ERASE)) {
            throw new IllegalArgumentException("Metadata patch value must be a string or a list of strings");
        }
        if (value instanceof List) {
            value = List.copyOf(MetadataChange.requireStrings((List<?>) value));
        }
    }

    public static MetadataPatch add(int id, String value) {
        return new MetadataPatch(id, Action.ADD, value);
    }
}
