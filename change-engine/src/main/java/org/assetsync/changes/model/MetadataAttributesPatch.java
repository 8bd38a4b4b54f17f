package org.assetsync.changes.model;

import java.util.Objects;

/**
 * A file attribute edit for a new upload. Key {@code mt} sets the modification time.
 */
public record MetadataAttributesPatch(String key, String value) {
    public static final String MODIFICATION_TIME = "mt";

    public MetadataAttributesPatch {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(value, "value");
    }

    public static MetadataAttributesPatch modificationTime(String isoTimestamp) {
        return new MetadataAttributesPatch(MODIFICATION_TIME, isoTimestamp);
    }
}
