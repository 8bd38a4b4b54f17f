package org.assetsync.changes.model;

/**
 * A pending change against the DAM service. Exactly one of the permitted variants.
 */
public sealed interface Change permits MetadataChange, MoveChange, UploadChange {

    /**
     * How a change is submitted. One constant per permitted variant, so switches over it are exhaustive.
     */
    enum Kind {
        METADATA,
        MOVE,
        UPLOAD
    }

    Kind kind();
}
