package org.assetsync.changes.model;

/**
 * The parts of a remote collection (archive or folder) needed to validate a move or upload target.
 */
public record CollectionRef(
    String name,
    String href,
    boolean canMoveTo,
    boolean canUploadTo
) {}
