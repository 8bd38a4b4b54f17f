package org.assetsync.changes;

import org.assetsync.client.common.ApiException;

import lombok.Getter;

/**
 * The destination collection does not accept moves (or uploads), e.g. because it is a search archive.
 */
@Getter
public class CollectionNotMovableToException extends ApiException {
    private final String collectionName;

    public CollectionNotMovableToException(String collectionName, String operation) {
        super("Collection '" + collectionName + "' does not accept " + operation);
        this.collectionName = collectionName;
    }
}
