package org.assetsync.changes.upload;

import org.assetsync.client.common.ApiException;

import lombok.Getter;

/**
 * An upload could not be completed. Partially transmitted sessions are abandoned.
 */
@Getter
public class UploadException extends ApiException {
    private final String sessionId;
    private final int chunkIndex;

    public UploadException(String message) {
        super(message);
        this.sessionId = null;
        this.chunkIndex = -1;
    }

    public UploadException(String sessionId, int chunkIndex, Throwable cause) {
        super("Chunk " + chunkIndex + " of upload " + sessionId + " was rejected: " + cause.getMessage(), cause);
        this.sessionId = sessionId;
        this.chunkIndex = chunkIndex;
    }
}
