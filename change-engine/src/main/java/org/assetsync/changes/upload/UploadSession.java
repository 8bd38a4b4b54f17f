package org.assetsync.changes.upload;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The server's answer to opening an upload: where to send chunks and how to split the file.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadSession(String id, long chunkSize, int numChunks) {}
