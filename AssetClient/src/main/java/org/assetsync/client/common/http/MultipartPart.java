package org.assetsync.client.common.http;

/**
 * A single file part of a multipart/form-data request body.
 */
public record MultipartPart(
    String name,
    String filename,
    String contentType,
    byte[] content
) {
    public static final String OCTET_STREAM = "application/octet-stream";

    public static MultipartPart octetStream(String name, String filename, byte[] content) {
        return new MultipartPart(name, filename, OCTET_STREAM, content);
    }
}
