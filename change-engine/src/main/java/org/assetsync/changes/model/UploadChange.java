package org.assetsync.changes.model;

import java.nio.ByteBuffer;
import java.util.List;
import java.util.Objects;

/**
 * A new asset to upload into a collection.
 *
 * @param payload the file contents, copied on construction
 * @param destination href of the target collection
 * @param filename name the asset gets on the server
 * @param size declared size in bytes, at most the payload length
 * @param fields metadata edits applied to the new asset
 * @param attributes file attribute edits, e.g. modification time
 */
public record UploadChange(
    ByteBuffer payload,
    String destination,
    String filename,
    long size,
    List<MetadataPatch> fields,
    List<MetadataAttributesPatch> attributes
) implements Change {
    public UploadChange {
        Objects.requireNonNull(payload, "payload");
        Objects.requireNonNull(destination, "destination");
        Objects.requireNonNull(filename, "filename");
        if (size < 0 || size > payload.remaining()) {
            throw new IllegalArgumentException("Declared size " + size + " does not fit a payload of "
                + payload.remaining() + " bytes");
        }
        var copy = ByteBuffer.allocate(payload.remaining());
        copy.put(payload.duplicate()).flip();
        payload = copy.asReadOnlyBuffer();
        fields = fields == null ? List.of() : List.copyOf(fields);
        attributes = attributes == null ? List.of() : List.copyOf(attributes);
    }

    public static UploadChange of(byte[] contents, String destination, String filename,
                                  List<MetadataPatch> fields, List<MetadataAttributesPatch> attributes) {
        return new UploadChange(ByteBuffer.wrap(contents), destination, filename, contents.length,
            fields, attributes);
    }

    /**
     * Copies {@code length} bytes starting at {@code offset} out of the payload.
     */
    public byte[] slice(long offset, int length) {
        if (offset < 0 || length < 0 || offset + length > size) {
            throw new IndexOutOfBoundsException("Slice [" + offset + ", " + (offset + length)
                + ") is outside the declared size " + size);
        }
        var bytes = new byte[length];
        payload.duplicate().position(payload.position() + (int) offset).get(bytes);
        return bytes;
    }

    @Override
    public Kind kind() {
        return Kind.UPLOAD;
    }
}
