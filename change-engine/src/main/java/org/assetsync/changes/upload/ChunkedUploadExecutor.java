package org.assetsync.changes.upload;

import java.util.LinkedHashMap;
import java.util.Map;

import org.assetsync.changes.ChangeEngineSettings;
import org.assetsync.changes.model.UploadChange;
import org.assetsync.client.common.DamApiClient;
import org.assetsync.client.common.HttpStatusException;
import org.assetsync.client.common.http.MultipartPart;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Runs the upload protocol: open a session, then send the payload in the chunks the server asked for,
 * one after another. Chunks are never retried; a rejected chunk fails the whole upload.
 */
@Slf4j
public class ChunkedUploadExecutor {
    static final String CHUNK_PART_NAME = "chunk";
    private static final String JSON_CONTENT_TYPE = "application/json";

    private final DamApiClient client;
    private final ChangeEngineSettings settings;

    public ChunkedUploadExecutor(DamApiClient client, ChangeEngineSettings settings) {
        this.client = client;
        this.settings = settings;
    }

    public Mono<UploadSession> uploadAsset(UploadChange item) {
        return openSession(item)
            .flatMap(session -> Flux.range(0, session.numChunks())
                .concatMap(index -> uploadChunk(session, item, index))
                .then(Mono.just(session)))
            .doOnSuccess(session -> log.info("Uploaded {} ({} bytes) in {} chunk(s) as session {}",
                item.filename(), item.size(), session.numChunks(), session.id()));
    }

    Mono<UploadSession> openSession(UploadChange item) {
        var metadata = new LinkedHashMap<String, Object>();
        metadata.put("fields", item.fields());
        metadata.put("attributes", item.attributes());

        Map<String, Object> request = new LinkedHashMap<>();
        request.put("destination", item.destination());
        request.put("filename", item.filename());
        request.put("hasXmp", false);
        request.put("fileSize", item.size());
        request.put("checkoutId", null);
        request.put("metadata", metadata);
        request.put("comment", null);

        return client.post(settings.getUploadsPath(), JSON_CONTENT_TYPE, request)
            .flatMap(response -> client.readBody(response, UploadSession.class))
            .flatMap(session -> validate(session, item));
    }

    private static Mono<UploadSession> validate(UploadSession session, UploadChange item) {
        if (session.id() == null || session.id().isBlank()) {
            return Mono.error(new UploadException("Upload session for " + item.filename() + " has no id"));
        }
        if (session.numChunks() < 0) {
            return Mono.error(new UploadException("Upload session " + session.id()
                + " declared a negative chunk count " + session.numChunks()));
        }
        if (session.numChunks() > 0 && (session.chunkSize() <= 0 || session.chunkSize() > Integer.MAX_VALUE)) {
            return Mono.error(new UploadException("Upload session " + session.id()
                + " declared an unusable chunk size " + session.chunkSize()));
        }
        if (session.chunkSize() * session.numChunks() < item.size()) {
            return Mono.error(new UploadException("Upload session " + session.id() + " asks for "
                + session.numChunks() + " chunk(s) of " + session.chunkSize() + " bytes, too few for the "
                + item.size() + " bytes of " + item.filename()));
        }
        log.debug("Opened upload session {} for {}: {} chunk(s) of {} bytes",
            session.id(), item.filename(), session.numChunks(), session.chunkSize());
        return Mono.just(session);
    }

    /**
     * Sends chunk {@code index}, sized by the bytes remaining after the previous chunks.
     */
    Mono<Void> uploadChunk(UploadSession session, UploadChange item, int index) {
        long offset = index * session.chunkSize();
        int length = (int) Math.max(0, Math.min(session.chunkSize(), item.size() - offset));
        var path = settings.uploadChunkPath(session.id(), index);
        return Mono.fromCallable(() -> item.slice(Math.min(offset, item.size()), length))
            .flatMap(bytes -> client.postMultipart(path,
                MultipartPart.octetStream(CHUNK_PART_NAME, CHUNK_PART_NAME, bytes)))
            .doOnNext(response -> log.debug("Chunk {}/{} of session {} accepted ({} bytes)",
                index + 1, session.numChunks(), session.id(), length))
            .onErrorMap(HttpStatusException.class, e -> new UploadException(session.id(), index, e))
            .then();
    }
}
