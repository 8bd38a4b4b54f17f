package org.assetsync.changes;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import org.assetsync.changes.model.BackgroundTaskHandle;
import org.assetsync.changes.model.ChangeTask;
import org.assetsync.changes.model.MetadataChange;
import org.assetsync.changes.model.MoveChange;
import org.assetsync.changes.model.TaskStatus;
import org.assetsync.changes.model.UploadChange;
import org.assetsync.changes.upload.ChunkedUploadExecutor;
import org.assetsync.changes.wire.BackgroundRequestResponse;
import org.assetsync.client.common.ApiException;
import org.assetsync.client.common.DamApiClient;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Submits uncommitted tasks. Metadata changes complete synchronously; moves and uploads become
 * SUBMITTED with a handle for the {@link BackgroundTaskTracker} to poll.
 *
 * <p>A failure never escapes a commit pass: the task is marked FAILED with its cause and the pass
 * continues with the next task. Failed submissions are not retried.
 */
@Slf4j
public class ChangeDispatcher {
    static final String ASSET_UPDATE_CONTENT_TYPE = "application/vnd.fotoware.assetupdate+json";
    static final String MOVE_REQUEST_CONTENT_TYPE = "application/vnd.fotoware.move-request+json";

    private final DamApiClient client;
    private final TaskRegistry registry;
    private final ChunkedUploadExecutor uploadExecutor;
    private final ChangeEngineSettings settings;

    public ChangeDispatcher(DamApiClient client, TaskRegistry registry, ChunkedUploadExecutor uploadExecutor,
                            ChangeEngineSettings settings) {
        this.client = client;
        this.registry = registry;
        this.uploadExecutor = uploadExecutor;
        this.settings = settings;
    }

    /**
     * Commits every UNCOMMITTED task, one at a time, in registry order. SUBMITTED tasks are left alone.
     */
    public Mono<Void> commit() {
        var pending = registry.tasksByStatus(TaskStatus.UNCOMMITTED);
        log.info("Committing {} task(s)", pending.size());
        return Flux.fromIterable(pending)
            .filter(task -> task.getStatus() == TaskStatus.UNCOMMITTED)
            .concatMap(this::commitUncommitted)
            .then()
            .doOnSuccess(unused -> log.atInfo().setMessage("Commit pass finished: {} submitted, {} failed")
                .addArgument(() -> registry.tasksByStatus(TaskStatus.SUBMITTED).size())
                .addArgument(() -> registry.tasksByStatus(TaskStatus.FAILED).size())
                .log());
    }

    /**
     * Submits a single task, which must be UNCOMMITTED and registered. Either precondition failing is
     * signalled as an {@link IllegalStateException} before any request is made; every later failure
     * marks the task FAILED.
     */
    public Mono<Void> commitUncommitted(ChangeTask task) {
        if (task.getStatus() != TaskStatus.UNCOMMITTED) {
            return Mono.error(new IllegalStateException(task + " is not uncommitted"));
        }
        if (registry.getTask(task.getId()).filter(registered -> registered == task).isEmpty()) {
            return Mono.error(new IllegalStateException(task + " is not registered with this dispatcher"));
        }
        return submit(task)
            .onErrorResume(e -> {
                log.warn("{} failed: {}", task, e.getMessage());
                log.debug("Failure details for {}", task, e);
                task.markFailed(e);
                return Mono.empty();
            });
    }

    private Mono<Void> submit(ChangeTask task) {
        var change = task.getChange();
        return switch (change.kind()) {
            case METADATA -> patchMetadata((MetadataChange) change)
                .then(Mono.fromRunnable(() -> task.markDone(List.of())));
            case MOVE -> moveAssets((MoveChange) change)
                .doOnNext(location -> markSubmitted(task, location))
                .then();
            case UPLOAD -> uploadExecutor.uploadAsset((UploadChange) change)
                .doOnNext(session -> markSubmitted(task, settings.uploadStatusLocation(session.id())))
                .then();
        };
    }

    private void markSubmitted(ChangeTask task, String statusLocation) {
        registry.recordHandle(new BackgroundTaskHandle(task.getId(), statusLocation));
        task.markSubmitted();
        log.debug("{} submitted, status at {}", task, statusLocation);
    }

    Mono<Void> patchMetadata(MetadataChange change) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        change.fields().forEach((fieldId, value) -> metadata.put(fieldId, Map.of("value", value)));
        return client.patch(change.assetRef(), ASSET_UPDATE_CONTENT_TYPE, Map.of("metadata", metadata))
            .then();
    }

    /**
     * Creates the move job and returns its status location.
     */
    Mono<String> moveAssets(MoveChange change) {
        var assets = change.assetRefs().stream()
            .map(href -> Map.of("href", href))
            .collect(Collectors.toList());
        Map<String, Object> request = new LinkedHashMap<>();
        request.put("assets", assets);
        request.put("job-destination", change.destination());

        return client.post(settings.getMovePath(), MOVE_REQUEST_CONTENT_TYPE, request)
            .flatMap(response -> client.readBody(response, BackgroundRequestResponse.class))
            .flatMap(response -> response.location() == null || response.location().isBlank()
                ? Mono.error(new ApiException("Move request was accepted without a status location"))
                : Mono.just(response.location()));
    }
}
