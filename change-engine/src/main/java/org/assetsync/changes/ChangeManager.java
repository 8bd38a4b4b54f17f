package org.assetsync.changes;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import org.assetsync.changes.model.Change;
import org.assetsync.changes.model.ChangeTask;
import org.assetsync.changes.model.CollectionRef;
import org.assetsync.changes.model.MetadataAttributesPatch;
import org.assetsync.changes.model.MetadataChange;
import org.assetsync.changes.model.MetadataPatch;
import org.assetsync.changes.model.MoveChange;
import org.assetsync.changes.model.TaskStatus;
import org.assetsync.changes.model.UploadChange;
import org.assetsync.changes.polling.PollingRetrier;
import org.assetsync.changes.upload.ChunkedUploadExecutor;
import org.assetsync.client.common.DamApiClient;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

/**
 * Prepares and commits changes to assets: metadata edits, moves between collections and uploads of new files.
 *
 * <p>Adding a change performs no I/O. {@link #commit()} submits everything uncommitted;
 * {@link #checkSubmitted()} or {@link #awaitCompletion()} then follows the background jobs.
 * One instance has a single logical owner; calls must not overlap.
 */
@Slf4j
public class ChangeManager {
    @Getter
    private final TaskRegistry registry;
    private final ChangeDispatcher dispatcher;
    private final BackgroundTaskTracker tracker;
    private final ChangeEngineSettings settings;

    public ChangeManager(DamApiClient client, ChangeEngineSettings settings) {
        this(client, settings, new PollingRetrier(client, settings.getStatusPolling()));
    }

    public ChangeManager(DamApiClient client, ChangeEngineSettings settings, PollingRetrier pollingRetrier) {
        this.settings = settings;
        this.registry = new TaskRegistry();
        this.dispatcher = new ChangeDispatcher(client, registry, new ChunkedUploadExecutor(client, settings), settings);
        this.tracker = new BackgroundTaskTracker(client, registry, pollingRetrier);
    }

    /** Sets one metadata field of an asset. */
    public ChangeTask setValue(String assetRef, int field, Object value) {
        return add(MetadataChange.of(assetRef, field, value));
    }

    /** Sets several metadata fields of an asset in one request. */
    public ChangeTask setValues(String assetRef, Map<String, Object> fields) {
        return add(new MetadataChange(assetRef, fields));
    }

    /**
     * Moves assets into another collection.
     *
     * @throws CollectionNotMovableToException if the destination does not accept moves
     */
    public ChangeTask move(Iterable<String> assetRefs, CollectionRef destination) {
        if (!destination.canMoveTo()) {
            throw new CollectionNotMovableToException(destination.name(), "moves");
        }
        return add(MoveChange.of(assetRefs, destination.href()));
    }

    /**
     * Uploads a new asset.
     *
     * @throws CollectionNotMovableToException if the destination does not accept uploads
     */
    public ChangeTask upload(byte[] contents, CollectionRef destination, String filename,
                             List<MetadataPatch> fields, List<MetadataAttributesPatch> attributes) {
        if (!destination.canUploadTo()) {
            throw new CollectionNotMovableToException(destination.name(), "uploads");
        }
        return add(UploadChange.of(contents, destination.href(), filename, fields, attributes));
    }

    /**
     * Reads {@code contents} fully, then behaves as {@link #upload(byte[], CollectionRef, String, List, List)}.
     * The stream is not closed.
     */
    public ChangeTask upload(InputStream contents, CollectionRef destination, String filename,
                             List<MetadataPatch> fields, List<MetadataAttributesPatch> attributes) throws IOException {
        if (!destination.canUploadTo()) {
            throw new CollectionNotMovableToException(destination.name(), "uploads");
        }
        return upload(contents.readAllBytes(), destination, filename, fields, attributes);
    }

    private ChangeTask add(Change change) {
        var task = new ChangeTask(change);
        registry.addTask(task);
        log.debug("Added {}", task);
        return task;
    }

    /** Commits the changes to the service. Completes once every uncommitted task was submitted or failed. */
    public Mono<Void> commit() {
        return dispatcher.commit();
    }

    /** One reconciliation pass over submitted tasks. */
    public Mono<Void> checkSubmitted() {
        return tracker.checkSubmitted();
    }

    /** Reconciles until no task is submitted, within the configured status polling budget. */
    public Mono<Void> awaitCompletion() {
        return tracker.awaitCompletion(settings.getStatusPolling());
    }

    public List<ChangeTask> tasks() {
        return registry.allTasks();
    }

    public List<ChangeTask> tasks(TaskStatus status) {
        return registry.tasksByStatus(status);
    }

    public boolean hasUncommittedChanges() {
        return registry.hasTasksWithStatus(TaskStatus.UNCOMMITTED);
    }

    public Optional<ChangeTask> removeTask(UUID id) {
        return registry.removeTask(id);
    }
}
