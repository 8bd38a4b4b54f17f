package org.assetsync.changes;

import java.util.List;
import java.util.Optional;

import org.assetsync.changes.model.BackgroundTaskHandle;
import org.assetsync.changes.model.ChangeTask;
import org.assetsync.changes.model.TaskStatus;
import org.assetsync.changes.polling.NotReadyException;
import org.assetsync.changes.polling.PollingRetrier;
import org.assetsync.changes.polling.PollingSettings;
import org.assetsync.changes.wire.MoveJobStatus;
import org.assetsync.changes.wire.RemoteJobState;
import org.assetsync.changes.wire.UploadJobStatus;
import org.assetsync.client.common.DamApiClient;
import org.assetsync.client.common.HttpStatusException;
import org.assetsync.client.common.http.HttpResponse;

import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

/**
 * Advances SUBMITTED tasks toward DONE or FAILED by polling the status location of their jobs.
 */
@Slf4j
public class BackgroundTaskTracker {
    private static final int REQUEST_TIMEOUT = 408;
    private static final int TOO_MANY_REQUESTS = 429;

    private final DamApiClient client;
    private final TaskRegistry registry;
    private final PollingRetrier pollingRetrier;

    public BackgroundTaskTracker(DamApiClient client, TaskRegistry registry, PollingRetrier pollingRetrier) {
        this.client = client;
        this.registry = registry;
        this.pollingRetrier = pollingRetrier;
    }

    /**
     * One reconciliation pass: a single status GET per SUBMITTED task, in registry order.
     * Terminal tasks are never touched.
     */
    public Mono<Void> checkSubmitted() {
        var submitted = registry.tasksByStatus(TaskStatus.SUBMITTED);
        log.debug("Checking {} submitted task(s)", submitted.size());
        return Flux.fromIterable(submitted)
            .filter(task -> task.getStatus() == TaskStatus.SUBMITTED)
            .concatMap(this::checkTask)
            .then();
    }

    /**
     * Repeats {@link #checkSubmitted()} until no task is SUBMITTED, waiting between passes.
     * Fails with a {@link org.assetsync.changes.polling.PollingTimeoutException} when the budget runs out.
     */
    public Mono<Void> awaitCompletion(PollingSettings settings) {
        var pass = Mono.defer(this::checkSubmitted)
            .then(Mono.defer(() -> registry.hasTasksWithStatus(TaskStatus.SUBMITTED)
                ? Mono.<Void>error(new NotReadyException("submitted tasks"))
                : Mono.<Void>empty()));
        return pollingRetrier.retryWhileNotReady("submitted tasks", pass, settings);
    }

    private Mono<Void> checkTask(ChangeTask task) {
        Optional<BackgroundTaskHandle> handle = registry.getHandle(task.getId());
        if (handle.isEmpty()) {
            log.warn("{} is submitted but has no background job handle, skipping", task);
            return Mono.empty();
        }
        var location = handle.get().statusLocation();
        return client.get(location)
            .flatMap(response -> readStatus(task, response))
            .doOnNext(status -> apply(task, location, status))
            .onErrorResume(HttpStatusException.class, e -> {
                if (isJobGone(e)) {
                    log.warn("Status of {} is no longer available ({}), marking it failed", task, e.getStatusCode());
                    finish(task, () -> task.markFailed(e));
                } else {
                    log.warn("Could not poll status of {}: {}", task, e.getMessage());
                }
                return Mono.empty();
            })
            .onErrorResume(e -> !(e instanceof HttpStatusException), e -> {
                log.warn("Could not read status of {}: {}", task, e.getMessage());
                return Mono.empty();
            })
            .then();
    }

    private Mono<JobStatusView> readStatus(ChangeTask task, HttpResponse response) {
        return switch (task.getChange().kind()) {
            case MOVE -> client.readBody(response, MoveJobStatus.class)
                .map(status -> new JobStatusView(status.state(), status.resultRefs(), "move job failed"));
            case UPLOAD -> client.readBody(response, UploadJobStatus.class)
                .map(status -> new JobStatusView(status.state(), status.resultRefs(), status.errorDescription()));
            case METADATA -> Mono.error(new IllegalStateException(task + " has no background job"));
        };
    }

    private void apply(ChangeTask task, String location, JobStatusView status) {
        switch (status.state()) {
            case DONE:
                finish(task, () -> task.markDone(status.resultRefs()));
                log.info("{} done", task);
                break;
            case FAILED:
                finish(task, () -> task.markFailed(new RemoteJobFailedException(location, status.failureReason())));
                log.warn("{} failed remotely: {}", task, status.failureReason());
                break;
            case UNKNOWN:
                log.warn("{} reported an unrecognised status, leaving it submitted", task);
                break;
            default:
                log.debug("{} still {}", task, status.state());
        }
    }

    private void finish(ChangeTask task, Runnable transition) {
        transition.run();
        registry.removeHandle(task.getId());
    }

    private static boolean isJobGone(HttpStatusException e) {
        return e.isClientError() && e.getStatusCode() != REQUEST_TIMEOUT && e.getStatusCode() != TOO_MANY_REQUESTS;
    }

    private record JobStatusView(RemoteJobState state, List<String> resultRefs, String failureReason) {}
}
