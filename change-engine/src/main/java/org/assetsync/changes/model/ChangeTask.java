package org.assetsync.changes.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * The unit of work: one change plus its lifecycle status. Identity is the generated id alone.
 */
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class ChangeTask {
    @EqualsAndHashCode.Include
    @Getter
    private final UUID id;
    @Getter
    private final Change change;
    @Getter
    private TaskStatus status = TaskStatus.UNCOMMITTED;
    private Throwable failure;
    @Getter
    private List<String> resultRefs = List.of();

    public ChangeTask(Change change) {
        this(UUID.randomUUID(), change);
    }

    public ChangeTask(UUID id, Change change) {
        this.id = Objects.requireNonNull(id, "id");
        this.change = Objects.requireNonNull(change, "change");
    }

    public Optional<Throwable> getFailure() {
        return Optional.ofNullable(failure);
    }

    public void markSubmitted() {
        transitionTo(TaskStatus.SUBMITTED);
    }

    public void markDone(List<String> resultRefs) {
        transitionTo(TaskStatus.DONE);
        this.resultRefs = List.copyOf(resultRefs);
    }

    public void markFailed(Throwable cause) {
        transitionTo(TaskStatus.FAILED);
        this.failure = cause;
    }

    private void transitionTo(TaskStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException("Task " + id + " cannot move from " + status + " to " + next);
        }
        status = next;
    }

    @Override
    public String toString() {
        return "ChangeTask(type=" + change.getClass().getSimpleName() + ", status=" + status + ", id=" + id + ")";
    }
}
