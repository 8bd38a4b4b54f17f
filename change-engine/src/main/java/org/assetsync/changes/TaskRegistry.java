package org.assetsync.changes;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

import org.assetsync.changes.model.BackgroundTaskHandle;
import org.assetsync.changes.model.ChangeTask;
import org.assetsync.changes.model.TaskStatus;

import lombok.extern.slf4j.Slf4j;

/**
 * Owns the tasks of one commit session, in insertion order, and the handles of their background jobs.
 * Not thread-safe: registry mutation must not overlap a commit or reconciliation pass.
 */
@Slf4j
public class TaskRegistry {
    private final Map<UUID, ChangeTask> tasks = new LinkedHashMap<>();
    private final Map<UUID, BackgroundTaskHandle> handles = new HashMap<>();

    /**
     * @return false if a task with the same id is already registered; the registered one is kept
     */
    public boolean addTask(ChangeTask task) {
        if (tasks.putIfAbsent(task.getId(), task) != null) {
            log.debug("Ignoring {}, a task with that id is already registered", task);
            return false;
        }
        return true;
    }

    public Optional<ChangeTask> getTask(UUID id) {
        return Optional.ofNullable(tasks.get(id));
    }

    /**
     * A snapshot of the tasks currently in {@code status}, in insertion order.
     */
    public List<ChangeTask> tasksByStatus(TaskStatus status) {
        return tasks.values().stream()
            .filter(task -> task.getStatus() == status)
            .collect(Collectors.toList());
    }

    public boolean hasTasksWithStatus(TaskStatus status) {
        return tasks.values().stream().anyMatch(task -> task.getStatus() == status);
    }

    public List<ChangeTask> allTasks() {
        return new ArrayList<>(tasks.values());
    }

    public int size() {
        return tasks.size();
    }

    /**
     * Forgets a task and its handle. Removing a submitted task does not cancel its remote job.
     */
    public Optional<ChangeTask> removeTask(UUID id) {
        handles.remove(id);
        return Optional.ofNullable(tasks.remove(id));
    }

    public void recordHandle(BackgroundTaskHandle handle) {
        if (!tasks.containsKey(handle.taskId())) {
            throw new IllegalArgumentException("No task registered with id " + handle.taskId());
        }
        if (handles.putIfAbsent(handle.taskId(), handle) != null) {
            throw new IllegalStateException("Task " + handle.taskId() + " already has a background job");
        }
    }

    public Optional<BackgroundTaskHandle> getHandle(UUID taskId) {
        return Optional.ofNullable(handles.get(taskId));
    }

    public void removeHandle(UUID taskId) {
        handles.remove(taskId);
    }
}
