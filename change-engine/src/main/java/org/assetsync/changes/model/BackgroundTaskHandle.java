package org.assetsync.changes.model;

import java.util.Objects;
import java.util.UUID;

/**
 * Where the progress of a submitted move or upload job can be polled.
 */
public record BackgroundTaskHandle(UUID taskId, String statusLocation) {
    public BackgroundTaskHandle {
        Objects.requireNonNull(taskId, "taskId");
        if (statusLocation == null || statusLocation.isBlank()) {
            throw new IllegalArgumentException("statusLocation must not be blank");
        }
    }
}
