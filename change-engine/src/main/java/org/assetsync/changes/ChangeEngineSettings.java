package org.assetsync.changes;

import java.time.Duration;

import org.assetsync.changes.polling.PollingSettings;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Endpoint paths and polling budgets used by the change engine.
 */
@Getter
@Builder(toBuilder = true)
@ToString
public class ChangeEngineSettings {
    public static final String DEFAULT_MOVE_PATH = "/fotoweb/me/background-tasks/";
    public static final String DEFAULT_UPLOADS_PATH = "/fotoweb/api/uploads";
    public static final String DEFAULT_RENDITION_SERVICE_PATH = "/fotoweb/services/renditions";

    @Builder.Default
    private final String movePath = DEFAULT_MOVE_PATH;
    @Builder.Default
    private final String uploadsPath = DEFAULT_UPLOADS_PATH;
    @Builder.Default
    private final String renditionServicePath = DEFAULT_RENDITION_SERVICE_PATH;

    /** Budget for {@code awaitCompletion}: one attempt is one reconciliation pass. */
    @Builder.Default
    private final PollingSettings statusPolling = PollingSettings.of(60, Duration.ofSeconds(5));
    /** Budget for waiting on a rendition to be produced. */
    @Builder.Default
    private final PollingSettings renditionPolling = PollingSettings.defaults();

    public static ChangeEngineSettings defaults() {
        return ChangeEngineSettings.builder().build();
    }

    public String uploadStatusLocation(String sessionId) {
        return uploadsPath + "/" + sessionId + "/status";
    }

    public String uploadChunkPath(String sessionId, int chunkIndex) {
        return uploadsPath + "/" + sessionId + "/chunks/" + chunkIndex;
    }
}
