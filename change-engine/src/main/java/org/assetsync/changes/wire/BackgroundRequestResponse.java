package org.assetsync.changes.wire;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Answer to a background-task (move) request.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BackgroundRequestResponse(
    String location,
    Integer maxInterval,
    String status
) {}
