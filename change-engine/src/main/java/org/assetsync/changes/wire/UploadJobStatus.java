package org.assetsync.changes.wire;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Status document of an upload session.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadJobStatus(String status, Result result, JobError error) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Result(String assetUrl, String assetDetails) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JobError(String value, String message) {}

    public RemoteJobState state() {
        return RemoteJobState.fromWire(status);
    }

    public List<String> resultRefs() {
        if (result == null || result.assetUrl() == null) {
            return List.of();
        }
        return List.of(result.assetUrl());
    }

    public String errorDescription() {
        if (error == null) {
            return "upload job failed";
        }
        return error.message() != null ? error.message() : error.value();
    }
}
