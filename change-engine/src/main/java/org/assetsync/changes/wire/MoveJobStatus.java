package org.assetsync.changes.wire;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Status document of a move background task, as served at its status location.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MoveJobStatus(TaskInfo task, JobInfo job) {

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record TaskInfo(String status, String type, String created, String modified, String id) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JobInfo(String status, Integer updates, List<JobResult> result) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record JobResult(
        String href,
        Boolean done,
        @JsonProperty("result-href") String resultHref,
        @JsonProperty("result-filename") String resultFilename,
        @JsonProperty("original-removed") Boolean originalRemoved
    ) {}

    public RemoteJobState state() {
        return RemoteJobState.fromWire(task == null ? null : task.status());
    }

    public List<String> resultRefs() {
        if (job == null || job.result() == null) {
            return List.of();
        }
        return job.result().stream()
            .map(JobResult::resultHref)
            .filter(Objects::nonNull)
            .collect(Collectors.toList());
    }
}
