package fr.lapetina.ocr.scheduler.storage;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ocr.scheduler.domain.model.ErrorType;
import fr.lapetina.ocr.scheduler.domain.model.JobStatus;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Durable job status, one JSON object per job root.
 * The six core fields are always written (null until reached); the error kind
 * and publish info only when present.
 */
public record JobStatusSnapshot(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") JobStatus status,
        @JsonProperty("queued_at") Instant queuedAt,
        @JsonProperty("started_at") Instant startedAt,
        @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("message") String message,
        @JsonProperty("error_kind") @JsonInclude(JsonInclude.Include.NON_NULL) ErrorType errorKind,
        @JsonProperty("published") @JsonInclude(JsonInclude.Include.NON_NULL) Map<String, String> published
) {

    /**
     * Same status with the given publish info.
     */
    public JobStatusSnapshot withPublished(Map<String, String> publishInfo) {
        return new JobStatusSnapshot(taskId, status, queuedAt, startedAt, finishedAt, message, errorKind,
                publishInfo != null ? Collections.unmodifiableMap(new LinkedHashMap<>(publishInfo)) : null);
    }
}
