package fr.lapetina.ocr.scheduler.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import fr.lapetina.ocr.scheduler.domain.model.Job;
import fr.lapetina.ocr.scheduler.domain.model.JobStatus;

/**
 * Acknowledgement of an accepted submission.
 */
public record TaskResponse(
        @JsonProperty("task_id") String taskId,
        @JsonProperty("status") JobStatus status
) {

    public static TaskResponse of(Job job) {
        return new TaskResponse(job.getTaskId(), job.getStatus());
    }
}
