package fr.lapetina.ocr.scheduler.domain.model;

import fr.lapetina.ocr.scheduler.storage.JobPaths;
import fr.lapetina.ocr.scheduler.storage.JobStatusSnapshot;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * One submitted document-conversion request.
 *
 * Created by the submission path, mutated only by the worker that dequeued it,
 * read by status queries. All state access is synchronized so readers always see
 * a consistent snapshot; transitions are validated against {@link JobStatus#canTransitionTo}.
 */
public final class Job {

    private final String taskId;
    private final JobSource source;
    private final JobPaths paths;
    private final JobOptions options;
    private final Instant queuedAt;
    private final CompletableFuture<Job> completion = new CompletableFuture<>();

    private JobStatus status = JobStatus.QUEUED;
    private Instant startedAt;
    private Instant finishedAt;
    private String message;
    private ErrorType errorType;
    private Map<String, String> published;

    public Job(String taskId, JobSource source, JobPaths paths, JobOptions options) {
        this(taskId, source, paths, options, Instant.now());
    }

    public Job(String taskId, JobSource source, JobPaths paths, JobOptions options, Instant queuedAt) {
        this.taskId = Objects.requireNonNull(taskId, "Task ID is required");
        this.source = Objects.requireNonNull(source, "Source is required");
        this.paths = Objects.requireNonNull(paths, "Job paths are required");
        this.options = options != null ? options : JobOptions.defaults();
        this.queuedAt = Objects.requireNonNull(queuedAt, "Queued timestamp is required");
    }

    public String getTaskId() {
        return taskId;
    }

    public JobSource getSource() {
        return source;
    }

    public JobPaths getPaths() {
        return paths;
    }

    public JobOptions getOptions() {
        return options;
    }

    public Instant getQueuedAt() {
        return queuedAt;
    }

    public synchronized JobStatus getStatus() {
        return status;
    }

    public synchronized Instant getStartedAt() {
        return startedAt;
    }

    public synchronized Instant getFinishedAt() {
        return finishedAt;
    }

    public synchronized String getMessage() {
        return message;
    }

    public synchronized ErrorType getErrorType() {
        return errorType;
    }

    public synchronized Map<String, String> getPublished() {
        return published;
    }

    /**
     * Future completed with this job once its terminal status is durable.
     */
    public CompletableFuture<Job> completion() {
        return completion;
    }

    public synchronized void markProcessing() {
        transition(JobStatus.PROCESSING);
        startedAt = laterOf(queuedAt, Instant.now());
    }

    public synchronized void markSucceeded() {
        transition(JobStatus.SUCCEEDED);
        finishedAt = laterOf(startedAt, Instant.now());
    }

    public synchronized void markFailed(ErrorType type, String failureMessage) {
        transition(JobStatus.FAILED);
        errorType = type != null ? type : ErrorType.INTERNAL_ERROR;
        message = failureMessage;
        finishedAt = laterOf(startedAt != null ? startedAt : queuedAt, Instant.now());
    }

    /**
     * Completes {@link #completion()} once the terminal status has been persisted.
     *
     * @throws IllegalStateException if the job is not terminal yet
     */
    public void signalCompletion() {
        if (!getStatus().isTerminal()) {
            throw new IllegalStateException("Job not finished: taskId=" + taskId);
        }
        completion.complete(this);
    }

    /**
     * Records where results were published. Does not affect the status.
     */
    public synchronized void setPublished(Map<String, String> publishInfo) {
        this.published = publishInfo != null ? Map.copyOf(publishInfo) : null;
    }

    /**
     * Returns the durable status-file view of this job.
     */
    public synchronized JobStatusSnapshot toSnapshot() {
        return new JobStatusSnapshot(
                taskId,
                status,
                queuedAt,
                startedAt,
                finishedAt,
                message,
                errorType,
                published
        );
    }

    private void transition(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal job transition: taskId=" + taskId + ", " + status + " -> " + next);
        }
        status = next;
    }

    private static Instant laterOf(Instant floor, Instant candidate) {
        if (floor == null || candidate.isAfter(floor)) {
            return candidate;
        }
        return floor;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Job that = (Job) o;
        return taskId.equals(that.taskId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(taskId);
    }

    @Override
    public synchronized String toString() {
        return "Job{" +
                "taskId='" + taskId + '\'' +
                ", status=" + status +
                ", remote=" + source.remote() +
                '}';
    }
}
