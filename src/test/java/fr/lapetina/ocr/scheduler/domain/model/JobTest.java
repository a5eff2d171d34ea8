package fr.lapetina.ocr.scheduler.domain.model;

import fr.lapetina.ocr.scheduler.storage.JobPaths;
import fr.lapetina.ocr.scheduler.storage.JobStatusSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JobTest {

    private static final String TASK_ID = "0f8fad5b-d9cb-469f-a165-70867728950e";

    private Job job;

    @BeforeEach
    void setUp() {
        JobPaths paths = JobPaths.of(Path.of("jobs", TASK_ID), "input.pdf");
        job = new Job(TASK_ID, JobSource.local(paths.inputFile().toString()), paths, null);
    }

    @Test
    @DisplayName("should start queued with default options")
    void shouldStartQueued() {
        assertThat(job.getStatus()).isEqualTo(JobStatus.QUEUED);
        assertThat(job.getOptions()).isEqualTo(JobOptions.defaults());
        assertThat(job.getStartedAt()).isNull();
        assertThat(job.completion()).isNotDone();
    }

    @Test
    @DisplayName("should move forward with monotonic timestamps")
    void shouldTransitionForward() {
        job.markProcessing();
        job.markSucceeded();

        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(job.getStartedAt()).isAfterOrEqualTo(job.getQueuedAt());
        assertThat(job.getFinishedAt()).isAfterOrEqualTo(job.getStartedAt());
    }

    @Test
    @DisplayName("should record failure kind and message")
    void shouldRecordFailure() {
        job.markProcessing();
        job.markFailed(ErrorType.PAGE_LIMIT, "Too many pages");

        JobStatusSnapshot snapshot = job.toSnapshot();
        assertThat(snapshot.status()).isEqualTo(JobStatus.FAILED);
        assertThat(snapshot.errorKind()).isEqualTo(ErrorType.PAGE_LIMIT);
        assertThat(snapshot.message()).isEqualTo("Too many pages");
    }

    @Test
    @DisplayName("should default the failure kind to internal error")
    void shouldDefaultFailureKind() {
        assertThatThrownBy(() -> job.markSucceeded()).isInstanceOf(IllegalStateException.class);

        job.markProcessing();
        job.markFailed(null, "lost");

        assertThat(job.getErrorType()).isEqualTo(ErrorType.INTERNAL_ERROR);
    }

    @Test
    @DisplayName("should reject backward or repeated transitions")
    void shouldRejectIllegalTransitions() {
        job.markProcessing();
        job.markSucceeded();

        assertThatThrownBy(() -> job.markFailed(ErrorType.ENGINE_ERROR, "late"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("SUCCEEDED -> FAILED");
        assertThatThrownBy(() -> job.markProcessing())
                .isInstanceOf(IllegalStateException.class);
        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
    }

    @Test
    @DisplayName("should complete only when signalled after a terminal status")
    void shouldSignalCompletion() {
        job.markProcessing();
        assertThatThrownBy(() -> job.signalCompletion()).isInstanceOf(IllegalStateException.class);

        job.markSucceeded();
        assertThat(job.completion()).isNotDone();

        job.signalCompletion();
        assertThat(job.completion()).isCompletedWithValue(job);
    }

    @Test
    @DisplayName("should keep publish info without changing status")
    void shouldKeepPublishInfo() {
        job.markProcessing();
        job.markSucceeded();
        job.setPublished(Map.of("backend", "local"));

        assertThat(job.getStatus()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(job.toSnapshot().published()).containsEntry("backend", "local");
    }

    @Test
    @DisplayName("should clamp timestamps to the queue time")
    void shouldNeverStartBeforeQueued() {
        JobPaths paths = JobPaths.of(Path.of("jobs", TASK_ID), "input.pdf");
        Job future = new Job(TASK_ID, JobSource.remote("https://example.com/a.pdf"), paths,
                JobOptions.defaults(), Instant.now().plusSeconds(3600));

        future.markProcessing();
        future.markFailed(ErrorType.TIMEOUT, "slow");

        assertThat(future.getStartedAt()).isEqualTo(future.getQueuedAt());
        assertThat(future.getFinishedAt()).isEqualTo(future.getQueuedAt());
    }
}
