package fr.lapetina.ocr.scheduler.publish;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.ocr.scheduler.domain.exception.PathViolationException;
import fr.lapetina.ocr.scheduler.domain.exception.PublishException;
import fr.lapetina.ocr.scheduler.domain.exception.TaskStateException;
import fr.lapetina.ocr.scheduler.domain.model.JobStatus;
import fr.lapetina.ocr.scheduler.storage.JobPaths;
import fr.lapetina.ocr.scheduler.storage.JobStatusSnapshot;
import fr.lapetina.ocr.scheduler.storage.JobStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class PublishServiceTest {

    @TempDir
    Path tempDir;

    private JobStorage storage;

    @BeforeEach
    void setUp() {
        storage = new JobStorage(tempDir.resolve("jobs"), new ObjectMapper().registerModule(new JavaTimeModule()));
    }

    private JobPaths finishedJob(JobStatus status) throws IOException {
        JobPaths paths = storage.newJob("doc.pdf");
        Files.writeString(paths.markdownFile(), "# done");
        Files.writeString(paths.layoutFile(), "{\"pages\":[]}");
        Instant now = Instant.now();
        storage.saveStatus(paths, new JobStatusSnapshot(paths.taskId(), status, now, now, now, "done", null, null));
        return paths;
    }

    @Test
    @DisplayName("should record local publish info in the status file")
    void shouldRecordLocalPublishInfo() throws IOException {
        JobPaths paths = finishedJob(JobStatus.SUCCEEDED);
        PublishService service = new PublishService(new LocalPublisher(), storage, null);

        PublishInfo info = service.publish(paths.taskId()).orElseThrow();

        assertThat(info.markdownUrl()).isEqualTo("/v1/tasks/" + paths.taskId() + "/result.md");
        JobStatusSnapshot saved = storage.loadStatus(paths.taskId()).orElseThrow();
        assertThat(saved.status()).isEqualTo(JobStatus.SUCCEEDED);
        assertThat(saved.message()).isEqualTo("done");
        assertThat(saved.published())
                .containsEntry("backend", "local")
                .containsEntry("zip_url", "/v1/tasks/" + paths.taskId() + "/download.zip");
    }

    @Test
    @DisplayName("should upload to the object store and record the remote backend")
    void shouldPublishRemotely() throws IOException {
        JobPaths paths = finishedJob(JobStatus.SUCCEEDED);
        InMemoryObjectStore objects = new InMemoryObjectStore();
        PublishService service = new PublishService(
                new RemotePublisher(objects, "results", Duration.ofMinutes(5)), storage, null);

        service.publish(paths.taskId());

        assertThat(objects.getObjects()).containsKey("results/" + paths.taskId() + "/full.md");
        assertThat(storage.loadStatus(paths.taskId()).orElseThrow().published())
                .containsEntry("backend", "remote");
        assertThat(service.backend()).isEqualTo("remote");
    }

    @Test
    @DisplayName("should return empty for an unknown task")
    void shouldReturnEmptyForUnknownTask() {
        PublishService service = new PublishService(new LocalPublisher(), storage, null);

        assertThat(service.publish(UUID.randomUUID().toString())).isEmpty();
        assertThatThrownBy(() -> service.publish("../etc"))
                .isInstanceOf(PathViolationException.class);
    }

    @Test
    @DisplayName("should refuse to publish a task that has not succeeded")
    void shouldRefuseUnfinishedTask() throws IOException {
        JobPaths paths = finishedJob(JobStatus.PROCESSING);
        PublishService service = new PublishService(new LocalPublisher(), storage, null);

        assertThatThrownBy(() -> service.publish(paths.taskId()))
                .isInstanceOf(TaskStateException.class)
                .hasMessageContaining("processing");
    }

    @Test
    @DisplayName("should surface upload failures and leave the status untouched")
    void shouldSurfaceUploadFailure() throws IOException {
        JobPaths paths = finishedJob(JobStatus.SUCCEEDED);
        InMemoryObjectStore objects = new InMemoryObjectStore();
        objects.failUploads(true);
        PublishService service = new PublishService(
                new RemotePublisher(objects, "results", Duration.ofMinutes(5)), storage, null);

        assertThatThrownBy(() -> service.publish(paths.taskId()))
                .isInstanceOf(PublishException.class)
                .hasMessageContaining("bucket unreachable");
        assertThat(storage.loadStatus(paths.taskId()).orElseThrow().published()).isNull();
    }
}
