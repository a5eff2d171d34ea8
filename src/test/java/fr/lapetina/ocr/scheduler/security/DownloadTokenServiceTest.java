package fr.lapetina.ocr.scheduler.security;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import fr.lapetina.ocr.scheduler.MutableClock;
import fr.lapetina.ocr.scheduler.domain.exception.PathViolationException;
import fr.lapetina.ocr.scheduler.domain.exception.TaskStateException;
import fr.lapetina.ocr.scheduler.domain.exception.ValidationException;
import fr.lapetina.ocr.scheduler.domain.model.JobStatus;
import fr.lapetina.ocr.scheduler.domain.model.TokenKind;
import fr.lapetina.ocr.scheduler.publish.InMemoryObjectStore;
import fr.lapetina.ocr.scheduler.publish.RemotePublisher;
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
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DownloadTokenServiceTest {

    @TempDir
    Path tempDir;

    private ObjectMapper mapper;
    private MutableClock clock;
    private JobStorage storage;

    @BeforeEach
    void setUp() {
        mapper = new ObjectMapper().registerModule(new JavaTimeModule());
        clock = new MutableClock();
        storage = new JobStorage(tempDir.resolve("jobs"), mapper);
    }

    private DownloadTokenService localService() {
        TokenStore store = new TokenStore(tempDir.resolve("tokens.json"), storage.getRoot(), mapper);
        return new DownloadTokenService(store, storage, null, 3, 600);
    }

    private JobPaths finishedJob(JobStatus status) throws IOException {
        return finishedJob(status, null);
    }

    private JobPaths finishedJob(JobStatus status, Map<String, String> published) throws IOException {
        JobPaths paths = storage.newJob("doc.pdf");
        Files.writeString(paths.markdownFile(), "# done");
        Files.write(paths.archiveFile(), new byte[]{'P', 'K'});
        Instant now = Instant.now();
        storage.saveStatus(paths, new JobStatusSnapshot(paths.taskId(), status, now, now, now, null, null, published));
        return paths;
    }

    @Test
    @DisplayName("should map token kinds to result artifacts")
    void shouldMapArtifacts() {
        JobPaths paths = JobPaths.of(tempDir.resolve("job"), "input.pdf");

        assertThat(DownloadTokenService.artifactOf(paths, TokenKind.MARKDOWN)).isEqualTo(paths.markdownFile());
        assertThat(DownloadTokenService.artifactOf(paths, TokenKind.JSON)).isEqualTo(paths.layoutFile());
        assertThat(DownloadTokenService.artifactOf(paths, TokenKind.ARCHIVE)).isEqualTo(paths.archiveFile());
    }

    @Test
    @DisplayName("should issue a token with configured defaults for a succeeded job")
    void shouldIssueWithDefaults() throws IOException {
        JobPaths paths = finishedJob(JobStatus.SUCCEEDED);
        DownloadTokenService service = localService();

        DownloadToken token = service.issue(paths.taskId(), TokenKind.ARCHIVE, null, null).orElseThrow();

        assertThat(token.maxDownloads()).isEqualTo(3);
        assertThat(token.remain()).isEqualTo(3);
        assertThat(token.filePath()).isEqualTo(paths.archiveFile().toString());
        assertThat(service.consume(token.token()).map(TokenGrant::localPath))
                .contains(paths.archiveFile().toAbsolutePath().normalize());
    }

    @Test
    @DisplayName("should return empty for an unknown job")
    void shouldReturnEmptyForUnknownJob() {
        assertThat(localService().issue(UUID.randomUUID().toString(), TokenKind.ARCHIVE, 1, 60L)).isEmpty();
    }

    @Test
    @DisplayName("should refuse tokens for jobs that did not succeed")
    void shouldRefuseUnfinishedJob() throws IOException {
        JobPaths paths = finishedJob(JobStatus.FAILED);

        assertThatThrownBy(() -> localService().issue(paths.taskId(), TokenKind.ARCHIVE, 1, 60L))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("failed");
    }

    @Test
    @DisplayName("should refuse tokens for artifacts that were not produced")
    void shouldRefuseMissingArtifact() throws IOException {
        JobPaths paths = finishedJob(JobStatus.SUCCEEDED);

        assertThatThrownBy(() -> localService().issue(paths.taskId(), TokenKind.JSON, 1, 60L))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("layout.json");
    }

    private DownloadTokenService remoteService(InMemoryObjectStore objects) {
        RemotePublisher publisher = new RemotePublisher(objects, "results", Duration.ofMinutes(5));
        TokenStore store = new TokenStore(tempDir.resolve("remote-tokens.json"), storage.getRoot(),
                DownloadToken.REMOTE, objects, Duration.ofMinutes(5), mapper, clock);
        return new DownloadTokenService(store, storage, publisher, 1, 60);
    }

    @Test
    @DisplayName("should point remote tokens at the published object key")
    void shouldUseObjectKeyForRemote() throws IOException {
        JobPaths paths = finishedJob(JobStatus.SUCCEEDED, Map.of("backend", DownloadToken.REMOTE));
        DownloadTokenService service = remoteService(new InMemoryObjectStore());

        DownloadToken token = service.issue(paths.taskId(), TokenKind.ARCHIVE, null, null).orElseThrow();

        assertThat(token.objectKey()).isEqualTo("results/" + paths.taskId() + "/result.zip");
        assertThat(service.consume(token.token()).map(TokenGrant::signedUrl))
                .contains("https://objects.test/results/" + paths.taskId() + "/result.zip?expires=300");
    }

    @Test
    @DisplayName("should refuse remote tokens until the results are published remotely")
    void shouldRefuseRemoteTokensBeforePublishing() throws IOException {
        DownloadTokenService service = remoteService(new InMemoryObjectStore());
        JobPaths unpublished = finishedJob(JobStatus.SUCCEEDED);
        JobPaths publishedLocally = finishedJob(JobStatus.SUCCEEDED, Map.of("backend", "local"));

        assertThatThrownBy(() -> service.issue(unpublished.taskId(), TokenKind.ARCHIVE, 1, 60L))
                .isInstanceOf(TaskStateException.class)
                .hasMessageContaining("not published");
        assertThatThrownBy(() -> service.issue(publishedLocally.taskId(), TokenKind.ARCHIVE, 1, 60L))
                .isInstanceOf(TaskStateException.class);
    }

    @Test
    @DisplayName("should resolve direct artifacts and guard image paths")
    void shouldResolveDirectDownloads() throws IOException {
        JobPaths paths = finishedJob(JobStatus.SUCCEEDED);
        Files.createDirectories(paths.imagesDir());
        Files.write(paths.imagesDir().resolve("page_0001_0.jpg"), new byte[]{1});
        DownloadTokenService service = localService();

        assertThat(service.artifact(paths.taskId(), TokenKind.MARKDOWN)).contains(paths.markdownFile());
        assertThat(service.artifact(paths.taskId(), TokenKind.JSON)).isEmpty();
        assertThat(service.image(paths.taskId(), "page_0001_0.jpg")).isPresent();
        assertThat(service.image(paths.taskId(), "missing.jpg")).isEmpty();
        assertThatThrownBy(() -> service.image(paths.taskId(), "../../job_status.json"))
                .isInstanceOf(PathViolationException.class);
    }
}
