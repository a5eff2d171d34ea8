package fr.lapetina.ocr.scheduler.security;

import fr.lapetina.ocr.scheduler.domain.exception.TaskStateException;
import fr.lapetina.ocr.scheduler.domain.exception.ValidationException;
import fr.lapetina.ocr.scheduler.domain.model.JobStatus;
import fr.lapetina.ocr.scheduler.domain.model.TokenKind;
import fr.lapetina.ocr.scheduler.publish.RemotePublisher;
import fr.lapetina.ocr.scheduler.storage.JobPaths;
import fr.lapetina.ocr.scheduler.storage.JobStatusSnapshot;
import fr.lapetina.ocr.scheduler.storage.JobStorage;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Issues download tokens for the artifacts of finished jobs and resolves artifacts
 * for direct download.
 *
 * Local tokens point at the artifact file; remote tokens at the object key the
 * publisher uploaded it under.
 */
public final class DownloadTokenService {

    private final TokenStore tokenStore;
    private final JobStorage storage;
    private final RemotePublisher remotePublisher;
    private final int defaultMaxDownloads;
    private final long defaultTtlSeconds;

    public DownloadTokenService(
            TokenStore tokenStore,
            JobStorage storage,
            RemotePublisher remotePublisher,
            int defaultMaxDownloads,
            long defaultTtlSeconds
    ) {
        this.tokenStore = tokenStore;
        this.storage = storage;
        this.remotePublisher = remotePublisher;
        this.defaultMaxDownloads = defaultMaxDownloads;
        this.defaultTtlSeconds = defaultTtlSeconds;
    }

    /**
     * Issues a token for one artifact of a succeeded job.
     *
     * @param maxDownloads null for the configured default
     * @param ttlSeconds   null for the configured default
     * @return empty if the job is unknown
     * @throws ValidationException if the job has not succeeded or the artifact is missing
     * @throws TaskStateException  for a remote token whose results were never published
     */
    public Optional<DownloadToken> issue(String taskId, TokenKind kind, Integer maxDownloads, Long ttlSeconds) {
        PathGuard.requireValidTaskId(taskId);
        Optional<JobStatusSnapshot> status = storage.loadStatus(taskId);
        if (status.isEmpty()) {
            return Optional.empty();
        }
        if (status.get().status() != JobStatus.SUCCEEDED) {
            throw new ValidationException("Task has not succeeded: status=" + status.get().status().wireName());
        }

        JobPaths paths = storage.jobPaths(taskId);
        Path artifact = artifactOf(paths, kind);
        if (!Files.isRegularFile(artifact)) {
            throw new ValidationException("Artifact not available: " + artifact.getFileName());
        }

        boolean remote = DownloadToken.REMOTE.equals(tokenStore.getBackend());
        if (remote && !isPublishedRemotely(status.get())) {
            throw new TaskStateException("Task results not published yet: taskId=" + taskId);
        }
        String locator = remote
                ? remotePublisher.objectKey(taskId, artifact.getFileName().toString())
                : artifact.toString();

        return Optional.of(tokenStore.createToken(
                taskId,
                kind,
                locator,
                maxDownloads != null ? maxDownloads : defaultMaxDownloads,
                ttlSeconds != null ? ttlSeconds : defaultTtlSeconds));
    }

    /**
     * Resolves an artifact for direct download.
     *
     * @return empty if the task or the artifact does not exist
     */
    public Optional<Path> artifact(String taskId, TokenKind kind) {
        Path artifact = artifactOf(storage.jobPaths(taskId), kind);
        return Files.isRegularFile(artifact) ? Optional.of(artifact) : Optional.empty();
    }

    /**
     * Resolves an extracted image of a task.
     *
     * @param relativePath path below the task's images directory
     * @return empty if no such image exists
     * @throws fr.lapetina.ocr.scheduler.domain.exception.PathViolationException if the path escapes the images directory
     */
    public Optional<Path> image(String taskId, String relativePath) {
        Path imagesDir = storage.jobPaths(taskId).imagesDir();
        Path image = PathGuard.requireUnder(imagesDir, imagesDir.resolve(relativePath));
        return Files.isRegularFile(image) ? Optional.of(image) : Optional.empty();
    }

    public Optional<TokenGrant> consume(String token) {
        return tokenStore.consume(token);
    }

    private static boolean isPublishedRemotely(JobStatusSnapshot status) {
        return status.published() != null && DownloadToken.REMOTE.equals(status.published().get("backend"));
    }

    static Path artifactOf(JobPaths paths, TokenKind kind) {
        return switch (kind) {
            case MARKDOWN -> paths.markdownFile();
            case JSON -> paths.layoutFile();
            case ARCHIVE -> paths.archiveFile();
        };
    }
}
