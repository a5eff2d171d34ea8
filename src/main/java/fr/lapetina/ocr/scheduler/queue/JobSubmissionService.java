package fr.lapetina.ocr.scheduler.queue;

import fr.lapetina.ocr.scheduler.domain.exception.BackpressureException;
import fr.lapetina.ocr.scheduler.domain.exception.StorageException;
import fr.lapetina.ocr.scheduler.domain.exception.TaskStateException;
import fr.lapetina.ocr.scheduler.domain.exception.ValidationException;
import fr.lapetina.ocr.scheduler.domain.model.ErrorType;
import fr.lapetina.ocr.scheduler.domain.model.Job;
import fr.lapetina.ocr.scheduler.domain.model.JobOptions;
import fr.lapetina.ocr.scheduler.domain.model.JobSource;
import fr.lapetina.ocr.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ocr.scheduler.security.PathGuard;
import fr.lapetina.ocr.scheduler.storage.JobPaths;
import fr.lapetina.ocr.scheduler.storage.JobStatusSnapshot;
import fr.lapetina.ocr.scheduler.storage.JobStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Entry point for new jobs: allocates the job directory, stores uploads and
 * hands the job to the queue.
 *
 * A rejected submission leaves nothing behind: the job is untracked and its
 * directory deleted before the rejection is reported.
 */
public final class JobSubmissionService {

    private static final Logger log = LoggerFactory.getLogger(JobSubmissionService.class);

    private static final int COPY_BUFFER = 64 * 1024;

    private final JobQueue jobQueue;
    private final JobStorage storage;
    private final MetricsRegistry metricsRegistry;
    private final long maxUploadBytes;

    public JobSubmissionService(JobQueue jobQueue, JobStorage storage, MetricsRegistry metricsRegistry, int maxUploadMb) {
        this.jobQueue = jobQueue;
        this.storage = storage;
        this.metricsRegistry = metricsRegistry;
        this.maxUploadBytes = Math.max(1, maxUploadMb) * 1024L * 1024L;
    }

    /**
     * Queues a job whose input is downloaded by the worker.
     *
     * @throws ValidationException   if the URL is not http(s)
     * @throws BackpressureException if the queue is full
     */
    public Job submitRemote(String url, JobOptions options) {
        URI uri = requireHttpUrl(url);
        JobPaths paths = storage.newJob(fileNameOf(uri));
        return enqueue(new Job(paths.taskId(), JobSource.remote(uri.toString()), paths, options), paths);
    }

    /**
     * Stores an uploaded document in a fresh job directory and queues it.
     *
     * @throws ValidationException   if the upload exceeds the size limit
     * @throws BackpressureException if the queue is full
     */
    public Job submitUpload(InputStream content, String filename, JobOptions options) {
        JobPaths paths = storage.newJob(filename);
        try {
            long size = copyBounded(content, paths.inputFile());
            log.debug("Upload stored: taskId={}, sizeBytes={}", paths.taskId(), size);
        } catch (ValidationException e) {
            reject(paths, e.getErrorType());
            throw e;
        } catch (IOException e) {
            discardQuietly(paths);
            throw new StorageException("Cannot store upload for job " + paths.taskId(), e);
        }
        return enqueue(localJob(paths, options), paths);
    }

    /**
     * Queues a document already on disk by copying it into a fresh job directory.
     */
    public Job submitLocal(Path file, JobOptions options) {
        if (!Files.isRegularFile(file)) {
            throw new ValidationException("Input file not found: " + file.getFileName());
        }
        try (InputStream in = Files.newInputStream(file)) {
            return submitUpload(in, file.getFileName().toString(), options);
        } catch (IOException e) {
            throw new ValidationException(ErrorType.VALIDATION_ERROR, "Cannot read input file: " + file.getFileName(), e);
        }
    }

    /**
     * Current status of a job: live state while tracked, else the status file on disk.
     *
     * @throws fr.lapetina.ocr.scheduler.domain.exception.PathViolationException if the id is not a UUID
     */
    public Optional<JobStatusSnapshot> status(String taskId) {
        PathGuard.requireValidTaskId(taskId);
        Optional<Job> live = jobQueue.get(taskId);
        if (live.isPresent()) {
            return Optional.of(live.get().toSnapshot());
        }
        return storage.loadStatus(taskId);
    }

    /**
     * Removes a task's directory and every artifact in it. Never interrupts a running job.
     *
     * @return false if the task does not exist
     * @throws TaskStateException if the task is still queued or processing
     */
    public boolean delete(String taskId) {
        PathGuard.requireValidTaskId(taskId);
        Optional<Job> live = jobQueue.get(taskId);
        if (live.isPresent() && !live.get().getStatus().isTerminal()) {
            throw new TaskStateException("Task is still " + live.get().getStatus().wireName() + ": taskId=" + taskId);
        }
        JobPaths paths = storage.jobPaths(taskId);
        if (!Files.isDirectory(paths.root())) {
            return false;
        }
        storage.discard(paths);
        log.info("Task deleted: taskId={}", taskId);
        return true;
    }

    private Job localJob(JobPaths paths, JobOptions options) {
        return new Job(paths.taskId(), JobSource.local(paths.inputFile().toString()), paths, options);
    }

    private Job enqueue(Job job, JobPaths paths) {
        boolean accepted;
        try {
            accepted = jobQueue.submit(job);
        } catch (RuntimeException e) {
            discardQuietly(paths);
            throw e;
        }
        if (!accepted) {
            reject(paths, ErrorType.QUEUE_FULL);
            throw new BackpressureException(BackpressureException.BackpressureReason.QUEUE_FULL,
                    "capacity " + jobQueue.queueCapacity());
        }
        return job;
    }

    private void reject(JobPaths paths, ErrorType reason) {
        discardQuietly(paths);
        if (metricsRegistry != null) {
            metricsRegistry.incrementRejected(reason);
        }
        log.warn("Submission rejected: taskId={}, reason={}", paths.taskId(), reason);
    }

    private void discardQuietly(JobPaths paths) {
        try {
            storage.discard(paths);
        } catch (StorageException e) {
            log.warn("Could not discard rejected job directory: taskId={}", paths.taskId(), e);
        }
    }

    private long copyBounded(InputStream content, Path target) throws IOException {
        byte[] buffer = new byte[COPY_BUFFER];
        long total = 0;
        try (OutputStream out = Files.newOutputStream(target)) {
            int read;
            while ((read = content.read(buffer)) != -1) {
                total += read;
                if (total > maxUploadBytes) {
                    throw ValidationException.sizeLimit(maxUploadBytes);
                }
                out.write(buffer, 0, read);
            }
        }
        return total;
    }

    private static URI requireHttpUrl(String url) {
        if (url == null || url.isBlank()) {
            throw new ValidationException("A source URL or an uploaded file is required");
        }
        try {
            URI uri = URI.create(url.trim());
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new ValidationException("Unsupported URL scheme: " + scheme);
            }
            if (uri.getHost() == null) {
                throw new ValidationException("URL has no host: " + url);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorType.VALIDATION_ERROR, "Invalid URL: " + url, e);
        }
    }

    private static String fileNameOf(URI uri) {
        String path = uri.getPath();
        if (path == null || path.isEmpty()) {
            return null;
        }
        return PathGuard.baseName(path);
    }
}
