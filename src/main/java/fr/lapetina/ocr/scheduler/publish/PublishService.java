package fr.lapetina.ocr.scheduler.publish;

import fr.lapetina.ocr.scheduler.domain.exception.PublishException;
import fr.lapetina.ocr.scheduler.domain.exception.TaskStateException;
import fr.lapetina.ocr.scheduler.domain.model.JobStatus;
import fr.lapetina.ocr.scheduler.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.ocr.scheduler.security.PathGuard;
import fr.lapetina.ocr.scheduler.storage.JobPaths;
import fr.lapetina.ocr.scheduler.storage.JobStatusSnapshot;
import fr.lapetina.ocr.scheduler.storage.JobStorage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Optional;

/**
 * On-demand publishing of a finished job, for deployments without auto-publish
 * or to retry a publication that failed.
 */
public final class PublishService {

    private static final Logger log = LoggerFactory.getLogger(PublishService.class);

    private final Publisher publisher;
    private final JobStorage storage;
    private final MetricsRegistry metricsRegistry;

    public PublishService(Publisher publisher, JobStorage storage, MetricsRegistry metricsRegistry) {
        this.publisher = publisher;
        this.storage = storage;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Publishes a succeeded job and records the result in its status file.
     *
     * @return empty if the job is unknown
     * @throws TaskStateException if the job has not succeeded
     * @throws PublishException   if the backend refused the upload
     */
    public Optional<PublishInfo> publish(String taskId) {
        PathGuard.requireValidTaskId(taskId);
        Optional<JobStatusSnapshot> status = storage.loadStatus(taskId);
        if (status.isEmpty()) {
            return Optional.empty();
        }
        if (status.get().status() != JobStatus.SUCCEEDED) {
            throw new TaskStateException("Task has not succeeded: status=" + status.get().status().wireName());
        }

        JobPaths paths = storage.jobPaths(taskId);
        PublishInfo info;
        try {
            info = publisher.publish(taskId, paths);
        } catch (IOException e) {
            log.warn("Publishing failed: taskId={}, backend={}, error={}", taskId, publisher.backend(), e.getMessage());
            if (metricsRegistry != null) {
                metricsRegistry.incrementPublishFailed();
            }
            throw new PublishException("Cannot publish task " + taskId, e);
        }

        storage.saveStatus(paths, status.get().withPublished(info.toMap()));
        log.info("Job published on request: taskId={}, backend={}", taskId, info.backend());
        return Optional.of(info);
    }

    public String backend() {
        return publisher.backend();
    }
}
