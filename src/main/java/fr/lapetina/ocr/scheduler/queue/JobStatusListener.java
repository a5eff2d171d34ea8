package fr.lapetina.ocr.scheduler.queue;

import fr.lapetina.ocr.scheduler.domain.model.Job;
import fr.lapetina.ocr.scheduler.publish.PublishInfo;

/**
 * Listener notified by the job queue after each durable status change.
 */
@FunctionalInterface
public interface JobStatusListener {

    /**
     * Called once the job's current status has been written to its status file.
     *
     * @param job The job, already in its new state
     */
    void onStatusChanged(Job job);

    /**
     * Called after results of a succeeded job were published and recorded.
     */
    default void onPublished(Job job, PublishInfo info) {
    }

    /**
     * Called when publishing failed. The job stays succeeded.
     */
    default void onPublishFailed(Job job, Exception error) {
    }
}
