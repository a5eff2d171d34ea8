package fr.lapetina.ocr.scheduler.queue;

import fr.lapetina.ocr.scheduler.domain.model.Job;

/**
 * Work performed by a queue worker for one job.
 *
 * Returning normally means the job succeeded; any exception fails it.
 */
@FunctionalInterface
public interface JobProcessor {

    void process(Job job) throws Exception;
}
