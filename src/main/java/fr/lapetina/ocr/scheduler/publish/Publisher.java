package fr.lapetina.ocr.scheduler.publish;

import fr.lapetina.ocr.scheduler.storage.JobPaths;

import java.io.IOException;

/**
 * Makes a finished job's artifacts reachable outside the service.
 */
public interface Publisher {

    PublishInfo publish(String taskId, JobPaths paths) throws IOException;

    String backend();
}
