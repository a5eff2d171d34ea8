package fr.lapetina.ocr.scheduler.publish;

import fr.lapetina.ocr.scheduler.storage.JobPaths;

/**
 * Results stay in job storage; links point back at the service's own routes.
 */
public final class LocalPublisher implements Publisher {

    @Override
    public PublishInfo publish(String taskId, JobPaths paths) {
        String base = "/v1/tasks/" + taskId;
        return new PublishInfo(
                backend(),
                base + "/result.md",
                base + "/result.json",
                base + "/download.zip",
                base + "/result-images"
        );
    }

    @Override
    public String backend() {
        return "local";
    }
}
