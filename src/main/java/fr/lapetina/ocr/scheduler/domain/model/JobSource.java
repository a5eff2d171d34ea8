package fr.lapetina.ocr.scheduler.domain.model;

import java.util.Objects;

/**
 * Where a job's input comes from: a file already placed in job storage,
 * or a remote URL that the pipeline downloads first.
 */
public record JobSource(String location, boolean remote) {

    public JobSource {
        Objects.requireNonNull(location, "Location is required");
    }

    public static JobSource local(String path) {
        return new JobSource(path, false);
    }

    public static JobSource remote(String url) {
        return new JobSource(url, true);
    }
}
