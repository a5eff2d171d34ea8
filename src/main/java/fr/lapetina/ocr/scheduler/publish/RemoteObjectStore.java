package fr.lapetina.ocr.scheduler.publish;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Blob store that published results are uploaded to. Implemented outside this project
 * for a concrete provider.
 */
public interface RemoteObjectStore {

    void upload(String key, Path file, String contentType) throws IOException;

    /**
     * Returns a time-limited GET link for an object.
     */
    String sign(String key, Duration expiry);

    /**
     * Returns the provider's canonical location of a key, e.g. {@code s3://bucket/key}.
     */
    String locationOf(String key);
}
