package fr.lapetina.ocr.scheduler.publish;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Object store keeping uploads in memory.
 */
public final class InMemoryObjectStore implements RemoteObjectStore {

    private final Map<String, byte[]> objects = new ConcurrentHashMap<>();
    private final Map<String, String> contentTypes = new ConcurrentHashMap<>();
    private volatile boolean failUploads;

    public void failUploads(boolean fail) {
        this.failUploads = fail;
    }

    @Override
    public void upload(String key, Path file, String contentType) throws IOException {
        if (failUploads) {
            throw new IOException("bucket unreachable");
        }
        objects.put(key, Files.readAllBytes(file));
        if (contentType != null) {
            contentTypes.put(key, contentType);
        }
    }

    @Override
    public String sign(String key, Duration expiry) {
        return "https://objects.test/" + key + "?expires=" + expiry.getSeconds();
    }

    @Override
    public String locationOf(String key) {
        return "mem://bucket/" + key;
    }

    public Map<String, byte[]> getObjects() {
        return objects;
    }

    public String contentTypeOf(String key) {
        return contentTypes.get(key);
    }
}
