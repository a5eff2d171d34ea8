package fr.lapetina.ocr.scheduler.publish;

import fr.lapetina.ocr.scheduler.domain.model.TokenKind;
import fr.lapetina.ocr.scheduler.storage.JobPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URLConnection;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.stream.Stream;

/**
 * Uploads a job's artifacts under {@code <prefix>/<taskId>/} and returns signed links.
 */
public final class RemotePublisher implements Publisher {

    private static final Logger log = LoggerFactory.getLogger(RemotePublisher.class);

    private final RemoteObjectStore store;
    private final String prefix;
    private final Duration signExpiry;

    public RemotePublisher(RemoteObjectStore store, String prefix, Duration signExpiry) {
        this.store = store;
        this.prefix = trimTrailingSlash(prefix);
        this.signExpiry = signExpiry;
    }

    @Override
    public PublishInfo publish(String taskId, JobPaths paths) throws IOException {
        String jobPrefix = objectPrefix(taskId);

        String markdownUrl = uploadAndSign(paths.markdownFile(), jobPrefix + "/" + JobPaths.MARKDOWN_FILE,
                TokenKind.MARKDOWN.contentType());
        String jsonUrl = uploadAndSign(paths.layoutFile(), jobPrefix + "/" + JobPaths.LAYOUT_FILE,
                TokenKind.JSON.contentType());
        String archiveUrl = uploadAndSign(paths.archiveFile(), jobPrefix + "/" + JobPaths.ARCHIVE_FILE,
                TokenKind.ARCHIVE.contentType());

        int images = 0;
        if (Files.isDirectory(paths.imagesDir())) {
            List<Path> files;
            try (Stream<Path> walk = Files.walk(paths.imagesDir())) {
                files = walk.filter(Files::isRegularFile).toList();
            }
            for (Path image : files) {
                String rel = paths.outputDir().relativize(image).toString().replace('\\', '/');
                store.upload(jobPrefix + "/" + rel, image,
                        URLConnection.guessContentTypeFromName(image.getFileName().toString()));
                images++;
            }
        }

        log.info("Results published: taskId={}, prefix={}, images={}", taskId, jobPrefix, images);
        return new PublishInfo(
                backend(),
                markdownUrl,
                jsonUrl,
                archiveUrl,
                store.locationOf(jobPrefix + "/" + JobPaths.IMAGES_DIR + "/")
        );
    }

    /**
     * Object key under which a job artifact is published.
     */
    public String objectKey(String taskId, String fileName) {
        return objectPrefix(taskId) + "/" + fileName;
    }

    private String objectPrefix(String taskId) {
        return prefix.isEmpty() ? taskId : prefix + "/" + taskId;
    }

    private String uploadAndSign(Path file, String key, String contentType) throws IOException {
        if (!Files.exists(file)) {
            return "";
        }
        store.upload(key, file, contentType);
        return store.sign(key, signExpiry);
    }

    @Override
    public String backend() {
        return "remote";
    }

    private static String trimTrailingSlash(String value) {
        String trimmed = value == null ? "" : value.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
