package fr.lapetina.ocr.scheduler.pipeline;

import fr.lapetina.ocr.scheduler.domain.exception.StorageException;
import fr.lapetina.ocr.scheduler.domain.exception.ValidationException;
import fr.lapetina.ocr.scheduler.domain.model.ErrorType;
import fr.lapetina.ocr.scheduler.domain.model.JobSource;
import fr.lapetina.ocr.scheduler.storage.JobPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.Locale;

/**
 * Places a job's input at {@link JobPaths#inputFile()} and enforces the size ceiling.
 *
 * Remote inputs are streamed chunk by chunk into a temp file beside the target;
 * the download aborts as soon as the ceiling is crossed.
 */
public final class InputMaterializer {

    private static final Logger log = LoggerFactory.getLogger(InputMaterializer.class);

    private final HttpClient httpClient;
    private final long maxBytes;
    private final int chunkBytes;
    private final Duration requestTimeout;

    public InputMaterializer(HttpClient httpClient, int maxUploadMb, int downloadChunkMb, Duration requestTimeout) {
        this.httpClient = httpClient;
        this.maxBytes = Math.max(1, maxUploadMb) * 1024L * 1024L;
        this.chunkBytes = Math.max(1, downloadChunkMb) * 1024 * 1024;
        this.requestTimeout = requestTimeout;
    }

    public InputMaterializer(int maxUploadMb, int downloadChunkMb, Duration requestTimeout) {
        this(HttpClient.newBuilder()
                        .connectTimeout(Duration.ofSeconds(10))
                        .followRedirects(HttpClient.Redirect.NORMAL)
                        .version(HttpClient.Version.HTTP_1_1)
                        .build(),
                maxUploadMb, downloadChunkMb, requestTimeout);
    }

    /**
     * Makes the input available locally.
     *
     * @return path of the local input file
     * @throws ValidationException with {@link ErrorType#SIZE_LIMIT} when the input is too large
     */
    public Path materialize(JobSource source, JobPaths paths) {
        Path input;
        if (source.remote()) {
            download(source.location(), paths.inputFile());
            input = paths.inputFile();
        } else {
            input = Path.of(source.location());
            if (!Files.isRegularFile(input)) {
                throw new ValidationException("Input file not found: " + input.getFileName());
            }
        }
        checkSize(input);
        return input;
    }

    private void checkSize(Path input) {
        try {
            long size = Files.size(input);
            if (size > maxBytes) {
                log.warn("Input rejected: sizeBytes={}, limitBytes={}", size, maxBytes);
                throw ValidationException.sizeLimit(maxBytes);
            }
        } catch (IOException e) {
            throw new StorageException("Cannot stat input " + input, e);
        }
    }

    private void download(String url, Path target) {
        URI uri = parse(url);
        HttpRequest request = HttpRequest.newBuilder(uri)
                .timeout(requestTimeout)
                .GET()
                .build();

        Path tmp = null;
        try {
            HttpResponse<InputStream> response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
            try (InputStream body = response.body()) {
                if (response.statusCode() / 100 != 2) {
                    throw new ValidationException(ErrorType.VALIDATION_ERROR,
                            "Download failed: HTTP " + response.statusCode());
                }
                long announced = response.headers().firstValueAsLong("Content-Length").orElse(-1L);
                if (announced > maxBytes) {
                    log.warn("Download rejected by Content-Length: url={}, contentLength={}, limitBytes={}",
                            uri.getHost(), announced, maxBytes);
                    throw ValidationException.sizeLimit(maxBytes);
                }

                Files.createDirectories(target.getParent());
                tmp = Files.createTempFile(target.getParent(), "download", ".part");
                long written = copyBounded(body, tmp);
                Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
                log.info("Input downloaded: host={}, bytes={}", uri.getHost(), written);
            }
        } catch (IOException e) {
            throw new ValidationException(ErrorType.VALIDATION_ERROR,
                    "Download failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ValidationException(ErrorType.VALIDATION_ERROR, "Download interrupted", e);
        } finally {
            deleteQuietly(tmp);
        }
    }

    private long copyBounded(InputStream body, Path tmp) throws IOException {
        byte[] buffer = new byte[Math.min(chunkBytes, 1024 * 1024)];
        long total = 0;
        try (OutputStream out = Files.newOutputStream(tmp)) {
            int read;
            while ((read = body.read(buffer)) != -1) {
                total += read;
                if (total > maxBytes) {
                    log.warn("Download aborted: size limit crossed, limitBytes={}", maxBytes);
                    throw ValidationException.sizeLimit(maxBytes);
                }
                out.write(buffer, 0, read);
            }
        }
        return total;
    }

    private static URI parse(String url) {
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                throw new ValidationException("Unsupported URL scheme: " + scheme);
            }
            return uri;
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorType.VALIDATION_ERROR, "Invalid URL: " + url, e);
        }
    }

    private static void deleteQuietly(Path tmp) {
        if (tmp == null) {
            return;
        }
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException e) {
            log.debug("Could not delete partial download: {}", tmp);
        }
    }
}
