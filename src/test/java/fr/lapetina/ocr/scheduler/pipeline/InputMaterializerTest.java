package fr.lapetina.ocr.scheduler.pipeline;

import com.sun.net.httpserver.HttpServer;
import fr.lapetina.ocr.scheduler.domain.exception.ValidationException;
import fr.lapetina.ocr.scheduler.domain.model.ErrorType;
import fr.lapetina.ocr.scheduler.domain.model.JobSource;
import fr.lapetina.ocr.scheduler.storage.JobPaths;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InputMaterializerTest {

    private static final int ONE_MB = 1024 * 1024;

    @TempDir
    Path tempDir;

    private HttpServer server;
    private String baseUrl;
    private JobPaths paths;
    private InputMaterializer materializer;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/doc.pdf", exchange -> {
            byte[] body = "%PDF-1.4 small".getBytes();
            exchange.sendResponseHeaders(200, body.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(body);
            }
        });
        server.createContext("/huge.pdf", exchange -> {
            // chunked, so only the streamed byte count can trip the limit
            exchange.sendResponseHeaders(200, 0);
            try (OutputStream out = exchange.getResponseBody()) {
                byte[] chunk = new byte[64 * 1024];
                for (int i = 0; i < 40; i++) {
                    out.write(chunk);
                }
            } catch (IOException e) {
                // client hung up after the limit
            }
        });
        server.createContext("/announced.pdf", exchange -> {
            exchange.sendResponseHeaders(200, 2L * ONE_MB);
            exchange.close();
        });
        server.createContext("/missing.pdf", exchange -> {
            exchange.sendResponseHeaders(404, -1);
            exchange.close();
        });
        server.start();
        baseUrl = "http://127.0.0.1:" + server.getAddress().getPort();

        paths = JobPaths.of(tempDir.resolve("job"), "input.pdf");
        Files.createDirectories(paths.root());
        materializer = new InputMaterializer(1, 1, Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        server.stop(0);
    }

    @Test
    @DisplayName("should download a remote input into the job directory")
    void shouldDownloadRemoteInput() throws IOException {
        Path input = materializer.materialize(JobSource.remote(baseUrl + "/doc.pdf"), paths);

        assertThat(input).isEqualTo(paths.inputFile());
        assertThat(Files.readString(input)).isEqualTo("%PDF-1.4 small");
    }

    @Test
    @DisplayName("should abort a streamed download crossing the size limit")
    void shouldAbortOversizedDownload() throws IOException {
        assertThatThrownBy(() -> materializer.materialize(JobSource.remote(baseUrl + "/huge.pdf"), paths))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getErrorType()).isEqualTo(ErrorType.SIZE_LIMIT));

        assertThat(paths.inputFile()).doesNotExist();
        try (Stream<Path> files = Files.list(paths.root())) {
            assertThat(files).as("partial download removed").isEmpty();
        }
    }

    @Test
    @DisplayName("should refuse a download whose announced length is too large")
    void shouldRejectAnnouncedLength() {
        assertThatThrownBy(() -> materializer.materialize(JobSource.remote(baseUrl + "/announced.pdf"), paths))
                .isInstanceOf(ValidationException.class)
                .satisfies(e -> assertThat(((ValidationException) e).getErrorType()).isEqualTo(ErrorType.SIZE_LIMIT));
    }

    @Test
    @DisplayName("should fail validation on non-2xx responses")
    void shouldFailOnHttpError() {
        assertThatThrownBy(() -> materializer.materialize(JobSource.remote(baseUrl + "/missing.pdf"), paths))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Download failed: HTTP 404");
    }

    @Test
    @DisplayName("should reject non-http sources")
    void shouldRejectUnsupportedScheme() {
        assertThatThrownBy(() -> materializer.materialize(JobSource.remote("file:///etc/passwd"), paths))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Unsupported URL scheme");
    }

    @Test
    @DisplayName("should fail when a local input is missing")
    void shouldFailOnMissingLocalInput() {
        assertThatThrownBy(() -> materializer.materialize(JobSource.local(paths.inputFile().toString()), paths))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("Input file not found");
    }
}
