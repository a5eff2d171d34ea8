package fr.lapetina.ocr.scheduler;

import fr.lapetina.ocr.scheduler.integration.TestSchedulerFactory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class OcrSchedulerApplicationTest {

    @TempDir
    Path dataDir;

    @Test
    @DisplayName("should serve health on an ephemeral port once started")
    void shouldServeHealthOnceStarted() throws Exception {
        try (OcrSchedulerApplication app = new OcrSchedulerApplication(TestSchedulerFactory.create(dataDir, 1))) {
            app.start();

            assertThat(app.getPort()).isPositive();
            assertThat(app.health()).containsEntry("status", "UP");

            HttpResponse<String> response = HttpClient.newHttpClient().send(
                    HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + app.getPort() + "/healthz")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());
            assertThat(response.statusCode()).isEqualTo(200);
        }
    }

    @Test
    @DisplayName("should stop the workers and release waiters on close")
    void shouldStopWorkersOnClose() throws Exception {
        OcrSchedulerApplication app = new OcrSchedulerApplication(TestSchedulerFactory.create(dataDir, 1));
        app.start();

        Thread waiter = new Thread(() -> {
            try {
                app.awaitTermination();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();

        app.close();
        app.close();

        waiter.join(TimeUnit.SECONDS.toMillis(5));
        assertThat(waiter.isAlive()).isFalse();
        assertThat(app.getFactory().getJobQueue().isRunning()).isFalse();
        assertThat(app.health()).containsEntry("status", "DOWN");
    }

    @Test
    @DisplayName("should prefer the command line config path over the system property")
    void shouldResolveConfigPath() {
        String previous = System.getProperty(OcrSchedulerApplication.CONFIG_PROPERTY);
        try {
            System.setProperty(OcrSchedulerApplication.CONFIG_PROPERTY, "from-property.yaml");

            assertThat(OcrSchedulerApplication.resolveConfigPath(new String[]{"from-args.yaml"}))
                    .isEqualTo("from-args.yaml");
            assertThat(OcrSchedulerApplication.resolveConfigPath(new String[0]))
                    .isEqualTo("from-property.yaml");

            System.clearProperty(OcrSchedulerApplication.CONFIG_PROPERTY);
            assertThat(OcrSchedulerApplication.resolveConfigPath(new String[0]))
                    .isEqualTo(OcrSchedulerApplication.DEFAULT_CONFIG);
        } finally {
            if (previous == null) {
                System.clearProperty(OcrSchedulerApplication.CONFIG_PROPERTY);
            } else {
                System.setProperty(OcrSchedulerApplication.CONFIG_PROPERTY, previous);
            }
        }
    }
}
