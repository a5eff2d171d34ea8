package fr.lapetina.ocr.scheduler.infrastructure.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    private static ByteArrayInputStream yaml(String content) {
        return new ByteArrayInputStream(content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    @DisplayName("should provide working defaults")
    void shouldProvideDefaults() {
        SchedulerConfig config = ConfigLoader.createDefault();

        ConfigLoader.validate(config);
        assertThat(config.getQueue().getMaxWorkers()).isEqualTo(1);
        assertThat(config.getResource().getBackend()).isEqualTo("hf");
        assertThat(config.getResource().getConcurrencySafeBackends()).contains("vllm");
        assertThat(config.getPublish().getBackend()).isEqualTo("local");
        assertThat(config.getDefaults().isPackZip()).isTrue();
    }

    @Test
    @DisplayName("should load the test configuration from the classpath")
    void shouldLoadFromClasspath() {
        SchedulerConfig config = new ConfigLoader("test-config.yaml").load();

        assertThat(config.getServer().getPort()).isZero();
        assertThat(config.getQueue().getMaxQueueSize()).isEqualTo(4);
        assertThat(config.getResource().isForceCpu()).isTrue();
        assertThat(config.getPipeline().getBatchPageSize()).isEqualTo(5);
        assertThat(config.getMetrics().getPrefix()).isEqualTo("ocr_scheduler_test");
    }

    @Test
    @DisplayName("should prefer a file on disk and keep defaults for omitted sections")
    void shouldLoadFromFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("scheduler.yaml"), """
                queue:
                  maxWorkers: 3
                pipeline:
                  maxPages: 50
                """);

        SchedulerConfig config = new ConfigLoader(file.toString()).load();

        assertThat(config.getQueue().getMaxWorkers()).isEqualTo(3);
        assertThat(config.getPipeline().getMaxPages()).isEqualTo(50);
        assertThat(config.getRateLimit().getBurst()).isEqualTo(ConfigLoader.createDefault().getRateLimit().getBurst());
    }

    @Test
    @DisplayName("should fall back to defaults for an empty document")
    void shouldAcceptEmptyDocument() {
        SchedulerConfig config = new ConfigLoader("unused.yaml").loadFromStream(yaml(""));

        assertThat(config.getPipeline().getMaxUploadMb())
                .isEqualTo(ConfigLoader.createDefault().getPipeline().getMaxUploadMb());
    }

    @Test
    @DisplayName("should list every invalid value")
    void shouldRejectInvalidValues() {
        String content = """
                queue:
                  maxWorkers: 0
                pipeline:
                  batchPageSize: 0
                publish:
                  backend: ftp
                """;

        assertThatThrownBy(() -> new ConfigLoader("unused.yaml").loadFromStream(yaml(content)))
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageStartingWith("Invalid configuration: ")
                .hasMessageContaining("queue.maxWorkers must be >= 1")
                .hasMessageContaining("pipeline.batchPageSize must be >= 1")
                .hasMessageContaining("publish.backend must be 'local' or 'remote'");
    }

    @Test
    @DisplayName("should fail when the file is nowhere to be found")
    void shouldFailOnMissingFile() {
        assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                .isInstanceOf(ConfigLoader.ConfigurationException.class)
                .hasMessageContaining("not found");
    }
}
