package fr.lapetina.ocr.scheduler.storage;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AtomicFilesTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("should replace existing content and create parent directories")
    void shouldReplaceContent() throws IOException {
        Path target = tempDir.resolve("nested/dir/file.txt");

        AtomicFiles.writeString(target, "first");
        AtomicFiles.writeString(target, "second");

        assertThat(target).hasContent("second");
    }

    @Test
    @DisplayName("should keep previous content when the writer fails")
    void shouldKeepPreviousContentOnFailure() throws IOException {
        Path target = tempDir.resolve("file.txt");
        AtomicFiles.writeString(target, "intact");

        assertThatThrownBy(() -> AtomicFiles.write(target, out -> {
            out.write("partial".getBytes());
            throw new IOException("disk full");
        })).isInstanceOf(IOException.class);

        assertThat(target).hasContent("intact");
        try (Stream<Path> files = Files.list(tempDir)) {
            assertThat(files).as("temp file cleaned up").containsExactly(target);
        }
    }
}
