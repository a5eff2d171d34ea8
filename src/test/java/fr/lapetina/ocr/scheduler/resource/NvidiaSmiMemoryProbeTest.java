package fr.lapetina.ocr.scheduler.resource;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NvidiaSmiMemoryProbeTest {

    @TempDir
    Path tempDir;

    private Path script(String body) throws IOException {
        Path script = tempDir.resolve("fake-nvidia-smi.sh");
        Files.writeString(script, "#!/bin/sh\n" + body + "\n");
        assertThat(script.toFile().setExecutable(true)).isTrue();
        return script;
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("should read GPU memory from the command output")
    void shouldReadGpuMemoryFromCommand() throws IOException {
        NvidiaSmiMemoryProbe gpu = new NvidiaSmiMemoryProbe(
                script("echo '8192, 16384'").toString(), Duration.ofSeconds(5));

        Optional<MemoryInfo> info = gpu.gpuMemory(0);

        assertThat(info).isPresent();
        assertThat(info.get().freeGb()).isCloseTo(8.0, within(0.001));
        assertThat(info.get().totalGb()).isCloseTo(16.0, within(0.001));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("should give up on a hung command once the timeout elapses")
    void shouldTimeOutHungCommand() throws IOException {
        NvidiaSmiMemoryProbe gpu = new NvidiaSmiMemoryProbe(
                script("sleep 30").toString(), Duration.ofMillis(200));

        long started = System.nanoTime();
        Optional<MemoryInfo> info = gpu.gpuMemory(0);

        assertThat(info).isEmpty();
        assertThat(Duration.ofNanos(System.nanoTime() - started)).isLessThan(Duration.ofSeconds(5));
    }

    @Test
    @EnabledOnOs({OS.LINUX, OS.MAC})
    @DisplayName("should return empty when the command exits with an error")
    void shouldIgnoreFailingCommand() throws IOException {
        NvidiaSmiMemoryProbe gpu = new NvidiaSmiMemoryProbe(
                script("echo 'NVIDIA-SMI has failed'; exit 9").toString(), Duration.ofSeconds(5));

        assertThat(gpu.gpuMemory(0)).isEmpty();
    }

    @Test
    @DisplayName("should return empty when the command is not installed")
    void shouldIgnoreMissingCommand() {
        NvidiaSmiMemoryProbe gpu = new NvidiaSmiMemoryProbe(
                tempDir.resolve("no-such-binary").toString(), Duration.ofSeconds(1));

        assertThat(gpu.gpuMemory(0)).isEmpty();
    }

    @Test
    @DisplayName("should parse free and total MiB from an nvidia-smi line")
    void shouldParseGpuLine() {
        Optional<MemoryInfo> info = NvidiaSmiMemoryProbe.parseGpuLine("20480, 24576");

        assertThat(info).isPresent();
        assertThat(info.get().freeGb()).isCloseTo(20.0, within(0.001));
        assertThat(info.get().totalGb()).isCloseTo(24.0, within(0.001));
    }

    @Test
    @DisplayName("should reject unparseable nvidia-smi output")
    void shouldRejectGarbage() {
        assertThat(NvidiaSmiMemoryProbe.parseGpuLine("No devices were found")).isEmpty();
        assertThat(NvidiaSmiMemoryProbe.parseGpuLine("")).isEmpty();
    }

    @Test
    @DisplayName("should read available and total memory from meminfo")
    void shouldParseMeminfo() {
        List<String> lines = List.of(
                "MemTotal:       16777216 kB",
                "MemFree:         1048576 kB",
                "MemAvailable:    8388608 kB"
        );

        Optional<MemoryInfo> info = NvidiaSmiMemoryProbe.parseMeminfo(lines);

        assertThat(info).isPresent();
        assertThat(info.get().freeGb()).isCloseTo(8.0, within(0.001));
        assertThat(info.get().totalGb()).isCloseTo(16.0, within(0.001));
    }

    @Test
    @DisplayName("should return empty when meminfo lacks the total")
    void shouldHandleIncompleteMeminfo() {
        assertThat(NvidiaSmiMemoryProbe.parseMeminfo(List.of("MemAvailable: 100 kB"))).isEmpty();
    }
}
