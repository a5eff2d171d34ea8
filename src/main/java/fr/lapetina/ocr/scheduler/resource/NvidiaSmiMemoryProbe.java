package fr.lapetina.ocr.scheduler.resource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Memory probe backed by {@code nvidia-smi} for the GPU and by
 * {@code /proc/meminfo} (or the JVM's OS bean) for system memory.
 */
public final class NvidiaSmiMemoryProbe implements MemoryProbe {

    private static final Logger log = LoggerFactory.getLogger(NvidiaSmiMemoryProbe.class);

    private static final double MIB_PER_GIB = 1024.0;
    private static final double KIB_PER_GIB = 1024.0 * 1024.0;
    private static final double BYTES_PER_GIB = 1024.0 * 1024.0 * 1024.0;
    private static final Path MEMINFO = Path.of("/proc/meminfo");

    private final String command;
    private final Duration timeout;

    public NvidiaSmiMemoryProbe(String command, Duration timeout) {
        this.command = command;
        this.timeout = timeout;
    }

    public NvidiaSmiMemoryProbe() {
        this("nvidia-smi", Duration.ofSeconds(2));
    }

    @Override
    public Optional<MemoryInfo> gpuMemory(int gpuIndex) {
        Process process = null;
        Path output = null;
        try {
            // Read only after waitFor: a hung nvidia-smi must not block on its pipe
            output = Files.createTempFile("nvidia-smi", ".out");
            process = new ProcessBuilder(
                    command,
                    "--query-gpu=memory.free,memory.total",
                    "--format=csv,noheader,nounits",
                    "-i", String.valueOf(gpuIndex))
                    .redirectErrorStream(true)
                    .redirectOutput(output.toFile())
                    .start();

            if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                log.debug("nvidia-smi timed out: gpuIndex={}, timeoutMs={}", gpuIndex, timeout.toMillis());
                return Optional.empty();
            }
            if (process.exitValue() != 0) {
                log.debug("nvidia-smi failed: gpuIndex={}, exitCode={}", gpuIndex, process.exitValue());
                return Optional.empty();
            }
            return parseGpuLine(firstLine(output));
        } catch (IOException e) {
            log.debug("nvidia-smi not runnable: {}", e.getMessage());
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } finally {
            if (process != null && process.isAlive()) {
                process.destroyForcibly();
            }
            deleteQuietly(output);
        }
    }

    private static String firstLine(Path file) throws IOException {
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return reader.readLine();
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            log.debug("Cannot delete {}: {}", file, e.getMessage());
        }
    }

    static Optional<MemoryInfo> parseGpuLine(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String[] parts = line.split(",");
        if (parts.length < 2) {
            return Optional.empty();
        }
        try {
            double freeMib = Double.parseDouble(parts[0].trim());
            double totalMib = Double.parseDouble(parts[1].trim());
            return Optional.of(new MemoryInfo(freeMib / MIB_PER_GIB, totalMib / MIB_PER_GIB));
        } catch (NumberFormatException e) {
            log.debug("Unparseable nvidia-smi output: {}", line);
            return Optional.empty();
        }
    }

    @Override
    public Optional<MemoryInfo> systemMemory() {
        if (Files.isReadable(MEMINFO)) {
            try (InputStream in = Files.newInputStream(MEMINFO)) {
                Optional<MemoryInfo> info = parseMeminfo(
                        new String(in.readAllBytes(), StandardCharsets.UTF_8).lines().toList());
                if (info.isPresent()) {
                    return info;
                }
            } catch (IOException e) {
                log.debug("Cannot read {}: {}", MEMINFO, e.getMessage());
            }
        }
        if (ManagementFactory.getOperatingSystemMXBean() instanceof com.sun.management.OperatingSystemMXBean os) {
            return Optional.of(new MemoryInfo(
                    os.getFreeMemorySize() / BYTES_PER_GIB,
                    os.getTotalMemorySize() / BYTES_PER_GIB));
        }
        return Optional.empty();
    }

    static Optional<MemoryInfo> parseMeminfo(List<String> lines) {
        Long availableKb = null;
        Long totalKb = null;
        for (String line : lines) {
            if (line.startsWith("MemAvailable:")) {
                availableKb = kilobytes(line);
            } else if (line.startsWith("MemTotal:")) {
                totalKb = kilobytes(line);
            }
        }
        if (availableKb == null || totalKb == null) {
            return Optional.empty();
        }
        return Optional.of(new MemoryInfo(availableKb / KIB_PER_GIB, totalKb / KIB_PER_GIB));
    }

    private static Long kilobytes(String line) {
        String[] parts = line.trim().split("\\s+");
        if (parts.length < 2) {
            return null;
        }
        try {
            return Long.parseLong(parts[1]);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
