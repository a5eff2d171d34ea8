package fr.lapetina.ocr.scheduler.storage;

import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ocr.scheduler.domain.exception.StorageException;
import fr.lapetina.ocr.scheduler.security.PathGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Stream;

/**
 * Per-job directories under a single storage root.
 *
 * Owns directory creation, the durable status file and retention. Every status
 * write goes through {@link AtomicFiles} so a reader never sees partial JSON.
 */
public final class JobStorage {

    private static final Logger log = LoggerFactory.getLogger(JobStorage.class);

    private static final List<String> INPUT_ORDER = List.of("pdf", "png", "jpg", "jpeg");
    private static final String DEFAULT_EXTENSION = "pdf";
    private static final String TMP_DIR = "tmp";

    private final Path root;
    private final ObjectMapper objectMapper;

    public JobStorage(Path root, ObjectMapper objectMapper) {
        this.root = root.toAbsolutePath().normalize();
        this.objectMapper = objectMapper;
        try {
            Files.createDirectories(this.root.resolve(TMP_DIR));
        } catch (IOException e) {
            throw new StorageException("Cannot create storage root " + this.root, e);
        }
        log.info("Job storage initialized: root={}", this.root);
    }

    public Path getRoot() {
        return root;
    }

    /**
     * Allocates a fresh job directory for an input named {@code filename}.
     * Only pdf, png, jpg and jpeg keep their extension; anything else is stored as pdf.
     */
    public JobPaths newJob(String filename) {
        String taskId = UUID.randomUUID().toString();
        JobPaths paths = JobPaths.of(root.resolve(taskId), "input." + inputExtension(filename));
        try {
            Files.createDirectories(paths.imagesDir());
        } catch (IOException e) {
            throw new StorageException("Cannot create job directory " + paths.root(), e);
        }
        log.debug("Job directory created: taskId={}, input={}", taskId, paths.inputFile().getFileName());
        return paths;
    }

    /**
     * Resolves the layout of an existing job, locating whichever input file is present.
     *
     * @throws fr.lapetina.ocr.scheduler.domain.exception.PathViolationException if the id is not a UUID
     */
    public JobPaths jobPaths(String taskId) {
        PathGuard.requireValidTaskId(taskId);
        Path jobRoot = root.resolve(taskId);
        for (String ext : INPUT_ORDER) {
            Path candidate = jobRoot.resolve("input." + ext);
            if (Files.exists(candidate)) {
                return JobPaths.of(jobRoot, candidate.getFileName().toString());
            }
        }
        return JobPaths.of(jobRoot, "input." + DEFAULT_EXTENSION);
    }

    public void saveStatus(JobPaths paths, JobStatusSnapshot snapshot) {
        try {
            AtomicFiles.writeJson(objectMapper, paths.statusFile(), snapshot);
        } catch (IOException e) {
            throw new StorageException("Cannot persist status of job " + snapshot.taskId(), e);
        }
    }

    /**
     * Reads the persisted status of a job. Absent or unreadable files yield empty.
     */
    public Optional<JobStatusSnapshot> loadStatus(String taskId) {
        Path statusFile = jobPaths(taskId).statusFile();
        if (!Files.exists(statusFile)) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(statusFile.toFile(), JobStatusSnapshot.class));
        } catch (IOException e) {
            log.warn("Unreadable status file: taskId={}, error={}", taskId, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Removes a job directory and everything below it.
     */
    public void discard(JobPaths paths) {
        try {
            deleteRecursively(paths.root());
            log.debug("Job directory discarded: taskId={}", paths.taskId());
        } catch (IOException e) {
            throw new StorageException("Cannot discard job directory " + paths.root(), e);
        }
    }

    /**
     * Keeps the {@code maxRetention} most recently modified job directories and deletes the rest.
     *
     * @return number of directories deleted
     */
    public int cleanupOldJobs(int maxRetention) {
        List<Path> jobDirs = new ArrayList<>();
        try (Stream<Path> children = Files.list(root)) {
            children.filter(Files::isDirectory)
                    .filter(p -> !TMP_DIR.equals(p.getFileName().toString()))
                    .forEach(jobDirs::add);
        } catch (IOException e) {
            throw new StorageException("Cannot list storage root " + root, e);
        }
        if (jobDirs.size() <= maxRetention) {
            return 0;
        }

        jobDirs.sort(Comparator.comparing(JobStorage::lastModified).reversed());
        int deleted = 0;
        for (Path dir : jobDirs.subList(Math.max(0, maxRetention), jobDirs.size())) {
            try {
                deleteRecursively(dir);
                deleted++;
            } catch (IOException e) {
                log.warn("Failed to delete expired job directory: dir={}, error={}", dir, e.getMessage());
            }
        }
        log.info("Old jobs cleaned up: deleted={}, retained={}", deleted, maxRetention);
        return deleted;
    }

    static String inputExtension(String filename) {
        if (filename == null) {
            return DEFAULT_EXTENSION;
        }
        String name = PathGuard.baseName(filename);
        if (name == null) {
            return DEFAULT_EXTENSION;
        }
        int dot = name.lastIndexOf('.');
        if (dot < 0) {
            return DEFAULT_EXTENSION;
        }
        String ext = name.substring(dot + 1).toLowerCase(Locale.ROOT);
        return INPUT_ORDER.contains(ext) ? ext : DEFAULT_EXTENSION;
    }

    private static FileTime lastModified(Path dir) {
        try {
            return Files.getLastModifiedTime(dir);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    static void deleteRecursively(Path dir) throws IOException {
        if (!Files.exists(dir)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(dir)) {
            List<Path> paths = walk.sorted(Comparator.reverseOrder()).toList();
            for (Path p : paths) {
                Files.deleteIfExists(p);
            }
        }
    }
}
