package fr.lapetina.ocr.scheduler.security;

import fr.lapetina.ocr.scheduler.domain.exception.PathViolationException;

import java.nio.file.Path;
import java.util.UUID;

/**
 * Boundary checks for identifiers and paths that reach the filesystem.
 */
public final class PathGuard {

    private PathGuard() {
    }

    /**
     * Task ids are canonical UUIDs; anything else could carry path segments.
     */
    public static boolean isValidTaskId(String taskId) {
        if (taskId == null) {
            return false;
        }
        try {
            return UUID.fromString(taskId).toString().equalsIgnoreCase(taskId);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    public static void requireValidTaskId(String taskId) {
        if (!isValidTaskId(taskId)) {
            throw new PathViolationException("Invalid task id: " + taskId);
        }
    }

    /**
     * Resolves {@code target} and verifies it lies under {@code root}.
     *
     * @return the normalized absolute target
     * @throws PathViolationException when the target escapes the root
     */
    public static Path requireUnder(Path root, Path target) {
        Path normalizedRoot = root.toAbsolutePath().normalize();
        Path normalizedTarget = target.toAbsolutePath().normalize();
        if (!normalizedTarget.startsWith(normalizedRoot)) {
            throw new PathViolationException("Path escapes storage root: " + target);
        }
        return normalizedTarget;
    }

    /**
     * Reduces an engine-provided name to its final path segment.
     *
     * @return the base name, or null when nothing usable remains
     */
    public static String baseName(String name) {
        if (name == null) {
            return null;
        }
        String normalized = name.replace('\\', '/');
        int slash = normalized.lastIndexOf('/');
        String base = slash >= 0 ? normalized.substring(slash + 1) : normalized;
        if (base.isBlank() || base.equals(".") || base.equals("..")) {
            return null;
        }
        return base;
    }
}
