package fr.lapetina.ocr.scheduler.storage;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Filesystem layout of one job under the storage root.
 *
 * <pre>
 * &lt;root&gt;/&lt;taskId&gt;/
 *     input.pdf | input.png | input.jpg | input.jpeg
 *     job_status.json
 *     result.zip
 *     output/
 *         full.md
 *         layout.json
 *         images/
 * </pre>
 */
public record JobPaths(
        Path root,
        Path inputFile,
        Path outputDir,
        Path imagesDir,
        Path markdownFile,
        Path layoutFile,
        Path archiveFile,
        Path statusFile
) {
    public static final String STATUS_FILE = "job_status.json";
    public static final String OUTPUT_DIR = "output";
    public static final String IMAGES_DIR = "images";
    public static final String MARKDOWN_FILE = "full.md";
    public static final String LAYOUT_FILE = "layout.json";
    public static final String ARCHIVE_FILE = "result.zip";

    public JobPaths {
        Objects.requireNonNull(root, "Job root is required");
        Objects.requireNonNull(inputFile, "Input file is required");
    }

    /**
     * Builds the standard layout for a job root and input file name.
     */
    public static JobPaths of(Path root, String inputFileName) {
        Path output = root.resolve(OUTPUT_DIR);
        return new JobPaths(
                root,
                root.resolve(inputFileName),
                output,
                output.resolve(IMAGES_DIR),
                output.resolve(MARKDOWN_FILE),
                output.resolve(LAYOUT_FILE),
                root.resolve(ARCHIVE_FILE),
                root.resolve(STATUS_FILE)
        );
    }

    public String taskId() {
        return root.getFileName().toString();
    }
}
