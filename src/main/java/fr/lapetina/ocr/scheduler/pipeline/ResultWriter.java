package fr.lapetina.ocr.scheduler.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.ocr.scheduler.domain.exception.StorageException;
import fr.lapetina.ocr.scheduler.domain.model.PageResult;
import fr.lapetina.ocr.scheduler.security.PathGuard;
import fr.lapetina.ocr.scheduler.storage.AtomicFiles;
import fr.lapetina.ocr.scheduler.storage.JobPaths;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Persists engine output into a job's {@code output/} directory.
 *
 * <ul>
 *   <li>{@code layout.json}: {@code {"pages":[{"page_index":n,"res":{...}}]}}, appended batch by batch</li>
 *   <li>{@code full.md}: non-blank page markdown joined by a blank line</li>
 *   <li>{@code images/}: flat directory, base names only</li>
 *   <li>{@code result.zip}: the output directory's contents at the archive root</li>
 * </ul>
 */
public final class ResultWriter {

    private static final Logger log = LoggerFactory.getLogger(ResultWriter.class);

    static final String PAGE_SEPARATOR = "\n\n";

    // ](target or src="target
    private static final Pattern IMAGE_REF = Pattern.compile("(\\]\\(\\s*<?|src\\s*=\\s*[\"'])([^)\\s\"'>]+)");

    private final ObjectMapper objectMapper;

    public ResultWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Appends page payloads to layout.json, replacing the file atomically.
     */
    public void appendLayout(JobPaths paths, List<PageResult> pages) {
        Path layoutFile = paths.layoutFile();
        try {
            ObjectNode root = readLayout(layoutFile);
            ArrayNode entries = (ArrayNode) root.get("pages");
            for (PageResult page : pages) {
                ObjectNode entry = entries.addObject();
                entry.put("page_index", page.pageIndex());
                entry.set("res", objectMapper.valueToTree(page.payload()));
            }
            AtomicFiles.writeJson(objectMapper, layoutFile, root);
        } catch (IOException e) {
            throw new StorageException("Cannot write " + layoutFile.getFileName(), e);
        }
    }

    private ObjectNode readLayout(Path layoutFile) throws IOException {
        if (Files.exists(layoutFile)) {
            JsonNode existing = objectMapper.readTree(layoutFile.toFile());
            if (existing instanceof ObjectNode node && node.get("pages") instanceof ArrayNode) {
                return node;
            }
            log.warn("Replacing malformed layout file: file={}", layoutFile);
        }
        ObjectNode root = objectMapper.createObjectNode();
        root.putArray("pages");
        return root;
    }

    /**
     * Writes a page's images under their base name.
     *
     * A name already used by this job is namespaced as {@code page_NNNN_<name>} and the
     * page markdown is rewritten to point at the new file. Individual image failures are
     * logged and skipped.
     *
     * @param usedNames names already written for this job; updated in place
     * @return the page markdown with image references adjusted
     */
    public String writeImages(JobPaths paths, PageResult page, Set<String> usedNames) {
        Map<String, String> renamedRefs = new HashMap<>();
        for (Map.Entry<String, byte[]> image : page.images().entrySet()) {
            String key = image.getKey();
            String baseName = PathGuard.baseName(key);
            if (baseName == null) {
                log.warn("Skipping image with unusable name: page={}, name={}", page.pageIndex(), key);
                continue;
            }

            String fileName = uniqueName(baseName, page.pageIndex(), usedNames);
            if (!fileName.equals(baseName)) {
                String renamedRef = key.substring(0, key.length() - baseName.length()) + fileName;
                renamedRefs.put(key, renamedRef);
                log.debug("Image renamed to avoid collision: page={}, from={}, to={}",
                        page.pageIndex(), baseName, fileName);
            }

            try {
                Path target = PathGuard.requireUnder(paths.imagesDir(), paths.imagesDir().resolve(fileName));
                AtomicFiles.writeBytes(target, image.getValue());
                usedNames.add(fileName);
            } catch (IOException | RuntimeException e) {
                log.warn("Failed to write image: page={}, name={}, error={}",
                        page.pageIndex(), fileName, e.getMessage());
            }
        }
        return rewriteImageRefs(page.markdown(), renamedRefs);
    }

    /**
     * Rewrites markdown link targets and HTML {@code src} attributes that exactly match a
     * renamed image reference. Other text is left untouched.
     */
    static String rewriteImageRefs(String markdown, Map<String, String> renamedRefs) {
        if (markdown == null || renamedRefs.isEmpty()) {
            return markdown;
        }
        Matcher matcher = IMAGE_REF.matcher(markdown);
        StringBuilder rewritten = new StringBuilder(markdown.length());
        while (matcher.find()) {
            String target = renamedRefs.getOrDefault(matcher.group(2), matcher.group(2));
            matcher.appendReplacement(rewritten, Matcher.quoteReplacement(matcher.group(1) + target));
        }
        matcher.appendTail(rewritten);
        return rewritten.toString();
    }

    static String uniqueName(String baseName, int pageIndex, Set<String> usedNames) {
        if (!usedNames.contains(baseName)) {
            return baseName;
        }
        String candidate = String.format("page_%04d_%s", pageIndex, baseName);
        int suffix = 2;
        while (usedNames.contains(candidate)) {
            candidate = String.format("page_%04d_%d_%s", pageIndex, suffix++, baseName);
        }
        return candidate;
    }

    /**
     * Writes full.md from the given page texts, skipping blank ones.
     *
     * @return true if the file was written
     */
    public boolean writeMarkdown(JobPaths paths, List<String> pageTexts) {
        List<String> parts = new ArrayList<>();
        for (String text : pageTexts) {
            if (text != null && !text.isBlank()) {
                parts.add(text);
            }
        }
        if (parts.isEmpty()) {
            return false;
        }
        try {
            AtomicFiles.writeString(paths.markdownFile(), String.join(PAGE_SEPARATOR, parts));
            return true;
        } catch (IOException e) {
            throw new StorageException("Cannot write " + paths.markdownFile().getFileName(), e);
        }
    }

    /**
     * Packs the output directory into result.zip with its contents at the archive root.
     */
    public void packArchive(JobPaths paths) {
        Path outputDir = paths.outputDir();
        try {
            Files.deleteIfExists(paths.archiveFile());
            List<Path> entries;
            try (Stream<Path> walk = Files.walk(outputDir)) {
                entries = walk.filter(p -> !p.equals(outputDir))
                        .sorted(Comparator.comparing(Path::toString))
                        .toList();
            }
            AtomicFiles.write(paths.archiveFile(), out -> zip(outputDir, entries, out));
            log.debug("Archive written: taskId={}, entries={}", paths.taskId(), entries.size());
        } catch (IOException e) {
            throw new StorageException("Cannot write " + paths.archiveFile().getFileName(), e);
        }
    }

    private static void zip(Path outputDir, List<Path> entries, OutputStream out) throws IOException {
        ZipOutputStream zip = new ZipOutputStream(out);
        for (Path entry : entries) {
            String name = outputDir.relativize(entry).toString().replace('\\', '/');
            if (Files.isDirectory(entry)) {
                zip.putNextEntry(new ZipEntry(name + "/"));
                zip.closeEntry();
            } else if (!entry.getFileName().toString().endsWith(".tmp")) {
                zip.putNextEntry(new ZipEntry(name));
                Files.copy(entry, zip);
                zip.closeEntry();
            }
        }
        // Writes the central directory; the caller closes the underlying stream
        zip.finish();
    }
}
