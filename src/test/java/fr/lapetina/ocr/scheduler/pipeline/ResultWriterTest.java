package fr.lapetina.ocr.scheduler.pipeline;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.ocr.scheduler.domain.model.PageResult;
import fr.lapetina.ocr.scheduler.storage.JobPaths;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.assertj.core.api.Assertions.assertThat;

class ResultWriterTest {

    @TempDir
    Path tempDir;

    private ObjectMapper mapper;
    private ResultWriter writer;
    private JobPaths paths;

    @BeforeEach
    void setUp() throws IOException {
        mapper = new ObjectMapper();
        writer = new ResultWriter(mapper);
        paths = JobPaths.of(tempDir.resolve("job"), "input.pdf");
        Files.createDirectories(paths.imagesDir());
    }

    @Test
    @DisplayName("should append pages to layout.json across batches")
    void shouldAppendLayout() throws IOException {
        writer.appendLayout(paths, List.of(PageResult.of(1, "a"), PageResult.of(2, "b")));
        writer.appendLayout(paths, List.of(PageResult.of(3, "c")));

        JsonNode pages = mapper.readTree(paths.layoutFile().toFile()).get("pages");
        assertThat(pages.size()).isEqualTo(3);
        assertThat(pages.get(2).get("page_index").asInt()).isEqualTo(3);
        assertThat(pages.get(0).get("res").get("page").asInt()).isEqualTo(1);
    }

    @Test
    @DisplayName("should join non-blank page markdown with a blank line")
    void shouldWriteMarkdown() {
        boolean written = writer.writeMarkdown(paths, List.of("# one", "  ", "two"));

        assertThat(written).isTrue();
        assertThat(paths.markdownFile()).hasContent("# one\n\ntwo");
    }

    @Test
    @DisplayName("should skip full.md when every page is blank")
    void shouldSkipEmptyMarkdown() {
        assertThat(writer.writeMarkdown(paths, List.of("", " "))).isFalse();
        assertThat(paths.markdownFile()).doesNotExist();
    }

    @Test
    @DisplayName("should namespace colliding image names by page")
    void shouldRenameCollidingImages() {
        Set<String> used = new HashSet<>();
        PageResult first = new PageResult(1, Map.of(), "![](images/fig.png)", Map.of("images/fig.png", new byte[]{1}));
        PageResult second = new PageResult(2, Map.of(), "![](images/fig.png)", Map.of("images/fig.png", new byte[]{2}));

        String firstMd = writer.writeImages(paths, first, used);
        String secondMd = writer.writeImages(paths, second, used);

        assertThat(firstMd).isEqualTo("![](images/fig.png)");
        assertThat(secondMd).isEqualTo("![](images/page_0002_fig.png)");
        assertThat(paths.imagesDir().resolve("fig.png")).hasBinaryContent(new byte[]{1});
        assertThat(paths.imagesDir().resolve("page_0002_fig.png")).hasBinaryContent(new byte[]{2});
    }

    @Test
    @DisplayName("should rewrite only the exact reference of a renamed image")
    void shouldRewriteOnlyExactImageReferences() {
        Set<String> used = new HashSet<>();
        writer.writeImages(paths, new PageResult(1, Map.of(), "![](0.jpg)", Map.of("0.jpg", new byte[]{1})), used);

        Map<String, byte[]> images = new LinkedHashMap<>();
        images.put("0.jpg", new byte[]{2});
        images.put("10.jpg", new byte[]{3});
        String markdown = writer.writeImages(paths,
                new PageResult(2, Map.of(), "![](0.jpg) ![](10.jpg) <img src=\"0.jpg\"> 0.jpg", images), used);

        assertThat(markdown).isEqualTo("![](page_0002_0.jpg) ![](10.jpg) <img src=\"page_0002_0.jpg\"> 0.jpg");
        assertThat(paths.imagesDir().resolve("10.jpg")).hasBinaryContent(new byte[]{3});
        assertThat(paths.imagesDir().resolve("page_0002_0.jpg")).hasBinaryContent(new byte[]{2});
    }

    @Test
    @DisplayName("should add a counter when the page-scoped name is taken too")
    void shouldDisambiguateRepeatedCollisions() {
        Set<String> used = new HashSet<>(Set.of("fig.png", "page_0003_fig.png", "page_0003_2_fig.png"));

        assertThat(ResultWriter.uniqueName("fig.png", 3, used)).isEqualTo("page_0003_3_fig.png");
        assertThat(ResultWriter.uniqueName("other.png", 3, used)).isEqualTo("other.png");
    }

    @Test
    @DisplayName("should keep image files inside the images directory")
    void shouldFlattenTraversalNames() throws IOException {
        Map<String, byte[]> images = new LinkedHashMap<>();
        images.put("../../escape.png", new byte[]{9});
        images.put("..", new byte[]{8});

        writer.writeImages(paths, new PageResult(1, Map.of(), "", images), new HashSet<>());

        assertThat(paths.imagesDir().resolve("escape.png")).exists();
        assertThat(tempDir.resolve("escape.png")).doesNotExist();
        try (Stream<Path> files = Files.list(paths.imagesDir())) {
            assertThat(files).hasSize(1);
        }
    }

    @Test
    @DisplayName("should archive the output directory contents at the archive root")
    void shouldPackArchive() throws IOException {
        writer.writeMarkdown(paths, List.of("text"));
        writer.appendLayout(paths, List.of(PageResult.of(1, "text")));
        Files.write(paths.imagesDir().resolve("fig.png"), new byte[]{1});

        writer.packArchive(paths);

        List<String> names = new ArrayList<>();
        try (InputStream in = Files.newInputStream(paths.archiveFile());
             ZipInputStream zip = new ZipInputStream(in)) {
            ZipEntry entry;
            while ((entry = zip.getNextEntry()) != null) {
                names.add(entry.getName());
            }
        }
        assertThat(names).containsExactlyInAnyOrder("full.md", "layout.json", "images/", "images/fig.png");
        assertThat(paths.archiveFile().getParent()).isEqualTo(paths.root());
    }
}
